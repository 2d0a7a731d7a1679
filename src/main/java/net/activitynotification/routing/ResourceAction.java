package net.activitynotification.routing;

import org.springframework.http.HttpMethod;

import java.util.Locale;
import java.util.Optional;

/**
 * Every action a notification or subscription resource knows about.
 *
 * <p>The standard resource actions ({@link #NEW}, {@link #CREATE}, {@link #EDIT}, {@link #UPDATE})
 * are listed so they can be named in exclusions even though they are never declared for
 * notifications. Actions with a path suffix append it to the collection or member path.
 */
public enum ResourceAction {
    INDEX(HttpMethod.GET, Scope.COLLECTION, ""),
    CREATE(HttpMethod.POST, Scope.COLLECTION, ""),
    NEW(HttpMethod.GET, Scope.COLLECTION, "new"),
    EDIT(HttpMethod.GET, Scope.MEMBER, "edit"),
    SHOW(HttpMethod.GET, Scope.MEMBER, ""),
    UPDATE(HttpMethod.PATCH, Scope.MEMBER, ""),
    DESTROY(HttpMethod.DELETE, Scope.MEMBER, ""),

    OPEN_ALL(HttpMethod.POST, Scope.COLLECTION, "open_all"),
    MOVE(HttpMethod.GET, Scope.MEMBER, "move"),
    OPEN(HttpMethod.POST, Scope.MEMBER, "open"),

    SUBSCRIBE(HttpMethod.POST, Scope.MEMBER, "subscribe"),
    UNSUBSCRIBE(HttpMethod.POST, Scope.MEMBER, "unsubscribe"),
    SUBSCRIBE_TO_EMAIL(HttpMethod.POST, Scope.MEMBER, "subscribe_to_email"),
    UNSUBSCRIBE_TO_EMAIL(HttpMethod.POST, Scope.MEMBER, "unsubscribe_to_email"),
    SUBSCRIBE_TO_OPTIONAL_TARGET(HttpMethod.POST, Scope.MEMBER, "subscribe_to_optional_target"),
    UNSUBSCRIBE_TO_OPTIONAL_TARGET(HttpMethod.POST, Scope.MEMBER, "unsubscribe_to_optional_target");

    /** Whether an action addresses the whole collection or a single member. */
    public enum Scope {
        COLLECTION,
        MEMBER
    }

    private final HttpMethod method;
    private final Scope scope;
    private final String pathSuffix;

    ResourceAction(HttpMethod method, Scope scope, String pathSuffix) {
        this.method = method;
        this.scope = scope;
        this.pathSuffix = pathSuffix;
    }

    /**
     * Snake case action name used in exclusions, route names and handler dispatch.
     */
    public String actionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public HttpMethod method() {
        return method;
    }

    public Scope scope() {
        return scope;
    }

    public String pathSuffix() {
        return pathSuffix;
    }

    /**
     * Looks an action up by its snake case name.
     *
     * @param actionName action name such as {@code open_all}
     * @return the matching action, or empty for names this helper does not declare
     */
    public static Optional<ResourceAction> fromActionName(String actionName) {
        if (actionName == null || actionName.isBlank()) {
            return Optional.empty();
        }
        for (ResourceAction action : values()) {
            if (action.actionName().equals(actionName)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
