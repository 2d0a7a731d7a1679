package net.activitynotification.routing;

import java.util.List;

import static net.activitynotification.routing.ResourceAction.CREATE;
import static net.activitynotification.routing.ResourceAction.DESTROY;
import static net.activitynotification.routing.ResourceAction.EDIT;
import static net.activitynotification.routing.ResourceAction.INDEX;
import static net.activitynotification.routing.ResourceAction.MOVE;
import static net.activitynotification.routing.ResourceAction.NEW;
import static net.activitynotification.routing.ResourceAction.OPEN;
import static net.activitynotification.routing.ResourceAction.OPEN_ALL;
import static net.activitynotification.routing.ResourceAction.SHOW;
import static net.activitynotification.routing.ResourceAction.SUBSCRIBE;
import static net.activitynotification.routing.ResourceAction.SUBSCRIBE_TO_EMAIL;
import static net.activitynotification.routing.ResourceAction.SUBSCRIBE_TO_OPTIONAL_TARGET;
import static net.activitynotification.routing.ResourceAction.UNSUBSCRIBE;
import static net.activitynotification.routing.ResourceAction.UNSUBSCRIBE_TO_EMAIL;
import static net.activitynotification.routing.ResourceAction.UNSUBSCRIBE_TO_OPTIONAL_TARGET;
import static net.activitynotification.routing.ResourceAction.UPDATE;

/**
 * The two resource families nested under a notification target.
 *
 * <p>Custom actions are listed in declaration order and are declared before the standard ones,
 * so a literal segment such as {@code open_all} is matched ahead of a member {@code {id}}.
 */
public enum ResourceKind {
    NOTIFICATIONS("notifications",
        List.of(NEW, CREATE, EDIT, UPDATE),
        List.of(INDEX, SHOW, DESTROY),
        List.of(OPEN_ALL, MOVE, OPEN)),

    SUBSCRIPTIONS("subscriptions",
        List.of(NEW, EDIT, UPDATE),
        List.of(INDEX, CREATE, SHOW, DESTROY),
        List.of(SUBSCRIBE, UNSUBSCRIBE,
            SUBSCRIBE_TO_EMAIL, UNSUBSCRIBE_TO_EMAIL,
            SUBSCRIBE_TO_OPTIONAL_TARGET, UNSUBSCRIBE_TO_OPTIONAL_TARGET));

    private final String resourceName;
    private final List<ResourceAction> forcedExcludes;
    private final List<ResourceAction> alwaysDeclared;
    private final List<ResourceAction> filteredActions;

    ResourceKind(String resourceName,
                 List<ResourceAction> forcedExcludes,
                 List<ResourceAction> alwaysDeclared,
                 List<ResourceAction> filteredActions) {
        this.resourceName = resourceName;
        this.forcedExcludes = forcedExcludes;
        this.alwaysDeclared = alwaysDeclared;
        this.filteredActions = filteredActions;
    }

    /** Plural snake case name, also the default model and controller segment. */
    public String resourceName() {
        return resourceName;
    }

    /** Actions appended to {@code except} on every resolution; they can never be declared. */
    public List<ResourceAction> forcedExcludes() {
        return forcedExcludes;
    }

    /** Actions declared for every target regardless of {@code except} or {@code only}. */
    public List<ResourceAction> alwaysDeclared() {
        return alwaysDeclared;
    }

    /** Optional actions gated by {@link RoutePathFilter}. */
    public List<ResourceAction> filteredActions() {
        return filteredActions;
    }
}
