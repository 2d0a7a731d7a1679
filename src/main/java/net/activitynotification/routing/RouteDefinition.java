package net.activitynotification.routing;

import org.springframework.http.HttpMethod;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One declared route, as handed to a {@link RouteMapper}.
 *
 * @param name       route name, e.g. {@code move_user_notification}
 * @param method     HTTP verb
 * @param path       path template using Spring path variables, e.g.
 *                   {@code /users/{user_id}/notifications/{id}/move}
 * @param controller handler binding, e.g. {@code activity_notification/notifications}
 * @param action     snake case action name dispatched to the handler
 * @param defaults   fixed request parameters ({@code target_type}, {@code devise_type})
 * @param options    passthrough options supplied by the caller
 */
public record RouteDefinition(String name,
                              HttpMethod method,
                              String path,
                              String controller,
                              String action,
                              Map<String, String> defaults,
                              Map<String, String> options) {

    public RouteDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(controller, "controller");
        Objects.requireNonNull(action, "action");
        defaults = orderedCopy(defaults);
        options = orderedCopy(options);
    }

    /**
     * {@code controller#action} label used in logs and the route listing.
     */
    public String endpoint() {
        return controller + "#" + action;
    }

    public String defaultValue(String key) {
        return defaults.get(key);
    }

    private static Map<String, String> orderedCopy(Map<String, String> source) {
        return source == null || source.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
