package net.activitynotification.routing;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied options for {@link ActivityNotificationRoutes#notifyTo} and
 * {@link ActivityNotificationRoutes#subscribedBy}.
 *
 * <p>Immutable: the same instance can be reused for any number of declarations. Every field is
 * optional; {@link RouteOptionResolver} fills in the defaults.
 */
@Value
public class RouteOptions {

    private static final RouteOptions DEFAULTS = RouteOptions.builder().build();

    // Path segment of the nested resource, "notifications" or "subscriptions" when absent
    @Nullable String model;

    // Handler binding, e.g. "activity_notification/notifications"
    @Nullable String controller;

    // Route name segment, defaults to the model
    @Nullable String as;

    // Authentication scope the routes are bound to, e.g. "users"
    @Nullable String withDevise;

    boolean withSubscription;

    // Options for the cascaded subscription routes; only read by notifyTo
    @Nullable RouteOptions subscriptionOptions;

    List<String> except;

    List<String> only;

    // Unrecognised options, passed through untouched to every declared route
    Map<String, String> options;

    @Builder(toBuilder = true)
    private RouteOptions(@Nullable String model,
                         @Nullable String controller,
                         @Nullable String as,
                         @Nullable String withDevise,
                         boolean withSubscription,
                         @Nullable RouteOptions subscriptionOptions,
                         @Nullable List<String> except,
                         @Nullable List<String> only,
                         @Nullable Map<String, String> options) {
        this.model = blankToNull(model);
        this.controller = blankToNull(controller);
        this.as = blankToNull(as);
        this.withDevise = blankToNull(withDevise);
        this.withSubscription = withSubscription || (subscriptionOptions != null && !subscriptionOptions.isEmpty());
        this.subscriptionOptions = subscriptionOptions;
        this.except = except == null ? List.of() : List.copyOf(except);
        this.only = only == null ? List.of() : List.copyOf(only);
        this.options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /**
     * Options with nothing set.
     */
    public static RouteOptions defaults() {
        return DEFAULTS;
    }

    /**
     * True when no option is set. Empty nested subscription options do not enable cascading.
     */
    public boolean isEmpty() {
        return model == null
            && controller == null
            && as == null
            && withDevise == null
            && !withSubscription
            && subscriptionOptions == null
            && except.isEmpty()
            && only.isEmpty()
            && options.isEmpty();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Builder extensions accepting {@link ResourceAction} constants.
     */
    public static class RouteOptionsBuilder {

        public RouteOptionsBuilder exceptActions(ResourceAction... actions) {
            return except(actionNames(actions));
        }

        public RouteOptionsBuilder onlyActions(ResourceAction... actions) {
            return only(actionNames(actions));
        }

        /**
         * Options for cascaded subscription routes. Enables cascading unless {@code nested} is
         * empty; combine with {@code withSubscription(true)} to cascade with empty options.
         */
        public RouteOptionsBuilder subscription(RouteOptions nested) {
            return subscriptionOptions(nested);
        }

        private static List<String> actionNames(ResourceAction... actions) {
            return Arrays.stream(actions).map(ResourceAction::actionName).toList();
        }
    }
}
