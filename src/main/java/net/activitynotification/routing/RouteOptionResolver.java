package net.activitynotification.routing;

import net.activitynotification.util.ResourceNameUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns caller {@link RouteOptions} into {@link ResolvedRouteOptions}.
 *
 * <p>Resolution never fails and never mutates its input: missing values receive defaults and
 * unknown options are carried through as-is.
 */
public class RouteOptionResolver {

    static final String CONTROLLER_NAMESPACE = "activity_notification/";
    static final String DEVISE_CONTROLLER_SUFFIX = "_with_devise";

    /**
     * Resolves options using the kind's own forced excludes.
     */
    public ResolvedRouteOptions resolve(ResourceKind kind, RouteOptions raw) {
        return resolve(kind, raw, kind.forcedExcludes());
    }

    /**
     * Resolves options for one declaration call.
     *
     * @param kind           resource family being declared
     * @param raw            caller options, never modified
     * @param forcedExcludes actions appended to {@code except} regardless of caller input
     * @return immutable resolved options
     */
    public ResolvedRouteOptions resolve(ResourceKind kind, RouteOptions raw, List<ResourceAction> forcedExcludes) {
        RouteOptions options = raw == null ? RouteOptions.defaults() : raw;
        String resourcesName = ResourceNameUtils.underscore(ResourceNameUtils.pluralize(kind.resourceName()));

        String model = options.getModel() != null ? options.getModel() : resourcesName;
        boolean devise = options.getWithDevise() != null;

        String controller = options.getController();
        if (controller == null) {
            controller = CONTROLLER_NAMESPACE + resourcesName + (devise ? DEVISE_CONTROLLER_SUFFIX : "");
        }

        String routeName = options.getAs();
        if (routeName == null) {
            routeName = devise ? resourcesName : model;
        }

        Map<String, String> deviseDefaults = devise
            ? Map.of(ResolvedRouteOptions.DEVISE_TYPE, options.getWithDevise())
            : Map.of();

        List<String> except = new ArrayList<>(options.getExcept());
        forcedExcludes.forEach(action -> except.add(action.actionName()));

        return new ResolvedRouteOptions(kind,
            model,
            controller,
            routeName,
            options.getWithDevise(),
            deviseDefaults,
            except,
            options.getOnly(),
            subscriptionOption(kind, options),
            options.getOptions());
    }

    private Optional<RouteOptions> subscriptionOption(ResourceKind kind, RouteOptions options) {
        if (kind != ResourceKind.NOTIFICATIONS || !options.isWithSubscription()) {
            return Optional.empty();
        }
        RouteOptions nested = options.getSubscriptionOptions() != null
            ? options.getSubscriptionOptions()
            : RouteOptions.defaults();
        // Subscription routes always follow the notification routes' authentication scope
        return Optional.of(nested.toBuilder()
            .withDevise(options.getWithDevise())
            .withSubscription(false)
            .subscriptionOptions(null)
            .build());
    }
}
