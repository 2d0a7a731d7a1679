package net.activitynotification.routing;

import lombok.extern.slf4j.Slf4j;
import net.activitynotification.target.NotificationTargetRegistry;

import java.util.Map;

/**
 * Declares the notification and subscription routes of notification targets on a
 * {@link RouteMapper}.
 *
 * <p>For {@code notifyTo(RouteOptions.defaults(), "users")} the following routes are declared:
 * <pre>
 *   open_all_user_notifications  POST   /users/{user_id}/notifications/open_all
 *   move_user_notification       GET    /users/{user_id}/notifications/{id}/move
 *   open_user_notification       POST   /users/{user_id}/notifications/{id}/open
 *   user_notifications           GET    /users/{user_id}/notifications
 *   user_notification            GET    /users/{user_id}/notifications/{id}
 *   user_notification            DELETE /users/{user_id}/notifications/{id}
 * </pre>
 * each bound to {@code activity_notification/notifications} with the default
 * {@code target_type=users}. Binding to an authentication scope ({@code withDevise("users")})
 * switches the controller to {@code activity_notification/notifications_with_devise} and adds
 * {@code devise_type=users}.
 *
 * <p>Declaration runs once, on the thread building the route table; instances are not
 * thread-safe.
 */
@Slf4j
public class ActivityNotificationRoutes {

    private final RouteMapper mapper;
    private final NotificationTargetRegistry targets;
    private final RouteOptionResolver resolver;

    public ActivityNotificationRoutes(RouteMapper mapper, NotificationTargetRegistry targets) {
        this(mapper, targets, new RouteOptionResolver());
    }

    public ActivityNotificationRoutes(RouteMapper mapper,
                                      NotificationTargetRegistry targets,
                                      RouteOptionResolver resolver) {
        this.mapper = mapper;
        this.targets = targets;
        this.resolver = resolver;
    }

    /**
     * Declares notification routes for each target with default options.
     */
    public ActivityNotificationRoutes notifyTo(String... targetNames) {
        return notifyTo(RouteOptions.defaults(), targetNames);
    }

    /**
     * Declares notification routes for each target, then cascades subscription routes for the
     * targets that support subscriptions when {@code withSubscription} is set. Targets without
     * subscription support are skipped without error.
     *
     * @param options     caller options, resolved once for all targets
     * @param targetNames target resource names, e.g. {@code users}
     * @return this helper, for chaining
     */
    public ActivityNotificationRoutes notifyTo(RouteOptions options, String... targetNames) {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS, options);

        for (String target : targetNames) {
            declareResources(target, resolved);

            if (resolved.cascadesSubscriptions()) {
                if (targets.supportsSubscriptions(target)) {
                    subscribedBy(resolved.subscriptionOption().get(), target);
                } else {
                    log.debug("Skipping subscription routes for '{}': target does not support subscriptions", target);
                }
            }
        }
        return this;
    }

    /**
     * Declares subscription routes for each target with default options.
     */
    public ActivityNotificationRoutes subscribedBy(String... targetNames) {
        return subscribedBy(RouteOptions.defaults(), targetNames);
    }

    /**
     * Declares subscription management routes for each target.
     *
     * @param options     caller options, resolved once for all targets
     * @param targetNames target resource names, e.g. {@code users}
     * @return this helper, for chaining
     */
    public ActivityNotificationRoutes subscribedBy(RouteOptions options, String... targetNames) {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.SUBSCRIPTIONS, options);
        for (String target : targetNames) {
            declareResources(target, resolved);
        }
        return this;
    }

    private void declareResources(String target, ResolvedRouteOptions resolved) {
        NestedResourceScope scope = NestedResourceScope.nest(target, resolved.model(), resolved.routeName());
        Map<String, String> defaults = resolved.defaultsFor(target);
        ResourceKind kind = resolved.kind();

        int declared = 0;
        // Literal segments such as open_all go first so they win over {id}
        for (ResourceAction action : kind.filteredActions()) {
            if (RoutePathFilter.shouldSkip(action, resolved)) {
                continue;
            }
            declare(scope, action, resolved, defaults);
            declared++;
        }
        for (ResourceAction action : kind.alwaysDeclared()) {
            declare(scope, action, resolved, defaults);
            declared++;
        }

        log.info("Declared {} {} routes under {} -> {}", declared, kind.resourceName(),
            scope.collectionPath(), resolved.controller());
    }

    private void declare(NestedResourceScope scope,
                         ResourceAction action,
                         ResolvedRouteOptions resolved,
                         Map<String, String> defaults) {
        mapper.addRoute(new RouteDefinition(
            routeName(scope, action),
            action.method(),
            scope.pathFor(action),
            resolved.controller(),
            action.actionName(),
            defaults,
            resolved.passthrough()));
    }

    private static String routeName(NestedResourceScope scope, ResourceAction action) {
        // Subscription creation is published under the open_all name
        if (action == ResourceAction.CREATE) {
            return ResourceAction.OPEN_ALL.pathSuffix() + "_" + scope.collectionName();
        }
        return scope.nameFor(action);
    }
}
