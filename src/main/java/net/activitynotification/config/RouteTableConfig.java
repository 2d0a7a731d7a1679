/**
 * Configuration compiling the activity notification route table at startup
 *
 * Features:
 * - Registers notification targets from configuration and from NotificationTarget beans
 * - Declares notify-to and subscribed-by routes from application properties
 * - Publishes the compiled table to Spring MVC as a functional router
 * - Dispatches matched requests to RouteActionHandler beans by controller name
 */
package net.activitynotification.config;

import lombok.extern.slf4j.Slf4j;
import net.activitynotification.controller.support.ControllerRouteDispatcher;
import net.activitynotification.controller.support.RouteActionHandler;
import net.activitynotification.controller.support.RouteDispatcher;
import net.activitynotification.controller.support.RouteTableRouterFunctions;
import net.activitynotification.routing.ActivityNotificationRoutes;
import net.activitynotification.routing.RouteTable;
import net.activitynotification.target.ConfiguredNotificationTarget;
import net.activitynotification.target.NotificationTarget;
import net.activitynotification.target.NotificationTargetRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

@Configuration
@Slf4j
public class RouteTableConfig {

    @Bean
    public NotificationTargetRegistry notificationTargetRegistry(ActivityNotificationProperties properties,
                                                                 ObjectProvider<NotificationTarget> targetBeans) {
        NotificationTargetRegistry registry = new NotificationTargetRegistry();
        for (ActivityNotificationProperties.Target target : properties.getTargets()) {
            registry.register(new ConfiguredNotificationTarget(target.getName(), target.isSubscriptionEnabled()));
        }
        // Beans win over configuration for the same resource name
        targetBeans.orderedStream().forEach(registry::register);
        return registry;
    }

    /**
     * Compiles the route table once. A duplicate route in the configuration fails startup.
     *
     * @param properties route declarations
     * @param targets    capability lookup for subscription cascading
     * @return the compiled route table
     */
    @Bean
    public RouteTable activityNotificationRouteTable(ActivityNotificationProperties properties,
                                                     NotificationTargetRegistry targets) {
        RouteTable table = new RouteTable();
        declareRoutes(new ActivityNotificationRoutes(table, targets), properties.getRoutes());

        log.info("Compiled {} activity notification routes", table.size());
        if (log.isDebugEnabled() && !table.isEmpty()) {
            log.debug("Activity notification routes:\n{}", table.describe());
        }
        return table;
    }

    @Bean
    public RouteDispatcher routeDispatcher(ObjectProvider<RouteActionHandler> handlers) {
        return new ControllerRouteDispatcher(handlers.orderedStream().toList());
    }

    @Bean
    public RouterFunction<ServerResponse> activityNotificationRouterFunction(RouteTable activityNotificationRouteTable,
                                                                             RouteDispatcher routeDispatcher) {
        return RouteTableRouterFunctions.routerFunction(activityNotificationRouteTable, routeDispatcher);
    }

    static void declareRoutes(ActivityNotificationRoutes routes, ActivityNotificationProperties.Routes config) {
        for (ActivityNotificationProperties.RouteDeclaration declaration : config.getNotifyTo()) {
            routes.notifyTo(declaration.toRouteOptions(), declaration.getTargets().toArray(String[]::new));
        }
        for (ActivityNotificationProperties.RouteDeclaration declaration : config.getSubscribedBy()) {
            routes.subscribedBy(declaration.toRouteOptions(), declaration.getTargets().toArray(String[]::new));
        }
    }
}
