/**
 * Health indicator for the compiled activity notification route table
 *
 * Reports UP with the number of compiled routes and the routed targets,
 * or UNKNOWN when the configuration declared no routes at all.
 * Exposed by Spring Boot Actuator through the /actuator/health endpoint.
 */
package net.activitynotification.config;

import net.activitynotification.routing.ResolvedRouteOptions;
import net.activitynotification.routing.RouteDefinition;
import net.activitynotification.routing.RouteTable;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component("routeTableHealthIndicator")
public class RouteTableHealthIndicator implements HealthIndicator {

    private final RouteTable routeTable;

    public RouteTableHealthIndicator(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    @Override
    public Health health() {
        if (routeTable.isEmpty()) {
            return Health.unknown()
                .withDetail("routes", 0)
                .withDetail("reason", "No notification or subscription routes are declared")
                .build();
        }
        return Health.up()
            .withDetail("routes", routeTable.size())
            .withDetail("targets", routeTable.routes().stream()
                .map(route -> route.defaultValue(ResolvedRouteOptions.TARGET_TYPE))
                .filter(Objects::nonNull)
                .distinct()
                .toList())
            .withDetail("authenticated", routeTable.routes().stream()
                .map(RouteDefinition::defaults)
                .filter(defaults -> defaults.containsKey(ResolvedRouteOptions.DEVISE_TYPE))
                .count())
            .build();
    }
}
