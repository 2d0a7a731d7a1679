package net.activitynotification.controller.dto;

import net.activitynotification.routing.RouteDefinition;

import java.util.Map;

/** DTO describing one compiled route in the route listing. */
public record RouteSummaryDto(
    String name,
    String method,
    String path,
    String controller,
    String action,
    Map<String, String> defaults
) {
    public static RouteSummaryDto fromRoute(RouteDefinition route) {
        return new RouteSummaryDto(
            route.name(),
            route.method().name(),
            route.path(),
            route.controller(),
            route.action(),
            route.defaults()
        );
    }
}
