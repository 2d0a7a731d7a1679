/**
 * Controller exposing the compiled notification and subscription route table
 * - Lists every declared route with verb, path, controller binding and defaults
 * - Optionally narrows the listing to a single target resource
 * - Offers a plain text rendering for terminals
 */
package net.activitynotification.controller;

import net.activitynotification.controller.dto.RouteSummaryDto;
import net.activitynotification.routing.ResolvedRouteOptions;
import net.activitynotification.routing.RouteTable;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for inspecting the route table built at startup
 * Primarily used to verify route configuration in a deployed instance
 */
@RestController
@RequestMapping("/admin/routes")
@PreAuthorize("hasRole('ADMIN')")
@ConditionalOnProperty(prefix = "activity-notification.routes.listing", name = "enabled",
    havingValue = "true", matchIfMissing = true)
public class RouteTableController {

    private final RouteTable routeTable;

    public RouteTableController(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    /**
     * Returns the compiled routes in declaration order
     * @param target optional target resource name, matched against the {@code target_type} default
     * @return route summaries
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<RouteSummaryDto> listRoutes(@RequestParam(name = "target", required = false) String target) {
        return routeTable.routes().stream()
            .filter(route -> target == null || target.equals(route.defaultValue(ResolvedRouteOptions.TARGET_TYPE)))
            .map(RouteSummaryDto::fromRoute)
            .toList();
    }

    /**
     * Returns the route table as aligned plain text
     * @return one route per line
     */
    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getRouteReport() {
        return routeTable.describe();
    }
}
