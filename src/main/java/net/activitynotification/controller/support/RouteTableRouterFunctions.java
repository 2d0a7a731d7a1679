package net.activitynotification.controller.support;

import net.activitynotification.routing.RouteDefinition;
import net.activitynotification.routing.RouteTable;
import org.springframework.web.servlet.function.RequestPredicates;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

import java.util.Optional;

/**
 * Publishes a compiled {@link RouteTable} as a Spring MVC functional router.
 */
public final class RouteTableRouterFunctions {

    private RouteTableRouterFunctions() {
        // Utility class
    }

    /**
     * One functional route per table entry, in table order, each matching on verb and path and
     * handing the request to {@code dispatcher}.
     *
     * @param table      compiled route table
     * @param dispatcher receiver of matched requests
     * @return router function; matches nothing when the table is empty
     */
    public static RouterFunction<ServerResponse> routerFunction(RouteTable table, RouteDispatcher dispatcher) {
        if (table.isEmpty()) {
            return request -> Optional.empty();
        }
        RouterFunctions.Builder builder = RouterFunctions.route();
        for (RouteDefinition route : table.routes()) {
            builder.route(RequestPredicates.method(route.method()).and(RequestPredicates.path(route.path())),
                request -> dispatcher.dispatch(RouteInvocation.of(route, request.pathVariables()), request));
        }
        return builder.build();
    }
}
