package net.activitynotification.controller.support;

import jakarta.annotation.Nullable;
import net.activitynotification.routing.ResolvedRouteOptions;
import net.activitynotification.routing.RouteDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A matched request on a declared route: the route itself plus its parameters, which are
 * the route defaults overlaid with the request's path variables.
 *
 * @param route      the matched route
 * @param parameters defaults first, then path variables ({@code user_id}, {@code id})
 */
public record RouteInvocation(RouteDefinition route, Map<String, String> parameters) {

    public RouteInvocation {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static RouteInvocation of(RouteDefinition route, Map<String, String> pathVariables) {
        Map<String, String> parameters = new LinkedHashMap<>(route.defaults());
        parameters.putAll(pathVariables);
        return new RouteInvocation(route, parameters);
    }

    public String controller() {
        return route.controller();
    }

    public String action() {
        return route.action();
    }

    @Nullable
    public String parameter(String name) {
        return parameters.get(name);
    }

    public String targetType() {
        return parameters.get(ResolvedRouteOptions.TARGET_TYPE);
    }

    @Nullable
    public String deviseType() {
        return parameters.get(ResolvedRouteOptions.DEVISE_TYPE);
    }
}
