package net.activitynotification.routing;

import lombok.extern.slf4j.Slf4j;
import net.activitynotification.exception.DuplicateRouteException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory route table, filled once while routes are declared at startup.
 *
 * <p>Keeps declaration order. Rejects a second route on the same verb and path, and a route name
 * reused for a different path; the same name on the same path with another verb is allowed
 * ({@code show} and {@code destroy} share one).
 */
@Slf4j
public class RouteTable implements RouteMapper {

    private final List<RouteDefinition> routes = new ArrayList<>();
    private final Map<String, RouteDefinition> byMethodAndPath = new HashMap<>();
    private final Map<String, RouteDefinition> byName = new HashMap<>();

    @Override
    public void addRoute(RouteDefinition route) {
        String key = route.method().name() + " " + route.path();
        RouteDefinition samePath = byMethodAndPath.get(key);
        if (samePath != null) {
            throw new DuplicateRouteException(
                "Route " + key + " is already bound to " + samePath.endpoint(), route, samePath);
        }
        RouteDefinition sameName = byName.get(route.name());
        if (sameName != null && !sameName.path().equals(route.path())) {
            throw new DuplicateRouteException(
                "Route name '" + route.name() + "' is already used for " + sameName.path(), route, sameName);
        }

        routes.add(route);
        byMethodAndPath.put(key, route);
        byName.putIfAbsent(route.name(), route);
        log.debug("Declared route {} {} -> {} {}", route.method(), route.path(), route.endpoint(), route.defaults());
    }

    public List<RouteDefinition> routes() {
        return Collections.unmodifiableList(routes);
    }

    public int size() {
        return routes.size();
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    /**
     * Finds the first route registered under a name.
     */
    public Optional<RouteDefinition> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Renders the table one route per line, in the layout of a framework route listing.
     *
     * @return printable route listing, empty string for an empty table
     */
    public String describe() {
        int nameWidth = routes.stream().mapToInt(route -> route.name().length()).max().orElse(0);
        int pathWidth = routes.stream().mapToInt(route -> route.path().length()).max().orElse(0);
        return routes.stream()
            .map(route -> String.format("%" + nameWidth + "s %-6s %-" + pathWidth + "s %s %s",
                route.name(), route.method().name(), route.path(), route.endpoint(), route.defaults()))
            .collect(Collectors.joining("\n"));
    }
}
