package net.activitynotification.routing;

/**
 * Host routing engine that receives declared routes.
 *
 * <p>Implementations may reject a declaration (for example a duplicate route); such failures
 * propagate unchanged to whoever invoked the declaration helper.
 */
@FunctionalInterface
public interface RouteMapper {

    void addRoute(RouteDefinition route);
}
