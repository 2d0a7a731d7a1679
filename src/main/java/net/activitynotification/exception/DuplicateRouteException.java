package net.activitynotification.exception;

import net.activitynotification.routing.RouteDefinition;

/**
 * A route declaration collided with a route already in the table, either on verb and path or
 * on a route name bound to a different path.
 * RETRYABLE: No (the route configuration itself has to change)
 */
public class DuplicateRouteException extends RuntimeException {

    private final transient RouteDefinition rejected;
    private final transient RouteDefinition existing;

    public DuplicateRouteException(String message, RouteDefinition rejected, RouteDefinition existing) {
        super(message);
        this.rejected = rejected;
        this.existing = existing;
    }

    /** The declaration that was refused. */
    public RouteDefinition getRejected() {
        return rejected;
    }

    /** The previously declared route it collided with. */
    public RouteDefinition getExisting() {
        return existing;
    }
}
