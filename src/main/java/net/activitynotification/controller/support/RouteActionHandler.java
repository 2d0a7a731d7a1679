package net.activitynotification.controller.support;

import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Application-supplied implementation of the actions behind one controller binding, for example
 * {@code activity_notification/notifications}. Register implementations as beans.
 */
public interface RouteActionHandler {

    /**
     * Controller binding served by this handler, matched exactly against
     * {@link net.activitynotification.routing.RouteDefinition#controller()}.
     */
    String controllerName();

    ServerResponse handle(RouteInvocation invocation, ServerRequest request) throws Exception;
}
