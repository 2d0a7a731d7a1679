package net.activitynotification.controller.support;

import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Receives every request matched against the compiled route table.
 */
@FunctionalInterface
public interface RouteDispatcher {

    ServerResponse dispatch(RouteInvocation invocation, ServerRequest request) throws Exception;
}
