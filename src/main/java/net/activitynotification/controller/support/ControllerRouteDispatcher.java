package net.activitynotification.controller.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches matched routes to the {@link RouteActionHandler} registered for the route's
 * controller binding.
 *
 * <p>A route without a registered handler answers 501 Not Implemented. Handler exceptions are
 * not caught here; they reach Spring MVC's exception resolvers unchanged.
 */
@Slf4j
public class ControllerRouteDispatcher implements RouteDispatcher {

    private final Map<String, RouteActionHandler> handlers = new LinkedHashMap<>();

    public ControllerRouteDispatcher(Collection<? extends RouteActionHandler> handlers) {
        for (RouteActionHandler handler : handlers) {
            RouteActionHandler previous = this.handlers.putIfAbsent(handler.controllerName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Controller '" + handler.controllerName()
                    + "' is handled by both " + previous.getClass().getName()
                    + " and " + handler.getClass().getName());
            }
        }
        log.info("Registered route handlers for controllers {}", this.handlers.keySet());
    }

    @Override
    public ServerResponse dispatch(RouteInvocation invocation, ServerRequest request) throws Exception {
        RouteActionHandler handler = handlers.get(invocation.controller());
        if (handler == null) {
            log.warn("No handler registered for {} ({} {})",
                invocation.route().endpoint(), request.method(), request.path());
            throw new ResponseStatusException(HttpStatus.NOT_IMPLEMENTED,
                "No handler registered for " + invocation.route().endpoint());
        }
        log.debug("Dispatching {} {} to {}", request.method(), request.path(), invocation.route().endpoint());
        return handler.handle(invocation, request);
    }

    /**
     * Controller bindings with a registered handler, in registration order.
     */
    public Set<String> controllerNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(handlers.keySet()));
    }
}
