package net.activitynotification.routing;

/**
 * Decides whether an optional action route is skipped. {@code except} is consulted first and
 * wins over {@code only}.
 */
public final class RoutePathFilter {

    private RoutePathFilter() {
        // Utility class
    }

    public static boolean shouldSkip(ResourceAction action, ResolvedRouteOptions options) {
        return shouldSkip(action.actionName(), options);
    }

    public static boolean shouldSkip(String actionName, ResolvedRouteOptions options) {
        if (!options.except().isEmpty() && options.except().contains(actionName)) {
            return true;
        }
        return !options.only().isEmpty() && !options.only().contains(actionName);
    }
}
