package net.activitynotification.routing;

import net.activitynotification.util.ResourceNameUtils;

/**
 * Path and name prefixes of a resource nested under a target, e.g.
 * {@code /users/{user_id}/notifications}. The target itself declares no routes.
 *
 * @param target          target resource name as supplied by the caller
 * @param targetParameter path variable holding the target id, e.g. {@code user_id}
 * @param collectionPath  path of the nested collection
 * @param collectionName  route name of the nested collection, e.g. {@code user_notifications}
 * @param memberName      route name of one nested member, e.g. {@code user_notification}
 */
public record NestedResourceScope(String target,
                                  String targetParameter,
                                  String collectionPath,
                                  String collectionName,
                                  String memberName) {

    static final String MEMBER_PARAMETER = "id";

    /**
     * Builds the scope of {@code model} nested under {@code target}.
     *
     * @param target    target resource name, e.g. {@code users}
     * @param model     nested resource path segment, e.g. {@code notifications}
     * @param routeName nested resource route name segment, usually the model
     */
    public static NestedResourceScope nest(String target, String model, String routeName) {
        String targetSingular = ResourceNameUtils.singularKey(target);
        String resourceName = ResourceNameUtils.underscore(routeName);
        String targetParameter = targetSingular + "_id";
        return new NestedResourceScope(target,
            targetParameter,
            "/" + target + "/{" + targetParameter + "}/" + model,
            targetSingular + "_" + resourceName,
            targetSingular + "_" + ResourceNameUtils.singularize(resourceName));
    }

    public String memberPath() {
        return collectionPath + "/{" + MEMBER_PARAMETER + "}";
    }

    /**
     * Full path of an action within this scope.
     */
    public String pathFor(ResourceAction action) {
        String base = action.scope() == ResourceAction.Scope.MEMBER ? memberPath() : collectionPath;
        return action.pathSuffix().isEmpty() ? base : base + "/" + action.pathSuffix();
    }

    /**
     * Route name of an action within this scope. Actions without a path suffix use the plain
     * collection or member name; the others are prefixed with their suffix.
     */
    public String nameFor(ResourceAction action) {
        String base = action.scope() == ResourceAction.Scope.MEMBER ? memberName : collectionName;
        return action.pathSuffix().isEmpty() ? base : action.pathSuffix() + "_" + base;
    }
}
