package net.activitynotification.target;

/**
 * A resource that receives notifications, identified by the plural name used in its routes.
 */
public interface NotificationTarget {

    /**
     * Plural resource name, e.g. {@code users}.
     */
    String resourceName();
}
