package net.activitynotification.target;

/**
 * Target declared in application configuration rather than by a bean.
 *
 * @param resourceName        plural resource name
 * @param subscriptionEnabled whether subscription routes may be cascaded for this target
 */
public record ConfiguredNotificationTarget(String resourceName, boolean subscriptionEnabled)
        implements NotificationTarget, SubscriptionCapable {

    @Override
    public boolean isSubscriptionEnabled() {
        return subscriptionEnabled;
    }
}
