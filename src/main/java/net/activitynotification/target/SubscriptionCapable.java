package net.activitynotification.target;

/**
 * Implemented by notification targets that can manage subscriptions. Targets that do not
 * implement it never get subscription routes cascaded from their notification routes.
 */
public interface SubscriptionCapable {

    boolean isSubscriptionEnabled();
}
