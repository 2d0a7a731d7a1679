package net.activitynotification.target;

import lombok.extern.slf4j.Slf4j;
import net.activitynotification.util.ResourceNameUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of notification targets by resource name, answering whether a target supports
 * subscriptions.
 *
 * <p>Names are compared in snake case, so {@code AdminUsers}, {@code admin-users} and
 * {@code admin_users} refer to the same target. A later registration replaces an earlier one.
 */
@Slf4j
public class NotificationTargetRegistry {

    private final Map<String, NotificationTarget> targets = new LinkedHashMap<>();

    public NotificationTargetRegistry() {
    }

    public NotificationTargetRegistry(Collection<? extends NotificationTarget> targets) {
        targets.forEach(this::register);
    }

    public void register(NotificationTarget target) {
        NotificationTarget previous = targets.put(key(target.resourceName()), target);
        if (previous != null) {
            log.warn("Notification target '{}' registered twice; keeping {}", target.resourceName(), target);
        }
    }

    public Optional<NotificationTarget> find(String resourceName) {
        if (resourceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(targets.get(key(resourceName)));
    }

    /**
     * Capability query used when notification routes cascade subscription routes.
     *
     * @param resourceName target resource name
     * @return true only for a registered target implementing {@link SubscriptionCapable}
     *         that reports subscriptions as enabled
     */
    public boolean supportsSubscriptions(String resourceName) {
        return find(resourceName)
            .filter(SubscriptionCapable.class::isInstance)
            .map(SubscriptionCapable.class::cast)
            .map(SubscriptionCapable::isSubscriptionEnabled)
            .orElse(false);
    }

    public List<NotificationTarget> targets() {
        return List.copyOf(targets.values());
    }

    private static String key(String resourceName) {
        return ResourceNameUtils.underscore(resourceName);
    }
}
