package net.activitynotification.target;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationTargetRegistryTest {

    @Test
    void should_SupportSubscriptions_OnlyForEnabledCapableTargets() {
        NotificationTarget plain = () -> "guests";
        NotificationTargetRegistry registry = new NotificationTargetRegistry(List.of(
            new ConfiguredNotificationTarget("users", true),
            new ConfiguredNotificationTarget("admins", false),
            plain));

        assertThat(registry.supportsSubscriptions("users")).isTrue();
        assertThat(registry.supportsSubscriptions("admins")).isFalse();
        assertThat(registry.supportsSubscriptions("guests")).isFalse();
        assertThat(registry.supportsSubscriptions("unknown")).isFalse();
        assertThat(registry.supportsSubscriptions(null)).isFalse();
    }

    @Test
    void should_MatchNamesInSnakeCase() {
        NotificationTargetRegistry registry = new NotificationTargetRegistry(List.of(
            new ConfiguredNotificationTarget("admin_users", true)));

        assertThat(registry.find("AdminUsers")).isPresent();
        assertThat(registry.find("admin-users")).isPresent();
        assertThat(registry.supportsSubscriptions("AdminUsers")).isTrue();
    }

    @Test
    void should_ReplaceEarlierRegistration() {
        NotificationTargetRegistry registry = new NotificationTargetRegistry();
        registry.register(new ConfiguredNotificationTarget("users", false));
        registry.register(new ConfiguredNotificationTarget("users", true));

        assertThat(registry.targets()).hasSize(1);
        assertThat(registry.supportsSubscriptions("users")).isTrue();
    }

    @Test
    void should_ListTargetsInRegistrationOrder() {
        NotificationTargetRegistry registry = new NotificationTargetRegistry(List.of(
            new ConfiguredNotificationTarget("users", true),
            new ConfiguredNotificationTarget("admins", false)));

        assertThat(registry.targets()).extracting(NotificationTarget::resourceName)
            .containsExactly("users", "admins");
    }
}
