package net.activitynotification.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RouteOptionResolverTest {

    private final RouteOptionResolver resolver = new RouteOptionResolver();

    @Test
    @DisplayName("Defaults: notifications model, namespaced controller, forced excludes appended")
    void should_FillDefaults_When_NoOptionsGiven() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS, RouteOptions.defaults());

        assertThat(resolved.kind()).isEqualTo(ResourceKind.NOTIFICATIONS);
        assertThat(resolved.model()).isEqualTo("notifications");
        assertThat(resolved.controller()).isEqualTo("activity_notification/notifications");
        assertThat(resolved.routeName()).isEqualTo("notifications");
        assertThat(resolved.withDevise()).isNull();
        assertThat(resolved.deviseDefaults()).isEmpty();
        assertThat(resolved.except()).containsExactly("new", "create", "edit", "update");
        assertThat(resolved.only()).isEmpty();
        assertThat(resolved.subscriptionOption()).isEmpty();
        assertThat(resolved.passthrough()).isEmpty();
    }

    @Test
    void should_TreatNullOptionsAsDefaults() {
        assertThat(resolver.resolve(ResourceKind.NOTIFICATIONS, null))
            .isEqualTo(resolver.resolve(ResourceKind.NOTIFICATIONS, RouteOptions.defaults()));
    }

    @Test
    void should_UseDeviseControllerAndDefaults_When_BoundToAuthenticationScope() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().withDevise("users").build());

        assertThat(resolved.controller()).isEqualTo("activity_notification/notifications_with_devise");
        assertThat(resolved.withDevise()).isEqualTo("users");
        assertThat(resolved.deviseDefaults()).containsExactly(Map.entry("devise_type", "users"));
        assertThat(resolved.defaultsFor("users"))
            .containsExactly(Map.entry("target_type", "users"), Map.entry("devise_type", "users"));
    }

    @Test
    void should_KeepExplicitController_When_BoundToAuthenticationScope() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().withDevise("users").controller("users/notifications").build());

        assertThat(resolved.controller()).isEqualTo("users/notifications");
    }

    @Test
    @DisplayName("Route name follows the model unless bound to an authentication scope")
    void should_DeriveRouteName_FromModelOrAs() {
        ResolvedRouteOptions byModel = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().model("notices").build());
        ResolvedRouteOptions byDevise = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().model("notices").withDevise("users").build());
        ResolvedRouteOptions byAs = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().model("notices").withDevise("users").as("alerts").build());

        assertThat(byModel.model()).isEqualTo("notices");
        assertThat(byModel.routeName()).isEqualTo("notices");
        assertThat(byDevise.model()).isEqualTo("notices");
        assertThat(byDevise.routeName()).isEqualTo("notifications");
        assertThat(byAs.routeName()).isEqualTo("alerts");
    }

    @Test
    void should_AppendForcedExcludes_AfterCallerExcludes() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().exceptActions(ResourceAction.OPEN).build());

        assertThat(resolved.except()).containsExactly("open", "new", "create", "edit", "update");
    }

    @Test
    void should_UseSubscriptionForcedExcludes_ForSubscriptions() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.SUBSCRIPTIONS, RouteOptions.defaults());

        assertThat(resolved.model()).isEqualTo("subscriptions");
        assertThat(resolved.controller()).isEqualTo("activity_notification/subscriptions");
        assertThat(resolved.except()).containsExactly("new", "edit", "update");
    }

    @Test
    void should_AcceptExplicitForcedExcludes() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS, RouteOptions.defaults(),
            List.of(ResourceAction.MOVE));

        assertThat(resolved.except()).containsExactly("move");
    }

    @Test
    void should_CarryUnknownOptionsThrough() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().options(Map.of("format", "json")).build());

        assertThat(resolved.passthrough()).containsExactly(Map.entry("format", "json"));
    }

    @Test
    @DisplayName("Cascaded subscription options inherit the authentication scope and never cascade again")
    void should_BuildSubscriptionOption_When_WithSubscriptionSet() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().withDevise("users").withSubscription(true).build());

        assertThat(resolved.cascadesSubscriptions()).isTrue();
        RouteOptions subscription = resolved.subscriptionOption().orElseThrow();
        assertThat(subscription.getWithDevise()).isEqualTo("users");
        assertThat(subscription.isWithSubscription()).isFalse();
        assertThat(subscription.getSubscriptionOptions()).isNull();
        assertThat(subscription.getModel()).isNull();
    }

    @Test
    void should_OverrideNestedDevise_WithParentDevise() {
        RouteOptions nested = RouteOptions.builder()
            .withDevise("admins")
            .exceptActions(ResourceAction.SUBSCRIBE_TO_EMAIL)
            .build();
        ResolvedRouteOptions withParentDevise = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().withDevise("users").subscription(nested).build());
        ResolvedRouteOptions withoutParentDevise = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().subscription(nested).build());

        assertThat(withParentDevise.subscriptionOption().orElseThrow().getWithDevise()).isEqualTo("users");
        assertThat(withParentDevise.subscriptionOption().orElseThrow().getExcept())
            .containsExactly("subscribe_to_email");
        assertThat(withoutParentDevise.subscriptionOption().orElseThrow().getWithDevise()).isNull();
    }

    @Test
    @DisplayName("Empty nested subscription options alone do not enable cascading")
    void should_NotCascade_When_NestedOptionsAreEmpty() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().subscription(RouteOptions.defaults()).build());

        assertThat(resolved.cascadesSubscriptions()).isFalse();
        assertThat(resolved.subscriptionOption()).isEmpty();
    }

    @Test
    void should_CascadeWithDefaults_When_FlagSetAlongsideEmptyNestedOptions() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().withSubscription(true).subscription(RouteOptions.defaults()).build());

        assertThat(resolved.subscriptionOption()).isPresent();
    }

    @Test
    void should_Cascade_When_NestedOptionsCarryAnyValue() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.NOTIFICATIONS,
            RouteOptions.builder().subscription(RouteOptions.builder().as("watches").build()).build());

        assertThat(resolved.subscriptionOption())
            .hasValueSatisfying(options -> assertThat(options.getAs()).isEqualTo("watches"));
    }

    @Test
    void should_NotCascade_ForSubscriptionDeclarations() {
        ResolvedRouteOptions resolved = resolver.resolve(ResourceKind.SUBSCRIPTIONS,
            RouteOptions.builder().withSubscription(true).build());

        assertThat(resolved.subscriptionOption()).isEmpty();
    }

    @Test
    void should_ProduceEqualResults_When_ResolvedTwice() {
        RouteOptions options = RouteOptions.builder()
            .withDevise("users")
            .withSubscription(true)
            .onlyActions(ResourceAction.MOVE)
            .build();

        assertThat(resolver.resolve(ResourceKind.NOTIFICATIONS, options))
            .isEqualTo(resolver.resolve(ResourceKind.NOTIFICATIONS, options));
    }

    @Test
    void should_LeaveCallerOptionsUntouched() {
        RouteOptions options = RouteOptions.builder().exceptActions(ResourceAction.OPEN).build();

        resolver.resolve(ResourceKind.NOTIFICATIONS, options);

        assertThat(options.getExcept()).containsExactly("open");
        assertThat(options.getController()).isNull();
        assertThat(options.getModel()).isNull();
    }
}
