package net.activitynotification.config;

import jakarta.annotation.PostConstruct;
import net.activitynotification.routing.RouteOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly typed configuration for notification targets, route declarations and the users
 * allowed on authentication-bound routes.
 */
@Component
@ConfigurationProperties(prefix = "activity-notification")
public class ActivityNotificationProperties {

    /**
     * Known notification targets and their capabilities.
     */
    private List<Target> targets = new ArrayList<>();

    /**
     * Route declarations compiled into the route table at startup.
     */
    private Routes routes = new Routes();

    /**
     * In-memory users for routes bound to an authentication scope.
     */
    private Security security = new Security();

    @PostConstruct
    void validate() {
        for (Target target : targets) {
            Assert.hasText(target.getName(), "activity-notification.targets[].name must not be blank");
        }
        for (RouteDeclaration declaration : routes.getNotifyTo()) {
            Assert.notEmpty(declaration.getTargets(), "activity-notification.routes.notify-to[].targets must not be empty");
        }
        for (RouteDeclaration declaration : routes.getSubscribedBy()) {
            Assert.notEmpty(declaration.getTargets(), "activity-notification.routes.subscribed-by[].targets must not be empty");
        }
    }

    public List<Target> getTargets() {
        return targets;
    }

    public void setTargets(List<Target> targets) {
        this.targets = targets != null ? targets : new ArrayList<>();
    }

    public Routes getRoutes() {
        return routes;
    }

    public void setRoutes(Routes routes) {
        this.routes = routes != null ? routes : new Routes();
    }

    public Security getSecurity() {
        return security;
    }

    public void setSecurity(Security security) {
        this.security = security != null ? security : new Security();
    }

    public static class Target {

        private String name;

        private boolean subscriptionEnabled;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isSubscriptionEnabled() {
            return subscriptionEnabled;
        }

        public void setSubscriptionEnabled(boolean subscriptionEnabled) {
            this.subscriptionEnabled = subscriptionEnabled;
        }
    }

    public static class Routes {

        /**
         * Notification route declarations, optionally cascading subscription routes.
         */
        private List<RouteDeclaration> notifyTo = new ArrayList<>();

        /**
         * Standalone subscription route declarations.
         */
        private List<RouteDeclaration> subscribedBy = new ArrayList<>();

        /**
         * Admin listing of the compiled route table.
         */
        private Listing listing = new Listing();

        public List<RouteDeclaration> getNotifyTo() {
            return notifyTo;
        }

        public void setNotifyTo(List<RouteDeclaration> notifyTo) {
            this.notifyTo = notifyTo != null ? notifyTo : new ArrayList<>();
        }

        public List<RouteDeclaration> getSubscribedBy() {
            return subscribedBy;
        }

        public void setSubscribedBy(List<RouteDeclaration> subscribedBy) {
            this.subscribedBy = subscribedBy != null ? subscribedBy : new ArrayList<>();
        }

        public Listing getListing() {
            return listing;
        }

        public void setListing(Listing listing) {
            this.listing = listing != null ? listing : new Listing();
        }
    }

    public static class Listing {

        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Options shared by top-level declarations and the nested subscription options.
     */
    public static class DeclarationOptions {

        private String model;
        private String controller;
        private String as;
        private List<String> except = new ArrayList<>();
        private List<String> only = new ArrayList<>();
        private Map<String, String> options = new LinkedHashMap<>();

        RouteOptions.RouteOptionsBuilder toBuilder() {
            return RouteOptions.builder()
                .model(model)
                .controller(controller)
                .as(as)
                .except(except)
                .only(only)
                .options(options);
        }

        public RouteOptions toRouteOptions() {
            return toBuilder().build();
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getController() {
            return controller;
        }

        public void setController(String controller) {
            this.controller = controller;
        }

        public String getAs() {
            return as;
        }

        public void setAs(String as) {
            this.as = as;
        }

        public List<String> getExcept() {
            return except;
        }

        public void setExcept(List<String> except) {
            this.except = except != null ? except : new ArrayList<>();
        }

        public List<String> getOnly() {
            return only;
        }

        public void setOnly(List<String> only) {
            this.only = only != null ? only : new ArrayList<>();
        }

        public Map<String, String> getOptions() {
            return options;
        }

        public void setOptions(Map<String, String> options) {
            this.options = options != null ? options : new LinkedHashMap<>();
        }
    }

    public static class RouteDeclaration extends DeclarationOptions {

        private List<String> targets = new ArrayList<>();

        private String withDevise;

        /**
         * Cascade subscription routes with default options.
         */
        private boolean withSubscription;

        /**
         * Cascade subscription routes with these options; implies with-subscription.
         */
        private DeclarationOptions subscription;

        @Override
        public RouteOptions toRouteOptions() {
            RouteOptions.RouteOptionsBuilder builder = toBuilder()
                .withDevise(withDevise)
                .withSubscription(withSubscription);
            if (subscription != null) {
                builder.subscription(subscription.toRouteOptions());
            }
            return builder.build();
        }

        public List<String> getTargets() {
            return targets;
        }

        public void setTargets(List<String> targets) {
            this.targets = targets != null ? targets : new ArrayList<>();
        }

        public String getWithDevise() {
            return withDevise;
        }

        public void setWithDevise(String withDevise) {
            this.withDevise = withDevise;
        }

        public boolean isWithSubscription() {
            return withSubscription;
        }

        public void setWithSubscription(boolean withSubscription) {
            this.withSubscription = withSubscription;
        }

        public DeclarationOptions getSubscription() {
            return subscription;
        }

        public void setSubscription(DeclarationOptions subscription) {
            this.subscription = subscription;
        }
    }

    public static class Security {

        private List<User> users = new ArrayList<>();

        public List<User> getUsers() {
            return users;
        }

        public void setUsers(List<User> users) {
            this.users = users != null ? users : new ArrayList<>();
        }
    }

    public static class User {

        private String username;
        private String password;
        private List<String> roles = new ArrayList<>();

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public List<String> getRoles() {
            return roles;
        }

        public void setRoles(List<String> roles) {
            this.roles = roles != null ? roles : new ArrayList<>();
        }
    }
}
