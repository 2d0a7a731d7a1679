/**
 * Configuration class for Spring Security settings
 *
 * Features:
 * - Requires an authenticated principal on routes bound to an authentication scope (devise_type)
 * - Maps each authentication scope to a role: "users" requires USER, "admins" requires ADMIN
 * - Restricts the admin route listing to the ADMIN role
 * - Sets up stateless HTTP Basic Authentication with a ProblemDetail entry point
 * - Defines in-memory users from activity-notification.security.users
 */
package net.activitynotification.config;

import lombok.extern.slf4j.Slf4j;
import net.activitynotification.routing.ResolvedRouteOptions;
import net.activitynotification.routing.RouteDefinition;
import net.activitynotification.routing.RouteTable;
import net.activitynotification.util.ResourceNameUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@Slf4j
public class SecurityConfig {

    private final CustomBasicAuthenticationEntryPoint customBasicAuthenticationEntryPoint;
    private final RouteTable routeTable;

    public SecurityConfig(CustomBasicAuthenticationEntryPoint customBasicAuthenticationEntryPoint,
                          RouteTable routeTable) {
        this.customBasicAuthenticationEntryPoint = customBasicAuthenticationEntryPoint;
        this.routeTable = routeTable;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        Map<String, List<RouteDefinition>> protectedRoutes = routesByRequiredRole(routeTable);
        protectedRoutes.forEach((role, routes) ->
            log.info("{} route(s) require role {}", routes.size(), role));

        http
            .securityMatcher("/**")
            .authorizeHttpRequests(authorizeRequests -> {
                protectedRoutes.forEach((role, routes) -> routes.forEach(route ->
                    authorizeRequests.requestMatchers(route.method(), route.path()).hasRole(role)));
                authorizeRequests
                    .requestMatchers("/admin/**").hasRole("ADMIN")
                    .anyRequest().permitAll();
            })
            .httpBasic(httpBasic -> httpBasic
                .authenticationEntryPoint(customBasicAuthenticationEntryPoint)
            )
            // Stateless: credentials are sent per request and no session cookie is issued,
            // so CSRF protection has nothing to protect.
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .csrf(csrf -> csrf.disable());

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public UserDetailsService userDetailsService(ActivityNotificationProperties properties,
                                                 PasswordEncoder passwordEncoder) {
        List<UserDetails> users = new ArrayList<>();
        for (ActivityNotificationProperties.User user : properties.getSecurity().getUsers()) {
            if (!StringUtils.hasText(user.getUsername()) || !StringUtils.hasText(user.getPassword())) {
                log.warn("Skipping configured user '{}': username and password are required", user.getUsername());
                continue;
            }
            users.add(User.withUsername(user.getUsername())
                .password(passwordEncoder.encode(user.getPassword()))
                .roles(user.getRoles().toArray(String[]::new))
                .build());
        }
        log.info("Configured {} in-memory user(s)", users.size());
        return new InMemoryUserDetailsManager(users);
    }

    /**
     * Groups routes bound to an authentication scope by the role that scope requires.
     *
     * @param routeTable compiled route table
     * @return role to routes, in first-seen order; routes without {@code devise_type} are omitted
     */
    static Map<String, List<RouteDefinition>> routesByRequiredRole(RouteTable routeTable) {
        Map<String, List<RouteDefinition>> byRole = new LinkedHashMap<>();
        for (RouteDefinition route : routeTable.routes()) {
            String deviseType = route.defaultValue(ResolvedRouteOptions.DEVISE_TYPE);
            if (deviseType != null) {
                byRole.computeIfAbsent(roleFor(deviseType), role -> new ArrayList<>()).add(route);
            }
        }
        return byRole;
    }

    /**
     * Role required by an authentication scope: singular, upper case.
     */
    static String roleFor(String deviseType) {
        return ResourceNameUtils.singularKey(deviseType).toUpperCase(Locale.ROOT);
    }
}
