package net.activitynotification;

import net.activitynotification.controller.support.RouteActionHandler;
import net.activitynotification.controller.support.RouteInvocation;
import net.activitynotification.routing.RouteTable;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Application context test over the routes declared in application.yml
 *
 * Features:
 * - Verifies the route table compiled from configuration
 * - Verifies authentication-bound routes require the matching role
 * - Verifies dispatch to registered handlers and 501 for unhandled controllers
 * - Verifies the admin route listing is restricted to ADMIN
 */
@SpringBootTest(properties = {
    "APP_SECURITY_USER_PASSWORD=user-secret",
    "APP_SECURITY_ADMIN_PASSWORD=admin-secret"
})
@AutoConfigureMockMvc
class ActivityNotificationApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RouteTable routeTable;

    @TestConfiguration
    static class HandlerConfig {

        @Bean
        RouteActionHandler deviseNotificationsHandler() {
            return new RouteActionHandler() {
                @Override
                public String controllerName() {
                    return "activity_notification/notifications_with_devise";
                }

                @Override
                public ServerResponse handle(RouteInvocation invocation, ServerRequest request) {
                    return ServerResponse.ok()
                        .header("X-Endpoint", invocation.route().endpoint())
                        .header("X-Devise-Type", invocation.deviseType())
                        .build();
                }
            };
        }
    }

    @Test
    void contextLoads_withConfiguredRoutes() {
        // users: 6 notification + 10 subscription routes; admins: 5 notification routes
        assertEquals(21, routeTable.size());
    }

    @Test
    void authenticatedRoute_shouldChallengeAnonymousClient() throws Exception {
        mockMvc.perform(get("/users/1/notifications"))
            .andExpect(status().isUnauthorized())
            .andExpect(header().string("WWW-Authenticate", containsString("ActivityNotification")));
    }

    @Test
    void authenticatedRoute_shouldDispatchForUserRole() throws Exception {
        mockMvc.perform(get("/users/1/notifications/3/move").with(httpBasic("user", "user-secret")))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Endpoint", "activity_notification/notifications_with_devise#move"))
            .andExpect(header().string("X-Devise-Type", "users"));
    }

    @Test
    void authenticatedRoute_shouldForbidOtherRoles() throws Exception {
        mockMvc.perform(get("/users/1/notifications").with(httpBasic("admin", "admin-secret")))
            .andExpect(status().isForbidden());
    }

    @Test
    void publicRoute_shouldAnswerNotImplemented_WhenNoHandlerRegistered() throws Exception {
        mockMvc.perform(post("/admins/1/notifications/open_all"))
            .andExpect(status().isNotImplemented());
    }

    @Test
    void routeListing_shouldRequireAdmin() throws Exception {
        mockMvc.perform(get("/admin/routes"))
            .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/admin/routes").with(httpBasic("user", "user-secret")))
            .andExpect(status().isForbidden());
        mockMvc.perform(get("/admin/routes").with(httpBasic("admin", "admin-secret")).accept(MediaType.APPLICATION_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(21));
    }

    @Test
    void health_shouldBePublic() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk());
    }
}
