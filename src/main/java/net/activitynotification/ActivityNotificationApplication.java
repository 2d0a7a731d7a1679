/**
 * Main application class for the activity notification route service
 *
 * Features:
 * - Compiles notification and subscription routes from configuration at startup
 * - Serves the compiled routes through Spring MVC functional endpoints
 * - Binds authentication-scoped routes to Spring Security roles
 * - Entry point for Spring Boot application
 */

package net.activitynotification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ActivityNotificationApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(ActivityNotificationApplication.class, args);
    }
}
