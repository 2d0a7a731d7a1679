/**
 * Custom implementation of Spring Security's BasicAuthenticationEntryPoint
 * Invoked when an unauthenticated client calls a route bound to an authentication scope
 * or the admin route listing
 *
 * Key Features:
 * - Returns an RFC 9457 ProblemDetail body on authentication failure
 * - Specifies the WWW-Authenticate header with a custom realm name
 */
package net.activitynotification.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.authentication.www.BasicAuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Customizes the 401 response for routes protected by HTTP Basic authentication
 * Instead of a bare status, the client receives a ProblemDetail with the expected header format
 */
@Component
public class CustomBasicAuthenticationEntryPoint extends BasicAuthenticationEntryPoint {

    static final String REALM = "ActivityNotification";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authEx) throws IOException {
        response.addHeader("WWW-Authenticate", "Basic realm=\"" + getRealmName() + "\"");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
            HttpStatus.UNAUTHORIZED,
            "HTTP Basic Authentication required for this route."
        );
        problemDetail.setType(URI.create("about:blank"));
        problemDetail.setInstance(URI.create(request.getRequestURI()));
        problemDetail.setProperty(
            "expectedHeader",
            "Authorization: Basic <base64_encoded_username:password>"
        );

        response.getWriter().write(OBJECT_MAPPER.writeValueAsString(problemDetail));
    }

    @Override
    public void afterPropertiesSet() {
        setRealmName(REALM);
        super.afterPropertiesSet();
    }
}
