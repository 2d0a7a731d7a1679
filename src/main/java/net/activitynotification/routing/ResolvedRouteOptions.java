package net.activitynotification.routing;

import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully resolved options for one declaration call, shared by every target of that call.
 *
 * @param kind               resource family being declared
 * @param model              path segment of the nested resource
 * @param controller         handler binding for every declared route
 * @param routeName          route name segment ({@code as} or the model)
 * @param withDevise         authentication scope, or null when routes are unauthenticated
 * @param deviseDefaults     {@code devise_type} default when bound to an authentication scope
 * @param except             excluded action names, forced excludes included
 * @param only               allowed action names, empty when unrestricted
 * @param subscriptionOption options for cascaded subscription routes, present only when
 *                           notification routes requested cascading
 * @param passthrough        unrecognised options copied onto every route
 */
public record ResolvedRouteOptions(ResourceKind kind,
                                   String model,
                                   String controller,
                                   String routeName,
                                   @Nullable String withDevise,
                                   Map<String, String> deviseDefaults,
                                   List<String> except,
                                   List<String> only,
                                   Optional<RouteOptions> subscriptionOption,
                                   Map<String, String> passthrough) {

    public static final String TARGET_TYPE = "target_type";
    public static final String DEVISE_TYPE = "devise_type";

    public ResolvedRouteOptions {
        deviseDefaults = Map.copyOf(deviseDefaults);
        except = List.copyOf(except);
        only = List.copyOf(only);
        passthrough = Collections.unmodifiableMap(new LinkedHashMap<>(passthrough));
    }

    /**
     * Route defaults for one target: {@code target_type} first, then the devise defaults.
     *
     * @param target target resource name, e.g. {@code users}
     * @return ordered defaults map
     */
    public Map<String, String> defaultsFor(String target) {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(TARGET_TYPE, target);
        defaults.putAll(deviseDefaults);
        return defaults;
    }

    public boolean cascadesSubscriptions() {
        return subscriptionOption.isPresent();
    }
}
