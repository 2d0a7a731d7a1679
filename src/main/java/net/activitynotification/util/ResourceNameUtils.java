package net.activitynotification.util;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Naming helpers for resource names used in route paths and route names.
 *
 * <p>Locale-independent: an irregular lookup table plus a handful of English suffix rules.
 * Words the rules do not recognise are returned unchanged.
 *
 * @example
 * <pre>{@code
 * ResourceNameUtils.singularize("users")          // "user"
 * ResourceNameUtils.singularize("categories")     // "category"
 * ResourceNameUtils.singularize("admin_people")   // "admin_person"
 * ResourceNameUtils.pluralize("subscription")     // "subscriptions"
 * ResourceNameUtils.underscore("AdminUsers")      // "admin_users"
 * }</pre>
 */
public final class ResourceNameUtils {

    private static final Map<String, String> IRREGULAR_SINGULARS = Map.ofEntries(
        Map.entry("people", "person"),
        Map.entry("men", "man"),
        Map.entry("women", "woman"),
        Map.entry("children", "child"),
        Map.entry("mice", "mouse"),
        Map.entry("geese", "goose"),
        Map.entry("feet", "foot"),
        Map.entry("teeth", "tooth"),
        Map.entry("oxen", "ox"),
        // "ies" plurals of words ending in "ie"
        Map.entry("movies", "movie"),
        Map.entry("cookies", "cookie"),
        Map.entry("zombies", "zombie"),
        Map.entry("calories", "calorie"),
        // "is" -> "es"
        Map.entry("analyses", "analysis"),
        Map.entry("crises", "crisis"),
        Map.entry("theses", "thesis"),
        Map.entry("diagnoses", "diagnosis"),
        Map.entry("aliases", "alias")
    );

    private static final Map<String, String> IRREGULAR_PLURALS = IRREGULAR_SINGULARS.entrySet().stream()
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getValue, Map.Entry::getKey));

    private static final Set<String> UNCOUNTABLE = Set.of(
        "equipment", "information", "series", "species", "news", "sheep", "fish", "deer", "rice", "money"
    );

    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z\\d]+)([A-Z][a-z])");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z\\d])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");
    private static final Pattern CONSONANT_Y = Pattern.compile(".*[^aeiou]y");
    private static final Pattern SIBILANT = Pattern.compile(".*(s|x|z|ch|sh)");
    // statuses, viruses, campuses, buses; not abuses or houses
    private static final Pattern US_PLURAL = Pattern.compile("(.*(stat|vir|camp|cens|bon|octop)|b|omnib)uses");

    private ResourceNameUtils() {
        // Utility class
    }

    /**
     * Returns the singular form of a plural resource name. Only the last underscore-separated
     * segment is inflected.
     *
     * @param name plural resource name, for example {@code users}
     * @return singular form, or the input unchanged when it is null, blank or not recognised
     */
    public static String singularize(String name) {
        if (name == null || name.isBlank()) {
            return name;
        }
        int split = name.lastIndexOf('_');
        String head = split >= 0 ? name.substring(0, split + 1) : "";
        String word = split >= 0 ? name.substring(split + 1) : name;
        return head + singularWord(word);
    }

    /**
     * Returns the plural form of a resource name. Names that are already plural are returned
     * unchanged.
     *
     * @param name singular or plural resource name
     * @return plural form, or the input unchanged when it is null or blank
     */
    public static String pluralize(String name) {
        if (name == null || name.isBlank()) {
            return name;
        }
        int split = name.lastIndexOf('_');
        String head = split >= 0 ? name.substring(0, split + 1) : "";
        String word = split >= 0 ? name.substring(split + 1) : name;
        return head + pluralWord(word);
    }

    /**
     * Converts camel case, dashes and spaces into a lowercase snake case name.
     * {@code ::} namespace separators become {@code /}.
     *
     * @param name raw name, for example {@code AdminUsers} or {@code admin-users}
     * @return snake case form, or the input unchanged when it is null
     */
    public static String underscore(String name) {
        if (name == null) {
            return null;
        }
        String result = name.trim().replace("::", "/");
        result = ACRONYM_BOUNDARY.matcher(result).replaceAll("$1_$2");
        result = CAMEL_BOUNDARY.matcher(result).replaceAll("$1_$2");
        result = SEPARATORS.matcher(result).replaceAll("_");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Lowercase singular snake case name used in route names and path parameters.
     *
     * @param name resource name in any supported form
     * @return normalized singular name
     */
    public static String singularKey(String name) {
        return singularize(underscore(name));
    }

    private static String singularWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (UNCOUNTABLE.contains(lower)) {
            return word;
        }
        String irregular = IRREGULAR_SINGULARS.get(lower);
        if (irregular != null) {
            return irregular;
        }
        if (US_PLURAL.matcher(lower).matches()) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("ies") && lower.length() > 4) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (lower.endsWith("sses") || lower.endsWith("xes") || lower.endsWith("zzes")
                || lower.endsWith("ches") || lower.endsWith("shes")) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("ss") || lower.endsWith("us") || lower.endsWith("is")) {
            return word;
        }
        if (lower.endsWith("s") && lower.length() > 1) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static String pluralWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (UNCOUNTABLE.contains(lower) || IRREGULAR_SINGULARS.containsKey(lower)) {
            return word;
        }
        String irregular = IRREGULAR_PLURALS.get(lower);
        if (irregular != null) {
            return irregular;
        }
        String singular = singularWord(word);
        if (!singular.equals(word) && pluralRule(singular).equals(word)) {
            return word;
        }
        return pluralRule(word);
    }

    private static String pluralRule(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (CONSONANT_Y.matcher(lower).matches()) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (SIBILANT.matcher(lower).matches()) {
            return word + "es";
        }
        return word + "s";
    }
}
