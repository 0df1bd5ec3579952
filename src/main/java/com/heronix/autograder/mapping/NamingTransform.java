package com.heronix.autograder.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Renames record keys between the store convention (snake_case) and the
 * canonical in-memory convention (camelCase).
 *
 * <pre>
 * persisted                     canonical
 * {"grading_criteria": "...",   {"gradingCriteria": "...",
 *  "updated_at": "..."}          "updatedAt": "..."}
 * </pre>
 *
 * Keys are renamed in nested maps and in maps inside lists; values are
 * never touched. Key order is preserved. The two directions are exact inverses
 * on well-formed keys:
 * <ul>
 *   <li>snake_case: {@code [a-z][a-z0-9]*(_[a-z][a-z0-9]*)*}</li>
 *   <li>camelCase: {@code [a-z][a-z0-9]*([A-Z][a-z0-9]*)*}</li>
 * </ul>
 * Any other key (e.g. {@code "Title"}, {@code "file__count"}, {@code "a_1"})
 * cannot be renamed without ambiguity. It is kept as-is and reported in
 * {@link Conversion#malformedKeys()} so the caller can log it. A renamed key
 * that would collide with a kept key is kept as-is too, so no entry is ever dropped.
 */
public final class NamingTransform {

    private static final Pattern SNAKE_KEY = Pattern.compile("[a-z][a-z0-9]*(_[a-z][a-z0-9]*)*");
    private static final Pattern CAMEL_KEY = Pattern.compile("[a-z][a-z0-9]*([A-Z][a-z0-9]*)*");

    private NamingTransform() {
    }

    /**
     * Result of a conversion.
     *
     * @param record        converted record, unmodifiable, same key order as the input
     * @param malformedKeys keys passed through unchanged, in encounter order
     */
    public record Conversion(Map<String, Object> record, Set<String> malformedKeys) {

        public boolean isClean() {
            return malformedKeys.isEmpty();
        }
    }

    /**
     * Persisted (snake_case) record to canonical (camelCase) record.
     */
    public static Conversion toCanonical(Map<String, ?> persisted) {
        Set<String> malformed = new LinkedHashSet<>();
        Map<String, Object> converted = convertMap(persisted, SNAKE_KEY, NamingTransform::snakeToCamel, malformed);
        return new Conversion(converted, Collections.unmodifiableSet(malformed));
    }

    /**
     * Canonical (camelCase) record to persisted (snake_case) record.
     */
    public static Conversion toPersisted(Map<String, ?> canonical) {
        Set<String> malformed = new LinkedHashSet<>();
        Map<String, Object> converted = convertMap(canonical, CAMEL_KEY, NamingTransform::camelToSnake, malformed);
        return new Conversion(converted, Collections.unmodifiableSet(malformed));
    }

    public static String snakeToCamel(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        boolean upperNext = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String camelToSnake(String key) {
        StringBuilder sb = new StringBuilder(key.length() + 4);
        for (char c : key.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('_').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private static Map<String, Object> convertMap(Map<String, ?> source, Pattern wellFormed,
                                                  UnaryOperator<String> rename, Set<String> malformed) {
        // Keys that cannot be renamed keep their name; reserve those names first
        Set<String> keptAsIs = new LinkedHashSet<>();
        for (String key : source.keySet()) {
            if (key == null || !wellFormed.matcher(key).matches()) {
                keptAsIs.add(key);
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            String key = entry.getKey();
            String target = key;

            if (keptAsIs.contains(key)) {
                malformed.add(key);
            } else {
                String renamed = rename.apply(key);
                if (!renamed.equals(key) && keptAsIs.contains(renamed)) {
                    malformed.add(key);
                } else {
                    target = renamed;
                }
            }

            result.put(target, convertValue(entry.getValue(), wellFormed, rename, malformed));
        }
        return Collections.unmodifiableMap(result);
    }

    @SuppressWarnings("unchecked")
    private static Object convertValue(Object value, Pattern wellFormed,
                                       UnaryOperator<String> rename, Set<String> malformed) {
        if (value instanceof Map) {
            return convertMap((Map<String, ?>) value, wellFormed, rename, malformed);
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(convertValue(element, wellFormed, rename, malformed));
            }
            return Collections.unmodifiableList(converted);
        }
        return value;
    }
}
