package io.specbridge.openapi;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives short, stable tool names from generated or declared operation names.
 * <p>
 * Generated identifiers usually carry the HTTP verb and repeat the resource noun, for example
 * <code>get_supplier_detail_suppliers__supplier_id__get</code>. Simplification turns that into
 * <code>get_supplier_detail</code>. Simplifying an already simplified name returns it unchanged.
 */
@UtilityClass
public class NameSimplifier {
    public static final String DELIMITER = "_";

    private static final Set<String> VERBS = Set.of(
            "get", "create", "update", "delete", "approve", "reject", "list", "query");

    private static final Pattern SNAKE_CASE = Pattern.compile("[a-z0-9_]+");
    private static final Pattern UPPER_RUN_BOUNDARY = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern LOWER_UPPER_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern TRAILING_METHOD = Pattern.compile("_(get|post|put|patch|delete)$");
    private static final Pattern INTERIOR_API = Pattern.compile("_api(?=_)");
    private static final Pattern REPEATED_DELIMITERS = Pattern.compile("_+");

    /**
     * Converts case boundaries to the delimiter and lowercases. Hyphens fold to the delimiter.
     * Names that already are lowercase delimited tokens are returned as-is.
     */
    public static String toSnakeCase(String name) {
        if (SNAKE_CASE.matcher(name).matches()) {
            return name;
        }
        var converted = UPPER_RUN_BOUNDARY.matcher(name).replaceAll("$1_$2");
        converted = LOWER_UPPER_BOUNDARY.matcher(converted).replaceAll("$1_$2");
        return REPEATED_DELIMITERS.matcher(converted.toLowerCase().replace('-', '_')).replaceAll(DELIMITER);
    }

    /**
     * Full simplification. Repeated until the name stops changing so the result is a fixed point.
     */
    public static String simplify(String name) {
        if (StringUtils.isBlank(name)) {
            return name;
        }
        var current = name;
        var next = simplifyOnce(current);
        while (!next.equals(current)) {
            current = next;
            next = simplifyOnce(current);
        }
        return current;
    }

    static String simplifyOnce(String name) {
        var simplified = toSnakeCase(name);
        simplified = stripTrailingMethod(simplified);
        simplified = INTERIOR_API.matcher(simplified).replaceAll("");
        simplified = collapseRedundantSuffix(simplified);
        simplified = StringUtils.strip(REPEATED_DELIMITERS.matcher(simplified).replaceAll(DELIMITER), DELIMITER);
        return simplified.isEmpty() ? name : simplified;
    }

    private static String stripTrailingMethod(String name) {
        final var stripped = TRAILING_METHOD.matcher(name).replaceFirst("");
        return StringUtils.strip(stripped, DELIMITER).isEmpty() ? name : stripped;
    }

    /**
     * Finds the shortest prefix (of at least two tokens) whose remaining suffix repeats the prefix's resource noun
     * and cuts the name there.
     */
    private static String collapseRedundantSuffix(String name) {
        final var tokens = Arrays.stream(name.split(DELIMITER))
                .filter(token -> !token.isEmpty())
                .toList();
        for (int i = 2; i < tokens.size(); i++) {
            final var prefix = tokens.subList(0, i);
            final var suffix = tokens.subList(i, tokens.size());
            final var bare = VERBS.contains(prefix.get(0)) ? prefix.subList(1, prefix.size()) : prefix;
            if (repeatsNoun(bare, suffix)) {
                return String.join(DELIMITER, prefix);
            }
        }
        return name;
    }

    private static boolean repeatsNoun(List<String> bare, List<String> suffix) {
        final var noun = bare.get(0);
        final var suffixHead = suffix.get(0);
        return suffixHead.equals(noun)
                || suffixHead.equals(noun + "s")
                || String.join(DELIMITER, suffix).startsWith(String.join(DELIMITER, bare));
    }
}
