package org.pragmatica.aether.syntax;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Naming rules for declared names and binders.
 *
 * <p>Declarations ({@code Set}, {@code Func}, {@code Generator}, {@code Lazy}) must be upper case
 * letters, digits and underscores. Parameters and lambda binders may use any case.
 */
public final class NamingRules {
    public static final String DIGIT_START_REASON = "identifiers cannot start with a digit";
    public static final String BINDER_REASON = "parameter names may only contain letters, digits and underscores";
    public static final String DECLARATION_REASON =
        "variable and function names must be UPPER_SNAKE_CASE (for example MY_VAR, CALCULATE_SUM)";

    private static final Pattern WORD_BOUNDARY = Pattern.compile("([\\p{Ll}\\d])(\\p{Lu})");

    private NamingRules() {}

    /**
     * Why a declaration name is rejected, or empty when it is valid.
     */
    public static Optional<String> declarationViolation(String name) {
        if (startsWithDigit(name)) {
            return Optional.of(DIGIT_START_REASON);
        }
        boolean valid = name.codePoints()
                            .allMatch(c -> Character.isUpperCase(c) || Character.isDigit(c) || c == '_');
        return valid ? Optional.empty() : Optional.of(DECLARATION_REASON);
    }

    /**
     * Why a parameter or lambda binder name is rejected, or empty when it is valid.
     */
    public static Optional<String> binderViolation(String name) {
        if (startsWithDigit(name)) {
            return Optional.of(DIGIT_START_REASON);
        }
        boolean valid = name.codePoints()
                            .allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
        return valid ? Optional.empty() : Optional.of(BINDER_REASON);
    }

    /**
     * ASCII-only UPPER_SNAKE_CASE check used by the naming lint and rename validation.
     */
    public static boolean isUpperSnakeCase(String name) {
        if (name.isEmpty() || isAsciiDigit(name.charAt(0))) {
            return false;
        }
        return name.chars()
                   .allMatch(c -> (c >= 'A' && c <= 'Z') || isAsciiDigit(c) || c == '_');
    }

    /**
     * Suggested UPPER_SNAKE_CASE spelling: {@code myVar} becomes {@code MY_VAR}.
     */
    public static String suggestUpperSnakeCase(String name) {
        return WORD_BOUNDARY.matcher(name)
                            .replaceAll("$1_$2")
                            .toUpperCase(Locale.ROOT);
    }

    private static boolean startsWithDigit(String name) {
        return !name.isEmpty() && Character.isDigit(name.codePointAt(0));
    }

    private static boolean isAsciiDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
