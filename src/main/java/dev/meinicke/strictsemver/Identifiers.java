package dev.meinicke.strictsemver;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Character-class checks and splitting shared by the parser and the comparators.
 *
 * <p>All checks are ASCII only: any character outside {@code [0-9A-Za-z-]} is rejected, including
 * non-ASCII letters and digits that {@link Character#isLetterOrDigit(char)} would accept.
 */
final class Identifiers {

    private Identifiers() {
        throw new UnsupportedOperationException("this class cannot be instantiated");
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierChar(char c) {
        return isDigit(c) || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '-';
    }

    /**
     * @return true when every character is an ASCII alphanumeric or hyphen; false for empty strings
     */
    static boolean isAsciiIdentifier(@NotNull String id) {
        if (id.isEmpty()) return false;
        for (int i = 0; i < id.length(); i++) {
            if (!isIdentifierChar(id.charAt(i))) return false;
        }
        return true;
    }

    /**
     * @return true when {@code s} is non-empty and consists of ASCII digits only
     */
    static boolean isNumeric(@Nullable String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    /**
     * A leading zero is only legal on the single-character identifier {@code "0"}.
     */
    static boolean hasLeadingZero(@NotNull String numeric) {
        return numeric.length() > 1 && numeric.charAt(0) == '0';
    }

    /**
     * Splits on {@code delim}, keeping empty pieces (so {@code "a..b"} yields three pieces and
     * {@code "a."} yields two). An empty input yields a single empty piece.
     */
    static @NotNull List<String> split(@NotNull String s, char delim) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == delim) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    /**
     * Splits a dotted pre-release or build string into an unmodifiable identifier list.
     * {@code null} maps to the empty list.
     */
    static @NotNull List<String> dotted(@Nullable String s) {
        if (s == null) return Collections.emptyList();
        return Collections.unmodifiableList(split(s, '.'));
    }

}
