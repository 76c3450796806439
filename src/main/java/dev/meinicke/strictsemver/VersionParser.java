package dev.meinicke.strictsemver;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Strict SemVer 2.0.0 scanner.
 *
 * <p>Accepts exactly the language
 * <pre>
 * version    := numeric "." numeric "." numeric ( "-" preRelease )? ( "+" buildMeta )?
 * numeric    := "0" | [1-9][0-9]*
 * preRelease := preId ( "." preId )*
 * preId      := "0" | [1-9][0-9]* | [0-9]*[A-Za-z-][0-9A-Za-z-]*
 * buildMeta  := bId ( "." bId )*
 * bId        := [0-9A-Za-z-]+
 * </pre>
 * without regular expressions. The input is never trimmed, so surrounding whitespace is an error like
 * any other stray character. One parser instance handles one input.
 */
final class VersionParser {

    private final @NotNull String input;

    VersionParser(@NotNull String input) {
        this.input = Objects.requireNonNull(input, "input");
    }

    @NotNull Version parse() {
        if (input.isEmpty()) throw fail("empty version string");

        // the core holds only digits and dots, so the first '+' ends everything before the build
        // metadata and the first '-' before it starts the pre-release
        int plus = input.indexOf('+');
        String beforePlus = plus >= 0 ? input.substring(0, plus) : input;
        @Nullable String buildPart = plus >= 0 ? input.substring(plus + 1) : null;

        int dash = beforePlus.indexOf('-');
        String core = dash >= 0 ? beforePlus.substring(0, dash) : beforePlus;
        @Nullable String preReleasePart = dash >= 0 ? beforePlus.substring(dash + 1) : null;

        List<String> corePieces = Identifiers.split(core, '.');
        if (corePieces.size() != 3) {
            throw fail("core version must be three dot-separated numeric identifiers 'major.minor.patch' (found: '" + core + "')");
        }

        BigInteger major = parseCoreNumber(corePieces.get(0), "major");
        BigInteger minor = parseCoreNumber(corePieces.get(1), "minor");
        BigInteger patch = parseCoreNumber(corePieces.get(2), "patch");

        if (preReleasePart != null) validatePreRelease(preReleasePart);
        if (buildPart != null) validateBuildMeta(buildPart);

        return Version.of(major, minor, patch, preReleasePart, buildPart);
    }

    private @NotNull BigInteger parseCoreNumber(@NotNull String piece, @NotNull String name) {
        if (piece.isEmpty()) throw fail(name + " component is missing");
        if (!Identifiers.isNumeric(piece)) {
            throw fail(name + " component must be numeric: '" + piece + "'");
        }
        if (Identifiers.hasLeadingZero(piece)) {
            throw fail(name + " component must not contain leading zeros: '" + piece + "'");
        }
        return new BigInteger(piece);
    }

    private void validatePreRelease(@NotNull String part) {
        if (part.isEmpty()) throw fail("empty pre-release after '-'");
        for (String id : Identifiers.split(part, '.')) {
            if (id.isEmpty()) throw fail("empty identifier in pre-release '" + part + "'");
            if (!Identifiers.isAsciiIdentifier(id)) {
                throw fail("pre-release identifier contains invalid characters: '" + id + "'");
            }
            if (Identifiers.isNumeric(id) && Identifiers.hasLeadingZero(id)) {
                throw fail("numeric pre-release identifier must not contain leading zeros: '" + id + "'");
            }
        }
    }

    private void validateBuildMeta(@NotNull String part) {
        if (part.isEmpty()) throw fail("empty build metadata after '+'");
        for (String id : Identifiers.split(part, '.')) {
            if (id.isEmpty()) throw fail("empty identifier in build metadata '" + part + "'");
            if (!Identifiers.isAsciiIdentifier(id)) {
                throw fail("build identifier contains invalid characters: '" + id + "'");
            }
        }
    }

    private @NotNull VersionParseException fail(@NotNull String reason) {
        return new VersionParseException(input, reason);
    }

}
