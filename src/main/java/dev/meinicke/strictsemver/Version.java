package dev.meinicke.strictsemver;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * Immutable, strict SemVer 2.0.0 version value.
 *
 * <p>A version is the five-tuple {@code (major, minor, patch, preRelease?, buildMeta?)}. Instances are
 * obtained from {@link #parse(String)}, which accepts exactly the grammar of the SemVer 2.0.0 standard, or
 * from {@link #of(BigInteger, BigInteger, BigInteger, String, String)}, which trusts its arguments.
 *
 * <p>Notes:
 * <ul>
 *   <li>Core numeric components are stored as {@link BigInteger}, so arbitrarily wide values such as
 *       {@code 99999999999999999999999.0.0} parse and render exactly.</li>
 *   <li>The textual form is never normalized: for every accepted string {@code s},
 *       {@code Version.parse(s).toString().equals(s)}.</li>
 *   <li>{@link #compareTo(Version)} implements SemVer precedence; build metadata is <em>ignored</em>.</li>
 *   <li>{@link #equals(Object)} and {@link #hashCode()} are structural and include build metadata, so
 *       {@code 1.0.0+a} and {@code 1.0.0+b} are not equal although {@code compareTo} returns 0. Use
 *       {@link #precedenceEquals(Version)} or {@link #PRECEDENCE_WITH_BUILD} when that matters.</li>
 * </ul>
 *
 * Instances are immutable and thread-safe.
 */
public final class Version implements Comparable<Version> {

    private static final Logger log = LoggerFactory.getLogger(Version.class);

    private final @NotNull BigInteger major;
    private final @NotNull BigInteger minor;
    private final @NotNull BigInteger patch;
    private final @Nullable String preRelease;
    private final @Nullable String buildMeta;
    private final @NotNull List<String> preReleaseIdentifiers;  // unmodifiable, split once
    private final @NotNull List<String> buildIdentifiers;       // unmodifiable, split once
    private final @NotNull String canonical;                    // cached canonical string representation

    /**
     * Comparator implementing SemVer precedence (same as {@link #compareTo}). Build metadata is ignored.
     */
    public static final @NotNull Comparator<Version> PRECEDENCE = PrecedenceComparator.INSTANCE;

    /**
     * Comparator that orders by SemVer precedence and, when precedence is equal, uses build metadata as a
     * deterministic tiebreaker. A version without build metadata sorts first. Build identifiers are compared
     * one by one with the pre-release rules (numeric below alphanumeric, numeric by value, alphanumeric by
     * ASCII order); numerically equal identifiers such as {@code 001} and {@code 1} fall back to ASCII order,
     * which keeps this comparator consistent with {@link #equals(Object)}.
     *
     * <p>This ordering is an aid for sorted collections only; SemVer itself assigns no meaning to it.
     */
    public static final @NotNull Comparator<Version> PRECEDENCE_WITH_BUILD = (a, b) -> {
        int p = a.compareTo(b);
        if (p != 0) return p;
        return PrecedenceComparator.compareBuildIdentifiers(a.buildIdentifiers, b.buildIdentifiers);
    };

    private Version(@NotNull BigInteger major, @NotNull BigInteger minor, @NotNull BigInteger patch,
                    @Nullable String preRelease, @Nullable String buildMeta) {
        this.major = Objects.requireNonNull(major, "major");
        this.minor = Objects.requireNonNull(minor, "minor");
        this.patch = Objects.requireNonNull(patch, "patch");
        this.preRelease = preRelease == null || preRelease.isEmpty() ? null : preRelease;
        this.buildMeta = buildMeta == null || buildMeta.isEmpty() ? null : buildMeta;
        this.preReleaseIdentifiers = Identifiers.dotted(this.preRelease);
        this.buildIdentifiers = Identifiers.dotted(this.buildMeta);
        this.canonical = buildCanonical();
    }

    // -------------------- Factories --------------------

    /**
     * Parse a SemVer 2.0.0 string.
     *
     * <p>Parsing is strict: leading zeros in numeric fields, empty identifiers, characters outside
     * {@code [0-9A-Za-z-]}, missing core fields and surrounding whitespace are all rejected.
     *
     * @param input non-null semver string
     * @return parsed Version
     * @throws VersionParseException when input does not conform to the grammar
     */
    public static @NotNull Version parse(@NotNull String input) {
        return new VersionParser(input).parse();
    }

    /**
     * Try to parse. Returns empty {@link Optional} for {@code null} or invalid input.
     */
    public static @NotNull Optional<Version> tryParse(@Nullable String input) {
        if (input == null) return Optional.empty();
        try {
            return Optional.of(parse(input));
        } catch (VersionParseException ex) {
            log.debug("Rejected version string: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return whether {@code input} is a well-formed SemVer 2.0.0 string
     */
    public static boolean isValid(@Nullable String input) {
        return tryParse(input).isPresent();
    }

    /**
     * Construct directly from components without validating them.
     *
     * <p>The caller is responsible for passing non-negative numbers and dotted identifiers that conform
     * to the grammar; {@link #toString()} renders whatever it is given. {@code null} or empty strings
     * mean "absent".
     */
    public static @NotNull Version of(@NotNull BigInteger major,
                                      @NotNull BigInteger minor,
                                      @NotNull BigInteger patch,
                                      @Nullable String preRelease,
                                      @Nullable String buildMeta) {
        return new Version(major, minor, patch, preRelease, buildMeta);
    }

    public static @NotNull Version of(long major, long minor, long patch) {
        return new Version(BigInteger.valueOf(major), BigInteger.valueOf(minor), BigInteger.valueOf(patch), null, null);
    }

    // -------------------- Accessors --------------------

    public @NotNull BigInteger getMajor() { return major; }

    public @NotNull BigInteger getMinor() { return minor; }

    public @NotNull BigInteger getPatch() { return patch; }

    /**
     * @return the dotted pre-release exactly as written, without the leading {@code '-'}
     */
    public @NotNull Optional<String> getPreRelease() { return Optional.ofNullable(preRelease); }

    /**
     * @return the dotted build metadata exactly as written, without the leading {@code '+'}
     */
    public @NotNull Optional<String> getBuildMeta() { return Optional.ofNullable(buildMeta); }

    public @NotNull List<String> getPreReleaseIdentifiers() { return preReleaseIdentifiers; }

    public @NotNull List<String> getBuildIdentifiers() { return buildIdentifiers; }

    public boolean isPreRelease() { return preRelease != null; }

    public boolean hasBuildMeta() { return buildMeta != null; }

    // -------------------- Derivation helpers --------------------

    public @NotNull Version bumpMajor() {
        return new Version(major.add(BigInteger.ONE), BigInteger.ZERO, BigInteger.ZERO, null, null);
    }

    public @NotNull Version bumpMinor() {
        return new Version(major, minor.add(BigInteger.ONE), BigInteger.ZERO, null, null);
    }

    public @NotNull Version bumpPatch() {
        return new Version(major, minor, patch.add(BigInteger.ONE), null, null);
    }

    /**
     * @return this version without build metadata; {@code this} if there is none
     */
    public @NotNull Version withoutBuildMeta() {
        if (buildMeta == null) return this;
        return new Version(major, minor, patch, preRelease, null);
    }

    /**
     * @return the release {@code major.minor.patch} this version leads up to; {@code this} if it already is one
     */
    public @NotNull Version toRelease() {
        if (preRelease == null && buildMeta == null) return this;
        return new Version(major, minor, patch, null, null);
    }

    // -------------------- Stringification --------------------

    @Override
    public @NotNull String toString() { return canonical; }

    private @NotNull String buildCanonical() {
        StringBuilder sb = new StringBuilder();
        sb.append(major).append('.').append(minor).append('.').append(patch);
        if (preRelease != null) sb.append('-').append(preRelease);
        if (buildMeta != null) sb.append('+').append(buildMeta);
        return sb.toString();
    }

    // -------------------- Comparable (SemVer precedence) --------------------

    @Override
    public int compareTo(@NotNull Version other) {
        return PrecedenceComparator.INSTANCE.compare(this, other);
    }

    /**
     * @return true when both versions have the same precedence, i.e. they differ at most in build metadata
     */
    public boolean precedenceEquals(@NotNull Version other) { return compareTo(other) == 0; }

    public boolean isLessThan(@NotNull Version other) { return compareTo(other) < 0; }

    public boolean isGreaterThan(@NotNull Version other) { return compareTo(other) > 0; }

    public boolean isAtLeast(@NotNull Version other) { return compareTo(other) >= 0; }

    public boolean isAtMost(@NotNull Version other) { return compareTo(other) <= 0; }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof Version)) return false;
        Version v = (Version) o;
        return major.equals(v.major)
                && minor.equals(v.minor)
                && patch.equals(v.patch)
                && Objects.equals(preRelease, v.preRelease)
                && Objects.equals(buildMeta, v.buildMeta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease, buildMeta);
    }

}
