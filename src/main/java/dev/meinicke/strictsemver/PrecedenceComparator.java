package dev.meinicke.strictsemver;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * SemVer 2.0.0 precedence (section 11 of the standard).
 *
 * <ol>
 *   <li>major, minor and patch are compared numerically, in that order; the first difference decides.</li>
 *   <li>With an equal triple, a version without pre-release ranks above any version with one.</li>
 *   <li>Pre-release identifiers are compared left to right: numeric ones numerically, alphanumeric ones by
 *       ASCII order, and a numeric identifier ranks below an alphanumeric one. When one list is a prefix of
 *       the other, the shorter list ranks lower.</li>
 * </ol>
 *
 * Build metadata is ignored, so this ordering is not consistent with {@link Version#equals(Object)}.
 */
final class PrecedenceComparator implements Comparator<Version> {

    static final @NotNull PrecedenceComparator INSTANCE = new PrecedenceComparator();

    private PrecedenceComparator() {
    }

    @Override
    public int compare(@NotNull Version a, @NotNull Version b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");

        int cmp = a.getMajor().compareTo(b.getMajor());
        if (cmp != 0) return cmp;
        cmp = a.getMinor().compareTo(b.getMinor());
        if (cmp != 0) return cmp;
        cmp = a.getPatch().compareTo(b.getPatch());
        if (cmp != 0) return cmp;

        boolean aPre = a.isPreRelease();
        boolean bPre = b.isPreRelease();
        if (!aPre && !bPre) return 0;
        if (!aPre) return 1;
        if (!bPre) return -1;

        return compareIdentifiers(a.getPreReleaseIdentifiers(), b.getPreReleaseIdentifiers());
    }

    static int compareIdentifiers(@NotNull List<String> a, @NotNull List<String> b) {
        int min = Math.min(a.size(), b.size());
        for (int i = 0; i < min; i++) {
            int cmp = compareIdentifier(a.get(i), b.get(i));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(a.size(), b.size());
    }

    static int compareIdentifier(@NotNull String a, @NotNull String b) {
        boolean aNum = Identifiers.isNumeric(a);
        boolean bNum = Identifiers.isNumeric(b);
        if (aNum && bNum) return new BigInteger(a).compareTo(new BigInteger(b));
        if (aNum) return -1;
        if (bNum) return 1;
        // identifiers are ASCII, so UTF-16 order is byte order
        return Integer.signum(a.compareTo(b));
    }

    /**
     * Total order over build identifier lists, used only to break precedence ties.
     *
     * <p>Identifiers follow the pre-release rules, except that numerically equal identifiers such as
     * {@code 001} and {@code 1} fall back to ASCII order, so only identical lists compare as 0.
     */
    static int compareBuildIdentifiers(@NotNull List<String> a, @NotNull List<String> b) {
        int min = Math.min(a.size(), b.size());
        for (int i = 0; i < min; i++) {
            String as = a.get(i);
            String bs = b.get(i);
            int cmp = compareIdentifier(as, bs);
            if (cmp == 0) cmp = Integer.signum(as.compareTo(bs));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(a.size(), b.size());
    }

    @Override
    public @NotNull String toString() {
        return "SemVer precedence";
    }

}
