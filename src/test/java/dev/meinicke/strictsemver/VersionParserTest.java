package dev.meinicke.strictsemver;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Acceptance and rejection tests for the strict parser, using the conformance strings published with
 * the SemVer 2.0.0 standard.
 */
public class VersionParserTest {

    @ParameterizedTest
    @DisplayName("well-formed versions parse and render back byte for byte")
    @ValueSource(strings = {
            "0.0.4",
            "1.2.3",
            "10.20.30",
            "1.1.2-prerelease+meta",
            "1.1.2+meta",
            "1.1.2+meta-valid",
            "1.0.0-alpha",
            "1.0.0-beta",
            "1.0.0-alpha.beta",
            "1.0.0-alpha.beta.1",
            "1.0.0-alpha.1",
            "1.0.0-alpha0.valid",
            "1.0.0-alpha.0valid",
            "1.0.0-alpha-a.b-c-somethinglong+build.1-aef.1-its-okay",
            "1.0.0-rc.1+build.1",
            "2.0.0-rc.1+build.123",
            "1.2.3-beta",
            "10.2.3-DEV-SNAPSHOT",
            "1.2.3-SNAPSHOT-123",
            "1.0.0",
            "2.0.0",
            "1.1.7",
            "2.0.0+build.1848",
            "2.0.1-alpha.1227",
            "1.0.0-alpha+beta",
            "1.2.3----RC-SNAPSHOT.12.9.1--.12+788",
            "1.2.3----R-S.12.9.1--.12+meta",
            "1.2.3----RC-SNAPSHOT.12.9.1--.12",
            "1.0.0+0.build.1-rc.10000aaa-kk-0.1",
            "99999999999999999999999.999999999999999999.99999999999999999",
            "1.0.0-0A.is.legal"
    })
    public void testAccepts(@NotNull String input) {
        @NotNull Version v = Version.parse(input);
        assertEquals(input, v.toString());
        assertEquals(v, Version.parse(v.toString()));
    }

    @ParameterizedTest
    @DisplayName("malformed versions are rejected with the input attached")
    @ValueSource(strings = {
            "1",
            "1.2",
            "1.2.3-0123",
            "1.2.3-0123.0123",
            "1.1.2+.123",
            "+invalid",
            "-invalid",
            "-invalid+invalid",
            "-invalid.01",
            "alpha",
            "alpha.beta",
            "alpha.beta.1",
            "alpha.1",
            "alpha+beta",
            "alpha_beta",
            "alpha.",
            "alpha..",
            "beta",
            "1.0.0-alpha_beta",
            "-alpha.",
            "1.0.0-alpha..",
            "1.0.0-alpha..1",
            "1.0.0-alpha...1",
            "1.0.0-alpha....1",
            "1.0.0-alpha.....1",
            "1.0.0-alpha......1",
            "1.0.0-alpha.......1",
            "01.1.1",
            "1.01.1",
            "1.1.01",
            "1.2.3.DEV",
            "1.2-SNAPSHOT",
            "1.2.31.2.3----RC-SNAPSHOT.12.09.1--..12+788",
            "1.2-RC-SNAPSHOT",
            "-1.0.3-gamma+b7718",
            "+justmeta",
            "9.8.7+meta+meta",
            "9.8.7-whatever+meta+meta",
            "99999999999999999999999.999999999999999999.99999999999999999----RC-SNAPSHOT.12.09.1--------------------------------..12"
    })
    public void testRejects(@NotNull String input) {
        @NotNull VersionParseException ex = assertThrows(VersionParseException.class, () -> Version.parse(input));
        assertEquals(input, ex.getInput());
        assertTrue(ex.getMessage().contains(input));
        assertFalse(Version.isValid(input));
    }

    @ParameterizedTest
    @DisplayName("empty parts, separators and stray characters are rejected")
    @ValueSource(strings = {
            "",
            "1.0.0-",
            "1.0.0+",
            "1.0.0-+meta",
            "1.0.0-alpha+",
            "1.0.0-alpha.",
            "1.0.0-.alpha",
            "1.0.0+meta.",
            "1..0",
            "1.0.",
            ".1.0",
            "1.0.0.0",
            "a.b.c",
            "1.two.3",
            "1.0.0-@beta",
            "1.0.0+build!",
            "1.0.0-alpha beta",
            "v1.0.0"
    })
    public void testRejectsMalformedSeparators(@NotNull String input) {
        assertThrows(VersionParseException.class, () -> Version.parse(input));
    }

    @ParameterizedTest
    @DisplayName("surrounding whitespace and newlines are not trimmed")
    @ValueSource(strings = {" 1.0.0", "1.0.0 ", "\t1.0.0", "1.0.0\n", "1.0.0-rc.1\r\n"})
    public void testRejectsWhitespace(@NotNull String input) {
        assertThrows(VersionParseException.class, () -> Version.parse(input));
    }

    @ParameterizedTest
    @DisplayName("non-ASCII characters are rejected")
    @ValueSource(strings = {"1.0.0-alphä", "1.0.0+büild", "١.0.0", "1.0.0-Ａ"})
    public void testRejectsNonAscii(@NotNull String input) {
        assertThrows(VersionParseException.class, () -> Version.parse(input));
    }

    @Test
    @DisplayName("leading zeros are allowed in build metadata and alphanumeric pre-release identifiers")
    public void testLeadingZerosWhereAllowed() {
        assertEquals("1.0.0+001.alpha-01", Version.parse("1.0.0+001.alpha-01").toString());
        assertEquals("1.0.0-0abc.0", Version.parse("1.0.0-0abc.0").toString());
        assertEquals("1.0.0-0", Version.parse("1.0.0-0").toString());
    }

    @Test
    @DisplayName("the message names the offending component")
    public void testErrorReasons() {
        @NotNull VersionParseException ex = assertThrows(VersionParseException.class, () -> Version.parse("01.1.1"));
        assertEquals("01.1.1", ex.getInput());
        assertTrue(ex.getReason().contains("major"), ex.getReason());
        assertTrue(ex.getReason().contains("leading zeros"), ex.getReason());

        ex = assertThrows(VersionParseException.class, () -> Version.parse("1.0.0-alpha.01"));
        assertTrue(ex.getReason().contains("pre-release"), ex.getReason());

        ex = assertThrows(VersionParseException.class, () -> Version.parse("1.0.0+build!"));
        assertTrue(ex.getReason().contains("build"), ex.getReason());
    }

    @Test
    @DisplayName("a hyphen inside the pre-release belongs to the identifier")
    public void testHyphensInPreRelease() {
        @NotNull Version v = Version.parse("1.2.3----RC-SNAPSHOT.12.9.1--.12+788");
        assertEquals("1", v.getMajor().toString());
        assertEquals("3", v.getPatch().toString());
        assertEquals("---RC-SNAPSHOT.12.9.1--.12", v.getPreRelease().orElseThrow());
        assertEquals("788", v.getBuildMeta().orElseThrow());
    }

    @Test
    @DisplayName("null input is a programming error")
    public void testNullInput() {
        assertThrows(NullPointerException.class, () -> Version.parse(null));
    }

}
