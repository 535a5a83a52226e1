package site.rstream.utils;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class GlobPatternTest {

    @ParameterizedTest
    @CsvSource({
            "*, anything, true",
            "h?llo, hello, true",
            "h?llo, heello, false",
            "h*llo, heeeello, true",
            "h[ae]llo, hallo, true",
            "h[ae]llo, hillo, false",
            "h[^e]llo, hallo, true",
            "h[^e]llo, hello, false",
            "h[a-b]llo, hbllo, true",
            "h[a-b]llo, hcllo, false",
            "user:*, user:1000, true",
            "user:*, order:1, false",
            "*:*, a:b, true"
    })
    void testMatches(final String pattern, final String text, final boolean expected) {
        final GlobPattern glob = GlobPattern.compile(pattern.getBytes(StandardCharsets.UTF_8));
        assertEquals(expected, glob.matches(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testEscape() {
        final GlobPattern glob = GlobPattern.compile("a\\*b".getBytes(StandardCharsets.UTF_8));
        assertTrue(glob.matches("a*b".getBytes(StandardCharsets.UTF_8)));
        assertFalse(glob.matches("axb".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testIgnoreCase() {
        final GlobPattern glob = GlobPattern.compileIgnoreCase("DB*".getBytes(StandardCharsets.UTF_8));
        assertTrue(glob.matches("dbfilename".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testMatchesAll() {
        assertTrue(GlobPattern.compile("*".getBytes(StandardCharsets.UTF_8)).matchesAll());
        assertFalse(GlobPattern.compile("a*".getBytes(StandardCharsets.UTF_8)).matchesAll());
    }
}
