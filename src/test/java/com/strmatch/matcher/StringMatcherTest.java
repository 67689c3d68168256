package com.strmatch.matcher;

import com.strmatch.exception.InvalidPatternException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StringMatcher construction, matching and printing.
 */
class StringMatcherTest {

    private static final String[] SAMPLES = {"", "a", "highway", "Highway", "foo bar", "ünïcödé"};

    // =====================================================================
    // Constant matchers
    // =====================================================================

    @Nested
    @DisplayName("Constant matchers")
    class ConstantMatchers {

        @ParameterizedTest
        @ValueSource(strings = {"", "a", "highway", "anything at all"})
        @DisplayName("always_true matches everything, always_false nothing")
        void constantsIgnoreInput(String input) {
            assertTrue(StringMatcher.alwaysTrue().matches(input));
            assertFalse(StringMatcher.alwaysFalse().matches(input));
        }

        @Test
        @DisplayName("Default constructor never matches")
        void defaultNeverMatches() {
            StringMatcher matcher = new StringMatcher();

            assertEquals(MatcherType.ALWAYS_FALSE, matcher.getType());
            for (String s : SAMPLES) {
                assertFalse(matcher.matches(s));
            }
        }

        @Test
        @DisplayName("Boolean constructor behaves like the named constants")
        void booleanConstructor() {
            for (String s : SAMPLES) {
                assertEquals(StringMatcher.alwaysTrue().matches(s), StringMatcher.of(true).matches(s));
                assertEquals(StringMatcher.alwaysFalse().matches(s), StringMatcher.of(false).matches(s));
            }
            assertEquals(MatcherType.ALWAYS_TRUE, StringMatcher.of(true).getType());
            assertEquals(MatcherType.ALWAYS_FALSE, StringMatcher.of(false).getType());
        }
    }

    // =====================================================================
    // Text matchers
    // =====================================================================

    @Nested
    @DisplayName("Equal matcher")
    class Equal {

        @Test
        @DisplayName("String shortcut is a case-sensitive exact match")
        void exactMatch() {
            StringMatcher matcher = StringMatcher.of("highway");

            assertEquals(MatcherType.EQUAL, matcher.getType());
            assertTrue(matcher.matches("highway"));
            assertFalse(matcher.matches("Highway"));
            assertFalse(matcher.matches("highways"));
            assertFalse(matcher.matches("high"));
            assertFalse(matcher.matches(""));
        }

        @Test
        @DisplayName("Every sample matches itself and nothing else")
        void matchesOnlyItself() {
            for (String s : SAMPLES) {
                StringMatcher matcher = StringMatcher.equal(s);
                for (String t : SAMPLES) {
                    assertEquals(s.equals(t), matcher.matches(t), () -> "equal[" + s + "] vs " + t);
                }
            }
        }

        @Test
        @DisplayName("Empty value matches only the empty string")
        void emptyValue() {
            StringMatcher matcher = StringMatcher.equal("");

            assertTrue(matcher.matches(""));
            assertFalse(matcher.matches(" "));
        }
    }

    @Nested
    @DisplayName("Prefix matcher")
    class Prefix {

        @Test
        @DisplayName("Matches strings starting with the prefix")
        void matchesPrefix() {
            StringMatcher matcher = StringMatcher.prefix("foot");

            assertTrue(matcher.matches("footway"));
            assertTrue(matcher.matches("foot"));
            assertFalse(matcher.matches("sidewalk"));
            assertFalse(matcher.matches("foo"));
            assertFalse(matcher.matches("Footway"));
        }

        @ParameterizedTest
        @CsvSource({
                "foot, way",
                "foot, ''",
                "'', anything",
                "'', ''"
        })
        @DisplayName("Prefix followed by any suffix matches")
        void prefixPlusSuffix(String prefix, String suffix) {
            assertTrue(StringMatcher.prefix(prefix).matches(prefix + suffix));
        }

        @Test
        @DisplayName("Empty prefix matches everything")
        void emptyPrefix() {
            StringMatcher matcher = StringMatcher.prefix("");
            for (String s : SAMPLES) {
                assertTrue(matcher.matches(s));
            }
        }
    }

    @Nested
    @DisplayName("Substring matcher")
    class Substring {

        @ParameterizedTest
        @CsvSource({
                "way, foot, ''",
                "way, '', side",
                "_link, motorway, ''",
                "a, b, c",
                "'', x, y"
        })
        @DisplayName("Substring surrounded by anything matches")
        void surrounded(String sub, String before, String after) {
            assertTrue(StringMatcher.substring(sub).matches(before + sub + after));
        }

        @Test
        @DisplayName("Missing substring does not match")
        void missing() {
            StringMatcher matcher = StringMatcher.substring("_link");

            assertTrue(matcher.matches("primary_link"));
            assertFalse(matcher.matches("primary"));
            assertFalse(matcher.matches("_lin"));
        }

        @Test
        @DisplayName("Empty substring matches everything")
        void emptySubstring() {
            StringMatcher matcher = StringMatcher.substring("");
            for (String s : SAMPLES) {
                assertTrue(matcher.matches(s));
            }
        }
    }

    // =====================================================================
    // List and regex matchers
    // =====================================================================

    @Nested
    @DisplayName("List matcher")
    class ListMatching {

        @Test
        @DisplayName("Matches any member exactly")
        void membership() {
            StringMatcher matcher = StringMatcher.of(List.of("primary", "secondary", "tertiary"));

            assertEquals(MatcherType.LIST, matcher.getType());
            assertTrue(matcher.matches("secondary"));
            assertFalse(matcher.matches("residential"));
            assertFalse(matcher.matches("Secondary"));
            assertFalse(matcher.matches(""));
        }

        @Test
        @DisplayName("Empty list never matches")
        void emptyList() {
            StringMatcher matcher = StringMatcher.of(List.of());
            for (String s : SAMPLES) {
                assertFalse(matcher.matches(s));
            }
        }

        @Test
        @DisplayName("Source list is copied at construction")
        void copiesSource() {
            List<String> source = new ArrayList<>(List.of("a"));
            StringMatcher matcher = StringMatcher.of(source);
            source.add("b");

            assertFalse(matcher.matches("b"));
            assertEquals("list[[a]]", matcher.describe());
        }

        @Test
        @DisplayName("Adding to the held list extends membership")
        void addExtendsMembership() {
            ListMatcher list = new ListMatcher(List.of("x", "y"));
            StringMatcher matcher = StringMatcher.of(list);
            assertFalse(matcher.matches("z"));

            list.add("z");

            assertTrue(matcher.matches("z"));
            assertEquals("list[[x][y][z]]", matcher.describe());
        }
    }

    @Nested
    @DisplayName("Regex matcher")
    class RegexMatching {

        @Test
        @DisplayName("Anchored pattern matches whole word")
        void anchored() {
            StringMatcher matcher = StringMatcher.regex("^res.*ial$");

            assertEquals(MatcherType.REGEX, matcher.getType());
            assertTrue(matcher.matches("residential"));
            assertFalse(matcher.matches("not residential"));
        }

        @Test
        @DisplayName("Unanchored pattern is searched anywhere")
        void searchSemantics() {
            StringMatcher matcher = StringMatcher.of(Pattern.compile("way"));

            assertTrue(matcher.matches("footway"));
            assertTrue(matcher.matches("waymarked"));
            assertTrue(matcher.matches("a way b"));
            assertFalse(matcher.matches("road"));
        }

        @Test
        @DisplayName("Uncompilable pattern fails at construction")
        void invalidPattern() {
            InvalidPatternException e = assertThrows(InvalidPatternException.class,
                    () -> StringMatcher.regex("(unclosed"));

            assertEquals("(unclosed", e.getPattern());
            assertNotNull(e.getCause());
        }
    }

    // =====================================================================
    // Calling conventions
    // =====================================================================

    @Test
    @DisplayName("String and other CharSequence inputs give identical results")
    void charSequenceViews() {
        List<StringMatcher> matchers = List.of(
                StringMatcher.alwaysTrue(),
                StringMatcher.alwaysFalse(),
                StringMatcher.equal("highway"),
                StringMatcher.prefix("high"),
                StringMatcher.substring("way"),
                StringMatcher.regex("g.w"),
                StringMatcher.anyOf("highway", "road"));

        for (StringMatcher matcher : matchers) {
            for (String s : new String[]{"highway", "road", "track", ""}) {
                boolean expected = matcher.matches(s);
                assertEquals(expected, matcher.matches(new StringBuilder(s)), matcher::describe);
                assertEquals(expected, matcher.test(s), matcher::describe);
            }
        }
    }

    @Test
    @DisplayName("Null input is rejected")
    void nullInput() {
        assertThrows(NullPointerException.class, () -> StringMatcher.alwaysTrue().matches(null));
    }

    @Test
    @DisplayName("Works as a stream filter predicate")
    void predicate() {
        List<String> kept = List.of("footway", "primary", "foot", "road").stream()
                .filter(StringMatcher.prefix("foot"))
                .toList();

        assertEquals(List.of("footway", "foot"), kept);
    }

    // =====================================================================
    // Diagnostic output
    // =====================================================================

    @ParameterizedTest
    @CsvSource({
            "always_false, ALWAYS_FALSE",
            "always_true, ALWAYS_TRUE",
            "equal[foo], EQUAL",
            "prefix[foo], PREFIX",
            "substring[foo], SUBSTRING",
            "regex, REGEX",
            "list[[a][b]], LIST"
    })
    @DisplayName("describe() output is exact per matcher type")
    void describe(String expected, MatcherType type) {
        StringMatcher matcher = switch (type) {
            case ALWAYS_FALSE -> StringMatcher.alwaysFalse();
            case ALWAYS_TRUE -> StringMatcher.alwaysTrue();
            case EQUAL -> StringMatcher.of("foo");
            case PREFIX -> StringMatcher.prefix("foo");
            case SUBSTRING -> StringMatcher.substring("foo");
            case REGEX -> StringMatcher.regex("fo+");
            case LIST -> StringMatcher.of(List.of("a", "b"));
        };

        assertEquals(expected, matcher.describe());
        assertEquals(expected, matcher.toString());
    }

    @Test
    @DisplayName("List printing keeps order and duplicates")
    void listPrintOrder() {
        assertEquals("list[[b][a][b]]", StringMatcher.anyOf("b", "a", "b").describe());
        assertEquals("list[]", StringMatcher.of(List.of()).describe());
    }

    @Test
    @DisplayName("print() writes describe() into the sink")
    void printToSink() {
        StringBuilder sb = new StringBuilder("matcher=");
        StringMatcher.prefix("foot").print(sb);
        assertEquals("matcher=prefix[foot]", sb.toString());

        StringWriter writer = StringMatcher.anyOf("a").print(new StringWriter());
        assertEquals("list[[a]]", writer.toString());
    }

    @Test
    @DisplayName("print() surfaces sink failures")
    void printFailure() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        assertThrows(UncheckedIOException.class, () -> StringMatcher.alwaysTrue().print(broken));
    }

    @Test
    @DisplayName("Matchers with the same strategy and data are equal")
    void valueEquality() {
        assertEquals(StringMatcher.of("foo"), StringMatcher.equal("foo"));
        assertEquals(StringMatcher.of("foo").hashCode(), StringMatcher.equal("foo").hashCode());
        assertEquals(StringMatcher.of(true), StringMatcher.alwaysTrue());
        assertEquals(StringMatcher.regex("a+"), StringMatcher.regex("a+"));
        assertEquals(StringMatcher.anyOf("a", "b"), StringMatcher.of(List.of("a", "b")));

        assertNotEquals(StringMatcher.equal("foo"), StringMatcher.prefix("foo"));
        assertNotEquals(StringMatcher.prefix("foo"), StringMatcher.substring("foo"));
        assertNotEquals(StringMatcher.anyOf("a", "b"), StringMatcher.anyOf("b", "a"));
    }
}
