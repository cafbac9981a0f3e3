package io.github.cyfko.keyflat.core.parsing;

import io.github.cyfko.keyflat.core.config.KeyFormat;
import io.github.cyfko.keyflat.core.exception.AmbiguousKeyFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeySegmentScanner Tests")
class KeySegmentScannerTest {

    static Stream<Arguments> keysPerFormat() {
        return Stream.of(
                Arguments.of(KeyFormat.defaults(), "name", List.of("name")),
                Arguments.of(KeyFormat.defaults(), "properties.geo.latitude", List.of("properties", "geo", "latitude")),
                Arguments.of(KeyFormat.defaults(), "properties.collections[0][1]", List.of("properties", "collections", "0", "1")),
                Arguments.of(KeyFormat.defaults(), "items[0]name", List.of("items", "0", "name")),
                Arguments.of(KeyFormat.braces(), "{properties}{collections}[1][0]", List.of("properties", "collections", "1", "0")),
                Arguments.of(KeyFormat.arrows(), "properties->geo->latitude", List.of("properties", "geo", "latitude")),
                Arguments.of(KeyFormat.path(), "properties/collections/0/1/", List.of("properties", "collections", "0", "1"))
        );
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("keysPerFormat")
    @DisplayName("Should split flat keys produced by each preset")
    void shouldSplitKeys(KeyFormat format, String key, List<String> expected) {
        assertEquals(expected, KeySegmentScanner.of(format).scan(key));
    }

    @Test
    @DisplayName("Should collapse a mixture of delimiters into one split point")
    void shouldCollapseMixedDelimiters() {
        KeySegmentScanner scanner = KeySegmentScanner.of(KeyFormat.defaults());

        assertEquals(List.of("a", "0", "b"), scanner.scan("a.[0]..b"));
        assertEquals(List.of("a", "b"), scanner.scan("a][.b"));
    }

    @Test
    @DisplayName("Should drop delimiters at both ends")
    void shouldTrimDelimiters() {
        assertEquals(List.of("a", "b"), KeySegmentScanner.of(KeyFormat.defaults()).scan("..a.b[]"));
    }

    @Test
    @DisplayName("Should return no segment for a key made only of delimiters")
    void shouldReturnNoSegmentForDelimitersOnly() {
        KeySegmentScanner scanner = KeySegmentScanner.of(KeyFormat.defaults());

        assertTrue(scanner.scan("").isEmpty());
        assertTrue(scanner.scan(".[]").isEmpty());
    }

    @Test
    @DisplayName("Characters of multi-character delimiters should each act as separators")
    void multiCharacterDelimitersShouldSplitOnEachCharacter() {
        KeySegmentScanner scanner = KeySegmentScanner.of(KeyFormat.arrows());

        assertTrue(scanner.isSeparator('-'));
        assertTrue(scanner.isSeparator('>'));
        assertFalse(scanner.isSeparator('.'));
        assertEquals(List.of("a", "b"), scanner.scan("a>b"));
    }

    @Test
    @DisplayName("Should flag segments framed by list delimiters")
    void shouldFlagListIndexes() {
        KeySegmentScanner scanner = KeySegmentScanner.of(KeyFormat.defaults());

        assertEquals(List.of(
                new KeySegmentScanner.Segment("items", false),
                new KeySegmentScanner.Segment("0", true),
                new KeySegmentScanner.Segment("name", false),
                new KeySegmentScanner.Segment("1", false)
        ), scanner.segments("items[0]name.1"));
        assertEquals(List.of(new KeySegmentScanner.Segment("a", false), new KeySegmentScanner.Segment("0", true)),
                scanner.segments("a.[0"));
        assertEquals(List.of(new KeySegmentScanner.Segment("0", true)), scanner.segments("0]"));
    }

    @Test
    @DisplayName("List index tracking should depend on list characters of their own")
    void shouldTrackListIndexesOnlyWithDedicatedCharacters() {
        assertTrue(KeySegmentScanner.of(KeyFormat.defaults()).tracksListIndexes());
        assertTrue(KeySegmentScanner.of(KeyFormat.braces()).tracksListIndexes());
        assertFalse(KeySegmentScanner.of(KeyFormat.arrows()).tracksListIndexes());
        assertFalse(KeySegmentScanner.of(new KeyFormat("", ".", false, ".", "", true)).tracksListIndexes());
        assertFalse(KeySegmentScanner.of(KeyFormat.braces()).segments("{a}{0}").get(1).listIndex());
    }

    @Test
    @DisplayName("Should keep regex metacharacters literal")
    void shouldKeepRegexMetacharactersLiteral() {
        KeyFormat format = new KeyFormat("", "|", false, "(", ")", true);

        assertEquals(List.of("a", "b", "0"), KeySegmentScanner.of(format).scan("a|b(0)"));
        assertEquals(List.of("a.b"), KeySegmentScanner.of(format).scan("a.b"));
    }

    @Test
    @DisplayName("Should refuse a format without delimiters")
    void shouldRefuseFormatWithoutDelimiters() {
        KeyFormat format = new KeyFormat("", "", false, "", "", false);

        assertThrows(AmbiguousKeyFormatException.class, () -> KeySegmentScanner.of(format));
    }
}
