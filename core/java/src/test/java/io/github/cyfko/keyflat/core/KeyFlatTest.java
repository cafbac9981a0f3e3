package io.github.cyfko.keyflat.core;

import io.github.cyfko.keyflat.core.api.Flattener;
import io.github.cyfko.keyflat.core.api.Unflattener;
import io.github.cyfko.keyflat.core.config.FlatPolicy;
import io.github.cyfko.keyflat.core.config.KeyFormat;
import io.github.cyfko.keyflat.core.config.StartKeyMatching;
import io.github.cyfko.keyflat.core.impl.BasicFlattener;
import io.github.cyfko.keyflat.core.impl.BasicUnflattener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static io.github.cyfko.keyflat.core.SampleStructures.of;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of flattening and unflattening through the {@link KeyFlat} entry point.
 */
@DisplayName("KeyFlat Tests")
class KeyFlatTest {

    static Stream<Arguments> formats() {
        return Stream.of(
                Arguments.of("defaults", KeyFormat.defaults()),
                Arguments.of("braces", KeyFormat.braces()),
                Arguments.of("arrows", KeyFormat.arrows()),
                Arguments.of("path", KeyFormat.path()),
                Arguments.of("open list indexes", KeyFormat.builder().suffixListEnd(false).build()),
                Arguments.of("closed map segments", KeyFormat.builder().suffixEnd(true).build())
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("formats")
    @DisplayName("Unflatten should invert flatten with the same format")
    void shouldRoundTrip(String name, KeyFormat format) {
        // Given
        Map<String, Object> source = SampleStructures.record();

        // When
        Map<String, Object> flat = KeyFlat.flatten(source, format);
        Object rebuilt = KeyFlat.unflatten(flat, format);

        // Then
        assertEquals(source, rebuilt);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("formats")
    @DisplayName("A root list should come back as a list")
    void shouldRoundTripRootList(String name, KeyFormat format) {
        // Given
        List<Object> source = List.of("x", List.of(1, 2), of("k", "v"));

        // When
        Object rebuilt = KeyFlat.unflatten(KeyFlat.flatten(source, format), format);

        // Then
        assertInstanceOf(List.class, rebuilt);
        assertEquals(source, rebuilt);
    }

    static Stream<Arguments> formatsWithListDelimiters() {
        return formats().filter(arguments -> ((KeyFormat) arguments.get()[1]).listFramingEnabled());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("formatsWithListDelimiters")
    @DisplayName("Maps keyed like list indexes should stay maps")
    void shouldKeepIndexLikeMapKeys(String name, KeyFormat format) {
        // Given
        Map<String, Object> source = of(
                "a", of("0", "x", "1", "y"),
                "b", List.of("x", "y"),
                "c", List.of(of("0", true))
        );

        // When
        Object rebuilt = KeyFlat.unflatten(KeyFlat.flatten(source, format), format);

        // Then
        assertEquals(source, rebuilt);
        assertInstanceOf(Map.class, ((Map<?, ?>) rebuilt).get("a"));
    }

    @Test
    @DisplayName("Should round trip below a start key with literal matching")
    void shouldRoundTripBelowStartKey() {
        // Given
        String startKey = "https://example.com/";
        Flattener flattener = KeyFlat.flattener(KeyFormat.path());
        Unflattener unflattener = KeyFlat.unflattener(KeyFormat.path(),
                FlatPolicy.builder().startKeyMatching(StartKeyMatching.LITERAL_PREFIX).build());

        // When
        Map<String, Object> flat = flattener.flatten(SampleStructures.record(), startKey);

        // Then
        assertTrue(flat.keySet().stream().allMatch(key -> key.startsWith(startKey)));
        assertEquals(SampleStructures.record(), unflattener.unflatten(flat, startKey));
    }

    @Test
    @DisplayName("Should produce one entry per leaf, empty containers counted as leaves")
    void shouldProduceOneEntryPerLeaf() {
        // Given
        Map<String, Object> source = of(
                "a", 1,
                "b", List.of(of("c", 2, "d", List.of()), Map.of()),
                "e", of("f", of("g", null))
        );

        // When
        Map<String, Object> flat = KeyFlat.flattener().flatten(source);

        // Then
        assertEquals(5, flat.size());
    }

    @Test
    @DisplayName("Flattening twice should give identical mappings in identical order")
    void flatteningShouldBeRepeatable() {
        // Given
        Flattener flattener = KeyFlat.flattener(KeyFormat.braces());

        // When
        Map<String, Object> first = flattener.flatten(SampleStructures.record());
        Map<String, Object> second = flattener.flatten(SampleStructures.record());

        // Then
        assertEquals(new ArrayList<>(first.entrySet()), new ArrayList<>(second.entrySet()));
    }

    @Test
    @DisplayName("Factory methods should carry the requested format and policy")
    void factoriesShouldCarryConfiguration() {
        // When
        Flattener flattener = KeyFlat.flattener(KeyFormat.braces(), FlatPolicy.relaxed());
        Unflattener unflattener = KeyFlat.unflattener(KeyFormat.arrows(), FlatPolicy.strict());

        // Then
        assertInstanceOf(BasicFlattener.class, flattener);
        assertInstanceOf(BasicUnflattener.class, unflattener);
        assertEquals(KeyFormat.braces(), flattener.getKeyFormat());
        assertEquals(FlatPolicy.relaxed(), ((BasicFlattener) flattener).getFlatPolicy());
        assertEquals(KeyFormat.arrows(), unflattener.getKeyFormat());
        assertEquals(FlatPolicy.strict(), ((BasicUnflattener) unflattener).getFlatPolicy());
        assertEquals(KeyFormat.defaults(), KeyFlat.flattener().getKeyFormat());
        assertEquals(KeyFormat.defaults(), KeyFlat.unflattener().getKeyFormat());
    }

    @Test
    @DisplayName("A format without delimiters should still flatten")
    void formatWithoutDelimitersShouldStillFlatten() {
        KeyFormat format = new KeyFormat("", "", false, "", "", true);

        assertEquals(Map.of("ab", 1), KeyFlat.flatten(of("a", of("b", 1)), format));
    }
}
