package io.github.cyfko.keyflat.core.parsing;

import io.github.cyfko.keyflat.core.config.KeyFormat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Single-pass splitter turning a flat key back into its path segments.
 * <p>
 * Every character of every configured delimiter ({@code suffix}, {@code prefix}, {@code prefixList},
 * {@code suffixList}) is a separator character. A maximal run of separator characters, whatever its
 * mixture, counts as one split point, and runs at both ends of the key are dropped. The result is the
 * sequence of non-separator runs:
 * </p>
 * <pre>
 * defaults: "properties.collections[0][1]"  → [properties, collections, 0, 1]
 * braces:   "{properties}{geo}{latitude}"   → [properties, geo, latitude]
 * arrows:   "properties-&gt;geo-&gt;latitude"    → [properties, geo, latitude]
 * </pre>
 *
 * <p>
 * {@link #segments(String)} also tells which segments were written as list indexes. A segment is a
 * list index when the run before it holds a {@code prefixList} character, or the run after it holds a
 * {@code suffixList} character. Characters shared with {@code prefix} or {@code suffix} are ignored for
 * this purpose, so a format whose list literals only reuse map characters does not
 * {@linkplain #tracksListIndexes() track list indexes} at all.
 * </p>
 *
 * <p><strong>Performance characteristics:</strong></p>
 * <ul>
 *   <li>Time: O(n) where n = key length</li>
 *   <li>No regex matching, separators are looked up in small sorted char arrays</li>
 * </ul>
 *
 * <p>Instances are immutable and can be shared across threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class KeySegmentScanner {

    private final char[] separators;
    private final char[] listOpeners;
    private final char[] listClosers;

    private KeySegmentScanner(char[] separators, char[] listOpeners, char[] listClosers) {
        this.separators = separators;
        this.listOpeners = listOpeners;
        this.listClosers = listClosers;
    }

    /**
     * Creates a scanner for the delimiters of the given format.
     *
     * @param format the key format, must declare at least one delimiter
     * @return a scanner splitting on the format's delimiter characters
     * @throws io.github.cyfko.keyflat.core.exception.AmbiguousKeyFormatException if the format has no delimiter
     */
    public static KeySegmentScanner of(KeyFormat format) {
        String mapChars = format.prefix() + format.suffix();
        return new KeySegmentScanner(
                charsOf(String.join("", format.requireDelimiter().delimiters()), ""),
                charsOf(format.prefixList(), mapChars),
                charsOf(format.suffixList(), mapChars));
    }

    /**
     * Splits a key into its segment names.
     *
     * @param key the flat key, start key already removed
     * @return the segments in path order, empty if the key consists of separators only
     */
    public List<String> scan(String key) {
        List<Segment> segments = segments(key);
        List<String> names = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            names.add(segment.name());
        }
        return names;
    }

    /**
     * Splits a key into its segments, each flagged with whether list delimiters framed it.
     *
     * @param key the flat key, start key already removed
     * @return the segments in path order, empty if the key consists of separators only
     */
    public List<Segment> segments(String key) {
        List<Segment> segments = new ArrayList<>();
        int start = -1;
        boolean opens = false;
        boolean closes = false;
        boolean listIndex = false;

        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (isSeparator(c)) {
                if (start >= 0) {
                    segments.add(new Segment(key.substring(start, i), listIndex));
                    start = -1;
                }
                opens |= contains(listOpeners, c);
                closes |= contains(listClosers, c);
            } else if (start < 0) {
                markClosed(segments, closes);
                listIndex = opens;
                opens = false;
                closes = false;
                start = i;
            }
        }

        if (start >= 0) {
            segments.add(new Segment(key.substring(start), listIndex));
        } else {
            markClosed(segments, closes);
        }
        return segments;
    }

    /**
     * Whether this scanner can tell list indexes from map keys, that is whether the format has list
     * delimiter characters of its own.
     *
     * @return true if {@link Segment#listIndex()} carries information
     */
    public boolean tracksListIndexes() {
        return listOpeners.length > 0 || listClosers.length > 0;
    }

    boolean isSeparator(char c) {
        return contains(separators, c);
    }

    private static void markClosed(List<Segment> segments, boolean closes) {
        int last = segments.size() - 1;
        if (closes && last >= 0 && !segments.get(last).listIndex()) {
            segments.set(last, new Segment(segments.get(last).name(), true));
        }
    }

    private static boolean contains(char[] sorted, char c) {
        return Arrays.binarySearch(sorted, c) >= 0;
    }

    private static char[] charsOf(String literals, String excluded) {
        StringBuilder chars = new StringBuilder();
        for (int i = 0; i < literals.length(); i++) {
            char c = literals.charAt(i);
            if (excluded.indexOf(c) < 0 && chars.indexOf(String.valueOf(c)) < 0) {
                chars.append(c);
            }
        }
        char[] result = chars.toString().toCharArray();
        Arrays.sort(result);
        return result;
    }

    /**
     * One path segment of a flat key.
     *
     * @param name      the segment text
     * @param listIndex whether list delimiters framed the segment
     */
    public record Segment(String name, boolean listIndex) {}
}
