package io.github.cyfko.keyflat.core.config;

import io.github.cyfko.keyflat.core.exception.AmbiguousKeyFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Key-format configuration shared by flattening and unflattening.
 * <p>
 * Six settings control how a nesting path is rendered into a flat key. Keyed (map) segments are
 * framed with {@code prefix}/{@code suffix}, list-index segments with {@code prefixList}/{@code suffixList}.
 * The two {@code *End} flags decide whether the closing literal is also written after a terminal segment.
 * </p>
 *
 * <h2>Defaults</h2>
 * <table border="1">
 * <caption>Key format settings</caption>
 * <thead>
 * <tr><th>Setting</th><th>Option name</th><th>Default</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>prefix</td><td>{@code prefix}</td><td>{@code ""}</td></tr>
 * <tr><td>suffix</td><td>{@code suffix}</td><td>{@code "."}</td></tr>
 * <tr><td>suffixEnd</td><td>{@code suffix-end}</td><td>{@code false}</td></tr>
 * <tr><td>prefixList</td><td>{@code prefix-list}</td><td>{@code "["}</td></tr>
 * <tr><td>suffixList</td><td>{@code suffix-list}</td><td>{@code "]"}</td></tr>
 * <tr><td>suffixListEnd</td><td>{@code suffix-list-end}</td><td>{@code true}</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * KeyFormat.defaults();   // {assokey: ["Foo"]} -> "assokey[0]"
 * KeyFormat.braces();     // {assokey: ["Foo"]} -> "{assokey}[0]"
 * KeyFormat.arrows();     // {a: {b: 1}}        -> "a->b"
 * KeyFormat.path();       // {a: {b: 1}}        -> "a/b/"
 *
 * // Custom, unset settings fall back to the defaults
 * KeyFormat format = KeyFormat.builder()
 *     .suffix("_")
 *     .suffixEnd(true)
 *     .build();
 * }</pre>
 *
 * <p>The same format must be used to flatten and to unflatten a given mapping.</p>
 *
 * @param prefix        literal written before each keyed segment
 * @param suffix        literal written after each keyed segment
 * @param suffixEnd     whether {@code suffix} is written after a terminal keyed segment
 * @param prefixList    literal written before each list-index segment
 * @param suffixList    literal written after each list-index segment
 * @param suffixListEnd whether {@code suffixList} is written after a terminal list-index segment
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record KeyFormat(
        String prefix,
        String suffix,
        boolean suffixEnd,
        String prefixList,
        String suffixList,
        boolean suffixListEnd
) {

    public static final String DEFAULT_PREFIX = "";
    public static final String DEFAULT_SUFFIX = ".";
    public static final boolean DEFAULT_SUFFIX_END = false;
    public static final String DEFAULT_PREFIX_LIST = "[";
    public static final String DEFAULT_SUFFIX_LIST = "]";
    public static final boolean DEFAULT_SUFFIX_LIST_END = true;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any literal is {@code null}
     */
    public KeyFormat {
        requireLiteral(prefix, "prefix");
        requireLiteral(suffix, "suffix");
        requireLiteral(prefixList, "prefixList");
        requireLiteral(suffixList, "suffixList");
    }

    public static KeyFormat defaults() {
        return builder().build();
    }

    /**
     * Braced keys with closing literals on every segment: {@code {properties}{geo}{latitude}}.
     *
     * @return braces preset
     */
    public static KeyFormat braces() {
        return new KeyFormat("{", "}", true, "[", "]", true);
    }

    /**
     * Arrow-separated keys, lists framed like maps: {@code properties->collections->0->1}.
     *
     * @return arrows preset
     */
    public static KeyFormat arrows() {
        return new KeyFormat("", "->", false, "", "", true);
    }

    /**
     * Slash-terminated path keys, suitable below a URL start key: {@code properties/geo/latitude/}.
     *
     * @return path preset
     */
    public static KeyFormat path() {
        return new KeyFormat("", "/", true, "", "", true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a format from option names as used by untyped configuration sources.
     * <p>
     * Recognised names are {@code prefix}, {@code suffix}, {@code suffix-end}, {@code prefix-list},
     * {@code suffix-list} and {@code suffix-list-end}. A {@code null} value counts as absent and the
     * default applies. Flags accept a {@link Boolean} or the strings {@code "true"}/{@code "false"}.
     * </p>
     *
     * @param options option map, must not be null
     * @return the resulting format
     * @throws IllegalArgumentException on an unknown option name or a value of the wrong type
     */
    public static KeyFormat fromOptions(Map<String, ?> options) {
        if (options == null) {
            throw new IllegalArgumentException("Options map is required");
        }

        Builder builder = builder();
        for (Map.Entry<String, ?> option : options.entrySet()) {
            String name = option.getKey();
            Object value = option.getValue();
            if (value == null) {
                continue;
            }
            switch (String.valueOf(name)) {
                case "prefix" -> builder.prefix(asLiteral(name, value));
                case "suffix" -> builder.suffix(asLiteral(name, value));
                case "suffix-end" -> builder.suffixEnd(asFlag(name, value));
                case "prefix-list" -> builder.prefixList(asLiteral(name, value));
                case "suffix-list" -> builder.suffixList(asLiteral(name, value));
                case "suffix-list-end" -> builder.suffixListEnd(asFlag(name, value));
                default -> throw new IllegalArgumentException("Unknown key format option: " + name);
            }
        }
        return builder.build();
    }

    /**
     * Whether list containers get their own framing. When both list literals are empty, lists are
     * rendered exactly like maps, with their indexes as keys.
     *
     * @return true if {@code prefixList} or {@code suffixList} is non-empty
     */
    public boolean listFramingEnabled() {
        return !prefixList.isEmpty() || !suffixList.isEmpty();
    }

    /**
     * Returns the canonical separator used when re-splitting a flat key: the first non-empty of
     * {@code suffix}, {@code prefix}, {@code prefixList}, {@code suffixList}.
     *
     * @return the splitter literal
     * @throws AmbiguousKeyFormatException if all four literals are empty
     */
    public String splitter() {
        for (String literal : List.of(suffix, prefix, prefixList, suffixList)) {
            if (!literal.isEmpty()) {
                return literal;
            }
        }
        throw noDelimiter();
    }

    /**
     * Checks that at least one delimiter literal is configured, which unflattening needs to split keys.
     *
     * @return this format
     * @throws AmbiguousKeyFormatException if all four literals are empty
     */
    public KeyFormat requireDelimiter() {
        if (prefix.isEmpty() && suffix.isEmpty() && prefixList.isEmpty() && suffixList.isEmpty()) {
            throw noDelimiter();
        }
        return this;
    }

    /**
     * Returns the non-empty delimiter literals, in splitter priority order.
     *
     * @return unmodifiable list of delimiters, possibly empty
     */
    public List<String> delimiters() {
        List<String> delimiters = new ArrayList<>(4);
        for (String literal : List.of(suffix, prefix, prefixList, suffixList)) {
            if (!literal.isEmpty()) {
                delimiters.add(literal);
            }
        }
        return Collections.unmodifiableList(delimiters);
    }

    private static AmbiguousKeyFormatException noDelimiter() {
        return new AmbiguousKeyFormatException(
                "Key format has no delimiter: suffix, prefix, prefix-list and suffix-list are all empty");
    }

    private static void requireLiteral(String literal, String name) {
        if (literal == null) {
            throw new IllegalArgumentException(name + " must not be null (use an empty string instead)");
        }
    }

    private static String asLiteral(String name, Object value) {
        if (value instanceof CharSequence || value instanceof Character) {
            return value.toString();
        }
        throw new IllegalArgumentException(String.format(
                "Option '%s' expects a string, got %s", name, value.getClass().getSimpleName()));
    }

    private static boolean asFlag(String name, Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized) || "false".equals(normalized)) {
                return Boolean.parseBoolean(normalized);
            }
        }
        throw new IllegalArgumentException(String.format(
                "Option '%s' expects a boolean, got '%s'", name, value));
    }

    /**
     * Builder for {@link KeyFormat}. Settings left unset are filled with the defaults on {@link #build()};
     * explicitly set values, including empty strings and {@code false}, are kept as given.
     */
    public static final class Builder {
        private String prefix;
        private String suffix;
        private Boolean suffixEnd;
        private String prefixList;
        private String suffixList;
        private Boolean suffixListEnd;

        private Builder() {}

        public Builder prefix(String prefix) { this.prefix = prefix; return this; }
        public Builder suffix(String suffix) { this.suffix = suffix; return this; }
        public Builder suffixEnd(boolean suffixEnd) { this.suffixEnd = suffixEnd; return this; }
        public Builder prefixList(String prefixList) { this.prefixList = prefixList; return this; }
        public Builder suffixList(String suffixList) { this.suffixList = suffixList; return this; }
        public Builder suffixListEnd(boolean suffixListEnd) { this.suffixListEnd = suffixListEnd; return this; }

        public KeyFormat build() {
            return new KeyFormat(
                    prefix != null ? prefix : DEFAULT_PREFIX,
                    suffix != null ? suffix : DEFAULT_SUFFIX,
                    suffixEnd != null ? suffixEnd : DEFAULT_SUFFIX_END,
                    prefixList != null ? prefixList : DEFAULT_PREFIX_LIST,
                    suffixList != null ? suffixList : DEFAULT_SUFFIX_LIST,
                    suffixListEnd != null ? suffixListEnd : DEFAULT_SUFFIX_LIST_END
            );
        }
    }
}
