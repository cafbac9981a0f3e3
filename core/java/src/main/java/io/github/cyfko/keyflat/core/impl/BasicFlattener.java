package io.github.cyfko.keyflat.core.impl;

import io.github.cyfko.keyflat.core.api.Flattener;
import io.github.cyfko.keyflat.core.config.FlatPolicy;
import io.github.cyfko.keyflat.core.config.KeyFormat;
import io.github.cyfko.keyflat.core.exception.NestingDepthExceededException;
import io.github.cyfko.keyflat.core.utils.ContainerUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default recursive {@link Flattener}.
 * <p>
 * For every container the framing literals are chosen once: lists (when the format enables list
 * framing) use {@code prefixList}/{@code suffixList}/{@code suffixListEnd}, maps use
 * {@code prefix}/{@code suffix}/{@code suffixEnd}. A key is then built as
 * {@code startKey + prefix + key}, followed by the suffix when the value is a non-empty container
 * (always) or a leaf (only when the end flag is set).
 * </p>
 *
 * <pre>
 * .-------------&gt; start key
 * |.------------&gt; prefix
 * ||       .----&gt; suffix, only if suffixEnd
 * ||       |.---&gt; prefixList
 * ||       || .-&gt; suffixList, only if suffixListEnd
 * ||       || |
 * ${assokey}[0] =&gt; "Foo"
 * </pre>
 *
 * <p>When a list is entered from a keyed segment and {@code suffixEnd} is false, the trailing map
 * suffix is removed first, so {@code {a: [1]}} gives {@code a[0]} and not {@code a.[0]}.</p>
 *
 * <p>Instances are immutable and thread-safe; each call writes into its own destination.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFlattener implements Flattener {

    private static final Logger log = Logger.getLogger(BasicFlattener.class.getName());

    private final KeyFormat keyFormat;
    private final FlatPolicy flatPolicy;

    public BasicFlattener() {
        this(KeyFormat.defaults(), FlatPolicy.defaults());
    }

    public BasicFlattener(KeyFormat keyFormat) {
        this(keyFormat, FlatPolicy.defaults());
    }

    /**
     * @param keyFormat  key rendering settings
     * @param flatPolicy depth limit and list inference settings
     * @throws NullPointerException if any argument is null
     */
    public BasicFlattener(KeyFormat keyFormat, FlatPolicy flatPolicy) {
        this.keyFormat = Objects.requireNonNull(keyFormat, "Key format is required");
        this.flatPolicy = Objects.requireNonNull(flatPolicy, "Flat policy is required");
    }

    @Override
    public Map<String, Object> flatten(Object source, String startKey) {
        Map<String, Object> destination = new LinkedHashMap<>();
        flattenInto(source, destination, startKey);
        return destination;
    }

    @Override
    public void flattenInto(Object source, Map<String, Object> destination, String startKey) {
        Objects.requireNonNull(destination, "Destination cannot be null");

        if (!ContainerUtils.isContainer(source)) {
            log.fine(() -> String.format(
                    "Nothing to flatten: source of type %s is not a container",
                    source == null ? "null" : source.getClass().getName()));
            return;
        }

        int sizeBefore = destination.size();
        long start = System.nanoTime();

        walk(source, destination, startKey == null ? "" : startKey, 1);

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.fine(() -> String.format(
                "Flattened into %d entries in %d ms",
                destination.size() - sizeBefore, durationMs));
    }

    @Override
    public KeyFormat getKeyFormat() {
        return keyFormat;
    }

    public FlatPolicy getFlatPolicy() {
        return flatPolicy;
    }

    private void walk(Object container, Map<String, Object> destination, String startKey, int depth) {
        if (depth > flatPolicy.maxDepth()) {
            throw new NestingDepthExceededException(flatPolicy.maxDepth(), flatPolicy.policyName(), startKey);
        }

        final String prefix;
        final String suffix;
        final boolean suffixEnd;
        final String base;

        if (keyFormat.listFramingEnabled() && ContainerUtils.isList(container, flatPolicy.inferListsFromKeys())) {
            base = keyFormat.suffixEnd() ? startKey : stripTrailing(startKey, keyFormat.suffix());
            prefix = keyFormat.prefixList();
            suffix = keyFormat.suffixList();
            suffixEnd = keyFormat.suffixListEnd();
        } else {
            base = startKey;
            prefix = keyFormat.prefix();
            suffix = keyFormat.suffix();
            suffixEnd = keyFormat.suffixEnd();
        }

        ContainerUtils.forEachEntry(container, (key, value) -> {
            String segmentKey = base + prefix + key;

            if (ContainerUtils.isNonEmptyContainer(value)) {
                walk(value, destination, segmentKey + suffix, depth + 1);
            } else {
                destination.put(suffixEnd ? segmentKey + suffix : segmentKey, value);
            }
        });
    }

    /**
     * Removes every trailing occurrence of {@code literal} from {@code key}.
     */
    static String stripTrailing(String key, String literal) {
        if (literal.isEmpty()) {
            return key;
        }
        int end = key.length();
        while (end >= literal.length() && key.startsWith(literal, end - literal.length())) {
            end -= literal.length();
        }
        return key.substring(0, end);
    }
}
