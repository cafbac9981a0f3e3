package io.github.cyfko.keyflat.core.impl;

import io.github.cyfko.keyflat.core.api.Unflattener;
import io.github.cyfko.keyflat.core.config.ConflictPolicy;
import io.github.cyfko.keyflat.core.config.FlatPolicy;
import io.github.cyfko.keyflat.core.config.KeyFormat;
import io.github.cyfko.keyflat.core.config.ListRestoreMode;
import io.github.cyfko.keyflat.core.config.StartKeyMatching;
import io.github.cyfko.keyflat.core.exception.NestingDepthExceededException;
import io.github.cyfko.keyflat.core.exception.StructuralConflictException;
import io.github.cyfko.keyflat.core.exception.UnresolvableKeyException;
import io.github.cyfko.keyflat.core.parsing.KeySegmentScanner;
import io.github.cyfko.keyflat.core.utils.ContainerUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Default {@link Unflattener}.
 * <p>
 * Processing happens in two phases:
 * </p>
 * <ol>
 *   <li><strong>Build</strong>: for each flat entry, in source order, the start key is removed, the key
 *       is split by a {@link KeySegmentScanner} and the path is walked from the root, creating an
 *       ordered map for every missing segment. The value is stored at the last segment.</li>
 *   <li><strong>Restore</strong>: with {@link ListRestoreMode#RESTORE_LISTS}, every created container
 *       below the root keyed exactly {@code "0".."n-1"} is turned into a list, bottom-up. When the key
 *       format has list delimiters of its own, only containers whose keys were all written as list
 *       indexes qualify, so {@code a.0} stays a map key while {@code a[0]} becomes a list element.
 *       {@link #restore(Map, String)} applies the same rule to the root.</li>
 * </ol>
 *
 * <p>
 * Only containers created during the build phase are ever descended into or modified. Values taken
 * from the source, empty maps and lists included, are leaves: a key that needs to pass through one is
 * a structural conflict, resolved according to {@link FlatPolicy#conflictPolicy()}.
 * </p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicUnflattener implements Unflattener {

    private static final Logger log = Logger.getLogger(BasicUnflattener.class.getName());

    private final KeyFormat keyFormat;
    private final FlatPolicy flatPolicy;

    public BasicUnflattener() {
        this(KeyFormat.defaults(), FlatPolicy.defaults());
    }

    public BasicUnflattener(KeyFormat keyFormat) {
        this(keyFormat, FlatPolicy.defaults());
    }

    /**
     * @param keyFormat  key rendering settings, the same used to flatten
     * @param flatPolicy depth limit, conflict handling, list restoration and start key settings
     * @throws NullPointerException if any argument is null
     */
    public BasicUnflattener(KeyFormat keyFormat, FlatPolicy flatPolicy) {
        this.keyFormat = Objects.requireNonNull(keyFormat, "Key format is required");
        this.flatPolicy = Objects.requireNonNull(flatPolicy, "Flat policy is required");
    }

    @Override
    public Map<String, Object> unflatten(Map<String, ?> source, String startKey) {
        return build(source, startKey).root;
    }

    @Override
    public Object restore(Map<String, ?> source, String startKey) {
        Assembly assembly = build(source, startKey);
        Map<String, Object> root = assembly.root;
        if (flatPolicy.listRestoreMode() == ListRestoreMode.RESTORE_LISTS && assembly.isList(root)) {
            return new ArrayList<>(root.values());
        }
        return root;
    }

    @Override
    public KeyFormat getKeyFormat() {
        return keyFormat;
    }

    public FlatPolicy getFlatPolicy() {
        return flatPolicy;
    }

    private Assembly build(Map<String, ?> source, String startKey) {
        Objects.requireNonNull(source, "Source cannot be null");

        KeySegmentScanner scanner = KeySegmentScanner.of(keyFormat);
        String start = startKey == null ? "" : startKey;
        long begin = System.nanoTime();

        Assembly assembly = new Assembly(scanner.tracksListIndexes());
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            String key = entry.getKey();
            if (key == null) {
                throw new UnresolvableKeyException(null);
            }

            List<KeySegmentScanner.Segment> segments = scanner.segments(removeStartKey(key, start));
            if (segments.isEmpty()) {
                throw new UnresolvableKeyException(key);
            }
            if (segments.size() > flatPolicy.maxDepth()) {
                throw new NestingDepthExceededException(flatPolicy.maxDepth(), flatPolicy.policyName(), key);
            }

            assembly.place(key, segments, entry.getValue());
        }

        Map<String, Object> root = assembly.root;
        if (flatPolicy.listRestoreMode() == ListRestoreMode.RESTORE_LISTS) {
            root.replaceAll((segment, child) -> assembly.restoreLists(child));
        }

        long durationMs = (System.nanoTime() - begin) / 1_000_000;
        log.fine(() -> String.format(
                "Unflattened %d entries into %d root entries in %d ms",
                source.size(), root.size(), durationMs));

        return assembly;
    }

    private void onConflict(String key, List<String> path, String reason) {
        if (flatPolicy.conflictPolicy() == ConflictPolicy.STRICT) {
            throw new StructuralConflictException(
                    String.format("Flat key '%s' conflicts with earlier keys: location %s %s", key, path, reason),
                    key, path);
        }
        log.fine(() -> String.format("Overwriting location %s for flat key '%s': it %s", path, key, reason));
    }

    private String removeStartKey(String key, String startKey) {
        if (startKey.isEmpty()) {
            return key;
        }
        if (flatPolicy.startKeyMatching() == StartKeyMatching.LITERAL_PREFIX) {
            return key.startsWith(startKey) ? key.substring(startKey.length()) : key;
        }
        int i = 0;
        while (i < key.length() && startKey.indexOf(key.charAt(i)) >= 0) {
            i++;
        }
        return key.substring(i);
    }

    /**
     * Containers built for one call. Only containers in {@code built} are descended into or modified.
     * With list index tracking, {@code listFramed} records per container whether every key placed in it
     * was written as a list index.
     */
    private final class Assembly {
        private final Map<String, Object> root = new LinkedHashMap<>();
        private final Set<Object> built = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Map<Object, Boolean> listFramed = new IdentityHashMap<>();
        private final boolean tracksListIndexes;

        private Assembly(boolean tracksListIndexes) {
            this.tracksListIndexes = tracksListIndexes;
            built.add(root);
        }

        @SuppressWarnings("unchecked")
        private void place(String key, List<KeySegmentScanner.Segment> segments, Object value) {
            Map<String, Object> current = root;
            int last = segments.size() - 1;

            for (int i = 0; i < last; i++) {
                KeySegmentScanner.Segment segment = segments.get(i);
                Object child = current.get(segment.name());

                if (child == null || !built.contains(child)) {
                    if (current.containsKey(segment.name())) {
                        onConflict(key, names(segments, i + 1), "holds a leaf value and cannot be descended into");
                    }
                    Map<String, Object> created = new LinkedHashMap<>();
                    built.add(created);
                    child = created;
                }
                put(current, segment, child);
                current = (Map<String, Object>) child;
            }

            KeySegmentScanner.Segment leaf = segments.get(last);
            Object existing = current.get(leaf.name());
            if (existing != null && built.contains(existing)) {
                onConflict(key, names(segments, segments.size()), "already holds a container built from other keys");
            }
            put(current, leaf, value);
        }

        private void put(Map<String, Object> container, KeySegmentScanner.Segment segment, Object value) {
            container.put(segment.name(), value);
            listFramed.merge(container, segment.listIndex(), Boolean::logicalAnd);
        }

        @SuppressWarnings("unchecked")
        private Object restoreLists(Object node) {
            if (!built.contains(node)) {
                return node;
            }
            Map<String, Object> map = (Map<String, Object>) node;
            map.replaceAll((segment, child) -> restoreLists(child));
            return isList(map) ? new ArrayList<>(map.values()) : map;
        }

        private boolean isList(Map<String, Object> map) {
            if (map.isEmpty()) {
                return false;
            }
            if (tracksListIndexes && !Boolean.TRUE.equals(listFramed.get(map))) {
                return false;
            }
            return ContainerUtils.isSequentiallyKeyed(map);
        }

        private List<String> names(List<KeySegmentScanner.Segment> segments, int count) {
            List<String> names = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                names.add(segments.get(i).name());
            }
            return names;
        }
    }
}
