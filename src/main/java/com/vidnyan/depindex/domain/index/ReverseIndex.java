package com.vidnyan.depindex.domain.index;

import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;

import java.util.*;

/**
 * Inverted index: referenced symbol → files that reference it.
 * <p>
 * Each import contributes its resolved module name and that name's last dotted component;
 * each dotted function call contributes its qualifier ({@code os.path.join} → {@code os}).
 * Buckets keep first-seen order and hold no duplicates. Immutable snapshot; a rebuild
 * produces a new instance.
 */
public final class ReverseIndex {

    private static final ReverseIndex EMPTY = new ReverseIndex(new TreeMap<>());

    private final Map<String, List<String>> buckets;

    private ReverseIndex(SortedMap<String, List<String>> buckets) {
        this.buckets = Collections.unmodifiableSortedMap(buckets);
    }

    public static ReverseIndex empty() {
        return EMPTY;
    }

    /**
     * Wrap a previously persisted symbol map.
     */
    public static ReverseIndex of(Map<String, List<String>> persisted) {
        SortedMap<String, List<String>> copy = new TreeMap<>();
        persisted.forEach((symbol, files) -> {
            if (symbol != null && files != null) {
                copy.put(symbol, List.copyOf(new LinkedHashSet<>(files)));
            }
        });
        return new ReverseIndex(copy);
    }

    /**
     * Build the index from every record of the corpus.
     */
    public static ReverseIndex build(Collection<DependencyRecord> records, ModulePaths paths) {
        Map<String, LinkedHashSet<String>> index = new HashMap<>();

        for (DependencyRecord record : records) {
            String source = paths.normalize(record.filePath());

            for (DependencyRecord.ImportRef imp : record.imports()) {
                String module = imp.effectiveModule();
                if (module.isEmpty()) {
                    continue;
                }
                index.computeIfAbsent(module, k -> new LinkedHashSet<>()).add(source);
                String stem = imp.moduleStem();
                if (!stem.isEmpty()) {
                    index.computeIfAbsent(stem, k -> new LinkedHashSet<>()).add(source);
                }
            }

            for (String qualifier : record.callPrefixes()) {
                index.computeIfAbsent(qualifier, k -> new LinkedHashSet<>()).add(source);
            }
        }

        SortedMap<String, List<String>> sorted = new TreeMap<>();
        index.forEach((symbol, files) -> sorted.put(symbol, List.copyOf(files)));
        return new ReverseIndex(sorted);
    }

    /**
     * Files that reference the given file, looked up by its stem, module name and path.
     * The file itself is never reported as its own dependent. Empty when nothing matches.
     */
    public List<String> lookup(String filePath, ModulePaths paths) {
        String normalized = paths.normalize(filePath);
        Set<String> keys = new LinkedHashSet<>();
        keys.add(paths.stem(filePath));
        keys.add(paths.moduleName(filePath));
        keys.add(normalized);
        keys.add(filePath);

        Set<String> result = new LinkedHashSet<>();
        for (String key : keys) {
            result.addAll(bucket(key));
        }
        result.remove(normalized);
        return List.copyOf(result);
    }

    /**
     * Files referencing exactly this symbol.
     */
    public List<String> bucket(String symbol) {
        return buckets.getOrDefault(symbol, List.of());
    }

    /**
     * Symbol map with keys in lexicographic order, suitable for persisting.
     */
    public Map<String, List<String>> asMap() {
        return buckets;
    }

    public int symbolCount() {
        return buckets.size();
    }

    /**
     * Number of distinct files appearing in any bucket.
     */
    public int fileCount() {
        Set<String> files = new HashSet<>();
        buckets.values().forEach(files::addAll);
        return files.size();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }
}
