package io.surfworks.todome.query;

import io.surfworks.todome.syntax.ClassifiedLine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Category and tag names seen in a document, for completion by prefix.
 *
 * <p>Each name carries a reference count, one per line mentioning it, so an
 * edit can be applied by subtracting the removed lines and adding the new ones
 * without rescanning the document. Instances are immutable; updates return a
 * new index and leave this one valid for concurrent readers.
 */
public final class QueryIndex {

    private static final QueryIndex EMPTY = new QueryIndex(new TreeMap<>(), new TreeMap<>());

    private final NavigableMap<String, Integer> categories;
    private final NavigableMap<String, Integer> tags;

    private QueryIndex(NavigableMap<String, Integer> categories, NavigableMap<String, Integer> tags) {
        this.categories = Collections.unmodifiableNavigableMap(categories);
        this.tags = Collections.unmodifiableNavigableMap(tags);
    }

    public static QueryIndex empty() {
        return EMPTY;
    }

    /**
     * Full scan, used on first load.
     */
    public static QueryIndex of(Collection<? extends ClassifiedLine> lines) {
        return EMPTY.update(List.of(), lines);
    }

    /**
     * Index after {@code removed} lines left the document and {@code added} lines entered it.
     */
    public QueryIndex update(Collection<? extends ClassifiedLine> removed, Collection<? extends ClassifiedLine> added) {
        if (removed.isEmpty() && added.isEmpty()) {
            return this;
        }
        TreeMap<String, Integer> newCategories = new TreeMap<>(categories);
        TreeMap<String, Integer> newTags = new TreeMap<>(tags);
        for (ClassifiedLine line : removed) {
            if (line instanceof ClassifiedLine.Item item) {
                item.categories().forEach(name -> decrement(newCategories, name));
                item.tags().forEach(name -> decrement(newTags, name));
            }
        }
        for (ClassifiedLine line : added) {
            if (line instanceof ClassifiedLine.Item item) {
                item.categories().forEach(name -> newCategories.merge(name, 1, Integer::sum));
                item.tags().forEach(name -> newTags.merge(name, 1, Integer::sum));
            }
        }
        return new QueryIndex(newCategories, newTags);
    }

    /**
     * Names of the given kind starting with {@code prefix} (case-sensitive), sorted lexicographically.
     */
    public List<String> candidates(CandidateKind kind, String prefix) {
        List<String> result = new ArrayList<>();
        for (String name : names(kind).tailMap(prefix, true).keySet()) {
            if (!name.startsWith(prefix)) {
                break;
            }
            result.add(name);
        }
        return result;
    }

    public boolean contains(CandidateKind kind, String name) {
        return names(kind).containsKey(name);
    }

    public int size(CandidateKind kind) {
        return names(kind).size();
    }

    private NavigableMap<String, Integer> names(CandidateKind kind) {
        return switch (kind) {
            case CATEGORY -> categories;
            case TAG -> tags;
        };
    }

    private static void decrement(Map<String, Integer> counts, String name) {
        counts.computeIfPresent(name, (k, v) -> v > 1 ? v - 1 : null);
    }
}
