package io.github.reugn.route4j.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable, ordered view of the registry that code generation works from.
 *
 * <p>The registry records entries in the order the compiler happened to process them, which is
 * not guaranteed to be stable across builds. The manifest fixes a reproducible order so the
 * generated sources do not change between identical compilations:
 * <ul>
 *   <li>scopes are ordered lexicographically;</li>
 *   <li>entries of a scope are ordered by declaring class name, then by declaration order
 *       inside that class.</li>
 * </ul>
 * Duplicate entries are kept.
 */
final class RouteManifest {

    private static final Comparator<RegistrationEntry> SOURCE_ORDER =
            Comparator.comparing(RegistrationEntry::declaringType)
                    .thenComparingInt(RegistrationEntry::ordinal);

    private final Map<String, List<RegistrationEntry>> entriesByScope;

    private RouteManifest(Map<String, List<RegistrationEntry>> entriesByScope) {
        this.entriesByScope = entriesByScope;
    }

    /**
     * Builds a manifest from a registry snapshot.
     *
     * @param snapshot the registry content, as returned by {@link Registry#snapshotAll()}
     * @return the ordered manifest
     */
    static RouteManifest of(Map<String, List<RegistrationEntry>> snapshot) {
        Map<String, List<RegistrationEntry>> sorted = new TreeMap<>();
        snapshot.forEach((scope, entries) -> {
            List<RegistrationEntry> ordered = new ArrayList<>(entries);
            ordered.sort(SOURCE_ORDER);
            sorted.put(scope, List.copyOf(ordered));
        });
        return new RouteManifest(Collections.unmodifiableMap(sorted));
    }

    /**
     * Returns the entries filed under a module key.
     *
     * @param moduleKey the scope used as filing key
     * @return the ordered entries; empty if the module has no handlers
     */
    List<RegistrationEntry> entriesFor(String moduleKey) {
        return entriesByScope.getOrDefault(moduleKey, List.of());
    }

    Set<String> scopes() {
        return entriesByScope.keySet();
    }

    /**
     * Returns every entry, scope by scope.
     */
    List<RegistrationEntry> allEntries() {
        List<RegistrationEntry> all = new ArrayList<>();
        entriesByScope.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    int size() {
        return entriesByScope.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Regroups entries by their own scope, keeping first-appearance order of scopes and
     * the relative order of entries inside each group.
     *
     * @param entries the entries to regroup
     * @return scope to entries, in encounter order
     */
    static Map<String, List<RegistrationEntry>> groupByScope(List<RegistrationEntry> entries) {
        Map<String, List<RegistrationEntry>> groups = new LinkedHashMap<>();
        for (RegistrationEntry entry : entries) {
            groups.computeIfAbsent(entry.scope(), k -> new ArrayList<>()).add(entry);
        }
        return groups;
    }
}
