package org.blocksync.registry.pattern;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named substrings captured by a successful {@link IFragmentMatcher} match.
 */
public final class Captures {

    private static final Captures EMPTY = new Captures(Map.of());

    private final Map<String, String> groups;

    private Captures(Map<String, String> groups) {
        this.groups = groups;
    }

    public static Captures empty() {
        return EMPTY;
    }

    public static Captures of(Map<String, String> groups) {
        return new Captures(Collections.unmodifiableMap(new LinkedHashMap<>(groups)));
    }

    /**
     * Returns the captured text for a group, or {@code null} if the group did not participate.
     * @param name The group name.
     * @return The captured text or {@code null}.
     */
    public String get(String name) {
        return groups.get(name);
    }

    public Optional<String> find(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    public boolean has(String name) {
        return groups.containsKey(name);
    }

    public Map<String, String> asMap() {
        return groups;
    }

    /**
     * Combines two capture sets. Groups of {@code other} win on name clashes.
     * @param other The captures to merge in.
     * @return A new capture set.
     */
    public Captures merge(Captures other) {
        Map<String, String> merged = new LinkedHashMap<>(groups);
        merged.putAll(other.groups);
        return of(merged);
    }

    @Override
    public String toString() {
        return groups.toString();
    }
}
