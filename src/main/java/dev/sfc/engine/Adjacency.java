package dev.sfc.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Untyped forward and reverse edges between element IDs. Neighbour sets keep
 * insertion order and hold each ID once.
 */
public final class Adjacency {

    /** Which way edges are followed. */
    public enum Direction { FORWARD, REVERSE }

    private final Map<String, Set<String>> forward = new LinkedHashMap<>();
    private final Map<String, Set<String>> reverse = new LinkedHashMap<>();

    void addEdge(String from, String to) {
        forward.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        reverse.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
    }

    public Set<String> neighbours(String id, Direction direction) {
        Map<String, Set<String>> edges = direction == Direction.FORWARD ? forward : reverse;
        Set<String> result = edges.get(id);
        return result == null ? Set.of() : Collections.unmodifiableSet(result);
    }

    public Set<String> successors(String id) {
        return neighbours(id, Direction.FORWARD);
    }

    public Set<String> predecessors(String id) {
        return neighbours(id, Direction.REVERSE);
    }

    public int edgeCount() {
        return forward.values().stream().mapToInt(Set::size).sum();
    }
}
