package io.callmap.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Call graph of a single translation unit, before merging.
 *
 * @param edges        caller -> callees in the order the calls appear (no leaf markers)
 * @param functions    every function identity declared in the unit
 * @param skippedCalls descriptions of call expressions that produced no edge
 */
public record UnitCallGraph(
    Map<String, List<String>> edges,
    Set<String> functions,
    List<String> skippedCalls
) {
    public UnitCallGraph {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        edges.forEach((caller, callees) -> copy.put(caller, List.copyOf(callees)));
        edges = Collections.unmodifiableMap(copy);
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        skippedCalls = List.copyOf(skippedCalls);
    }

    /**
     * Calls recorded for a function, empty if it made none.
     */
    public List<String> callees(String function) {
        return edges.getOrDefault(function, List.of());
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(List::size).sum();
    }
}
