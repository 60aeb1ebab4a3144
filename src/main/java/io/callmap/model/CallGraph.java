package io.callmap.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The merged call graph of all analyzed translation units.
 * <p>
 * Callee lists keep recording order, which is also print order. A {@code null}
 * callee is the leaf marker: the function is known but has no recorded calls.
 *
 * @param edges     caller -> ordered callees (may contain the {@code null} leaf marker)
 * @param functions every function identity seen as a declaration
 */
public record CallGraph(
    Map<String, List<String>> edges,
    Set<String> functions
) {
    public CallGraph {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        // List.copyOf rejects nulls, and the leaf marker is a null
        edges.forEach((caller, callees) -> copy.put(caller, Collections.unmodifiableList(new ArrayList<>(callees))));
        edges = Collections.unmodifiableMap(copy);
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
    }

    /**
     * Recorded callees of a function, empty if the function has no entry.
     */
    public List<String> callees(String function) {
        return edges.getOrDefault(function, List.of());
    }

    /**
     * Whether the function has an entry of its own and can be expanded when rendering.
     */
    public boolean hasEntry(String function) {
        return edges.containsKey(function);
    }

    /**
     * Whether the function's only entry is the leaf marker.
     */
    public boolean isLeaf(String function) {
        List<String> callees = edges.get(function);
        return callees != null && callees.size() == 1 && callees.get(0) == null;
    }

    /**
     * Every name that appears as a callee anywhere in the graph.
     */
    public Set<String> allCallees() {
        Set<String> called = new LinkedHashSet<>();
        for (List<String> callees : edges.values()) {
            callees.stream().filter(Objects::nonNull).forEach(called::add);
        }
        return called;
    }

    /**
     * Number of real edges (leaf markers excluded).
     */
    public int edgeCount() {
        return (int) edges.values().stream()
            .flatMap(List::stream)
            .filter(Objects::nonNull)
            .count();
    }

    public int functionCount() {
        return functions.size();
    }
}
