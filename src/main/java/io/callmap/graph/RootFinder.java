package io.callmap.graph;

import io.callmap.model.CallGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the entry points of a call graph.
 * <p>
 * A root is a declared function that no recorded edge names as a callee. This is a
 * membership test, not a reachability test: a function called only from an
 * unreachable function is still not a root.
 */
public final class RootFinder {

    private RootFinder() {
    }

    /**
     * Give every declared function without calls the single leaf marker {@code [null]},
     * so that each function has at least one renderable entry.
     *
     * @return A new graph; the argument is not modified
     */
    public static CallGraph normalizeLeaves(CallGraph graph) {
        Map<String, List<String>> edges = new LinkedHashMap<>(graph.edges());
        for (String function : graph.functions()) {
            List<String> callees = edges.get(function);
            if (callees == null || callees.isEmpty()) {
                edges.put(function, Collections.singletonList(null));
            }
        }
        return new CallGraph(edges, graph.functions());
    }

    /**
     * Declared functions that never appear as a callee, sorted by name.
     */
    public static List<String> findRoots(CallGraph graph) {
        Set<String> called = graph.allCallees();
        List<String> roots = new ArrayList<>();
        for (String function : graph.functions()) {
            if (!called.contains(function)) {
                roots.add(function);
            }
        }
        Collections.sort(roots);
        return roots;
    }
}
