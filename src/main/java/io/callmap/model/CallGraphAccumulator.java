package io.callmap.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds per-unit call graphs into one global graph.
 * <p>
 * Function sets are unioned. Edge lists are <em>replaced</em>: for every function a
 * unit declares, the global list becomes that unit's list, even when the unit only
 * saw a prototype and recorded nothing. A header function parsed identically by many
 * units therefore does not accumulate duplicate edges, but edges seen only by an
 * earlier unit are lost when a later unit has a partial view of the same function.
 * <p>
 * Merge order decides the result; callers merge in a fixed unit order.
 */
public class CallGraphAccumulator {

    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final Set<String> functions = new LinkedHashSet<>();
    private int unitsMerged = 0;

    public void merge(UnitCallGraph unit) {
        functions.addAll(unit.functions());
        for (String function : unit.functions()) {
            edges.put(function, unit.callees(function));
        }
        unitsMerged++;
    }

    public int getUnitsMerged() {
        return unitsMerged;
    }

    /**
     * Snapshot of the merged graph. Functions without calls keep an empty list here;
     * leaf markers are added by {@code RootFinder.normalizeLeaves}.
     */
    public CallGraph toCallGraph() {
        return new CallGraph(edges, functions);
    }
}
