package io.callmap.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of analyzing a set of translation units.
 *
 * @param graph        merged graph with leaf markers applied
 * @param roots        functions never called by any recorded edge, in name order
 * @param unitsParsed  number of units parsed and merged
 * @param failures     units that could not be parsed
 * @param skippedCalls number of call expressions that produced no edge
 */
public record AnalysisResult(
    CallGraph graph,
    List<String> roots,
    int unitsParsed,
    List<UnitFailure> failures,
    int skippedCalls
) {
    public AnalysisResult {
        roots = List.copyOf(roots);
        failures = List.copyOf(failures);
    }

    /**
     * A unit that was skipped because it failed to parse.
     */
    public record UnitFailure(Path file, String message) {}

    public boolean hasFunctions() {
        return !graph.functions().isEmpty();
    }

    public boolean hasRoots() {
        return !roots.isEmpty();
    }
}
