package io.callmap.analysis;

import io.callmap.ast.AstNode;
import io.callmap.ast.AstProvider;
import io.callmap.ast.ParseException;
import io.callmap.compdb.CompileCommand;
import io.callmap.graph.RootFinder;
import io.callmap.model.AnalysisResult;
import io.callmap.model.CallGraph;
import io.callmap.model.CallGraphAccumulator;
import io.callmap.model.UnitCallGraph;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyzes every translation unit of a project and merges the results.
 * <p>
 * Units are processed one at a time in the given order, which is also the merge
 * order. A unit that fails to parse is reported and skipped; the others still run.
 */
public class ProjectAnalyzer {

    private final AstProvider astProvider;
    private final CallGraphBuilder builder;
    private final PrintStream progress;
    private final PrintStream warnings;

    /**
     * @param astProvider Parser for translation units
     * @param builder     Per-unit call graph builder
     * @param progress    Stream for per-unit progress lines, or null for none
     * @param warnings    Stream for parse failures and skipped calls
     */
    public ProjectAnalyzer(AstProvider astProvider, CallGraphBuilder builder,
                           PrintStream progress, PrintStream warnings) {
        this.astProvider = astProvider;
        this.builder = builder;
        this.progress = progress;
        this.warnings = warnings;
    }

    public ProjectAnalyzer(AstProvider astProvider, CallGraphBuilder builder) {
        this(astProvider, builder, null, System.err);
    }

    public AnalysisResult analyze(List<CompileCommand> units) {
        CallGraphAccumulator accumulator = new CallGraphAccumulator();
        List<AnalysisResult.UnitFailure> failures = new ArrayList<>();
        int skippedCalls = 0;

        for (CompileCommand unit : units) {
            log(unit.file().toString());
            List<String> flags = unit.flags();
            log("  args: " + flags);

            UnitCallGraph unitGraph;
            try {
                AstNode root = astProvider.parse(unit.file(), unit.directory(), flags);
                unitGraph = builder.build(root);
            } catch (ParseException e) {
                warnings.println("Warning: Failed to parse " + e.source() + ": " + e.getMessage());
                failures.add(new AnalysisResult.UnitFailure(e.source(), e.getMessage()));
                continue;
            }

            accumulator.merge(unitGraph);
            skippedCalls += unitGraph.skippedCalls().size();

            log("  " + unitGraph.functions().size() + " functions, " + unitGraph.edgeCount() + " calls");
            for (String skipped : unitGraph.skippedCalls()) {
                log("  skipped call in " + skipped);
            }
        }

        CallGraph graph = RootFinder.normalizeLeaves(accumulator.toCallGraph());
        List<String> roots = RootFinder.findRoots(graph);

        return new AnalysisResult(graph, roots, accumulator.getUnitsMerged(), failures, skippedCalls);
    }

    private void log(String message) {
        if (progress != null) {
            progress.println(message);
        }
    }
}
