package io.callmap.output;

import io.callmap.model.CallGraph;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints call trees for root functions.
 * <p>
 * Layout:
 * <pre>
 * main()
 * -> init()
 *    |-> load()
 *    |-> parse()
 *       -> main() [recursive]
 * </pre>
 * A function with several callees lists each on its own line starting at the
 * column of the parent's name, marked with {@code |}. A single callee goes on the
 * next line: below a plain {@code ->} line its arrow stays in the parent's arrow
 * column, below a {@code |->} line it ends one column before the parent's name.
 * A leaf marker prints as {@code None}.
 * <p>
 * Each branch tracks the functions on its current path; a callee already on the
 * path is printed with {@code [recursive]} and not expanded. The walk uses an
 * explicit stack, so deep call chains do not grow the Java stack.
 */
public class CallTreeRenderer {

    private static final String ARROW = "-> ";
    private static final String BRANCH_ARROW = "|-> ";
    private static final String LEAF = "None";
    private static final String RECURSIVE = " [recursive]";

    private static final String RESET = "\u001B[0m";
    private static final String CYAN = "\u001B[36m";
    private static final String YELLOW = "\u001B[33m";
    private static final String DIM = "\u001B[2m";

    private final CallGraph callGraph;
    private final PrintStream out;
    private final boolean useColor;
    private final boolean showLeafMarkers;

    public CallTreeRenderer(CallGraph callGraph, PrintStream out) {
        this(callGraph, out, false, true);
    }

    public CallTreeRenderer(CallGraph callGraph, PrintStream out, boolean useColor, boolean showLeafMarkers) {
        this.callGraph = callGraph;
        this.out = out;
        this.useColor = useColor;
        this.showLeafMarkers = showLeafMarkers;
    }

    /**
     * Print graph statistics.
     */
    public void printSummary(List<String> roots) {
        long leaves = callGraph.functions().stream().filter(callGraph::isLeaf).count();
        out.println("=== CALL GRAPH SUMMARY ===");
        out.println("Functions: " + callGraph.functionCount());
        out.println("Calls: " + callGraph.edgeCount());
        out.println("Root functions (entry points): " + roots.size());
        out.println("Leaf functions (no recorded calls): " + leaves);
        out.println();
    }

    /**
     * Print the trees of all roots under a {@code Call graph:} heading.
     */
    public void printCallTrees(List<String> roots) {
        out.println("Call graph:");
        for (String root : roots) {
            printTree(root);
        }
    }

    /**
     * Print one root and everything reachable from it.
     */
    public void printTree(String root) {
        out.println(color(CYAN, root) + "()");

        Set<String> onPath = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        onPath.add(root);
        stack.push(new Frame(root, callGraph.callees(root), 0, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next >= frame.callees.size()) {
                stack.pop();
                onPath.remove(frame.function);
                continue;
            }

            String callee = frame.callees.get(frame.next++);
            boolean branched = frame.callees.size() > 1;
            int indent = branched ? frame.nameColumn : frame.arrowColumn;
            String prefix = branched ? BRANCH_ARROW : ARROW;
            int nameColumn = indent + prefix.length();
            int arrowColumn = branched ? nameColumn - 1 : indent;

            if (callee == null) {
                if (showLeafMarkers) {
                    out.println(spaces(indent) + prefix + color(DIM, LEAF));
                }
            } else if (onPath.contains(callee)) {
                out.println(spaces(indent) + prefix + callee + "()" + color(YELLOW, RECURSIVE));
            } else {
                out.println(spaces(indent) + prefix + callee + "()");
                if (callGraph.hasEntry(callee)) {
                    onPath.add(callee);
                    stack.push(new Frame(callee, callGraph.callees(callee), arrowColumn, nameColumn));
                }
            }
        }
    }

    private String spaces(int count) {
        return " ".repeat(count);
    }

    private String color(String code, String text) {
        if (useColor) {
            return code + text + RESET;
        }
        return text;
    }

    /**
     * A function whose callees are being printed.
     */
    private static final class Frame {
        final String function;
        final List<String> callees;
        final int arrowColumn;
        final int nameColumn;
        int next = 0;

        Frame(String function, List<String> callees, int arrowColumn, int nameColumn) {
            this.function = function;
            this.callees = callees;
            this.arrowColumn = arrowColumn;
            this.nameColumn = nameColumn;
        }
    }
}
