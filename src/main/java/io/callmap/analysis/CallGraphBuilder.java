package io.callmap.analysis;

import io.callmap.ast.AstNode;
import io.callmap.ast.AstNodeKind;
import io.callmap.model.UnitCallGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the call graph of one translation unit from its AST.
 * <p>
 * The walk carries the enclosing function as an immutable parameter:
 * - a function declaration sets it to the function's name
 * - a method declaration sets it to {@code Type::method}
 * - every call expression below it records one edge from it
 * <p>
 * Subtrees originating from system headers are skipped entirely. Calls outside any
 * function (global initializers) are dropped.
 */
public class CallGraphBuilder {

    static final String SCOPE_SEPARATOR = "::";

    private final OriginFilter originFilter;

    public CallGraphBuilder(OriginFilter originFilter) {
        this.originFilter = originFilter;
    }

    public CallGraphBuilder() {
        this(OriginFilter.defaults());
    }

    /**
     * Walk a translation unit.
     *
     * @param root Root node of the unit; it is never filtered itself
     * @return Edges and declared functions of this unit alone
     */
    public UnitCallGraph build(AstNode root) {
        UnitState state = new UnitState();
        visit(root, "", state);
        return new UnitCallGraph(state.edges, state.functions, state.skippedCalls);
    }

    private void visit(AstNode node, String enclosing, UnitState state) {
        String context = switch (node.kind()) {
            case FUNCTION_DECL -> node.spelling();
            case METHOD_DECL -> qualifiedMethodName(node);
            case CALL_EXPR, MEMBER_REF_EXPR, OTHER -> enclosing;
        };

        if (node.kind().isFunctionLike() && !context.isEmpty()) {
            state.functions.add(context);
        }

        for (AstNode child : node.children()) {
            if (originFilter.isSystem(child)) {
                continue;
            }
            if (child.kind() == AstNodeKind.CALL_EXPR && !context.isEmpty()) {
                recordCall(context, child, state);
            }
            visit(child, context, state);
        }
    }

    /**
     * Record the edge for one call expression.
     * A member call resolves to {@code ObjectType::member} using the first member
     * reference among the call's children; any other call uses the call's own spelling.
     */
    private void recordCall(String caller, AstNode call, UnitState state) {
        AstNode memberRef = firstMemberReference(call);

        String callee;
        if (memberRef != null) {
            if (memberRef.children().isEmpty()) {
                state.skippedCalls.add(caller + ": member call '" + memberRef.spelling() + "' has no object expression");
                return;
            }
            AstNode object = memberRef.children().get(0);
            callee = object.staticType() + SCOPE_SEPARATOR + memberRef.spelling();
        } else {
            callee = call.spelling();
        }

        if (callee.isEmpty()) {
            state.skippedCalls.add(caller + ": call without a callee name");
            return;
        }

        state.edges.computeIfAbsent(caller, k -> new ArrayList<>()).add(callee);
    }

    private static AstNode firstMemberReference(AstNode call) {
        for (AstNode child : call.children()) {
            if (child.kind() == AstNodeKind.MEMBER_REF_EXPR) {
                return child;
            }
        }
        return null;
    }

    /**
     * {@code Type::method}, or the bare method name when the parent type is unknown.
     */
    static String qualifiedMethodName(AstNode method) {
        AstNode parent = method.semanticParent();
        if (parent == null || parent.spelling().isEmpty()) {
            return method.spelling();
        }
        return parent.spelling() + SCOPE_SEPARATOR + method.spelling();
    }

    private static final class UnitState {
        final Map<String, List<String>> edges = new LinkedHashMap<>();
        final Set<String> functions = new LinkedHashSet<>();
        final List<String> skippedCalls = new ArrayList<>();
    }
}
