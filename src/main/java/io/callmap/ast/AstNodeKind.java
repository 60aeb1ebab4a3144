package io.callmap.ast;

/**
 * The node kinds the call graph builder distinguishes.
 * Every other AST construct is folded into {@link #OTHER}.
 */
public enum AstNodeKind {
    /** Free function declaration or definition. */
    FUNCTION_DECL,
    /** Member function declaration or definition. */
    METHOD_DECL,
    /** Any call expression (plain, member or overloaded operator). */
    CALL_EXPR,
    /** Member access expression ({@code obj.member} or {@code ptr->member}). */
    MEMBER_REF_EXPR,
    OTHER;

    public boolean isFunctionLike() {
        return this == FUNCTION_DECL || this == METHOD_DECL;
    }
}
