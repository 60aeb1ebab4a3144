package io.callmap.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of a parsed translation unit, reduced to what call graph extraction needs.
 * <p>
 * Nodes are identity-compared: the semantic parent link may point back into the
 * tree, so structural equality would not terminate.
 */
public final class AstNode {

    private final AstNodeKind kind;
    private final String spelling;
    private final String originFile;
    private final String staticType;
    private final AstNode semanticParent;
    private final List<AstNode> children = new ArrayList<>();

    AstNode(AstNodeKind kind, String spelling, String originFile, String staticType, AstNode semanticParent) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.spelling = spelling != null ? spelling : "";
        this.originFile = originFile;
        this.staticType = staticType != null ? staticType : "";
        this.semanticParent = semanticParent;
    }

    public AstNodeKind kind() {
        return kind;
    }

    /**
     * Display name: the declared name for declarations, the callee name for calls,
     * the member name for member references. Empty when the node has none.
     */
    public String spelling() {
        return spelling;
    }

    /**
     * File the node originates from, or {@code null} for builtin/compiler-provided nodes.
     */
    public String originFile() {
        return originFile;
    }

    /**
     * Spelling of the node's static type, empty when the node carries no type.
     */
    public String staticType() {
        return staticType;
    }

    /**
     * Semantic parent (the class a method belongs to), may be {@code null}.
     */
    public AstNode semanticParent() {
        return semanticParent;
    }

    public List<AstNode> children() {
        return Collections.unmodifiableList(children);
    }

    void addChild(AstNode child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    @Override
    public String toString() {
        return kind + "(" + spelling + (originFile != null ? " @ " + originFile : "") + ")";
    }

    public static Builder builder(AstNodeKind kind) {
        return new Builder(kind);
    }

    /**
     * Builder for assembling AST fragments by hand, e.g. in tests or alternative providers.
     */
    public static class Builder {
        private final AstNodeKind kind;
        private String spelling;
        private String originFile;
        private String staticType;
        private AstNode semanticParent;
        private final List<AstNode> children = new ArrayList<>();

        private Builder(AstNodeKind kind) {
            this.kind = kind;
        }

        public Builder spelling(String spelling) {
            this.spelling = spelling;
            return this;
        }

        public Builder originFile(String originFile) {
            this.originFile = originFile;
            return this;
        }

        public Builder staticType(String staticType) {
            this.staticType = staticType;
            return this;
        }

        public Builder semanticParent(AstNode semanticParent) {
            this.semanticParent = semanticParent;
            return this;
        }

        public Builder child(AstNode child) {
            this.children.add(child);
            return this;
        }

        public AstNode build() {
            AstNode node = new AstNode(kind, spelling, originFile, staticType, semanticParent);
            children.forEach(node::addChild);
            return node;
        }
    }
}
