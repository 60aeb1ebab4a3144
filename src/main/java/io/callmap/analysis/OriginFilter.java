package io.callmap.analysis;

import io.callmap.ast.AstNode;

import java.util.List;

/**
 * Decides whether an AST node comes from system or compiler-provided code.
 * <p>
 * A node is system code when its origin file starts with one of the configured
 * prefixes, contains one of the configured fragments, or is unknown (builtins
 * carry no file).
 */
public class OriginFilter {

    private final List<String> prefixes;
    private final List<String> fragments;

    public OriginFilter(List<String> prefixes, List<String> fragments) {
        this.prefixes = List.copyOf(prefixes);
        this.fragments = List.copyOf(fragments);
    }

    /**
     * Filter matching the usual Unix system header locations.
     */
    public static OriginFilter defaults() {
        return new OriginFilter(List.of("/usr/include", "/usr/lib"), List.of("/lib/gcc"));
    }

    public boolean isSystem(AstNode node) {
        return isSystemFile(node.originFile());
    }

    public boolean isSystemFile(String file) {
        if (file == null) {
            return true;
        }
        for (String prefix : prefixes) {
            if (file.startsWith(prefix)) {
                return true;
            }
        }
        for (String fragment : fragments) {
            if (file.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
