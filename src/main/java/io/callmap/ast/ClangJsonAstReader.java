package io.callmap.ast;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts the JSON AST dump produced by {@code clang -Xclang -ast-dump=json} into {@link AstNode} trees.
 * <p>
 * The dump is streamed rather than bound to a tree model: units that include
 * large system headers produce dumps of several hundred megabytes.
 * <p>
 * Clang writes a location's {@code file} only when it differs from the last location
 * it wrote, so the reader carries the last seen file through the whole document in
 * the order the locations appear.
 * <p>
 * Instances are not thread-safe; use one reader per dump.
 */
public class ClangJsonAstReader {

    private static final Set<String> RECORD_KINDS = Set.of(
            "CXXRecordDecl",
            "RecordDecl",
            "ClassTemplateSpecializationDecl",
            "ClassTemplatePartialSpecializationDecl"
    );

    private static final Set<String> CALL_KINDS = Set.of(
            "CallExpr",
            "CXXMemberCallExpr",
            "CXXOperatorCallExpr"
    );

    private final JsonFactory factory;
    private final Map<String, AstNode> recordsById = new HashMap<>();
    private String lastFile;

    public ClangJsonAstReader() {
        this(new JsonFactory());
    }

    public ClangJsonAstReader(JsonFactory factory) {
        this.factory = factory;
    }

    /**
     * Reads one translation unit dump.
     *
     * @param in JSON dump, starting with the {@code TranslationUnitDecl} object
     * @return Root node of the unit
     * @throws IOException If the stream is not a well-formed dump
     */
    public AstNode read(InputStream in) throws IOException {
        recordsById.clear();
        lastFile = null;

        try (JsonParser parser = factory.createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("AST dump does not start with a JSON object");
            }
            AstNode root = readNode(parser, null);
            if (root == null) {
                throw new IOException("AST dump has no translation unit node");
            }
            return root;
        }
    }

    /**
     * Reads the node object the parser is positioned on.
     * Returns {@code null} for implicit declarations; their locations are still consumed.
     */
    private AstNode readNode(JsonParser parser, AstNode enclosingRecord) throws IOException {
        NodeFields fields = new NodeFields();
        List<AstNode> children = new ArrayList<>();
        AstNode record = null;

        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            parser.nextToken();

            switch (field) {
                case "id" -> fields.id = parser.getText();
                case "kind" -> fields.kind = parser.getText();
                case "name" -> fields.name = parser.getValueAsString();
                case "isImplicit" -> fields.implicit = parser.getValueAsBoolean();
                case "parentDeclContextId" -> fields.parentDeclContextId = parser.getText();
                case "loc" -> {
                    fields.hasLoc = true;
                    fields.locFile = readLocation(parser);
                }
                case "range" -> fields.rangeFile = readRange(parser);
                case "type" -> fields.qualType = readStringMember(parser, "qualType");
                case "referencedDecl" -> fields.referencedName = readStringMember(parser, "name");
                case "inner" -> {
                    if (RECORD_KINDS.contains(fields.kind)) {
                        record = createNode(fields, enclosingRecord, "");
                    }
                    readChildren(parser, children, record != null ? record : enclosingRecord);
                }
                default -> parser.skipChildren();
            }
        }

        AstNode node = record;
        if (node == null) {
            String spelling = CALL_KINDS.contains(fields.kind) ? calleeSpelling(children) : "";
            node = createNode(fields, enclosingRecord, spelling);
        }
        children.forEach(node::addChild);

        return fields.implicit ? null : node;
    }

    private void readChildren(JsonParser parser, List<AstNode> children, AstNode enclosingRecord) throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            parser.skipChildren();
            return;
        }
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            if (parser.currentToken() != JsonToken.START_OBJECT) {
                parser.skipChildren();
                continue;
            }
            AstNode child = readNode(parser, enclosingRecord);
            if (child != null) {
                children.add(child);
            }
        }
    }

    private AstNode createNode(NodeFields fields, AstNode enclosingRecord, String callSpelling) {
        AstNodeKind kind = mapKind(fields.kind);
        String origin = fields.hasLoc ? fields.locFile : fields.rangeFile;

        String spelling;
        if (kind == AstNodeKind.CALL_EXPR) {
            spelling = callSpelling;
        } else if (fields.name != null) {
            spelling = fields.name;
        } else {
            spelling = fields.referencedName;
        }

        AstNode parent = null;
        if (kind == AstNodeKind.METHOD_DECL) {
            if (fields.parentDeclContextId != null) {
                parent = recordsById.get(fields.parentDeclContextId);
            }
            if (parent == null) {
                parent = enclosingRecord;
            }
        }

        AstNode node = new AstNode(kind, spelling, origin, fields.qualType, parent);
        if (RECORD_KINDS.contains(fields.kind) && fields.id != null && !fields.implicit) {
            recordsById.put(fields.id, node);
        }
        return node;
    }

    static AstNodeKind mapKind(String clangKind) {
        if (clangKind == null) {
            return AstNodeKind.OTHER;
        }
        return switch (clangKind) {
            case "FunctionDecl" -> AstNodeKind.FUNCTION_DECL;
            case "CXXMethodDecl" -> AstNodeKind.METHOD_DECL;
            case "CallExpr", "CXXMemberCallExpr", "CXXOperatorCallExpr" -> AstNodeKind.CALL_EXPR;
            case "MemberExpr" -> AstNodeKind.MEMBER_REF_EXPR;
            default -> AstNodeKind.OTHER;
        };
    }

    /**
     * Name of the callee: the first named node in the callee expression (the call's first child).
     */
    private static String calleeSpelling(List<AstNode> children) {
        if (children.isEmpty()) {
            return "";
        }
        String name = firstSpelling(children.get(0));
        return name != null ? name : "";
    }

    private static String firstSpelling(AstNode node) {
        if (!node.spelling().isEmpty()) {
            return node.spelling();
        }
        for (AstNode child : node.children()) {
            String name = firstSpelling(child);
            if (name != null) {
                return name;
            }
        }
        return null;
    }

    /**
     * Reads a {@code range} object and returns the file of its begin location.
     */
    private String readRange(JsonParser parser) throws IOException {
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            parser.skipChildren();
            return null;
        }
        String beginFile = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            parser.nextToken();
            if ("begin".equals(field)) {
                beginFile = readLocation(parser);
            } else if ("end".equals(field)) {
                readLocation(parser);
            } else {
                parser.skipChildren();
            }
        }
        return beginFile;
    }

    /**
     * Reads a source location, which is either a bare location or a
     * {@code spellingLoc}/{@code expansionLoc} pair for macro expansions.
     *
     * @return File the location resolves to (expansion file for macros), or null if invalid
     */
    private String readLocation(JsonParser parser) throws IOException {
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            parser.skipChildren();
            return null;
        }
        boolean valid = false;
        boolean macro = false;
        String expansionFile = null;

        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            parser.nextToken();
            switch (field) {
                case "spellingLoc" -> {
                    macro = true;
                    readLocation(parser);
                }
                case "expansionLoc" -> {
                    macro = true;
                    expansionFile = readLocation(parser);
                }
                case "offset" -> valid = true;
                case "file" -> lastFile = parser.getText();
                default -> parser.skipChildren(); // includedFrom carries its own "file"
            }
        }

        if (macro) {
            return expansionFile;
        }
        return valid ? lastFile : null;
    }

    /**
     * Reads a nested object and returns one of its string members, skipping the rest.
     */
    private static String readStringMember(JsonParser parser, String member) throws IOException {
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            parser.skipChildren();
            return null;
        }
        String value = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            parser.nextToken();
            if (member.equals(field) && parser.currentToken() == JsonToken.VALUE_STRING) {
                value = parser.getText();
            } else {
                parser.skipChildren();
            }
        }
        return value;
    }

    private static final class NodeFields {
        String id;
        String kind;
        String name;
        String referencedName;
        String qualType;
        String parentDeclContextId;
        boolean implicit;
        boolean hasLoc;
        String locFile;
        String rangeFile;
    }
}
