package io.callmap.ast;

import io.callmap.analysis.CallGraphBuilder;
import io.callmap.model.UnitCallGraph;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClangJsonAstReaderTest {

    // Trimmed from clang 16 output for:
    //   widget.h: class Widget { public: void run(); };
    //   main.cpp: #include <stdio.h> / #include "widget.h"
    //             void helper(); void Widget::run() { helper(); }
    //             int main() { Widget w; w.run(); }
    private static final String UNIT = """
            {
              "id": "0x1", "kind": "TranslationUnitDecl", "loc": {},
              "range": {"begin": {}, "end": {}},
              "inner": [
                {
                  "id": "0x2", "kind": "TypedefDecl", "loc": {},
                  "range": {"begin": {}, "end": {}},
                  "isImplicit": true, "name": "__int128_t",
                  "type": {"qualType": "__int128"}
                },
                {
                  "id": "0x3", "kind": "FunctionDecl",
                  "loc": {"offset": 100, "file": "/usr/include/stdio.h", "line": 356, "col": 12, "tokLen": 6},
                  "range": {"begin": {"offset": 89, "col": 1, "tokLen": 6}, "end": {"offset": 140, "col": 52, "tokLen": 1}},
                  "name": "printf", "type": {"qualType": "int (const char *, ...)"}
                },
                {
                  "id": "0x4", "kind": "CXXRecordDecl",
                  "loc": {"offset": 6, "file": "/work/inc/widget.h", "line": 1, "col": 7, "tokLen": 6,
                          "includedFrom": {"file": "/work/src/main.cpp"}},
                  "range": {"begin": {"offset": 0, "col": 1, "tokLen": 5}, "end": {"offset": 40, "line": 3, "col": 1, "tokLen": 1}},
                  "name": "Widget", "tagUsed": "class", "completeDefinition": true,
                  "definitionData": {"isLiteral": true},
                  "inner": [
                    {
                      "id": "0x5", "kind": "CXXRecordDecl",
                      "loc": {"offset": 6, "col": 7, "tokLen": 6},
                      "range": {"begin": {"offset": 0, "col": 1, "tokLen": 5}, "end": {"offset": 6, "col": 7, "tokLen": 6}},
                      "isImplicit": true, "name": "Widget", "tagUsed": "class"
                    },
                    {
                      "id": "0x6", "kind": "CXXMethodDecl",
                      "loc": {"offset": 32, "line": 2, "col": 18, "tokLen": 3},
                      "range": {"begin": {"offset": 27, "col": 13, "tokLen": 4}, "end": {"offset": 36, "col": 22, "tokLen": 1}},
                      "name": "run", "type": {"qualType": "void ()"}
                    }
                  ]
                },
                {
                  "id": "0x7", "kind": "FunctionDecl",
                  "loc": {"offset": 45, "file": "/work/src/main.cpp", "line": 4, "col": 6, "tokLen": 6},
                  "range": {"begin": {"offset": 40, "col": 1, "tokLen": 4}, "end": {"offset": 52, "col": 13, "tokLen": 1}},
                  "name": "helper", "type": {"qualType": "void ()"}
                },
                {
                  "id": "0x8", "kind": "CXXMethodDecl", "parentDeclContextId": "0x4", "previousDecl": "0x6",
                  "loc": {"offset": 68, "line": 5, "col": 14, "tokLen": 3},
                  "range": {"begin": {"offset": 55, "col": 1, "tokLen": 4}, "end": {"offset": 86, "col": 32, "tokLen": 1}},
                  "name": "run", "type": {"qualType": "void ()"},
                  "inner": [
                    {
                      "id": "0x9", "kind": "CompoundStmt",
                      "range": {"begin": {"offset": 74, "col": 20, "tokLen": 1}, "end": {"offset": 86, "col": 32, "tokLen": 1}},
                      "inner": [
                        {
                          "id": "0xa", "kind": "CallExpr",
                          "range": {"begin": {"offset": 76, "col": 22, "tokLen": 6}, "end": {"offset": 83, "col": 29, "tokLen": 1}},
                          "type": {"qualType": "void"}, "valueCategory": "prvalue",
                          "inner": [
                            {
                              "id": "0xb", "kind": "ImplicitCastExpr",
                              "range": {"begin": {"offset": 76, "col": 22, "tokLen": 6}, "end": {"offset": 76, "col": 22, "tokLen": 6}},
                              "type": {"qualType": "void (*)()"}, "castKind": "FunctionToPointerDecay",
                              "inner": [
                                {
                                  "id": "0xc", "kind": "DeclRefExpr",
                                  "range": {"begin": {"offset": 76, "col": 22, "tokLen": 6}, "end": {"offset": 76, "col": 22, "tokLen": 6}},
                                  "type": {"qualType": "void ()"},
                                  "referencedDecl": {"id": "0x7", "kind": "FunctionDecl", "name": "helper", "type": {"qualType": "void ()"}}
                                }
                              ]
                            }
                          ]
                        }
                      ]
                    }
                  ]
                },
                {
                  "id": "0xd", "kind": "FunctionDecl",
                  "loc": {"offset": 92, "line": 6, "col": 5, "tokLen": 4},
                  "range": {"begin": {"offset": 88, "col": 1, "tokLen": 3}, "end": {"offset": 120, "col": 33, "tokLen": 1}},
                  "name": "main", "type": {"qualType": "int ()"},
                  "inner": [
                    {
                      "id": "0xe", "kind": "CompoundStmt",
                      "range": {"begin": {"offset": 99, "col": 12, "tokLen": 1}, "end": {"offset": 120, "col": 33, "tokLen": 1}},
                      "inner": [
                        {
                          "id": "0xf", "kind": "CXXMemberCallExpr",
                          "range": {"begin": {"offset": 111, "col": 24, "tokLen": 1}, "end": {"offset": 117, "col": 30, "tokLen": 1}},
                          "type": {"qualType": "void"},
                          "inner": [
                            {
                              "id": "0x10", "kind": "MemberExpr",
                              "range": {"begin": {"offset": 111, "col": 24, "tokLen": 1}, "end": {"offset": 113, "col": 26, "tokLen": 3}},
                              "type": {"qualType": "<bound member function type>"},
                              "name": "run", "isArrow": false, "referencedMemberDecl": "0x6",
                              "inner": [
                                {
                                  "id": "0x11", "kind": "DeclRefExpr",
                                  "range": {"begin": {"offset": 111, "col": 24, "tokLen": 1}, "end": {"offset": 111, "col": 24, "tokLen": 1}},
                                  "type": {"qualType": "Widget"},
                                  "referencedDecl": {"id": "0x12", "kind": "VarDecl", "name": "w", "type": {"qualType": "Widget"}}
                                }
                              ]
                            }
                          ]
                        }
                      ]
                    }
                  ]
                }
              ]
            }
            """;

    private final ClangJsonAstReader reader = new ClangJsonAstReader();

    @Test
    void read_dropsImplicitDeclarations() throws IOException {
        AstNode root = read(UNIT);

        assertThat(root.children())
                .extracting(AstNode::spelling)
                .containsExactly("printf", "Widget", "helper", "run", "main");
        AstNode widget = root.children().get(1);
        assertThat(widget.children()).extracting(AstNode::kind).containsExactly(AstNodeKind.METHOD_DECL);
    }

    @Test
    void read_tracksFileAcrossLocationsThatOmitIt() throws IOException {
        AstNode root = read(UNIT);

        assertThat(root.originFile()).isNull();
        assertThat(root.children().get(0).originFile()).isEqualTo("/usr/include/stdio.h");
        AstNode widget = root.children().get(1);
        assertThat(widget.originFile()).isEqualTo("/work/inc/widget.h");
        // includedFrom names main.cpp but does not change the current file
        assertThat(widget.children().get(0).originFile()).isEqualTo("/work/inc/widget.h");
        assertThat(root.children().get(3).originFile()).isEqualTo("/work/src/main.cpp");
        assertThat(root.children().get(4).originFile()).isEqualTo("/work/src/main.cpp");
    }

    @Test
    void read_resolvesSemanticParentOfMethods() throws IOException {
        AstNode root = read(UNIT);
        AstNode widget = root.children().get(1);

        AstNode inClass = widget.children().get(0);
        AstNode outOfLine = root.children().get(3);

        assertThat(inClass.semanticParent()).isSameAs(widget);
        assertThat(outOfLine.kind()).isEqualTo(AstNodeKind.METHOD_DECL);
        assertThat(outOfLine.semanticParent()).isSameAs(widget);
        assertThat(root.children().get(0).semanticParent()).isNull();
    }

    @Test
    void read_takesCallSpellingFromCalleeExpression() throws IOException {
        AstNode root = read(UNIT);

        AstNode freeCall = root.children().get(3).children().get(0).children().get(0);
        assertThat(freeCall.kind()).isEqualTo(AstNodeKind.CALL_EXPR);
        assertThat(freeCall.spelling()).isEqualTo("helper");
        assertThat(freeCall.originFile()).isEqualTo("/work/src/main.cpp");

        AstNode memberCall = root.children().get(4).children().get(0).children().get(0);
        assertThat(memberCall.spelling()).isEqualTo("run");
        AstNode memberRef = memberCall.children().get(0);
        assertThat(memberRef.kind()).isEqualTo(AstNodeKind.MEMBER_REF_EXPR);
        assertThat(memberRef.children().get(0).staticType()).isEqualTo("Widget");
    }

    @Test
    void read_feedsCallGraphBuilder() throws IOException {
        UnitCallGraph graph = new CallGraphBuilder().build(read(UNIT));

        assertThat(graph.functions()).containsExactly("Widget::run", "helper", "main");
        assertThat(graph.callees("Widget::run")).containsExactly("helper");
        assertThat(graph.callees("main")).containsExactly("Widget::run");
        assertThat(graph.skippedCalls()).isEmpty();
    }

    @Test
    void read_usesExpansionFileForMacroLocations() throws IOException {
        String json = """
                {
                  "id": "0x1", "kind": "TranslationUnitDecl", "loc": {}, "range": {"begin": {}, "end": {}},
                  "inner": [
                    {
                      "id": "0x2", "kind": "FunctionDecl",
                      "loc": {"offset": 10, "file": "/work/src/check.c", "line": 3, "col": 6, "tokLen": 5},
                      "range": {"begin": {"offset": 5, "col": 1, "tokLen": 4}, "end": {"offset": 60, "col": 1, "tokLen": 1}},
                      "name": "check",
                      "inner": [
                        {
                          "id": "0x3", "kind": "CallExpr",
                          "range": {
                            "begin": {
                              "spellingLoc": {"offset": 1200, "file": "/usr/include/assert.h", "line": 100, "col": 5, "tokLen": 13},
                              "expansionLoc": {"offset": 30, "file": "/work/src/check.c", "line": 4, "col": 3, "tokLen": 6}
                            },
                            "end": {
                              "spellingLoc": {"offset": 1230, "file": "/usr/include/assert.h", "line": 100, "col": 35, "tokLen": 1},
                              "expansionLoc": {"offset": 40, "file": "/work/src/check.c", "line": 4, "col": 13, "tokLen": 1}
                            }
                          },
                          "inner": [
                            {
                              "id": "0x4", "kind": "DeclRefExpr",
                              "range": {"begin": {"offset": 30, "col": 3, "tokLen": 6}, "end": {"offset": 30, "col": 3, "tokLen": 6}},
                              "referencedDecl": {"id": "0x5", "kind": "FunctionDecl", "name": "verify"}
                            }
                          ]
                        }
                      ]
                    }
                  ]
                }
                """;

        AstNode call = read(json).children().get(0).children().get(0);

        assertThat(call.originFile()).isEqualTo("/work/src/check.c");
        assertThat(call.spelling()).isEqualTo("verify");
        assertThat(call.children().get(0).originFile()).isEqualTo("/work/src/check.c");
    }

    @Test
    void read_builtinWithEmptyLocationHasNoOrigin() throws IOException {
        String json = """
                {
                  "id": "0x1", "kind": "TranslationUnitDecl", "loc": {}, "range": {"begin": {}, "end": {}},
                  "inner": [
                    {"id": "0x2", "kind": "FunctionDecl", "loc": {}, "range": {"begin": {}, "end": {}}, "name": "__builtin_expect"}
                  ]
                }
                """;

        AstNode builtin = read(json).children().get(0);

        assertThat(builtin.kind()).isEqualTo(AstNodeKind.FUNCTION_DECL);
        assertThat(builtin.originFile()).isNull();
    }

    @Test
    void read_rejectsInputThatIsNotAnObject() {
        assertThatThrownBy(() -> read("[1, 2, 3]"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    void mapKind_mapsClangKindsOntoNodeKinds() {
        assertThat(ClangJsonAstReader.mapKind("FunctionDecl")).isEqualTo(AstNodeKind.FUNCTION_DECL);
        assertThat(ClangJsonAstReader.mapKind("CXXMethodDecl")).isEqualTo(AstNodeKind.METHOD_DECL);
        assertThat(ClangJsonAstReader.mapKind("CXXMemberCallExpr")).isEqualTo(AstNodeKind.CALL_EXPR);
        assertThat(ClangJsonAstReader.mapKind("CXXOperatorCallExpr")).isEqualTo(AstNodeKind.CALL_EXPR);
        assertThat(ClangJsonAstReader.mapKind("MemberExpr")).isEqualTo(AstNodeKind.MEMBER_REF_EXPR);
        assertThat(ClangJsonAstReader.mapKind("CXXConstructorDecl")).isEqualTo(AstNodeKind.OTHER);
        assertThat(ClangJsonAstReader.mapKind(null)).isEqualTo(AstNodeKind.OTHER);
    }

    private AstNode read(String json) throws IOException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
