package io.callmap.analysis;

import io.callmap.ast.AstNode;
import io.callmap.ast.AstNodeKind;
import io.callmap.ast.AstProvider;
import io.callmap.ast.ParseException;
import io.callmap.compdb.CompileCommand;
import io.callmap.model.AnalysisResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.callmap.ast.TestAst.call;
import static io.callmap.ast.TestAst.function;
import static io.callmap.ast.TestAst.memberCall;
import static io.callmap.ast.TestAst.method;
import static io.callmap.ast.TestAst.record;
import static io.callmap.ast.TestAst.unit;
import static org.assertj.core.api.Assertions.assertThat;

class ProjectAnalyzerTest {

    private static final Path PROJECT = Path.of("/work/project");

    private final ByteArrayOutputStream warnings = new ByteArrayOutputStream();
    private final StubProvider provider = new StubProvider();
    private final ProjectAnalyzer analyzer = new ProjectAnalyzer(
            provider, new CallGraphBuilder(), null, new PrintStream(warnings, true, StandardCharsets.UTF_8));

    @Test
    void analyze_mergesUnitsAndFindsRoots() {
        provider.add("src/main.cpp", unit(
                function("main", call("helper")),
                function("helper")));
        provider.add("src/helper.cpp", unit(
                function("helper", memberCall("Widget", "run")),
                method(record("Widget"), "run")));

        // main.cpp only sees helper's prototype, so the defining unit is merged last
        AnalysisResult result = analyzer.analyze(List.of(command("src/main.cpp"), command("src/helper.cpp")));

        assertThat(result.unitsParsed()).isEqualTo(2);
        assertThat(result.failures()).isEmpty();
        assertThat(result.roots()).containsExactly("main");
        assertThat(result.graph().functions()).containsExactlyInAnyOrder("main", "helper", "Widget::run");
        assertThat(result.graph().isLeaf("Widget::run")).isTrue();
    }

    @Test
    void analyze_laterPrototypeOverwritesEarlierDefinition() {
        provider.add("src/helper.cpp", unit(function("helper", call("compute"))));
        provider.add("src/main.cpp", unit(function("main", call("helper")), function("helper")));

        AnalysisResult helperFirst = analyzer.analyze(List.of(command("src/helper.cpp"), command("src/main.cpp")));
        AnalysisResult mainFirst = analyzer.analyze(List.of(command("src/main.cpp"), command("src/helper.cpp")));

        assertThat(helperFirst.graph().isLeaf("helper")).isTrue();
        assertThat(mainFirst.graph().callees("helper")).containsExactly("compute");
    }

    @Test
    void analyze_continuesAfterParseFailure() {
        provider.add("src/main.cpp", unit(function("main", call("helper"))));
        provider.add("src/helper.cpp", unit(function("helper")));

        AnalysisResult result = analyzer.analyze(List.of(
                command("src/broken.cpp"), command("src/main.cpp"), command("src/helper.cpp")));

        assertThat(result.unitsParsed()).isEqualTo(2);
        assertThat(result.failures())
                .extracting(AnalysisResult.UnitFailure::file)
                .containsExactly(PROJECT.resolve("src/broken.cpp"));
        assertThat(result.roots()).containsExactly("main");
        assertThat(warnings.toString(StandardCharsets.UTF_8))
                .contains("Warning: Failed to parse " + PROJECT.resolve("src/broken.cpp"));
    }

    @Test
    void analyze_passesStrippedFlagsToProvider() {
        provider.add("src/main.cpp", unit(function("main")));

        analyzer.analyze(List.of(new CompileCommand(PROJECT, PROJECT.resolve("src/main.cpp"),
                List.of("g++", "-c", "src/main.cpp", "-o", "build/main.o", "-I./inc"))));

        assertThat(provider.flagsSeen).containsExactly(List.of("-I./inc"));
    }

    @Test
    void analyze_countsSkippedCalls() {
        AstNode bareMember = AstNode.builder(AstNodeKind.MEMBER_REF_EXPR)
                .spelling("tick")
                .originFile(PROJECT.resolve("src/main.cpp").toString())
                .build();
        AstNode callNode = AstNode.builder(AstNodeKind.CALL_EXPR)
                .originFile(PROJECT.resolve("src/main.cpp").toString())
                .child(bareMember)
                .build();
        provider.add("src/main.cpp", unit(function("main", callNode)));

        AnalysisResult result = analyzer.analyze(List.of(command("src/main.cpp")));

        assertThat(result.skippedCalls()).isEqualTo(1);
        assertThat(result.graph().isLeaf("main")).isTrue();
    }

    @Test
    void analyze_emptyInputHasNoFunctions() {
        AnalysisResult result = analyzer.analyze(List.of());

        assertThat(result.hasFunctions()).isFalse();
        assertThat(result.hasRoots()).isFalse();
    }

    private static CompileCommand command(String relative) {
        Path file = PROJECT.resolve(relative);
        return new CompileCommand(PROJECT, file, List.of("clang++", "-c", file.toString()));
    }

    /**
     * Serves prepared ASTs by file; any other file fails to parse.
     */
    private static final class StubProvider implements AstProvider {
        private final Map<Path, AstNode> units = new HashMap<>();
        final List<List<String>> flagsSeen = new ArrayList<>();

        void add(String relative, AstNode root) {
            units.put(PROJECT.resolve(relative), root);
        }

        @Override
        public AstNode parse(Path source, Path workDir, List<String> flags) throws ParseException {
            flagsSeen.add(flags);
            AstNode root = units.get(source);
            if (root == null) {
                throw new ParseException(source, "error: expected ';' after expression");
            }
            return root;
        }

        @Override
        public String name() {
            return "stub";
        }
    }
}
