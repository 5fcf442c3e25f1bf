package org.javai.aetherra.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.aetherra.ast.AstNode;
import org.javai.aetherra.ast.NodeId;
import org.javai.aetherra.ast.NodeKind;
import org.javai.aetherra.ast.SyntaxTree;
import org.javai.aetherra.lex.AetherraTokenizer;
import org.javai.aetherra.parse.AetherraParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AetherraAnalyzerTest {

	private AetherraAnalyzer analyzer;

	@BeforeEach
	void setUp() {
		analyzer = new AetherraAnalyzer();
	}

	private static SyntaxTree parse(String source) {
		return new AetherraParser(new AetherraTokenizer(source).tokenize()).parse().tree();
	}

	@Test
	void countsNodesDepthAndComplexity() {
		SyntaxTree tree = parse("""
				goal: stay healthy
				plugin: monitor
				    when load > 1:
				        agent: scale
				        remember("scaled") as "ops"
				    end
				end
				define check(host):
				    run ping(host)
				end
				for host in fleet:
				    run check(host)
				end
				""");

		AnalysisReport report = analyzer.analyze(tree);

		assertThat(report.totalNodes()).isEqualTo(tree.size());
		assertThat(report.count(NodeKind.PROGRAM)).isEqualTo(1);
		assertThat(report.count(NodeKind.FUNCTION_CALL)).isEqualTo(2);
		assertThat(report.count(NodeKind.ASSIGNMENT)).isZero();
		// program 0, plugin 1, when 2, agent 3
		assertThat(report.maxDepth()).isEqualTo(3);
		// plugin 1 + when 2 + agent 1 + memory 1 + define 1 + run 1 + for 2 + run 1
		assertThat(report.complexityScore()).isEqualTo(10);
		assertThat(report.errors()).isEmpty();
		assertThat(report.warnings()).isEmpty();
		assertThat(report.isValid()).isTrue();
	}

	@Test
	void emptyProgram() {
		AnalysisReport report = analyzer.analyze(SyntaxTree.empty());

		assertThat(report.totalNodes()).isEqualTo(1);
		assertThat(report.maxDepth()).isZero();
		assertThat(report.complexityScore()).isZero();
	}

	@Test
	void functionWithoutNameIsAnError() {
		AnalysisReport report = analyzer.analyze(parse("define ():\nend"));

		assertThat(report.errors()).containsExactly("Line 1: function definition has no name");
		assertThat(report.isValid()).isFalse();
	}

	@Test
	void memoryWithoutOperationIsAnError() {
		SyntaxTree.Builder builder = SyntaxTree.builder();
		NodeId memory = builder.add(new AstNode.Memory(4, null, "x", null, null));
		SyntaxTree tree = builder.build(builder.add(new AstNode.Program(List.of(memory))));

		assertThat(analyzer.analyze(tree).errors()).containsExactly("Line 4: memory statement has no operation");
	}

	@Test
	void emptyGoalIsOnlyAWarning() {
		AnalysisReport report = analyzer.analyze(parse("goal:"));

		assertThat(report.errors()).isEmpty();
		assertThat(report.warnings()).containsExactly("Line 1: goal has an empty objective");
	}

	@Test
	void emptyTargetsAreWarnings() {
		AnalysisReport report = analyzer.analyze(parse("optimize\nsuggest if ready"));

		assertThat(report.warnings()).containsExactly(
				"Line 1: 'optimize' has no target",
				"Line 2: self-modification has no target");
	}

	@Test
	void duplicateFunctionNamesAreWarnings() {
		AnalysisReport report = analyzer.analyze(parse("""
				define sync():
				end
				define sync(x):
				end
				"""));

		assertThat(report.warnings()).containsExactly("Line 3: function 'sync' is already defined at line 1");
	}

	@Test
	void duplicateParametersAreErrors() {
		AnalysisReport report = analyzer.analyze(parse("define f(a, a):\nend"));

		assertThat(report.errors()).containsExactly("Line 1: parameter 'a' is declared twice");
	}

	@Test
	void conditionsThatAreNotExpressionsAreWarnings() {
		AnalysisReport report = analyzer.analyze(parse("""
				when load is high:
				    agent: scale
				end
				while queue > 0:
				    agent: drain
				end
				"""));

		assertThat(report.warnings()).singleElement()
				.satisfies(w -> assertThat(w).startsWith("Line 1: condition 'load is high' is not a valid expression"));
	}

	@Test
	void analysisDoesNotModifyTheTree() {
		SyntaxTree tree = parse("goal: x\nwhen a:\n    agent: b\nend");
		SyntaxTree copy = parse("goal: x\nwhen a:\n    agent: b\nend");

		analyzer.analyze(tree);

		assertThat(tree).isEqualTo(copy);
	}

	@Test
	void weightsCoverEveryNodeKind() {
		for (NodeKind kind : NodeKind.values()) {
			assertThat(AetherraAnalyzer.weight(kind)).isBetween(0, 2);
		}
	}

	@Test
	void deeplyNestedConditionsAreWarningsNotFailures() {
		AnalysisReport parens = analyzer.analyze(parse(
				"when " + "(".repeat(20_000) + "x" + ")".repeat(20_000) + ":\n    agent: on\nend\n"));
		AnalysisReport negations = analyzer.analyze(parse("when " + "not ".repeat(50_000) + "x:\n    agent: on\nend\n"));

		assertThat(parens.errors()).isEmpty();
		assertThat(parens.warnings()).singleElement()
				.satisfies(w -> assertThat(w).startsWith("Line 1: condition '").contains("nested deeper than"));
		assertThat(negations.warnings()).singleElement()
				.satisfies(w -> assertThat(w).contains("nested deeper than"));
		assertThat(negations.count(NodeKind.AGENT)).isEqualTo(1);
	}
}
