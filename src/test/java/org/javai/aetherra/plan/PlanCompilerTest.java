package org.javai.aetherra.plan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.javai.aetherra.ast.AstNode;
import org.javai.aetherra.ast.NodeId;
import org.javai.aetherra.ast.SyntaxTree;
import org.javai.aetherra.config.CompilerOptions;
import org.javai.aetherra.lex.AetherraTokenizer;
import org.javai.aetherra.parse.AetherraParser;
import org.junit.jupiter.api.Test;

class PlanCompilerTest {

	private final PlanCompiler compiler = new PlanCompiler();

	private static SyntaxTree parse(String source) {
		return new AetherraParser(new AetherraTokenizer(source).tokenize()).parse().tree();
	}

	private static ExecutablePlan plan(RuntimeCall... calls) {
		return new ExecutablePlan(List.of(calls));
	}

	@Test
	void statementsCompileInSourceOrder() {
		ExecutablePlan plan = compiler.compile(parse("""
				goal: reduce memory usage by 30% priority: high
				agent: on
				remember("System initialized") as "startup"
				recall errors since "2024-01-01" limit 5
				memory.pattern("crash", frequency="daily")
				analyze recent_logs
				x = 5
				"""));

		assertThat(plan.calls()).containsExactly(
				new RuntimeCall.SetGoal("reduce memory usage by 30%", "high"),
				new RuntimeCall.AgentCommand("on"),
				new RuntimeCall.MemoryRemember("System initialized", "startup"),
				new RuntimeCall.MemoryRecall("errors", Map.of("since", "2024-01-01", "limit", "5")),
				new RuntimeCall.MemoryPattern("crash", "daily"),
				new RuntimeCall.ExecuteIntent("analyze", "recent_logs", null),
				new RuntimeCall.Assign("x", "5"));
		assertThat(plan.hasErrors()).isFalse();
	}

	@Test
	void conditionalBranchesBecomeNestedPlans() {
		ExecutablePlan plan = compiler.compile(parse("""
				when error_rate > 5%:
				    suggest fix for "performance"
				else:
				    agent: idle
				end
				"""));

		assertThat(plan.calls()).containsExactly(new RuntimeCall.ExecuteConditional(
				"error_rate > 5%",
				plan(new RuntimeCall.SuggestFix("fix for \"performance\"", null)),
				plan(new RuntimeCall.AgentCommand("idle"))));
	}

	@Test
	void missingElseCompilesToEmptyPlan() {
		ExecutablePlan plan = compiler.compile(parse("if ready:\n    agent: go\nend"));

		RuntimeCall.ExecuteConditional conditional = (RuntimeCall.ExecuteConditional) plan.calls().get(0);
		assertThat(conditional.thenPlan().size()).isEqualTo(1);
		assertThat(conditional.elsePlan()).isEqualTo(ExecutablePlan.empty());
	}

	@Test
	void blockBodiesBecomeNestedPlans() {
		ExecutablePlan plan = compiler.compile(parse("""
				plugin: monitor
				    analyze logs
				end
				define greet(name):
				    agent: hello
				end
				run greet("world")
				for host in fleet:
				    run greet(host)
				end
				while queue > 0:
				    agent: drain
				end
				"""));

		assertThat(plan.calls()).containsExactly(
				new RuntimeCall.LoadPlugin("monitor", plan(new RuntimeCall.ExecuteIntent("analyze", "logs", null))),
				new RuntimeCall.DefineFunction("greet", List.of("name"), plan(new RuntimeCall.AgentCommand("hello"))),
				new RuntimeCall.CallFunction("greet", List.of("world")),
				new RuntimeCall.ExecuteLoop(RuntimeCall.ExecuteLoop.LoopKind.FOR, "host", "fleet",
						plan(new RuntimeCall.CallFunction("greet", List.of("host")))),
				new RuntimeCall.ExecuteLoop(RuntimeCall.ExecuteLoop.LoopKind.WHILE, null, "queue > 0",
						plan(new RuntimeCall.AgentCommand("drain"))));
	}

	@Test
	void goalPriorityFallsBackToConfiguredDefault() {
		PlanCompiler withDefault = new PlanCompiler(CompilerOptions.defaults().withDefaultGoalPriority("medium"));
		SyntaxTree tree = parse("goal: ship it\ngoal: fix bugs priority: critical");

		assertThat(withDefault.compile(tree).calls()).containsExactly(
				new RuntimeCall.SetGoal("ship it", "medium"),
				new RuntimeCall.SetGoal("fix bugs", "critical"));
		assertThat(compiler.compile(tree).calls().get(0)).isEqualTo(new RuntimeCall.SetGoal("ship it", null));
	}

	@Test
	void invalidStatementBecomesCompileErrorAndSiblingsStillCompile() {
		ExecutablePlan plan = compiler.compile(parse("""
				agent: before
				define ():
				    agent: inside
				end
				agent: after
				"""));

		assertThat(plan.calls()).containsExactly(
				new RuntimeCall.AgentCommand("before"),
				new RuntimeCall.CompileError(2, "Line 2: function definition has no name"),
				new RuntimeCall.AgentCommand("after"));
		assertThat(plan.hasErrors()).isTrue();
	}

	@Test
	void nestedCompileErrorsAreFound() {
		ExecutablePlan plan = compiler.compile(parse("""
				plugin: guard
				    agent: watch
				    define ():
				    end
				end
				"""));

		assertThat(plan.calls()).singleElement().isInstanceOf(RuntimeCall.LoadPlugin.class);
		assertThat(plan.hasErrors()).isTrue();
		assertThat(plan.compileErrors()).containsExactly(
				new RuntimeCall.CompileError(3, "Line 3: function definition has no name"));
	}

	@Test
	void commentsProduceNoCalls() {
		SyntaxTree.Builder builder = SyntaxTree.builder();
		NodeId comment = builder.add(new AstNode.Comment(1, "# setup"));
		NodeId agent = builder.add(new AstNode.Agent(2, "start"));
		SyntaxTree tree = builder.build(builder.add(new AstNode.Program(List.of(comment, agent))));

		assertThat(compiler.compile(tree).calls()).containsExactly(new RuntimeCall.AgentCommand("start"));
	}

	@Test
	void malformedSourceStillCompiles() {
		ExecutablePlan plan = compiler.compile(parse("foo bar\n)\nwhen"));

		assertThat(plan.calls()).containsExactly(
				new RuntimeCall.CompileError(3, "Line 3: 'when' has no condition"));
	}

	@Test
	void emptyProgramCompilesToEmptyPlan() {
		assertThat(compiler.compile(SyntaxTree.empty())).isEqualTo(ExecutablePlan.empty());
	}

	@Test
	void compilingTwiceGivesEqualPlans() {
		SyntaxTree tree = parse("when a > 1:\n    remember(\"x\")\nend\nrun f(1, 2)");

		assertThat(compiler.compile(tree)).isEqualTo(compiler.compile(tree));
	}

	@Test
	void describeIndentsNestedPlans() {
		ExecutablePlan plan = compiler.compile(parse("""
				when ready:
				    agent: go
				else
				    agent: wait
				end
				"""));

		assertThat(plan.describe()).isEqualTo("""
				execute_conditional("ready")
				  agent_command("go")
				else
				  agent_command("wait")
				""");
	}
}
