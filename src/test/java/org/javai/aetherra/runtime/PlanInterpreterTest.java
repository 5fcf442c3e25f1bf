package org.javai.aetherra.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.aetherra.plan.ExecutablePlan;
import org.javai.aetherra.plan.RuntimeCall;
import org.javai.aetherra.testsupport.LogCapture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PlanInterpreterTest {

	@Mock
	private RuntimeFacade facade;

	private PlanInterpreter interpreter;

	@BeforeEach
	void setUp() {
		interpreter = new PlanInterpreter(facade);
	}

	private static ExecutablePlan plan(RuntimeCall... calls) {
		return new ExecutablePlan(List.of(calls));
	}

	@Test
	void callsAreDispatchedInPlanOrder() {
		PlanExecutionResult result = interpreter.execute(plan(
				new RuntimeCall.SetGoal("ship", "high"),
				new RuntimeCall.AgentCommand("on"),
				new RuntimeCall.MemoryRemember("started", "boot"),
				new RuntimeCall.MemoryRecall("errors", Map.of("limit", "5")),
				new RuntimeCall.MemoryPattern("crash", "daily"),
				new RuntimeCall.ExecuteIntent("optimize", "memory", "for"),
				new RuntimeCall.SuggestFix("performance", "load > 1"),
				new RuntimeCall.ApplyFix("cache", null),
				new RuntimeCall.CallFunction("greet", List.of("world")),
				new RuntimeCall.Assign("x", "5")));

		assertThat(result.success()).isTrue();
		assertThat(result.calls()).hasSize(10).allMatch(CallResult::success);
		assertThat(result.failure()).isEmpty();

		InOrder order = inOrder(facade);
		order.verify(facade).setGoal("ship", "high");
		order.verify(facade).agentCommand("on");
		order.verify(facade).remember("started", "boot");
		order.verify(facade).recall("errors", Map.of("limit", "5"));
		order.verify(facade).pattern("crash", "daily");
		order.verify(facade).executeIntent("optimize", "memory", "for");
		order.verify(facade).suggestFix("performance", "load > 1");
		order.verify(facade).applyFix("cache", null);
		order.verify(facade).callFunction("greet", List.of("world"));
		order.verify(facade).assign("x", "5");
	}

	@Test
	void conditionalBranchesRunWhenTheFacadeInvokesThem() throws Exception {
		doAnswer(invocation -> {
			invocation.<PlanThunk>getArgument(1).run();
			invocation.<PlanThunk>getArgument(2).run();
			return null;
		}).when(facade).executeConditional(anyString(), any(), any());

		PlanExecutionResult result = interpreter.execute(plan(new RuntimeCall.ExecuteConditional("ready",
				plan(new RuntimeCall.AgentCommand("go"), new RuntimeCall.AgentCommand("report")),
				ExecutablePlan.empty())));

		assertThat(result.success()).isTrue();
		InOrder order = inOrder(facade);
		order.verify(facade).executeConditional(eq("ready"), any(), any());
		order.verify(facade).agentCommand("go");
		order.verify(facade).agentCommand("report");
	}

	@Test
	void bodiesAreNotRunUnlessTheFacadeAsks() throws Exception {
		PlanExecutionResult result = interpreter.execute(plan(
				new RuntimeCall.DefineFunction("greet", List.of("name"), plan(new RuntimeCall.AgentCommand("hello")))));

		assertThat(result.success()).isTrue();
		ArgumentCaptor<PlanThunk> body = ArgumentCaptor.forClass(PlanThunk.class);
		verify(facade).defineFunction(eq("greet"), eq(List.of("name")), body.capture());
		verify(facade, never()).agentCommand(anyString());

		body.getValue().run();
		verify(facade).agentCommand("hello");
	}

	@Test
	void loopBodyMayRunRepeatedly() throws Exception {
		doAnswer(invocation -> {
			PlanThunk body = invocation.getArgument(3);
			body.run();
			body.run();
			return null;
		}).when(facade).executeLoop(any(), any(), anyString(), any());

		PlanExecutionResult result = interpreter.execute(plan(new RuntimeCall.ExecuteLoop(
				RuntimeCall.ExecuteLoop.LoopKind.FOR, "host", "fleet",
				plan(new RuntimeCall.CallFunction("ping", List.of("host"))))));

		assertThat(result.success()).isTrue();
		verify(facade).executeLoop(eq(RuntimeCall.ExecuteLoop.LoopKind.FOR), eq("host"), eq("fleet"), any());
		verify(facade, times(2)).callFunction("ping", List.of("host"));
	}

	@Test
	void executionStopsAtCompileError() {
		try (LogCapture capture = LogCapture.of(PlanInterpreter.class, Level.WARN)) {
			PlanExecutionResult result = interpreter.execute(plan(
					new RuntimeCall.AgentCommand("before"),
					new RuntimeCall.CompileError(2, "Line 2: plugin has no name"),
					new RuntimeCall.AgentCommand("after")));

			assertThat(result.success()).isFalse();
			assertThat(result.calls()).hasSize(2);
			assertThat(result.failure()).hasValueSatisfying(failure -> {
				assertThat(failure.call()).isInstanceOf(RuntimeCall.CompileError.class);
				assertThat(failure.message()).isEqualTo("Plan contains compile error at line 2: Line 2: plugin has no name");
			});
			assertThat(capture.messagesAt(Level.WARN)).singleElement()
					.isEqualTo("Execution stopped: Plan contains compile error at line 2: Line 2: plugin has no name");
		}
		verify(facade).agentCommand("before");
		verify(facade, never()).agentCommand("after");
	}

	@Test
	void facadeFailureStopsExecution() {
		doThrow(new IllegalStateException("agent offline")).when(facade).agentCommand("first");

		PlanExecutionResult result = interpreter.execute(plan(
				new RuntimeCall.AgentCommand("first"),
				new RuntimeCall.SetGoal("never", null)));

		assertThat(result.success()).isFalse();
		assertThat(result.calls()).singleElement().satisfies(failure -> {
			assertThat(failure.success()).isFalse();
			assertThat(failure.message()).isEqualTo("Execution failed: agent offline");
			assertThat(failure.error()).isInstanceOf(IllegalStateException.class);
		});
		verify(facade, never()).setGoal(anyString(), isNull());
	}

	@Test
	void failureInsideNestedPlanFailsTheEnclosingCall() throws Exception {
		doAnswer(invocation -> {
			invocation.<PlanThunk>getArgument(1).run();
			return null;
		}).when(facade).loadPlugin(anyString(), any());
		doThrow(new IllegalArgumentException("unknown metric")).when(facade).executeIntent("analyze", "cpu", null);

		try (LogCapture capture = LogCapture.of(PlanInterpreter.class, Level.WARN)) {
			PlanExecutionResult result = interpreter.execute(plan(
					new RuntimeCall.LoadPlugin("monitor", plan(
							new RuntimeCall.ExecuteIntent("analyze", "cpu", null),
							new RuntimeCall.ExecuteIntent("analyze", "disk", null))),
					new RuntimeCall.AgentCommand("after")));

			assertThat(result.success()).isFalse();
			assertThat(result.calls()).singleElement().satisfies(failure -> {
				assertThat(failure.call()).isInstanceOf(RuntimeCall.LoadPlugin.class);
				assertThat(failure.message()).isEqualTo("Execution failed: unknown metric");
				assertThat(failure.error()).isInstanceOfSatisfying(PlanExecutionException.class,
						e -> assertThat(e.result().calls()).hasSize(1));
			});
			assertThat(capture.messagesAt(Level.WARN)).containsExactly(
					"Runtime call ExecuteIntent failed: unknown metric",
					"Nested plan of LoadPlugin failed: Execution failed: unknown metric");
		}
		verify(facade, never()).executeIntent("analyze", "disk", null);
		verify(facade, never()).agentCommand(anyString());
	}

	@Test
	void compileErrorInsideNestedPlanFailsTheEnclosingCall() throws Exception {
		doAnswer(invocation -> {
			invocation.<PlanThunk>getArgument(3).run();
			return null;
		}).when(facade).executeLoop(any(), any(), anyString(), any());

		PlanExecutionResult result = interpreter.execute(plan(new RuntimeCall.ExecuteLoop(
				RuntimeCall.ExecuteLoop.LoopKind.WHILE, null, "busy",
				plan(new RuntimeCall.CompileError(3, "Line 3: function call has no name")))));

		assertThat(result.success()).isFalse();
		assertThat(result.failure()).hasValueSatisfying(failure -> assertThat(failure.message())
				.isEqualTo("Plan contains compile error at line 3: Line 3: function call has no name"));
	}

	@Test
	void emptyPlanSucceedsWithoutTouchingTheFacade() {
		PlanExecutionResult result = interpreter.execute(ExecutablePlan.empty());

		assertThat(result.success()).isTrue();
		assertThat(result.calls()).isEmpty();
		verifyNoInteractions(facade);
	}

	@Test
	void nullPlanFails() {
		PlanExecutionResult result = interpreter.execute(null);

		assertThat(result.success()).isFalse();
		assertThat(result.failure()).hasValueSatisfying(failure -> assertThat(failure.message()).isEqualTo("Plan is null"));
	}
}
