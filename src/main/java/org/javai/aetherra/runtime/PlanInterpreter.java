package org.javai.aetherra.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.aetherra.plan.ExecutablePlan;
import org.javai.aetherra.plan.RuntimeCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential executor for compiled plans. Dispatches each call to a {@link RuntimeFacade} in plan order
 * and fails fast on the first compile error marker or failed call.
 * <p>
 * Nested plans are passed to the facade as {@link PlanThunk}s that execute the nested plan with the same
 * rules; a failure inside one surfaces as a {@link PlanExecutionException} and fails the enclosing call.
 */
public class PlanInterpreter {

	private static final Logger logger = LoggerFactory.getLogger(PlanInterpreter.class);

	private static final PlanThunk NOTHING = () -> {
	};

	private final RuntimeFacade facade;
	private final Invocations invocations = new Invocations();

	public PlanInterpreter(RuntimeFacade facade) {
		this.facade = Objects.requireNonNull(facade, "facade must not be null");
	}

	public PlanExecutionResult execute(ExecutablePlan plan) {
		if (plan == null) {
			return new PlanExecutionResult(false, List.of(CallResult.failed(null, null, "Plan is null")));
		}

		List<CallResult> results = new ArrayList<>();
		boolean success = true;

		for (RuntimeCall call : plan.calls()) {
			if (call instanceof RuntimeCall.CompileError error) {
				String message = "Plan contains compile error at line " + error.line() + ": " + error.message();
				logger.warn("Execution stopped: {}", message);
				results.add(CallResult.failed(call, null, message));
				success = false;
				break; // stop execution on error
			}

			CallResult result = invoke(call);
			results.add(result);
			if (!result.success()) {
				success = false;
				break; // fail fast on execution error
			}
		}

		return new PlanExecutionResult(success, results);
	}

	private CallResult invoke(RuntimeCall call) {
		try {
			call.accept(invocations).run();
			return CallResult.succeeded(call);
		}
		catch (PlanExecutionException ex) {
			logger.warn("Nested plan of {} failed: {}", call.getClass().getSimpleName(), ex.getMessage());
			return CallResult.failed(call, ex, ex.getMessage());
		}
		catch (RuntimeException ex) {
			logger.warn("Runtime call {} failed: {}", call.getClass().getSimpleName(), ex.getMessage());
			return CallResult.failed(call, ex, "Execution failed: " + ex.getMessage());
		}
	}

	private PlanThunk nested(ExecutablePlan plan) {
		if (plan.calls().isEmpty()) {
			return NOTHING;
		}
		return () -> {
			PlanExecutionResult result = execute(plan);
			if (!result.success()) {
				String message = result.failure()
						.map(CallResult::message)
						.orElse("Nested plan failed");
				throw new PlanExecutionException(message, result);
			}
		};
	}

	/**
	 * Maps each call to the facade invocation that performs it.
	 */
	private final class Invocations implements RuntimeCall.Visitor<PlanThunk> {

		@Override
		public PlanThunk visitSetGoal(RuntimeCall.SetGoal call) {
			return () -> facade.setGoal(call.objective(), call.priority());
		}

		@Override
		public PlanThunk visitAgentCommand(RuntimeCall.AgentCommand call) {
			return () -> facade.agentCommand(call.command());
		}

		@Override
		public PlanThunk visitMemoryRemember(RuntimeCall.MemoryRemember call) {
			return () -> facade.remember(call.data(), call.tag());
		}

		@Override
		public PlanThunk visitMemoryRecall(RuntimeCall.MemoryRecall call) {
			return () -> facade.recall(call.query(), call.criteria());
		}

		@Override
		public PlanThunk visitMemoryPattern(RuntimeCall.MemoryPattern call) {
			return () -> facade.pattern(call.pattern(), call.frequency());
		}

		@Override
		public PlanThunk visitExecuteIntent(RuntimeCall.ExecuteIntent call) {
			return () -> facade.executeIntent(call.action(), call.target(), call.modifier());
		}

		@Override
		public PlanThunk visitExecuteConditional(RuntimeCall.ExecuteConditional call) {
			return () -> facade.executeConditional(call.condition(), nested(call.thenPlan()), nested(call.elsePlan()));
		}

		@Override
		public PlanThunk visitLoadPlugin(RuntimeCall.LoadPlugin call) {
			return () -> facade.loadPlugin(call.name(), nested(call.actionPlan()));
		}

		@Override
		public PlanThunk visitSuggestFix(RuntimeCall.SuggestFix call) {
			return () -> facade.suggestFix(call.target(), call.condition());
		}

		@Override
		public PlanThunk visitApplyFix(RuntimeCall.ApplyFix call) {
			return () -> facade.applyFix(call.target(), call.condition());
		}

		@Override
		public PlanThunk visitDefineFunction(RuntimeCall.DefineFunction call) {
			return () -> facade.defineFunction(call.name(), call.params(), nested(call.bodyPlan()));
		}

		@Override
		public PlanThunk visitCallFunction(RuntimeCall.CallFunction call) {
			return () -> facade.callFunction(call.name(), call.args());
		}

		@Override
		public PlanThunk visitExecuteLoop(RuntimeCall.ExecuteLoop call) {
			return () -> facade.executeLoop(call.kind(), call.binder(), call.source(), nested(call.bodyPlan()));
		}

		@Override
		public PlanThunk visitAssign(RuntimeCall.Assign call) {
			return () -> facade.assign(call.target(), call.value());
		}

		@Override
		public PlanThunk visitCompileError(RuntimeCall.CompileError call) {
			return () -> {
				throw new IllegalStateException("Compile error at line " + call.line() + ": " + call.message());
			};
		}
	}
}
