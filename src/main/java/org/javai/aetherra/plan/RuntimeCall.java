package org.javai.aetherra.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One call on the runtime facade. Block statements carry their bodies as nested {@link ExecutablePlan}s.
 * <p>
 * In JSON every call is an object tagged by a {@code call} property, e.g.
 * {@code {"call":"set_goal","objective":"reduce latency","priority":"high"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "call")
@JsonSubTypes({
		@JsonSubTypes.Type(value = RuntimeCall.SetGoal.class, name = "set_goal"),
		@JsonSubTypes.Type(value = RuntimeCall.AgentCommand.class, name = "agent_command"),
		@JsonSubTypes.Type(value = RuntimeCall.MemoryRemember.class, name = "memory_remember"),
		@JsonSubTypes.Type(value = RuntimeCall.MemoryRecall.class, name = "memory_recall"),
		@JsonSubTypes.Type(value = RuntimeCall.MemoryPattern.class, name = "memory_pattern"),
		@JsonSubTypes.Type(value = RuntimeCall.ExecuteIntent.class, name = "execute_intent"),
		@JsonSubTypes.Type(value = RuntimeCall.ExecuteConditional.class, name = "execute_conditional"),
		@JsonSubTypes.Type(value = RuntimeCall.LoadPlugin.class, name = "load_plugin"),
		@JsonSubTypes.Type(value = RuntimeCall.SuggestFix.class, name = "suggest_fix"),
		@JsonSubTypes.Type(value = RuntimeCall.ApplyFix.class, name = "apply_fix"),
		@JsonSubTypes.Type(value = RuntimeCall.DefineFunction.class, name = "define_function"),
		@JsonSubTypes.Type(value = RuntimeCall.CallFunction.class, name = "call_function"),
		@JsonSubTypes.Type(value = RuntimeCall.ExecuteLoop.class, name = "execute_loop"),
		@JsonSubTypes.Type(value = RuntimeCall.Assign.class, name = "assign"),
		@JsonSubTypes.Type(value = RuntimeCall.CompileError.class, name = "compile_error")
})
public sealed interface RuntimeCall {

	<R> R accept(Visitor<R> visitor);

	/**
	 * One method per call type, so adding a call type breaks every consumer until it handles it.
	 */
	interface Visitor<R> {
		R visitSetGoal(SetGoal call);

		R visitAgentCommand(AgentCommand call);

		R visitMemoryRemember(MemoryRemember call);

		R visitMemoryRecall(MemoryRecall call);

		R visitMemoryPattern(MemoryPattern call);

		R visitExecuteIntent(ExecuteIntent call);

		R visitExecuteConditional(ExecuteConditional call);

		R visitLoadPlugin(LoadPlugin call);

		R visitSuggestFix(SuggestFix call);

		R visitApplyFix(ApplyFix call);

		R visitDefineFunction(DefineFunction call);

		R visitCallFunction(CallFunction call);

		R visitExecuteLoop(ExecuteLoop call);

		R visitAssign(Assign call);

		R visitCompileError(CompileError call);
	}

	record SetGoal(
			@JsonProperty("objective") String objective,
			@JsonProperty("priority") String priority
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSetGoal(this);
		}
	}

	record AgentCommand(@JsonProperty("command") String command) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAgentCommand(this);
		}
	}

	record MemoryRemember(
			@JsonProperty("data") String data,
			@JsonProperty("tag") String tag
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitMemoryRemember(this);
		}
	}

	/**
	 * @param criteria optional filters keyed {@code since}, {@code category}, {@code tag} and {@code limit}
	 */
	record MemoryRecall(
			@JsonProperty("query") String query,
			@JsonProperty("criteria") Map<String, String> criteria
	) implements RuntimeCall {
		public MemoryRecall {
			criteria = criteria == null || criteria.isEmpty()
					? Map.of()
					: Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitMemoryRecall(this);
		}
	}

	record MemoryPattern(
			@JsonProperty("pattern") String pattern,
			@JsonProperty("frequency") String frequency
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitMemoryPattern(this);
		}
	}

	record ExecuteIntent(
			@JsonProperty("action") String action,
			@JsonProperty("target") String target,
			@JsonProperty("modifier") String modifier
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExecuteIntent(this);
		}
	}

	/**
	 * @param elsePlan the else branch; empty when the conditional has none
	 */
	record ExecuteConditional(
			@JsonProperty("condition") String condition,
			@JsonProperty("thenPlan") ExecutablePlan thenPlan,
			@JsonProperty("elsePlan") ExecutablePlan elsePlan
	) implements RuntimeCall {
		public ExecuteConditional {
			thenPlan = thenPlan != null ? thenPlan : ExecutablePlan.empty();
			elsePlan = elsePlan != null ? elsePlan : ExecutablePlan.empty();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExecuteConditional(this);
		}
	}

	record LoadPlugin(
			@JsonProperty("name") String name,
			@JsonProperty("actionPlan") ExecutablePlan actionPlan
	) implements RuntimeCall {
		public LoadPlugin {
			actionPlan = actionPlan != null ? actionPlan : ExecutablePlan.empty();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLoadPlugin(this);
		}
	}

	record SuggestFix(
			@JsonProperty("target") String target,
			@JsonProperty("condition") String condition
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSuggestFix(this);
		}
	}

	record ApplyFix(
			@JsonProperty("target") String target,
			@JsonProperty("condition") String condition
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitApplyFix(this);
		}
	}

	record DefineFunction(
			@JsonProperty("name") String name,
			@JsonProperty("params") List<String> params,
			@JsonProperty("bodyPlan") ExecutablePlan bodyPlan
	) implements RuntimeCall {
		public DefineFunction {
			params = params != null ? List.copyOf(params) : List.of();
			bodyPlan = bodyPlan != null ? bodyPlan : ExecutablePlan.empty();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitDefineFunction(this);
		}
	}

	record CallFunction(
			@JsonProperty("name") String name,
			@JsonProperty("args") List<String> args
	) implements RuntimeCall {
		public CallFunction {
			args = args != null ? List.copyOf(args) : List.of();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCallFunction(this);
		}
	}

	/**
	 * @param binder the loop variable of a {@code for} loop, {@code null} for {@code while}
	 * @param source the iterated text of a {@code for} loop or the condition of a {@code while} loop
	 */
	record ExecuteLoop(
			@JsonProperty("kind") LoopKind kind,
			@JsonProperty("binder") String binder,
			@JsonProperty("source") String source,
			@JsonProperty("bodyPlan") ExecutablePlan bodyPlan
	) implements RuntimeCall {

		public enum LoopKind {
			FOR,
			WHILE
		}

		public ExecuteLoop {
			bodyPlan = bodyPlan != null ? bodyPlan : ExecutablePlan.empty();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExecuteLoop(this);
		}
	}

	/**
	 * @param value the unevaluated value text; string literals keep their quotes
	 */
	record Assign(
			@JsonProperty("target") String target,
			@JsonProperty("value") String value
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAssign(this);
		}
	}

	/**
	 * Marks a statement that could not be compiled. Sibling statements are still present in the plan.
	 */
	record CompileError(
			@JsonProperty("line") int line,
			@JsonProperty("message") String message
	) implements RuntimeCall {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCompileError(this);
		}
	}
}
