package org.javai.aetherra.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered runtime calls compiled from one statement list. Calls run in list order; nested plans
 * (conditional branches, plugin actions, function and loop bodies) run when the facade invokes them.
 */
public record ExecutablePlan(@JsonProperty("calls") List<RuntimeCall> calls) {

	private static final ExecutablePlan EMPTY = new ExecutablePlan(List.of());

	public ExecutablePlan {
		calls = calls != null ? List.copyOf(calls) : List.of();
	}

	public static ExecutablePlan empty() {
		return EMPTY;
	}

	public int size() {
		return calls.size();
	}

	/**
	 * True if this plan or any nested plan contains a {@link RuntimeCall.CompileError}.
	 */
	public boolean hasErrors() {
		return !compileErrors().isEmpty();
	}

	/**
	 * All compile error markers, nested ones included, in plan order.
	 */
	public List<RuntimeCall.CompileError> compileErrors() {
		List<RuntimeCall.CompileError> errors = new ArrayList<>();
		collectErrors(this, errors);
		return errors;
	}

	/**
	 * Multi-line rendering with nested plans indented under their call.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder();
		describe(this, 0, sb);
		return sb.toString();
	}

	private static void collectErrors(ExecutablePlan plan, List<RuntimeCall.CompileError> errors) {
		for (RuntimeCall call : plan.calls()) {
			if (call instanceof RuntimeCall.CompileError error) {
				errors.add(error);
			}
			for (ExecutablePlan nested : nestedPlans(call)) {
				collectErrors(nested, errors);
			}
		}
	}

	private static List<ExecutablePlan> nestedPlans(RuntimeCall call) {
		if (call instanceof RuntimeCall.ExecuteConditional conditional) {
			return List.of(conditional.thenPlan(), conditional.elsePlan());
		}
		if (call instanceof RuntimeCall.LoadPlugin plugin) {
			return List.of(plugin.actionPlan());
		}
		if (call instanceof RuntimeCall.DefineFunction function) {
			return List.of(function.bodyPlan());
		}
		if (call instanceof RuntimeCall.ExecuteLoop loop) {
			return List.of(loop.bodyPlan());
		}
		return List.of();
	}

	private static void describe(ExecutablePlan plan, int indent, StringBuilder sb) {
		for (RuntimeCall call : plan.calls()) {
			sb.append("  ".repeat(indent)).append(call.accept(new CallHeader())).append('\n');
			if (call instanceof RuntimeCall.ExecuteConditional conditional) {
				describe(conditional.thenPlan(), indent + 1, sb);
				if (conditional.elsePlan().size() > 0) {
					sb.append("  ".repeat(indent)).append("else\n");
					describe(conditional.elsePlan(), indent + 1, sb);
				}
			} else {
				for (ExecutablePlan nested : nestedPlans(call)) {
					describe(nested, indent + 1, sb);
				}
			}
		}
	}

	private static final class CallHeader implements RuntimeCall.Visitor<String> {

		@Override
		public String visitSetGoal(RuntimeCall.SetGoal call) {
			return "set_goal(" + quote(call.objective()) + ", " + quote(call.priority()) + ")";
		}

		@Override
		public String visitAgentCommand(RuntimeCall.AgentCommand call) {
			return "agent_command(" + quote(call.command()) + ")";
		}

		@Override
		public String visitMemoryRemember(RuntimeCall.MemoryRemember call) {
			return "memory.remember(" + quote(call.data()) + ", " + quote(call.tag()) + ")";
		}

		@Override
		public String visitMemoryRecall(RuntimeCall.MemoryRecall call) {
			return "memory.recall(" + quote(call.query()) + (call.criteria().isEmpty() ? "" : ", " + call.criteria()) + ")";
		}

		@Override
		public String visitMemoryPattern(RuntimeCall.MemoryPattern call) {
			return "memory.pattern(" + quote(call.pattern()) + ", " + quote(call.frequency()) + ")";
		}

		@Override
		public String visitExecuteIntent(RuntimeCall.ExecuteIntent call) {
			return "execute_intent(" + quote(call.action()) + ", " + quote(call.target()) + ", "
					+ quote(call.modifier()) + ")";
		}

		@Override
		public String visitExecuteConditional(RuntimeCall.ExecuteConditional call) {
			return "execute_conditional(" + quote(call.condition()) + ")";
		}

		@Override
		public String visitLoadPlugin(RuntimeCall.LoadPlugin call) {
			return "load_plugin(" + quote(call.name()) + ")";
		}

		@Override
		public String visitSuggestFix(RuntimeCall.SuggestFix call) {
			return "suggest_fix(" + quote(call.target()) + (call.condition() != null ? ", if " + quote(call.condition()) : "") + ")";
		}

		@Override
		public String visitApplyFix(RuntimeCall.ApplyFix call) {
			return "apply_fix(" + quote(call.target()) + (call.condition() != null ? ", if " + quote(call.condition()) : "") + ")";
		}

		@Override
		public String visitDefineFunction(RuntimeCall.DefineFunction call) {
			return "define_function(" + quote(call.name()) + ", " + call.params() + ")";
		}

		@Override
		public String visitCallFunction(RuntimeCall.CallFunction call) {
			return "call_function(" + quote(call.name()) + ", " + call.args() + ")";
		}

		@Override
		public String visitExecuteLoop(RuntimeCall.ExecuteLoop call) {
			return "execute_loop(" + call.kind() + ", " + quote(call.binder()) + ", " + quote(call.source()) + ")";
		}

		@Override
		public String visitAssign(RuntimeCall.Assign call) {
			return "assign(" + quote(call.target()) + ", " + call.value() + ")";
		}

		@Override
		public String visitCompileError(RuntimeCall.CompileError call) {
			return "compile_error(line " + call.line() + ": " + call.message() + ")";
		}

		private static String quote(String text) {
			return text == null ? "null" : "\"" + text + "\"";
		}
	}
}
