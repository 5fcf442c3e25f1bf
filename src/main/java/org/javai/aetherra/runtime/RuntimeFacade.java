package org.javai.aetherra.runtime;

import java.util.List;
import java.util.Map;
import org.javai.aetherra.plan.RuntimeCall;

/**
 * The execution environment a compiled plan drives: goals, agents, memory, plugins and self-modification.
 * Supplied by the caller; the compiler never holds one.
 * <p>
 * Block operations receive their body as a {@link PlanThunk}. The facade runs it zero or more times and
 * should let a {@link PlanExecutionException} from it propagate. Any exception thrown by a facade method
 * fails the call that invoked it.
 */
public interface RuntimeFacade {

	void setGoal(String objective, String priority);

	void agentCommand(String command);

	/**
	 * @param tag optional tag, {@code null} when absent
	 */
	void remember(String data, String tag);

	/**
	 * @param criteria optional filters ({@code since}, {@code category}, {@code tag}, {@code limit}); empty when none
	 */
	void recall(String query, Map<String, String> criteria);

	void pattern(String pattern, String frequency);

	void executeIntent(String action, String target, String modifier);

	/**
	 * @param elseBranch runs nothing when the conditional has no else branch
	 */
	void executeConditional(String condition, PlanThunk thenBranch, PlanThunk elseBranch)
			throws PlanExecutionException;

	void loadPlugin(String name, PlanThunk actions) throws PlanExecutionException;

	/**
	 * @param condition optional guard text, {@code null} when absent
	 */
	void suggestFix(String target, String condition);

	void applyFix(String target, String condition);

	void defineFunction(String name, List<String> params, PlanThunk body) throws PlanExecutionException;

	void callFunction(String name, List<String> args);

	void executeLoop(RuntimeCall.ExecuteLoop.LoopKind kind, String binder, String source, PlanThunk body)
			throws PlanExecutionException;

	/**
	 * @param value unevaluated value text
	 */
	void assign(String target, String value);
}
