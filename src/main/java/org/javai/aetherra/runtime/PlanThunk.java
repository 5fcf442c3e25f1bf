package org.javai.aetherra.runtime;

/**
 * Deferred execution of a nested plan, handed to the facade for block calls.
 * The facade decides whether and how often to run it.
 */
@FunctionalInterface
public interface PlanThunk {

	/**
	 * Runs the nested plan.
	 *
	 * @throws PlanExecutionException if a call in the nested plan fails
	 */
	void run() throws PlanExecutionException;
}
