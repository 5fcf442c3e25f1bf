package org.javai.aetherra.runtime;

/**
 * Signals that a nested plan failed while the facade was running it.
 * The interpreter turns it into a failed {@link CallResult} for the enclosing call.
 */
public class PlanExecutionException extends Exception {

	private final transient PlanExecutionResult result;

	public PlanExecutionException(String message, PlanExecutionResult result) {
		super(message);
		this.result = result;
	}

	/**
	 * Outcome of the failed nested plan; its last call is the one that failed.
	 */
	public PlanExecutionResult result() {
		return result;
	}
}
