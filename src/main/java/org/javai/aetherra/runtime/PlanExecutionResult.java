package org.javai.aetherra.runtime;

import java.util.List;
import java.util.Optional;

/**
 * Captures the outcome of executing a plan. Execution stops at the first failure, so a failed result
 * ends with the failing call and holds no results for the calls after it.
 */
public record PlanExecutionResult(boolean success, List<CallResult> calls) {

	public PlanExecutionResult {
		calls = calls != null ? List.copyOf(calls) : List.of();
	}

	public Optional<CallResult> failure() {
		return calls.stream().filter(c -> !c.success()).findFirst();
	}
}
