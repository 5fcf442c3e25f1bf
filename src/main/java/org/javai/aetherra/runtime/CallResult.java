package org.javai.aetherra.runtime;

import org.javai.aetherra.plan.RuntimeCall;

/**
 * Per-call execution outcome.
 */
public record CallResult(
		RuntimeCall call,
		boolean success,
		Throwable error,
		String message
) {

	static CallResult succeeded(RuntimeCall call) {
		return new CallResult(call, true, null, null);
	}

	static CallResult failed(RuntimeCall call, Throwable error, String message) {
		return new CallResult(call, false, error, message);
	}
}
