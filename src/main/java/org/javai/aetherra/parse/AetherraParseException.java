package org.javai.aetherra.parse;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when AetherraCode input cannot be parsed.
 */
public class AetherraParseException extends RuntimeException {

	private final List<Diagnostic> diagnostics;

	public AetherraParseException(Diagnostic diagnostic) {
		this(List.of(diagnostic));
	}

	public AetherraParseException(List<Diagnostic> diagnostics) {
		super(describe(diagnostics));
		this.diagnostics = List.copyOf(diagnostics);
	}

	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}

	private static String describe(List<Diagnostic> diagnostics) {
		if (diagnostics == null || diagnostics.isEmpty()) {
			return "Parse failed";
		}
		return diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("; "));
	}
}
