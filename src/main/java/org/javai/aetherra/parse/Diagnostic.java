package org.javai.aetherra.parse;

import org.javai.aetherra.lex.Token;

/**
 * A positioned parser message. Errors are syntax errors; warnings mark skipped input.
 */
public record Diagnostic(Severity severity, String message, int line, int column) {

	public enum Severity {
		ERROR,
		WARNING
	}

	public static Diagnostic error(String message, Token at) {
		return new Diagnostic(Severity.ERROR, message, at.line(), at.column());
	}

	public static Diagnostic error(String message, int line, int column) {
		return new Diagnostic(Severity.ERROR, message, line, column);
	}

	public static Diagnostic warning(String message, Token at) {
		return new Diagnostic(Severity.WARNING, message, at.line(), at.column());
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	public String format() {
		return "%s at line %d, column %d: %s".formatted(
				severity == Severity.ERROR ? "Syntax error" : "Warning", line, column, message);
	}
}
