package org.javai.aetherra.lex;

/**
 * Non-fatal lexical problem; lexing always continues past it.
 */
public record LexWarning(String message, int line, int column) {

	public String format() {
		return "line %d, column %d: %s".formatted(line, column, message);
	}
}
