package org.javai.aetherra.lex;

/**
 * A classified lexical unit of AetherraCode source.
 *
 * @param kind the token kind
 * @param text the token text; for strings the unescaped content without quotes
 * @param line 1-based source line
 * @param column 1-based source column of the first character
 */
public record Token(TokenKind kind, String text, int line, int column) {

	@Override
	public String toString() {
		return switch (kind) {
			case STRING -> "STRING(\"" + text + "\")";
			case NUMBER, IDENTIFIER, COMMENT -> kind + "(" + text + ")";
			default -> kind.toString();
		};
	}

	public boolean is(TokenKind expected) {
		return this.kind == expected;
	}

	/**
	 * True for tokens that end a statement: a line break or the end of input.
	 */
	public boolean isStatementEnd() {
		return kind == TokenKind.NEWLINE || kind == TokenKind.EOF;
	}

	/**
	 * Human-readable description used in diagnostics.
	 */
	public String describe() {
		return switch (kind) {
			case EOF -> "end of input";
			case NEWLINE -> "end of line";
			case STRING -> "string \"" + text + "\"";
			default -> "'" + text + "'";
		};
	}
}
