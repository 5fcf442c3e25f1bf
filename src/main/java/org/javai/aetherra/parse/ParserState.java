package org.javai.aetherra.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.aetherra.lex.Token;
import org.javai.aetherra.lex.TokenKind;

/**
 * Cursor over a token list plus the diagnostics collected so far.
 * The cursor only moves forward and never passes the trailing EOF token.
 */
class ParserState {

	private final List<Token> tokens;
	private final ParseMode mode;
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private int current = 0;

	ParserState(List<Token> tokens, ParseMode mode) {
		this.tokens = withTrailingEof(tokens);
		this.mode = mode;
	}

	Token peek() {
		return tokens.get(current);
	}

	/**
	 * The token {@code offset} positions ahead, or the EOF token if that is past the end.
	 */
	Token peek(int offset) {
		int index = Math.min(current + offset, tokens.size() - 1);
		return tokens.get(index);
	}

	Token advance() {
		Token token = tokens.get(current);
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	boolean check(TokenKind kind) {
		return peek().kind() == kind;
	}

	boolean match(TokenKind kind) {
		if (check(kind)) {
			advance();
			return true;
		}
		return false;
	}

	boolean isAtEnd() {
		return peek().kind() == TokenKind.EOF;
	}

	boolean atStatementEnd() {
		return peek().isStatementEnd();
	}

	/**
	 * Consumes a token of the given kind or fails the current statement.
	 *
	 * @param what description of the expected token used in the error message
	 */
	Token expect(TokenKind kind, String what) {
		if (check(kind)) {
			return advance();
		}
		throw unexpected(what);
	}

	AetherraParseException unexpected(String what) {
		Token found = peek();
		String message = found.is(TokenKind.EOF)
				? "Unexpected end of input, expected " + what
				: "Expected " + what + " but found " + found.describe();
		return new AetherraParseException(Diagnostic.error(message, found));
	}

	/**
	 * Reports an error the parser can continue past: recorded in lenient mode, thrown in strict mode.
	 */
	void recoverableError(Diagnostic diagnostic) {
		if (mode == ParseMode.STRICT) {
			throw new AetherraParseException(diagnostic);
		}
		diagnostics.add(diagnostic);
	}

	void record(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
	}

	void skipNewlines() {
		while (check(TokenKind.NEWLINE)) {
			advance();
		}
	}

	/**
	 * Skips to the next statement boundary: past the next line break, or up to (not past) an {@code end}.
	 */
	void synchronize() {
		while (!isAtEnd() && !check(TokenKind.NEWLINE) && !check(TokenKind.END)) {
			advance();
		}
		match(TokenKind.NEWLINE);
	}

	ParseMode mode() {
		return mode;
	}

	int currentIndex() {
		return current;
	}

	List<Diagnostic> diagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	private static List<Token> withTrailingEof(List<Token> tokens) {
		if (tokens == null || tokens.isEmpty()) {
			return List.of(new Token(TokenKind.EOF, "", 1, 1));
		}
		Token last = tokens.get(tokens.size() - 1);
		if (last.is(TokenKind.EOF)) {
			return tokens;
		}
		List<Token> copy = new ArrayList<>(tokens);
		copy.add(new Token(TokenKind.EOF, "", last.line(), last.column() + last.text().length()));
		return copy;
	}
}
