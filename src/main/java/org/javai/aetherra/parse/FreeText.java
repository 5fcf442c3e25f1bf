package org.javai.aetherra.parse;

import java.util.List;
import org.javai.aetherra.lex.Token;
import org.javai.aetherra.lex.TokenKind;

/**
 * Rebuilds free-text fields (objectives, conditions, targets) from the tokens that spelled them.
 * <p>
 * Tokens are joined with single spaces, except that no space follows an opening bracket or precedes a
 * closing bracket or comma, and a name is glued to the {@code (} that calls it. String tokens are
 * re-quoted so the text can later be parsed as an expression.
 */
public final class FreeText {

	private FreeText() {
	}

	public static String join(List<Token> tokens) {
		if (tokens == null || tokens.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		Token previous = null;
		for (Token token : tokens) {
			if (previous != null && needsSpace(previous, token)) {
				sb.append(' ');
			}
			sb.append(render(token));
			previous = token;
		}
		return sb.toString();
	}

	/**
	 * Like {@link #join(List)}, but a text made of one string literal yields the bare string.
	 */
	public static String joinUnquoted(List<Token> tokens) {
		if (tokens != null && tokens.size() == 1 && tokens.get(0).is(TokenKind.STRING)) {
			return tokens.get(0).text();
		}
		return join(tokens);
	}

	static String render(Token token) {
		if (token.is(TokenKind.STRING)) {
			String escaped = token.text()
					.replace("\\", "\\\\")
					.replace("\"", "\\\"")
					.replace("\n", "\\n")
					.replace("\t", "\\t")
					.replace("\r", "\\r");
			return "\"" + escaped + "\"";
		}
		return token.text();
	}

	private static boolean needsSpace(Token previous, Token next) {
		if (previous.is(TokenKind.LPAREN) || previous.is(TokenKind.LBRACKET) || previous.is(TokenKind.LBRACE)) {
			return false;
		}
		return switch (next.kind()) {
			case RPAREN, RBRACKET, RBRACE, COMMA -> false;
			case LPAREN -> !previous.is(TokenKind.IDENTIFIER);
			default -> true;
		};
	}
}
