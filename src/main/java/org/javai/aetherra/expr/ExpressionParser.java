package org.javai.aetherra.expr;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.javai.aetherra.lex.AetherraTokenizer;
import org.javai.aetherra.lex.Token;
import org.javai.aetherra.lex.TokenKind;
import org.javai.aetherra.parse.AetherraParseException;
import org.javai.aetherra.parse.Diagnostic;

/**
 * Precedence-climbing parser for condition and value text.
 * <p>
 * Precedence from lowest to highest: {@code or}, {@code and}, equality ({@code == !=}), comparison
 * ({@code > >= < <=}), addition ({@code + -}), multiplication ({@code * /}), unary ({@code not -}) and
 * primaries (literals, names, calls, arrays, dictionaries, parenthesised expressions). All binary
 * operators are left-associative, so {@code a > b > c} is {@code (a > b) > c}.
 * Keywords other than {@code and}, {@code or}, {@code not}, {@code true} and {@code false} are read as names.
 * Prefix operators, parentheses, arrays, dictionaries and call arguments may nest at most
 * {@link #MAX_NESTING_DEPTH} levels deep.
 */
public final class ExpressionParser {

	public static final int MAX_NESTING_DEPTH = 200;

	private final List<Token> tokens;
	private int position = 0;
	private int depth = 0;

	public ExpressionParser(List<Token> tokens) {
		List<Token> filtered = new ArrayList<>();
		for (Token token : tokens) {
			if (!token.is(TokenKind.NEWLINE) && !token.is(TokenKind.COMMENT)) {
				filtered.add(token);
			}
		}
		if (filtered.isEmpty() || !filtered.get(filtered.size() - 1).is(TokenKind.EOF)) {
			filtered.add(new Token(TokenKind.EOF, "", 1, 1));
		}
		this.tokens = filtered;
	}

	/**
	 * Parses expression text such as {@code error_rate > 5% and not muted}.
	 *
	 * @throws AetherraParseException if the text is not a single well-formed expression
	 */
	public static Expression parse(String text) {
		return new ExpressionParser(new AetherraTokenizer(text).tokenize()).parseExpression();
	}

	/**
	 * Parses the tokens as one expression that must consume all input.
	 */
	public Expression parseExpression() {
		if (check(TokenKind.EOF)) {
			throw error("Expected an expression but found end of input");
		}
		Expression expression = parseOr();
		if (!check(TokenKind.EOF)) {
			throw error("Unexpected " + peek().describe() + " after expression");
		}
		return expression;
	}

	private Expression parseOr() {
		Expression left = parseAnd();
		while (match(TokenKind.OR)) {
			left = new Expression.Binary(Expression.BinaryOperator.OR, left, parseAnd());
		}
		return left;
	}

	private Expression parseAnd() {
		Expression left = parseEquality();
		while (match(TokenKind.AND)) {
			left = new Expression.Binary(Expression.BinaryOperator.AND, left, parseEquality());
		}
		return left;
	}

	private Expression parseEquality() {
		Expression left = parseComparison();
		while (check(TokenKind.EQUAL) || check(TokenKind.NOT_EQUAL)) {
			Expression.BinaryOperator op = advance().is(TokenKind.EQUAL)
					? Expression.BinaryOperator.EQUAL
					: Expression.BinaryOperator.NOT_EQUAL;
			left = new Expression.Binary(op, left, parseComparison());
		}
		return left;
	}

	private Expression parseComparison() {
		Expression left = parseAddition();
		while (check(TokenKind.GREATER) || check(TokenKind.GREATER_EQUAL)
				|| check(TokenKind.LESS) || check(TokenKind.LESS_EQUAL)) {
			Token opToken = advance();
			Expression.BinaryOperator op = switch (opToken.kind()) {
				case GREATER -> Expression.BinaryOperator.GREATER;
				case GREATER_EQUAL -> Expression.BinaryOperator.GREATER_EQUAL;
				case LESS -> Expression.BinaryOperator.LESS;
				case LESS_EQUAL -> Expression.BinaryOperator.LESS_EQUAL;
				default -> throw new IllegalStateException("Unknown comparison operator: " + opToken);
			};
			left = new Expression.Binary(op, left, parseAddition());
		}
		return left;
	}

	private Expression parseAddition() {
		Expression left = parseMultiplication();
		while (check(TokenKind.PLUS) || check(TokenKind.MINUS)) {
			Expression.BinaryOperator op = advance().is(TokenKind.PLUS)
					? Expression.BinaryOperator.ADD
					: Expression.BinaryOperator.SUBTRACT;
			left = new Expression.Binary(op, left, parseMultiplication());
		}
		return left;
	}

	private Expression parseMultiplication() {
		Expression left = parseUnary();
		while (check(TokenKind.STAR) || check(TokenKind.SLASH)) {
			Expression.BinaryOperator op = advance().is(TokenKind.STAR)
					? Expression.BinaryOperator.MULTIPLY
					: Expression.BinaryOperator.DIVIDE;
			left = new Expression.Binary(op, left, parseUnary());
		}
		return left;
	}

	private Expression parseUnary() {
		if (match(TokenKind.NOT)) {
			return nested(() -> new Expression.Unary(Expression.UnaryOperator.NOT, parseUnary()));
		}
		if (match(TokenKind.MINUS)) {
			return nested(() -> new Expression.Unary(Expression.UnaryOperator.NEGATE, parseUnary()));
		}
		return parsePrimary();
	}

	private Expression parsePrimary() {
		Token token = peek();
		switch (token.kind()) {
			case NUMBER -> {
				advance();
				return number(token);
			}
			case STRING -> {
				advance();
				return new Expression.StringLiteral(token.text());
			}
			case TRUE, FALSE -> {
				advance();
				return new Expression.BooleanLiteral(token.is(TokenKind.TRUE));
			}
			case LPAREN -> {
				advance();
				return nested(() -> {
					Expression inner = parseOr();
					consume(TokenKind.RPAREN, "')' to close '('");
					return inner;
				});
			}
			case LBRACKET -> {
				return nested(this::parseArray);
			}
			case LBRACE -> {
				return nested(this::parseDict);
			}
			default -> {
				if (isName(token)) {
					advance();
					if (check(TokenKind.LPAREN)) {
						return nested(() -> parseCall(token.text()));
					}
					return new Expression.Identifier(token.text());
				}
				throw error(token.is(TokenKind.EOF)
						? "Unexpected end of input in expression"
						: "Unexpected " + token.describe() + " in expression");
			}
		}
	}

	private Expression parseCall(String qualifiedName) {
		consume(TokenKind.LPAREN, "'('");
		List<Expression.Argument> arguments = new ArrayList<>();
		if (!check(TokenKind.RPAREN)) {
			do {
				if (isName(peek()) && peek(1).is(TokenKind.ASSIGN)) {
					String name = advance().text();
					advance(); // consume '='
					arguments.add(new Expression.Argument(name, parseOr()));
				} else {
					arguments.add(new Expression.Argument(null, parseOr()));
				}
			} while (match(TokenKind.COMMA));
		}
		consume(TokenKind.RPAREN, "')' to close the argument list");

		int dot = qualifiedName.lastIndexOf('.');
		if (dot > 0 && dot < qualifiedName.length() - 1) {
			return new Expression.Call(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1), arguments);
		}
		return new Expression.Call(null, qualifiedName, arguments);
	}

	private Expression parseArray() {
		consume(TokenKind.LBRACKET, "'['");
		List<Expression> elements = new ArrayList<>();
		if (!check(TokenKind.RBRACKET)) {
			do {
				elements.add(parseOr());
			} while (match(TokenKind.COMMA));
		}
		consume(TokenKind.RBRACKET, "']' to close the array");
		return new Expression.ArrayLiteral(elements);
	}

	private Expression parseDict() {
		consume(TokenKind.LBRACE, "'{'");
		List<Expression.Entry> entries = new ArrayList<>();
		if (!check(TokenKind.RBRACE)) {
			do {
				Token key = peek();
				if (!key.is(TokenKind.STRING) && !isName(key)) {
					throw error("Expected a dictionary key but found " + key.describe());
				}
				advance();
				consume(TokenKind.COLON, "':' after dictionary key");
				entries.add(new Expression.Entry(key.text(), parseOr()));
			} while (match(TokenKind.COMMA));
		}
		consume(TokenKind.RBRACE, "'}' to close the dictionary");
		return new Expression.DictLiteral(entries);
	}

	private Expression.NumberLiteral number(Token token) {
		String text = token.text();
		boolean percent = text.endsWith("%");
		String digits = percent ? text.substring(0, text.length() - 1) : text;
		return new Expression.NumberLiteral(new BigDecimal(digits), percent);
	}

	private boolean isName(Token token) {
		if (token.is(TokenKind.IDENTIFIER)) {
			return true;
		}
		return switch (token.kind()) {
			case AND, OR, NOT, TRUE, FALSE -> false;
			default -> token.kind().isKeyword();
		};
	}

	// ==================== Helper Methods ====================

	private Expression nested(Supplier<Expression> inner) {
		if (depth >= MAX_NESTING_DEPTH) {
			throw error("Expression nested deeper than " + MAX_NESTING_DEPTH + " levels");
		}
		depth++;
		try {
			return inner.get();
		} finally {
			depth--;
		}
	}

	private Token peek() {
		return tokens.get(position);
	}

	private Token peek(int offset) {
		return tokens.get(Math.min(position + offset, tokens.size() - 1));
	}

	private boolean check(TokenKind kind) {
		return peek().kind() == kind;
	}

	private boolean match(TokenKind kind) {
		if (check(kind)) {
			advance();
			return true;
		}
		return false;
	}

	private Token advance() {
		Token token = peek();
		if (!token.is(TokenKind.EOF)) {
			position++;
		}
		return token;
	}

	private Token consume(TokenKind kind, String what) {
		if (check(kind)) {
			return advance();
		}
		throw error("Expected " + what + " but found " + peek().describe());
	}

	private AetherraParseException error(String message) {
		return new AetherraParseException(Diagnostic.error(message, peek()));
	}
}
