package org.javai.aetherra.lex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts AetherraCode source text into a stream of tokens.
 * <p>
 * Lexing never fails: characters that start no token are skipped and an unterminated string
 * runs to the end of the input. Both cases are recorded as {@link LexWarning}s. The token list
 * always ends with exactly one {@link TokenKind#EOF}.
 * <p>
 * Instances are single-use and not thread-safe; create one per source string.
 */
public class AetherraTokenizer {

	private static final Logger logger = LoggerFactory.getLogger(AetherraTokenizer.class);

	private final String input;
	private final boolean retainComments;
	private final List<LexWarning> warnings = new ArrayList<>();
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public AetherraTokenizer(String input) {
		this(input, false);
	}

	/**
	 * @param input the source text; {@code null} is treated as empty
	 * @param retainComments emit {@code #} comments as {@link TokenKind#COMMENT} tokens instead of dropping them
	 */
	public AetherraTokenizer(String input, boolean retainComments) {
		this.input = input != null ? input : "";
		this.retainComments = retainComments;
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens, terminated by a single EOF token
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			Token token = nextToken();
			if (token != null) {
				tokens.add(token);
			}
		}

		tokens.add(new Token(TokenKind.EOF, "", line, column));
		return tokens;
	}

	/**
	 * Warnings recorded by the last {@link #tokenize()} call.
	 */
	public List<LexWarning> warnings() {
		return Collections.unmodifiableList(warnings);
	}

	private Token nextToken() {
		int startLine = line;
		int startColumn = column;
		char c = peek();

		return switch (c) {
			case '\n' -> {
				advance();
				yield new Token(TokenKind.NEWLINE, "\n", startLine, startColumn);
			}
			case '#' -> scanComment();
			case '"', '\'' -> scanString();
			case ':' -> single(TokenKind.COLON);
			case ',' -> single(TokenKind.COMMA);
			case '(' -> single(TokenKind.LPAREN);
			case ')' -> single(TokenKind.RPAREN);
			case '[' -> single(TokenKind.LBRACKET);
			case ']' -> single(TokenKind.RBRACKET);
			case '{' -> single(TokenKind.LBRACE);
			case '}' -> single(TokenKind.RBRACE);
			case '+' -> single(TokenKind.PLUS);
			case '-' -> single(TokenKind.MINUS);
			case '*' -> single(TokenKind.STAR);
			case '/' -> single(TokenKind.SLASH);
			case '>' -> operator(TokenKind.GREATER, TokenKind.GREATER_EQUAL);
			case '<' -> operator(TokenKind.LESS, TokenKind.LESS_EQUAL);
			case '=' -> operator(TokenKind.ASSIGN, TokenKind.EQUAL);
			case '!' -> {
				if (peekNext() == '=') {
					yield operator(null, TokenKind.NOT_EQUAL);
				}
				yield skipUnknown(c);
			}
			default -> {
				if (isDigit(c)) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanIdentifier();
				} else {
					yield skipUnknown(c);
				}
			}
		};
	}

	private Token single(TokenKind kind) {
		int startLine = line;
		int startColumn = column;
		char c = advance();
		return new Token(kind, String.valueOf(c), startLine, startColumn);
	}

	/**
	 * Scans a one- or two-character operator; the two-character form is the one followed by '='.
	 */
	private Token operator(TokenKind singleKind, TokenKind withEqualsKind) {
		int startLine = line;
		int startColumn = column;
		char first = advance();
		if (peek() == '=' && !isAtEnd()) {
			advance();
			return new Token(withEqualsKind, first + "=", startLine, startColumn);
		}
		return new Token(singleKind, String.valueOf(first), startLine, startColumn);
	}

	private Token scanComment() {
		int startLine = line;
		int startColumn = column;
		advance(); // consume '#'
		int start = pos;
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		if (!retainComments) {
			return null;
		}
		return new Token(TokenKind.COMMENT, input.substring(start, pos).trim(), startLine, startColumn);
	}

	private Token scanString() {
		int startLine = line;
		int startColumn = column;
		char quote = advance(); // consume opening quote

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != quote) {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			warn("Unterminated string", startLine, startColumn);
		} else {
			advance(); // consume closing quote
		}
		return new Token(TokenKind.STRING, sb.toString(), startLine, startColumn);
	}

	private Token scanNumber() {
		int startLine = line;
		int startColumn = column;
		int start = pos;

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		// Check for decimal part
		if (peek() == '.' && isDigit(peekNext())) {
			advance(); // consume '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		if (peek() == '%' && !isAtEnd()) {
			advance();
		}

		return new Token(TokenKind.NUMBER, input.substring(start, pos), startLine, startColumn);
	}

	private Token scanIdentifier() {
		int startLine = line;
		int startColumn = column;
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		return new Token(TokenKind.forWord(value), value, startLine, startColumn);
	}

	private Token skipUnknown(char c) {
		warn("Unrecognized character '" + c + "' skipped", line, column);
		advance();
		return null;
	}

	private void warn(String message, int atLine, int atColumn) {
		logger.debug("Lex warning at {}:{}: {}", atLine, atColumn, message);
		warnings.add(new LexWarning(message, atLine, atColumn));
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\r' || c == '\f';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c) || c == '.';
	}
}
