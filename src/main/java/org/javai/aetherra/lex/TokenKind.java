package org.javai.aetherra.lex;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of token kinds produced by {@link AetherraTokenizer}.
 */
public enum TokenKind {

	// Keywords
	GOAL("goal"),
	AGENT("agent"),
	REMEMBER("remember"),
	RECALL("recall"),
	MEMORY("memory"),
	WHEN("when"),
	IF("if"),
	ELSE("else"),
	END("end"),
	PLUGIN("plugin"),
	SUGGEST("suggest"),
	APPLY("apply"),
	OPTIMIZE("optimize"),
	LEARN("learn"),
	ANALYZE("analyze"),
	AS("as"),
	FOR("for"),
	WHILE("while"),
	IN("in"),
	FROM("from"),
	TO("to"),
	WITH("with"),
	PRIORITY("priority"),
	DEFINE("define"),
	RUN("run"),
	SINCE("since"),
	CATEGORY("category"),
	LIMIT("limit"),
	AND("and"),
	OR("or"),
	NOT("not"),
	TRUE("true"),
	FALSE("false"),

	// Structural
	COLON(null),
	COMMA(null),
	LPAREN(null),
	RPAREN(null),
	LBRACKET(null),
	RBRACKET(null),
	LBRACE(null),
	RBRACE(null),
	ASSIGN(null),

	// Operators
	GREATER(null),
	GREATER_EQUAL(null),
	LESS(null),
	LESS_EQUAL(null),
	EQUAL(null),
	NOT_EQUAL(null),
	PLUS(null),
	MINUS(null),
	STAR(null),
	SLASH(null),

	// Literals
	STRING(null),
	NUMBER(null),
	IDENTIFIER(null),

	COMMENT(null),
	NEWLINE(null),
	EOF(null);

	private static final Map<String, TokenKind> KEYWORDS;

	static {
		Map<String, TokenKind> keywords = new HashMap<>();
		for (TokenKind kind : values()) {
			if (kind.keyword != null) {
				keywords.put(kind.keyword, kind);
			}
		}
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final String keyword;

	TokenKind(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * The reserved word for keyword kinds, {@code null} otherwise.
	 */
	public String keyword() {
		return keyword;
	}

	public boolean isKeyword() {
		return keyword != null;
	}

	/**
	 * Resolves a word to its keyword kind, ignoring case, or {@link #IDENTIFIER} if it is not reserved.
	 */
	public static TokenKind forWord(String word) {
		return KEYWORDS.getOrDefault(word.toLowerCase(Locale.ROOT), IDENTIFIER);
	}
}
