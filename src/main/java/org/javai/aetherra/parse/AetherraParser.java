package org.javai.aetherra.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.aetherra.ast.AstNode;
import org.javai.aetherra.ast.NodeId;
import org.javai.aetherra.ast.SyntaxTree;
import org.javai.aetherra.config.CompilerOptions;
import org.javai.aetherra.lex.Token;
import org.javai.aetherra.lex.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for AetherraCode with one token of lookahead.
 * <p>
 * Statements are dispatched on their first token. Blocks ({@code when}, {@code if}, {@code plugin},
 * {@code define}, {@code for}, {@code while}) parse nested statements until their {@code end}; nesting
 * is handled by recursion. Example:
 *
 * <pre>
 * goal: reduce memory usage by 30% priority: high
 * remember("System initialized") as "startup"
 * when error_rate > 5%:
 *     suggest fix for "performance"
 * end
 * </pre>
 *
 * In {@link ParseMode#LENIENT} mode a syntax error ends only the statement it occurs in; the parser skips
 * to the next statement boundary and continues. In {@link ParseMode#STRICT} mode the first error aborts
 * the parse. Instances are single-use.
 */
public class AetherraParser {

	private static final Logger logger = LoggerFactory.getLogger(AetherraParser.class);

	private final ParserState state;
	private final CompilerOptions options;
	private final SyntaxTree.Builder builder = SyntaxTree.builder();
	private int depth = 0;

	/**
	 * Creates a lenient parser with default options.
	 */
	public AetherraParser(List<Token> tokens) {
		this(tokens, CompilerOptions.defaults());
	}

	public AetherraParser(List<Token> tokens, CompilerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.state = new ParserState(tokens, options.parseMode());
	}

	/**
	 * Parses the whole token stream into a program.
	 *
	 * @return the tree with all diagnostics; never throws for malformed input
	 */
	public ParseResult parse() {
		List<NodeId> statements = new ArrayList<>();
		try {
			state.skipNewlines();
			while (!state.isAtEnd()) {
				NodeId id = parseStatement();
				if (id != null) {
					statements.add(id);
				}
				state.skipNewlines();
			}
		} catch (AetherraParseException e) {
			// Only strict mode lets an error escape a statement
			state.record(e.diagnostics().get(0));
			logger.debug("Strict parse aborted: {}", e.getMessage());
			return new ParseResult(SyntaxTree.empty(), state.diagnostics());
		}

		NodeId root = builder.add(new AstNode.Program(statements));
		SyntaxTree tree = builder.build(root);
		logger.debug("Parsed {} statements ({} nodes) with {} diagnostics",
				statements.size(), tree.size(), state.diagnostics().size());
		return new ParseResult(tree, state.diagnostics());
	}

	/**
	 * Parses one statement and adds it to the arena.
	 *
	 * @return the id of the new node, or {@code null} if the statement was skipped
	 */
	private NodeId parseStatement() {
		int startIndex = state.currentIndex();
		int mark = builder.size();
		try {
			AstNode node = parseStatementNode();
			if (node == null) {
				return null;
			}
			expectStatementEnd();
			return builder.add(node);
		} catch (AetherraParseException e) {
			if (state.mode() == ParseMode.STRICT) {
				throw e;
			}
			state.record(e.diagnostics().get(0));
			builder.truncate(mark);
			if (state.currentIndex() == startIndex && !state.isAtEnd()) {
				state.advance();
			}
			state.synchronize();
			logger.debug("Recovered from syntax error: {}", e.getMessage());
			return null;
		}
	}

	private AstNode parseStatementNode() {
		Token token = state.peek();
		return switch (token.kind()) {
			case GOAL -> parseGoal();
			case AGENT -> parseAgent();
			case REMEMBER -> parseRemember();
			case RECALL -> parseRecall();
			case MEMORY -> throw new AetherraParseException(Diagnostic.error(
					"Expected 'memory.pattern(...)' but found " + state.peek(1).describe() + " after 'memory'",
					token));
			case OPTIMIZE, LEARN, ANALYZE -> parseIntent();
			case WHEN, IF -> parseConditional();
			case PLUGIN -> parsePlugin();
			case SUGGEST, APPLY -> parseSelfModification();
			case DEFINE -> parseFunctionDef();
			case RUN -> parseFunctionCall();
			case FOR, WHILE -> parseLoop();
			case COMMENT -> {
				state.advance();
				yield new AstNode.Comment(token.line(), token.text());
			}
			case END, ELSE -> throw new AetherraParseException(Diagnostic.error(
					"Unexpected '" + token.text() + "' without an open block", token));
			case IDENTIFIER -> {
				if ("memory.pattern".equals(token.text().toLowerCase(Locale.ROOT))) {
					yield parsePattern();
				}
				if (state.peek(1).is(TokenKind.ASSIGN)) {
					yield parseAssignment();
				}
				yield skipUnknownStatement(token);
			}
			default -> skipUnknownStatement(token);
		};
	}

	private AstNode skipUnknownStatement(Token token) {
		String message = "Unrecognized statement starting with " + token.describe();
		if (state.mode() == ParseMode.STRICT) {
			throw new AetherraParseException(Diagnostic.error(message, token));
		}
		state.record(Diagnostic.warning(message + "; line skipped", token));
		logger.debug("Skipping unrecognized statement at line {}", token.line());
		state.synchronize();
		return null;
	}

	private void expectStatementEnd() {
		if (state.atStatementEnd()) {
			state.match(TokenKind.NEWLINE);
			return;
		}
		// An 'end' closing the enclosing block may follow a complete statement on the same line
		if (state.check(TokenKind.END) && depth > 0) {
			return;
		}
		throw state.unexpected("end of line");
	}

	// goal: <objective> [priority: <level>]
	private AstNode parseGoal() {
		Token keyword = state.advance();
		state.expect(TokenKind.COLON, "':' after 'goal'");

		List<Token> objective = collectUntil(TokenKind.PRIORITY);
		String priority = null;
		if (state.match(TokenKind.PRIORITY)) {
			state.expect(TokenKind.COLON, "':' after 'priority'");
			Token level = state.peek();
			if (!level.is(TokenKind.IDENTIFIER) && !level.is(TokenKind.STRING)) {
				throw state.unexpected("priority level");
			}
			state.advance();
			priority = level.text();
		}
		return new AstNode.Goal(keyword.line(), FreeText.joinUnquoted(objective), priority);
	}

	// agent: <command>
	private AstNode parseAgent() {
		Token keyword = state.advance();
		state.expect(TokenKind.COLON, "':' after 'agent'");
		return new AstNode.Agent(keyword.line(), FreeText.joinUnquoted(collectUntil()));
	}

	// remember("<data>") [as "<tag>"]
	private AstNode parseRemember() {
		Token keyword = state.advance();
		state.match(TokenKind.COLON);
		state.expect(TokenKind.LPAREN, "'(' after 'remember'");
		String data = state.expect(TokenKind.STRING, "string to remember").text();
		state.expect(TokenKind.RPAREN, "closing ')'");

		String tag = null;
		if (state.match(TokenKind.AS)) {
			tag = state.expect(TokenKind.STRING, "tag string after 'as'").text();
		}
		return new AstNode.Memory(keyword.line(), AstNode.Memory.Operation.REMEMBER, data, tag, null);
	}

	// recall <query> [since "<date>"] [in category "<cat>"] [with "<tag>"] [limit <n>]
	private AstNode parseRecall() {
		Token keyword = state.advance();
		List<Token> query = new ArrayList<>();
		while (!state.atStatementEnd() && !atRecallCriterion()) {
			query.add(state.advance());
		}

		Map<String, String> criteria = new LinkedHashMap<>();
		while (atRecallCriterion()) {
			Token criterion = state.advance();
			switch (criterion.kind()) {
				case SINCE -> criteria.put("since", state.expect(TokenKind.STRING, "date string after 'since'").text());
				case IN -> {
					state.expect(TokenKind.CATEGORY, "'category' after 'in'");
					criteria.put("category", state.expect(TokenKind.STRING, "category string").text());
				}
				case WITH -> criteria.put("tag", state.expect(TokenKind.STRING, "tag string after 'with'").text());
				case LIMIT -> criteria.put("limit", state.expect(TokenKind.NUMBER, "number after 'limit'").text());
				default -> throw new IllegalStateException("Unexpected recall criterion: " + criterion);
			}
		}
		return new AstNode.Memory(keyword.line(), AstNode.Memory.Operation.RECALL,
				FreeText.joinUnquoted(query), null, criteria);
	}

	private boolean atRecallCriterion() {
		return switch (state.peek().kind()) {
			case SINCE, WITH, LIMIT -> true;
			case IN -> state.peek(1).is(TokenKind.CATEGORY);
			default -> false;
		};
	}

	// memory.pattern("<pattern>"[, frequency="<freq>"])
	private AstNode parsePattern() {
		Token keyword = state.advance();
		state.expect(TokenKind.LPAREN, "'(' after 'memory.pattern'");
		String pattern = state.expect(TokenKind.STRING, "pattern string").text();

		Map<String, String> criteria = new LinkedHashMap<>();
		while (state.match(TokenKind.COMMA)) {
			String name = state.expect(TokenKind.IDENTIFIER, "argument name").text();
			state.expect(TokenKind.ASSIGN, "'=' after '" + name + "'");
			criteria.put(name, state.expect(TokenKind.STRING, "string value for '" + name + "'").text());
		}
		state.expect(TokenKind.RPAREN, "closing ')'");
		return new AstNode.Memory(keyword.line(), AstNode.Memory.Operation.PATTERN, pattern, null, criteria);
	}

	// optimize|learn|analyze [for|from|to|with] <target>
	private AstNode parseIntent() {
		Token action = state.advance();
		String modifier = null;
		switch (state.peek().kind()) {
			case FOR, FROM, TO, WITH -> modifier = state.advance().text();
			default -> {
			}
		}
		return new AstNode.Intent(action.line(), action.text(), FreeText.joinUnquoted(collectUntil()), modifier);
	}

	// when|if <condition>: <statements> [else: <statements>] end
	private AstNode parseConditional() {
		Token keyword = state.advance();
		AstNode.Conditional.Kind kind = keyword.is(TokenKind.WHEN)
				? AstNode.Conditional.Kind.WHEN
				: AstNode.Conditional.Kind.IF;

		List<Token> condition = collectUntil(TokenKind.COLON);
		expectHeaderColon(keyword);

		List<NodeId> body = new ArrayList<>();
		Token terminator = parseBlock(keyword, body, true);
		List<NodeId> elseBody = null;
		if (terminator.is(TokenKind.ELSE)) {
			state.match(TokenKind.COLON);
			elseBody = new ArrayList<>();
			parseBlock(keyword, elseBody, false);
		}
		return new AstNode.Conditional(keyword.line(), kind, FreeText.join(condition), body, elseBody);
	}

	// plugin: <name> <statements> end
	private AstNode parsePlugin() {
		Token keyword = state.advance();
		state.expect(TokenKind.COLON, "':' after 'plugin'");
		Token name = state.peek();
		if (!name.is(TokenKind.IDENTIFIER) && !name.is(TokenKind.STRING)) {
			throw state.unexpected("plugin name after 'plugin:'");
		}
		state.advance();
		state.match(TokenKind.COLON);
		if (!state.atStatementEnd()) {
			throw state.unexpected("end of line after plugin name");
		}

		List<NodeId> actions = new ArrayList<>();
		parseBlock(keyword, actions, false);
		return new AstNode.Plugin(keyword.line(), name.text(), actions);
	}

	// suggest|apply <target> [if <condition>]
	private AstNode parseSelfModification() {
		Token keyword = state.advance();
		AstNode.SelfModification.Operation operation = keyword.is(TokenKind.SUGGEST)
				? AstNode.SelfModification.Operation.SUGGEST
				: AstNode.SelfModification.Operation.APPLY;

		List<Token> target = collectUntil(TokenKind.IF);
		String condition = null;
		if (state.match(TokenKind.IF)) {
			condition = FreeText.join(collectUntil());
		}
		return new AstNode.SelfModification(keyword.line(), operation, FreeText.joinUnquoted(target), condition);
	}

	// define <name>(<params>)[:] <statements> end
	private AstNode parseFunctionDef() {
		Token keyword = state.advance();
		// A missing name is left for the analyzer to report
		String name = state.check(TokenKind.IDENTIFIER) ? state.advance().text() : "";

		state.expect(TokenKind.LPAREN, "'(' after function name");
		List<String> params = new ArrayList<>();
		if (!state.check(TokenKind.RPAREN)) {
			do {
				params.add(state.expect(TokenKind.IDENTIFIER, "parameter name").text());
			} while (state.match(TokenKind.COMMA));
		}
		state.expect(TokenKind.RPAREN, "closing ')'");
		state.match(TokenKind.COLON);
		if (!state.atStatementEnd()) {
			throw state.unexpected("end of line after function header");
		}

		List<NodeId> body = new ArrayList<>();
		parseBlock(keyword, body, false);
		return new AstNode.FunctionDef(keyword.line(), name, params, body);
	}

	// run <name>(<args>)
	private AstNode parseFunctionCall() {
		Token keyword = state.advance();
		String name = state.expect(TokenKind.IDENTIFIER, "function name after 'run'").text();
		state.expect(TokenKind.LPAREN, "'(' after function name");

		List<String> args = new ArrayList<>();
		if (!state.check(TokenKind.RPAREN)) {
			do {
				List<Token> arg = collectArgument();
				if (arg.isEmpty()) {
					throw state.unexpected("argument");
				}
				args.add(FreeText.joinUnquoted(arg));
			} while (state.match(TokenKind.COMMA));
		}
		state.expect(TokenKind.RPAREN, "closing ')'");
		return new AstNode.FunctionCall(keyword.line(), name, args);
	}

	// Tokens of one call argument, up to a top-level ',' or ')'
	private List<Token> collectArgument() {
		List<Token> tokens = new ArrayList<>();
		int nesting = 0;
		while (!state.atStatementEnd()) {
			TokenKind kind = state.peek().kind();
			if (nesting == 0 && (kind == TokenKind.COMMA || kind == TokenKind.RPAREN)) {
				break;
			}
			switch (kind) {
				case LPAREN, LBRACKET, LBRACE -> nesting++;
				case RPAREN, RBRACKET, RBRACE -> nesting--;
				default -> {
				}
			}
			tokens.add(state.advance());
		}
		return tokens;
	}

	// for <binder> in <source>: <statements> end | while <condition>: <statements> end
	private AstNode parseLoop() {
		Token keyword = state.advance();
		AstNode.Loop.Kind kind;
		String binder = null;
		if (keyword.is(TokenKind.FOR)) {
			kind = AstNode.Loop.Kind.FOR;
			binder = state.expect(TokenKind.IDENTIFIER, "loop variable after 'for'").text();
			state.expect(TokenKind.IN, "'in' after loop variable");
		} else {
			kind = AstNode.Loop.Kind.WHILE;
		}
		List<Token> source = collectUntil(TokenKind.COLON);
		expectHeaderColon(keyword);

		List<NodeId> body = new ArrayList<>();
		parseBlock(keyword, body, false);
		return new AstNode.Loop(keyword.line(), kind, binder, FreeText.join(source), body);
	}

	// <name> = <value>
	private AstNode parseAssignment() {
		Token target = state.advance();
		state.expect(TokenKind.ASSIGN, "'='");
		List<Token> value = collectUntil();
		if (value.isEmpty()) {
			throw state.unexpected("value after '='");
		}
		return new AstNode.Assignment(target.line(), target.text(), FreeText.join(value));
	}

	private void expectHeaderColon(Token header) {
		if (state.match(TokenKind.COLON)) {
			return;
		}
		Token found = state.peek();
		state.recoverableError(Diagnostic.error(
				"Expected ':' after '" + header.text() + "' header but found " + found.describe(), found));
	}

	/**
	 * Parses statements into {@code body} until the block's {@code end} (consumed), an {@code else} when
	 * allowed (consumed), or the end of input, which is reported against the header line.
	 *
	 * @return the token that terminated the block
	 */
	private Token parseBlock(Token header, List<NodeId> body, boolean allowElse) {
		if (depth >= options.maxNestingDepth()) {
			throw new AetherraParseException(Diagnostic.error(
					"Blocks nested deeper than " + options.maxNestingDepth() + " levels", header));
		}
		depth++;
		try {
			while (true) {
				state.skipNewlines();
				Token token = state.peek();
				if (token.is(TokenKind.END)) {
					state.advance();
					return token;
				}
				if (token.is(TokenKind.ELSE) && allowElse) {
					state.advance();
					return token;
				}
				if (token.is(TokenKind.EOF)) {
					state.recoverableError(Diagnostic.error(
							"Unterminated '" + header.text() + "' block starting at line " + header.line()
									+ ": expected 'end'", header));
					return token;
				}
				NodeId id = parseStatement();
				if (id != null) {
					body.add(id);
				}
			}
		} finally {
			depth--;
		}
	}

	/**
	 * Collects the tokens up to the end of the line or, if given, the first token of {@code stopKind}.
	 */
	private List<Token> collectUntil(TokenKind stopKind) {
		List<Token> tokens = new ArrayList<>();
		while (!state.atStatementEnd() && !state.check(stopKind)) {
			tokens.add(state.advance());
		}
		return tokens;
	}

	private List<Token> collectUntil() {
		return collectUntil(TokenKind.NEWLINE);
	}
}
