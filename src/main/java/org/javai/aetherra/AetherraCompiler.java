package org.javai.aetherra;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.javai.aetherra.analysis.AetherraAnalyzer;
import org.javai.aetherra.analysis.AnalysisReport;
import org.javai.aetherra.ast.SyntaxTree;
import org.javai.aetherra.config.CompilerOptions;
import org.javai.aetherra.config.CompilerOptionsLoader;
import org.javai.aetherra.expr.Expression;
import org.javai.aetherra.expr.ExpressionParser;
import org.javai.aetherra.lex.AetherraTokenizer;
import org.javai.aetherra.lex.Token;
import org.javai.aetherra.parse.AetherraParser;
import org.javai.aetherra.parse.ParseResult;
import org.javai.aetherra.plan.ExecutablePlan;
import org.javai.aetherra.plan.PlanCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the AetherraCode front end: source text to tokens, syntax tree, analysis report and
 * {@link ExecutablePlan}.
 *
 * <pre>{@code
 * AetherraCompiler compiler = new AetherraCompiler();
 * CompilationResult result = compiler.compileSource("""
 *     goal: reduce memory usage by 30% priority: high
 *     remember("System initialized") as "startup"
 *     """);
 * new PlanInterpreter(facade).execute(result.planOrThrow());
 * }</pre>
 *
 * Each call works on its own token buffer and node arena, so one instance may compile on many threads at
 * once.
 */
public class AetherraCompiler {

	private static final Logger logger = LoggerFactory.getLogger(AetherraCompiler.class);

	private final CompilerOptions options;
	private final AetherraAnalyzer analyzer = new AetherraAnalyzer();
	private final PlanCompiler planCompiler;

	public AetherraCompiler() {
		this(CompilerOptions.defaults());
	}

	public AetherraCompiler(CompilerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.planCompiler = new PlanCompiler(options);
	}

	/**
	 * Creates a compiler configured from {@value CompilerOptionsLoader#DEFAULT_RESOURCE} on the classpath,
	 * falling back to the defaults when that resource is absent.
	 */
	public static AetherraCompiler fromClasspath() {
		ClassLoader loader = Thread.currentThread().getContextClassLoader();
		if (loader == null) {
			loader = AetherraCompiler.class.getClassLoader();
		}
		return new AetherraCompiler(new CompilerOptionsLoader().loadDefault(loader));
	}

	public CompilerOptions options() {
		return options;
	}

	/**
	 * Tokenizes source text. Never fails; use {@link #compileSource(String)} to also collect lex warnings.
	 */
	public List<Token> tokenize(String source) {
		return new AetherraTokenizer(source, options.retainComments()).tokenize();
	}

	public ParseResult parse(List<Token> tokens) {
		return new AetherraParser(tokens, options).parse();
	}

	public AnalysisReport analyze(SyntaxTree tree) {
		return analyzer.analyze(tree);
	}

	public ExecutablePlan compile(SyntaxTree tree) {
		return planCompiler.compile(tree);
	}

	/**
	 * Runs the whole pipeline on one source text.
	 */
	public CompilationResult compileSource(String source) {
		long start = System.nanoTime();

		AetherraTokenizer tokenizer = new AetherraTokenizer(source, options.retainComments());
		List<Token> tokens = tokenizer.tokenize();
		ParseResult parsed = parse(tokens);
		AnalysisReport report = analyze(parsed.tree());
		ExecutablePlan plan = compile(parsed.tree());

		if (logger.isDebugEnabled()) {
			logger.debug("Compiled {} tokens into {} calls ({} nodes, {} diagnostics) in {} us",
					tokens.size(), plan.size(), report.totalNodes(), parsed.diagnostics().size(),
					TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start));
		}
		return new CompilationResult(plan, parsed.diagnostics(), tokenizer.warnings(), report);
	}

	/**
	 * Parses condition or value text, such as a conditional's condition, as an expression.
	 *
	 * @throws org.javai.aetherra.parse.AetherraParseException if the text is not a valid expression
	 */
	public Expression parseExpression(String text) {
		return ExpressionParser.parse(text);
	}
}
