package org.javai.aetherra;

import java.util.List;
import org.javai.aetherra.analysis.AnalysisReport;
import org.javai.aetherra.lex.LexWarning;
import org.javai.aetherra.parse.AetherraParseException;
import org.javai.aetherra.parse.Diagnostic;
import org.javai.aetherra.plan.ExecutablePlan;

/**
 * Everything one {@link AetherraCompiler#compileSource(String)} call produced.
 * <p>
 * The plan is always present: in lenient mode it holds the statements that parsed, in strict mode it is
 * empty once a syntax error occurred. Use {@link #planOrThrow()} to treat any syntax error as failure.
 *
 * @param plan the compiled plan, possibly partial
 * @param diagnostics parser errors and warnings in source order
 * @param lexWarnings characters the tokenizer skipped and strings it closed at end of input
 * @param report statistics and validation findings for the parsed tree
 */
public record CompilationResult(
		ExecutablePlan plan,
		List<Diagnostic> diagnostics,
		List<LexWarning> lexWarnings,
		AnalysisReport report
) {

	public CompilationResult {
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
		lexWarnings = lexWarnings != null ? List.copyOf(lexWarnings) : List.of();
	}

	/**
	 * True if parsing produced no syntax errors. Warnings and validation findings do not count.
	 */
	public boolean succeeded() {
		return errors().isEmpty();
	}

	public List<Diagnostic> errors() {
		return diagnostics.stream().filter(Diagnostic::isError).toList();
	}

	public List<Diagnostic> warnings() {
		return diagnostics.stream().filter(d -> !d.isError()).toList();
	}

	/**
	 * @return the plan if parsing produced no syntax errors
	 * @throws AetherraParseException carrying every syntax error otherwise
	 */
	public ExecutablePlan planOrThrow() {
		List<Diagnostic> errors = errors();
		if (!errors.isEmpty()) {
			throw new AetherraParseException(errors);
		}
		return plan;
	}
}
