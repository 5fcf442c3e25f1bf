package org.javai.aetherra.parse;

import java.util.List;
import java.util.Objects;
import org.javai.aetherra.ast.SyntaxTree;

/**
 * Outcome of a parse: the (possibly partial) tree and every diagnostic in source order.
 * In strict mode a failed parse carries an empty tree and exactly one error.
 */
public record ParseResult(SyntaxTree tree, List<Diagnostic> diagnostics) {

	public ParseResult {
		Objects.requireNonNull(tree, "tree must not be null");
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public List<Diagnostic> errors() {
		return diagnostics.stream().filter(Diagnostic::isError).toList();
	}

	public List<Diagnostic> warnings() {
		return diagnostics.stream().filter(d -> !d.isError()).toList();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}
}
