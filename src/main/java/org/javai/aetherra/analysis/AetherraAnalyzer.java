package org.javai.aetherra.analysis;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.aetherra.ast.AstNode;
import org.javai.aetherra.ast.AstWalker;
import org.javai.aetherra.ast.NodeKind;
import org.javai.aetherra.ast.SyntaxTree;
import org.javai.aetherra.expr.ExpressionParser;
import org.javai.aetherra.parse.AetherraParseException;

/**
 * Walks a parsed program once and reports node statistics, complexity and validation findings.
 * Never modifies the tree and never throws for a well-formed {@link SyntaxTree}.
 * <p>
 * Complexity: +2 per conditional or loop, +1 per function definition or call, +1 per memory, agent or
 * plugin statement.
 */
public class AetherraAnalyzer {

	public AnalysisReport analyze(SyntaxTree tree) {
		Objects.requireNonNull(tree, "tree must not be null");

		Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
		List<String> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		Map<String, Integer> functionLines = new HashMap<>();
		int[] maxDepth = {0};
		int[] total = {0};
		int[] complexity = {0};

		AstWalker.walkPreOrder(tree, (node, depth) -> {
			counts.merge(node.kind(), 1, Integer::sum);
			total[0]++;
			maxDepth[0] = Math.max(maxDepth[0], depth);
			complexity[0] += weight(node.kind());

			errors.addAll(StructuralRules.errors(node));
			warnings.addAll(StructuralRules.warnings(node));

			if (node instanceof AstNode.FunctionDef def && !def.name().isBlank()) {
				Integer first = functionLines.putIfAbsent(def.name(), def.line());
				if (first != null) {
					warnings.add(StructuralRules.at(node,
							"function '" + def.name() + "' is already defined at line " + first));
				}
			}
			String condition = conditionOf(node);
			if (condition != null && !condition.isBlank()) {
				checkExpression(node, condition, warnings);
			}
		});

		return new AnalysisReport(counts, maxDepth[0], total[0], complexity[0], errors, warnings);
	}

	static int weight(NodeKind kind) {
		return switch (kind) {
			case CONDITIONAL, LOOP -> 2;
			case FUNCTION_DEF, FUNCTION_CALL -> 1;
			case MEMORY, AGENT, PLUGIN -> 1;
			case PROGRAM, GOAL, INTENT, SELF_MODIFICATION, ASSIGNMENT, COMMENT -> 0;
		};
	}

	private static String conditionOf(AstNode node) {
		if (node instanceof AstNode.Conditional conditional) {
			return conditional.condition();
		}
		if (node instanceof AstNode.Loop loop && loop.loopKind() == AstNode.Loop.Kind.WHILE) {
			return loop.source();
		}
		if (node instanceof AstNode.SelfModification mod) {
			return mod.condition();
		}
		return null;
	}

	private static void checkExpression(AstNode node, String condition, List<String> warnings) {
		try {
			ExpressionParser.parse(condition);
		} catch (AetherraParseException e) {
			warnings.add(StructuralRules.at(node, "condition '" + condition + "' is not a valid expression: "
					+ e.diagnostics().get(0).message()));
		}
	}
}
