package org.javai.aetherra.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.aetherra.ast.AstNode;
import org.javai.aetherra.ast.AstNodeVisitor;

/**
 * Per-node structural checks shared by {@link AetherraAnalyzer} and the plan compiler.
 * <p>
 * An error means the node cannot be turned into a runtime call; a warning means it can, but is
 * probably not what the author meant. Messages are prefixed with the node's line.
 */
public final class StructuralRules {

	private StructuralRules() {
	}

	public static List<String> errors(AstNode node) {
		return node.accept(new ErrorRules());
	}

	public static List<String> warnings(AstNode node) {
		List<String> warnings = new ArrayList<>();
		if (node instanceof AstNode.Goal goal && isBlank(goal.objective())) {
			warnings.add(at(node, "goal has an empty objective"));
		} else if (node instanceof AstNode.Agent agent && isBlank(agent.command())) {
			warnings.add(at(node, "agent command is empty"));
		} else if (node instanceof AstNode.Intent intent && isBlank(intent.target())) {
			warnings.add(at(node, "'" + intent.action() + "' has no target"));
		} else if (node instanceof AstNode.SelfModification mod && isBlank(mod.target())) {
			warnings.add(at(node, "self-modification has no target"));
		} else if (node instanceof AstNode.Memory memory && memory.operation() != null && isBlank(memory.data())) {
			warnings.add(at(node, "memory " + memory.operation().name().toLowerCase(Locale.ROOT) + " has no data"));
		}
		return warnings;
	}

	static String at(AstNode node, String message) {
		return "Line " + node.line() + ": " + message;
	}

	private static boolean isBlank(String text) {
		return text == null || text.isBlank();
	}

	private static final class ErrorRules implements AstNodeVisitor<List<String>> {

		@Override
		public List<String> visitProgram(AstNode.Program node) {
			return List.of();
		}

		@Override
		public List<String> visitGoal(AstNode.Goal node) {
			return List.of();
		}

		@Override
		public List<String> visitAgent(AstNode.Agent node) {
			return List.of();
		}

		@Override
		public List<String> visitMemory(AstNode.Memory node) {
			if (node.operation() == null) {
				return List.of(at(node, "memory statement has no operation"));
			}
			return List.of();
		}

		@Override
		public List<String> visitIntent(AstNode.Intent node) {
			if (isBlank(node.action())) {
				return List.of(at(node, "intent has no action"));
			}
			return List.of();
		}

		@Override
		public List<String> visitConditional(AstNode.Conditional node) {
			if (isBlank(node.condition())) {
				return List.of(at(node, "'" + node.conditionalKind().name().toLowerCase(Locale.ROOT) + "' has no condition"));
			}
			return List.of();
		}

		@Override
		public List<String> visitPlugin(AstNode.Plugin node) {
			if (isBlank(node.name())) {
				return List.of(at(node, "plugin has no name"));
			}
			return List.of();
		}

		@Override
		public List<String> visitSelfModification(AstNode.SelfModification node) {
			if (node.operation() == null) {
				return List.of(at(node, "self-modification has no operation"));
			}
			return List.of();
		}

		@Override
		public List<String> visitFunctionDef(AstNode.FunctionDef node) {
			List<String> errors = new ArrayList<>();
			if (isBlank(node.name())) {
				errors.add(at(node, "function definition has no name"));
			}
			List<String> seen = new ArrayList<>();
			for (String param : node.params()) {
				if (seen.contains(param)) {
					errors.add(at(node, "parameter '" + param + "' is declared twice"));
				}
				seen.add(param);
			}
			return errors;
		}

		@Override
		public List<String> visitFunctionCall(AstNode.FunctionCall node) {
			if (isBlank(node.name())) {
				return List.of(at(node, "function call has no name"));
			}
			return List.of();
		}

		@Override
		public List<String> visitLoop(AstNode.Loop node) {
			List<String> errors = new ArrayList<>();
			if (node.loopKind() == AstNode.Loop.Kind.FOR && isBlank(node.binder())) {
				errors.add(at(node, "'for' loop has no loop variable"));
			}
			if (isBlank(node.source())) {
				errors.add(at(node, node.loopKind() == AstNode.Loop.Kind.FOR
						? "'for' loop has nothing to iterate"
						: "'while' loop has no condition"));
			}
			return errors;
		}

		@Override
		public List<String> visitAssignment(AstNode.Assignment node) {
			List<String> errors = new ArrayList<>();
			if (isBlank(node.target())) {
				errors.add(at(node, "assignment has no target"));
			}
			if (isBlank(node.value())) {
				errors.add(at(node, "assignment has no value"));
			}
			return errors;
		}

		@Override
		public List<String> visitComment(AstNode.Comment node) {
			return List.of();
		}
	}
}
