package org.javai.aetherra.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the AetherraCode syntax tree.
 * <p>
 * Nodes are immutable and live in the arena of a {@link SyntaxTree}. Block nodes refer to their
 * children by {@link NodeId}, never by reference, so a tree cannot contain cycles. Optional
 * payload fields are {@code null} when absent.
 */
public sealed interface AstNode {

	NodeKind kind();

	/**
	 * 1-based source line of the token that starts the node.
	 */
	int line();

	<R> R accept(AstNodeVisitor<R> visitor);

	/**
	 * Child node ids in source order; empty for leaf statements.
	 */
	default List<NodeId> children() {
		return List.of();
	}

	record Program(List<NodeId> statements) implements AstNode {
		public Program {
			statements = copy(statements);
		}

		@Override
		public NodeKind kind() {
			return NodeKind.PROGRAM;
		}

		@Override
		public int line() {
			return 1;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitProgram(this);
		}

		@Override
		public List<NodeId> children() {
			return statements;
		}
	}

	record Goal(int line, String objective, String priority) implements AstNode {
		@Override
		public NodeKind kind() {
			return NodeKind.GOAL;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitGoal(this);
		}
	}

	record Agent(int line, String command) implements AstNode {
		@Override
		public NodeKind kind() {
			return NodeKind.AGENT;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitAgent(this);
		}
	}

	record Memory(int line, Operation operation, String data, String tag, Map<String, String> criteria)
			implements AstNode {

		public enum Operation {
			REMEMBER,
			RECALL,
			PATTERN
		}

		public Memory {
			criteria = criteria == null || criteria.isEmpty()
					? null
					: Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
		}

		@Override
		public NodeKind kind() {
			return NodeKind.MEMORY;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitMemory(this);
		}
	}

	record Intent(int line, String action, String target, String modifier) implements AstNode {
		@Override
		public NodeKind kind() {
			return NodeKind.INTENT;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitIntent(this);
		}
	}

	record Conditional(int line, Kind conditionalKind, String condition, List<NodeId> body, List<NodeId> elseBody)
			implements AstNode {

		public enum Kind {
			WHEN,
			IF
		}

		public Conditional {
			body = copy(body);
			elseBody = elseBody != null ? List.copyOf(elseBody) : null;
		}

		@Override
		public NodeKind kind() {
			return NodeKind.CONDITIONAL;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitConditional(this);
		}

		@Override
		public List<NodeId> children() {
			if (elseBody == null || elseBody.isEmpty()) {
				return body;
			}
			List<NodeId> all = new ArrayList<>(body);
			all.addAll(elseBody);
			return Collections.unmodifiableList(all);
		}
	}

	record Plugin(int line, String name, List<NodeId> actions) implements AstNode {
		public Plugin {
			actions = copy(actions);
		}

		@Override
		public NodeKind kind() {
			return NodeKind.PLUGIN;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitPlugin(this);
		}

		@Override
		public List<NodeId> children() {
			return actions;
		}
	}

	record SelfModification(int line, Operation operation, String target, String condition) implements AstNode {

		public enum Operation {
			SUGGEST,
			APPLY
		}

		@Override
		public NodeKind kind() {
			return NodeKind.SELF_MODIFICATION;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitSelfModification(this);
		}
	}

	record FunctionDef(int line, String name, List<String> params, List<NodeId> body) implements AstNode {
		public FunctionDef {
			params = params != null ? List.copyOf(params) : List.of();
			body = copy(body);
		}

		@Override
		public NodeKind kind() {
			return NodeKind.FUNCTION_DEF;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitFunctionDef(this);
		}

		@Override
		public List<NodeId> children() {
			return body;
		}
	}

	record FunctionCall(int line, String name, List<String> args) implements AstNode {
		public FunctionCall {
			args = args != null ? List.copyOf(args) : List.of();
		}

		@Override
		public NodeKind kind() {
			return NodeKind.FUNCTION_CALL;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitFunctionCall(this);
		}
	}

	record Loop(int line, Kind loopKind, String binder, String source, List<NodeId> body) implements AstNode {

		public enum Kind {
			FOR,
			WHILE
		}

		public Loop {
			body = copy(body);
		}

		@Override
		public NodeKind kind() {
			return NodeKind.LOOP;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitLoop(this);
		}

		@Override
		public List<NodeId> children() {
			return body;
		}
	}

	record Assignment(int line, String target, String value) implements AstNode {
		@Override
		public NodeKind kind() {
			return NodeKind.ASSIGNMENT;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitAssignment(this);
		}
	}

	record Comment(int line, String text) implements AstNode {
		@Override
		public NodeKind kind() {
			return NodeKind.COMMENT;
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitComment(this);
		}
	}

	private static List<NodeId> copy(List<NodeId> ids) {
		return ids != null ? List.copyOf(ids) : List.of();
	}
}
