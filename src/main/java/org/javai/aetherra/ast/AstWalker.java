package org.javai.aetherra.ast;

/**
 * Utility class for walking a {@link SyntaxTree}.
 * Provides common traversal patterns for tree operations.
 */
public final class AstWalker {

	private AstWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Callback receiving each node with its depth (the program root has depth 0).
	 */
	@FunctionalInterface
	public interface DepthVisitor {
		void visit(AstNode node, int depth);
	}

	/**
	 * Visits every node reachable from the root in pre-order (node before children).
	 */
	public static void walkPreOrder(SyntaxTree tree, DepthVisitor visitor) {
		if (tree == null) {
			return;
		}
		walkPreOrder(tree, tree.root(), 0, visitor);
	}

	/**
	 * Visits every node reachable from the root in post-order (children before node).
	 */
	public static void walkPostOrder(SyntaxTree tree, DepthVisitor visitor) {
		if (tree == null) {
			return;
		}
		walkPostOrder(tree, tree.root(), 0, visitor);
	}

	/**
	 * Applies a visitor to every top-level statement in source order.
	 */
	public static <R> void visitStatements(SyntaxTree tree, AstNodeVisitor<R> visitor) {
		if (tree == null) {
			return;
		}
		for (AstNode statement : tree.statements()) {
			statement.accept(visitor);
		}
	}

	private static void walkPreOrder(SyntaxTree tree, AstNode node, int depth, DepthVisitor visitor) {
		visitor.visit(node, depth);
		for (NodeId child : node.children()) {
			walkPreOrder(tree, tree.node(child), depth + 1, visitor);
		}
	}

	private static void walkPostOrder(SyntaxTree tree, AstNode node, int depth, DepthVisitor visitor) {
		for (NodeId child : node.children()) {
			walkPostOrder(tree, tree.node(child), depth + 1, visitor);
		}
		visitor.visit(node, depth);
	}
}
