package org.javai.aetherra.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed AetherraCode program: an arena of nodes plus the id of its {@link AstNode.Program} root.
 * <p>
 * Children are always stored before their parents, so every {@link NodeId} a node refers to
 * indexes a slot that existed when the node was added. Copying the tree is copying one list.
 */
public final class SyntaxTree {

	private final List<AstNode> arena;
	private final NodeId rootId;

	private SyntaxTree(List<AstNode> arena, NodeId rootId) {
		this.arena = List.copyOf(arena);
		this.rootId = rootId;
	}

	/**
	 * A tree holding only an empty program.
	 */
	public static SyntaxTree empty() {
		Builder builder = builder();
		return builder.build(builder.add(new AstNode.Program(List.of())));
	}

	public static Builder builder() {
		return new Builder();
	}

	public AstNode.Program root() {
		return (AstNode.Program) arena.get(rootId.index());
	}

	public NodeId rootId() {
		return rootId;
	}

	public AstNode node(NodeId id) {
		Objects.requireNonNull(id, "id must not be null");
		if (id.index() >= arena.size()) {
			throw new IllegalArgumentException("No node " + id + " in a tree of " + arena.size() + " nodes");
		}
		return arena.get(id.index());
	}

	/**
	 * Resolves a list of ids to their nodes, preserving order.
	 */
	public List<AstNode> nodes(List<NodeId> ids) {
		if (ids == null || ids.isEmpty()) {
			return List.of();
		}
		return ids.stream().map(this::node).toList();
	}

	/**
	 * Top-level statements of the program in source order.
	 */
	public List<AstNode> statements() {
		return nodes(root().statements());
	}

	/**
	 * All arena slots in insertion order (children before parents, root last).
	 */
	public List<AstNode> arena() {
		return arena;
	}

	public int size() {
		return arena.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SyntaxTree other)) return false;
		return arena.equals(other.arena) && rootId.equals(other.rootId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arena, rootId);
	}

	@Override
	public String toString() {
		return "SyntaxTree[" + arena.size() + " nodes, root=" + rootId + "]";
	}

	/**
	 * Appends nodes to an arena. Used by the parser; a node may only refer to ids already added.
	 */
	public static final class Builder {

		private final List<AstNode> arena = new ArrayList<>();

		private Builder() {
		}

		public NodeId add(AstNode node) {
			Objects.requireNonNull(node, "node must not be null");
			for (NodeId child : node.children()) {
				if (child.index() >= arena.size()) {
					throw new IllegalStateException(
							"Node " + node.kind() + " refers to " + child + " which is not in the arena yet");
				}
			}
			arena.add(node);
			return new NodeId(arena.size() - 1);
		}

		public AstNode get(NodeId id) {
			return arena.get(id.index());
		}

		public int size() {
			return arena.size();
		}

		/**
		 * Drops every node added after the arena held {@code size} nodes. The parser uses this to discard the
		 * children of a statement it abandons, so they do not linger unreachable in the finished tree.
		 */
		public void truncate(int size) {
			if (size < 0 || size > arena.size()) {
				throw new IllegalArgumentException("Cannot truncate an arena of " + arena.size() + " nodes to " + size);
			}
			arena.subList(size, arena.size()).clear();
		}

		public SyntaxTree build(NodeId rootId) {
			Objects.requireNonNull(rootId, "rootId must not be null");
			if (!(arena.get(rootId.index()) instanceof AstNode.Program)) {
				throw new IllegalStateException("Root " + rootId + " is not a program node");
			}
			return new SyntaxTree(arena, rootId);
		}
	}
}
