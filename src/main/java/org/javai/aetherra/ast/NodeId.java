package org.javai.aetherra.ast;

/**
 * Index of a node in the arena of a {@link SyntaxTree}.
 */
public record NodeId(int index) {

	public NodeId {
		if (index < 0) {
			throw new IllegalArgumentException("NodeId index must not be negative: " + index);
		}
	}

	@Override
	public String toString() {
		return "#" + index;
	}
}
