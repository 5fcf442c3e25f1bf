package org.javai.aetherra.ast;

/**
 * Tag of every {@link AstNode} variant.
 */
public enum NodeKind {
	PROGRAM,
	GOAL,
	AGENT,
	MEMORY,
	INTENT,
	CONDITIONAL,
	PLUGIN,
	SELF_MODIFICATION,
	FUNCTION_DEF,
	FUNCTION_CALL,
	LOOP,
	ASSIGNMENT,
	COMMENT
}
