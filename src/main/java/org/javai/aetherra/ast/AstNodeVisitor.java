package org.javai.aetherra.ast;

/**
 * Visitor over the closed set of {@link AstNode} variants.
 * <p>
 * Every variant has its own method, so an implementation stops compiling when a variant is added
 * without being handled.
 *
 * @param <R> the return type of the visitor operations
 */
public interface AstNodeVisitor<R> {

	R visitProgram(AstNode.Program program);

	R visitGoal(AstNode.Goal goal);

	R visitAgent(AstNode.Agent agent);

	R visitMemory(AstNode.Memory memory);

	R visitIntent(AstNode.Intent intent);

	R visitConditional(AstNode.Conditional conditional);

	R visitPlugin(AstNode.Plugin plugin);

	R visitSelfModification(AstNode.SelfModification selfModification);

	R visitFunctionDef(AstNode.FunctionDef functionDef);

	R visitFunctionCall(AstNode.FunctionCall functionCall);

	R visitLoop(AstNode.Loop loop);

	R visitAssignment(AstNode.Assignment assignment);

	R visitComment(AstNode.Comment comment);
}
