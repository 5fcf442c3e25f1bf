package org.javai.aetherra.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.aetherra.analysis.StructuralRules;
import org.javai.aetherra.ast.AstNode;
import org.javai.aetherra.ast.AstNodeVisitor;
import org.javai.aetherra.ast.NodeId;
import org.javai.aetherra.ast.SyntaxTree;
import org.javai.aetherra.config.CompilerOptions;

/**
 * Compiles a syntax tree into an {@link ExecutablePlan}, one runtime call per statement in source order.
 * <p>
 * Block bodies compile into nested plans. A statement that fails a structural rule becomes a
 * {@link RuntimeCall.CompileError} in place of its call (its body is not compiled) and compilation
 * continues with the next sibling. Comments produce no call. Compilation never throws for a tree
 * built by the parser.
 * <p>
 * Stateless and safe to share between threads.
 */
public class PlanCompiler {

	private final CompilerOptions options;

	public PlanCompiler() {
		this(CompilerOptions.defaults());
	}

	public PlanCompiler(CompilerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public ExecutablePlan compile(SyntaxTree tree) {
		Objects.requireNonNull(tree, "tree must not be null");
		return new CallEmitter(tree, options).compileBlock(tree.root().statements());
	}

	/**
	 * Per-compile visitor holding the tree being compiled.
	 */
	private static final class CallEmitter implements AstNodeVisitor<RuntimeCall> {

		private final SyntaxTree tree;
		private final CompilerOptions options;

		CallEmitter(SyntaxTree tree, CompilerOptions options) {
			this.tree = tree;
			this.options = options;
		}

		ExecutablePlan compileBlock(List<NodeId> ids) {
			if (ids == null || ids.isEmpty()) {
				return ExecutablePlan.empty();
			}
			List<RuntimeCall> calls = new ArrayList<>();
			for (NodeId id : ids) {
				RuntimeCall call = compileStatement(tree.node(id));
				if (call != null) {
					calls.add(call);
				}
			}
			return new ExecutablePlan(calls);
		}

		private RuntimeCall compileStatement(AstNode node) {
			List<String> errors = StructuralRules.errors(node);
			if (!errors.isEmpty()) {
				return new RuntimeCall.CompileError(node.line(), String.join("; ", errors));
			}
			return node.accept(this);
		}

		@Override
		public RuntimeCall visitProgram(AstNode.Program node) {
			return new RuntimeCall.CompileError(node.line(), "A program cannot be nested inside another program");
		}

		@Override
		public RuntimeCall visitGoal(AstNode.Goal node) {
			String priority = node.priority() != null ? node.priority() : options.defaultGoalPriority();
			return new RuntimeCall.SetGoal(node.objective(), priority);
		}

		@Override
		public RuntimeCall visitAgent(AstNode.Agent node) {
			return new RuntimeCall.AgentCommand(node.command());
		}

		@Override
		public RuntimeCall visitMemory(AstNode.Memory node) {
			return switch (node.operation()) {
				case REMEMBER -> new RuntimeCall.MemoryRemember(node.data(), node.tag());
				case RECALL -> new RuntimeCall.MemoryRecall(node.data(), node.criteria());
				case PATTERN -> new RuntimeCall.MemoryPattern(node.data(),
						node.criteria() != null ? node.criteria().get("frequency") : null);
			};
		}

		@Override
		public RuntimeCall visitIntent(AstNode.Intent node) {
			return new RuntimeCall.ExecuteIntent(node.action(), node.target(), node.modifier());
		}

		@Override
		public RuntimeCall visitConditional(AstNode.Conditional node) {
			return new RuntimeCall.ExecuteConditional(node.condition(),
					compileBlock(node.body()), compileBlock(node.elseBody()));
		}

		@Override
		public RuntimeCall visitPlugin(AstNode.Plugin node) {
			return new RuntimeCall.LoadPlugin(node.name(), compileBlock(node.actions()));
		}

		@Override
		public RuntimeCall visitSelfModification(AstNode.SelfModification node) {
			return switch (node.operation()) {
				case SUGGEST -> new RuntimeCall.SuggestFix(node.target(), node.condition());
				case APPLY -> new RuntimeCall.ApplyFix(node.target(), node.condition());
			};
		}

		@Override
		public RuntimeCall visitFunctionDef(AstNode.FunctionDef node) {
			return new RuntimeCall.DefineFunction(node.name(), node.params(), compileBlock(node.body()));
		}

		@Override
		public RuntimeCall visitFunctionCall(AstNode.FunctionCall node) {
			return new RuntimeCall.CallFunction(node.name(), node.args());
		}

		@Override
		public RuntimeCall visitLoop(AstNode.Loop node) {
			RuntimeCall.ExecuteLoop.LoopKind kind = switch (node.loopKind()) {
				case FOR -> RuntimeCall.ExecuteLoop.LoopKind.FOR;
				case WHILE -> RuntimeCall.ExecuteLoop.LoopKind.WHILE;
			};
			return new RuntimeCall.ExecuteLoop(kind, node.binder(), node.source(), compileBlock(node.body()));
		}

		@Override
		public RuntimeCall visitAssignment(AstNode.Assignment node) {
			return new RuntimeCall.Assign(node.target(), node.value());
		}

		@Override
		public RuntimeCall visitComment(AstNode.Comment node) {
			return null;
		}
	}
}
