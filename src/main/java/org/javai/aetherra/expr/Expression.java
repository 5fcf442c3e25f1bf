package org.javai.aetherra.expr;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured form of condition and value text, produced by {@link ExpressionParser}.
 */
public sealed interface Expression {

	/**
	 * Prefix rendering that makes grouping explicit, e.g. {@code (or a (and b c))}.
	 */
	String describe();

	enum BinaryOperator {
		OR("or"),
		AND("and"),
		EQUAL("=="),
		NOT_EQUAL("!="),
		GREATER(">"),
		GREATER_EQUAL(">="),
		LESS("<"),
		LESS_EQUAL("<="),
		ADD("+"),
		SUBTRACT("-"),
		MULTIPLY("*"),
		DIVIDE("/");

		private final String symbol;

		BinaryOperator(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}
	}

	enum UnaryOperator {
		NOT("not"),
		NEGATE("-");

		private final String symbol;

		UnaryOperator(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}
	}

	record StringLiteral(String value) implements Expression {
		@Override
		public String describe() {
			return "\"" + value + "\"";
		}
	}

	/**
	 * A number; {@code percent} is set for literals written with a trailing {@code %}, the value is unscaled.
	 */
	record NumberLiteral(BigDecimal value, boolean percent) implements Expression {
		@Override
		public String describe() {
			return value.toPlainString() + (percent ? "%" : "");
		}
	}

	record BooleanLiteral(boolean value) implements Expression {
		@Override
		public String describe() {
			return String.valueOf(value);
		}
	}

	record Identifier(String name) implements Expression {
		@Override
		public String describe() {
			return name;
		}
	}

	record Unary(UnaryOperator operator, Expression operand) implements Expression {
		@Override
		public String describe() {
			return "(" + operator.symbol() + " " + operand.describe() + ")";
		}
	}

	record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
		@Override
		public String describe() {
			return "(" + operator.symbol() + " " + left.describe() + " " + right.describe() + ")";
		}
	}

	/**
	 * A call such as {@code memory.pattern("crash", frequency="daily")}; {@code receiver} is the qualifier
	 * before the last dot, {@code null} for unqualified calls.
	 */
	record Call(String receiver, String method, List<Argument> arguments) implements Expression {
		public Call {
			arguments = arguments != null ? List.copyOf(arguments) : List.of();
		}

		public String qualifiedName() {
			return receiver != null ? receiver + "." + method : method;
		}

		@Override
		public String describe() {
			return "(call " + qualifiedName()
					+ arguments.stream().map(a -> " " + a.describe()).collect(Collectors.joining()) + ")";
		}
	}

	/**
	 * A call argument; {@code name} is {@code null} for positional arguments.
	 */
	record Argument(String name, Expression value) {
		public String describe() {
			return name != null ? name + "=" + value.describe() : value.describe();
		}
	}

	record ArrayLiteral(List<Expression> elements) implements Expression {
		public ArrayLiteral {
			elements = elements != null ? List.copyOf(elements) : List.of();
		}

		@Override
		public String describe() {
			return elements.stream().map(Expression::describe).collect(Collectors.joining(" ", "[", "]"));
		}
	}

	record DictLiteral(List<Entry> entries) implements Expression {
		public DictLiteral {
			entries = entries != null ? List.copyOf(entries) : List.of();
		}

		@Override
		public String describe() {
			return entries.stream()
					.map(e -> e.key() + ": " + e.value().describe())
					.collect(Collectors.joining(", ", "{", "}"));
		}
	}

	record Entry(String key, Expression value) {
	}
}
