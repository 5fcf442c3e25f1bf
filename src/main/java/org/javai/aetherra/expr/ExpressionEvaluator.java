package org.javai.aetherra.expr;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evaluates an {@link Expression} against caller-supplied variables and functions.
 * <p>
 * Numbers evaluate to {@link BigDecimal}; a percentage literal evaluates to its written value
 * ({@code 5%} is 5). A name with no binding evaluates to the name itself, so {@code status == ready}
 * compares against the text {@code "ready"} when {@code ready} is unbound. Ordering comparisons between
 * values that are neither both numbers nor both strings are false.
 * <p>
 * Truthiness: {@code null}, {@code false}, zero, empty strings, empty collections and empty maps are false;
 * everything else is true.
 */
public class ExpressionEvaluator {

	/**
	 * Resolves a call such as {@code memory.pattern("crash")} during evaluation.
	 */
	@FunctionalInterface
	public interface FunctionHandler {
		Object call(String qualifiedName, List<Object> positional, Map<String, Object> named);
	}

	private static final FunctionHandler NO_FUNCTIONS = (name, positional, named) -> {
		throw new IllegalArgumentException("No function handler available to call '" + name + "'");
	};

	private final Function<String, Object> variables;
	private final FunctionHandler functions;

	public ExpressionEvaluator(Function<String, Object> variables) {
		this(variables, NO_FUNCTIONS);
	}

	public ExpressionEvaluator(Function<String, Object> variables, FunctionHandler functions) {
		this.variables = Objects.requireNonNull(variables, "variables must not be null");
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
	}

	/**
	 * Parses and evaluates condition text to a boolean.
	 *
	 * @throws org.javai.aetherra.parse.AetherraParseException if the text is not a valid expression
	 */
	public boolean test(String condition) {
		return isTruthy(evaluate(ExpressionParser.parse(condition)));
	}

	public Object evaluate(Expression expression) {
		Objects.requireNonNull(expression, "expression must not be null");
		if (expression instanceof Expression.StringLiteral s) {
			return s.value();
		}
		if (expression instanceof Expression.NumberLiteral n) {
			return n.value();
		}
		if (expression instanceof Expression.BooleanLiteral b) {
			return b.value();
		}
		if (expression instanceof Expression.Identifier id) {
			Object value = variables.apply(id.name());
			return value != null ? normalize(value) : id.name();
		}
		if (expression instanceof Expression.Unary unary) {
			return evaluateUnary(unary);
		}
		if (expression instanceof Expression.Binary binary) {
			return evaluateBinary(binary);
		}
		if (expression instanceof Expression.Call call) {
			return evaluateCall(call);
		}
		if (expression instanceof Expression.ArrayLiteral array) {
			List<Object> values = new ArrayList<>();
			for (Expression element : array.elements()) {
				values.add(evaluate(element));
			}
			return values;
		}
		if (expression instanceof Expression.DictLiteral dict) {
			Map<String, Object> values = new LinkedHashMap<>();
			for (Expression.Entry entry : dict.entries()) {
				values.put(entry.key(), evaluate(entry.value()));
			}
			return values;
		}
		throw new IllegalStateException("Unsupported expression: " + expression);
	}

	public static boolean isTruthy(Object value) {
		if (value == null) {
			return false;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		if (value instanceof BigDecimal d) {
			return d.signum() != 0;
		}
		if (value instanceof Number n) {
			return n.doubleValue() != 0.0;
		}
		if (value instanceof CharSequence s) {
			return s.length() > 0;
		}
		if (value instanceof Collection<?> c) {
			return !c.isEmpty();
		}
		if (value instanceof Map<?, ?> m) {
			return !m.isEmpty();
		}
		return true;
	}

	private Object evaluateUnary(Expression.Unary unary) {
		Object operand = evaluate(unary.operand());
		return switch (unary.operator()) {
			case NOT -> !isTruthy(operand);
			case NEGATE -> requireNumber(operand, "-").negate();
		};
	}

	private Object evaluateBinary(Expression.Binary binary) {
		// Logical operators short-circuit
		switch (binary.operator()) {
			case AND -> {
				return isTruthy(evaluate(binary.left())) && isTruthy(evaluate(binary.right()));
			}
			case OR -> {
				return isTruthy(evaluate(binary.left())) || isTruthy(evaluate(binary.right()));
			}
			default -> {
			}
		}

		Object left = evaluate(binary.left());
		Object right = evaluate(binary.right());
		return switch (binary.operator()) {
			case EQUAL -> valueEquals(left, right);
			case NOT_EQUAL -> !valueEquals(left, right);
			case GREATER -> compare(left, right, c -> c > 0);
			case GREATER_EQUAL -> compare(left, right, c -> c >= 0);
			case LESS -> compare(left, right, c -> c < 0);
			case LESS_EQUAL -> compare(left, right, c -> c <= 0);
			case ADD -> add(left, right);
			case SUBTRACT -> requireNumber(left, "-").subtract(requireNumber(right, "-"));
			case MULTIPLY -> requireNumber(left, "*").multiply(requireNumber(right, "*"));
			case DIVIDE -> divide(requireNumber(left, "/"), requireNumber(right, "/"));
			case AND, OR -> throw new IllegalStateException("Logical operator not short-circuited");
		};
	}

	private Object evaluateCall(Expression.Call call) {
		List<Object> positional = new ArrayList<>();
		Map<String, Object> named = new LinkedHashMap<>();
		for (Expression.Argument argument : call.arguments()) {
			Object value = evaluate(argument.value());
			if (argument.name() != null) {
				named.put(argument.name(), value);
			} else {
				positional.add(value);
			}
		}
		return normalize(functions.call(call.qualifiedName(), positional, named));
	}

	private static Object add(Object left, Object right) {
		if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
			return l.add(r);
		}
		if (left instanceof String || right instanceof String) {
			return String.valueOf(left) + right;
		}
		throw new IllegalArgumentException("Operator '+' cannot combine " + describe(left) + " and " + describe(right));
	}

	private static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
		if (divisor.signum() == 0) {
			throw new IllegalArgumentException("Division by zero");
		}
		return dividend.divide(divisor, MathContext.DECIMAL64);
	}

	private static boolean valueEquals(Object left, Object right) {
		if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
			return l.compareTo(r) == 0;
		}
		return Objects.equals(left, right);
	}

	private interface ComparisonTest {
		boolean test(int comparison);
	}

	private static boolean compare(Object left, Object right, ComparisonTest test) {
		if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
			return test.test(l.compareTo(r));
		}
		if (left instanceof String l && right instanceof String r) {
			return test.test(l.compareTo(r));
		}
		return false;
	}

	private static BigDecimal requireNumber(Object value, String operator) {
		if (value instanceof BigDecimal d) {
			return d;
		}
		throw new IllegalArgumentException("Operator '" + operator + "' requires a number but got " + describe(value));
	}

	private static Object normalize(Object value) {
		if (value instanceof BigDecimal) {
			return value;
		}
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return BigDecimal.valueOf(((Number) value).longValue());
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new IllegalArgumentException("Number " + value + " is not finite");
			}
		}
		if (value instanceof Number n) {
			return new BigDecimal(n.toString());
		}
		return value;
	}

	private static String describe(Object value) {
		return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
	}
}
