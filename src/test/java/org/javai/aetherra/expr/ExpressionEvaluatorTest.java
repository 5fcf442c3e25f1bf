package org.javai.aetherra.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {

	private ExpressionEvaluator evaluator;

	@BeforeEach
	void setUp() {
		Map<String, Object> variables = Map.of(
				"error_rate", 7,
				"cpu", 42.5,
				"status", "ready",
				"muted", false,
				"hosts", List.of("a", "b"));
		evaluator = new ExpressionEvaluator(variables::get,
				(name, positional, named) -> name + ":" + positional + ":" + named);
	}

	private Object eval(String text) {
		return evaluator.evaluate(ExpressionParser.parse(text));
	}

	@Test
	void comparesNumbersNumerically() {
		assertThat(evaluator.test("error_rate > 5%")).isTrue();
		assertThat(evaluator.test("cpu >= 42.50")).isTrue();
		assertThat(evaluator.test("cpu < 10")).isFalse();
		assertThat(evaluator.test("error_rate == 7.0")).isTrue();
	}

	@Test
	void logicalOperatorsFollowPrecedence() {
		// or(true, and(false, ...)) is true; and(or(true, false), false) would be false
		assertThat(evaluator.test("error_rate > 5 or muted and cpu > 100")).isTrue();
		assertThat(evaluator.test("not muted and status == \"ready\"")).isTrue();
	}

	@Test
	void unboundNamesEvaluateToTheirName() {
		assertThat(eval("unknown")).isEqualTo("unknown");
		assertThat(evaluator.test("status == ready")).isTrue();
	}

	@Test
	void orderingBetweenMixedTypesIsFalse() {
		assertThat(evaluator.test("status > 5")).isFalse();
		assertThat(evaluator.test("status < 5")).isFalse();
	}

	@Test
	void arithmetic() {
		assertThat(eval("1 + 2 * 3")).isEqualTo(new BigDecimal("7"));
		assertThat(eval("10 / 4")).isEqualTo(new BigDecimal("2.5"));
		assertThat(eval("-error_rate + 2")).isEqualTo(new BigDecimal("-5"));
		assertThat(eval("\"id-\" + 7")).isEqualTo("id-7");
	}

	@Test
	void divisionByZeroIsRejected() {
		assertThatThrownBy(() -> eval("1 / 0"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Division by zero");
	}

	@Test
	void arithmeticOnTextIsRejected() {
		assertThatThrownBy(() -> eval("status * 2"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("requires a number");
	}

	@Test
	void truthiness() {
		assertThat(ExpressionEvaluator.isTruthy(null)).isFalse();
		assertThat(ExpressionEvaluator.isTruthy(BigDecimal.ZERO)).isFalse();
		assertThat(ExpressionEvaluator.isTruthy("")).isFalse();
		assertThat(ExpressionEvaluator.isTruthy(List.of())).isFalse();
		assertThat(ExpressionEvaluator.isTruthy(Map.of())).isFalse();
		assertThat(ExpressionEvaluator.isTruthy(0.5)).isTrue();
		assertThat(ExpressionEvaluator.isTruthy("no")).isTrue();
		assertThat(evaluator.test("hosts")).isTrue();
	}

	@Test
	void collectionsEvaluateElementwise() {
		assertThat(eval("[1, status]")).isEqualTo(List.of(new BigDecimal("1"), "ready"));
		assertThat(eval("{limit: 2}")).isEqualTo(Map.of("limit", new BigDecimal("2")));
	}

	@Test
	void callsAreDelegatedToTheFunctionHandler() {
		assertThat(eval("memory.pattern(\"crash\", frequency=\"daily\")"))
				.isEqualTo("memory.pattern:[crash]:{frequency=daily}");
	}

	@Test
	void callsWithoutHandlerAreRejected() {
		ExpressionEvaluator plain = new ExpressionEvaluator(name -> null);

		assertThatThrownBy(() -> plain.test("check()"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'check'");
	}

	@Test
	void nonFiniteNumbersAreRejected() {
		ExpressionEvaluator withNaN = new ExpressionEvaluator(Map.of("ratio", Double.NaN)::get,
				(name, positional, named) -> Double.POSITIVE_INFINITY);

		assertThatThrownBy(() -> withNaN.test("ratio > 1"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Number NaN is not finite");
		assertThatThrownBy(() -> withNaN.test("peak() > 1"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Number Infinity is not finite");
	}
}
