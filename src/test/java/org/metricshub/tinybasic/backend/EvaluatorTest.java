package org.metricshub.tinybasic.backend;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.tinybasic.frontend.BasicParser;
import org.metricshub.tinybasic.frontend.ast.RelationOperator;
import org.metricshub.tinybasic.jrt.BasicRuntimeException;
import org.metricshub.tinybasic.jrt.RuntimeErrorKind;

public class EvaluatorTest {

	private final Environment environment = new Environment();
	private final Evaluator evaluator = new Evaluator(environment);

	private int eval(String text) {
		return evaluator.evaluate(new BasicParser().parseExpression(text), 40);
	}

	@Test
	public void testArithmetic() {
		assertEquals(14, eval("2 + 3 * 4"));
		assertEquals(-6, eval("-(2 * 3)"));
		assertEquals(3, eval("+3"));
	}

	@Test
	public void testDivisionTruncatesTowardZero() {
		assertEquals(3, eval("7 / 2"));
		assertEquals(-3, eval("-7 / 2"));
		assertEquals(-3, eval("7 / -2"));
	}

	@Test
	public void testWrapAround() {
		assertEquals(Integer.MIN_VALUE, eval("2147483647 + 1"));
		assertEquals(Integer.MAX_VALUE, eval("-2147483647 - 2"));
	}

	@Test
	public void testVariables() {
		environment.set('A', 5);
		environment.set('B', 3);
		assertEquals(2, eval("A - B"));
		assertEquals(0, eval("C"));
	}

	@Test
	public void testDivisionByZero() {
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> eval("1 + 4 / (A - A)"));
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, e.getKind());
		assertEquals(40, e.getLineNumber());
		assertEquals("Division by zero in (4 / (A - A))", e.getMessage());
		assertEquals("DIVISION_BY_ZERO at line 40: Division by zero in (4 / (A - A))", e.describe());
	}

	@Test
	public void testCompare() {
		assertTrue(Evaluator.compare(1, RelationOperator.EQUAL, 1));
		assertTrue(Evaluator.compare(1, RelationOperator.NOT_EQUAL, 2));
		assertTrue(Evaluator.compare(-1, RelationOperator.LESS_THAN, 0));
		assertTrue(Evaluator.compare(2, RelationOperator.LESS_THAN_OR_EQUAL, 2));
		assertFalse(Evaluator.compare(2, RelationOperator.GREATER_THAN, 2));
		assertTrue(Evaluator.compare(3, RelationOperator.GREATER_THAN_OR_EQUAL, 2));
	}
}
