package euclid.parser;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import euclid.model.Justification;
import euclid.model.Proof;

import static euclid.model.ProofBuilder.*;

@RunWith(Parameterized.class)
public class ProofParserTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						"PROVE: x = 1.",
						proof(eq(sym("x"), num(1))),
				},
				{
						"PROVE: x = 1.\nx = 1.",
						proof(eq(sym("x"), num(1)), clause(eq(sym("x"), num(1)))),
				},
				{
						"PROVE: IF x = 1 THEN x = x.\nx = 1.\nTHEREFORE x = x.",
						proof(
								ifThen(eq(sym("x"), num(1)), eq(sym("x"), sym("x"))),
								clause(eq(sym("x"), num(1))),
								therefore(eq(sym("x"), sym("x")))),
				},
				{
						"Prove: n is an even integer.\n" +
								"Let n be an even integer.\n" +
								"Let m = 2 k.\n" +
								"By definition n is an even integer.",
						proof(
								isA(sym("n"), category("even", "integer")),
								let("n", category("even", "integer")),
								let("m", times(num(2), sym("k"))),
								by(Justification.DEFINITION, isA(sym("n"), category("even", "integer")))),
				},
				{
						"PROVE: y = 2 (x).\nBY SUBSTITUTION y = 2 x WHERE x IS AN odd number.",
						proof(
								eq(sym("y"), times(num(2), sym("x"))),
								by(Justification.SUBSTITUTION,
										eq(sym("y"), times(num(2), sym("x"))),
										where("x", category("odd", "number")))),
				},
				{
						"PROVE: (x) = 3 (4 (y)).",
						proof(eq(paren(sym("x")), times(num(3), times(num(4), sym("y"))))),
				},
				{
						"PROVE: 2 ((x)) = 2.5.",
						proof(eq(times(num(2), paren(sym("x"))), num("2.5"))),
				},
				{
						"PROVE: IF IF a = b THEN b = a THEN c is a thing.",
						proof(ifThen(
								ifThen(eq(sym("a"), sym("b")), eq(sym("b"), sym("a"))),
								isA(sym("c"), category("thing")))),
				},
				{
						"PROVE: 7 is a prime.\nTHEREFORE 7 is a prime.",
						proof(isA(num(7), category("prime")), therefore(isA(num(7), category("prime")))),
				},
		});
	}

	private final String source;
	private final Proof expected;

	public ProofParserTest(String source, Proof expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws ParseFailureException {
		Proof actual = ProofParser.readProof(source);
		assertEquals(expected, actual);
	}
}
