package euclid.check;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import euclid.errors.BoundaryMismatchIssue;
import euclid.errors.ClauseDoesNotFollowIssue;
import euclid.errors.EmptyProofIssue;
import euclid.errors.Issue;
import euclid.errors.TopLevelIssueContext;
import euclid.model.Justification;
import euclid.model.Proof;

import static euclid.model.ProofBuilder.*;

@RunWith(Parameterized.class)
public class ProofValidatorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// PROVE: x = 1.
				{
						proof(eq(sym("x"), num(1))),
						Collections.singletonList(new EmptyProofIssue(proof(eq(sym("x"), num(1))))),
				},
				// PROVE: IF x = 1 THEN x = x.
				// x = 1.
				// Therefore x = x.
				{
						proof(
								ifThen(eq(sym("x"), num(1)), eq(sym("x"), sym("x"))),
								clause(eq(sym("x"), num(1))),
								therefore(eq(sym("x"), sym("x")))),
						Collections.emptyList(),
				},
				// PROVE: x = 1.
				// y = 1.
				{
						proof(eq(sym("x"), num(1)), clause(eq(sym("y"), num(1)))),
						Collections.singletonList(new BoundaryMismatchIssue(
								BoundaryMismatchIssue.Boundary.STATEMENT,
								eq(sym("x"), num(1)),
								clause(eq(sym("y"), num(1))))),
				},
				// PROVE: x = x.
				// x = x.
				{
						proof(eq(sym("x"), sym("x")), clause(eq(sym("x"), sym("x")))),
						Collections.emptyList(),
				},
				// PROVE: x = 1.
				// x = 1.
				{
						proof(eq(sym("x"), num(1)), clause(eq(sym("x"), num(1)))),
						Collections.singletonList(new ClauseDoesNotFollowIssue(clause(eq(sym("x"), num(1))))),
				},
				// PROVE: x = 4.
				// Let x = 4.
				// Let y = x.
				// By substitution y = 4.
				// Therefore x = 4.
				{
						proof(
								eq(sym("x"), num(4)),
								let("x", num(4)),
								let("y", sym("x")),
								by(Justification.SUBSTITUTION, eq(sym("y"), num(4))),
								therefore(eq(sym("x"), num(4)))),
						Collections.emptyList(),
				},
				// PROVE: IF x = 1 THEN y = 1.
				// y = 1.
				// Therefore y = 1.
				{
						proof(
								ifThen(eq(sym("x"), num(1)), eq(sym("y"), num(1))),
								clause(eq(sym("y"), num(1))),
								therefore(eq(sym("y"), num(1)))),
						Collections.singletonList(new BoundaryMismatchIssue(
								BoundaryMismatchIssue.Boundary.HYPOTHESIS,
								eq(sym("x"), num(1)),
								clause(eq(sym("y"), num(1))))),
				},
				// PROVE: IF x = 1 THEN y = 1.
				// x = 1.
				// Let y = x.
				{
						proof(
								ifThen(eq(sym("x"), num(1)), eq(sym("y"), num(1))),
								clause(eq(sym("x"), num(1))),
								let("y", sym("x"))),
						Collections.singletonList(new BoundaryMismatchIssue(
								BoundaryMismatchIssue.Boundary.CONSEQUENT,
								eq(sym("y"), num(1)),
								let("y", sym("x")))),
				},
				// PROVE: IF x = 1 THEN y = 1.
				// x = 1.
				// By substitution y = 1.
				// Let y = x.
				// Therefore y = 1.
				{
						proof(
								ifThen(eq(sym("x"), num(1)), eq(sym("y"), num(1))),
								clause(eq(sym("x"), num(1))),
								by(Justification.SUBSTITUTION, eq(sym("y"), num(1))),
								let("y", sym("x")),
								therefore(eq(sym("y"), num(1)))),
						Collections.singletonList(new ClauseDoesNotFollowIssue(
								by(Justification.SUBSTITUTION, eq(sym("y"), num(1))))),
				},
				// PROVE: IF n = 4 THEN n IS AN even.
				// n = 4.
				// By definition n is an even.
				// Therefore n is an even.
				{
						proof(
								ifThen(eq(sym("n"), num(4)), isA(sym("n"), category("even"))),
								clause(eq(sym("n"), num(4))),
								by(Justification.DEFINITION, isA(sym("n"), category("even"))),
								therefore(isA(sym("n"), category("even")))),
						Collections.emptyList(),
				},
				// PROVE: IF n = 3 THEN n IS AN even.
				// n = 3.
				// By definition n is an even.
				// Therefore n is an even.
				{
						proof(
								ifThen(eq(sym("n"), num(3)), isA(sym("n"), category("even"))),
								clause(eq(sym("n"), num(3))),
								by(Justification.DEFINITION, isA(sym("n"), category("even"))),
								therefore(isA(sym("n"), category("even")))),
						Collections.singletonList(new ClauseDoesNotFollowIssue(
								by(Justification.DEFINITION, isA(sym("n"), category("even"))))),
				},
				// PROVE: IF n = 3 THEN n IS AN odd.
				// n = 3.
				// n is an odd.
				{
						proof(
								ifThen(eq(sym("n"), num(3)), isA(sym("n"), category("odd"))),
								clause(eq(sym("n"), num(3))),
								clause(isA(sym("n"), category("odd")))),
						Collections.singletonList(new ClauseDoesNotFollowIssue(
								clause(isA(sym("n"), category("odd"))))),
				},
				// PROVE: IF n = 2 k THEN m IS AN integer.
				// n = 2 k.
				// By substitution n = 2 (k) where k is an integer.
				// Let m = k.
				// Therefore m is an integer.
				{
						proof(
								ifThen(eq(sym("n"), times(num(2), sym("k"))), isA(sym("m"), category("integer"))),
								clause(eq(sym("n"), times(num(2), sym("k")))),
								by(Justification.SUBSTITUTION, eq(sym("n"), times(num(2), sym("k"))),
										where("k", category("integer"))),
								let("m", sym("k")),
								therefore(isA(sym("m"), category("integer")))),
						Collections.emptyList(),
				},
				// PROVE: IF n IS AN even integer THEN m IS AN even integer.
				// n is an even integer.
				// Let m = n.
				// Therefore m is an even integer.
				{
						proof(
								ifThen(isA(sym("n"), category("even", "integer")),
										isA(sym("m"), category("even", "integer"))),
								clause(isA(sym("n"), category("even", "integer"))),
								let("m", sym("n")),
								therefore(isA(sym("m"), category("even", "integer")))),
						Collections.emptyList(),
				},
				// PROVE: IF a = b THEN 2 a = 2 (b).
				// a = b.
				// Therefore 2 a = 2 (b).
				{
						proof(
								ifThen(eq(sym("a"), sym("b")), eq(times(num(2), sym("a")), times(num(2), sym("b")))),
								clause(eq(sym("a"), sym("b"))),
								therefore(eq(times(num(2), sym("a")), times(num(2), sym("b"))))),
						Collections.emptyList(),
				},
				// PROVE: IF u = v THEN p = r.
				// u = v.
				// Let c = d.
				// Let p = 2 u.
				// Let q = 2 v.
				// Let q = 3 c.
				// Let r = 3 d.
				// By substitution p = r.
				// Therefore p = r.
				{
						proof(
								ifThen(eq(sym("u"), sym("v")), eq(sym("p"), sym("r"))),
								clause(eq(sym("u"), sym("v"))),
								let("c", sym("d")),
								let("p", times(num(2), sym("u"))),
								let("q", times(num(2), sym("v"))),
								let("q", times(num(3), sym("c"))),
								let("r", times(num(3), sym("d"))),
								by(Justification.SUBSTITUTION, eq(sym("p"), sym("r"))),
								therefore(eq(sym("p"), sym("r")))),
						Collections.emptyList(),
				},
				// PROVE: IF x = 3 THEN x IS AN even.
				// x = 3.
				// Let x = 4.
				// By definition x is an even.
				// Therefore x is an even.
				{
						proof(
								ifThen(eq(sym("x"), num(3)), isA(sym("x"), category("even"))),
								clause(eq(sym("x"), num(3))),
								let("x", num(4)),
								by(Justification.DEFINITION, isA(sym("x"), category("even"))),
								therefore(isA(sym("x"), category("even")))),
						Collections.singletonList(new ClauseDoesNotFollowIssue(
								by(Justification.DEFINITION, isA(sym("x"), category("even"))))),
				},
				// PROVE: IF x = 1 THEN (x) = 1.
				// x = 1.
				// Therefore x = 1.
				{
						proof(
								ifThen(eq(sym("x"), num(1)), eq(paren(sym("x")), num(1))),
								clause(eq(sym("x"), num(1))),
								therefore(eq(sym("x"), num(1)))),
						Collections.singletonList(new BoundaryMismatchIssue(
								BoundaryMismatchIssue.Boundary.CONSEQUENT,
								eq(paren(sym("x")), num(1)),
								therefore(eq(sym("x"), num(1))))),
				},
				// PROVE: IF x = 1 THEN x = 1.
				// x = 1.
				// By substitution x = 1.
				{
						proof(
								ifThen(eq(sym("x"), num(1)), eq(sym("x"), num(1))),
								clause(eq(sym("x"), num(1))),
								by(Justification.SUBSTITUTION, eq(sym("x"), num(1)))),
						Collections.emptyList(),
				},
				// PROVE: IF x = 1 THEN x IS A thing.
				// x = 1.
				// By substitution x is a thing.
				{
						proof(
								ifThen(eq(sym("x"), num(1)), isA(sym("x"), category("thing"))),
								clause(eq(sym("x"), num(1))),
								by(Justification.SUBSTITUTION, isA(sym("x"), category("thing")))),
						Collections.singletonList(new ClauseDoesNotFollowIssue(
								by(Justification.SUBSTITUTION, isA(sym("x"), category("thing"))))),
				},
		});
	}

	private final Proof proof;
	private final List<Issue> issues;

	public ProofValidatorTest(Proof proof, List<Issue> issues) {
		this.proof = proof;
		this.issues = issues;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ProofValidator.perform(ctx, proof);

		assertEquals(issues, ctx.getIssues());
	}
}
