package euclid.formatters;

import static org.junit.Assert.*;

import org.junit.Test;

import euclid.errors.BoundaryMismatchIssue;
import euclid.errors.ClauseDoesNotFollowIssue;
import euclid.errors.EmptyProofIssue;
import euclid.errors.ParsingIssue;
import euclid.lexer.ProofLexerException;
import euclid.model.Justification;
import euclid.parser.ProofParser;
import euclid.util.SourceLocation;

import static euclid.model.ProofBuilder.*;

public class IssueFormattingVisitorTest {

	@Test
	public void emptyProof() {
		assertEquals("the body of the proof is empty",
				new EmptyProofIssue(ProofParser.readProof("PROVE: x = 1.")).getMsg());
	}

	@Test
	public void statementMismatch() {
		BoundaryMismatchIssue issue = new BoundaryMismatchIssue(
				BoundaryMismatchIssue.Boundary.STATEMENT,
				eq(sym("x"), num(1)),
				let("y", num(2)));
		assertEquals("the first statement of the proof does not match the statement to be proven " +
				"(expected \"x = 1\", found \"LET y = 2.\")", issue.getMsg());
	}

	@Test
	public void hypothesisMismatch() {
		BoundaryMismatchIssue issue = new BoundaryMismatchIssue(
				BoundaryMismatchIssue.Boundary.HYPOTHESIS,
				isA(sym("n"), category("even")),
				clause(isA(sym("n"), category("odd"))));
		assertEquals("the first statement of the proof does not match the hypothesis of the if statement " +
				"to be proven (expected \"n IS A even\", found \"n IS A odd.\")", issue.getMsg());
	}

	@Test
	public void consequentMismatch() {
		BoundaryMismatchIssue issue = new BoundaryMismatchIssue(
				BoundaryMismatchIssue.Boundary.CONSEQUENT,
				eq(sym("x"), sym("x")),
				therefore(eq(sym("x"), num(1))));
		assertEquals("the final statement of the proof does not match the consequent to be proven " +
				"(expected \"x = x\", found \"THEREFORE x = 1.\")", issue.getMsg());
	}

	@Test
	public void clauseDoesNotFollow() {
		ClauseDoesNotFollowIssue issue = new ClauseDoesNotFollowIssue(
				by(Justification.SUBSTITUTION, eq(sym("y"), times(num(2), sym("k"))),
						where("k", category("whole", "number"))));
		assertEquals("\"BY SUBSTITUTION y = 2 k WHERE k IS A whole number.\" does not follow", issue.getMsg());
	}

	@Test
	public void parsingIssueReusesTheErrorMessage() {
		ProofLexerException error = new ProofLexerException("$", SourceLocation.unknown());
		ParsingIssue issue = new ParsingIssue(error);
		assertEquals("'$' unexpected", issue.getMsg());
		assertSame(error, issue.getCause());
	}
}
