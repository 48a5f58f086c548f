package euclid.check;

import java.util.List;
import java.util.logging.Logger;

import euclid.errors.BoundaryMismatchIssue;
import euclid.errors.EmptyProofIssue;
import euclid.errors.IssueContext;
import euclid.model.Clause;
import euclid.model.Conditional;
import euclid.model.Formula;
import euclid.model.Proof;

/**
 * Checks a parsed proof, reporting the first problem found to the issue context:
 *
 * <ul>
 *     <li>the body must not be empty;</li>
 *     <li>for a goal "IF h THEN c", the first clause must state h and the last c;
 *     for any other goal, the first clause must state the goal;</li>
 *     <li>each clause must follow from the clauses before it. The first clause of
 *     a conditional proof is its hypothesis and is assumed rather than checked.</li>
 * </ul>
 *
 * Boundary clauses are compared structurally, exactly as written.
 */
public class ProofValidator {
	private static final Logger logger = Logger.getLogger(ProofValidator.class.getName());

	private ProofValidator() {}

	public static void perform(IssueContext ctx, Proof proof) {
		List<Clause> clauses = proof.getClauses();
		if (clauses.isEmpty()) {
			ctx.error(new EmptyProofIssue(proof));
			return;
		}
		if (!checkBoundaries(ctx, proof.getStatement(), clauses)) {
			return;
		}

		logger.fine(() -> "checking " + clauses.size() + " clause(s) of proof of \"" + proof.getStatement() + "\"");
		KnowledgeBase knowledge = new KnowledgeBase();
		ClauseValidationVisitor validator = new ClauseValidationVisitor(ctx, knowledge);
		int first = 0;
		if (proof.getStatement() instanceof Conditional) {
			validator.assume(clauses.get(0));
			first = 1;
		}
		for (int i = first; i < clauses.size(); i++) {
			if (!clauses.get(i).accept(validator)) {
				return;
			}
		}
	}

	private static boolean checkBoundaries(IssueContext ctx, Formula statement, List<Clause> clauses) {
		Clause firstClause = clauses.get(0);
		if (statement instanceof Conditional) {
			Conditional conditional = (Conditional) statement;
			if (!conditional.getHypothesis().equals(firstClause.getAssertedFormula())) {
				ctx.error(new BoundaryMismatchIssue(
						BoundaryMismatchIssue.Boundary.HYPOTHESIS, conditional.getHypothesis(), firstClause));
				return false;
			}
			Clause lastClause = clauses.get(clauses.size() - 1);
			if (!conditional.getConsequent().equals(lastClause.getAssertedFormula())) {
				ctx.error(new BoundaryMismatchIssue(
						BoundaryMismatchIssue.Boundary.CONSEQUENT, conditional.getConsequent(), lastClause));
				return false;
			}
			return true;
		}
		if (!statement.equals(firstClause.getAssertedFormula())) {
			ctx.error(new BoundaryMismatchIssue(BoundaryMismatchIssue.Boundary.STATEMENT, statement, firstClause));
			return false;
		}
		return true;
	}
}
