package euclid.check;

import java.util.logging.Logger;

import euclid.errors.ClauseDoesNotFollowIssue;
import euclid.errors.IssueContext;
import euclid.model.Clause;
import euclid.model.ClauseVisitor;
import euclid.model.Formula;
import euclid.model.FormulaClause;
import euclid.model.IsA;
import euclid.model.Justification;
import euclid.model.LetClause;
import euclid.model.ThereforeClause;
import euclid.model.WhereClause;

/**
 * Checks one clause against the knowledge gathered from the clauses before it,
 * then folds the clause's own assertions in. Returns false, after reporting an
 * issue, when the clause is not justified.
 */
public class ClauseValidationVisitor extends ClauseVisitor<Boolean, RuntimeException> {
	private static final Logger logger = Logger.getLogger(ClauseValidationVisitor.class.getName());

	private final IssueContext ctx;
	private final KnowledgeBase knowledge;
	private final KnowledgeFoldingVisitor folder;

	public ClauseValidationVisitor(IssueContext ctx, KnowledgeBase knowledge) {
		this.ctx = ctx;
		this.knowledge = knowledge;
		this.folder = new KnowledgeFoldingVisitor(knowledge);
	}

	/**
	 * Takes a clause as given, without checking it. Used for the hypothesis of a
	 * conditional proof.
	 */
	public void assume(Clause clause) {
		logger.fine(() -> "assuming \"" + clause + "\" " + clause.getLocation().prettyString());
		clause.getAssertedFormula().accept(folder);
		if (clause instanceof FormulaClause) {
			((FormulaClause) clause).getWhere().ifPresent(this::foldWhere);
		}
	}

	private void foldWhere(WhereClause where) {
		new IsA(where.getLocation(), where.getSymbol(), where.getCategory()).accept(folder);
	}

	private boolean check(Clause clause, Formula formula, Justification justification) {
		if (!JustificationChecker.follows(knowledge, formula, justification)) {
			logger.fine(() -> "rejected \"" + clause + "\" " + clause.getLocation().prettyString());
			ctx.error(new ClauseDoesNotFollowIssue(clause));
			return false;
		}
		logger.fine(() -> "accepted \"" + clause + "\" " + clause.getLocation().prettyString());
		return true;
	}

	@Override
	public Boolean visit(LetClause letClause) {
		logger.fine(() -> "declaring \"" + letClause + "\" " + letClause.getLocation().prettyString());
		letClause.getAssertedFormula().accept(folder);
		return true;
	}

	@Override
	public Boolean visit(FormulaClause formulaClause) {
		if (!check(formulaClause, formulaClause.getFormula(), formulaClause.getJustification().orElse(null))) {
			return false;
		}
		formulaClause.getFormula().accept(folder);
		formulaClause.getWhere().ifPresent(this::foldWhere);
		return true;
	}

	@Override
	public Boolean visit(ThereforeClause thereforeClause) {
		if (!check(thereforeClause, thereforeClause.getFormula(), null)) {
			return false;
		}
		thereforeClause.getFormula().accept(folder);
		return true;
	}
}
