package euclid.check;

import java.util.Optional;

import euclid.InternalCheckerError;

import euclid.model.Conditional;
import euclid.model.Equality;
import euclid.model.FormulaVisitor;
import euclid.model.IsA;
import euclid.model.Justification;
import euclid.model.NumberTerm;

/**
 * Answers, for one formula, whether it follows from the knowledge under the
 * given justification, which is null when the clause cites none.
 */
public class FormulaJustificationVisitor extends FormulaVisitor<Boolean, RuntimeException> {
	private final KnowledgeBase knowledge;
	private final Justification justification;

	public FormulaJustificationVisitor(KnowledgeBase knowledge, Justification justification) {
		this.knowledge = knowledge;
		this.justification = justification;
	}

	@Override
	public Boolean visit(Equality equality) {
		if (justification == null) {
			return knowledge.areEquivalent(equality.getLeft(), equality.getRight());
		}
		switch (justification) {
			case SUBSTITUTION:
				return !knowledge.areIdentical(equality.getLeft(), equality.getRight()) &&
						knowledge.areEquivalent(equality.getLeft(), equality.getRight());
			case DEFINITION:
				return false;
			default:
				throw new InternalCheckerError("unhandled justification " + justification);
		}
	}

	@Override
	public Boolean visit(IsA isA) {
		if (knowledge.hasCategory(isA.getTerm(), isA.getCategory())) {
			return justification == null || justification == Justification.DEFINITION;
		}
		if (justification != Justification.DEFINITION) {
			return false;
		}
		Optional<BuiltinPredicate> predicate = BuiltinPredicate.lookup(isA.getCategory());
		if (!predicate.isPresent()) {
			return false;
		}
		Optional<NumberTerm> literal = knowledge.resolveLiteral(isA.getTerm());
		return literal.isPresent() && predicate.get().test(literal.get());
	}

	@Override
	public Boolean visit(Conditional conditional) {
		return false;
	}
}
