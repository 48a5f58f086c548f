package euclid.model;

import euclid.util.SourceLocation;

/**
 * A statement that is either established or not: an equation, a category
 * membership, or an implication between two formulas.
 */
public abstract class Formula extends ProofNode {

	public Formula(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ProofNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(FormulaVisitor<T, E> v) throws E;

}
