package euclid.model;

import euclid.util.SourceLocation;

/**
 * One sentence of a proof body.
 */
public abstract class Clause extends ProofNode {

	public Clause(SourceLocation location) {
		super(location);
	}

	/**
	 * @return the formula this clause claims: the formula itself for formula and
	 * THEREFORE clauses, "x = t" or "x is a c" for the two forms of LET
	 */
	public abstract Formula getAssertedFormula();

	@Override
	public <T, E extends Throwable> T accept(ProofNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ClauseVisitor<T, E> v) throws E;

}
