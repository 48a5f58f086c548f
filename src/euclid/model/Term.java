package euclid.model;

import euclid.util.SourceLocation;

/**
 * Something that can stand on either side of an equation.
 */
public abstract class Term extends ProofNode {

	public Term(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ProofNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E;

}
