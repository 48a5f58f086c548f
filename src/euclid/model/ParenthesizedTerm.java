package euclid.model;

import euclid.util.SourceLocation;

/**
 * A term in parentheses. It means the same as the term inside, but is kept in
 * the AST so that structural comparison sees exactly what was written.
 */
public class ParenthesizedTerm extends Term {

	private final Term inner;

	public ParenthesizedTerm(SourceLocation location, Term inner) {
		super(location);
		this.inner = inner;
	}

	public Term getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31 + inner.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ParenthesizedTerm other = (ParenthesizedTerm) obj;
		return inner.equals(other.inner);
	}
}
