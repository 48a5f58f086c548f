package euclid.model;

import euclid.util.SourceLocation;

/**
 * Category membership, "n is an even integer"
 */
public class IsA extends Formula {

	private final Term term;
	private final CompoundSymbol category;

	public IsA(SourceLocation location, Term term, CompoundSymbol category) {
		super(location);
		this.term = term;
		this.category = category;
	}

	public Term getTerm() {
		return term;
	}

	public CompoundSymbol getCategory() {
		return category;
	}

	@Override
	public <T, E extends Throwable> T accept(FormulaVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + term.hashCode();
		result = prime * result + category.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		IsA other = (IsA) obj;
		return term.equals(other.term) && category.equals(other.category);
	}
}
