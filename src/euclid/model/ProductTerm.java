package euclid.model;

import euclid.util.SourceLocation;

/**
 * Multiplication by a numeric coefficient, written "2 k" or "2 (k)". The
 * coefficient always comes first; "k 2" is not a product.
 */
public class ProductTerm extends Term {

	private final NumberTerm coefficient;
	private final Term factor;

	public ProductTerm(SourceLocation location, NumberTerm coefficient, Term factor) {
		super(location);
		this.coefficient = coefficient;
		this.factor = factor;
	}

	public NumberTerm getCoefficient() {
		return coefficient;
	}

	public Term getFactor() {
		return factor;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + coefficient.hashCode();
		result = prime * result + factor.hashCode();
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
		ProductTerm other = (ProductTerm) obj;
		return coefficient.equals(other.coefficient) && factor.equals(other.factor);
	}
}
