package euclid.model;

import euclid.util.SourceLocation;

public class Equality extends Formula {

	private final Term left;
	private final Term right;

	public Equality(SourceLocation location, Term left, Term right) {
		super(location);
		this.left = left;
		this.right = right;
	}

	public Term getLeft() {
		return left;
	}

	public Term getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(FormulaVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + left.hashCode();
		result = prime * result + right.hashCode();
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
		Equality other = (Equality) obj;
		return left.equals(other.left) && right.equals(other.right);
	}
}
