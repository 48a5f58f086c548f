package euclid.model;

import euclid.util.SourceLocation;

public class ThereforeClause extends Clause {

	private final Formula formula;

	public ThereforeClause(SourceLocation location, Formula formula) {
		super(location);
		this.formula = formula;
	}

	public Formula getFormula() {
		return formula;
	}

	@Override
	public Formula getAssertedFormula() {
		return formula;
	}

	@Override
	public <T, E extends Throwable> T accept(ClauseVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 17 + formula.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ThereforeClause other = (ThereforeClause) obj;
		return formula.equals(other.formula);
	}
}
