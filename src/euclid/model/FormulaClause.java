package euclid.model;

import java.util.Objects;
import java.util.Optional;

import euclid.util.SourceLocation;

/**
 * "BY DEFINITION n IS AN even integer WHERE k IS AN integer." Both the
 * justification and the where clause are optional.
 */
public class FormulaClause extends Clause {

	private final Justification justification;
	private final Formula formula;
	private final WhereClause where;

	public FormulaClause(SourceLocation location, Justification justification, Formula formula, WhereClause where) {
		super(location);
		this.justification = justification;
		this.formula = formula;
		this.where = where;
	}

	public Optional<Justification> getJustification() {
		return Optional.ofNullable(justification);
	}

	public Formula getFormula() {
		return formula;
	}

	public Optional<WhereClause> getWhere() {
		return Optional.ofNullable(where);
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
		return Objects.hash(justification, formula, where);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		FormulaClause other = (FormulaClause) obj;
		return justification == other.justification && formula.equals(other.formula) &&
				Objects.equals(where, other.where);
	}
}
