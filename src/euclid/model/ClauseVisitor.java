package euclid.model;

public abstract class ClauseVisitor<T, E extends Throwable> {
	public abstract T visit(LetClause letClause) throws E;
	public abstract T visit(FormulaClause formulaClause) throws E;
	public abstract T visit(ThereforeClause thereforeClause) throws E;
}
