package euclid.model;

public abstract class FormulaVisitor<T, E extends Throwable> {
	public abstract T visit(Equality equality) throws E;
	public abstract T visit(IsA isA) throws E;
	public abstract T visit(Conditional conditional) throws E;
}
