package euclid.model;

public abstract class ProofNodeVisitor<T, E extends Throwable> {
	public abstract T visit(Proof proof) throws E;
	public abstract T visit(Clause clause) throws E;
	public abstract T visit(WhereClause whereClause) throws E;
	public abstract T visit(Formula formula) throws E;
	public abstract T visit(Term term) throws E;
	public abstract T visit(CompoundSymbol compoundSymbol) throws E;
}
