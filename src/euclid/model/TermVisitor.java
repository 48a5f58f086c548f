package euclid.model;

public abstract class TermVisitor<T, E extends Throwable> {
	public abstract T visit(SymbolTerm symbolTerm) throws E;
	public abstract T visit(NumberTerm numberTerm) throws E;
	public abstract T visit(ProductTerm productTerm) throws E;
	public abstract T visit(ParenthesizedTerm parenthesizedTerm) throws E;
}
