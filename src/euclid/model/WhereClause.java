package euclid.model;

import euclid.util.SourceLocation;

/**
 * The "WHERE k IS AN integer" tail of a formula clause.
 */
public class WhereClause extends ProofNode {

	private final SymbolTerm symbol;
	private final CompoundSymbol category;

	public WhereClause(SourceLocation location, SymbolTerm symbol, CompoundSymbol category) {
		super(location);
		this.symbol = symbol;
		this.category = category;
	}

	public SymbolTerm getSymbol() {
		return symbol;
	}

	public CompoundSymbol getCategory() {
		return category;
	}

	@Override
	public <T, E extends Throwable> T accept(ProofNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + symbol.hashCode();
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
		WhereClause other = (WhereClause) obj;
		return symbol.equals(other.symbol) && category.equals(other.category);
	}
}
