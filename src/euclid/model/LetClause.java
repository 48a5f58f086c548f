package euclid.model;

import java.util.Objects;

import euclid.util.SourceLocation;

/**
 * "LET x = t." or "LET x BE A c." Exactly one of term and category is set.
 */
public class LetClause extends Clause {

	private final SymbolTerm symbol;
	private final Term term;
	private final CompoundSymbol category;

	private LetClause(SourceLocation location, SymbolTerm symbol, Term term, CompoundSymbol category) {
		super(location);
		this.symbol = symbol;
		this.term = term;
		this.category = category;
	}

	public static LetClause equalTo(SourceLocation location, SymbolTerm symbol, Term term) {
		return new LetClause(location, symbol, Objects.requireNonNull(term), null);
	}

	public static LetClause memberOf(SourceLocation location, SymbolTerm symbol, CompoundSymbol category) {
		return new LetClause(location, symbol, null, Objects.requireNonNull(category));
	}

	public SymbolTerm getSymbol() {
		return symbol;
	}

	public boolean bindsCategory() {
		return category != null;
	}

	/**
	 * @return the bound term, or null for "LET x BE A c."
	 */
	public Term getTerm() {
		return term;
	}

	/**
	 * @return the bound category, or null for "LET x = t."
	 */
	public CompoundSymbol getCategory() {
		return category;
	}

	@Override
	public Formula getAssertedFormula() {
		if (bindsCategory()) {
			return new IsA(getLocation(), symbol, category);
		}
		return new Equality(getLocation(), symbol, term);
	}

	@Override
	public <T, E extends Throwable> T accept(ClauseVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(symbol, term, category);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LetClause other = (LetClause) obj;
		return symbol.equals(other.symbol) && Objects.equals(term, other.term) &&
				Objects.equals(category, other.category);
	}
}
