package euclid.model;

import euclid.util.SourceLocation;

/**
 * A reference to a named quantity, e.g. the x in "x = 2 k"
 */
public class SymbolTerm extends Term {

	private final String name;

	public SymbolTerm(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		SymbolTerm other = (SymbolTerm) obj;
		return name.equals(other.name);
	}
}
