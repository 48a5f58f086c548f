package euclid.model;

import java.util.Collections;
import java.util.List;

import euclid.util.SourceLocation;

/**
 * A category name of one or more words, e.g. "even integer". Word order matters.
 */
public class CompoundSymbol extends ProofNode {

	private final List<String> components;

	public CompoundSymbol(SourceLocation location, List<String> components) {
		super(location);
		if (components.isEmpty()) {
			throw new IllegalArgumentException("a compound symbol needs at least one component");
		}
		this.components = Collections.unmodifiableList(components);
	}

	public List<String> getComponents() {
		return components;
	}

	public boolean isSingleWord() {
		return components.size() == 1;
	}

	@Override
	public <T, E extends Throwable> T accept(ProofNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return components.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		CompoundSymbol other = (CompoundSymbol) obj;
		return components.equals(other.components);
	}
}
