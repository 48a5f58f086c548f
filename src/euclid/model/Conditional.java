package euclid.model;

import euclid.util.SourceLocation;

/**
 * "IF hypothesis THEN consequent"
 */
public class Conditional extends Formula {

	private final Formula hypothesis;
	private final Formula consequent;

	public Conditional(SourceLocation location, Formula hypothesis, Formula consequent) {
		super(location);
		this.hypothesis = hypothesis;
		this.consequent = consequent;
	}

	public Formula getHypothesis() {
		return hypothesis;
	}

	public Formula getConsequent() {
		return consequent;
	}

	@Override
	public <T, E extends Throwable> T accept(FormulaVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + hypothesis.hashCode();
		result = prime * result + consequent.hashCode();
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
		Conditional other = (Conditional) obj;
		return hypothesis.equals(other.hypothesis) && consequent.equals(other.consequent);
	}
}
