package euclid.errors;

import java.util.Objects;

import euclid.model.Clause;
import euclid.model.Formula;

/**
 * The first or last clause of a proof does not restate what it has to.
 */
public class BoundaryMismatchIssue extends Issue {

	public enum Boundary {
		/** the first clause against the whole statement of a non-conditional proof */
		STATEMENT,
		/** the first clause against the hypothesis of a conditional statement */
		HYPOTHESIS,
		/** the last clause against the consequent of a conditional statement */
		CONSEQUENT,
	}

	private final Boundary boundary;
	private final Formula expected;
	private final Clause clause;

	public BoundaryMismatchIssue(Boundary boundary, Formula expected, Clause clause) {
		super(clause.getLocation());
		this.boundary = boundary;
		this.expected = expected;
		this.clause = clause;
	}

	public Boundary getBoundary() {
		return boundary;
	}

	public Formula getExpected() {
		return expected;
	}

	public Clause getClause() {
		return clause;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		BoundaryMismatchIssue other = (BoundaryMismatchIssue) obj;
		return boundary == other.boundary && expected.equals(other.expected) && clause.equals(other.clause);
	}

	@Override
	public int hashCode() {
		return Objects.hash(boundary, expected, clause);
	}
}
