package euclid.model;

import java.util.Collections;
import java.util.List;

import euclid.util.SourceLocation;

/**
 * A whole proof: the statement after "PROVE:" and the clauses that establish it.
 */
public class Proof extends ProofNode {

	private final Formula statement;
	private final List<Clause> clauses;

	public Proof(SourceLocation location, Formula statement, List<Clause> clauses) {
		super(location);
		this.statement = statement;
		this.clauses = Collections.unmodifiableList(clauses);
	}

	public Formula getStatement() {
		return statement;
	}

	public List<Clause> getClauses() {
		return clauses;
	}

	@Override
	public <T, E extends Throwable> T accept(ProofNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + statement.hashCode();
		result = prime * result + clauses.hashCode();
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
		Proof other = (Proof) obj;
		return statement.equals(other.statement) && clauses.equals(other.clauses);
	}
}
