package euclid.errors;

import euclid.model.Clause;

public class ClauseDoesNotFollowIssue extends Issue {
	private final Clause clause;

	public ClauseDoesNotFollowIssue(Clause clause) {
		super(clause.getLocation());
		this.clause = clause;
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
		return clause.equals(((ClauseDoesNotFollowIssue) obj).clause);
	}

	@Override
	public int hashCode() {
		return clause.hashCode();
	}
}
