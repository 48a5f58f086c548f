package euclid.errors;

import euclid.model.Proof;

public class EmptyProofIssue extends Issue {
	private final Proof proof;

	public EmptyProofIssue(Proof proof) {
		super(proof.getLocation());
		this.proof = proof;
	}

	public Proof getProof() {
		return proof;
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
		return proof.equals(((EmptyProofIssue) obj).proof);
	}

	@Override
	public int hashCode() {
		return proof.hashCode();
	}
}
