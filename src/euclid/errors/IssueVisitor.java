package euclid.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(EmptyProofIssue emptyProofIssue) throws E;
	public abstract T visit(BoundaryMismatchIssue boundaryMismatchIssue) throws E;
	public abstract T visit(ClauseDoesNotFollowIssue clauseDoesNotFollowIssue) throws E;
}
