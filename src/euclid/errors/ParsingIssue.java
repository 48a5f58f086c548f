package euclid.errors;

import euclid.EuclidException;

/**
 * The proof text could not be read: either the lexer or the parser gave up.
 */
public class ParsingIssue extends Issue {
	private final EuclidException error;

	public ParsingIssue(EuclidException error) {
		super(error.getLocation());
		initCause(error);
		this.error = error;
	}

	public EuclidException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
