package euclid;

/**
 * Raised when the checker reaches a state that a well-formed AST cannot produce.
 */
public class InternalCheckerError extends RuntimeException {
	public InternalCheckerError(String msg) {
		super("internal checker error: " + msg);
	}

	public InternalCheckerError(Exception e) {
		super("internal checker error", e);
	}
}
