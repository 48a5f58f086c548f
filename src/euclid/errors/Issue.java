package euclid.errors;

import euclid.EuclidException;
import euclid.Unreachable;
import euclid.formatters.IssueFormattingVisitor;
import euclid.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A reason to reject a proof. Issues form a closed hierarchy, inspected through
 * {@link IssueVisitor}; the message is whatever {@link IssueFormattingVisitor} makes of it.
 */
public abstract class Issue extends EuclidException {
	private static final String prefix = "Proof error";

	public Issue(SourceLocation location) {
		super(prefix, "", location);
	}

	@Override
	public String getMessage() {
		return getMsg();
	}

	@Override
	public String getMsg() {
		StringWriter sw = new StringWriter();
		try {
			accept(new IssueFormattingVisitor(sw));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
