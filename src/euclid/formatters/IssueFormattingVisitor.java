package euclid.formatters;

import java.io.IOException;
import java.io.Writer;

import euclid.InternalCheckerError;
import euclid.errors.*;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final Writer out;

	public IssueFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write(parsingIssue.getError().getMsg());
		return null;
	}

	@Override
	public Void visit(EmptyProofIssue emptyProofIssue) throws IOException {
		out.write("the body of the proof is empty");
		return null;
	}

	@Override
	public Void visit(BoundaryMismatchIssue boundaryMismatchIssue) throws IOException {
		switch (boundaryMismatchIssue.getBoundary()) {
			case STATEMENT:
				out.write("the first statement of the proof does not match the statement to be proven");
				break;
			case HYPOTHESIS:
				out.write("the first statement of the proof does not match the hypothesis of the if statement " +
						"to be proven");
				break;
			case CONSEQUENT:
				out.write("the final statement of the proof does not match the consequent to be proven");
				break;
			default:
				throw new InternalCheckerError("unhandled boundary " + boundaryMismatchIssue.getBoundary());
		}
		out.write(" (expected \"");
		boundaryMismatchIssue.getExpected().accept(new FormulaFormattingVisitor(out));
		out.write("\", found \"");
		boundaryMismatchIssue.getClause().accept(new ClauseFormattingVisitor(out));
		out.write("\")");
		return null;
	}

	@Override
	public Void visit(ClauseDoesNotFollowIssue clauseDoesNotFollowIssue) throws IOException {
		out.write("\"");
		clauseDoesNotFollowIssue.getClause().accept(new ClauseFormattingVisitor(out));
		out.write("\" does not follow");
		return null;
	}
}
