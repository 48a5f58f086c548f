package euclid.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(errors);
	}

	/**
	 * @return the first issue reported
	 * @throws IllegalStateException if nothing was reported
	 */
	public Issue getFirstIssue() {
		if (errors.isEmpty()) {
			throw new IllegalStateException("no issues were reported");
		}
		return errors.get(0);
	}

	public String format() {
		StringBuilder sb = new StringBuilder();
		sb.append("Detected ").append(errors.size()).append(" issue(s):");
		for (Issue e : errors) {
			sb.append(System.lineSeparator()).append(e.getMsg());
		}
		return sb.toString();
	}
}
