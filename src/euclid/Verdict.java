package euclid;

import java.util.Optional;

import euclid.errors.Issue;
import euclid.util.SourceLocation;

/**
 * The outcome of checking one proof: accepted, or rejected because of an issue.
 */
public final class Verdict {
	private static final Verdict ACCEPTED = new Verdict(null);

	private final Issue issue;

	private Verdict(Issue issue) {
		this.issue = issue;
	}

	public static Verdict accepted() {
		return ACCEPTED;
	}

	public static Verdict rejected(Issue issue) {
		if (issue == null) {
			throw new IllegalArgumentException("a rejection needs an issue");
		}
		return new Verdict(issue);
	}

	public boolean isAccepted() {
		return issue == null;
	}

	public Optional<Issue> getIssue() {
		return Optional.ofNullable(issue);
	}

	/**
	 * @return the reason for rejection, empty for an accepted proof
	 */
	public Optional<String> getMessage() {
		return getIssue().map(Issue::getMsg);
	}

	public Optional<SourceLocation> getLocation() {
		if (issue == null || issue.getLocation().isUnknown()) {
			return Optional.empty();
		}
		return Optional.of(issue.getLocation());
	}

	@Override
	public String toString() {
		if (isAccepted()) {
			return "Verdict [ACCEPTED]";
		}
		return "Verdict [REJECTED: " + issue.getMsg() + "]";
	}
}
