package euclid.parser;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import euclid.EuclidException;
import euclid.lexer.ProofToken;
import euclid.lexer.ProofTokenType;
import euclid.util.SourceLocation;

/**
 * Raised when the tokens of a proof do not fit the grammar, either because an
 * unexpected token turned up or because the input ended in the middle of a construct.
 */
public class ParseFailureException extends EuclidException {

	private static final long serialVersionUID = 7529013468811927711L;
	private static final String prefix = "Syntax error";

	private final List<ProofTokenType> expected;
	private final ProofToken found;

	private ParseFailureException(String msg, List<ProofTokenType> expected, ProofToken found,
	                              SourceLocation location) {
		super(prefix, msg, location);
		this.expected = Collections.unmodifiableList(expected);
		this.found = found;
	}

	public static ParseFailureException unexpectedToken(List<ProofTokenType> expected, ProofToken found) {
		return new ParseFailureException(
				"got " + found.getType() + " '" + found.getText() + "', expected " + describe(expected),
				expected, found, found.getLocation());
	}

	public static ParseFailureException prematureEnd(List<ProofTokenType> expected, SourceLocation location) {
		return new ParseFailureException("premature end of input", expected, null, location);
	}

	private static String describe(List<ProofTokenType> expected) {
		if (expected.isEmpty()) {
			return "end of input";
		}
		if (expected.size() == 1) {
			return expected.get(0).toString();
		}
		return "one of " + expected.stream().map(ProofTokenType::toString).collect(Collectors.joining(", "));
	}

	public List<ProofTokenType> getExpected() {
		return expected;
	}

	/**
	 * @return the offending token, or null if the input ended too early
	 */
	public ProofToken getFound() {
		return found;
	}

	public boolean isPrematureEnd() {
		return found == null;
	}
}
