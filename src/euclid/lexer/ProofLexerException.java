package euclid.lexer;

import euclid.EuclidException;
import euclid.util.SourceLocation;

/**
 * Raised on a character that starts no token.
 */
public class ProofLexerException extends EuclidException {

	private static final long serialVersionUID = -4061873345309127415L;

	private final String offendingText;

	public ProofLexerException(String offendingText, SourceLocation location) {
		super("Lexer error", "'" + offendingText + "' unexpected", location);
		this.offendingText = offendingText;
	}

	public String getOffendingText() {
		return offendingText;
	}
}
