package euclid.parser;

import java.util.Arrays;
import java.util.Iterator;

import euclid.lexer.ProofToken;
import euclid.lexer.ProofTokenType;
import euclid.util.SourceLocation;

/**
 * A position in a token stream with one token of lookahead. Tokens are pulled
 * from the underlying iterator only as the parser asks for them.
 */
public class TokenCursor {
	private final Iterator<ProofToken> tokens;
	private ProofToken lookahead;
	private ProofToken previous;

	public TokenCursor(Iterator<ProofToken> tokens) {
		this.tokens = tokens;
	}

	private void fill() {
		if (lookahead == null && tokens.hasNext()) {
			lookahead = tokens.next();
		}
	}

	public boolean atEnd() {
		fill();
		return lookahead == null;
	}

	/**
	 * @return whether the next token has the given type, without consuming it
	 */
	public boolean check(ProofTokenType type) {
		fill();
		return lookahead != null && lookahead.getType() == type;
	}

	public ProofToken peek() {
		fill();
		return lookahead;
	}

	/**
	 * Consumes the next token, which must have one of the given types.
	 *
	 * @throws ParseFailureException if the input has ended or the next token has another type
	 */
	public ProofToken expect(ProofTokenType... types) throws ParseFailureException {
		fill();
		if (lookahead == null) {
			throw ParseFailureException.prematureEnd(Arrays.asList(types), endLocation());
		}
		for (ProofTokenType type : types) {
			if (lookahead.getType() == type) {
				return advance();
			}
		}
		throw ParseFailureException.unexpectedToken(Arrays.asList(types), lookahead);
	}

	private ProofToken advance() {
		previous = lookahead;
		lookahead = null;
		return previous;
	}

	/**
	 * @return the location just after the last consumed token, where more input was expected
	 */
	private SourceLocation endLocation() {
		if (previous == null) {
			return new SourceLocation(0, 0, 1, 1, 1, 1);
		}
		SourceLocation last = previous.getLocation();
		return new SourceLocation(last.getEndOffset(), last.getEndOffset(), last.getEndLine(), last.getEndLine(),
				last.getEndColumn(), last.getEndColumn());
	}
}
