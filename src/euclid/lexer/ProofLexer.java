package euclid.lexer;

import euclid.util.SourceLocation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans proof source into tokens, one at a time and on demand.
 *
 * At every position the patterns below are tried in order and the first one
 * that matches wins. Newlines and runs of blanks or commas are consumed
 * without producing a token. A lexer cannot be rewound; to scan the same text
 * again, make a new one.
 */
public class ProofLexer implements Iterator<ProofToken> {

	static final Pattern NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?");
	static final Pattern SYMBOL = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
	static final Pattern NEWLINE = Pattern.compile("\\r?\\n");
	static final Pattern SKIP = Pattern.compile("[ \\t\\r,]+");

	static final Map<Character, ProofTokenType> PUNCTUATION = new HashMap<>();
	static final Map<String, ProofTokenType> KEYWORDS = new HashMap<>();

	static {
		PUNCTUATION.put('=', ProofTokenType.EQ);
		PUNCTUATION.put(':', ProofTokenType.COLON);
		PUNCTUATION.put('(', ProofTokenType.LPAREN);
		PUNCTUATION.put(')', ProofTokenType.RPAREN);
		PUNCTUATION.put('.', ProofTokenType.DOT);

		KEYWORDS.put("PROVE", ProofTokenType.PROVE);
		KEYWORDS.put("LET", ProofTokenType.LET);
		KEYWORDS.put("WHERE", ProofTokenType.WHERE);
		KEYWORDS.put("BY", ProofTokenType.BY);
		KEYWORDS.put("BE", ProofTokenType.BE);
		KEYWORDS.put("IS", ProofTokenType.BE);
		KEYWORDS.put("A", ProofTokenType.A);
		KEYWORDS.put("AN", ProofTokenType.A);
		KEYWORDS.put("DEFINITION", ProofTokenType.DEFINITION);
		KEYWORDS.put("SUBSTITUTION", ProofTokenType.SUBSTITUTION);
		KEYWORDS.put("IF", ProofTokenType.IF);
		KEYWORDS.put("THEN", ProofTokenType.THEN);
		KEYWORDS.put("THEREFORE", ProofTokenType.THEREFORE);
	}

	private final String text;
	private int offset;
	private int line;
	private int lineStart;
	private ProofToken next;

	public ProofLexer(String text) {
		this.text = text;
		this.offset = 0;
		this.line = 1;
		this.lineStart = 0;
	}

	private ProofToken makeToken(String value, ProofTokenType type) {
		int column = offset - lineStart + 1;
		return new ProofToken(value, type, new SourceLocation(
				offset, offset + value.length(), line, line, column, column + value.length()));
	}

	private Matcher lookingAt(Pattern pattern) {
		Matcher m = pattern.matcher(text);
		m.region(offset, text.length());
		return m.lookingAt() ? m : null;
	}

	/**
	 * @return the next token, or null at the end of the input
	 * @throws ProofLexerException if the input contains a character no pattern accepts
	 */
	private ProofToken scan() throws ProofLexerException {
		while (offset < text.length()) {
			Matcher m = lookingAt(NEWLINE);
			if (m != null) {
				offset = m.end();
				lineStart = offset;
				++line;
				continue;
			}

			m = lookingAt(SKIP);
			if (m != null) {
				offset = m.end();
				continue;
			}

			m = lookingAt(NUMBER);
			if (m != null) {
				ProofToken token = makeToken(m.group(), ProofTokenType.NUMBER);
				offset = m.end();
				return token;
			}

			ProofTokenType punctuation = PUNCTUATION.get(text.charAt(offset));
			if (punctuation != null) {
				ProofToken token = makeToken(text.substring(offset, offset + 1), punctuation);
				++offset;
				return token;
			}

			m = lookingAt(SYMBOL);
			if (m != null) {
				String symbol = m.group();
				ProofTokenType type = KEYWORDS.getOrDefault(symbol.toUpperCase(Locale.ROOT), ProofTokenType.SYMBOL);
				ProofToken token = makeToken(symbol, type);
				offset = m.end();
				return token;
			}

			int column = offset - lineStart + 1;
			String offending = text.substring(offset, text.offsetByCodePoints(offset, 1));
			throw new ProofLexerException(offending, new SourceLocation(
					offset, offset + offending.length(), line, line, column, column + offending.length()));
		}
		return null;
	}

	@Override
	public boolean hasNext() {
		if (next == null) {
			next = scan();
		}
		return next != null;
	}

	@Override
	public ProofToken next() {
		if (!hasNext()) {
			throw new NoSuchElementException("end of proof source");
		}
		ProofToken result = next;
		next = null;
		return result;
	}

	/**
	 * @return every remaining token, in order
	 * @throws ProofLexerException if the lexer cannot understand part of the input
	 */
	public List<ProofToken> readTokens() throws ProofLexerException {
		List<ProofToken> tokens = new ArrayList<>();
		while (hasNext()) {
			tokens.add(next());
		}
		return tokens;
	}
}
