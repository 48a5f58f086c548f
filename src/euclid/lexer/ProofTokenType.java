package euclid.lexer;

public enum ProofTokenType {
	NUMBER,
	SYMBOL,
	// punctuation
	EQ,
	COLON,
	LPAREN,
	RPAREN,
	DOT,
	// keywords, matched case-insensitively. "is" lexes as BE and "an" as A
	PROVE,
	LET,
	WHERE,
	BY,
	BE,
	A,
	DEFINITION,
	SUBSTITUTION,
	IF,
	THEN,
	THEREFORE,
}
