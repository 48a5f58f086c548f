package euclid.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import euclid.Unreachable;
import euclid.lexer.ProofLexer;
import euclid.lexer.ProofLexerException;
import euclid.lexer.ProofToken;
import euclid.lexer.ProofTokenType;
import euclid.model.*;
import euclid.util.SourceLocation;

/**
 * Recursive descent parser for proofs, one method per grammar rule:
 *
 * <pre>
 *     proof            := PROVE COLON formula DOT clause*
 *     clause           := let-clause | therefore-clause | formula-clause
 *     let-clause       := LET SYMBOL (BE A compound-symbol | EQ term) DOT
 *     therefore-clause := THEREFORE formula DOT
 *     formula-clause   := (BY justification)? formula (WHERE SYMBOL BE A compound-symbol)? DOT
 *     formula          := IF formula THEN formula | term EQ term | term BE A compound-symbol
 *     term             := SYMBOL | NUMBER | NUMBER SYMBOL | NUMBER LPAREN term RPAREN | LPAREN term RPAREN
 *     justification    := DEFINITION | SUBSTITUTION
 *     compound-symbol  := SYMBOL+
 * </pre>
 *
 * A proof without clauses parses; rejecting it is up to the validator.
 */
public class ProofParser {

	private final TokenCursor cursor;

	public ProofParser(Iterator<ProofToken> tokens) {
		this.cursor = new TokenCursor(tokens);
	}

	/**
	 * @throws ProofLexerException if the text contains a character that starts no token
	 * @throws ParseFailureException if the tokens do not form a proof
	 */
	public static Proof readProof(String text) throws ProofLexerException, ParseFailureException {
		return new ProofParser(new ProofLexer(text)).proof();
	}

	public static Proof readProof(List<ProofToken> tokens) throws ParseFailureException {
		return new ProofParser(tokens.iterator()).proof();
	}

	public static Formula readFormula(String text) throws ProofLexerException, ParseFailureException {
		ProofParser parser = new ProofParser(new ProofLexer(text));
		Formula formula = parser.formula();
		parser.expectEnd();
		return formula;
	}

	public static Term readTerm(String text) throws ProofLexerException, ParseFailureException {
		ProofParser parser = new ProofParser(new ProofLexer(text));
		Term term = parser.term();
		parser.expectEnd();
		return term;
	}

	private void expectEnd() throws ParseFailureException {
		if (!cursor.atEnd()) {
			throw ParseFailureException.unexpectedToken(new ArrayList<>(), cursor.peek());
		}
	}

	Proof proof() throws ParseFailureException {
		ProofToken prove = cursor.expect(ProofTokenType.PROVE);
		cursor.expect(ProofTokenType.COLON);
		Formula statement = formula();
		ProofToken dot = cursor.expect(ProofTokenType.DOT);
		SourceLocation location = prove.getLocation().combine(dot.getLocation());
		List<Clause> clauses = new ArrayList<>();
		while (!cursor.atEnd()) {
			Clause clause = clause();
			location = location.combine(clause.getLocation());
			clauses.add(clause);
		}
		return new Proof(location, statement, clauses);
	}

	Clause clause() throws ParseFailureException {
		if (cursor.check(ProofTokenType.LET)) {
			return letClause();
		} else if (cursor.check(ProofTokenType.THEREFORE)) {
			return thereforeClause();
		} else {
			return formulaClause();
		}
	}

	LetClause letClause() throws ParseFailureException {
		ProofToken let = cursor.expect(ProofTokenType.LET);
		SymbolTerm symbol = symbol();
		ProofToken next = cursor.expect(ProofTokenType.EQ, ProofTokenType.BE);
		if (next.getType() == ProofTokenType.EQ) {
			Term term = term();
			ProofToken dot = cursor.expect(ProofTokenType.DOT);
			return LetClause.equalTo(let.getLocation().combine(dot.getLocation()), symbol, term);
		}
		cursor.expect(ProofTokenType.A);
		CompoundSymbol category = compoundSymbol();
		ProofToken dot = cursor.expect(ProofTokenType.DOT);
		return LetClause.memberOf(let.getLocation().combine(dot.getLocation()), symbol, category);
	}

	ThereforeClause thereforeClause() throws ParseFailureException {
		ProofToken therefore = cursor.expect(ProofTokenType.THEREFORE);
		Formula formula = formula();
		ProofToken dot = cursor.expect(ProofTokenType.DOT);
		return new ThereforeClause(therefore.getLocation().combine(dot.getLocation()), formula);
	}

	FormulaClause formulaClause() throws ParseFailureException {
		SourceLocation start = null;
		Justification justification = null;
		if (cursor.check(ProofTokenType.BY)) {
			start = cursor.expect(ProofTokenType.BY).getLocation();
			justification = justification();
		}
		Formula formula = formula();
		if (start == null) {
			start = formula.getLocation();
		}
		WhereClause where = null;
		if (cursor.check(ProofTokenType.WHERE)) {
			where = whereClause();
		}
		ProofToken dot = cursor.expect(ProofTokenType.DOT);
		return new FormulaClause(start.combine(dot.getLocation()), justification, formula, where);
	}

	Justification justification() throws ParseFailureException {
		ProofToken token = cursor.expect(ProofTokenType.DEFINITION, ProofTokenType.SUBSTITUTION);
		if (token.getType() == ProofTokenType.DEFINITION) {
			return Justification.DEFINITION;
		}
		return Justification.SUBSTITUTION;
	}

	WhereClause whereClause() throws ParseFailureException {
		ProofToken where = cursor.expect(ProofTokenType.WHERE);
		SymbolTerm symbol = symbol();
		cursor.expect(ProofTokenType.BE);
		cursor.expect(ProofTokenType.A);
		CompoundSymbol category = compoundSymbol();
		return new WhereClause(where.getLocation().combine(category.getLocation()), symbol, category);
	}

	CompoundSymbol compoundSymbol() throws ParseFailureException {
		ProofToken first = cursor.expect(ProofTokenType.SYMBOL);
		SourceLocation location = first.getLocation();
		List<String> components = new ArrayList<>();
		components.add(first.getText());
		while (cursor.check(ProofTokenType.SYMBOL)) {
			ProofToken next = cursor.expect(ProofTokenType.SYMBOL);
			location = location.combine(next.getLocation());
			components.add(next.getText());
		}
		return new CompoundSymbol(location, components);
	}

	Formula formula() throws ParseFailureException {
		if (cursor.check(ProofTokenType.IF)) {
			ProofToken ifToken = cursor.expect(ProofTokenType.IF);
			Formula hypothesis = formula();
			cursor.expect(ProofTokenType.THEN);
			Formula consequent = formula();
			return new Conditional(ifToken.getLocation().combine(consequent.getLocation()), hypothesis, consequent);
		}
		Term term = term();
		ProofToken next = cursor.expect(ProofTokenType.EQ, ProofTokenType.BE);
		if (next.getType() == ProofTokenType.EQ) {
			Term right = term();
			return new Equality(term.getLocation().combine(right.getLocation()), term, right);
		}
		cursor.expect(ProofTokenType.A);
		CompoundSymbol category = compoundSymbol();
		return new IsA(term.getLocation().combine(category.getLocation()), term, category);
	}

	Term term() throws ParseFailureException {
		ProofToken token = cursor.expect(ProofTokenType.SYMBOL, ProofTokenType.NUMBER, ProofTokenType.LPAREN);
		switch (token.getType()) {
			case SYMBOL:
				return new SymbolTerm(token.getLocation(), token.getText());
			case NUMBER: {
				NumberTerm coefficient = new NumberTerm(token.getLocation(), literal(token));
				if (cursor.check(ProofTokenType.SYMBOL)) {
					SymbolTerm factor = symbol();
					return new ProductTerm(token.getLocation().combine(factor.getLocation()), coefficient, factor);
				}
				if (cursor.check(ProofTokenType.LPAREN)) {
					cursor.expect(ProofTokenType.LPAREN);
					Term factor = term();
					ProofToken rparen = cursor.expect(ProofTokenType.RPAREN);
					return new ProductTerm(token.getLocation().combine(rparen.getLocation()), coefficient, factor);
				}
				return coefficient;
			}
			case LPAREN: {
				Term inner = term();
				ProofToken rparen = cursor.expect(ProofTokenType.RPAREN);
				return new ParenthesizedTerm(token.getLocation().combine(rparen.getLocation()), inner);
			}
			default:
				throw new Unreachable(); // expect() only returns the three types above
		}
	}

	private SymbolTerm symbol() throws ParseFailureException {
		ProofToken token = cursor.expect(ProofTokenType.SYMBOL);
		return new SymbolTerm(token.getLocation(), token.getText());
	}

	private static Number literal(ProofToken token) {
		return (Number) token.getValue();
	}
}
