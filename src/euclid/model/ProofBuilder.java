package euclid.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;

import euclid.util.SourceLocation;

/**
 * Shorthand constructors for AST nodes with unknown source locations, mostly for tests.
 */
public class ProofBuilder {
	private ProofBuilder() {}

	public static Proof proof(Formula statement, Clause... clauses) {
		return new Proof(SourceLocation.unknown(), statement, Arrays.asList(clauses));
	}

	// clauses

	public static LetClause let(String symbol, Term term) {
		return LetClause.equalTo(SourceLocation.unknown(), sym(symbol), term);
	}

	public static LetClause let(String symbol, CompoundSymbol category) {
		return LetClause.memberOf(SourceLocation.unknown(), sym(symbol), category);
	}

	public static FormulaClause clause(Formula formula) {
		return new FormulaClause(SourceLocation.unknown(), null, formula, null);
	}

	public static FormulaClause by(Justification justification, Formula formula) {
		return new FormulaClause(SourceLocation.unknown(), justification, formula, null);
	}

	public static FormulaClause by(Justification justification, Formula formula, WhereClause where) {
		return new FormulaClause(SourceLocation.unknown(), justification, formula, where);
	}

	public static WhereClause where(String symbol, CompoundSymbol category) {
		return new WhereClause(SourceLocation.unknown(), sym(symbol), category);
	}

	public static ThereforeClause therefore(Formula formula) {
		return new ThereforeClause(SourceLocation.unknown(), formula);
	}

	// formulas

	public static Equality eq(Term left, Term right) {
		return new Equality(SourceLocation.unknown(), left, right);
	}

	public static IsA isA(Term term, CompoundSymbol category) {
		return new IsA(SourceLocation.unknown(), term, category);
	}

	public static Conditional ifThen(Formula hypothesis, Formula consequent) {
		return new Conditional(SourceLocation.unknown(), hypothesis, consequent);
	}

	public static CompoundSymbol category(String... components) {
		return new CompoundSymbol(SourceLocation.unknown(), Arrays.asList(components));
	}

	// terms

	public static SymbolTerm sym(String name) {
		return new SymbolTerm(SourceLocation.unknown(), name);
	}

	public static NumberTerm num(long value) {
		return new NumberTerm(SourceLocation.unknown(), BigInteger.valueOf(value));
	}

	public static NumberTerm num(String decimal) {
		return new NumberTerm(SourceLocation.unknown(), new BigDecimal(decimal));
	}

	public static ProductTerm times(NumberTerm coefficient, Term factor) {
		return new ProductTerm(SourceLocation.unknown(), coefficient, factor);
	}

	public static ParenthesizedTerm paren(Term inner) {
		return new ParenthesizedTerm(SourceLocation.unknown(), inner);
	}
}
