package euclid.check;

import euclid.model.*;

/**
 * Removes parentheses from a term, at any depth. Parentheses only group, so the
 * knowledge base works on terms without them.
 */
public class TermNormalizingVisitor extends TermVisitor<Term, RuntimeException> {

	public static Term normalize(Term term) {
		return term.accept(new TermNormalizingVisitor());
	}

	@Override
	public Term visit(SymbolTerm symbolTerm) {
		return symbolTerm;
	}

	@Override
	public Term visit(NumberTerm numberTerm) {
		return numberTerm;
	}

	@Override
	public Term visit(ProductTerm productTerm) {
		Term factor = productTerm.getFactor().accept(this);
		if (factor == productTerm.getFactor()) {
			return productTerm;
		}
		return new ProductTerm(productTerm.getLocation(), productTerm.getCoefficient(), factor);
	}

	@Override
	public Term visit(ParenthesizedTerm parenthesizedTerm) {
		return parenthesizedTerm.getInner().accept(this);
	}
}
