package euclid.formatters;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;

import euclid.model.*;

public class TermFormattingVisitor extends TermVisitor<Void, IOException> {
	private final Writer out;

	public TermFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(SymbolTerm symbolTerm) throws IOException {
		out.write(symbolTerm.getName());
		return null;
	}

	@Override
	public Void visit(NumberTerm numberTerm) throws IOException {
		Number value = numberTerm.getValue();
		if (value instanceof BigDecimal) {
			out.write(((BigDecimal) value).toPlainString());
		} else {
			out.write(value.toString());
		}
		return null;
	}

	@Override
	public Void visit(ProductTerm productTerm) throws IOException {
		productTerm.getCoefficient().accept(this);
		Term factor = productTerm.getFactor();
		// "2 k" only works for a bare symbol, anything else needs the "2(...)" form
		if (factor instanceof SymbolTerm) {
			out.write(" ");
			factor.accept(this);
		} else {
			out.write("(");
			factor.accept(this);
			out.write(")");
		}
		return null;
	}

	@Override
	public Void visit(ParenthesizedTerm parenthesizedTerm) throws IOException {
		out.write("(");
		parenthesizedTerm.getInner().accept(this);
		out.write(")");
		return null;
	}
}
