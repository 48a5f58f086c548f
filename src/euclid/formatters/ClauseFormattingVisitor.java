package euclid.formatters;

import java.io.IOException;
import java.io.Writer;

import euclid.model.ClauseVisitor;
import euclid.model.FormulaClause;
import euclid.model.LetClause;
import euclid.model.ThereforeClause;

public class ClauseFormattingVisitor extends ClauseVisitor<Void, IOException> {
	private final Writer out;

	public ClauseFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(LetClause letClause) throws IOException {
		out.write("LET ");
		out.write(letClause.getSymbol().getName());
		if (letClause.bindsCategory()) {
			out.write(" BE A ");
			letClause.getCategory().accept(new ProofNodeFormattingVisitor(out));
		} else {
			out.write(" = ");
			letClause.getTerm().accept(new TermFormattingVisitor(out));
		}
		out.write(".");
		return null;
	}

	@Override
	public Void visit(FormulaClause formulaClause) throws IOException {
		if (formulaClause.getJustification().isPresent()) {
			out.write("BY ");
			out.write(formulaClause.getJustification().get().name());
			out.write(" ");
		}
		formulaClause.getFormula().accept(new FormulaFormattingVisitor(out));
		if (formulaClause.getWhere().isPresent()) {
			out.write(" ");
			formulaClause.getWhere().get().accept(new ProofNodeFormattingVisitor(out));
		}
		out.write(".");
		return null;
	}

	@Override
	public Void visit(ThereforeClause thereforeClause) throws IOException {
		out.write("THEREFORE ");
		thereforeClause.getFormula().accept(new FormulaFormattingVisitor(out));
		out.write(".");
		return null;
	}
}
