package euclid.formatters;

import java.io.IOException;
import java.io.Writer;

import euclid.model.*;

/**
 * Writes any AST node back out as proof source. Reading the output again gives
 * an AST equal to the one written.
 */
public class ProofNodeFormattingVisitor extends ProofNodeVisitor<Void, IOException> {
	private final Writer out;

	public ProofNodeFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(Proof proof) throws IOException {
		out.write("PROVE: ");
		proof.getStatement().accept(new FormulaFormattingVisitor(out));
		out.write(".");
		for (Clause clause : proof.getClauses()) {
			out.write(System.lineSeparator());
			clause.accept(new ClauseFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(Clause clause) throws IOException {
		clause.accept(new ClauseFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(WhereClause whereClause) throws IOException {
		out.write("WHERE ");
		out.write(whereClause.getSymbol().getName());
		out.write(" IS A ");
		whereClause.getCategory().accept(this);
		return null;
	}

	@Override
	public Void visit(Formula formula) throws IOException {
		formula.accept(new FormulaFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(Term term) throws IOException {
		term.accept(new TermFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(CompoundSymbol compoundSymbol) throws IOException {
		out.write(String.join(" ", compoundSymbol.getComponents()));
		return null;
	}
}
