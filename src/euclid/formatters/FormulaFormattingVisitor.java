package euclid.formatters;

import java.io.IOException;
import java.io.Writer;

import euclid.model.Conditional;
import euclid.model.Equality;
import euclid.model.FormulaVisitor;
import euclid.model.IsA;

public class FormulaFormattingVisitor extends FormulaVisitor<Void, IOException> {
	private final Writer out;

	public FormulaFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(Equality equality) throws IOException {
		equality.getLeft().accept(new TermFormattingVisitor(out));
		out.write(" = ");
		equality.getRight().accept(new TermFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(IsA isA) throws IOException {
		isA.getTerm().accept(new TermFormattingVisitor(out));
		out.write(" IS A ");
		isA.getCategory().accept(new ProofNodeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(Conditional conditional) throws IOException {
		out.write("IF ");
		conditional.getHypothesis().accept(this);
		out.write(" THEN ");
		conditional.getConsequent().accept(this);
		return null;
	}
}
