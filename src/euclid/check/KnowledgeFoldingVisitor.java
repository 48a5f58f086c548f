package euclid.check;

import java.util.logging.Logger;

import euclid.model.Conditional;
import euclid.model.Equality;
import euclid.model.FormulaVisitor;
import euclid.model.IsA;

/**
 * Adds what an accepted formula asserts to the knowledge base. Conditionals
 * assert nothing that later clauses can use.
 */
public class KnowledgeFoldingVisitor extends FormulaVisitor<Void, RuntimeException> {
	private static final Logger logger = Logger.getLogger(KnowledgeFoldingVisitor.class.getName());

	private final KnowledgeBase knowledge;

	public KnowledgeFoldingVisitor(KnowledgeBase knowledge) {
		this.knowledge = knowledge;
	}

	@Override
	public Void visit(Equality equality) {
		logger.finer(() -> "recording " + equality);
		knowledge.recordEquivalence(equality.getLeft(), equality.getRight());
		return null;
	}

	@Override
	public Void visit(IsA isA) {
		logger.finer(() -> "recording " + isA);
		knowledge.recordCategory(isA.getTerm(), isA.getCategory());
		return null;
	}

	@Override
	public Void visit(Conditional conditional) {
		return null;
	}
}
