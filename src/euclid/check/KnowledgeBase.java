package euclid.check;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import euclid.model.CompoundSymbol;
import euclid.model.NumberTerm;
import euclid.model.ProductTerm;
import euclid.model.Term;
import euclid.util.UnionFind;

/**
 * Everything established so far while walking one proof: which categories
 * terms belong to, and which terms are equal. Facts are only ever added.
 *
 * Terms are compared without their parentheses. Recorded equalities are kept
 * closed under congruence: whenever two factors end up in the same class, every
 * pair of known products with equal coefficients over them is merged too, so
 * equivalence stays transitive through any mix of names and products. Nothing is
 * evaluated: "2 (3)" and "6" are different terms.
 */
public class KnowledgeBase {

	private final Map<Term, Set<CompoundSymbol>> categories;
	private final UnionFind<Term> equivalences;
	// every product seen in a recorded equality, factors of products included
	private final List<ProductTerm> products;

	public KnowledgeBase() {
		this.categories = new LinkedHashMap<>();
		this.equivalences = new UnionFind<>();
		this.products = new ArrayList<>();
	}

	public void recordCategory(Term term, CompoundSymbol category) {
		categories.computeIfAbsent(TermNormalizingVisitor.normalize(term), k -> new LinkedHashSet<>()).add(category);
	}

	public void recordEquivalence(Term left, Term right) {
		Term normalizedLeft = register(TermNormalizingVisitor.normalize(left));
		Term normalizedRight = register(TermNormalizingVisitor.normalize(right));
		equivalences.union(normalizedLeft, normalizedRight);
		closeUnderCongruence();
	}

	private Term register(Term term) {
		equivalences.find(term);
		if (term instanceof ProductTerm && !products.contains(term)) {
			ProductTerm product = (ProductTerm) term;
			register(product.getFactor());
			products.add(product);
		}
		return term;
	}

	private void closeUnderCongruence() {
		boolean changed = true;
		while (changed) {
			changed = false;
			for (int i = 0; i < products.size(); i++) {
				for (int j = i + 1; j < products.size(); j++) {
					ProductTerm a = products.get(i);
					ProductTerm b = products.get(j);
					if (a.getCoefficient().equals(b.getCoefficient()) &&
							equivalences.sameSet(a.getFactor(), b.getFactor()) &&
							!equivalences.sameSet(a, b)) {
						equivalences.union(a, b);
						changed = true;
					}
				}
			}
		}
	}

	/**
	 * @return whether exactly this category was recorded for term or for something equivalent to it
	 */
	public boolean hasCategory(Term term, CompoundSymbol category) {
		for (Map.Entry<Term, Set<CompoundSymbol>> entry : categories.entrySet()) {
			if (entry.getValue().contains(category) && areEquivalent(term, entry.getKey())) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return whether the two terms are the same once parentheses are dropped
	 */
	public boolean areIdentical(Term left, Term right) {
		return TermNormalizingVisitor.normalize(left).equals(TermNormalizingVisitor.normalize(right));
	}

	public boolean areEquivalent(Term left, Term right) {
		return equivalent(TermNormalizingVisitor.normalize(left), TermNormalizingVisitor.normalize(right));
	}

	private boolean equivalent(Term left, Term right) {
		if (left.equals(right)) {
			return true;
		}
		Optional<Term> leftClass = classOf(left);
		Optional<Term> rightClass = classOf(right);
		if (leftClass.isPresent() || rightClass.isPresent()) {
			return leftClass.equals(rightClass);
		}
		// neither side was ever recorded; only two congruent products can still match
		if (left instanceof ProductTerm && right instanceof ProductTerm) {
			ProductTerm leftProduct = (ProductTerm) left;
			ProductTerm rightProduct = (ProductTerm) right;
			return leftProduct.getCoefficient().equals(rightProduct.getCoefficient()) &&
					equivalent(leftProduct.getFactor(), rightProduct.getFactor());
		}
		return false;
	}

	/**
	 * @return the representative of the class a normalized term belongs to, also for
	 * a product that was never recorded but is congruent to one that was
	 */
	private Optional<Term> classOf(Term term) {
		if (equivalences.contains(term)) {
			return Optional.of(equivalences.find(term));
		}
		if (term instanceof ProductTerm) {
			ProductTerm product = (ProductTerm) term;
			for (ProductTerm known : products) {
				if (known.getCoefficient().equals(product.getCoefficient()) &&
						equivalent(known.getFactor(), product.getFactor())) {
					return Optional.of(equivalences.find(known));
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * A literal resolves to itself. Any other term resolves to the literal recorded
	 * equal to it, provided its class holds exactly one value: a class where, say,
	 * 3 and 4 were both recorded resolves to nothing.
	 *
	 * @return the numeric literal the term stands for
	 */
	public Optional<NumberTerm> resolveLiteral(Term term) {
		Term normalized = TermNormalizingVisitor.normalize(term);
		if (normalized instanceof NumberTerm) {
			return Optional.of((NumberTerm) normalized);
		}
		Optional<Term> representative = classOf(normalized);
		if (!representative.isPresent()) {
			return Optional.empty();
		}
		Set<NumberTerm> literals = new LinkedHashSet<>();
		for (Term member : equivalences.members(representative.get())) {
			if (member instanceof NumberTerm) {
				literals.add((NumberTerm) member);
			}
		}
		if (literals.size() != 1) {
			return Optional.empty();
		}
		return Optional.of(literals.iterator().next());
	}
}
