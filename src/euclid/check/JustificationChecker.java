package euclid.check;

import java.util.Optional;

import euclid.model.Formula;
import euclid.model.Justification;

/**
 * Decides whether a formula is established by what is already known, under the
 * rule a clause cites:
 *
 * <ul>
 *     <li>BY DEFINITION proves "t IS A c" when c was recorded for t or for
 *     something equivalent to t, or when c is a {@link BuiltinPredicate} that the
 *     literal value of t satisfies.</li>
 *     <li>BY SUBSTITUTION proves "l = r" when l and r are equivalent and not
 *     merely identical, that is when some recorded equality is actually used.</li>
 *     <li>Without a justification, "l = r" needs l and r to be equivalent and
 *     "t IS A c" needs c to have been recorded.</li>
 * </ul>
 *
 * Anything else, including every conditional, does not follow.
 */
public class JustificationChecker {
	private JustificationChecker() {}

	public static boolean follows(KnowledgeBase knowledge, Formula formula, Optional<Justification> justification) {
		return formula.accept(new FormulaJustificationVisitor(knowledge, justification.orElse(null)));
	}

	public static boolean follows(KnowledgeBase knowledge, Formula formula, Justification justification) {
		return follows(knowledge, formula, Optional.ofNullable(justification));
	}
}
