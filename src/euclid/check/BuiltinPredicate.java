package euclid.check;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

import euclid.model.CompoundSymbol;
import euclid.model.NumberTerm;

/**
 * Categories whose membership is decided by looking at a number instead of at
 * recorded facts. The table is fixed; a category is built in when it is a
 * single word matching one of the names below, ignoring case.
 */
public enum BuiltinPredicate {
	EVEN("even") {
		@Override
		boolean test(BigInteger value) {
			return !value.testBit(0);
		}
	},
	ODD("odd") {
		@Override
		boolean test(BigInteger value) {
			return value.testBit(0);
		}
	};

	private final String name;

	BuiltinPredicate(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	abstract boolean test(BigInteger value);

	/**
	 * @return whether the literal satisfies this predicate; literals with a
	 * fractional part satisfy none
	 */
	public boolean test(NumberTerm literal) {
		if (!literal.isIntegral()) {
			return false;
		}
		return test(literal.getIntegerValue());
	}

	public static Optional<BuiltinPredicate> lookup(CompoundSymbol category) {
		if (!category.isSingleWord()) {
			return Optional.empty();
		}
		String word = category.getComponents().get(0).toLowerCase(Locale.ROOT);
		for (BuiltinPredicate predicate : values()) {
			if (predicate.name.equals(word)) {
				return Optional.of(predicate);
			}
		}
		return Optional.empty();
	}
}
