package euclid.check;

import static org.junit.Assert.*;

import java.util.Optional;

import org.junit.Test;

import static euclid.model.ProofBuilder.*;

public class BuiltinPredicateTest {

	@Test
	public void lookupIgnoresCase() {
		assertEquals(Optional.of(BuiltinPredicate.EVEN), BuiltinPredicate.lookup(category("even")));
		assertEquals(Optional.of(BuiltinPredicate.EVEN), BuiltinPredicate.lookup(category("EVEN")));
		assertEquals(Optional.of(BuiltinPredicate.ODD), BuiltinPredicate.lookup(category("Odd")));
	}

	@Test
	public void lookupNeedsASingleKnownWord() {
		assertFalse(BuiltinPredicate.lookup(category("even", "integer")).isPresent());
		assertFalse(BuiltinPredicate.lookup(category("prime")).isPresent());
	}

	@Test
	public void parity() {
		assertTrue(BuiltinPredicate.EVEN.test(num(0)));
		assertTrue(BuiltinPredicate.EVEN.test(num(4)));
		assertFalse(BuiltinPredicate.EVEN.test(num(3)));
		assertTrue(BuiltinPredicate.ODD.test(num(3)));
		assertFalse(BuiltinPredicate.ODD.test(num(40)));
		assertTrue(BuiltinPredicate.ODD.test(num("123456789012345678901234567890123")));
	}

	@Test
	public void decimals() {
		assertTrue(BuiltinPredicate.EVEN.test(num("4.0")));
		assertTrue(BuiltinPredicate.ODD.test(num("7.000")));
		assertFalse(BuiltinPredicate.EVEN.test(num("2.5")));
		assertFalse(BuiltinPredicate.ODD.test(num("2.5")));
	}
}
