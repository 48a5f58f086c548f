package euclid.lexer;

import static org.junit.Assert.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import org.junit.Test;

import euclid.util.SourceLocation;

public class ProofLexerPositionTest {

	@Test
	public void tokensKnowTheirLineAndColumn() {
		List<ProofToken> tokens = new ProofLexer("PROVE: x = 1.\n  Let y = x.").readTokens();

		assertEquals(11, tokens.size());
		SourceLocation prove = tokens.get(0).getLocation();
		assertEquals(1, prove.getStartLine());
		assertEquals(1, prove.getStartColumn());
		assertEquals(6, prove.getEndColumn());

		SourceLocation x = tokens.get(2).getLocation();
		assertEquals(1, x.getStartLine());
		assertEquals(8, x.getStartColumn());

		SourceLocation let = tokens.get(6).getLocation();
		assertEquals(2, let.getStartLine());
		assertEquals(3, let.getStartColumn());
		assertEquals(16, let.getStartOffset());
	}

	@Test
	public void numberValues() {
		List<ProofToken> tokens = new ProofLexer("0 1 697 24.837").readTokens();

		assertEquals(BigInteger.ZERO, tokens.get(0).getValue());
		assertEquals(BigInteger.ONE, tokens.get(1).getValue());
		assertEquals(BigInteger.valueOf(697), tokens.get(2).getValue());
		assertEquals(new BigDecimal("24.837"), tokens.get(3).getValue());
	}

	@Test
	public void spellingsShareKinds() {
		assertEquals(
				new ProofLexer("be").next().getType(),
				new ProofLexer("is").next().getType());
		assertEquals(
				new ProofLexer("a").next().getType(),
				new ProofLexer("an").next().getType());
	}

	@Test
	public void equalityIgnoresPosition() {
		ProofToken first = new ProofLexer("x").next();
		ProofToken second = new ProofLexer("\n\n   x").next();

		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertNotEquals(first.getLocation(), second.getLocation());
	}

	@Test
	public void decimalPointNeedsDigitsAfterIt() {
		List<ProofToken> tokens = new ProofLexer("5.").readTokens();

		assertEquals(2, tokens.size());
		assertEquals(ProofTokenType.NUMBER, tokens.get(0).getType());
		assertEquals(BigInteger.valueOf(5), tokens.get(0).getValue());
		assertEquals(ProofTokenType.DOT, tokens.get(1).getType());
	}

	@Test
	public void unexpectedCharacter() {
		try {
			new ProofLexer("PROVE: x = 1.\n  y $ 2").readTokens();
			fail("expected a lexer error");
		} catch (ProofLexerException e) {
			assertEquals("$", e.getOffendingText());
			assertEquals(2, e.getLocation().getStartLine());
			assertEquals(5, e.getLocation().getStartColumn());
			assertTrue(e.getMessage().contains("'$' unexpected"));
		}
	}

	@Test
	public void scansLazily() {
		ProofLexer lexer = new ProofLexer("x + y");

		assertTrue(lexer.hasNext());
		assertEquals(ProofTokenType.SYMBOL, lexer.next().getType());
		try {
			lexer.next();
			fail("expected a lexer error");
		} catch (ProofLexerException e) {
			assertEquals("+", e.getOffendingText());
			assertEquals(3, e.getLocation().getStartColumn());
		}
	}
}
