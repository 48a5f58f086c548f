package euclid;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.Test;

public class EuclidOptionsTest {

	private static EuclidOptions parse(String... args) throws EuclidOptionException {
		EuclidOptions opts = new EuclidOptions();
		opts.parse(args);
		return opts;
	}

	@Test
	public void defaults() throws EuclidOptionException {
		EuclidOptions opts = parse();
		assertFalse(opts.json);
		assertFalse(opts.context);
		assertEquals(Collections.singletonList(EuclidOptions.STDIN), opts.getInputPaths());
	}

	@Test
	public void flagsAndFiles() throws EuclidOptionException {
		EuclidOptions opts = parse("-j", "a.prf", "--context", "b.prf");
		assertTrue(opts.json);
		assertTrue(opts.context);
		assertEquals(Arrays.asList("a.prf", "b.prf"), opts.getInputPaths());
	}

	@Test
	public void dashKeepsItsPlace() throws EuclidOptionException {
		assertEquals(Arrays.asList("a.prf", "-", "b.prf"), parse("a.prf", "-", "b.prf").getInputPaths());
		assertEquals(Arrays.asList("-", "a.prf"), parse("-", "-q", "a.prf").getInputPaths());
	}

	@Test(expected = EuclidOptionException.class)
	public void quietAndVerboseConflict() throws EuclidOptionException {
		parse("-q", "-v");
	}

	@Test
	public void logLevels() throws EuclidOptionException {
		Logger logger = Logger.getLogger("euclid.test.options");

		parse("-q").configureLogging(logger);
		assertEquals(Level.WARNING, logger.getLevel());

		parse().configureLogging(logger);
		assertEquals(Level.INFO, logger.getLevel());

		parse("-v").configureLogging(logger);
		assertEquals(Level.FINE, logger.getLevel());
		assertEquals(1, logger.getHandlers().length);

		parse("-v").configureLogging(logger);
		assertEquals(1, logger.getHandlers().length);
	}
}
