package net.swapcurve.marketdata.calibration;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.junit.Test;

import net.swapcurve.marketdata.model.curves.Curve;
import net.swapcurve.marketdata.products.Swap;
import net.swapcurve.marketdata.products.SwapPricer;
import net.swapcurve.time.Schedule;

public class BootstrappedCurvesTest {

	private static final LocalDate referenceDate = LocalDate.of(2024, 1, 15);
	private static final double discountSpreadBasisPoints = -38.0;

	static List<MarketQuote> getQuotes() {
		return Arrays.asList(
				MarketQuote.fixing(0.5, 0.0411),
				MarketQuote.parSwap(1, 0.0414),
				MarketQuote.parSwap(2, 0.0373),
				MarketQuote.parSwap(3, 0.0348),
				MarketQuote.parSwap(5, 0.0321),
				MarketQuote.parSwap(7, 0.0311),
				MarketQuote.parSwap(10, 0.0308));
	}

	@Test
	public void testBootstrapConverges() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);

		for(MarketQuote quote : getQuotes()) {
			assertTrue("Residual of " + quote.getSymbol(), curves.getCalibrationResidual(quote.getSymbol()) < 1E-8);
		}
		assertTrue(curves.getLastAccuracy() < 1E-8);
		assertEquals(0.0, curves.getCalibrationResidual("6M"), 0.0);
		assertTrue(curves.getLastNumberOfIterations() >= 6);
	}

	@Test
	public void testQuotesAreRepriced() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);
		SwapPricer pricer = new SwapPricer();

		for(MarketQuote quote : curves.getQuotes()) {
			if(quote.isFixing()) continue;

			Swap swap = new Swap(referenceDate, referenceDate.plusMonths(quote.getTenorMonths()), 1000000, quote.getRate());
			double value = pricer.getValue(swap, curves.getForwardCurve(), curves.getDiscountCurve(), referenceDate);
			assertEquals("Value of " + quote.getSymbol() + " swap", 0.0, value, 1E-3);

			double parRate = pricer.getParRate(swap, curves.getForwardCurve(), curves.getDiscountCurve(), referenceDate);
			assertEquals("Par rate of " + quote.getSymbol() + " swap", quote.getRate(), parRate, 1E-9);
		}
	}

	@Test
	public void testCurvePoints() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);
		Curve forwardCurve = curves.getForwardCurve();
		Curve discountCurve = curves.getDiscountCurve();

		assertEquals(7, forwardCurve.getNumberOfPoints());
		assertArrayEquals(forwardCurve.getTimes(), discountCurve.getTimes(), 0.0);

		// The point of each quote sits at the maturity of its swap
		double[] times = forwardCurve.getTimes();
		for(int i=0; i<times.length; i++) {
			MarketQuote quote = curves.getQuotes().get(i);
			assertEquals(Schedule.getTimeFromReferenceDate(referenceDate, referenceDate.plusMonths(quote.getTenorMonths())), times[i], 0.0);
		}

		// The fixing is used directly
		assertEquals(0.0411, forwardCurve.getZeroRates()[0], 0.0);

		double[] forwardRates = forwardCurve.getZeroRates();
		double[] discountRates = discountCurve.getZeroRates();
		for(int i=0; i<forwardRates.length; i++) {
			assertEquals(forwardRates[i] - 0.0038, discountRates[i], 1E-15);
			assertEquals(curves.getQuotes().get(i).getRate(), forwardRates[i], 0.01);
		}

		assertEquals(referenceDate, forwardCurve.getReferenceDate());
		assertEquals(referenceDate, discountCurve.getReferenceDate());
	}

	@Test
	public void testOrderOfQuotesDoesNotMatter() {
		List<MarketQuote> quotes = new ArrayList<MarketQuote>(getQuotes());
		Collections.reverse(quotes);

		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);
		BootstrappedCurves curvesFromReversed = new BootstrappedCurves(referenceDate, quotes, discountSpreadBasisPoints);

		assertArrayEquals(curves.getForwardCurve().getZeroRates(), curvesFromReversed.getForwardCurve().getZeroRates(), 0.0);
		assertEquals("6M", curvesFromReversed.getQuotes().get(0).getSymbol());
	}

	@Test
	public void testBootstrapFromArray() {
		BootstrappedCurves curves = BootstrappedCurves.bootstrap(referenceDate, getQuotes().toArray(new MarketQuote[0]), discountSpreadBasisPoints);

		assertArrayEquals(new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints).getForwardCurve().getZeroRates(), curves.getForwardCurve().getZeroRates(), 0.0);
		assertEquals(discountSpreadBasisPoints, curves.getDiscountSpreadBasisPoints(), 0.0);
		assertEquals(referenceDate, curves.getReferenceDate());
	}

	@Test
	public void testCloneShiftedLeavesFixingUnchanged() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);
		BootstrappedCurves curvesShifted = curves.getCloneShifted(0.0001);

		double[] rates = curves.getForwardCurve().getZeroRates();
		double[] ratesShifted = curvesShifted.getForwardCurve().getZeroRates();

		assertEquals(rates[0], ratesShifted[0], 0.0);
		for(int i=1; i<rates.length; i++) {
			assertTrue(ratesShifted[i] > rates[i]);
		}
		assertEquals(curves.getQuote("5Y").getRate() + 0.0001, curvesShifted.getQuote("5Y").getRate(), 1E-15);
	}

	@Test
	public void testCloneShiftedForSymbol() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);
		BootstrappedCurves curvesShifted = curves.getCloneShifted("5Y", 0.0001);

		double[] rates = curves.getForwardCurve().getZeroRates();
		double[] ratesShifted = curvesShifted.getForwardCurve().getZeroRates();

		// Shorter tenors do not depend on the 5Y quote
		for(int i=0; i<4; i++) assertEquals(rates[i], ratesShifted[i], 0.0);
		assertTrue(ratesShifted[4] > rates[4]);

		Map<String, Double> shifts = new HashMap<String, Double>();
		shifts.put("5Y", 0.0001);
		assertArrayEquals(ratesShifted, curves.getCloneShifted(shifts).getForwardCurve().getZeroRates(), 0.0);
	}

	@Test
	public void testCloneShiftedForPattern() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);

		assertArrayEquals(
				curves.getCloneShifted(0.0001).getForwardCurve().getZeroRates(),
				curves.getCloneShifted(Pattern.compile(".*Y"), 0.0001).getForwardCurve().getZeroRates(),
				0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCloneShiftedForUnknownSymbolIsRejected() {
		new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints).getCloneShifted("4Y", 0.0001);
	}

	@Test
	public void testNonConvergenceIsReported() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints, 1E-10, 1, 1E-4);

		assertTrue(curves.getLastAccuracy() > 1E-10);
		assertEquals(6, curves.getLastNumberOfIterations());
		assertEquals(7, curves.getForwardCurve().getNumberOfPoints());
	}

	@Test
	public void testVanishingDerivativeStopsTheSolve() {
		// A bump below the resolution of the rate gives a zero difference quotient
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints, 1E-10, 100, 1E-300);

		assertEquals(6, curves.getLastNumberOfIterations());
		assertTrue(curves.getLastAccuracy() > 1E-10);
		assertArrayEquals(new double[] { 0.0411, 0.0414, 0.0373, 0.0348, 0.0321, 0.0311, 0.0308 }, curves.getForwardCurve().getZeroRates(), 0.0);
	}

	@Test
	public void testUnknownSymbol() {
		BootstrappedCurves curves = new BootstrappedCurves(referenceDate, getQuotes(), discountSpreadBasisPoints);
		assertNull(curves.getQuote("4Y"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingFixingIsRejected() {
		new BootstrappedCurves(referenceDate, Arrays.asList(MarketQuote.parSwap(1, 0.0414), MarketQuote.parSwap(2, 0.0373)), discountSpreadBasisPoints);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTwoFixingsAreRejected() {
		new BootstrappedCurves(referenceDate, Arrays.asList(MarketQuote.fixing(0.25, 0.04), MarketQuote.fixing(0.5, 0.0411), MarketQuote.parSwap(1, 0.0414)), discountSpreadBasisPoints);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFixingOnlyIsRejected() {
		new BootstrappedCurves(referenceDate, Arrays.asList(MarketQuote.fixing(0.5, 0.0411)), discountSpreadBasisPoints);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFixingNotShortestIsRejected() {
		new BootstrappedCurves(referenceDate, Arrays.asList(MarketQuote.parSwap(1, 0.0414), MarketQuote.fixing(2, 0.0411)), discountSpreadBasisPoints);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateTenorIsRejected() {
		new BootstrappedCurves(referenceDate, Arrays.asList(MarketQuote.fixing(0.5, 0.0411), new MarketQuote("A", 1, 0.0414, false), new MarketQuote("B", 1, 0.0415, false)), discountSpreadBasisPoints);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateSymbolIsRejected() {
		new BootstrappedCurves(referenceDate, Arrays.asList(MarketQuote.fixing(0.5, 0.0411), new MarketQuote("S", 1, 0.0414, false), new MarketQuote("S", 2, 0.0373, false)), discountSpreadBasisPoints);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyQuotesAreRejected() {
		new BootstrappedCurves(referenceDate, new ArrayList<MarketQuote>(), discountSpreadBasisPoints);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingReferenceDateIsRejected() {
		new BootstrappedCurves(null, getQuotes(), discountSpreadBasisPoints);
	}
}
