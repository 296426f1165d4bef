package net.swapcurve.marketdata.calibration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class MarketQuoteTest {

	@Test
	public void testGeneratedSymbols() {
		assertEquals("6M", MarketQuote.fixing(0.5, 0.0411).getSymbol());
		assertEquals("1Y", MarketQuote.parSwap(1, 0.0414).getSymbol());
		assertEquals("10Y", MarketQuote.parSwap(10, 0.0308).getSymbol());
		assertEquals("18M", MarketQuote.parSwap(1.5, 0.04).getSymbol());
		assertEquals("3M", MarketQuote.fixing(0.25, 0.04).getSymbol());
	}

	@Test
	public void testGivenSymbolIsKept() {
		MarketQuote quote = new MarketQuote("EUR6M", 0.5, 0.0411, true);

		assertEquals("EUR6M", quote.getSymbol());
		assertTrue(quote.isFixing());
		assertEquals(6, quote.getTenorMonths());
	}

	@Test
	public void testTenorMonths() {
		assertEquals(12, MarketQuote.parSwap(1, 0.0414).getTenorMonths());
		assertEquals(84, MarketQuote.parSwap(7, 0.0311).getTenorMonths());
		assertEquals(18, MarketQuote.parSwap(1.5, 0.04).getTenorMonths());
	}

	@Test
	public void testCloneShifted() {
		MarketQuote quote = MarketQuote.parSwap(5, 0.0321);
		MarketQuote shifted = quote.getCloneShifted(0.0001);

		assertEquals(0.0322, shifted.getRate(), 1E-15);
		assertEquals(quote.getSymbol(), shifted.getSymbol());
		assertEquals(quote.getTenorYears(), shifted.getTenorYears(), 0.0);
		assertFalse(shifted.isFixing());
		assertEquals(0.0321, quote.getRate(), 0.0);
	}

	@Test
	public void testEquals() {
		assertEquals(MarketQuote.parSwap(2, 0.0373), MarketQuote.parSwap(2, 0.0373));
		assertEquals(MarketQuote.parSwap(2, 0.0373).hashCode(), MarketQuote.parSwap(2, 0.0373).hashCode());
		assertFalse(MarketQuote.parSwap(2, 0.0373).equals(MarketQuote.fixing(2, 0.0373)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveTenorIsRejected() {
		MarketQuote.parSwap(0.0, 0.03);
	}

	@Test
	public void testMonthlyTenor() {
		MarketQuote quote = MarketQuote.fixing(1.0 / 12.0, 0.039);

		assertEquals(1, quote.getTenorMonths());
		assertEquals("1M", quote.getSymbol());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTenorOfFractionalMonthsIsRejected() {
		MarketQuote.parSwap(1.04, 0.0414);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonFiniteRateIsRejected() {
		MarketQuote.parSwap(1.0, Double.NaN);
	}
}
