package net.swapcurve.marketdata.risk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Test;

import net.swapcurve.marketdata.calibration.BootstrappedCurves;
import net.swapcurve.marketdata.calibration.MarketQuote;
import net.swapcurve.marketdata.model.curves.Curve;
import net.swapcurve.marketdata.model.curves.CurveInterface;
import net.swapcurve.marketdata.products.Swap;
import net.swapcurve.marketdata.products.SwapPricer;

public class RiskCalculatorTest {

	private static final LocalDate referenceDate = LocalDate.of(2024, 1, 15);
	private static final double discountSpreadBasisPoints = -38.0;

	private static final List<MarketQuote> quotes = Arrays.asList(
			MarketQuote.fixing(0.5, 0.0411),
			MarketQuote.parSwap(1, 0.0414),
			MarketQuote.parSwap(2, 0.0373),
			MarketQuote.parSwap(3, 0.0348),
			MarketQuote.parSwap(5, 0.0321),
			MarketQuote.parSwap(7, 0.0311),
			MarketQuote.parSwap(10, 0.0308));

	private static BootstrappedCurves curves;
	private static Swap parSwap;

	@BeforeClass
	public static void setUp() {
		curves = new BootstrappedCurves(referenceDate, quotes, discountSpreadBasisPoints);

		Swap swap = new Swap(referenceDate, referenceDate.plusYears(9), 1000000);
		double parRate = new SwapPricer().getParRate(swap, curves.getForwardCurve(), curves.getDiscountCurve(), referenceDate);
		parSwap = swap.getCloneWithFixedRate(parRate);
	}

	@Test
	public void testDV01AndGammaOfReceiverSwap() {
		RiskCalculator riskCalculator = new RiskCalculator(new SwapPricer(), discountSpreadBasisPoints);
		RiskMetrics riskMetrics = riskCalculator.getRiskMetrics(parSwap, quotes, referenceDate);

		// Receiving fixed loses when rates rise, roughly notional * annuity * 1bp
		assertTrue("DV01 " + riskMetrics.getDV01(), riskMetrics.getDV01() < -400 && riskMetrics.getDV01() > -1200);
		assertTrue("Gamma " + riskMetrics.getGamma(), riskMetrics.getGamma() > 0);
		assertTrue("Gamma " + riskMetrics.getGamma(), riskMetrics.getGamma() < 0.01 * Math.abs(riskMetrics.getDV01()));
	}

	@Test
	public void testRiskMetricsFromCurvesAndFromQuotesAgree() {
		RiskCalculator riskCalculator = new RiskCalculator(new SwapPricer(), discountSpreadBasisPoints);

		RiskMetrics fromQuotes = riskCalculator.getRiskMetrics(parSwap, quotes, referenceDate);
		RiskMetrics fromCurves = riskCalculator.getRiskMetrics(parSwap, curves, referenceDate);

		assertEquals(fromQuotes.getDV01(), fromCurves.getDV01(), 1E-9);
		assertEquals(fromQuotes.getGamma(), fromCurves.getGamma(), 1E-9);
		assertEquals(fromCurves.getDV01(), riskCalculator.getDV01(parSwap, curves, referenceDate), 1E-9);
		assertEquals(fromCurves.getGamma(), riskCalculator.getGamma(parSwap, curves, referenceDate), 1E-9);
	}

	@Test
	public void testBucketedDV01() {
		RiskCalculator riskCalculator = new RiskCalculator(new SwapPricer(), discountSpreadBasisPoints);
		Map<String, Double> bucketedDV01 = riskCalculator.getBucketedDV01(parSwap, curves, referenceDate);

		assertEquals(Arrays.asList("1Y", "2Y", "3Y", "5Y", "7Y", "10Y"), Arrays.asList(bucketedDV01.keySet().toArray(new String[0])));
		assertTrue(bucketedDV01.get("10Y") < 0);

		double sum = 0.0;
		for(double dv01 : bucketedDV01.values()) sum += dv01;

		double dv01 = riskCalculator.getDV01(parSwap, curves, referenceDate);
		assertEquals(dv01, sum, 2.0);
	}

	@Test
	public void testCurveShiftDV01() {
		RiskCalculator riskCalculator = new RiskCalculator(new SwapPricer(), discountSpreadBasisPoints);

		double curveShiftDV01 = riskCalculator.getCurveShiftDV01(parSwap, curves.getForwardCurve(), curves.getDiscountCurve(), referenceDate);
		double dv01 = riskCalculator.getDV01(parSwap, curves, referenceDate);

		assertTrue(curveShiftDV01 < 0);
		assertEquals(dv01, curveShiftDV01, 0.3 * Math.abs(dv01));
	}

	@Test
	public void testCurveShiftDV01OnCurvesForLaterReferenceDate() {
		SwapPricer pricer = new SwapPricer();
		RiskCalculator riskCalculator = new RiskCalculator(pricer, discountSpreadBasisPoints);
		LocalDate valuationDate = referenceDate.plusMonths(3);
		Curve forwardCurve = curves.getForwardCurve();
		Curve discountCurve = curves.getDiscountCurve();

		double curveShiftDV01 = riskCalculator.getCurveShiftDV01(parSwap, forwardCurve.getCloneForReferenceDate(valuationDate), discountCurve.getCloneForReferenceDate(valuationDate), valuationDate);

		// Shifting before moving the curves gives the same scenarios
		double valueUp = pricer.getValue(parSwap,
				forwardCurve.getCloneShiftedParallel(1.0).getCloneForReferenceDate(valuationDate),
				discountCurve.getCloneShiftedParallel(1.0).getCloneForReferenceDate(valuationDate), valuationDate);
		double valueDown = pricer.getValue(parSwap,
				forwardCurve.getCloneShiftedParallel(-1.0).getCloneForReferenceDate(valuationDate),
				discountCurve.getCloneShiftedParallel(-1.0).getCloneForReferenceDate(valuationDate), valuationDate);

		assertTrue(curveShiftDV01 < 0);
		assertEquals((valueUp - valueDown) / 2.0, curveShiftDV01, 1E-6);
	}

	@Test
	public void testEachScenarioIsValuedOnce() {
		SwapPricer pricer = spy(new SwapPricer());
		RiskCalculator riskCalculator = new RiskCalculator(pricer, discountSpreadBasisPoints);

		riskCalculator.getRiskMetrics(parSwap, curves, referenceDate);

		verify(pricer, times(3)).getValue(eq(parSwap), any(CurveInterface.class), any(CurveInterface.class), eq(referenceDate));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingPricerIsRejected() {
		new RiskCalculator(null, discountSpreadBasisPoints);
	}
}
