package net.swapcurve.marketdata.risk;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.swapcurve.marketdata.calibration.BootstrappedCurves;
import net.swapcurve.marketdata.calibration.MarketQuote;
import net.swapcurve.marketdata.model.curves.CurveInterface;
import net.swapcurve.marketdata.products.Swap;
import net.swapcurve.marketdata.products.SwapPricer;

/**
 * Calculates rate sensitivities of a swap by shifting the market quotes and bootstrapping the curves again.
 *
 * The shifts are applied to the par swap quotes only, the fixing remains unchanged. Each scenario is an
 * independent bootstrap, see {@link BootstrappedCurves#getCloneShifted(double)}.
 * The value of the swap is the (dirty) value of the receiver swap given by the {@link SwapPricer}.
 */
public class RiskCalculator {

	private static final Logger logger = LoggerFactory.getLogger(RiskCalculator.class);

	/**
	 * The shift of the quotes in basis points.
	 */
	public static final double BUMP_BASIS_POINTS = 1.0;

	private final SwapPricer	pricer;
	private final double		discountSpreadBasisPoints;

	/**
	 * @param pricer The pricer used to value the swap.
	 * @param discountSpreadBasisPoints The spread of the discount curve over the forward curve used when bootstrapping quotes.
	 */
	public RiskCalculator(SwapPricer pricer, double discountSpreadBasisPoints) {
		super();
		if(pricer == null)
			throw new IllegalArgumentException("No pricer given.");
		this.pricer = pricer;
		this.discountSpreadBasisPoints = discountSpreadBasisPoints;
	}

	/**
	 * Bootstraps the curves from the given quotes and calculates DV01 and Gamma of the swap at the reference date.
	 *
	 * @param swap The swap.
	 * @param quotes The market quotes.
	 * @param referenceDate The reference date of the curves, also used as valuation date.
	 * @return The risk metrics.
	 */
	public RiskMetrics getRiskMetrics(Swap swap, List<MarketQuote> quotes, LocalDate referenceDate) {
		return getRiskMetrics(swap, new BootstrappedCurves(referenceDate, quotes, discountSpreadBasisPoints), referenceDate);
	}

	/**
	 * Calculates DV01 and Gamma of the swap using the quotes of given bootstrapped curves.
	 *
	 * @param swap The swap.
	 * @param curves The bootstrapped curves of the base scenario.
	 * @param valuationDate The valuation date.
	 * @return The risk metrics.
	 */
	public RiskMetrics getRiskMetrics(Swap swap, BootstrappedCurves curves, LocalDate valuationDate) {
		double valueBase	= getValue(swap, curves, valuationDate);
		double valueUp		= getValue(swap, curves.getCloneShifted(BUMP_BASIS_POINTS / 10000.0), valuationDate);
		double valueDown	= getValue(swap, curves.getCloneShifted(-BUMP_BASIS_POINTS / 10000.0), valuationDate);

		double dv01		= valueUp - valueBase;
		double gamma	= valueUp - 2.0 * valueBase + valueDown;

		logger.debug("Risk of {}: base {}, up {}, down {}, dv01 {}, gamma {}", swap, valueBase, valueUp, valueDown, dv01, gamma);

		return new RiskMetrics(dv01, gamma);
	}

	/**
	 * Returns <code>value(par rates + 1bp) - value(base)</code>.
	 *
	 * @param swap The swap.
	 * @param curves The bootstrapped curves of the base scenario.
	 * @param valuationDate The valuation date.
	 * @return The DV01.
	 */
	public double getDV01(Swap swap, BootstrappedCurves curves, LocalDate valuationDate) {
		return getValue(swap, curves.getCloneShifted(BUMP_BASIS_POINTS / 10000.0), valuationDate) - getValue(swap, curves, valuationDate);
	}

	/**
	 * Returns <code>value(par rates + 1bp) - 2 value(base) + value(par rates - 1bp)</code>.
	 *
	 * @param swap The swap.
	 * @param curves The bootstrapped curves of the base scenario.
	 * @param valuationDate The valuation date.
	 * @return The Gamma.
	 */
	public double getGamma(Swap swap, BootstrappedCurves curves, LocalDate valuationDate) {
		return getRiskMetrics(swap, curves, valuationDate).getGamma();
	}

	/**
	 * Returns the change of value when shifting one par swap quote at a time by one basis point.
	 *
	 * @param swap The swap.
	 * @param curves The bootstrapped curves of the base scenario.
	 * @param valuationDate The valuation date.
	 * @return A map from the symbol of each par swap quote to the change of value, in tenor order.
	 */
	public Map<String, Double> getBucketedDV01(Swap swap, BootstrappedCurves curves, LocalDate valuationDate) {
		double valueBase = getValue(swap, curves, valuationDate);

		Map<String, Double> bucketedDV01 = new LinkedHashMap<String, Double>();
		for(MarketQuote quote : curves.getQuotes()) {
			if(quote.isFixing()) continue;

			BootstrappedCurves curvesShifted = curves.getCloneShifted(quote.getSymbol(), BUMP_BASIS_POINTS / 10000.0);
			bucketedDV01.put(quote.getSymbol(), getValue(swap, curvesShifted, valuationDate) - valueBase);
		}

		return bucketedDV01;
	}

	/**
	 * Returns the DV01 obtained by shifting the zero rates of both curves in parallel (instead of the market quotes),
	 * as central difference <code>(value(+1bp) - value(-1bp)) / 2</code>.
	 *
	 * @param swap The swap.
	 * @param forwardCurve The forward curve.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The DV01 with respect to a parallel shift of the zero curves.
	 */
	public double getCurveShiftDV01(Swap swap, CurveInterface forwardCurve, CurveInterface discountCurve, LocalDate valuationDate) {
		if(forwardCurve == null || discountCurve == null)
			throw new IllegalArgumentException("Curve shift requires forward curve (" + forwardCurve + ") and discount curve (" + discountCurve + ")");

		double valueUp		= pricer.getValue(swap, forwardCurve.getCloneShiftedParallel(BUMP_BASIS_POINTS), discountCurve.getCloneShiftedParallel(BUMP_BASIS_POINTS), valuationDate);
		double valueDown	= pricer.getValue(swap, forwardCurve.getCloneShiftedParallel(-BUMP_BASIS_POINTS), discountCurve.getCloneShiftedParallel(-BUMP_BASIS_POINTS), valuationDate);

		return (valueUp - valueDown) / 2.0;
	}

	private double getValue(Swap swap, BootstrappedCurves curves, LocalDate valuationDate) {
		return pricer.getValue(swap, curves.getForwardCurve(), curves.getDiscountCurve(), valuationDate);
	}

	public SwapPricer getPricer() {
		return pricer;
	}

	public double getDiscountSpreadBasisPoints() {
		return discountSpreadBasisPoints;
	}
}
