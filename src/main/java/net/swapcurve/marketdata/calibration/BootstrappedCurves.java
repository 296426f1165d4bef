package net.swapcurve.marketdata.calibration;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.finmath.rootfinder.NewtonsMethod;
import net.swapcurve.marketdata.model.curves.Curve;
import net.swapcurve.marketdata.products.Swap;
import net.swapcurve.marketdata.products.SwapPricer;
import net.swapcurve.time.Schedule;

/**
 * Generate a pair of bootstrapped curves (forward curve, discount curve) from a fixing and a set of par swap quotes.
 *
 * The quotes are processed in ascending tenor. The fixing defines the first point of the forward curve directly.
 * For each par swap quote with tenor <i>T</i> the zero rate of the forward curve at <i>T</i> is solved by
 * Newton's method (with a forward difference derivative) such that the swap (annual fixed leg, semi-annual
 * floating leg, unit notional, struck at the quote) has value zero. The discount curve is not calibrated
 * independently: at each point its zero rate is the forward curve's zero rate plus a fixed spread.
 *
 * The trial curves used in the solve consist of the points already solved and the candidate point at <i>T</i>,
 * hence each solve only depends on shorter tenors. The time of the point of a quote is the time of the
 * date <code>referenceDate + round(12 * tenor)</code> months, i.e., the maturity of the quote's swap.
 *
 * The solve stops at the target accuracy or at the iteration cap. It stops early if the numerical derivative
 * falls below {@link #DERIVATIVE_FLOOR} in absolute value. The best point found is used and a missed accuracy
 * is logged as a warning.
 *
 * The defaults for the accuracy, the maximum number of iterations and the bump of the numerical derivative
 * may be set via the system properties
 * <code>net.swapcurve.marketdata.calibration.BootstrappedCurves.accuracy</code>,
 * <code>net.swapcurve.marketdata.calibration.BootstrappedCurves.maxIterations</code> and
 * <code>net.swapcurve.marketdata.calibration.BootstrappedCurves.derivativeBump</code>.
 */
public class BootstrappedCurves {

	private static final Logger logger = LoggerFactory.getLogger(BootstrappedCurves.class);

	public static final String FORWARD_CURVE_NAME	= "forwardCurve";
	public static final String DISCOUNT_CURVE_NAME	= "discountCurve";

	public static final double DERIVATIVE_FLOOR		= 1E-14;

	private static final double	defaultAccuracy;
	private static final int	defaultMaxIterations;
	private static final double	defaultDerivativeBump;
	static {
		defaultAccuracy			= Double.parseDouble(System.getProperty("net.swapcurve.marketdata.calibration.BootstrappedCurves.accuracy","1E-10"));
		defaultMaxIterations	= Integer.parseInt(System.getProperty("net.swapcurve.marketdata.calibration.BootstrappedCurves.maxIterations","100"));
		defaultDerivativeBump	= Double.parseDouble(System.getProperty("net.swapcurve.marketdata.calibration.BootstrappedCurves.derivativeBump","1E-4"));
	}

	private final LocalDate				referenceDate;
	private final List<MarketQuote>		quotes;
	private final double				discountSpreadBasisPoints;

	private final double	accuracy;
	private final int		maxIterations;
	private final double	derivativeBump;

	private final SwapPricer pricer = new SwapPricer();

	private Curve forwardCurve;
	private Curve discountCurve;

	private final Map<String, Double>	calibrationResiduals = new LinkedHashMap<String, Double>();
	private int							lastNumberOfIterations;
	private double						lastAccuracy;

	/**
	 * Bootstrap forward and discount curve using the default accuracy, iteration cap and derivative bump.
	 *
	 * @param referenceDate The reference date of the curves (time 0).
	 * @param quotes The market quotes: exactly one fixing (the shortest tenor) and at least one par swap.
	 * @param discountSpreadBasisPoints The spread of the discount curve over the forward curve in basis points.
	 */
	public BootstrappedCurves(LocalDate referenceDate, List<MarketQuote> quotes, double discountSpreadBasisPoints) {
		this(referenceDate, quotes, discountSpreadBasisPoints, defaultAccuracy, defaultMaxIterations, defaultDerivativeBump);
	}

	/**
	 * Bootstrap forward and discount curve.
	 *
	 * @param referenceDate The reference date of the curves (time 0).
	 * @param quotes The market quotes: exactly one fixing (the shortest tenor) and at least one par swap.
	 * @param discountSpreadBasisPoints The spread of the discount curve over the forward curve in basis points.
	 * @param accuracy The target for the absolute value of the unit notional swap value.
	 * @param maxIterations The maximum number of Newton iterations per quote.
	 * @param derivativeBump The bump of the zero rate used for the forward difference derivative.
	 */
	public BootstrappedCurves(LocalDate referenceDate, List<MarketQuote> quotes, double discountSpreadBasisPoints, double accuracy, int maxIterations, double derivativeBump) {
		super();
		// data sanity checks
		if(referenceDate == null)
			throw new IllegalArgumentException("No reference date given.");
		if(Double.isNaN(discountSpreadBasisPoints) || Double.isInfinite(discountSpreadBasisPoints))
			throw new IllegalArgumentException("Discount spread (" + discountSpreadBasisPoints + ") must be finite");
		if(!(accuracy > 0) || maxIterations <= 0 || !(derivativeBump > 0))
			throw new IllegalArgumentException("Invalid solver settings (accuracy=" + accuracy + ", maxIterations=" + maxIterations + ", derivativeBump=" + derivativeBump + ")");

		this.referenceDate = referenceDate;
		this.quotes = Collections.unmodifiableList(getSortedAndValidatedQuotes(quotes));
		this.discountSpreadBasisPoints = discountSpreadBasisPoints;
		this.accuracy = accuracy;
		this.maxIterations = maxIterations;
		this.derivativeBump = derivativeBump;

		bootstrap();
	}

	/**
	 * Bootstrap forward and discount curve using the default solver settings.
	 *
	 * @param referenceDate The reference date of the curves (time 0).
	 * @param quotes The market quotes: exactly one fixing (the shortest tenor) and at least one par swap.
	 * @param discountSpreadBasisPoints The spread of the discount curve over the forward curve in basis points.
	 * @return The bootstrapped curves.
	 */
	public static BootstrappedCurves bootstrap(LocalDate referenceDate, MarketQuote[] quotes, double discountSpreadBasisPoints) {
		if(quotes == null)
			throw new IllegalArgumentException("No quotes given.");
		return new BootstrappedCurves(referenceDate, Arrays.asList(quotes), discountSpreadBasisPoints);
	}

	private static List<MarketQuote> getSortedAndValidatedQuotes(List<MarketQuote> quotes) {
		if(quotes == null || quotes.isEmpty())
			throw new IllegalArgumentException("No quotes given.");

		List<MarketQuote> sortedQuotes = new ArrayList<MarketQuote>(quotes);
		if(sortedQuotes.contains(null))
			throw new IllegalArgumentException("Quotes must not contain null (" + quotes + ")");

		Collections.sort(sortedQuotes, new Comparator<MarketQuote>() {
			@Override
			public int compare(MarketQuote quote1, MarketQuote quote2) {
				return Integer.compare(quote1.getTenorMonths(), quote2.getTenorMonths());
			}
		});

		int numberOfFixings = 0;
		Set<String> symbols = new HashSet<String>();
		for(int i=0; i<sortedQuotes.size(); i++) {
			MarketQuote quote = sortedQuotes.get(i);
			if(quote.isFixing()) numberOfFixings++;
			if(!symbols.add(quote.getSymbol()))
				throw new IllegalArgumentException("Symbol " + quote.getSymbol() + " is not unique (" + quotes + ")");
			if(i > 0 && sortedQuotes.get(i-1).getTenorMonths() == quote.getTenorMonths())
				throw new IllegalArgumentException("Quotes " + sortedQuotes.get(i-1) + " and " + quote + " have the same tenor (" + quote.getTenorMonths() + " months)");
		}
		if(numberOfFixings != 1)
			throw new IllegalArgumentException("Quotes must contain exactly one fixing (found " + numberOfFixings + ")");
		if(sortedQuotes.size() < 2)
			throw new IllegalArgumentException("Quotes must contain at least one par swap (" + quotes + ")");
		if(!sortedQuotes.get(0).isFixing())
			throw new IllegalArgumentException("The fixing must have the shortest tenor (shortest quote is " + sortedQuotes.get(0) + ")");

		return sortedQuotes;
	}

	private void bootstrap() {
		double spread = discountSpreadBasisPoints / 10000.0;

		forwardCurve	= new Curve.CurveBuilder(FORWARD_CURVE_NAME, referenceDate).build();
		discountCurve	= new Curve.CurveBuilder(DISCOUNT_CURVE_NAME, referenceDate).build();

		lastNumberOfIterations	= 0;
		lastAccuracy			= 0.0;

		for(MarketQuote quote : quotes) {
			LocalDate maturity = referenceDate.plusMonths(quote.getTenorMonths());
			double time = Schedule.getTimeFromReferenceDate(referenceDate, maturity);

			double zeroRate;
			double residual;
			if(quote.isFixing()) {
				zeroRate = quote.getRate();
				residual = 0.0;
			}
			else {
				Swap swap = new Swap(referenceDate, maturity, 1.0, quote.getRate());

				NewtonsMethod rootFinder = new NewtonsMethod(quote.getRate());
				int numberOfIterations = 0;
				boolean isStalled = false;
				do {
					double candidate		= rootFinder.getNextPoint();
					double value			= getSwapValue(swap, time, candidate, spread);
					double valueShifted		= getSwapValue(swap, time, candidate + derivativeBump, spread);
					double derivative		= (valueShifted - value) / derivativeBump;

					// The next point is not used if the derivative vanished
					isStalled = Math.abs(derivative) < DERIVATIVE_FLOOR && Math.abs(value) >= accuracy;
					rootFinder.setValueAndDerivative(value, derivative);
					numberOfIterations++;
				} while(rootFinder.getAccuracy() >= accuracy && numberOfIterations < maxIterations && !isStalled);

				zeroRate = rootFinder.getBestPoint();
				residual = rootFinder.getAccuracy();
				lastNumberOfIterations += numberOfIterations;

				if(isStalled) {
					logger.warn("Solver stalled for quote {} after {} iterations (derivative vanished), residual {}, zero rate {}", quote.getSymbol(), numberOfIterations, residual, zeroRate);
				}
				else if(residual >= accuracy) {
					logger.warn("No convergence for quote {} after {} iterations, residual {} (target {}), zero rate {}", quote.getSymbol(), numberOfIterations, residual, accuracy, zeroRate);
				}
				else {
					logger.debug("Solved quote {} (t={}): zero rate {}, residual {}, iterations {}", quote.getSymbol(), time, zeroRate, residual, numberOfIterations);
				}
			}

			forwardCurve	= forwardCurve.getCloneBuilder().addPoint(time, zeroRate).build();
			discountCurve	= discountCurve.getCloneBuilder().addPoint(time, zeroRate + spread).build();

			calibrationResiduals.put(quote.getSymbol(), residual);
			lastAccuracy = Math.max(lastAccuracy, residual);
		}
	}

	/*
	 * Value of the unit notional payer swap (float - fixed) on the solved curves extended by the candidate point.
	 */
	private double getSwapValue(Swap swap, double time, double candidateZeroRate, double spread) {
		Curve forwardCurveTrial		= forwardCurve.getCloneBuilder().addPoint(time, candidateZeroRate).build();
		Curve discountCurveTrial	= discountCurve.getCloneBuilder().addPoint(time, candidateZeroRate + spread).build();

		return pricer.getFloatLegValue(swap, forwardCurveTrial, discountCurveTrial, referenceDate)
				- pricer.getFixedLegValue(swap, discountCurveTrial, referenceDate);
	}

	/**
	 * Returns the curves bootstrapped to "shifted" market data, that is, the quotes of <code>this</code> object
	 * where the rate of every par swap quote is shifted by the given amount (the fixing remains unchanged).
	 *
	 * @param shift The shift applied to all par swap rates (0.0001 is one basis point).
	 * @return A new set of bootstrapped curves.
	 */
	public BootstrappedCurves getCloneShifted(double shift) {
		List<MarketQuote> quotesShifted = new ArrayList<MarketQuote>();
		for(MarketQuote quote : quotes) {
			quotesShifted.add(quote.isFixing() ? quote : quote.getCloneShifted(shift));
		}

		return getCloneForQuotes(quotesShifted);
	}

	/**
	 * Returns the curves bootstrapped to "shifted" market data, where only the quote with the given symbol is shifted.
	 *
	 * @param symbol The symbol of the quote to shift.
	 * @param shift The shift to apply to the quote.
	 * @return A new set of bootstrapped curves.
	 */
	public BootstrappedCurves getCloneShifted(String symbol, double shift) {
		if(getQuote(symbol) == null)
			throw new IllegalArgumentException("No quote with symbol " + symbol);

		List<MarketQuote> quotesShifted = new ArrayList<MarketQuote>();
		for(MarketQuote quote : quotes) {
			quotesShifted.add(quote.getSymbol().equals(symbol) ? quote.getCloneShifted(shift) : quote);
		}

		return getCloneForQuotes(quotesShifted);
	}

	/**
	 * Returns the curves bootstrapped to "shifted" market data, that is, the quotes of <code>this</code> object,
	 * modified by the shifts provided to this method.
	 *
	 * @param shifts A map of shifts associating symbols with shifts. If symbols are not part of this map, they remain unshifted.
	 * @return A new set of bootstrapped curves.
	 */
	public BootstrappedCurves getCloneShifted(Map<String,Double> shifts) {
		List<MarketQuote> quotesShifted = new ArrayList<MarketQuote>();
		for(MarketQuote quote : quotes) {
			Double shift = shifts.get(quote.getSymbol());
			quotesShifted.add(shift != null ? quote.getCloneShifted(shift) : quote);
		}

		return getCloneForQuotes(quotesShifted);
	}

	/**
	 * Returns the curves bootstrapped to "shifted" market data, shifting all quotes whose symbol matches a given
	 * regular expression <code>Pattern</code>.
	 *
	 * @see java.util.regex.Pattern
	 *
	 * @param symbolRegExp A pattern, identifying the symbols to shift.
	 * @param shift The shift to apply to the symbol(s).
	 * @return A new set of bootstrapped curves.
	 */
	public BootstrappedCurves getCloneShifted(Pattern symbolRegExp, double shift) {
		List<MarketQuote> quotesShifted = new ArrayList<MarketQuote>();
		for(MarketQuote quote : quotes) {
			Matcher matcher = symbolRegExp.matcher(quote.getSymbol());
			quotesShifted.add(matcher.matches() ? quote.getCloneShifted(shift) : quote);
		}

		return getCloneForQuotes(quotesShifted);
	}

	private BootstrappedCurves getCloneForQuotes(List<MarketQuote> quotesShifted) {
		return new BootstrappedCurves(referenceDate, quotesShifted, discountSpreadBasisPoints, accuracy, maxIterations, derivativeBump);
	}

	/**
	 * @return The forward (projection) curve.
	 */
	public Curve getForwardCurve() {
		return forwardCurve;
	}

	/**
	 * @return The discount curve, i.e., the forward curve plus the discount spread at every point.
	 */
	public Curve getDiscountCurve() {
		return discountCurve;
	}

	/**
	 * Returns the absolute value of the unit notional swap value achieved for the quote with the given symbol.
	 *
	 * @param symbol The symbol of a quote.
	 * @return The residual of the quote (0 for the fixing).
	 */
	public double getCalibrationResidual(String symbol) {
		Double residual = calibrationResiduals.get(symbol);
		if(residual == null)
			throw new IllegalArgumentException("No quote with symbol " + symbol);
		return residual;
	}

	/**
	 * Return the accuracy achieved in the last calibration, i.e., the maximum residual over all quotes.
	 *
	 * @return The accuracy achieved in the last calibration.
	 */
	public double getLastAccuracy() {
		return lastAccuracy;
	}

	/**
	 * @return The total number of Newton iterations used by the bootstrap.
	 */
	public int getLastNumberOfIterations() {
		return lastNumberOfIterations;
	}

	/**
	 * @param symbol A symbol.
	 * @return The quote with the given symbol or null if there is none.
	 */
	public MarketQuote getQuote(String symbol) {
		for(MarketQuote quote : quotes) {
			if(quote.getSymbol().equals(symbol)) return quote;
		}
		return null;
	}

	/**
	 * @return The quotes sorted by tenor.
	 */
	public List<MarketQuote> getQuotes() {
		return quotes;
	}

	public LocalDate getReferenceDate() {
		return referenceDate;
	}

	public double getDiscountSpreadBasisPoints() {
		return discountSpreadBasisPoints;
	}

	@Override
	public String toString() {
		return "BootstrappedCurves [referenceDate=" + referenceDate + ", discountSpreadBasisPoints=" + discountSpreadBasisPoints
				+ ", lastAccuracy=" + lastAccuracy + ", quotes=" + quotes + ",\n" + forwardCurve + ",\n" + discountCurve + "]";
	}
}
