package net.swapcurve.marketdata.calibration;

import java.io.Serializable;

/**
 * A market quote used to calibrate curves: either a direct fixing of the short rate at a tenor
 * or the par rate of a swap with the given tenor.
 *
 * Tenors are given in years and must be a whole number of months, i.e., <code>12 * tenor</code> has to be
 * an integer up to {@link #TENOR_MONTHS_TOLERANCE}.
 * The symbol identifies the quote (e.g. in {@link BootstrappedCurves#getCloneShifted(String, double)})
 * and is generated from the tenor if not given: whole years give <code>nY</code>, otherwise <code>nM</code>.
 */
public class MarketQuote implements Serializable {

	private static final long serialVersionUID = 4412718624319380011L;

	public static final double TENOR_MONTHS_TOLERANCE = 1E-6;

	private final String	symbol;
	private final double	tenorYears;
	private final double	rate;
	private final boolean	isFixing;

	/**
	 * @param symbol A string identifying the quote. If null, it is generated from the tenor.
	 * @param tenorYears The tenor in years (positive, a whole number of months).
	 * @param rate The quoted rate.
	 * @param isFixing If true, the quote is a fixing (used directly), otherwise a par swap rate.
	 */
	public MarketQuote(String symbol, double tenorYears, double rate, boolean isFixing) {
		super();
		// data sanity checks
		if(Double.isNaN(tenorYears) || Double.isInfinite(tenorYears) || tenorYears <= 0)
			throw new IllegalArgumentException("Quote tenor (" + tenorYears + ") must be positive");
		if(Math.abs(12.0 * tenorYears - Math.round(12.0 * tenorYears)) > TENOR_MONTHS_TOLERANCE)
			throw new IllegalArgumentException("Quote tenor (" + tenorYears + ") is not a whole number of months");
		if(Math.round(12.0 * tenorYears) < 1)
			throw new IllegalArgumentException("Quote tenor (" + tenorYears + ") is shorter than one month");
		if(Double.isNaN(rate) || Double.isInfinite(rate))
			throw new IllegalArgumentException("Quote rate (" + rate + ") for tenor " + tenorYears + " must be finite");

		this.tenorYears = tenorYears;
		this.rate = rate;
		this.isFixing = isFixing;
		this.symbol = symbol != null ? symbol : getSymbolForTenor(tenorYears);
	}

	public MarketQuote(double tenorYears, double rate, boolean isFixing) {
		this(null, tenorYears, rate, isFixing);
	}

	/**
	 * @param tenorYears The tenor in years.
	 * @param rate The fixing rate.
	 * @return A fixing quote.
	 */
	public static MarketQuote fixing(double tenorYears, double rate) {
		return new MarketQuote(tenorYears, rate, true);
	}

	/**
	 * @param tenorYears The tenor of the swap in years.
	 * @param rate The par swap rate.
	 * @return A par swap quote.
	 */
	public static MarketQuote parSwap(double tenorYears, double rate) {
		return new MarketQuote(tenorYears, rate, false);
	}

	/**
	 * @param tenorYears A tenor in years.
	 * @return The symbol for the tenor, <code>nY</code> for whole years, <code>nM</code> otherwise.
	 */
	public static String getSymbolForTenor(double tenorYears) {
		long months = Math.round(12.0 * tenorYears);
		return months % 12 == 0 ? (months / 12) + "Y" : months + "M";
	}

	/**
	 * Create a quote where the rate is shifted by a given amount.
	 *
	 * @param shift The shift (absolute, i.e., 0.0001 for one basis point).
	 * @return The same quote with rate <code>rate + shift</code>.
	 */
	public MarketQuote getCloneShifted(double shift) {
		return new MarketQuote(symbol, tenorYears, rate + shift, isFixing);
	}

	public String getSymbol() {
		return symbol;
	}

	public double getTenorYears() {
		return tenorYears;
	}

	/**
	 * @return The tenor in months, <code>round(12 * tenorYears)</code>.
	 */
	public int getTenorMonths() {
		return (int) Math.round(12.0 * tenorYears);
	}

	public double getRate() {
		return rate;
	}

	public boolean isFixing() {
		return isFixing;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + (isFixing ? 1231 : 1237);
		long temp;
		temp = Double.doubleToLongBits(rate);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		result = prime * result + symbol.hashCode();
		temp = Double.doubleToLongBits(tenorYears);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		MarketQuote other = (MarketQuote) obj;
		return isFixing == other.isFixing
				&& Double.doubleToLongBits(rate) == Double.doubleToLongBits(other.rate)
				&& symbol.equals(other.symbol)
				&& Double.doubleToLongBits(tenorYears) == Double.doubleToLongBits(other.tenorYears);
	}

	@Override
	public String toString() {
		return "MarketQuote [symbol=" + symbol + ", tenorYears=" + tenorYears + ", rate=" + rate + ", isFixing=" + isFixing + "]";
	}
}
