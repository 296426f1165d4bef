package net.swapcurve.marketdata.products;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * The result of valuing a swap on a pair of curves at a valuation date.
 *
 * The dirty value is the value of a receiver swap (receive fixed, pay float). The clean value removes
 * the accrued amounts: <code>clean = dirty - fixedAccrual + floatAccrual</code>.
 */
public class SwapValuation implements Serializable {

	private static final long serialVersionUID = -3301752398410675720L;

	private final LocalDate	valuationDate;
	private final double	fixedLegValue;
	private final double	floatLegValue;
	private final double	annuity;
	private final double	dirtyValue;
	private final double	parRate;
	private final double	fixedAccrual;
	private final double	floatAccrual;
	private final double	cleanValue;

	public SwapValuation(LocalDate valuationDate, double fixedLegValue, double floatLegValue, double annuity, double parRate, double fixedAccrual, double floatAccrual) {
		super();
		this.valuationDate = valuationDate;
		this.fixedLegValue = fixedLegValue;
		this.floatLegValue = floatLegValue;
		this.annuity = annuity;
		this.dirtyValue = fixedLegValue - floatLegValue;
		this.parRate = parRate;
		this.fixedAccrual = fixedAccrual;
		this.floatAccrual = floatAccrual;
		this.cleanValue = dirtyValue - fixedAccrual + floatAccrual;
	}

	public LocalDate getValuationDate() {
		return valuationDate;
	}

	public double getFixedLegValue() {
		return fixedLegValue;
	}

	public double getFloatLegValue() {
		return floatLegValue;
	}

	/**
	 * @return The annuity of the fixed leg for unit notional.
	 */
	public double getAnnuity() {
		return annuity;
	}

	public double getDirtyValue() {
		return dirtyValue;
	}

	public double getParRate() {
		return parRate;
	}

	public double getFixedAccrual() {
		return fixedAccrual;
	}

	public double getFloatAccrual() {
		return floatAccrual;
	}

	public double getCleanValue() {
		return cleanValue;
	}

	@Override
	public String toString() {
		return "SwapValuation [valuationDate=" + valuationDate + ", fixedLegValue=" + fixedLegValue + ", floatLegValue=" + floatLegValue
				+ ", annuity=" + annuity + ", dirtyValue=" + dirtyValue + ", parRate=" + parRate + ", fixedAccrual=" + fixedAccrual
				+ ", floatAccrual=" + floatAccrual + ", cleanValue=" + cleanValue + "]";
	}
}
