package net.swapcurve.marketdata.products;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * A period of a floating swap leg. The rate is not part of the period, it is projected from a forward curve
 * when the leg is valued.
 */
public final class FloatPeriod implements Serializable {

	private static final long serialVersionUID = -3012873561249817302L;

	private final LocalDate	accrualStart;
	private final LocalDate	accrualEnd;
	private final LocalDate	paymentDate;
	private final double	dayFraction;

	public FloatPeriod(LocalDate accrualStart, LocalDate accrualEnd, LocalDate paymentDate, double dayFraction) {
		this.accrualStart = accrualStart;
		this.accrualEnd = accrualEnd;
		this.paymentDate = paymentDate;
		this.dayFraction = dayFraction;
	}

	public LocalDate getAccrualStart() {
		return accrualStart;
	}

	public LocalDate getAccrualEnd() {
		return accrualEnd;
	}

	public LocalDate getPaymentDate() {
		return paymentDate;
	}

	public double getDayFraction() {
		return dayFraction;
	}

	@Override
	public String toString() {
		return "FloatPeriod [accrualStart=" + accrualStart + ", accrualEnd=" + accrualEnd + ", paymentDate=" + paymentDate
				+ ", dayFraction=" + dayFraction + "]";
	}
}
