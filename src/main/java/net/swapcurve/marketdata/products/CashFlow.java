package net.swapcurve.marketdata.products;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * A fixed cash flow of a swap leg: accrual period, payment date, day count fraction, rate and amount.
 */
public final class CashFlow implements Serializable {

	private static final long serialVersionUID = 5179226534218049381L;

	private final LocalDate	accrualStart;
	private final LocalDate	accrualEnd;
	private final LocalDate	paymentDate;
	private final double	dayFraction;
	private final double	rate;
	private final double	amount;

	public CashFlow(LocalDate accrualStart, LocalDate accrualEnd, LocalDate paymentDate, double dayFraction, double rate, double amount) {
		this.accrualStart = accrualStart;
		this.accrualEnd = accrualEnd;
		this.paymentDate = paymentDate;
		this.dayFraction = dayFraction;
		this.rate = rate;
		this.amount = amount;
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

	public double getRate() {
		return rate;
	}

	public double getAmount() {
		return amount;
	}

	@Override
	public String toString() {
		return "CashFlow [accrualStart=" + accrualStart + ", accrualEnd=" + accrualEnd + ", paymentDate=" + paymentDate
				+ ", dayFraction=" + dayFraction + ", rate=" + rate + ", amount=" + amount + "]";
	}
}
