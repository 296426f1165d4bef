package net.swapcurve.marketdata.products;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import net.finmath.time.Period;
import net.finmath.time.daycount.DayCountConvention;
import net.finmath.time.daycount.DayCountConvention_ACT_ACT_ISDA;
import net.swapcurve.time.ScheduleGenerator;
import net.swapcurve.time.ScheduleInterface;

/**
 * A plain vanilla fixed/float interest rate swap: start and end date, notional, fixed rate and the
 * frequencies of the fixed leg (default annual) and the floating leg (default semi-annual).
 *
 * Both legs accrue ACT/ACT ISDA and pay at the end of each period. A swap is immutable; the
 * fixed rate is applied by {@link #getCloneWithFixedRate(double)}. Cash flows and periods are
 * generated on each call.
 */
public class Swap implements Serializable {

	private static final long serialVersionUID = 2740971520853281466L;

	public static final int DEFAULT_FIXED_FREQUENCY_MONTHS	= 12;
	public static final int DEFAULT_FLOAT_FREQUENCY_MONTHS	= 6;

	private static final DayCountConvention daycountConvention = new DayCountConvention_ACT_ACT_ISDA();

	private final LocalDate	startDate;
	private final LocalDate	endDate;
	private final double	notional;
	private final double	fixedRate;
	private final int		fixedFrequencyMonths;
	private final int		floatFrequencyMonths;

	public Swap(LocalDate startDate, LocalDate endDate, double notional, double fixedRate, int fixedFrequencyMonths, int floatFrequencyMonths) {
		super();
		if(startDate == null || endDate == null)
			throw new IllegalArgumentException("Swap requires start date (" + startDate + ") and end date (" + endDate + ")");
		if(!endDate.isAfter(startDate))
			throw new IllegalArgumentException("Swap end date (" + endDate + ") is not after start date (" + startDate + ")");
		if(!(notional > 0))
			throw new IllegalArgumentException("Swap notional (" + notional + ") must be positive");
		if(fixedFrequencyMonths <= 0 || floatFrequencyMonths <= 0)
			throw new IllegalArgumentException("Swap frequencies must be positive (fixed=" + fixedFrequencyMonths + ", float=" + floatFrequencyMonths + ")");

		this.startDate = startDate;
		this.endDate = endDate;
		this.notional = notional;
		this.fixedRate = fixedRate;
		this.fixedFrequencyMonths = fixedFrequencyMonths;
		this.floatFrequencyMonths = floatFrequencyMonths;
	}

	/**
	 * Creates a swap with annual fixed leg and semi-annual floating leg.
	 */
	public Swap(LocalDate startDate, LocalDate endDate, double notional, double fixedRate) {
		this(startDate, endDate, notional, fixedRate, DEFAULT_FIXED_FREQUENCY_MONTHS, DEFAULT_FLOAT_FREQUENCY_MONTHS);
	}

	/**
	 * Creates a swap with annual fixed leg, semi-annual floating leg and a fixed rate of 0 (to be set to the par rate).
	 */
	public Swap(LocalDate startDate, LocalDate endDate, double notional) {
		this(startDate, endDate, notional, 0.0);
	}

	/**
	 * @param fixedRate The new fixed rate.
	 * @return A swap identical to this one, except for the fixed rate.
	 */
	public Swap getCloneWithFixedRate(double fixedRate) {
		return new Swap(startDate, endDate, notional, fixedRate, fixedFrequencyMonths, floatFrequencyMonths);
	}

	/**
	 * @return The length of the swap in years (ACT/ACT ISDA).
	 */
	public double getTenor() {
		return daycountConvention.getDaycountFraction(startDate, endDate);
	}

	/**
	 * @param referenceDate The reference date of the schedule (time 0).
	 * @return The schedule of the fixed leg.
	 */
	public ScheduleInterface getFixedLegSchedule(LocalDate referenceDate) {
		return ScheduleGenerator.createSchedule(referenceDate, startDate, endDate, fixedFrequencyMonths, daycountConvention);
	}

	/**
	 * @param referenceDate The reference date of the schedule (time 0).
	 * @return The schedule of the floating leg.
	 */
	public ScheduleInterface getFloatLegSchedule(LocalDate referenceDate) {
		return ScheduleGenerator.createSchedule(referenceDate, startDate, endDate, floatFrequencyMonths, daycountConvention);
	}

	/**
	 * @return The cash flows of the fixed leg.
	 */
	public List<CashFlow> getFixedLegCashFlows() {
		List<CashFlow> cashFlows = new ArrayList<CashFlow>();
		for(Period period : getFixedLegSchedule(startDate)) {
			double dayFraction = daycountConvention.getDaycountFraction(period.getPeriodStart(), period.getPeriodEnd());
			double amount = notional * fixedRate * dayFraction;
			cashFlows.add(new CashFlow(period.getPeriodStart(), period.getPeriodEnd(), period.getPayment(), dayFraction, fixedRate, amount));
		}
		return cashFlows;
	}

	/**
	 * @return The periods of the floating leg.
	 */
	public List<FloatPeriod> getFloatLegPeriods() {
		List<FloatPeriod> floatPeriods = new ArrayList<FloatPeriod>();
		for(Period period : getFloatLegSchedule(startDate)) {
			double dayFraction = daycountConvention.getDaycountFraction(period.getPeriodStart(), period.getPeriodEnd());
			floatPeriods.add(new FloatPeriod(period.getPeriodStart(), period.getPeriodEnd(), period.getPayment(), dayFraction));
		}
		return floatPeriods;
	}

	public LocalDate getStartDate() {
		return startDate;
	}

	public LocalDate getEndDate() {
		return endDate;
	}

	public double getNotional() {
		return notional;
	}

	public double getFixedRate() {
		return fixedRate;
	}

	public int getFixedFrequencyMonths() {
		return fixedFrequencyMonths;
	}

	public int getFloatFrequencyMonths() {
		return floatFrequencyMonths;
	}

	public DayCountConvention getDaycountConvention() {
		return daycountConvention;
	}

	@Override
	public String toString() {
		return "Swap [startDate=" + startDate + ", endDate=" + endDate + ", notional=" + notional + ", fixedRate=" + fixedRate
				+ ", fixedFrequencyMonths=" + fixedFrequencyMonths + ", floatFrequencyMonths=" + floatFrequencyMonths + "]";
	}
}
