package net.swapcurve.time;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import net.finmath.time.Period;
import net.finmath.time.daycount.DayCountConvention;
import net.finmath.time.daycount.DayCountConvention_ACT_ACT_ISDA;

/**
 * A schedule of interest rate periods with a payment.
 *
 * The periods have two representations: one a {@link net.finmath.time.Period}
 * which contains {@link java.time.LocalDate} dates and
 * an alternative representation using doubles.
 *
 * The doubles are the times of the dates measured from the schedule's reference date
 * with ACT/ACT ISDA, negative for dates before the reference date. The period length
 * is the day count fraction of the period under the schedule's day count convention.
 * A period accrues from its start date (inclusive) to its end date (exclusive).
 */
public class Schedule implements ScheduleInterface {

	public static final DayCountConvention	internalDayCounting = new DayCountConvention_ACT_ACT_ISDA();

	private final LocalDate				referenceDate;

	private final List<Period>			periods;
	private final DayCountConvention	daycountconvention;

	private final double[] paymentTimes;
	private final double[] periodStartTimes;
	private final double[] periodEndTimes;
	private final double[] periodLength;

	public Schedule(LocalDate referenceDate, DayCountConvention daycountconvention, Period... periods) {
		this(referenceDate, Arrays.asList(periods), daycountconvention);
	}

	public Schedule(LocalDate referenceDate, List<Period> periods, DayCountConvention daycountconvention) {
		super();
		if(referenceDate == null)
			throw new IllegalArgumentException("Schedule requires a reference date.");
		this.referenceDate = referenceDate;
		this.periods = Collections.unmodifiableList(new ArrayList<Period>(periods));
		this.daycountconvention = daycountconvention;

		for(Period period : periods) {
			if(!period.getPeriodEnd().isAfter(period.getPeriodStart()))
				throw new IllegalArgumentException("Period end (" + period.getPeriodEnd() + ") is not after period start (" + period.getPeriodStart() + ")");
		}

		// Precalculate dates to yearfrac doubles
		paymentTimes = new double[periods.size()];
		periodStartTimes = new double[periods.size()];
		periodEndTimes = new double[periods.size()];
		periodLength = new double[periods.size()];
		for(int periodIndex=0; periodIndex < periods.size(); periodIndex++) {
			Period period = periods.get(periodIndex);
			paymentTimes[periodIndex] = getTimeFromReferenceDate(referenceDate, period.getPayment());
			periodStartTimes[periodIndex] = getTimeFromReferenceDate(referenceDate, period.getPeriodStart());
			periodEndTimes[periodIndex] = getTimeFromReferenceDate(referenceDate, period.getPeriodEnd());
			periodLength[periodIndex] = daycountconvention.getDaycountFraction(period.getPeriodStart(), period.getPeriodEnd());
		}
	}

	/**
	 * Returns the time of a date measured from a reference date using the internal day counting (ACT/ACT ISDA).
	 * Dates before the reference date result in negative times.
	 *
	 * @param referenceDate The reference date, i.e., the date corresponding to time 0.
	 * @param date The date.
	 * @return The (signed) time of the date.
	 */
	public static double getTimeFromReferenceDate(LocalDate referenceDate, LocalDate date) {
		if(date.isBefore(referenceDate))
			return -internalDayCounting.getDaycountFraction(date, referenceDate);
		return internalDayCounting.getDaycountFraction(referenceDate, date);
	}

	/**
	 * Returns the ACT/ACT ISDA year fraction from <code>startDate</code> to <code>endDate</code>,
	 * i.e., the sum over the calendar years touched by the period of the days falling into that
	 * year divided by 365 or 366.
	 *
	 * @param startDate The start date.
	 * @param endDate The end date.
	 * @return The year fraction; 0 if <code>startDate</code> is not before <code>endDate</code>.
	 */
	public static double getYearFraction(LocalDate startDate, LocalDate endDate) {
		if(!startDate.isBefore(endDate)) return 0.0;

		return internalDayCounting.getDaycountFraction(startDate, endDate);
	}

	/**
	 * Returns true if the given date lies in the accrual period, i.e., periodStart &le; date &lt; periodEnd.
	 *
	 * @param period A period.
	 * @param date A date.
	 * @return True if the period accrues on the given date.
	 */
	public static boolean isAccruing(Period period, LocalDate date) {
		return !date.isBefore(period.getPeriodStart()) && date.isBefore(period.getPeriodEnd());
	}

	@Override
	public LocalDate getReferenceDate() {
		return referenceDate;
	}

	@Override
	public List<Period> getPeriods() {
		return periods;
	}

	@Override
	public DayCountConvention getDaycountconvention() {
		return daycountconvention;
	}

	@Override
	public int getNumberOfPeriods() {
		return periods.size();
	}

	@Override
	public Period getPeriod(int periodIndex) {
		return periods.get(periodIndex);
	}

	@Override
	public double getPayment(int periodIndex) {
		return paymentTimes[periodIndex];
	}

	@Override
	public double getPeriodStart(int periodIndex) {
		return periodStartTimes[periodIndex];
	}

	@Override
	public double getPeriodEnd(int periodIndex) {
		return periodEndTimes[periodIndex];
	}

	@Override
	public double getPeriodLength(int periodIndex) {
		return periodLength[periodIndex];
	}

	@Override
	public Iterator<Period> iterator() {
		return periods.iterator();
	}

	@Override
	public String toString() {
		StringBuilder periodOutputString = new StringBuilder("Periods (periodStart, periodEnd, payment):");
		for(Period period : periods)
			periodOutputString.append("\n").append(period.getPeriodStart()).append(", ")
			.append(period.getPeriodEnd()).append(", ")
			.append(period.getPayment());
		return "Schedule [referenceDate=" + referenceDate + ", daycountconvention=" + daycountconvention + "\n" + periodOutputString + "]";
	}
}
