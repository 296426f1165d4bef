package net.swapcurve.time;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import net.finmath.time.Period;
import net.finmath.time.daycount.DayCountConvention;

/**
 * Generates regular payment dates and schedules.
 *
 * Dates are rolled from the start date by multiples of the frequency (<code>start + k * frequency</code>),
 * not from the previous date, so an end-of-month start does not drift. There is no business day
 * adjustment. If the frequency does not divide the period, a short stub at the end is created.
 */
public class ScheduleGenerator {

	private ScheduleGenerator() {
	}

	/**
	 * Generates the payment dates of a regular schedule: <code>startDate + k * frequencyMonths</code> for k = 1, 2, ...
	 * as long as the date is not after <code>endDate</code>. If the last of these dates differs from
	 * <code>endDate</code>, <code>endDate</code> is appended (stub). The start date is not part of the result.
	 *
	 * @param startDate The start date.
	 * @param endDate The end date, has to be after the start date.
	 * @param frequencyMonths The frequency in months, has to be positive.
	 * @return The list of payment dates, ending with <code>endDate</code>.
	 */
	public static List<LocalDate> generatePaymentDates(LocalDate startDate, LocalDate endDate, int frequencyMonths) {
		if(startDate == null || endDate == null)
			throw new IllegalArgumentException("startDate (" + startDate + ") and endDate (" + endDate + ") must not be null");
		if(!endDate.isAfter(startDate))
			throw new IllegalArgumentException("endDate (" + endDate + ") is not after startDate (" + startDate + ")");
		if(frequencyMonths <= 0)
			throw new IllegalArgumentException("frequencyMonths (" + frequencyMonths + ") must be positive");

		List<LocalDate> dates = new ArrayList<LocalDate>();
		for(int periodIndex=1; ; periodIndex++) {
			LocalDate date = startDate.plusMonths(periodIndex * frequencyMonths);
			if(date.isAfter(endDate)) break;
			dates.add(date);
		}

		if(dates.isEmpty() || !dates.get(dates.size()-1).equals(endDate))
			dates.add(endDate);

		return dates;
	}

	/**
	 * Generates a schedule of consecutive periods from <code>startDate</code> to <code>endDate</code>
	 * with payment at the period end. The rate of a period is fixed at its start.
	 *
	 * @param referenceDate The reference date of the schedule (time 0 of the double representation).
	 * @param startDate The start date of the first period.
	 * @param endDate The end date of the last period.
	 * @param frequencyMonths The frequency in months.
	 * @param daycountConvention The day count convention for the period length.
	 * @return The schedule.
	 */
	public static ScheduleInterface createSchedule(LocalDate referenceDate, LocalDate startDate, LocalDate endDate, int frequencyMonths, DayCountConvention daycountConvention) {
		List<Period> periods = new ArrayList<Period>();
		LocalDate periodStart = startDate;
		for(LocalDate paymentDate : generatePaymentDates(startDate, endDate, frequencyMonths)) {
			periods.add(new Period(periodStart, paymentDate, periodStart, paymentDate));
			periodStart = paymentDate;
		}

		return new Schedule(referenceDate, periods, daycountConvention);
	}
}
