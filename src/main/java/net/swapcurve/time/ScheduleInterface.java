package net.swapcurve.time;

import java.time.LocalDate;
import java.util.List;

import net.finmath.time.Period;
import net.finmath.time.daycount.DayCountConvention;

/**
 * Interface of a schedule of interest rate periods with a payment.
 *
 * The periods are given as dates and, alternatively, as doubles measuring the time
 * (in years, ACT/ACT ISDA) from the schedule's reference date.
 */
public interface ScheduleInterface extends Iterable<Period> {

	LocalDate getReferenceDate();

	List<Period> getPeriods();

	DayCountConvention getDaycountconvention();

	int getNumberOfPeriods();

	Period getPeriod(int periodIndex);

	double getPayment(int periodIndex);

	double getPeriodStart(int periodIndex);

	double getPeriodEnd(int periodIndex);

	double getPeriodLength(int periodIndex);
}
