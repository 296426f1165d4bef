package net.swapcurve.marketdata.products;

import java.time.LocalDate;

import net.finmath.time.Period;
import net.swapcurve.marketdata.model.curves.CurveInterface;
import net.swapcurve.time.Schedule;
import net.swapcurve.time.ScheduleInterface;

/**
 * Implements the valuation of a swap leg using curves (discount curve, forward curve).
 *
 * The swap leg valuation supports distinct discounting and forward curves. A fixed leg pays
 * <code>notional * spread * periodLength</code> per period, a floating leg pays
 * <code>notional * (forward + spread) * periodLength</code> where the forward is projected from the
 * forward curve over the accrual period.
 *
 * The times of the schedule have to be measured from the reference date of the curves. Support for day
 * counting is provided via the class implementing <code>ScheduleInterface</code>.
 */
public class SwapLeg {

	/**
	 * Periods starting before this time (measured from the curve's reference date) use the zero rate of the forward
	 * curve at the period end instead of a forward rate, which avoids forwards over vanishing intervals at the short end.
	 */
	public static final double SHORT_END_TIME_THRESHOLD = 1E-4;

	private final ScheduleInterface		legSchedule;	// Schedule of the leg
	private final double				notional;
	private final double				spread;			// Fixed spread on the forward or fix rate
	private final boolean				isFloating;		// If true, the forward of the period is added to the spread

	/**
	 * Creates a swap leg.
	 *
	 * @param legSchedule Schedule of the leg
	 * @param notional The notional of the leg
	 * @param spread Fixed spread on the forward or fix rate
	 * @param isFloating If true, the leg pays the forward from the forward curve (plus spread), otherwise it pays the fixed rate
	 */
	public SwapLeg(ScheduleInterface legSchedule, double notional, double spread, boolean isFloating) {
		super();
		if(legSchedule == null || legSchedule.getNumberOfPeriods() == 0)
			throw new IllegalArgumentException("Swap leg requires a schedule with at least one period.");
		this.legSchedule = legSchedule;
		this.notional = notional;
		this.spread = spread;
		this.isFloating = isFloating;
	}

	/**
	 * Returns the value of the leg, i.e., the sum of <code>amount * discountFactor(paymentTime)</code> over all periods
	 * paying after the valuation date.
	 *
	 * @param valuationDate The valuation date; payments on or before this date are not valued.
	 * @param forwardCurve The forward curve (may be null for a fixed leg).
	 * @param discountCurve The discount curve.
	 * @return The value of the leg.
	 */
	public double getValue(LocalDate valuationDate, CurveInterface forwardCurve, CurveInterface discountCurve) {
		checkCurves(forwardCurve, discountCurve);

		double value = 0.0;
		for(int iPeriod=0; iPeriod<legSchedule.getNumberOfPeriods(); iPeriod++) {
			Period period = legSchedule.getPeriod(iPeriod);
			if(!period.getPayment().isAfter(valuationDate)) continue;

			double paymentTime = legSchedule.getPayment(iPeriod);
			value += getAmount(iPeriod, forwardCurve) * discountCurve.getDiscountFactor(paymentTime);
		}

		return value;
	}

	/**
	 * Returns the annuity of the leg, i.e., the sum of <code>discountFactor(paymentTime) * periodLength</code> over all
	 * periods paying after the valuation date.
	 *
	 * @param valuationDate The valuation date.
	 * @param discountCurve The discount curve.
	 * @return The annuity of the leg (for unit notional).
	 */
	public double getAnnuity(LocalDate valuationDate, CurveInterface discountCurve) {
		checkCurves(null, discountCurve);

		double annuity = 0.0;
		for(int iPeriod=0; iPeriod<legSchedule.getNumberOfPeriods(); iPeriod++) {
			Period period = legSchedule.getPeriod(iPeriod);
			if(!period.getPayment().isAfter(valuationDate)) continue;

			annuity += discountCurve.getDiscountFactor(legSchedule.getPayment(iPeriod)) * legSchedule.getPeriodLength(iPeriod);
		}

		return annuity;
	}

	/**
	 * Returns the accrued amount of the period accruing on the valuation date: the full amount of the period
	 * prorated by the day count fraction elapsed since the period start. Returns 0 if no period accrues.
	 *
	 * @param valuationDate The valuation date.
	 * @param forwardCurve The forward curve (may be null for a fixed leg).
	 * @return The accrued amount.
	 */
	public double getAccrual(LocalDate valuationDate, CurveInterface forwardCurve) {
		if(isFloating && forwardCurve == null)
			throw new IllegalArgumentException("Floating swap leg requires a forward curve.");

		for(int iPeriod=0; iPeriod<legSchedule.getNumberOfPeriods(); iPeriod++) {
			Period period = legSchedule.getPeriod(iPeriod);
			if(!Schedule.isAccruing(period, valuationDate)) continue;

			double elapsed = legSchedule.getDaycountconvention().getDaycountFraction(period.getPeriodStart(), valuationDate);
			return getAmount(iPeriod, forwardCurve) * elapsed / legSchedule.getPeriodLength(iPeriod);
		}

		return 0.0;
	}

	/**
	 * Returns the rate paid in the given period: the fixed rate, or forward plus spread for a floating leg.
	 *
	 * @param periodIndex The index of the period.
	 * @param forwardCurve The forward curve (ignored for a fixed leg).
	 * @return The rate of the period.
	 */
	public double getRate(int periodIndex, CurveInterface forwardCurve) {
		if(!isFloating) return spread;

		double periodStartTime	= legSchedule.getPeriodStart(periodIndex);
		double periodEndTime	= legSchedule.getPeriodEnd(periodIndex);

		double forward;
		if(periodStartTime < SHORT_END_TIME_THRESHOLD) {
			forward = forwardCurve.getZeroRate(periodEndTime);
		}
		else {
			forward = forwardCurve.getForwardRate(periodStartTime, periodEndTime);
		}

		return forward + spread;
	}

	/**
	 * @param periodIndex The index of the period.
	 * @param forwardCurve The forward curve (ignored for a fixed leg).
	 * @return The amount paid in the given period.
	 */
	public double getAmount(int periodIndex, CurveInterface forwardCurve) {
		double swapDayCountFraction = legSchedule.getPeriodLength(periodIndex);
		// empty period is interpreted as misspecification
		if(swapDayCountFraction == 0)
			throw new IllegalArgumentException(periodIndex + "th period of swapLeg is empty.");

		return notional * getRate(periodIndex, forwardCurve) * swapDayCountFraction;
	}

	private void checkCurves(CurveInterface forwardCurve, CurveInterface discountCurve) {
		if(discountCurve == null)
			throw new IllegalArgumentException("No discount curve given.");
		if(!legSchedule.getReferenceDate().equals(discountCurve.getReferenceDate()))
			throw new IllegalArgumentException("Reference date of discount curve '" + discountCurve.getName() + "' (" + discountCurve.getReferenceDate() + ") != reference date of schedule (" + legSchedule.getReferenceDate() + ")");
		if(isFloating) {
			if(forwardCurve == null)
				throw new IllegalArgumentException("Floating swap leg requires a forward curve.");
			if(!legSchedule.getReferenceDate().equals(forwardCurve.getReferenceDate()))
				throw new IllegalArgumentException("Reference date of forward curve '" + forwardCurve.getName() + "' (" + forwardCurve.getReferenceDate() + ") != reference date of schedule (" + legSchedule.getReferenceDate() + ")");
		}
	}

	public ScheduleInterface getSchedule() {
		return legSchedule;
	}

	public double getNotional() {
		return notional;
	}

	public double getSpread() {
		return spread;
	}

	public boolean isFloating() {
		return isFloating;
	}

	@Override
	public String toString() {
		return "SwapLeg [notional=" + notional + ", spread=" + spread + ", isFloating=" + isFloating + ", " + legSchedule.toString() + "]\n";
	}
}
