package net.swapcurve.marketdata.products;

import java.time.LocalDate;

import net.swapcurve.marketdata.model.curves.CurveInterface;

/**
 * Values a {@link Swap} using a forward (projection) curve and a discount curve.
 *
 * The fixed leg pays the swap's fixed rate annually, the floating leg pays the forward of the
 * projection curve semi-annually (or with the frequencies of the swap). The schedules of the legs are
 * expressed relative to the reference date of the discount curve. Values are those of a receiver swap,
 * i.e., <code>fixedLegValue - floatLegValue</code>.
 */
public class SwapPricer {

	public SwapPricer() {
		super();
	}

	/**
	 * @param swap The swap.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The value of the fixed leg, i.e., the sum over the fixed cash flows paying after the valuation date.
	 */
	public double getFixedLegValue(Swap swap, CurveInterface discountCurve, LocalDate valuationDate) {
		return getFixedLeg(swap, discountCurve).getValue(valuationDate, null, discountCurve);
	}

	/**
	 * @param swap The swap.
	 * @param forwardCurve The forward curve used to project the floating rates.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The value of the floating leg.
	 */
	public double getFloatLegValue(Swap swap, CurveInterface forwardCurve, CurveInterface discountCurve, LocalDate valuationDate) {
		return getFloatLeg(swap, discountCurve).getValue(valuationDate, forwardCurve, discountCurve);
	}

	/**
	 * Returns the annuity of the fixed leg, i.e., the sum of <code>discountFactor * dayFraction</code> over the fixed
	 * payment dates after the valuation date (for unit notional).
	 *
	 * @param swap The swap.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The annuity of the fixed leg.
	 */
	public double getFixedAnnuity(Swap swap, CurveInterface discountCurve, LocalDate valuationDate) {
		return getFixedLeg(swap, discountCurve).getAnnuity(valuationDate, discountCurve);
	}

	/**
	 * Calculate the par rate of the swap, i.e., the fixed rate for which the fixed leg has the value of the floating leg.
	 *
	 * @param swap The swap.
	 * @param forwardCurve The forward curve.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The par rate.
	 */
	public double getParRate(Swap swap, CurveInterface forwardCurve, CurveInterface discountCurve, LocalDate valuationDate) {
		double floatLegValue = getFloatLegValue(swap, forwardCurve, discountCurve, valuationDate);
		double annuity = getFixedAnnuity(swap, discountCurve, valuationDate);
		if(annuity==0)
			throw new IllegalArgumentException("annuity==0 (no fixed payment after " + valuationDate + ")");

		return floatLegValue / (swap.getNotional() * annuity);
	}

	/**
	 * @param swap The swap.
	 * @param forwardCurve The forward curve.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The (dirty) value of the receiver swap, <code>fixedLegValue - floatLegValue</code>.
	 */
	public double getValue(Swap swap, CurveInterface forwardCurve, CurveInterface discountCurve, LocalDate valuationDate) {
		return getFixedLegValue(swap, discountCurve, valuationDate) - getFloatLegValue(swap, forwardCurve, discountCurve, valuationDate);
	}

	/**
	 * @param swap The swap.
	 * @param valuationDate The valuation date.
	 * @return The accrued fixed amount of the fixed period running on the valuation date, 0 if there is none.
	 */
	public double getFixedAccrual(Swap swap, LocalDate valuationDate) {
		return new SwapLeg(swap.getFixedLegSchedule(swap.getStartDate()), swap.getNotional(), swap.getFixedRate(), false).getAccrual(valuationDate, null);
	}

	/**
	 * @param swap The swap.
	 * @param forwardCurve The forward curve.
	 * @param valuationDate The valuation date.
	 * @return The accrued floating amount of the floating period running on the valuation date, 0 if there is none.
	 */
	public double getFloatAccrual(Swap swap, CurveInterface forwardCurve, LocalDate valuationDate) {
		if(forwardCurve == null)
			throw new IllegalArgumentException("No forward curve given.");
		return getFloatLeg(swap, forwardCurve).getAccrual(valuationDate, forwardCurve);
	}

	/**
	 * @param swap The swap.
	 * @param forwardCurve The forward curve.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The clean value, <code>dirty - fixedAccrual + floatAccrual</code>.
	 */
	public double getCleanValue(Swap swap, CurveInterface forwardCurve, CurveInterface discountCurve, LocalDate valuationDate) {
		return getValue(swap, forwardCurve, discountCurve, valuationDate)
				- getFixedAccrual(swap, valuationDate)
				+ getFloatAccrual(swap, forwardCurve, valuationDate);
	}

	/**
	 * Values the swap and collects leg values, annuity, par rate and accruals.
	 *
	 * @param swap The swap.
	 * @param forwardCurve The forward curve.
	 * @param discountCurve The discount curve.
	 * @param valuationDate The valuation date.
	 * @return The valuation.
	 */
	public SwapValuation price(Swap swap, CurveInterface forwardCurve, CurveInterface discountCurve, LocalDate valuationDate) {
		double fixedLegValue	= getFixedLegValue(swap, discountCurve, valuationDate);
		double floatLegValue	= getFloatLegValue(swap, forwardCurve, discountCurve, valuationDate);
		double annuity			= getFixedAnnuity(swap, discountCurve, valuationDate);
		double parRate			= annuity != 0 ? floatLegValue / (swap.getNotional() * annuity) : Double.NaN;

		return new SwapValuation(valuationDate, fixedLegValue, floatLegValue, annuity, parRate,
				getFixedAccrual(swap, valuationDate),
				getFloatAccrual(swap, forwardCurve, valuationDate));
	}

	private SwapLeg getFixedLeg(Swap swap, CurveInterface discountCurve) {
		if(swap == null)
			throw new IllegalArgumentException("No swap given.");
		if(discountCurve == null)
			throw new IllegalArgumentException("No discount curve given.");
		return new SwapLeg(swap.getFixedLegSchedule(discountCurve.getReferenceDate()), swap.getNotional(), swap.getFixedRate(), false);
	}

	private SwapLeg getFloatLeg(Swap swap, CurveInterface curve) {
		if(swap == null)
			throw new IllegalArgumentException("No swap given.");
		if(curve == null)
			throw new IllegalArgumentException("No curve given.");
		return new SwapLeg(swap.getFloatLegSchedule(curve.getReferenceDate()), swap.getNotional(), 0.0, true);
	}
}
