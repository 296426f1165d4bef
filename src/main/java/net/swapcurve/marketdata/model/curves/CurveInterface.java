package net.swapcurve.marketdata.model.curves;

import java.time.LocalDate;

/**
 * The interface which is implemented by a zero rate curve.
 *
 * Times are measured in years (ACT/ACT ISDA) from the curve's reference date.
 * Zero rates are continuously compounded, i.e., the discount factor of time <i>t</i> is
 * <i>exp(-r(t) t)</i>.
 */
public interface CurveInterface {

	/**
	 * @return The name of this curve.
	 */
	String getName();

	/**
	 * @return The date corresponding to time 0.
	 */
	LocalDate getReferenceDate();

	/**
	 * Returns the (continuously compounded) zero rate for the given maturity.
	 *
	 * @param maturity The maturity, measured from the reference date.
	 * @return The zero rate.
	 */
	double getZeroRate(double maturity);

	/**
	 * Returns the discount factor <i>exp(-r(t) t)</i> for the given maturity; 1.0 for maturities &le; 0.
	 *
	 * @param maturity The maturity, measured from the reference date.
	 * @return The discount factor.
	 */
	double getDiscountFactor(double maturity);

	/**
	 * Returns the simple forward rate <i>(df(t<sub>1</sub>)/df(t<sub>2</sub>) - 1)/(t<sub>2</sub>-t<sub>1</sub>)</i>.
	 *
	 * @param startTime The start time t<sub>1</sub>.
	 * @param endTime The end time t<sub>2</sub>, has to be after the start time.
	 * @return The forward rate.
	 */
	double getForwardRate(double startTime, double endTime);

	/**
	 * Returns a curve with every zero rate shifted by the given number of basis points.
	 *
	 * @param basisPoints The shift in basis points.
	 * @return The shifted curve.
	 */
	CurveInterface getCloneShiftedParallel(double basisPoints);
}
