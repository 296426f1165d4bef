package net.swapcurve.interpolation;

/**
 * Interface of a one dimensional interpolation <i>x &mapsto; f(x)</i>.
 *
 * Implementations are fitted on construction and are pure functions afterwards.
 */
public interface InterpolatorInterface {

	/**
	 * Returns the interpolated value at <code>x</code>.
	 *
	 * @param x The point at which the interpolation is evaluated.
	 * @return The interpolated value.
	 */
	double getValue(double x);
}
