package net.swapcurve.interpolation;

import java.io.Serializable;

/**
 * An interpolation evaluating a given interpolation at a shifted point, i.e.,
 * <i>f(x) = g(x + shift)</i>.
 *
 * Used to re-express a curve fitted relative to an old reference date in terms of a later
 * reference date without refitting: if the new reference date lies <i>s</i> years after the old one,
 * time <i>t</i> on the new curve corresponds to time <i>t + s</i> on the old curve.
 */
public class TimeShiftedInterpolation implements InterpolatorInterface, Serializable {

	private static final long serialVersionUID = 1942857305938710291L;

	private final InterpolatorInterface	baseInterpolation;
	private final double				shift;

	/**
	 * @param baseInterpolation The interpolation fitted on the points of the unshifted curve.
	 * @param shift The shift added to the argument before evaluating the base interpolation.
	 */
	public TimeShiftedInterpolation(InterpolatorInterface baseInterpolation, double shift) {
		if(baseInterpolation == null)
			throw new IllegalArgumentException("baseInterpolation must not be null");
		this.baseInterpolation = baseInterpolation;
		this.shift = shift;
	}

	@Override
	public double getValue(double x) {
		return baseInterpolation.getValue(x + shift);
	}

	public InterpolatorInterface getBaseInterpolation() {
		return baseInterpolation;
	}

	public double getShift() {
		return shift;
	}

	@Override
	public String toString() {
		return "TimeShiftedInterpolation [shift=" + shift + ", baseInterpolation=" + baseInterpolation + "]";
	}
}
