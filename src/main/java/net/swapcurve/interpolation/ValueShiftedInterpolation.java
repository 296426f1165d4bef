package net.swapcurve.interpolation;

import java.io.Serializable;

/**
 * An interpolation adding a constant to the values of a given interpolation, i.e.,
 * <i>f(x) = g(x) + shift</i>.
 *
 * Used for the parallel shift of a curve whose interpolation is not fitted through its own points.
 */
public class ValueShiftedInterpolation implements InterpolatorInterface, Serializable {

	private static final long serialVersionUID = -2287314496751207815L;

	private final InterpolatorInterface	baseInterpolation;
	private final double				shift;

	/**
	 * @param baseInterpolation The interpolation to shift.
	 * @param shift The shift added to the values of the base interpolation.
	 */
	public ValueShiftedInterpolation(InterpolatorInterface baseInterpolation, double shift) {
		if(baseInterpolation == null)
			throw new IllegalArgumentException("baseInterpolation must not be null");
		this.baseInterpolation = baseInterpolation;
		this.shift = shift;
	}

	@Override
	public double getValue(double x) {
		return baseInterpolation.getValue(x) + shift;
	}

	public InterpolatorInterface getBaseInterpolation() {
		return baseInterpolation;
	}

	public double getShift() {
		return shift;
	}

	@Override
	public String toString() {
		return "ValueShiftedInterpolation [shift=" + shift + ", baseInterpolation=" + baseInterpolation + "]";
	}
}
