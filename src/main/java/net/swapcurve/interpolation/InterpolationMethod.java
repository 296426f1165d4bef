package net.swapcurve.interpolation;

/**
 * The interpolation methods a curve can be fitted with.
 */
public enum InterpolationMethod {
	/** Piecewise linear, constant extrapolation. */
	LINEAR {
		@Override
		public InterpolatorInterface getInterpolator(double[] points, double[] values) {
			return new LinearInterpolation(points, values);
		}
	},
	/** Natural cubic spline, constant extrapolation. */
	CUBIC_SPLINE {
		@Override
		public InterpolatorInterface getInterpolator(double[] points, double[] values) {
			return new CubicSplineInterpolation(points, values, false);
		}
	},
	/** Natural cubic spline through an additional point (0, values[0]), i.e., f(0) = f(first point). */
	CUBIC_SPLINE_FLAT_AT_ZERO {
		@Override
		public InterpolatorInterface getInterpolator(double[] points, double[] values) {
			return new CubicSplineInterpolation(points, values, true);
		}
	};

	/**
	 * Fit an interpolation of this method through the given points.
	 *
	 * @param points The interpolation points, strictly increasing.
	 * @param values The values at the interpolation points.
	 * @return The fitted interpolation.
	 */
	public abstract InterpolatorInterface getInterpolator(double[] points, double[] values);
}
