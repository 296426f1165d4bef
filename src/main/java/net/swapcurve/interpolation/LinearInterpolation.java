package net.swapcurve.interpolation;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Piecewise linear interpolation with constant extrapolation.
 *
 * Outside <i>[x<sub>0</sub>, x<sub>n-1</sub>]</i> the value of the nearest boundary point is returned,
 * the slope is never extrapolated. With a single point the interpolation is constant.
 */
public class LinearInterpolation implements InterpolatorInterface, Serializable {

	private static final long serialVersionUID = -2342789273501720143L;

	private final double[] points;
	private final double[] values;

	/**
	 * Create a linear interpolation through the given points.
	 *
	 * @param points The interpolation points, strictly increasing.
	 * @param values The values at the interpolation points.
	 */
	public LinearInterpolation(double[] points, double[] values) {
		if(points.length != values.length)
			throw new IllegalArgumentException("Length of points (" + points.length + ") != length of values (" + values.length + ")");
		if(points.length == 0)
			throw new IllegalArgumentException("Linear interpolation requires at least one point.");
		for(int i=1; i<points.length; i++)
			if(points[i] <= points[i-1])
				throw new IllegalArgumentException("Points must be strictly increasing: point " + i + " (" + points[i] + ") <= point " + (i-1) + " (" + points[i-1] + ")");

		this.points = points.clone();
		this.values = values.clone();
	}

	@Override
	public double getValue(double x) {
		int n = points.length;

		if(x <= points[0])		return values[0];
		if(x >= points[n-1])	return values[n-1];

		// Interval i with points[i] < x <= points[i+1]; knots are few, a scan is sufficient
		int i = 0;
		while(points[i+1] < x) i++;

		if(x == points[i+1]) return values[i+1];

		double weight = (x - points[i]) / (points[i+1] - points[i]);
		return values[i] + weight * (values[i+1] - values[i]);
	}

	public double[] getPoints() {
		return points.clone();
	}

	public double[] getValues() {
		return values.clone();
	}

	@Override
	public String toString() {
		return "LinearInterpolation [points=" + Arrays.toString(points) + ", values=" + Arrays.toString(values) + "]";
	}
}
