package net.swapcurve.interpolation;

import java.io.Serializable;
import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;

/**
 * Natural cubic spline interpolation.
 *
 * On each interval <i>[x<sub>i</sub>, x<sub>i+1</sub>]</i> the interpolation is given by
 * <i>S<sub>i</sub>(x) = a<sub>i</sub> + b<sub>i</sub> dx + c<sub>i</sub> dx<sup>2</sup> + d<sub>i</sub> dx<sup>3</sup></i>
 * with <i>dx = x - x<sub>i</sub></i>. The coefficients <i>c</i> are obtained from the tridiagonal system of
 * the classical spline construction (solved by the Thomas algorithm) with the natural boundary condition
 * <i>S''(x<sub>0</sub>) = S''(x<sub>n-1</sub>) = 0</i>, i.e., <i>c<sub>0</sub> = c<sub>n-1</sub> = 0</i>.
 *
 * With two points the spline is the straight line through them.
 * Outside the interpolation domain the boundary values are returned (constant extrapolation).
 *
 * Optionally a point at <i>x = 0</i> carrying the value of the first point is added before fitting
 * (if the first point is positive), which gives <i>f(0) = f(x<sub>0</sub>)</i>.
 */
public class CubicSplineInterpolation implements InterpolatorInterface, Serializable {

	private static final long serialVersionUID = 4429862817466412530L;

	private final double[] points;
	private final double[] a;
	private final double[] b;
	private final double[] c;
	private final double[] d;

	/**
	 * Create a natural cubic spline through the given points.
	 *
	 * @param points The interpolation points, strictly increasing.
	 * @param values The values at the interpolation points.
	 * @param isAddZeroPoint If true and the first point is positive, the point (0, values[0]) is added before fitting.
	 */
	public CubicSplineInterpolation(double[] points, double[] values, boolean isAddZeroPoint) {
		if(points.length != values.length)
			throw new IllegalArgumentException("Length of points (" + points.length + ") != length of values (" + values.length + ")");
		if(points.length < 2)
			throw new IllegalArgumentException("Cubic spline requires at least 2 points (" + points.length + " given)");
		for(int i=1; i<points.length; i++)
			if(points[i] <= points[i-1])
				throw new IllegalArgumentException("Points must be strictly increasing: point " + i + " (" + points[i] + ") <= point " + (i-1) + " (" + points[i-1] + ")");

		if(isAddZeroPoint && points[0] > 0) {
			this.points	= ArrayUtils.insert(0, points, 0.0);
			this.a		= ArrayUtils.insert(0, values, values[0]);
		}
		else {
			this.points	= points.clone();
			this.a		= values.clone();
		}

		int n = this.points.length;
		b = new double[n];
		c = new double[n];
		d = new double[n];

		fit();
	}

	/**
	 * Create a natural cubic spline through the given points (without additional zero point).
	 *
	 * @param points The interpolation points, strictly increasing.
	 * @param values The values at the interpolation points.
	 */
	public CubicSplineInterpolation(double[] points, double[] values) {
		this(points, values, false);
	}

	private void fit() {
		int n = points.length;

		if(n == 2) {
			b[0] = (a[1] - a[0]) / (points[1] - points[0]);
			return;
		}

		double[] h = new double[n-1];
		for(int i=0; i<n-1; i++) h[i] = points[i+1] - points[i];

		double[] alpha = new double[n-1];
		for(int i=1; i<n-1; i++) {
			alpha[i] = 3.0 / h[i] * (a[i+1] - a[i]) - 3.0 / h[i-1] * (a[i] - a[i-1]);
		}

		// Forward sweep of the Thomas algorithm, natural boundary: l[0] = 1, mu[0] = z[0] = 0
		double[] l		= new double[n];
		double[] mu		= new double[n];
		double[] z		= new double[n];
		l[0] = 1.0;
		for(int i=1; i<n-1; i++) {
			l[i]	= 2.0 * (points[i+1] - points[i-1]) - h[i-1] * mu[i-1];
			mu[i]	= h[i] / l[i];
			z[i]	= (alpha[i] - h[i-1] * z[i-1]) / l[i];
		}

		// Back substitution, c[n-1] = 0
		c[n-1] = 0.0;
		for(int j=n-2; j>=0; j--) {
			c[j] = z[j] - mu[j] * c[j+1];
			b[j] = (a[j+1] - a[j]) / h[j] - h[j] * (c[j+1] + 2.0 * c[j]) / 3.0;
			d[j] = (c[j+1] - c[j]) / (3.0 * h[j]);
		}
	}

	@Override
	public double getValue(double x) {
		int n = points.length;

		if(x <= points[0])		return a[0];
		if(x >= points[n-1])	return a[n-1];

		int i = getIntervalIndex(x);
		double dx = x - points[i];
		return a[i] + dx * (b[i] + dx * (c[i] + dx * d[i]));
	}

	/**
	 * Returns the second derivative of the spline. It is zero at and beyond the boundary of the
	 * interpolation domain (natural boundary condition).
	 *
	 * @param x The point at which the second derivative is evaluated.
	 * @return The second derivative of the spline at <code>x</code>.
	 */
	public double getSecondDerivative(double x) {
		int n = points.length;

		if(x <= points[0] || x >= points[n-1]) return 0.0;

		int i = getIntervalIndex(x);
		double dx = x - points[i];
		return 2.0 * c[i] + 6.0 * d[i] * dx;
	}

	/*
	 * Index i with points[i] <= x < points[i+1], for x inside the domain.
	 */
	private int getIntervalIndex(double x) {
		int index = Arrays.binarySearch(points, x);
		if(index >= 0) return index;
		return -index - 2;
	}

	/**
	 * @return The points of the spline, including an added zero point.
	 */
	public double[] getPoints() {
		return points.clone();
	}

	@Override
	public String toString() {
		return "CubicSplineInterpolation [points=" + Arrays.toString(points) + ", values=" + Arrays.toString(a) + "]";
	}
}
