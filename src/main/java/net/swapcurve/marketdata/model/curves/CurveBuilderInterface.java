package net.swapcurve.marketdata.model.curves;

import net.swapcurve.interpolation.InterpolationMethod;
import net.swapcurve.interpolation.InterpolatorInterface;

/**
 * Interface of builders which allow to build curve objects by successively adding
 * points.
 *
 * Building a curve is a two phase process: points and the interpolation are collected
 * by the builder, then {@link #build()} creates an immutable curve.
 */
public interface CurveBuilderInterface {

	/**
	 * Build the curve. The method returns the curve object.
	 * Later changes to the builder do not affect curves built before.
	 *
	 * @return The curve given by the points and the interpolation of this builder.
	 */
	Curve build();

	/**
	 * Add a point to the curve.
	 *
	 * @param time The time of the corresponding point.
	 * @param zeroRate The zero rate of the corresponding point.
	 * @return A self reference to this curve build object.
	 */
	CurveBuilderInterface addPoint(double time, double zeroRate);

	/**
	 * Set the method used to fit the interpolation through the points.
	 *
	 * @param interpolationMethod The interpolation method.
	 * @return A self reference to this curve build object.
	 */
	CurveBuilderInterface setInterpolationMethod(InterpolationMethod interpolationMethod);

	/**
	 * Attach an interpolation which replaces the fit through the points.
	 * Adding a point afterwards removes the attached interpolation.
	 *
	 * @param interpolator The interpolation used by the curve.
	 * @return A self reference to this curve build object.
	 */
	CurveBuilderInterface setInterpolator(InterpolatorInterface interpolator);
}
