package net.swapcurve.marketdata.model.curves;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;

import net.swapcurve.interpolation.InterpolationMethod;
import net.swapcurve.interpolation.InterpolatorInterface;
import net.swapcurve.interpolation.TimeShiftedInterpolation;
import net.swapcurve.interpolation.ValueShiftedInterpolation;
import net.swapcurve.time.Schedule;

/**
 * A zero rate curve given by points <i>(t<sub>i</sub>, r<sub>i</sub>)</i> and an interpolation.
 *
 * A curve is immutable. It is created by a {@link CurveBuilder}, which keeps the points sorted by time
 * and fits the interpolation once when the curve is built. Unless an interpolation is attached explicitly,
 * the interpolation is fitted through the points by the builder's {@link InterpolationMethod}
 * (default {@link InterpolationMethod#LINEAR}).
 *
 * Zero rates are continuously compounded, the discount factor is <i>exp(-r(t) t)</i>.
 * The alternative reading of the zero rate as a simple rate, <i>1/(1 + r(t) t)</i>, is only available
 * via {@link #getDiscountFactorFromSimpleRate(double)}.
 */
public class Curve implements CurveInterface, Serializable {

	private static final long serialVersionUID = -1763812738405297182L;

	/**
	 * A builder (following the builder pattern) for curves.
	 */
	public static class CurveBuilder implements CurveBuilderInterface {

		private final String			name;
		private final LocalDate			referenceDate;
		private final List<Double>		times		= new ArrayList<Double>();
		private final List<Double>		zeroRates	= new ArrayList<Double>();
		private InterpolationMethod		interpolationMethod = InterpolationMethod.LINEAR;
		private InterpolatorInterface	interpolator;

		/**
		 * Build a curve with the given name and reference date.
		 *
		 * @param name The name of the curve.
		 * @param referenceDate The reference date, i.e., the date corresponding to time 0.
		 */
		public CurveBuilder(String name, LocalDate referenceDate) {
			if(referenceDate == null)
				throw new IllegalArgumentException("Curve " + name + " requires a reference date.");
			this.name = name;
			this.referenceDate = referenceDate;
		}

		/**
		 * Build a curve by cloning a given curve.
		 *
		 * @param curve A curve to be used as starting point for the new curve.
		 */
		public CurveBuilder(Curve curve) {
			this(curve.getName(), curve.getReferenceDate());
			for(int i=0; i<curve.times.length; i++) {
				times.add(curve.times[i]);
				zeroRates.add(curve.zeroRates[i]);
			}
			interpolationMethod = curve.interpolationMethod;
			if(curve.isInterpolatorAttached) interpolator = curve.interpolator;
		}

		@Override
		public Curve build() {
			double[] timesArray		= ArrayUtils.toPrimitive(times.toArray(new Double[times.size()]));
			double[] zeroRatesArray	= ArrayUtils.toPrimitive(zeroRates.toArray(new Double[zeroRates.size()]));
			return new Curve(name, referenceDate, timesArray, zeroRatesArray, interpolationMethod, interpolator);
		}

		@Override
		public CurveBuilder addPoint(double time, double zeroRate) {
			if(Double.isNaN(time) || Double.isInfinite(time) || time < 0)
				throw new IllegalArgumentException("Curve " + name + ": time (" + time + ") must be finite and non-negative");
			if(Double.isNaN(zeroRate) || Double.isInfinite(zeroRate))
				throw new IllegalArgumentException("Curve " + name + ": zero rate (" + zeroRate + ") at time " + time + " must be finite");

			int index = Collections.binarySearch(times, time);
			if(index >= 0)
				throw new IllegalArgumentException("Curve " + name + " already has a point at time " + time + " (zero rate " + zeroRates.get(index) + ")");
			index = -index - 1;

			times.add(index, time);
			zeroRates.add(index, zeroRate);

			// An attached interpolation does not know the new point
			interpolator = null;

			return this;
		}

		@Override
		public CurveBuilder setInterpolationMethod(InterpolationMethod interpolationMethod) {
			if(interpolationMethod == null)
				throw new IllegalArgumentException("Curve " + name + ": interpolationMethod must not be null");
			this.interpolationMethod = interpolationMethod;
			return this;
		}

		@Override
		public CurveBuilder setInterpolator(InterpolatorInterface interpolator) {
			this.interpolator = interpolator;
			return this;
		}
	}

	private final String				name;
	private final LocalDate				referenceDate;
	private final double[]				times;
	private final double[]				zeroRates;
	private final InterpolationMethod	interpolationMethod;
	private final InterpolatorInterface	interpolator;
	private final boolean				isInterpolatorAttached;

	private Curve(String name, LocalDate referenceDate, double[] times, double[] zeroRates, InterpolationMethod interpolationMethod, InterpolatorInterface attachedInterpolator) {
		this.name = name;
		this.referenceDate = referenceDate;
		this.times = times;
		this.zeroRates = zeroRates;
		this.interpolationMethod = interpolationMethod;

		if(attachedInterpolator != null) {
			this.interpolator = attachedInterpolator;
			this.isInterpolatorAttached = true;
		}
		else {
			this.interpolator = times.length > 0 ? interpolationMethod.getInterpolator(times, zeroRates) : null;
			this.isInterpolatorAttached = false;
		}
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public LocalDate getReferenceDate() {
		return referenceDate;
	}

	@Override
	public double getZeroRate(double maturity) {
		if(interpolator == null)
			throw new IllegalStateException("Curve " + name + " has no points.");

		return interpolator.getValue(maturity);
	}

	@Override
	public double getDiscountFactor(double maturity) {
		if(maturity <= 0) return 1.0;

		return Math.exp(-getZeroRate(maturity) * maturity);
	}

	/**
	 * Returns the discount factor obtained by reading the zero rate as a simple rate, i.e., <i>1/(1 + r(t) t)</i>.
	 * The curves built by the bootstrap carry continuously compounded rates; this method is not used for their valuation.
	 *
	 * @param maturity The maturity, measured from the reference date.
	 * @return The discount factor under simple compounding; 1.0 for maturities &le; 0.
	 */
	public double getDiscountFactorFromSimpleRate(double maturity) {
		if(maturity <= 0) return 1.0;

		return 1.0 / (1.0 + getZeroRate(maturity) * maturity);
	}

	@Override
	public double getForwardRate(double startTime, double endTime) {
		if(endTime <= startTime)
			throw new IllegalArgumentException("Curve " + name + ": endTime (" + endTime + ") must be after startTime (" + startTime + ")");

		return (getDiscountFactor(startTime) / getDiscountFactor(endTime) - 1.0) / (endTime - startTime);
	}

	/**
	 * Returns a curve with every point shifted by the given number of basis points, fitted with the same interpolation method.
	 * If an interpolation is attached (e.g. by {@link #getCloneForReferenceDate(LocalDate)}), the returned curve
	 * uses that interpolation shifted by the same amount, so the zero rate at every time moves by exactly the shift.
	 */
	@Override
	public Curve getCloneShiftedParallel(double basisPoints) {
		double shift = basisPoints / 10000.0;

		CurveBuilder builder = new CurveBuilder(name, referenceDate);
		builder.setInterpolationMethod(interpolationMethod);
		for(int i=0; i<times.length; i++) builder.addPoint(times[i], zeroRates[i] + shift);

		if(isInterpolatorAttached) builder.setInterpolator(new ValueShiftedInterpolation(interpolator, shift));

		return builder.build();
	}

	/**
	 * @return A copy of this curve, returning the same values as this curve.
	 */
	public Curve getClone() {
		return new Curve(name, referenceDate, times.clone(), zeroRates.clone(), interpolationMethod, isInterpolatorAttached ? interpolator : null);
	}

	/**
	 * Returns a builder initialised with the points and the interpolation of this curve.
	 *
	 * @return A curve builder.
	 */
	public CurveBuilder getCloneBuilder() {
		return new CurveBuilder(this);
	}

	/**
	 * Returns this curve expressed relative to a new reference date, without refitting.
	 *
	 * If the new reference date lies <i>s</i> years after the current one, the zero rate at time <i>t</i> of the
	 * returned curve is the zero rate at time <i>t + s</i> of this curve (the interpolation of this curve is wrapped
	 * in a {@link TimeShiftedInterpolation}). The points of the returned curve are the points of this curve moved
	 * to <i>t - s</i>; points at non-positive times are dropped.
	 *
	 * @param newReferenceDate The new reference date.
	 * @return The curve relative to the new reference date.
	 */
	public Curve getCloneForReferenceDate(LocalDate newReferenceDate) {
		if(interpolator == null)
			throw new IllegalStateException("Curve " + name + " has no points.");

		double shift = Schedule.getTimeFromReferenceDate(referenceDate, newReferenceDate);

		CurveBuilder builder = new CurveBuilder(name, newReferenceDate);
		builder.setInterpolationMethod(interpolationMethod);
		for(int i=0; i<times.length; i++) {
			if(times[i] - shift > 0) builder.addPoint(times[i] - shift, zeroRates[i]);
		}
		builder.setInterpolator(new TimeShiftedInterpolation(interpolator, shift));

		return builder.build();
	}

	/**
	 * @return The times of the points of this curve (sorted).
	 */
	public double[] getTimes() {
		return times.clone();
	}

	/**
	 * @return The zero rates of the points of this curve.
	 */
	public double[] getZeroRates() {
		return zeroRates.clone();
	}

	public int getNumberOfPoints() {
		return times.length;
	}

	public InterpolationMethod getInterpolationMethod() {
		return interpolationMethod;
	}

	/**
	 * @return The interpolation used by this curve (null if the curve has no points).
	 */
	public InterpolatorInterface getInterpolator() {
		return interpolator;
	}

	@Override
	public String toString() {
		return "Curve [name=" + name + ", referenceDate=" + referenceDate + ", times=" + Arrays.toString(times)
				+ ", zeroRates=" + Arrays.toString(zeroRates) + ", interpolationMethod=" + interpolationMethod
				+ (isInterpolatorAttached ? ", interpolator=" + interpolator : "") + "]";
	}
}
