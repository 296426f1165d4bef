package net.swapcurve.interpolation;

import static org.junit.Assert.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.Test;

public class TimeShiftedInterpolationTest {

	@Test
	public void testValueIsTakenAtShiftedTime() {
		InterpolatorInterface baseInterpolation = mock(InterpolatorInterface.class);
		when(baseInterpolation.getValue(2.5)).thenReturn(0.0325);

		InterpolatorInterface interpolation = new TimeShiftedInterpolation(baseInterpolation, 0.5);

		assertEquals(0.0325, interpolation.getValue(2.0), 0.0);
		verify(baseInterpolation).getValue(2.5);
	}

	@Test
	public void testShiftOfLinearInterpolation() {
		InterpolatorInterface baseInterpolation = new LinearInterpolation(new double[] { 1.0, 2.0 }, new double[] { 0.01, 0.02 });
		InterpolatorInterface interpolation = new TimeShiftedInterpolation(baseInterpolation, 0.25);

		assertEquals(0.015, interpolation.getValue(1.25), 1E-15);
		assertEquals(0.02, interpolation.getValue(1.75), 0.0);
		assertEquals(0.01, interpolation.getValue(0.0), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingBaseInterpolationIsRejected() {
		new TimeShiftedInterpolation(null, 0.25);
	}
}
