package edu.columbia.tjw.spline.algo;

import edu.columbia.tjw.spline.DegenerateIntervalException;
import edu.columbia.tjw.spline.QuadraticCoefficients;
import edu.columbia.tjw.spline.SchumakerSpline;
import edu.columbia.tjw.spline.SplineSettings;
import edu.columbia.tjw.spline.SplineValidationException;
import edu.columbia.tjw.spline.data.PointSequence;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SegmentBuilderTest
{
    private static final double TOLERANCE = 1.0e-12;

    private final SegmentBuilder _builder = new SegmentBuilder();

    @Test
    void testSingleQuadratic()
    {
        final IntervalFit fit = _builder.fitInterval(0, 0.0, 1.0, 0.0, 1.0, 0.5, 1.5);

        Assertions.assertTrue(fit instanceof IntervalFit.Single);
        Assertions.assertEquals(KnotPlacement.NONE, fit.getPlacement());
        Assertions.assertEquals(1, fit.getPieceCount());
        Assertions.assertEquals(0.0, fit.getKnot(0));
        Assertions.assertEquals(new QuadraticCoefficients(0.0, 0.5, 0.5), fit.getCoefficients(0));

        //Matches both end values and both end slopes.
        final QuadraticCoefficients c = fit.getCoefficients(0);
        Assertions.assertEquals(1.0, c.value(1.0), TOLERANCE);
        Assertions.assertEquals(1.5, c.derivative(1.0), TOLERANCE);
    }

    @Test
    void testPerturbedSlopeSplits()
    {
        final IntervalFit fit = _builder.fitInterval(0, 0.0, 1.0, 0.0, 1.0, 0.5, 1.6);

        Assertions.assertTrue(fit instanceof IntervalFit.Split);
        Assertions.assertEquals(KnotPlacement.LEFT_WEIGHTED, fit.getPlacement());
        Assertions.assertEquals(2, fit.getPieceCount());

        final double knot = ((IntervalFit.Split) fit).getInsertedKnot();
        Assertions.assertEquals(knot, fit.getKnot(1));

        final QuadraticCoefficients left = fit.getCoefficients(0);
        final QuadraticCoefficients right = fit.getCoefficients(1);
        final double alpha = knot;
        final double beta = 1.0 - knot;

        Assertions.assertEquals(0.0, left.value(0.0));
        Assertions.assertEquals(0.5, left.derivative(0.0));
        Assertions.assertEquals(left.value(alpha), right.getA(), TOLERANCE);
        Assertions.assertEquals(left.derivative(alpha), right.getB(), TOLERANCE);
        Assertions.assertEquals(1.0, right.value(beta), TOLERANCE);
        Assertions.assertEquals(1.6, right.derivative(beta), TOLERANCE);
    }

    @Test
    void testMidpointSplit()
    {
        final IntervalFit fit = _builder.fitInterval(3, 2.0, 4.0, 1.0, 2.0, 2.0, 3.0);

        Assertions.assertEquals(KnotPlacement.MIDPOINT, fit.getPlacement());
        Assertions.assertEquals(3.0, fit.getKnot(1));

        final QuadraticCoefficients right = fit.getCoefficients(1);
        Assertions.assertEquals(2.0, right.value(1.0), TOLERANCE);
        Assertions.assertEquals(3.0, right.derivative(1.0), TOLERANCE);
    }

    @Test
    void testBuildKnots()
    {
        final PointSequence points = new PointSequence(new double[]{0.0, 1.0, 3.0, 4.0, 6.0},
                new double[]{0.0, 0.5, 0.6, 1.0, 1.1});
        final double[] slopes = SlopeEstimator.SINGLETON.estimate(points);
        final SchumakerSpline spline = _builder.build(points, slopes);

        final double[] expected = new double[]{0.0, 2.0 / 3.0, 1.0, 2.0, 3.0, 3.5, 4.0, 14.0 / 3.0, 6.0};
        Assertions.assertArrayEquals(expected, spline.getKnots(), TOLERANCE);
        Assertions.assertEquals(8, spline.getPieceCount());

        Assertions.assertEquals(0.0, spline.getCoefficients(0).getA());
        Assertions.assertEquals(slopes[0], spline.getCoefficients(0).getB());
        Assertions.assertEquals(-0.1082897292152561, spline.getCoefficients(0).getC(), TOLERANCE);
        Assertions.assertEquals(0.6, spline.getCoefficients(4).getA());
        Assertions.assertEquals(0.4551825343348892, spline.getCoefficients(4).getC(), TOLERANCE);
    }

    @Test
    void testSlopeMismatch()
    {
        final PointSequence points = new PointSequence(new double[]{0.0, 1.0, 2.0}, new double[]{0.0, 1.0, 0.0});

        Assertions.assertThrows(SplineValidationException.class,
                () -> _builder.build(points, new double[]{1.0, 0.0}));
        Assertions.assertThrows(SplineValidationException.class,
                () -> _builder.build(points, new double[]{1.0, Double.NaN, 0.0}));
        Assertions.assertThrows(SplineValidationException.class, () -> _builder.build(points, null));
    }

    @Test
    void testDegenerateKnot()
    {
        //Right slope a hair off the secant puts the knot right next to the left end.
        final DegenerateIntervalException exc = Assertions.assertThrows(DegenerateIntervalException.class,
                () -> _builder.fitInterval(4, 0.0, 1.0, 0.0, 1.0, 0.0, 1.0 + 1.0e-14));

        Assertions.assertEquals(4, exc.getIntervalIndex());
        Assertions.assertTrue(exc.getWidth() < 1.0e-12);
    }

    @Test
    void testDegenerateToleranceSetting()
    {
        final SplineSettings settings = new SplineSettings.SplineSettingsBuilder()
                .setDegenerateTolerance(0.0).build();
        final SegmentBuilder lenient = new SegmentBuilder(settings);
        final IntervalFit fit = lenient.fitInterval(0, 0.0, 1.0, 0.0, 1.0, 0.0, 1.0 + 1.0e-14);

        Assertions.assertEquals(KnotPlacement.RIGHT_WEIGHTED, fit.getPlacement());
        Assertions.assertTrue(fit.getKnot(1) > 0.0);

        final SplineSettings strict = new SplineSettings.SplineSettingsBuilder()
                .setDegenerateTolerance(0.1).build();
        Assertions.assertThrows(DegenerateIntervalException.class,
                () -> new SegmentBuilder(strict).fitInterval(0, 0.0, 1.0, 0.0, 1.0, 0.4, 1.05));
    }

    @Test
    void testZeroWidthInterval()
    {
        Assertions.assertThrows(DegenerateIntervalException.class,
                () -> _builder.fitInterval(0, 1.0, 1.0, 0.0, 1.0, 0.0, 0.0));
    }
}
