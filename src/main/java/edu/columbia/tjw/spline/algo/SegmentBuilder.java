/*
 * Copyright 2014 Tyler Ward.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.columbia.tjw.spline.algo;

import edu.columbia.tjw.spline.DegenerateIntervalException;
import edu.columbia.tjw.spline.QuadraticCoefficients;
import edu.columbia.tjw.spline.SchumakerSpline;
import edu.columbia.tjw.spline.SplineSettings;
import edu.columbia.tjw.spline.SplineValidationException;
import edu.columbia.tjw.spline.data.PointSequence;
import edu.columbia.tjw.spline.util.LogUtil;
import edu.columbia.tjw.spline.util.MathFunctions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the knots and quadratic coefficients of a Schumaker spline from data
 * points and the slopes at those points.
 *
 * Each data interval is handled on its own by fitInterval. If one quadratic
 * can match both end values and both end slopes it is used as is, otherwise a
 * knot is inserted and two quadratics, sharing value and slope at that knot,
 * are used instead.
 *
 * @author tyler
 */
public final class SegmentBuilder
{
    private static final Logger LOG = LogUtil.getLogger(SegmentBuilder.class);

    private final SplineSettings _settings;

    public SegmentBuilder()
    {
        this(SplineSettings.getDefault());
    }

    public SegmentBuilder(final SplineSettings settings_)
    {
        if (null == settings_)
        {
            throw new NullPointerException("Settings cannot be null.");
        }

        _settings = settings_;
    }

    public SplineSettings getSettings()
    {
        return _settings;
    }

    public SchumakerSpline build(final PointSequence points_, final double[] slopes_)
    {
        final int n = points_.size();

        if (null == slopes_)
        {
            throw new SplineValidationException("Slopes must not be null.");
        }
        if (slopes_.length != n)
        {
            throw new SplineValidationException("Slope count mismatch: " + slopes_.length + " != " + n);
        }

        for (int i = 0; i < n; i++)
        {
            if (!MathFunctions.isWellDefined(slopes_[i]))
            {
                throw new SplineValidationException("Slopes must be finite: s[" + i + "] = " + slopes_[i]);
            }
        }

        final double[] knots = new double[(2 * n) - 1];
        final List<QuadraticCoefficients> coefficients = new ArrayList<>((2 * n) - 2);
        int knotCount = 0;
        int splitCount = 0;

        for (int i = 0; i < n - 1; i++)
        {
            final IntervalFit fit = fitInterval(i, points_.getX(i), points_.getX(i + 1), points_.getY(i),
                    points_.getY(i + 1), slopes_[i], slopes_[i + 1]);

            for (int k = 0; k < fit.getPieceCount(); k++)
            {
                knots[knotCount++] = fit.getKnot(k);
                coefficients.add(fit.getCoefficients(k));
            }

            if (fit.getPlacement().isSplit())
            {
                splitCount++;
            }
        }

        knots[knotCount++] = points_.getLastX();

        final SchumakerSpline output = new SchumakerSpline(Arrays.copyOf(knots, knotCount), coefficients);

        if (_settings.isLogSummary())
        {
            LOG.info("Built spline over " + n + " points: " + knotCount + " knots, " + splitCount
                    + " subdivided intervals.");
        }

        return output;
    }

    /**
     * Fits a single data interval. This is a pure function of its arguments
     * (and the degenerate tolerance).
     *
     * @param index_ Index of the interval, used for error reporting only
     * @param x0_ Left abscissa
     * @param x1_ Right abscissa, strictly greater than x0_
     * @param y0_ Value at x0_
     * @param y1_ Value at x1_
     * @param s0_ Slope at x0_
     * @param s1_ Slope at x1_
     * @return The single or split fit for this interval
     * @throws DegenerateIntervalException if the interval has no width, or the
     * inserted knot leaves a piece of (nearly) no width
     */
    public IntervalFit fitInterval(final int index_, final double x0_, final double x1_, final double y0_,
            final double y1_, final double s0_, final double s1_)
    {
        final double h = x1_ - x0_;

        if (!(h > 0.0))
        {
            throw new DegenerateIntervalException("Interval has no width", index_, h);
        }

        final double secant = (y1_ - y0_) / h;
        final KnotPlacement placement = KnotPlacement.select(s0_, s1_, secant);

        if (!placement.isSplit())
        {
            final QuadraticCoefficients single = new QuadraticCoefficients(y0_, s0_, (s1_ - s0_) / (2.0 * h));
            return new IntervalFit.Single(x0_, single);
        }

        final double knot = placement.locateKnot(x0_, x1_, s0_, s1_, secant);
        final double alpha = knot - x0_;
        final double beta = x1_ - knot;
        final double tolerance = _settings.getDegenerateTolerance();

        if (MathFunctions.isNegligible(alpha, h, tolerance))
        {
            throw new DegenerateIntervalException("Inserted knot " + knot + " too close to left end " + x0_
                    + " (" + placement + ")", index_, alpha);
        }
        if (MathFunctions.isNegligible(beta, h, tolerance))
        {
            throw new DegenerateIntervalException("Inserted knot " + knot + " too close to right end " + x1_
                    + " (" + placement + ")", index_, beta);
        }

        final double sBar = ((2.0 * (y1_ - y0_)) - ((alpha * s0_) + (beta * s1_))) / h;

        final double a1 = y0_;
        final double b1 = s0_;
        final double c1 = (sBar - s0_) / (2.0 * alpha);

        final double a2 = a1 + (alpha * b1) + ((alpha * alpha) * c1);
        final double b2 = sBar;
        final double c2 = (s1_ - sBar) / (2.0 * beta);

        final QuadraticCoefficients left = new QuadraticCoefficients(a1, b1, c1);
        final QuadraticCoefficients right = new QuadraticCoefficients(a2, b2, c2);

        if (LOG.isLoggable(Level.FINE))
        {
            LOG.fine("Interval[" + index_ + "] split at " + knot + " (" + placement + "), slope at knot " + sBar);
        }

        final double endValue = right.value(beta);

        if (MathFunctions.doubleCompareRounded(endValue, y1_, MathFunctions.SQRT_EPSILON) != 0)
        {
            LOG.warning("Interval[" + index_ + "] right piece misses its end value: " + endValue + " != " + y1_);
        }

        return new IntervalFit.Split(placement, x0_, knot, left, right);
    }

}
