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
package edu.columbia.tjw.spline;

import edu.columbia.tjw.spline.algo.SegmentBuilder;
import edu.columbia.tjw.spline.algo.SlopeEstimator;
import edu.columbia.tjw.spline.data.PointSequence;
import edu.columbia.tjw.spline.symbolic.PiecewiseExpression;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;

/**
 * Shape preserving quadratic spline interpolation, after L. L. Schumaker, "On
 * Shape Preserving Quadratic Spline Interpolation", SIAM J. Numer. Anal.
 * (1983).
 *
 * The result passes through every data point, and is co-monotone and
 * co-convex with the data provided the slopes (given or estimated) are
 * consistent with it.
 *
 * This class holds no mutable state and may be shared between threads.
 *
 * @author tyler
 */
public final class SchumakerInterpolator implements UnivariateInterpolator
{
    private final SplineSettings _settings;
    private final SegmentBuilder _builder;

    public SchumakerInterpolator()
    {
        this(SplineSettings.getDefault());
    }

    public SchumakerInterpolator(final SplineSettings settings_)
    {
        _settings = settings_;
        _builder = new SegmentBuilder(settings_);
    }

    public SplineSettings getSettings()
    {
        return _settings;
    }

    /**
     * Interpolate, estimating the slopes from the data.
     *
     * @param x_ Abscissas, strictly ascending
     * @param y_ Values
     * @return The spline
     */
    @Override
    public SchumakerSpline interpolate(final double[] x_, final double[] y_)
    {
        return interpolate(x_, y_, null);
    }

    /**
     * Interpolate with the given slopes.
     *
     * @param x_ Abscissas, strictly ascending
     * @param y_ Values
     * @param slopes_ Slopes at each point, or null to estimate them
     * @return The spline
     */
    public SchumakerSpline interpolate(final double[] x_, final double[] y_, final double[] slopes_)
    {
        final PointSequence points = new PointSequence(x_, y_, _settings.isCopyInputs());
        return interpolate(points, slopes_);
    }

    public SchumakerSpline interpolate(final PointSequence points_, final double[] slopes_)
    {
        final double[] slopes;

        if (null == slopes_)
        {
            slopes = SlopeEstimator.SINGLETON.estimate(points_);
        }
        else
        {
            slopes = slopes_;
        }

        return _builder.build(points_, slopes);
    }

    public PiecewiseExpression interpolatePiecewise(final double[] x_, final double[] y_, final double[] slopes_)
    {
        return interpolate(x_, y_, slopes_).toPiecewise();
    }

    public SplineResult build(final double[] x_, final double[] y_, final double[] slopes_, final OutputMode mode_)
    {
        if (null == mode_)
        {
            throw new NullPointerException("Mode cannot be null.");
        }

        return SplineResult.of(interpolate(x_, y_, slopes_), mode_);
    }

}
