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

import edu.columbia.tjw.spline.data.PointSequence;
import edu.columbia.tjw.spline.util.LogUtil;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Estimates the derivative at each data point when none are supplied.
 *
 * Interior slopes are a chord-length weighted average of the two neighbouring
 * secants when those secants have the same sign. Where the data changes
 * direction (or is flat on either side) the slope is zero, so that the point
 * becomes a local extremum of the interpolant. End slopes are extrapolated
 * from the first (last) secant and the neighbouring slope.
 *
 * @author tyler
 */
public final class SlopeEstimator
{
    private static final Logger LOG = LogUtil.getLogger(SlopeEstimator.class);

    /**
     * The singleton for this class. It has no free parameters, so no need for
     * more than one.
     */
    public static final SlopeEstimator SINGLETON = new SlopeEstimator();

    private SlopeEstimator()
    {
    }

    public double[] estimate(final PointSequence points_)
    {
        final int n = points_.size();
        final int intervalCount = n - 1;

        final double[] chord = new double[intervalCount];
        final double[] delta = new double[intervalCount];

        for (int i = 0; i < intervalCount; i++)
        {
            chord[i] = points_.getChordLength(i);
            delta[i] = points_.getSecant(i);
        }

        final double[] slopes = new double[n];

        for (int i = 1; i < n - 1; i++)
        {
            slopes[i] = interiorSlope(chord[i - 1], delta[i - 1], chord[i], delta[i]);
        }

        //Order matters when n == 2, the last slope sees the updated first slope.
        slopes[0] = endpointSlope(delta[0], slopes[1]);
        slopes[n - 1] = endpointSlope(delta[n - 2], slopes[n - 2]);

        if (LOG.isLoggable(Level.FINE))
        {
            if (slopes[0] * delta[0] < 0.0 || slopes[n - 1] * delta[n - 2] < 0.0)
            {
                LOG.fine("Extrapolated end slope opposes the end secant: " + slopes[0] + " vs " + delta[0] + ", "
                        + slopes[n - 1] + " vs " + delta[n - 2]);
            }

            LOG.fine("Estimated slopes: " + Arrays.toString(slopes));
        }

        return slopes;
    }

    /**
     * Slope at an interior point, given the chord length and secant of the
     * interval to its left and to its right.
     *
     * @param leftChord_
     * @param leftSecant_
     * @param rightChord_
     * @param rightSecant_
     * @return The weighted secant average, or 0.0 at a local extremum
     */
    public static double interiorSlope(final double leftChord_, final double leftSecant_, final double rightChord_,
            final double rightSecant_)
    {
        if (!(leftSecant_ * rightSecant_ > 0.0))
        {
            return 0.0;
        }

        return ((leftChord_ * leftSecant_) + (rightChord_ * rightSecant_)) / (leftChord_ + rightChord_);
    }

    public static double endpointSlope(final double secant_, final double neighbourSlope_)
    {
        return ((3.0 * secant_) - neighbourSlope_) / 2.0;
    }

}
