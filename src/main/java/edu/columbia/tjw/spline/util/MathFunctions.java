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
package edu.columbia.tjw.spline.util;

import org.apache.commons.math3.util.FastMath;

/**
 *
 * @author tyler
 */
public final class MathFunctions
{
    public static final double EPSILON = Math.ulp(1.0);

    // SQRT of the difference between 1.0 and the smallest value larger than 1.0.
    public static final double SQRT_EPSILON = Math.sqrt(EPSILON);

    private MathFunctions()
    {
    }

    public static boolean isWellDefined(final double input_)
    {
        return !(Double.isNaN(input_) || Double.isInfinite(input_));
    }

    /**
     * Euclidean length of the segment with the given extents.
     *
     * @param dx_ Horizontal extent
     * @param dy_ Vertical extent
     * @return sqrt(dx^2 + dy^2)
     */
    public static double chordLength(final double dx_, final double dy_)
    {
        return FastMath.sqrt((dx_ * dx_) + (dy_ * dy_));
    }

    /**
     * Is the width too small (relative to the enclosing scale) to divide by.
     *
     * @param width_ The width to check, expected to be non-negative
     * @param scale_ The width of the enclosing interval
     * @param relTolerance_ The relative tolerance, 0.0 rejects only widths
     * that are exactly zero (or negative)
     * @return true if width_ is at most relTolerance_ * scale_
     */
    public static boolean isNegligible(final double width_, final double scale_, final double relTolerance_)
    {
        if (!(width_ > 0.0))
        {
            return true;
        }

        return width_ <= relTolerance_ * Math.abs(scale_);
    }

    /**
     * Compares two doubles, treating differences typical of rounding error as
     * equality.
     *
     * Both numbers must be well defined (not infinite, not NaN).
     *
     * @param a_
     * @param b_
     * @param tolerance_ Absolute floor of the tolerance, relative tolerance is
     * SQRT_EPSILON
     * @return +1 if a_ &gt; b_, -1 if b_ &gt; a_, and 0 if they are too close
     * to tell.
     */
    public static int doubleCompareRounded(final double a_, final double b_, final double tolerance_)
    {
        if (!isWellDefined(a_))
        {
            throw new IllegalArgumentException("Invalid starting value: " + a_);
        }
        if (!isWellDefined(b_))
        {
            throw new IllegalArgumentException("Invalid ending value: " + b_);
        }

        final double diff = a_ - b_;
        final double norm = Math.max(Math.abs(a_), Math.abs(b_));
        final double allowed = Math.max(tolerance_, norm * SQRT_EPSILON);

        if (diff > allowed)
        {
            return 1;
        }
        else if (diff < -allowed)
        {
            return -1;
        }
        else
        {
            return 0;
        }
    }

}
