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

/**
 * How an interval is handled: left as a single quadratic, or split at an
 * inserted knot whose position depends on how the end slopes compare to the
 * secant.
 *
 * @author tyler
 */
public enum KnotPlacement
{
    /**
     * The mean of the end slopes equals the secant, one quadratic fits.
     */
    NONE,
    /**
     * Both end slopes on the same side of the secant (or on it), split at the
     * midpoint.
     */
    MIDPOINT,
    /**
     * Right slope is strictly closer to the secant, knot sits in the left half.
     */
    RIGHT_WEIGHTED,
    /**
     * Left slope is closer (or tied), knot sits in the right half.
     */
    LEFT_WEIGHTED;

    /**
     * Picks the construction for one interval. The tests are applied in a
     * fixed order and must stay that way: exact equality first, then the
     * non-strict same-side test, then the strict closeness comparison.
     *
     * @param leftSlope_ Slope at the left end
     * @param rightSlope_ Slope at the right end
     * @param secant_ Secant slope of the interval
     * @return The placement to use
     */
    public static KnotPlacement select(final double leftSlope_, final double rightSlope_, final double secant_)
    {
        if ((leftSlope_ + rightSlope_) / 2.0 == secant_)
        {
            return NONE;
        }

        final double leftDiff = leftSlope_ - secant_;
        final double rightDiff = rightSlope_ - secant_;

        if (leftDiff * rightDiff >= 0.0)
        {
            return MIDPOINT;
        }
        if (Math.abs(rightDiff) < Math.abs(leftDiff))
        {
            return RIGHT_WEIGHTED;
        }

        return LEFT_WEIGHTED;
    }

    /**
     * Position of the inserted knot inside [x0_, x1_].
     *
     * @param x0_ Left end of the interval
     * @param x1_ Right end of the interval
     * @param leftSlope_
     * @param rightSlope_
     * @param secant_
     * @return The knot
     * @throws IllegalStateException if called on NONE
     */
    public double locateKnot(final double x0_, final double x1_, final double leftSlope_, final double rightSlope_,
            final double secant_)
    {
        final double h = x1_ - x0_;

        switch (this)
        {
            case MIDPOINT:
                return (x0_ + x1_) / 2.0;
            case RIGHT_WEIGHTED:
            {
                final double eTemp = x0_ + ((2.0 * h) * (rightSlope_ - secant_)) / (rightSlope_ - leftSlope_);
                return (x0_ + eTemp) / 2.0;
            }
            case LEFT_WEIGHTED:
            {
                final double eTemp = x1_ + ((2.0 * h) * (leftSlope_ - secant_)) / (rightSlope_ - leftSlope_);
                return (x1_ + eTemp) / 2.0;
            }
            case NONE:
                throw new IllegalStateException("No knot is inserted for this interval.");
            default:
                throw new RuntimeException("Impossible.");
        }
    }

    public boolean isSplit()
    {
        return this != NONE;
    }

}
