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

/**
 * Thrown when an interval collapses: either two data points share an
 * abscissa, or an inserted knot lands so close to an end of its interval that
 * one of the two quadratic pieces would have (numerically) zero width.
 *
 * @author tyler
 */
public final class DegenerateIntervalException extends ArithmeticException
{
    private static final long serialVersionUID = 0x7c2e91d4a0b35f18L;

    private final int _intervalIndex;
    private final double _width;

    public DegenerateIntervalException(final String message_, final int intervalIndex_, final double width_)
    {
        super(message_ + " [interval " + intervalIndex_ + ", width " + width_ + "]");
        _intervalIndex = intervalIndex_;
        _width = width_;
    }

    /**
     * @return The index i of the data interval [x[i], x[i+1]] that collapsed.
     */
    public int getIntervalIndex()
    {
        return _intervalIndex;
    }

    /**
     * @return The width that was found to be (nearly) zero.
     */
    public double getWidth()
    {
        return _width;
    }

}
