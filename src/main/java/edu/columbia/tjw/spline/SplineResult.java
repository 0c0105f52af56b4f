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

import edu.columbia.tjw.spline.symbolic.PiecewiseExpression;

/**
 *
 * @author tyler
 */
public final class SplineResult
{
    private final OutputMode _mode;
    private final SchumakerSpline _spline;
    private final PiecewiseExpression _piecewise;

    private SplineResult(final OutputMode mode_, final SchumakerSpline spline_, final PiecewiseExpression piecewise_)
    {
        _mode = mode_;
        _spline = spline_;
        _piecewise = piecewise_;
    }

    public static SplineResult of(final SchumakerSpline spline_, final OutputMode mode_)
    {
        switch (mode_)
        {
            case COEFFICIENTS:
                return new SplineResult(mode_, spline_, null);
            case SYMBOLIC:
                return new SplineResult(mode_, null, spline_.toPiecewise());
            default:
                throw new IllegalArgumentException("Unknown mode: " + mode_);
        }
    }

    public OutputMode getMode()
    {
        return _mode;
    }

    public SchumakerSpline getSpline()
    {
        if (null == _spline)
        {
            throw new IllegalStateException("Result was built in " + _mode + " mode.");
        }

        return _spline;
    }

    public PiecewiseExpression getPiecewise()
    {
        if (null == _piecewise)
        {
            throw new IllegalStateException("Result was built in " + _mode + " mode.");
        }

        return _piecewise;
    }

}
