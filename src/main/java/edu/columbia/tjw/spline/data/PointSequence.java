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
package edu.columbia.tjw.spline.data;

import edu.columbia.tjw.spline.DegenerateIntervalException;
import edu.columbia.tjw.spline.SplineValidationException;
import edu.columbia.tjw.spline.util.MathFunctions;
import java.io.Serializable;

/**
 * An ordered, immutable sequence of (x, y) points with strictly increasing x.
 *
 * @author tyler
 */
public final class PointSequence implements Serializable
{
    private static final long serialVersionUID = 0x3a91d6e2c7f0b845L;

    private final double[] _x;
    private final double[] _y;
    private final double _minY;
    private final double _maxY;

    public PointSequence(final double[] x_, final double[] y_)
    {
        this(x_, y_, true);
    }

    public PointSequence(final double[] x_, final double[] y_, final boolean doCopy_)
    {
        if (null == x_ || null == y_)
        {
            throw new SplineValidationException("X and Y values must not be null.");
        }
        if (x_.length != y_.length)
        {
            throw new SplineValidationException("Length mismatch: " + x_.length + " != " + y_.length);
        }
        if (x_.length < 2)
        {
            throw new SplineValidationException("At least two points are required: " + x_.length);
        }

        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < x_.length; i++)
        {
            if (!MathFunctions.isWellDefined(x_[i]))
            {
                throw new SplineValidationException("X values must be finite: x[" + i + "] = " + x_[i]);
            }
            if (!MathFunctions.isWellDefined(y_[i]))
            {
                throw new SplineValidationException("Y values must be finite: y[" + i + "] = " + y_[i]);
            }

            if (i > 0)
            {
                if (x_[i] == x_[i - 1])
                {
                    throw new DegenerateIntervalException("Repeated x value " + x_[i], i - 1, 0.0);
                }
                if (!(x_[i] > x_[i - 1]))
                {
                    throw new SplineValidationException("X values must be strictly ascending: x[" + (i - 1) + "] = "
                            + x_[i - 1] + ", x[" + i + "] = " + x_[i]);
                }
            }

            minY = Math.min(minY, y_[i]);
            maxY = Math.max(maxY, y_[i]);
        }

        if (doCopy_)
        {
            _x = x_.clone();
            _y = y_.clone();
        }
        else
        {
            _x = x_;
            _y = y_;
        }

        _minY = minY;
        _maxY = maxY;
    }

    public int size()
    {
        return _x.length;
    }

    public int getIntervalCount()
    {
        return _x.length - 1;
    }

    public double getX(final int index_)
    {
        return _x[index_];
    }

    public double getY(final int index_)
    {
        return _y[index_];
    }

    public double getFirstX()
    {
        return _x[0];
    }

    public double getLastX()
    {
        return _x[_x.length - 1];
    }

    public double getMinY()
    {
        return _minY;
    }

    public double getMaxY()
    {
        return _maxY;
    }

    /**
     * @param interval_ Interval index i, in [0, size() - 2]
     * @return x[i+1] - x[i]
     */
    public double getWidth(final int interval_)
    {
        return _x[interval_ + 1] - _x[interval_];
    }

    /**
     * The secant slope (average rate of change) across an interval.
     *
     * @param interval_ Interval index i, in [0, size() - 2]
     * @return (y[i+1] - y[i]) / (x[i+1] - x[i])
     */
    public double getSecant(final int interval_)
    {
        final double dy = _y[interval_ + 1] - _y[interval_];
        return dy / getWidth(interval_);
    }

    public double getChordLength(final int interval_)
    {
        final double dy = _y[interval_ + 1] - _y[interval_];
        return MathFunctions.chordLength(getWidth(interval_), dy);
    }

    public double[] getX()
    {
        return _x.clone();
    }

    public double[] getY()
    {
        return _y.clone();
    }

}
