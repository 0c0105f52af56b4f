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
package edu.columbia.tjw.spline.symbolic;

import java.io.Serializable;

/**
 * The closed interval condition lower &lt;= x &lt;= upper.
 *
 * @author tyler
 */
public final class IntervalCondition implements Serializable
{
    private static final long serialVersionUID = 0x0b93e5d7f2a4c61eL;

    private final double _lower;
    private final double _upper;

    public IntervalCondition(final double lower_, final double upper_)
    {
        if (!(upper_ > lower_))
        {
            throw new IllegalArgumentException("Empty interval: [" + lower_ + ", " + upper_ + "]");
        }

        _lower = lower_;
        _upper = upper_;
    }

    public double getLower()
    {
        return _lower;
    }

    public double getUpper()
    {
        return _upper;
    }

    public boolean contains(final double x_)
    {
        return x_ >= _lower && x_ <= _upper;
    }

    public String render(final String variable_)
    {
        return _lower + " <= " + variable_ + " <= " + _upper;
    }

    @Override
    public String toString()
    {
        return render(PiecewiseExpression.DEFAULT_VARIABLE);
    }

}
