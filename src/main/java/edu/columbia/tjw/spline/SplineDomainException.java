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
 * Thrown when a spline is evaluated outside of the closed range spanned by its
 * knots.
 *
 * @author tyler
 */
public final class SplineDomainException extends IllegalArgumentException
{
    private static final long serialVersionUID = 0x1f8d0b7c33a2e965L;

    private final double _query;
    private final double _lowerBound;
    private final double _upperBound;

    public SplineDomainException(final double query_, final double lowerBound_, final double upperBound_)
    {
        super("Query point " + query_ + " outside of spline support [" + lowerBound_ + ", " + upperBound_ + "]");
        _query = query_;
        _lowerBound = lowerBound_;
        _upperBound = upperBound_;
    }

    public double getQuery()
    {
        return _query;
    }

    public double getLowerBound()
    {
        return _lowerBound;
    }

    public double getUpperBound()
    {
        return _upperBound;
    }

}
