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

import java.io.Serializable;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * The coefficients of one quadratic piece, f(x) = A + B(x - t) + C(x - t)^2,
 * where t is the left knot of the piece. The knot itself is not stored here,
 * all methods take the offset (x - t).
 *
 * @author tyler
 */
public final class QuadraticCoefficients implements Serializable
{
    private static final long serialVersionUID = 0x62f0c83b1d5e94a7L;

    private final double _a;
    private final double _b;
    private final double _c;

    public QuadraticCoefficients(final double a_, final double b_, final double c_)
    {
        _a = a_;
        _b = b_;
        _c = c_;
    }

    public double getA()
    {
        return _a;
    }

    public double getB()
    {
        return _b;
    }

    public double getC()
    {
        return _c;
    }

    public double value(final double offset_)
    {
        return _a + (_b * offset_) + (_c * (offset_ * offset_));
    }

    public double derivative(final double offset_)
    {
        return _b + (2.0 * _c * offset_);
    }

    public double secondDerivative()
    {
        return 2.0 * _c;
    }

    /**
     * @return This quadratic as a polynomial in (x - t).
     */
    public PolynomialFunction toPolynomial()
    {
        return new PolynomialFunction(new double[]
        {
            _a, _b, _c
        });
    }

    public double[] toArray()
    {
        return new double[]
        {
            _a, _b, _c
        };
    }

    @Override
    public boolean equals(final Object that_)
    {
        if (this == that_)
        {
            return true;
        }
        if (!(that_ instanceof QuadraticCoefficients))
        {
            return false;
        }

        final QuadraticCoefficients that = (QuadraticCoefficients) that_;
        return Double.compare(_a, that._a) == 0
                && Double.compare(_b, that._b) == 0
                && Double.compare(_c, that._c) == 0;
    }

    @Override
    public int hashCode()
    {
        int hash = 7;
        hash = 31 * hash + Double.hashCode(_a);
        hash = 31 * hash + Double.hashCode(_b);
        hash = 31 * hash + Double.hashCode(_c);
        return hash;
    }

    @Override
    public String toString()
    {
        return "[" + _a + ", " + _b + ", " + _c + "]";
    }

}
