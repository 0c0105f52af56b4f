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

import edu.columbia.tjw.spline.QuadraticCoefficients;
import java.io.Serializable;

/**
 * A quadratic in shifted form, A + B*(x - t) + C*(x - t)^2.
 *
 * @author tyler
 */
public final class QuadraticExpression implements Serializable
{
    private static final long serialVersionUID = 0x2e7b4f90a1c6d358L;

    private final QuadraticCoefficients _coefficients;
    private final double _shift;

    public QuadraticExpression(final QuadraticCoefficients coefficients_, final double shift_)
    {
        if (null == coefficients_)
        {
            throw new NullPointerException("Coefficients cannot be null.");
        }

        _coefficients = coefficients_;
        _shift = shift_;
    }

    public QuadraticCoefficients getCoefficients()
    {
        return _coefficients;
    }

    public double getShift()
    {
        return _shift;
    }

    public double evaluate(final double x_)
    {
        return _coefficients.value(x_ - _shift);
    }

    public String render(final String variable_)
    {
        final String term = renderShift(variable_);
        final StringBuilder builder = new StringBuilder();
        builder.append(_coefficients.getA());
        builder.append(" + ");
        builder.append(_coefficients.getB());
        builder.append("*");
        builder.append(term);
        builder.append(" + ");
        builder.append(_coefficients.getC());
        builder.append("*");
        builder.append(term);
        builder.append("^2");
        return builder.toString();
    }

    private String renderShift(final String variable_)
    {
        if (_shift == 0.0)
        {
            return variable_;
        }
        if (_shift < 0.0)
        {
            return "(" + variable_ + " + " + (-_shift) + ")";
        }

        return "(" + variable_ + " - " + _shift + ")";
    }

    @Override
    public String toString()
    {
        return render(PiecewiseExpression.DEFAULT_VARIABLE);
    }

}
