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

import edu.columbia.tjw.spline.symbolic.PiecewiseExporter;
import edu.columbia.tjw.spline.symbolic.PiecewiseExpression;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * A piecewise quadratic spline, defined by a strictly increasing knot sequence
 * and one coefficient triple per sub-interval between consecutive knots.
 *
 * The spline is defined on the closed range [first knot, last knot]. Each
 * sub-interval is closed on the left and open on the right, except the last
 * one which is closed on both ends.
 *
 * @author tyler
 */
public final class SchumakerSpline implements Serializable, UnivariateFunction
{
    private static final long serialVersionUID = 0x6a3f1e58b0d29c74L;

    private final double[] _knots;
    private final QuadraticCoefficients[] _coefficients;

    public SchumakerSpline(final double[] knots_, final List<QuadraticCoefficients> coefficients_)
    {
        if (null == knots_ || null == coefficients_)
        {
            throw new SplineValidationException("Knots and coefficients must not be null.");
        }
        if (knots_.length < 2)
        {
            throw new SplineValidationException("At least two knots are required: " + knots_.length);
        }
        if (coefficients_.size() != knots_.length - 1)
        {
            throw new SplineValidationException("Expected " + (knots_.length - 1) + " coefficient entries, got "
                    + coefficients_.size());
        }

        for (int i = 1; i < knots_.length; i++)
        {
            if (!(knots_[i] > knots_[i - 1]))
            {
                throw new SplineValidationException("Knots must be strictly ascending: knot[" + (i - 1) + "] = "
                        + knots_[i - 1] + ", knot[" + i + "] = " + knots_[i]);
            }
        }

        _knots = knots_.clone();
        _coefficients = coefficients_.toArray(new QuadraticCoefficients[0]);
    }

    @Override
    public double value(final double x_)
    {
        final int piece = findPiece(x_);
        return _coefficients[piece].value(x_ - _knots[piece]);
    }

    /**
     * The first derivative. At an interior knot this is the derivative of the
     * piece to the right of the knot.
     *
     * @param x_ The point to evaluate
     * @return The slope of the spline at x_
     */
    public double derivative(final double x_)
    {
        final int piece = findPiece(x_);
        return _coefficients[piece].derivative(x_ - _knots[piece]);
    }

    /**
     * Locates the sub-interval containing x_.
     *
     * @param x_ The query point
     * @return index i such that knot[i] &lt;= x_ &lt; knot[i+1], or the last
     * piece if x_ equals the last knot
     * @throws SplineDomainException if x_ is NaN or outside of [first knot,
     * last knot]
     */
    public int findPiece(final double x_)
    {
        final int last = _knots.length - 1;

        if (!(x_ >= _knots[0] && x_ <= _knots[last]))
        {
            throw new SplineDomainException(x_, _knots[0], _knots[last]);
        }
        if (x_ <= _knots[0])
        {
            return 0;
        }
        if (x_ == _knots[last])
        {
            return last - 1;
        }

        final int index = Arrays.binarySearch(_knots, x_);

        if (index >= 0)
        {
            return index;
        }

        //Insertion point is the first knot strictly greater than x_.
        final int insertion = -index - 1;
        return insertion - 1;
    }

    public int getKnotCount()
    {
        return _knots.length;
    }

    public int getPieceCount()
    {
        return _coefficients.length;
    }

    public double getKnot(final int index_)
    {
        return _knots[index_];
    }

    public double[] getKnots()
    {
        return _knots.clone();
    }

    public QuadraticCoefficients getCoefficients(final int piece_)
    {
        return _coefficients[piece_];
    }

    public List<QuadraticCoefficients> getCoefficientList()
    {
        return Collections.unmodifiableList(Arrays.asList(_coefficients));
    }

    /**
     * @return The coefficient table as a (pieceCount x 3) array of [A, B, C]
     * rows.
     */
    public double[][] getCoefficientTable()
    {
        final double[][] output = new double[_coefficients.length][];

        for (int i = 0; i < _coefficients.length; i++)
        {
            output[i] = _coefficients[i].toArray();
        }

        return output;
    }

    public double getLowerBound()
    {
        return _knots[0];
    }

    public double getUpperBound()
    {
        return _knots[_knots.length - 1];
    }

    /**
     * Same function as a commons-math spline. Note that the commons-math
     * version treats the last knot as the only closed right end, exactly as
     * this class does.
     *
     * @return An equivalent PolynomialSplineFunction
     */
    public PolynomialSplineFunction toPolynomialSplineFunction()
    {
        final PolynomialFunction[] polynomials = new PolynomialFunction[_coefficients.length];

        for (int i = 0; i < _coefficients.length; i++)
        {
            polynomials[i] = _coefficients[i].toPolynomial();
        }

        return new PolynomialSplineFunction(_knots.clone(), polynomials);
    }

    public PiecewiseExpression toPiecewise()
    {
        return PiecewiseExporter.export(this);
    }

    @Override
    public boolean equals(final Object that_)
    {
        if (this == that_)
        {
            return true;
        }
        if (!(that_ instanceof SchumakerSpline))
        {
            return false;
        }

        final SchumakerSpline that = (SchumakerSpline) that_;
        return Arrays.equals(_knots, that._knots) && Arrays.equals(_coefficients, that._coefficients);
    }

    @Override
    public int hashCode()
    {
        return 31 * Arrays.hashCode(_knots) + Arrays.hashCode(_coefficients);
    }

    @Override
    public String toString()
    {
        final List<String> rows = new ArrayList<>(_coefficients.length);

        for (int i = 0; i < _coefficients.length; i++)
        {
            rows.add("[" + _knots[i] + ", " + _knots[i + 1] + "]: " + _coefficients[i]);
        }

        return "SchumakerSpline" + rows;
    }

}
