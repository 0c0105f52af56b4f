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
import edu.columbia.tjw.spline.SchumakerSpline;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a knot sequence and its coefficient table into a piecewise expression,
 * one piece per sub-interval.
 *
 * @author tyler
 */
public final class PiecewiseExporter
{
    private PiecewiseExporter()
    {
    }

    public static PiecewiseExpression export(final SchumakerSpline spline_)
    {
        final int pieceCount = spline_.getPieceCount();
        final List<PiecewiseExpression.Piece> pieces = new ArrayList<>(pieceCount);

        for (int i = 0; i < pieceCount; i++)
        {
            pieces.add(makePiece(spline_.getKnot(i), spline_.getKnot(i + 1), spline_.getCoefficients(i)));
        }

        return new PiecewiseExpression(pieces);
    }

    public static PiecewiseExpression export(final double[] knots_, final List<QuadraticCoefficients> coefficients_)
    {
        if (knots_.length != coefficients_.size() + 1)
        {
            throw new IllegalArgumentException("Need one more knot than coefficient entries: " + knots_.length
                    + " != " + coefficients_.size() + " + 1");
        }

        final List<PiecewiseExpression.Piece> pieces = new ArrayList<>(coefficients_.size());

        for (int i = 0; i < coefficients_.size(); i++)
        {
            pieces.add(makePiece(knots_[i], knots_[i + 1], coefficients_.get(i)));
        }

        return new PiecewiseExpression(pieces);
    }

    private static PiecewiseExpression.Piece makePiece(final double left_, final double right_,
            final QuadraticCoefficients coefficients_)
    {
        final QuadraticExpression expression = new QuadraticExpression(coefficients_, left_);
        final IntervalCondition condition = new IntervalCondition(left_, right_);
        return new PiecewiseExpression.Piece(expression, condition);
    }

}
