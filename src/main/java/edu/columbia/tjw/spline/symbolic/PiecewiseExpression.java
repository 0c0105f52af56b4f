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

import edu.columbia.tjw.spline.SplineDomainException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A piecewise function made of (expression, condition) pairs.
 *
 * Every breakpoint is closed on both sides, so a value sitting exactly on a
 * breakpoint satisfies two conditions. The pieces agree there, and evaluate
 * takes the first matching piece.
 *
 * @author tyler
 */
public final class PiecewiseExpression implements Serializable
{
    private static final long serialVersionUID = 0x58c1a0f3e92d7b46L;

    public static final String DEFAULT_VARIABLE = "x";

    private final List<Piece> _pieces;

    public PiecewiseExpression(final List<Piece> pieces_)
    {
        if (pieces_.isEmpty())
        {
            throw new IllegalArgumentException("A piecewise expression needs at least one piece.");
        }

        _pieces = Collections.unmodifiableList(new ArrayList<>(pieces_));
    }

    public List<Piece> getPieces()
    {
        return _pieces;
    }

    public int size()
    {
        return _pieces.size();
    }

    public Piece getPiece(final int index_)
    {
        return _pieces.get(index_);
    }

    public double evaluate(final double x_)
    {
        for (final Piece next : _pieces)
        {
            if (next.getCondition().contains(x_))
            {
                return next.getExpression().evaluate(x_);
            }
        }

        throw new SplineDomainException(x_, _pieces.get(0).getCondition().getLower(),
                _pieces.get(_pieces.size() - 1).getCondition().getUpper());
    }

    public String render(final String variable_)
    {
        final StringBuilder builder = new StringBuilder();
        builder.append("Piecewise(");

        for (int i = 0; i < _pieces.size(); i++)
        {
            if (i > 0)
            {
                builder.append(", ");
            }

            final Piece next = _pieces.get(i);
            builder.append("(");
            builder.append(next.getExpression().render(variable_));
            builder.append(", ");
            builder.append(next.getCondition().render(variable_));
            builder.append(")");
        }

        builder.append(")");
        return builder.toString();
    }

    @Override
    public String toString()
    {
        return render(DEFAULT_VARIABLE);
    }

    public static final class Piece implements Serializable
    {
        private static final long serialVersionUID = 0x1d6f29b8c4e0a735L;

        private final QuadraticExpression _expression;
        private final IntervalCondition _condition;

        public Piece(final QuadraticExpression expression_, final IntervalCondition condition_)
        {
            _expression = expression_;
            _condition = condition_;
        }

        public QuadraticExpression getExpression()
        {
            return _expression;
        }

        public IntervalCondition getCondition()
        {
            return _condition;
        }
    }

}
