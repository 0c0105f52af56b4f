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
package edu.columbia.tjw.spline.algo;

import edu.columbia.tjw.spline.QuadraticCoefficients;

/**
 * The result of fitting one data interval [x0, x1]: either a single quadratic
 * or two quadratics joined at an inserted knot.
 *
 * @author tyler
 */
public abstract class IntervalFit
{
    private final KnotPlacement _placement;
    private final double _leftKnot;

    private IntervalFit(final KnotPlacement placement_, final double leftKnot_)
    {
        _placement = placement_;
        _leftKnot = leftKnot_;
    }

    public final KnotPlacement getPlacement()
    {
        return _placement;
    }

    public final double getLeftKnot()
    {
        return _leftKnot;
    }

    /**
     * @return 1 for a single quadratic, 2 for a split interval
     */
    public abstract int getPieceCount();

    /**
     * @param index_ 0 for the left-most piece
     * @return The knot at which that piece starts
     */
    public abstract double getKnot(int index_);

    public abstract QuadraticCoefficients getCoefficients(int index_);

    public static final class Single extends IntervalFit
    {
        private final QuadraticCoefficients _coefficients;

        public Single(final double leftKnot_, final QuadraticCoefficients coefficients_)
        {
            super(KnotPlacement.NONE, leftKnot_);
            _coefficients = coefficients_;
        }

        @Override
        public int getPieceCount()
        {
            return 1;
        }

        @Override
        public double getKnot(final int index_)
        {
            if (index_ != 0)
            {
                throw new IndexOutOfBoundsException("Bad index: " + index_);
            }

            return getLeftKnot();
        }

        @Override
        public QuadraticCoefficients getCoefficients(final int index_)
        {
            if (index_ != 0)
            {
                throw new IndexOutOfBoundsException("Bad index: " + index_);
            }

            return _coefficients;
        }
    }

    public static final class Split extends IntervalFit
    {
        private final double _insertedKnot;
        private final QuadraticCoefficients _left;
        private final QuadraticCoefficients _right;

        public Split(final KnotPlacement placement_, final double leftKnot_, final double insertedKnot_,
                final QuadraticCoefficients left_, final QuadraticCoefficients right_)
        {
            super(placement_, leftKnot_);

            if (!placement_.isSplit())
            {
                throw new IllegalArgumentException("Split interval needs a split placement: " + placement_);
            }

            _insertedKnot = insertedKnot_;
            _left = left_;
            _right = right_;
        }

        public double getInsertedKnot()
        {
            return _insertedKnot;
        }

        @Override
        public int getPieceCount()
        {
            return 2;
        }

        @Override
        public double getKnot(final int index_)
        {
            switch (index_)
            {
                case 0:
                    return getLeftKnot();
                case 1:
                    return _insertedKnot;
                default:
                    throw new IndexOutOfBoundsException("Bad index: " + index_);
            }
        }

        @Override
        public QuadraticCoefficients getCoefficients(final int index_)
        {
            switch (index_)
            {
                case 0:
                    return _left;
                case 1:
                    return _right;
                default:
                    throw new IndexOutOfBoundsException("Bad index: " + index_);
            }
        }
    }

}
