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
 * The form in which a constructed spline is handed back.
 *
 * @author tyler
 */
public enum OutputMode
{
    /**
     * Knots and coefficient table, as a SchumakerSpline.
     */
    COEFFICIENTS,
    /**
     * A PiecewiseExpression with one (expression, interval) pair per piece.
     */
    SYMBOLIC;
}
