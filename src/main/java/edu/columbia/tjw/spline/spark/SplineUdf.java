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
package edu.columbia.tjw.spline.spark;

import edu.columbia.tjw.spline.SchumakerSpline;
import org.apache.spark.sql.api.java.UDF1;

/**
 * Evaluates a fitted spline inside Spark. Null input gives null output, an
 * input outside the spline's support fails the task.
 *
 * @author tyler
 */
public final class SplineUdf implements UDF1<Double, Double>
{
    private static final long serialVersionUID = 0x39e7a4c15bf0d286L;

    private final SchumakerSpline _spline;

    public SplineUdf(final SchumakerSpline spline_)
    {
        if (null == spline_)
        {
            throw new NullPointerException("Spline cannot be null.");
        }

        _spline = spline_;
    }

    public SchumakerSpline getSpline()
    {
        return _spline;
    }

    @Override
    public Double call(final Double x_)
    {
        if (null == x_)
        {
            return null;
        }

        return _spline.value(x_);
    }

}
