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

import edu.columbia.tjw.spline.SchumakerInterpolator;
import edu.columbia.tjw.spline.SchumakerSpline;
import edu.columbia.tjw.spline.SplineValidationException;
import edu.columbia.tjw.spline.util.LogUtil;
import java.util.List;
import java.util.logging.Logger;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.functions;
import org.apache.spark.sql.types.DataTypes;

/**
 * Fits splines to, and applies them over, Spark data frames.
 *
 * Fitting collects the (ordered) points onto the driver, so it is only meant
 * for curves with a modest number of points. Evaluation runs distributed.
 *
 * @author tyler
 */
public class SparkSplineAdapter
{
    private static final Logger LOG = LogUtil.getLogger(SparkSplineAdapter.class);
    private static final String X_ALIAS = "x";
    private static final String Y_ALIAS = "y";

    private final SchumakerInterpolator _interpolator;

    public SparkSplineAdapter()
    {
        this(new SchumakerInterpolator());
    }

    public SparkSplineAdapter(final SchumakerInterpolator interpolator_)
    {
        _interpolator = interpolator_;
    }

    /**
     * Fit a spline through the (x, y) pairs in the given columns. Rows are put
     * in x order first, slopes are estimated.
     *
     * @param data_ The data
     * @param xColumn_ Numeric column holding the abscissas
     * @param yColumn_ Numeric column holding the values
     * @return The fitted spline
     */
    public SchumakerSpline fit(final Dataset<Row> data_, final String xColumn_, final String yColumn_)
    {
        final Column xCol = functions.col(xColumn_).cast(DataTypes.DoubleType).as(X_ALIAS);
        final Column yCol = functions.col(yColumn_).cast(DataTypes.DoubleType).as(Y_ALIAS);
        final List<Row> rows = data_.select(xCol, yCol).orderBy(X_ALIAS).collectAsList();

        final int size = rows.size();
        final double[] x = new double[size];
        final double[] y = new double[size];

        for (int i = 0; i < size; i++)
        {
            final Row next = rows.get(i);

            if (next.isNullAt(0) || next.isNullAt(1))
            {
                throw new SplineValidationException("Null value in row " + i + " of [" + xColumn_ + ", "
                        + yColumn_ + "]");
            }

            x[i] = next.getDouble(0);
            y[i] = next.getDouble(1);
        }

        LOG.info("Fitting spline over " + size + " rows of [" + xColumn_ + ", " + yColumn_ + "]");
        return _interpolator.interpolate(x, y);
    }

    /**
     * Append a column holding the spline evaluated at another column.
     *
     * @param data_ The data
     * @param spline_ The spline to apply
     * @param inputColumn_ Numeric column to evaluate at
     * @param outputColumn_ Name of the new column
     * @return data_ with the new column
     */
    public Dataset<Row> transform(final Dataset<Row> data_, final SchumakerSpline spline_,
            final String inputColumn_, final String outputColumn_)
    {
        final UserDefinedFunction udf = functions.udf(new SplineUdf(spline_), DataTypes.DoubleType);
        final Column input = functions.col(inputColumn_).cast(DataTypes.DoubleType);
        return data_.withColumn(outputColumn_, udf.apply(input));
    }

    /**
     * Register the spline as a SQL function, callable as name_(x).
     *
     * @param spark_ The session
     * @param name_ Function name
     * @param spline_ The spline
     */
    public void register(final SparkSession spark_, final String name_, final SchumakerSpline spline_)
    {
        spark_.udf().register(name_, new SplineUdf(spline_), DataTypes.DoubleType);
    }

}
