package edu.columbia.tjw.spline.spark;

import edu.columbia.tjw.spline.SchumakerInterpolator;
import edu.columbia.tjw.spline.SchumakerSpline;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SparkSplineAdapterTest
{
    private static final double[] X = new double[]{0.0, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0};
    private static final double[] Y = new double[]{0.0, 0.1, 0.2, 0.15, 1.5, 1.6, 1.55};
    private static final double TOLERANCE = 1.0e-12;

    private static SparkSession _spark;

    @BeforeAll
    static void startSpark()
    {
        _spark = SparkSession.builder()
                .master("local")
                .appName("Spline Session")
                .config("spark.ui.enabled", "false")
                .getOrCreate();
    }

    @AfterAll
    static void stopSpark()
    {
        if (null != _spark)
        {
            _spark.stop();
        }
    }

    private static Dataset<Row> makePoints()
    {
        final StructType schema = new StructType(new StructField[]{
            DataTypes.createStructField("AGE", DataTypes.DoubleType, false),
            DataTypes.createStructField("RATE", DataTypes.DoubleType, false)
        });

        //Deliberately out of order, the adapter sorts by x.
        final List<Integer> order = Arrays.asList(4, 0, 6, 2, 5, 1, 3);
        final List<Row> rows = new ArrayList<>();

        for (final int next : order)
        {
            rows.add(RowFactory.create(X[next], Y[next]));
        }

        return _spark.createDataFrame(rows, schema);
    }

    @Test
    void testFit()
    {
        final SchumakerSpline fitted = new SparkSplineAdapter().fit(makePoints(), "AGE", "RATE");
        final SchumakerSpline expected = new SchumakerInterpolator().interpolate(X, Y);

        Assertions.assertEquals(expected, fitted);
    }

    @Test
    void testTransform()
    {
        final SparkSplineAdapter adapter = new SparkSplineAdapter();
        final SchumakerSpline spline = new SchumakerInterpolator().interpolate(X, Y);
        final Dataset<Row> transformed = adapter.transform(makePoints(), spline, "AGE", "FITTED");
        final List<Row> rows = transformed.select("AGE", "RATE", "FITTED").collectAsList();

        Assertions.assertEquals(X.length, rows.size());

        for (final Row next : rows)
        {
            Assertions.assertEquals(next.getDouble(1), next.getDouble(2), TOLERANCE);
        }
    }

    @Test
    void testRegister()
    {
        final SparkSplineAdapter adapter = new SparkSplineAdapter();
        final SchumakerSpline spline = new SchumakerInterpolator().interpolate(X, Y);

        adapter.register(_spark, "rate_curve", spline);
        makePoints().createOrReplaceTempView("points");

        final List<Row> rows = _spark.sql("SELECT AGE, rate_curve(AGE) AS v FROM points").collectAsList();

        Assertions.assertEquals(X.length, rows.size());

        for (final Row next : rows)
        {
            Assertions.assertEquals(spline.value(next.getDouble(0)), next.getDouble(1), TOLERANCE);
        }
    }
}
