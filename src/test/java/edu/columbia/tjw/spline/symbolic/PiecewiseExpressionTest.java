package edu.columbia.tjw.spline.symbolic;

import edu.columbia.tjw.spline.QuadraticCoefficients;
import edu.columbia.tjw.spline.SchumakerInterpolator;
import edu.columbia.tjw.spline.SchumakerSpline;
import edu.columbia.tjw.spline.SplineDomainException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PiecewiseExpressionTest
{
    private static PiecewiseExpression makeExpression()
    {
        final List<QuadraticCoefficients> coefficients = Arrays.asList(
                new QuadraticCoefficients(0.0, 1.0, 0.0),
                new QuadraticCoefficients(1.0, 1.0, -0.5));
        return PiecewiseExporter.export(new double[]{0.0, 1.0, 2.0}, coefficients);
    }

    @Test
    void testRender()
    {
        final PiecewiseExpression expression = makeExpression();

        Assertions.assertEquals("Piecewise((0.0 + 1.0*x + 0.0*x^2, 0.0 <= x <= 1.0), "
                + "(1.0 + 1.0*(x - 1.0) + -0.5*(x - 1.0)^2, 1.0 <= x <= 2.0))", expression.toString());
        Assertions.assertEquals("1.0 <= t <= 2.0", expression.getPiece(1).getCondition().render("t"));
    }

    @Test
    void testNegativeShift()
    {
        final QuadraticExpression expression = new QuadraticExpression(new QuadraticCoefficients(1.0, 2.0, 3.0),
                -1.5);

        Assertions.assertEquals("1.0 + 2.0*(x + 1.5) + 3.0*(x + 1.5)^2", expression.toString());
        Assertions.assertEquals(1.0, expression.evaluate(-1.5));
        Assertions.assertEquals(6.0, expression.evaluate(-0.5));
    }

    @Test
    void testEvaluate()
    {
        final PiecewiseExpression expression = makeExpression();

        Assertions.assertEquals(2, expression.size());
        Assertions.assertEquals(0.5, expression.evaluate(0.5));
        Assertions.assertEquals(1.0, expression.evaluate(1.0));
        Assertions.assertEquals(1.5, expression.evaluate(2.0));

        //Both pieces hold at the shared breakpoint and agree there.
        Assertions.assertTrue(expression.getPiece(0).getCondition().contains(1.0));
        Assertions.assertTrue(expression.getPiece(1).getCondition().contains(1.0));
    }

    @Test
    void testOutsideSupport()
    {
        final PiecewiseExpression expression = makeExpression();

        final SplineDomainException exc = Assertions.assertThrows(SplineDomainException.class,
                () -> expression.evaluate(2.5));
        Assertions.assertEquals(0.0, exc.getLowerBound());
        Assertions.assertEquals(2.0, exc.getUpperBound());
        Assertions.assertThrows(SplineDomainException.class, () -> expression.evaluate(Double.NaN));
    }

    @Test
    void testExportMatchesSpline()
    {
        final SchumakerSpline spline = new SchumakerInterpolator().interpolate(
                new double[]{0.0, 1.0, 2.0, 3.0}, new double[]{0.0, 2.0, 1.0, 4.0});
        final PiecewiseExpression expression = spline.toPiecewise();

        Assertions.assertEquals(spline.getPieceCount(), expression.size());

        for (int i = 0; i < expression.size(); i++)
        {
            final PiecewiseExpression.Piece piece = expression.getPiece(i);
            Assertions.assertEquals(spline.getKnot(i), piece.getCondition().getLower());
            Assertions.assertEquals(spline.getKnot(i + 1), piece.getCondition().getUpper());
            Assertions.assertEquals(spline.getKnot(i), piece.getExpression().getShift());
            Assertions.assertSame(spline.getCoefficients(i), piece.getExpression().getCoefficients());
        }
    }

    @Test
    void testExportValidation()
    {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> PiecewiseExporter.export(new double[]{0.0, 1.0},
                        Arrays.asList(new QuadraticCoefficients(0.0, 0.0, 0.0),
                                new QuadraticCoefficients(0.0, 0.0, 0.0))));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new IntervalCondition(1.0, 1.0));
    }
}
