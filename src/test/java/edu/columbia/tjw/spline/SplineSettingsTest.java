package edu.columbia.tjw.spline;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SplineSettingsTest
{
    @Test
    void testDefaults()
    {
        final SplineSettings settings = SplineSettings.getDefault();

        Assertions.assertEquals(1.0e-12, settings.getDegenerateTolerance());
        Assertions.assertTrue(settings.isCopyInputs());
        Assertions.assertFalse(settings.isLogSummary());
    }

    @Test
    void testBuilder()
    {
        final SplineSettings settings = SplineSettings.getDefault().makeBuilder()
                .setDegenerateTolerance(1.0e-6)
                .setCopyInputs(false)
                .setLogSummary(true)
                .build();

        Assertions.assertEquals(1.0e-6, settings.getDegenerateTolerance());
        Assertions.assertFalse(settings.isCopyInputs());
        Assertions.assertTrue(settings.isLogSummary());

        final SplineSettings copy = settings.makeBuilder().build();
        Assertions.assertEquals(settings.toString(), copy.toString());
    }

    @Test
    void testBadTolerance()
    {
        final SplineSettings.SplineSettingsBuilder builder = new SplineSettings.SplineSettingsBuilder();

        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setDegenerateTolerance(-1.0e-3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setDegenerateTolerance(0.5));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setDegenerateTolerance(Double.NaN));
    }
}
