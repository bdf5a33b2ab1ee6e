package com.chicu.simorch.optimize;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterSpaceTest {

    @Test
    void defaults_shouldHaveFiveNamedDimensions() {
        ParameterSpace s = ParameterSpace.defaults();

        assertEquals(List.of("n2", "a_eff", "n_eff", "g_geom", "beta"), s.names());
    }

    @Test
    void dimension_wideRange_shouldBeLogScaled() {
        ParameterDimension n2 = new ParameterDimension("n2", 1e-18, 1e-16);
        ParameterDimension beta = new ParameterDimension("beta", 10, 100);

        assertTrue(n2.logScale());
        assertFalse(beta.logScale());
        assertEquals(1e-17, n2.fromUnit(0.5), 1e-20);
        assertEquals(55.0, beta.fromUnit(0.5), 1e-9);
    }

    @Test
    void fromUnit_shouldStayInsideBounds() {
        for (ParameterDimension d : ParameterSpace.defaults().dimensions()) {
            for (double u : new double[]{-1, 0, 0.3, 1, 2}) {
                double v = d.fromUnit(u);
                assertTrue(v >= d.low() && v <= d.high(), d.name() + "=" + v);
            }
        }
    }

    @Test
    void withBounds_shouldOverrideByName_andRejectUnknown() {
        ParameterSpace s = ParameterSpace.defaults().withBounds(Map.of("beta", List.of(20.0, 40.0)));

        ParameterDimension beta = s.dimensions().get(4);
        assertEquals(20.0, beta.low());
        assertEquals(40.0, beta.high());

        assertThrows(IllegalArgumentException.class,
                () -> ParameterSpace.defaults().withBounds(Map.of("gamma", List.of(1.0, 2.0))));
        assertThrows(IllegalArgumentException.class,
                () -> ParameterSpace.defaults().withBounds(Map.of("beta", List.of(40.0, 20.0))));
        assertThrows(IllegalArgumentException.class,
                () -> ParameterSpace.defaults().withBounds(Map.of("beta", List.of(1.0))));
    }

    @Test
    void duplicateNames_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ParameterSpace(List.of(
                new ParameterDimension("beta", 1, 2),
                new ParameterDimension("beta", 3, 4))));
    }

    @Test
    void fromUnitPoint_shouldMapInDeclaredOrder() {
        ParameterSpace s = new ParameterSpace(List.of(
                new ParameterDimension("beta", 10, 20),
                new ParameterDimension("g_geom", 0.5, 1.0)));

        Map<String, Double> p = s.fromUnit(new double[]{0.0, 1.0});

        assertEquals(List.of("beta", "g_geom"), List.copyOf(p.keySet()));
        assertEquals(10.0, p.get("beta"));
        assertEquals(1.0, p.get("g_geom"));
        assertThrows(IllegalArgumentException.class, () -> s.fromUnit(new double[]{0.1}));
    }
}
