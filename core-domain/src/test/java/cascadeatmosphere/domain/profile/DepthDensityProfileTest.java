package cascadeatmosphere.domain.profile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Test unitario para DepthDensityProfile.
 * Se usa un perfil lineal rho(X) = 1 + 0.1·X sobre [0, 10] repartido en dos tramos.
 */
class DepthDensityProfileTest {

    private static final double SURFACE_DEPTH = 10.0;

    private double[] breakpoints;
    private double[][] coefficients;
    private DepthDensityProfile profile;

    @BeforeEach
    void setUp() {
        breakpoints = new double[]{0.0, 5.0, SURFACE_DEPTH};
        coefficients = new double[][]{{1.0, 0.1, 0.0}, {1.5, 0.1, 0.0}};
        profile = new DepthDensityProfile(SURFACE_DEPTH, breakpoints, coefficients);
    }

    @Test
    @DisplayName("Evaluación dentro del dominio")
    void densityAt_insideDomain_shouldEvaluatePieces() {
        assertEquals(1.2, profile.densityAt(2.0), 1e-12);
        assertEquals(1.5, profile.densityAt(5.0), 1e-12);
        assertEquals(1.8, profile.densityAt(8.0), 1e-12);
        assertEquals(2.0, profile.densityAt(SURFACE_DEPTH), 1e-12);
    }

    @Test
    @DisplayName("Fuera del dominio: la profundidad se recorta a los extremos")
    void densityAt_outsideDomain_shouldClamp() {
        assertEquals(profile.densityAt(0.0), profile.densityAt(-3.0));
        assertEquals(profile.densityAt(SURFACE_DEPTH), profile.densityAt(1.0e4));
    }

    @Test
    @DisplayName("NaN: debe lanzar IllegalArgumentException")
    void densityAt_withNaN_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> profile.densityAt(Double.NaN));
    }

    @Test
    @DisplayName("Dominio inconsistente con la profundidad de superficie: debe lanzar IllegalArgumentException")
    void constructor_withDomainMismatch_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new DepthDensityProfile(12.0, breakpoints, coefficients));
        assertThrows(IllegalArgumentException.class,
                () -> new DepthDensityProfile(SURFACE_DEPTH, new double[]{1.0, 5.0, SURFACE_DEPTH}, coefficients));
        assertThrows(IllegalArgumentException.class, () -> new DepthDensityProfile(0.0, breakpoints, coefficients));
    }

    @Test
    @DisplayName("Dimensiones inconsistentes: debe lanzar IllegalArgumentException")
    void constructor_withWrongPieceCount_shouldThrow() {
        double[][] onePiece = {{1.0, 0.1, 0.0}};
        assertThrows(IllegalArgumentException.class, () -> new DepthDensityProfile(SURFACE_DEPTH, breakpoints, onePiece));
    }

    @Test
    @DisplayName("Puntos de ruptura no crecientes: debe lanzar IllegalArgumentException")
    void constructor_withNonMonotonicBreakpoints_shouldThrow() {
        double[] unordered = {0.0, 7.0, 6.0, SURFACE_DEPTH};
        double[][] threePieces = {{1.0}, {1.0}, {1.0}};
        // NonMonotonicSequenceException es una IllegalArgumentException
        assertThrows(IllegalArgumentException.class, () -> new DepthDensityProfile(SURFACE_DEPTH, unordered, threePieces));
    }

    @Test
    @DisplayName("Inmutabilidad: los arrays se copian en la entrada y en la salida")
    void profile_shouldBeImmutable() {
        // ACT
        breakpoints[1] = 4.0;
        coefficients[0][0] = 100.0;
        profile.getCoefficients()[1][0] = 100.0;
        profile.getBreakpoints()[1] = 4.0;

        // ASSERT
        assertEquals(1.2, profile.densityAt(2.0), 1e-12);
        assertThat(profile.getBreakpoints()).containsExactly(0.0, 5.0, SURFACE_DEPTH);
        assertThat(profile.getPieceCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Igualdad por valor")
    void equals_shouldCompareByValue() {
        DepthDensityProfile same = new DepthDensityProfile(SURFACE_DEPTH,
                new double[]{0.0, 5.0, SURFACE_DEPTH}, new double[][]{{1.0, 0.1, 0.0}, {1.5, 0.1, 0.0}});

        assertThat(same).isEqualTo(profile).hasSameHashCodeAs(profile);
        assertThat(profile.getSurfaceDepth()).isEqualTo(SURFACE_DEPTH);
    }
}
