package cascadeatmosphere.physics.solver;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para QuadraticSplineFitter.
 * Se centra en la interpolación exacta y en la continuidad C¹ del spline.
 */
class QuadraticSplineFitterTest {

    // Abscisas no uniformes, como las profundidades acumuladas a lo largo de la línea de visión
    private static final double[] X = {0.0, 0.3, 1.1, 1.5, 2.8, 3.0, 4.6, 6.1, 6.2, 8.0, 9.5, 12.0};

    @Test
    @DisplayName("El constructor debe ser privado para prohibir la instanciación")
    void constructorIsPrivate() throws NoSuchMethodException {
        Constructor<QuadraticSplineFitter> constructor = QuadraticSplineFitter.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()), "El constructor debe ser privado.");
    }

    @Test
    @DisplayName("Interpolación: el spline pasa exactamente por todas las muestras")
    void fit_shouldInterpolateEverySample() {
        // ARRANGE
        double[] y = new double[X.length];
        for (int i = 0; i < X.length; i++) {
            y[i] = Math.exp(-X[i] / 3.0);
        }

        // ACT
        PolynomialSplineFunction spline = QuadraticSplineFitter.fit(X, y);

        // ASSERT
        for (int i = 0; i < X.length; i++) {
            assertEquals(y[i], spline.value(X[i]), 1e-12, "El spline no pasa por la muestra " + i);
        }
    }

    @Test
    @DisplayName("Reproducción exacta: una parábola se recupera en todo el dominio")
    void fit_shouldReproduceQuadraticExactly() {
        // ARRANGE
        double[] y = new double[X.length];
        for (int i = 0; i < X.length; i++) {
            y[i] = quadratic(X[i]);
        }

        // ACT
        PolynomialSplineFunction spline = QuadraticSplineFitter.fit(X, y);

        // ASSERT: también entre muestras
        for (int i = 0; i <= 240; i++) {
            final double x = 12.0 * i / 240.0;
            assertEquals(quadratic(x), spline.value(x), 1e-9, "Desviación en x=" + x);
        }
    }

    @Test
    @DisplayName("Estructura: n - 2 tramos con dominio [x0, xn-1]")
    void fit_shouldProduceExpectedPieces() {
        // ARRANGE
        double[] y = new double[X.length];

        // ACT
        PolynomialSplineFunction spline = QuadraticSplineFitter.fit(X, y);

        // ASSERT
        assertEquals(X.length - 2, spline.getN());
        assertEquals(X[0], spline.getKnots()[0]);
        assertEquals(X[X.length - 1], spline.getKnots()[spline.getN()]);
        // Primer nudo interior en el punto medio de x1 y x2
        assertEquals(0.5 * (X[1] + X[2]), spline.getKnots()[1], 1e-15);
    }

    @Test
    @DisplayName("Continuidad C¹: valor y pendiente coinciden a ambos lados de cada nudo")
    void fit_shouldBeContinuouslyDifferentiable() {
        // ARRANGE
        double[] y = new double[X.length];
        for (int i = 0; i < X.length; i++) {
            y[i] = Math.sin(X[i]) + 0.1 * X[i];
        }

        // ACT
        PolynomialSplineFunction spline = QuadraticSplineFitter.fit(X, y);

        // ASSERT
        double[] knots = spline.getKnots();
        PolynomialFunction[] pieces = spline.getPolynomials();
        for (int p = 0; p < pieces.length - 1; p++) {
            final double width = knots[p + 1] - knots[p];
            assertEquals(pieces[p].value(width), pieces[p + 1].value(0.0), 1e-12, "Salto de valor en el nudo " + (p + 1));
            assertEquals(pieces[p].polynomialDerivative().value(width), pieces[p + 1].polynomialDerivative().value(0.0), 1e-10,
                    "Salto de pendiente en el nudo " + (p + 1));
        }
    }

    @Test
    @DisplayName("Caso mínimo: tres puntos definen una única parábola")
    void fit_withThreePoints_shouldReturnSinglePiece() {
        // ARRANGE
        double[] x = {0.0, 1.0, 3.0};
        double[] y = {quadratic(0.0), quadratic(1.0), quadratic(3.0)};

        // ACT
        PolynomialSplineFunction spline = QuadraticSplineFitter.fit(x, y);

        // ASSERT
        assertEquals(1, spline.getN());
        assertEquals(quadratic(2.0), spline.value(2.0), 1e-12);
    }

    @Test
    @DisplayName("Entradas inválidas: debe lanzar IllegalArgumentException")
    void fit_withInvalidInput_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> QuadraticSplineFitter.fit(new double[]{0.0, 1.0}, new double[]{0.0, 1.0}));
        assertThrows(IllegalArgumentException.class,
                () -> QuadraticSplineFitter.fit(new double[]{0.0, 1.0, 2.0}, new double[]{0.0, 1.0}));
        assertThrows(IllegalArgumentException.class,
                () -> QuadraticSplineFitter.fit(new double[]{0.0, 2.0, 2.0, 3.0}, new double[]{0.0, 1.0, 2.0, 3.0}));
        assertThrows(NullPointerException.class, () -> QuadraticSplineFitter.fit(null, new double[3]));
    }

    private static double quadratic(double x) {
        return 3.0 - 2.0 * x + 0.5 * x * x;
    }
}
