package cascadeatmosphere.physics.solver;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.Objects;

/**
 * Spline interpolante de grado 2 sin suavizado (s = 0).
 * <p>
 * Como en FITPACK para grado par, los nudos interiores se colocan en los puntos medios
 * entre muestras interiores consecutivas: con n muestras quedan n - 3 nudos interiores y
 * exactamente n B-splines cuadráticos, de modo que el sistema de interpolación es
 * tridiagonal y se resuelve con el algoritmo de Thomas. El resultado es C¹ y pasa
 * exactamente por todas las muestras.
 * <p>
 * El spline se devuelve en forma de potencias por tramo ({@link PolynomialSplineFunction}),
 * que es la representación que se persiste.
 */
public final class QuadraticSplineFitter {

    public static final int DEGREE = 2;
    public static final int MINIMUM_POINTS = DEGREE + 1;

    /**
     * Prohibido construir esta clase utilidad
     */
    private QuadraticSplineFitter() {
    }

    /**
     * Ajusta el spline que interpola los puntos (x, y).
     *
     * @param x Abscisas estrictamente crecientes.
     * @param y Ordenadas, misma longitud que x.
     * @return Spline cuadrático por tramos sobre [x[0], x[n-1]].
     * @throws IllegalArgumentException si hay menos de 3 puntos, las longitudes difieren o x no es creciente.
     */
    public static PolynomialSplineFunction fit(double[] x, double[] y) {
        Objects.requireNonNull(x, "Las abscisas no pueden ser nulas.");
        Objects.requireNonNull(y, "Las ordenadas no pueden ser nulas.");
        final int n = x.length;
        if (n < MINIMUM_POINTS) {
            throw new IllegalArgumentException("Se necesitan al menos " + MINIMUM_POINTS + " puntos para un spline cuadrático.");
        }
        if (y.length != n) {
            throw new IllegalArgumentException("Las abscisas y las ordenadas deben tener la misma longitud.");
        }
        for (int i = 0; i < n - 1; i++) {
            if (!(x[i] < x[i + 1])) {
                throw new IllegalArgumentException(String.format(
                        "Las abscisas deben ser estrictamente crecientes (x[%d]=%g, x[%d]=%g).", i, x[i], i + 1, x[i + 1]));
            }
        }

        final double[] knots = buildKnotVector(x);
        final double[] coefficients = solveInterpolation(x, y, knots);
        return toPiecewisePolynomial(knots, coefficients, n);
    }

    /**
     * Vector de nudos con multiplicidad 3 en los extremos y nudos interiores en los puntos
     * medios (x[i] + x[i+1]) / 2, i = 1..n-3. Longitud n + 3.
     */
    private static double[] buildKnotVector(double[] x) {
        final int n = x.length;
        double[] t = new double[n + DEGREE + 1];
        for (int k = 0; k <= DEGREE; k++) {
            t[k] = x[0];
            t[n + k] = x[n - 1];
        }
        for (int i = 1; i <= n - 3; i++) {
            t[DEGREE + i] = 0.5 * (x[i] + x[i + 1]);
        }
        return t;
    }

    /**
     * Resuelve los coeficientes B-spline. La muestra i (interior) cae en el tramo
     * [t[i+1], t[i+2]), donde sólo son no nulos N(i-1), N(i), N(i+1).
     */
    private static double[] solveInterpolation(double[] x, double[] y, double[] t) {
        final int n = x.length;
        double[] lower = new double[n];
        double[] diagonal = new double[n];
        double[] upper = new double[n];

        // Los extremos coinciden con nudos triples: sólo el primer/último B-spline vale 1
        diagonal[0] = 1.0;
        diagonal[n - 1] = 1.0;
        for (int i = 1; i < n - 1; i++) {
            double[] basis = basisFunctions(t, i + 1, x[i]);
            lower[i] = basis[0];
            diagonal[i] = basis[1];
            upper[i] = basis[2];
        }

        // Algoritmo de Thomas
        double[] cPrime = new double[n];
        double[] dPrime = new double[n];
        cPrime[0] = upper[0] / diagonal[0];
        dPrime[0] = y[0] / diagonal[0];
        for (int i = 1; i < n; i++) {
            final double m = diagonal[i] - lower[i] * cPrime[i - 1];
            cPrime[i] = (i < n - 1) ? upper[i] / m : 0.0;
            dPrime[i] = (y[i] - lower[i] * dPrime[i - 1]) / m;
        }
        double[] coefficients = new double[n];
        coefficients[n - 1] = dPrime[n - 1];
        for (int i = n - 2; i >= 0; i--) {
            coefficients[i] = dPrime[i] - cPrime[i] * coefficients[i + 1];
        }
        return coefficients;
    }

    /**
     * B-splines cuadráticos no nulos en x, dentro del tramo [t[span], t[span+1]).
     * Recurrencia de Cox-de Boor.
     */
    private static double[] basisFunctions(double[] t, int span, double x) {
        double[] basis = new double[DEGREE + 1];
        double[] left = new double[DEGREE + 1];
        double[] right = new double[DEGREE + 1];
        basis[0] = 1.0;
        for (int j = 1; j <= DEGREE; j++) {
            left[j] = x - t[span + 1 - j];
            right[j] = t[span + j] - x;
            double saved = 0.0;
            for (int r = 0; r < j; r++) {
                final double temp = basis[r] / (right[r + 1] + left[j - r]);
                basis[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            basis[j] = saved;
        }
        return basis;
    }

    /**
     * Convierte la representación B-spline a potencias de (x - t[l]) en cada tramo.
     * La derivada es un spline lineal con coeficientes d[j] = 2 (c[j] - c[j-1]) / (t[j+2] - t[j]),
     * que vale d[l-1] en el nudo t[l].
     */
    private static PolynomialSplineFunction toPiecewisePolynomial(double[] t, double[] c, int n) {
        double[] derivative = new double[n];
        for (int j = 1; j < n; j++) {
            derivative[j] = DEGREE * (c[j] - c[j - 1]) / (t[j + 2] - t[j]);
        }

        final int pieces = n - DEGREE;
        double[] breakpoints = new double[pieces + 1];
        PolynomialFunction[] polynomials = new PolynomialFunction[pieces];
        for (int p = 0; p < pieces; p++) {
            final int l = p + DEGREE;
            final double width = t[l + 1] - t[l];
            final double value = (c[l - 2] * (t[l + 1] - t[l]) + c[l - 1] * (t[l] - t[l - 1])) / (t[l + 1] - t[l - 1]);
            final double slope = derivative[l - 1];
            final double curvature = (derivative[l] - derivative[l - 1]) / (2.0 * width);
            breakpoints[p] = t[l];
            polynomials[p] = new PolynomialFunction(new double[]{value, slope, curvature});
        }
        breakpoints[pieces] = t[n];
        return new PolynomialSplineFunction(breakpoints, polynomials);
    }
}
