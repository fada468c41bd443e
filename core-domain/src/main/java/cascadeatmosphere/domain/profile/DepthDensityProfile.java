package cascadeatmosphere.domain.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.Arrays;
import java.util.Objects;

/**
 * Perfil inmutable de densidad en función de la profundidad inclinada, rho(X), para una
 * atmósfera y un ángulo cenital concretos.
 * <p>
 * El interpolante es un spline cuadrático por tramos cuyo dominio es exactamente
 * {@code [0, surfaceDepth]}. Se guarda como puntos de ruptura más los coeficientes de cada
 * tramo (en potencias de {@code X - breakpoint}) para poder persistirlo en JSON; la
 * evaluación se delega en {@link PolynomialSplineFunction}.
 * <p>
 * Fuera del dominio la profundidad se recorta a sus extremos: X &lt; 0 se evalúa en el
 * techo de la atmósfera y X &gt; surfaceDepth en el nivel del observador.
 */
public final class DepthDensityProfile {

    private static final double DOMAIN_TOLERANCE = 1e-9;

    private final double surfaceDepth;
    private final double[] breakpoints;
    private final double[][] coefficients;

    @JsonIgnore
    private final PolynomialSplineFunction spline;

    /**
     * @param surfaceDepth Profundidad inclinada total a lo largo de la línea de visión [g/cm²].
     * @param breakpoints  Puntos de ruptura estrictamente crecientes, de 0 a surfaceDepth.
     * @param coefficients Coeficientes de cada tramo, {@code breakpoints.length - 1} filas.
     */
    @JsonCreator
    public DepthDensityProfile(@JsonProperty("surfaceDepth") double surfaceDepth,
                               @JsonProperty("breakpoints") double[] breakpoints,
                               @JsonProperty("coefficients") double[][] coefficients) {
        Objects.requireNonNull(breakpoints, "Los puntos de ruptura no pueden ser nulos.");
        Objects.requireNonNull(coefficients, "Los coeficientes del spline no pueden ser nulos.");

        if (!(surfaceDepth > 0)) {
            throw new IllegalArgumentException("La profundidad de superficie debe ser positiva: " + surfaceDepth);
        }
        if (breakpoints.length < 2 || coefficients.length != breakpoints.length - 1) {
            throw new IllegalArgumentException(String.format(
                    "Dimensiones del spline inconsistentes: %d puntos de ruptura y %d tramos.",
                    breakpoints.length, coefficients.length));
        }
        if (Math.abs(breakpoints[0]) > DOMAIN_TOLERANCE
                || Math.abs(breakpoints[breakpoints.length - 1] - surfaceDepth) > DOMAIN_TOLERANCE * surfaceDepth) {
            throw new IllegalArgumentException(String.format(
                    "El dominio del spline [%g, %g] debe coincidir con [0, %g].",
                    breakpoints[0], breakpoints[breakpoints.length - 1], surfaceDepth));
        }

        PolynomialFunction[] polynomials = new PolynomialFunction[coefficients.length];
        for (int i = 0; i < coefficients.length; i++) {
            Objects.requireNonNull(coefficients[i], "Faltan los coeficientes del tramo " + i);
            polynomials[i] = new PolynomialFunction(coefficients[i]);
        }

        this.surfaceDepth = surfaceDepth;
        this.breakpoints = breakpoints.clone();
        this.coefficients = new double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            this.coefficients[i] = coefficients[i].clone();
        }
        // Lanza NonMonotonicSequenceException si los puntos de ruptura no son crecientes
        this.spline = new PolynomialSplineFunction(this.breakpoints, polynomials);
    }

    /**
     * Densidad a una profundidad inclinada dada, con recorte al dominio del perfil.
     *
     * @param slantDepth Profundidad inclinada X [g/cm²].
     * @return Densidad [g/cm³].
     */
    public double densityAt(double slantDepth) {
        if (Double.isNaN(slantDepth)) {
            throw new IllegalArgumentException("La profundidad inclinada no puede ser NaN.");
        }
        final double clamped = Math.min(Math.max(slantDepth, breakpoints[0]), breakpoints[breakpoints.length - 1]);
        return spline.value(clamped);
    }

    @JsonProperty("surfaceDepth")
    public double getSurfaceDepth() {
        return surfaceDepth;
    }

    @JsonProperty("breakpoints")
    public double[] getBreakpoints() {
        return breakpoints.clone();
    }

    @JsonProperty("coefficients")
    public double[][] getCoefficients() {
        double[][] copy = new double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            copy[i] = coefficients[i].clone();
        }
        return copy;
    }

    @JsonIgnore
    public int getPieceCount() {
        return coefficients.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DepthDensityProfile that)) return false;
        return Double.compare(surfaceDepth, that.surfaceDepth) == 0
                && Arrays.equals(breakpoints, that.breakpoints)
                && Arrays.deepEquals(coefficients, that.coefficients);
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(surfaceDepth);
        result = 31 * result + Arrays.hashCode(breakpoints);
        result = 31 * result + Arrays.deepHashCode(coefficients);
        return result;
    }

    @Override
    public String toString() {
        return String.format("DepthDensityProfile[surfaceDepth=%.3f g/cm², tramos=%d]", surfaceDepth, coefficients.length);
    }
}
