package cascadeatmosphere.physics.profile;

import cascadeatmosphere.config.AtmosphereConfig;
import cascadeatmosphere.domain.atmosphere.ZenithAngle;
import cascadeatmosphere.domain.profile.DepthDensityProfile;
import cascadeatmosphere.physics.geometry.GeometryProvider;
import cascadeatmosphere.physics.impl.SlantDepthSegmentTask;
import cascadeatmosphere.physics.model.AtmosphereDensityModel;
import cascadeatmosphere.physics.solver.QuadraticSplineFitter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Constructor de perfiles rho(X) para un ángulo cenital.
 * <p>
 * Responsabilidades:
 * 1. Muestrear {@code steps} distancias uniformes a lo largo de la línea de visión.
 * 2. Integrar la densidad en cada segmento entre muestras (en paralelo) y acumular la
 *    profundidad inclinada X en orden de distancia.
 * 3. Ajustar un spline cuadrático interpolante rho(X) y registrar la profundidad de superficie.
 * <p>
 * Es una función pura de (modelo, ángulo, steps): no guarda ningún resultado.
 * La llamada es bloqueante y puede tardar segundos con 1000 muestras.
 */
@Slf4j
public class DensityProfileBuilder implements AutoCloseable {

    @Getter
    private final AtmosphereDensityModel model;
    @Getter
    private final GeometryProvider geometry;
    @Getter
    private final int defaultSteps;
    private final ExecutorService threadPool;

    public DensityProfileBuilder(AtmosphereDensityModel model, GeometryProvider geometry, int defaultSteps, int processorCount) {
        this.model = Objects.requireNonNull(model, "El modelo de densidad no puede ser nulo.");
        this.geometry = Objects.requireNonNull(geometry, "La geometría no puede ser nula.");
        validateSteps(defaultSteps);
        this.defaultSteps = defaultSteps;
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        log.info("DensityProfileBuilder inicializado para {} ({} muestras, {} hilos).",
                model.describe(), defaultSteps, Math.max(processorCount, 1));
    }

    public DensityProfileBuilder(AtmosphereDensityModel model, GeometryProvider geometry, AtmosphereConfig config) {
        this(model, geometry, config.getSplineSteps(), config.getCpuProcessorCount());
    }

    public DepthDensityProfile build(ZenithAngle angle) {
        return build(angle, defaultSteps);
    }

    /**
     * Calcula el perfil rho(X) para un ángulo cenital.
     *
     * @param angle Ángulo cenital.
     * @param steps Número de muestras a lo largo de la línea de visión (>= 3).
     * @return Perfil con la profundidad de superficie y el spline rho(X).
     */
    public DepthDensityProfile build(ZenithAngle angle, int steps) {
        Objects.requireNonNull(angle, "El ángulo cenital no puede ser nulo.");
        validateSteps(steps);
        log.info("Calculando spline de rho(X) para {} a {}°.", model.describe(), angle.degrees());
        long startTime = System.currentTimeMillis();

        final double pathLength = geometry.pathLength(angle.radians());
        if (!(pathLength > 0)) {
            throw new IllegalStateException("La longitud de la línea de visión debe ser positiva: " + pathLength);
        }
        double[] distances = new double[steps];
        for (int i = 0; i < steps; i++) {
            distances[i] = pathLength * i / (steps - 1);
        }

        List<SlantDepthSegmentTask> tasks = new ArrayList<>(steps - 1);
        for (int i = 1; i < steps; i++) {
            tasks.add(new SlantDepthSegmentTask(model, geometry, angle, distances[i - 1], distances[i]));
        }

        List<Future<SlantDepthSegmentTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Cálculo del perfil de densidad interrumpido.", e);
        }

        // Recombinación en orden de distancia: X acumulada y densidad en cada muestra
        double[] slantDepth = new double[steps];
        double[] density = new double[steps];
        slantDepth[0] = 0.0;
        density[0] = model.density(geometry.heightAt(distances[0], angle.radians()));
        for (int i = 1; i < steps; i++) {
            SlantDepthSegmentTask task = awaitTask(futures.get(i - 1), i);
            slantDepth[i] = slantDepth[i - 1] + task.getSegmentDepth();
            density[i] = task.getEndDensity();
        }

        PolynomialSplineFunction spline = QuadraticSplineFitter.fit(slantDepth, density);
        final double surfaceDepth = slantDepth[steps - 1];

        log.info(".. tardó {} ms. X_surf = {} g/cm²", System.currentTimeMillis() - startTime, surfaceDepth);
        if (log.isDebugEnabled()) {
            log.debug("Error medio del spline: {}", fitResidual(spline, slantDepth, density));
        }

        return new DepthDensityProfile(surfaceDepth, spline.getKnots(), extractCoefficients(spline));
    }

    private SlantDepthSegmentTask awaitTask(Future<SlantDepthSegmentTask> future, int sample) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Cálculo del perfil de densidad interrumpido.", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Error integrando el segmento que termina en la muestra " + sample, e.getCause());
        }
    }

    /**
     * Desviación típica de rho / spline(X) sobre las muestras.
     */
    private static double fitResidual(PolynomialSplineFunction spline, double[] slantDepth, double[] density) {
        double[] ratios = new double[slantDepth.length];
        for (int i = 0; i < slantDepth.length; i++) {
            ratios[i] = density[i] / spline.value(slantDepth[i]);
        }
        return new StandardDeviation(false).evaluate(ratios);
    }

    private static double[][] extractCoefficients(PolynomialSplineFunction spline) {
        PolynomialFunction[] polynomials = spline.getPolynomials();
        double[][] coefficients = new double[polynomials.length][];
        for (int i = 0; i < polynomials.length; i++) {
            coefficients[i] = polynomials[i].getCoefficients();
        }
        return coefficients;
    }

    private static void validateSteps(int steps) {
        if (steps < QuadraticSplineFitter.MINIMUM_POINTS) {
            throw new IllegalArgumentException("El número de muestras debe ser al menos " + QuadraticSplineFitter.MINIMUM_POINTS + ": " + steps);
        }
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("DensityProfileBuilder cerrado.");
    }
}
