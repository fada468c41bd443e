package cascadeatmosphere.physics.impl;

import cascadeatmosphere.domain.atmosphere.ZenithAngle;
import cascadeatmosphere.physics.geometry.GeometryProvider;
import cascadeatmosphere.physics.model.AtmosphereDensityModel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.UnivariateIntegrator;

import java.util.concurrent.Callable;

/**
 * Tarea ejecutable que integra la densidad a lo largo de un único segmento
 * [startDistance, endDistance] de la línea de visión y evalúa la densidad en su extremo final.
 * Está diseñada para ser ejecutada en un pool de hilos: los segmentos son independientes entre sí.
 */
@Getter
@RequiredArgsConstructor
public class SlantDepthSegmentTask implements Callable<SlantDepthSegmentTask> {

    public static final double RELATIVE_ACCURACY = 0.01;
    public static final double ABSOLUTE_ACCURACY = 1e-15;
    public static final int GAUSS_POINTS = 5;
    public static final int MAX_EVALUATIONS = 1_000_000;

    // --- Entradas para la tarea ---
    private final AtmosphereDensityModel model; // Modelo de densidad (compartido, Thread safe)
    private final GeometryProvider geometry;    // Geometría de la línea de visión (compartida)
    private final ZenithAngle angle;
    private final double startDistance;         // cm desde el techo de la atmósfera
    private final double endDistance;

    // --- Resultados de la tarea ---
    private double segmentDepth;   // g/cm² acumulados en el segmento
    private double endDensity;     // g/cm³ en endDistance

    @Override
    public SlantDepthSegmentTask call() {
        final double thetaRad = angle.radians();
        final UnivariateFunction densityAlongPath = distance -> model.density(geometry.heightAt(distance, thetaRad));

        // El integrador guarda contadores internos: uno nuevo por tarea
        UnivariateIntegrator integrator = new IterativeLegendreGaussIntegrator(GAUSS_POINTS, RELATIVE_ACCURACY, ABSOLUTE_ACCURACY);
        this.segmentDepth = integrator.integrate(MAX_EVALUATIONS, densityAlongPath, startDistance, endDistance);
        this.endDensity = densityAlongPath.value(endDistance);
        return this;
    }
}
