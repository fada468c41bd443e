package cascadeatmosphere.physics.geometry;

import cascadeatmosphere.config.GeometryConfig;

import java.util.Objects;

/**
 * Geometría de Tierra esférica.
 * <p>
 * El observador se sitúa a {@code observationHeight} sobre una esfera de radio
 * {@code earthRadius}; la atmósfera termina a {@code atmosphereHeight}. La distancia
 * recorrida se mide desde el punto en el que la línea de visión entra en la atmósfera,
 * de forma que la distancia 0 corresponde a X = 0.
 * Esta clase es Thread safe.
 */
public final class EarthGeometry implements GeometryProvider {

    private final double earthRadius;
    private final double observerRadius;
    private final double topRadius;

    public EarthGeometry(GeometryConfig config) {
        Objects.requireNonNull(config, "La configuración geométrica no puede ser nula.");
        this.earthRadius = config.earthRadius();
        this.observerRadius = config.earthRadius() + config.observationHeight();
        this.topRadius = config.earthRadius() + config.atmosphereHeight();
    }

    @Override
    public double toRadians(double angleDeg) {
        return Math.PI / 180.0 * angleDeg;
    }

    @Override
    public double pathLength(double angleRad) {
        final double perpendicular = observerRadius * Math.sin(angleRad);
        return Math.sqrt(topRadius * topRadius - perpendicular * perpendicular) - observerRadius * Math.cos(angleRad);
    }

    @Override
    public double heightAt(double distance, double angleRad) {
        final double perpendicular = observerRadius * Math.sin(angleRad);
        // Proyección sobre la vertical del observador del punto situado a 'distance' del techo
        final double along = observerRadius * Math.cos(angleRad) + pathLength(angleRad) - distance;
        return Math.sqrt(perpendicular * perpendicular + along * along) - earthRadius;
    }
}
