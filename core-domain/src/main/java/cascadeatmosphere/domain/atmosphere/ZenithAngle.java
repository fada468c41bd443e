package cascadeatmosphere.domain.atmosphere;

import cascadeatmosphere.physics.geometry.GeometryProvider;

/**
 * Ángulo cenital en sus dos representaciones. Los radianes se obtienen siempre a
 * través de la geometría activa y se guardan junto a los grados.
 *
 * @param degrees Ángulo entre la línea de visión y la vertical local, en grados.
 * @param radians El mismo ángulo en radianes.
 */
public record ZenithAngle(double degrees, double radians) {

    public ZenithAngle {
        if (Double.isNaN(degrees) || Double.isNaN(radians)) {
            throw new IllegalArgumentException("El ángulo cenital no puede ser NaN.");
        }
    }

    public static ZenithAngle of(double degrees, GeometryProvider geometry) {
        return new ZenithAngle(degrees, geometry.toRadians(degrees));
    }

    public double cosine() {
        return Math.cos(radians);
    }
}
