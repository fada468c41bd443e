package cascadeatmosphere.physics.model;

/**
 * Magnitudes ópticas del aire derivadas directamente de la densidad en altura.
 * No necesitan ningún perfil en profundidad, sólo {@link AtmosphereDensityModel#density}.
 */
public final class AirOptics {

    /**
     * Índice de refracción relativo (n - 1) del aire a nivel del mar, como en CORSIKA.
     */
    private static final double SEA_LEVEL_REFRACTIVITY = 0.000283;

    /**
     * Unidad de Molière del aire multiplicada por la densidad [g/cm²].
     */
    private static final double MOLIERE_COLUMN = 9.3;

    /**
     * Prohibido construir esta clase utilidad
     */
    private AirOptics() {
    }

    /**
     * Unidad de Molière del aire a una altura dada, en metros.
     */
    public static double moliereUnit(AtmosphereDensityModel model, double heightCm) {
        return MOLIERE_COLUMN / (model.density(heightCm) * 100.0);
    }

    /**
     * Índice de refracción menos uno, escalado con la densidad relativa al suelo.
     */
    public static double relativeRefractiveIndex(AtmosphereDensityModel model, double heightCm) {
        return SEA_LEVEL_REFRACTIVITY * model.density(heightCm) / model.density(0.0);
    }

    /**
     * Factor de Lorentz umbral para la emisión Cherenkov.
     */
    public static double cherenkovGamma(AtmosphereDensityModel model, double heightCm) {
        final double nrel = relativeRefractiveIndex(model, heightCm);
        return (1.0 + nrel) / Math.sqrt(2.0 * nrel + nrel * nrel);
    }

    /**
     * Ángulo de emisión Cherenkov en grados.
     */
    public static double cherenkovAngle(AtmosphereDensityModel model, double heightCm) {
        return Math.toDegrees(Math.acos(1.0 / (1.0 + relativeRefractiveIndex(model, heightCm))));
    }
}
