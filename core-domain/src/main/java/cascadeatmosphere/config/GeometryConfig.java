package cascadeatmosphere.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con los parámetros de la geometría esférica de la Tierra
 * utilizada para trazar la línea de visión del observador a través de la atmósfera.
 * <p>
 * Todas las longitudes se expresan en centímetros, que es la unidad de trabajo de las
 * parametrizaciones tipo CORSIKA.
 *
 * @param earthRadius       Radio terrestre en cm.
 * @param observationHeight Altura del observador sobre la superficie en cm.
 * @param atmosphereHeight  Altura del techo de la atmósfera (donde X = 0) en cm.
 */
@Builder
@With
public record GeometryConfig(
        double earthRadius,
        double observationHeight,
        double atmosphereHeight
) {

    public GeometryConfig {
        if (earthRadius <= 0) {
            throw new IllegalArgumentException("El radio terrestre debe ser positivo.");
        }
        if (observationHeight < 0) {
            throw new IllegalArgumentException("La altura de observación no puede ser negativa.");
        }
        if (atmosphereHeight <= observationHeight) {
            throw new IllegalArgumentException(String.format(
                    "El techo de la atmósfera (%.1f cm) debe estar por encima del observador (%.1f cm).",
                    atmosphereHeight, observationHeight));
        }
    }

    /**
     * Geometría de referencia: Tierra de 6391 km, observador a nivel del mar y
     * atmósfera de 112.8 km.
     */
    public static GeometryConfig getStandardEarth() {
        return GeometryConfig.builder()
                .earthRadius(6391.0e5)
                .observationHeight(0.0)
                .atmosphereHeight(112.8e5)
                .build();
    }
}
