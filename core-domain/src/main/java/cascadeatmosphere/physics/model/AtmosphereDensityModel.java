package cascadeatmosphere.physics.model;

/**
 * Define el contrato mínimo de un modelo de atmósfera: la densidad en función de la altura.
 * <p>
 * Es la única física que necesitan el resto de componentes (integración a lo largo de la
 * línea de visión, magnitudes ópticas), de modo que cualquier implementación, ya sea la
 * parametrización analítica por capas o un modelo numérico externo, es intercambiable.
 * Cada implementación valida por su cuenta qué localizaciones y estaciones admite.
 * Las implementaciones deben ser Thread safe.
 */
public interface AtmosphereDensityModel {

    /**
     * Densidad del aire.
     *
     * @param heightCm Altura sobre la superficie en cm.
     * @return Densidad en g/cm³.
     */
    double density(double heightCm);

    /**
     * Localización que describe el modelo (ej: "USStd", "Karlsruhe").
     */
    String location();

    /**
     * Estación que describe el modelo, o {@code null} si la localización no tiene estaciones.
     */
    String season();

    /**
     * Tipo de modelo, utilizado junto a localización y estación como clave de la caché de perfiles.
     */
    default String modelKind() {
        return getClass().getSimpleName();
    }

    /**
     * Etiqueta legible para los logs: "localización" o "localización/estación".
     */
    default String describe() {
        return season() == null ? location() : location() + "/" + season();
    }
}
