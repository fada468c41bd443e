package cascadeatmosphere.cache;

import cascadeatmosphere.physics.model.AtmosphereDensityModel;

import java.util.Objects;

/**
 * Clave de la caché de perfiles: (tipo de modelo, localización, estación).
 *
 * @param modelKind Tipo de modelo de densidad (ej: "CorsikaAtmosphere").
 * @param location  Localización de la atmósfera.
 * @param season    Estación, o {@code null}.
 */
public record CacheKey(String modelKind, String location, String season) {

    private static final String SEPARATOR = "|";

    public CacheKey {
        Objects.requireNonNull(modelKind, "El tipo de modelo no puede ser nulo.");
        Objects.requireNonNull(location, "La localización no puede ser nula.");
    }

    public static CacheKey of(AtmosphereDensityModel model) {
        return new CacheKey(model.modelKind(), model.location(), model.season());
    }

    /**
     * Representación textual usada como clave del mapa persistido en JSON.
     */
    public String storageKey() {
        return modelKind + SEPARATOR + location + SEPARATOR + (season == null ? "" : season);
    }
}
