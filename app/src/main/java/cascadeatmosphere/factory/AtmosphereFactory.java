package cascadeatmosphere.factory;

import cascadeatmosphere.atmosphere.CascadeAtmosphere;
import cascadeatmosphere.cache.ProfileCacheRepository;
import cascadeatmosphere.cache.SplineCache;
import cascadeatmosphere.config.AtmosphereConfig;
import cascadeatmosphere.io.JsonFileHandler;
import cascadeatmosphere.physics.geometry.EarthGeometry;
import cascadeatmosphere.physics.geometry.GeometryProvider;
import cascadeatmosphere.physics.model.AtmosphereDensityModel;
import cascadeatmosphere.physics.model.CorsikaAtmosphere;
import cascadeatmosphere.physics.profile.DensityProfileBuilder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Fábrica responsable de ensamblar una {@link CascadeAtmosphere} lista para usar:
 * geometría, constructor de perfiles, caché persistente y fachada.
 */
@Slf4j
public class AtmosphereFactory {

    /**
     * Crea una atmósfera tipo CORSIKA.
     *
     * @param location Localización (ej: "USStd", "SouthPole").
     * @param season   Estación, o {@code null} para localizaciones sin estaciones.
     * @param config   Configuración de geometría, caché y muestreo.
     * @throws IllegalArgumentException si la combinación (localización, estación) no está parametrizada.
     */
    public CascadeAtmosphere createCorsika(String location, String season, AtmosphereConfig config) {
        return create(new CorsikaAtmosphere(location, season), config);
    }

    /**
     * Crea la fachada para cualquier modelo de densidad.
     */
    public CascadeAtmosphere create(AtmosphereDensityModel model, AtmosphereConfig config) {
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        GeometryProvider geometry = new EarthGeometry(config.getGeometryConfig());
        DensityProfileBuilder builder = new DensityProfileBuilder(model, geometry, config);

        SplineCache splineCache;
        if (config.isUseAtmosphereCache()) {
            Objects.requireNonNull(config.getCacheFilePath(), "Con la caché activada se necesita la ruta del fichero.");
            ProfileCacheRepository repository = new ProfileCacheRepository(new JsonFileHandler(), Path.of(config.getCacheFilePath()));
            splineCache = new SplineCache(builder, repository, true);
        } else {
            splineCache = SplineCache.disabled(builder);
        }
        log.info("Atmósfera {} creada (caché: {}).", model.describe(), config.isUseAtmosphereCache());
        return new CascadeAtmosphere(model, builder, splineCache);
    }
}
