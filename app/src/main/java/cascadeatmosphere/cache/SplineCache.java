package cascadeatmosphere.cache;

import cascadeatmosphere.domain.atmosphere.ZenithAngle;
import cascadeatmosphere.domain.profile.DepthDensityProfile;
import cascadeatmosphere.physics.profile.DensityProfileBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Política de reutilización de perfiles rho(X) entre ángulos cenitales.
 * <p>
 * Con la caché activada, una petición se sirve con el perfil del ángulo almacenado más
 * cercano siempre que esté a menos de {@value #ANGLE_TOLERANCE_DEG}° del pedido; en ese
 * caso el ángulo servido es el almacenado. Si no hay ninguno, se calcula el perfil para el
 * ángulo pedido, se añade a la caché y se persiste. Con la caché desactivada siempre se
 * calcula y no se guarda nada.
 */
@Slf4j
public class SplineCache {

    public static final double ANGLE_TOLERANCE_DEG = 1.0;

    private final DensityProfileBuilder builder;
    private final ProfileCacheRepository repository;
    private final boolean enabled;

    public SplineCache(DensityProfileBuilder builder, ProfileCacheRepository repository, boolean enabled) {
        this.builder = Objects.requireNonNull(builder, "El constructor de perfiles no puede ser nulo.");
        if (enabled) {
            Objects.requireNonNull(repository, "Con la caché activada el repositorio no puede ser nulo.");
        }
        this.repository = repository;
        this.enabled = enabled;
    }

    /**
     * Caché desactivada: cada consulta calcula el perfil.
     */
    public static SplineCache disabled(DensityProfileBuilder builder) {
        return new SplineCache(builder, null, false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Devuelve el perfil para un ángulo cenital, reutilizando uno almacenado si está dentro de la tolerancia.
     *
     * @param angleDeg Ángulo cenital pedido en grados.
     * @return El perfil y el ángulo al que corresponde.
     * @throws UncheckedIOException si el perfil recién calculado no se puede persistir.
     */
    public ProfileSelection get(double angleDeg) {
        final ZenithAngle requested = ZenithAngle.of(angleDeg, builder.getGeometry());
        if (!enabled) {
            return new ProfileSelection(requested, builder.build(requested), false);
        }

        final CacheKey key = CacheKey.of(builder.getModel());
        ProfileCacheStore store = repository.load();

        Optional<Map.Entry<Double, DepthDensityProfile>> closest = store.findClosest(key, angleDeg);
        if (closest.isPresent()) {
            final double storedAngle = closest.get().getKey();
            final DepthDensityProfile storedProfile = closest.get().getValue();
            if (Math.abs(storedAngle - angleDeg) < ANGLE_TOLERANCE_DEG) {
                if (storedProfile != null) {
                    log.info("Usando perfil en caché de {}° para la petición de {}° ({}).", storedAngle, angleDeg, key.storageKey());
                    return new ProfileSelection(ZenithAngle.of(storedAngle, builder.getGeometry()), storedProfile, true);
                }
                log.warn("Entrada de caché corrupta para {} a {}°: se recalcula.", key.storageKey(), storedAngle);
                store.remove(key, storedAngle);
            }
        }

        DepthDensityProfile profile = builder.build(requested);
        store.put(key, angleDeg, profile);
        try {
            repository.save(store);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo (re)crear la caché de atmósfera en " + repository.getCacheFile().toAbsolutePath(), e);
        }
        return new ProfileSelection(requested, profile, false);
    }
}
