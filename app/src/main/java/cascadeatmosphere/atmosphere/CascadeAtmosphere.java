package cascadeatmosphere.atmosphere;

import cascadeatmosphere.cache.ProfileSelection;
import cascadeatmosphere.cache.SplineCache;
import cascadeatmosphere.domain.atmosphere.ZenithAngle;
import cascadeatmosphere.domain.profile.DepthDensityProfile;
import cascadeatmosphere.physics.model.AirOptics;
import cascadeatmosphere.physics.model.AtmosphereDensityModel;
import cascadeatmosphere.physics.profile.DensityProfileBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Fachada de la atmósfera que consume el solver de cascadas.
 * <p>
 * Contrato público mínimo: {@link #density(double)}, {@link #setZenithAngle(double)},
 * {@link #densityAtDepth(double)} y {@link #inverseDensityAtDepth(double)}. La fachada no
 * sabe qué modelo concreto de densidad tiene detrás.
 * <p>
 * Mantiene un único perfil activo, el del último ángulo servido; los perfiles de otros
 * ángulos siguen en la caché pero no se retienen en memoria.
 * No es Thread safe: está pensada para un uso secuencial.
 */
@Slf4j
public class CascadeAtmosphere implements AutoCloseable {

    private final AtmosphereDensityModel model;
    private final DensityProfileBuilder builder;
    private final SplineCache splineCache;

    private ZenithAngle zenithAngle;
    private DepthDensityProfile activeProfile;

    public CascadeAtmosphere(AtmosphereDensityModel model, DensityProfileBuilder builder, SplineCache splineCache) {
        this.model = Objects.requireNonNull(model, "El modelo de densidad no puede ser nulo.");
        this.builder = Objects.requireNonNull(builder, "El constructor de perfiles no puede ser nulo.");
        this.splineCache = Objects.requireNonNull(splineCache, "La caché de perfiles no puede ser nula.");
    }

    /**
     * Configura el ángulo cenital y deja activo el perfil rho(X) correspondiente.
     * Si el ángulo es el mismo que el activo, no hace nada.
     *
     * @param angleDeg Ángulo cenital en el detector, en grados.
     * @throws java.io.UncheckedIOException si un perfil recién calculado no se puede persistir.
     */
    public void setZenithAngle(double angleDeg) {
        if (Double.isNaN(angleDeg)) {
            throw new IllegalArgumentException("El ángulo cenital no puede ser NaN.");
        }
        if (zenithAngle != null && zenithAngle.degrees() == angleDeg) {
            log.debug("Usando el spline de densidad anterior ({}°).", angleDeg);
            return;
        }
        ProfileSelection selection = splineCache.get(angleDeg);
        this.zenithAngle = selection.servedAngle();
        this.activeProfile = selection.profile();
        log.info("Perfil activo para {}: {}° (pedido {}°), X_surf = {} g/cm²",
                model.describe(), zenithAngle.degrees(), angleDeg, activeProfile.getSurfaceDepth());
    }

    /**
     * Densidad del aire en función de la altura.
     *
     * @param heightCm Altura en cm.
     * @return Densidad en g/cm³.
     */
    public double density(double heightCm) {
        return model.density(heightCm);
    }

    /**
     * Densidad en función de la profundidad inclinada del perfil activo.
     * Las profundidades fuera de [0, X_surf] se recortan a los extremos.
     *
     * @param slantDepth Profundidad inclinada en g/cm².
     * @return Densidad en g/cm³.
     */
    public double densityAtDepth(double slantDepth) {
        return requireActiveProfile().densityAt(slantDepth);
    }

    /**
     * Inversa de la densidad, 1/rho(X), del perfil activo.
     *
     * @param slantDepth Profundidad inclinada en g/cm².
     * @return 1/rho en cm³/g.
     */
    public double inverseDensityAtDepth(double slantDepth) {
        return 1.0 / densityAtDepth(slantDepth);
    }

    /**
     * Ángulo realmente servido, o {@code null} si aún no se ha configurado ninguno.
     */
    public ZenithAngle getZenithAngle() {
        return zenithAngle;
    }

    /**
     * Profundidad inclinada en el nivel de observación para el ángulo activo.
     */
    public double getSurfaceDepth() {
        return requireActiveProfile().getSurfaceDepth();
    }

    public DepthDensityProfile getActiveProfile() {
        return requireActiveProfile();
    }

    public AtmosphereDensityModel getModel() {
        return model;
    }

    // --- MAGNITUDES ÓPTICAS ---

    public double moliereUnit(double heightCm) {
        return AirOptics.moliereUnit(model, heightCm);
    }

    public double relativeRefractiveIndex(double heightCm) {
        return AirOptics.relativeRefractiveIndex(model, heightCm);
    }

    public double cherenkovGamma(double heightCm) {
        return AirOptics.cherenkovGamma(model, heightCm);
    }

    public double cherenkovAngle(double heightCm) {
        return AirOptics.cherenkovAngle(model, heightCm);
    }

    private DepthDensityProfile requireActiveProfile() {
        if (activeProfile == null) {
            throw new IllegalStateException(getClass().getSimpleName() + ": ángulo cenital no configurado. Llame a setZenithAngle() primero.");
        }
        return activeProfile;
    }

    @Override
    public void close() {
        builder.close();
    }
}
