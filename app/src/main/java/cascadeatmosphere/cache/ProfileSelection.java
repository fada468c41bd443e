package cascadeatmosphere.cache;

import cascadeatmosphere.domain.atmosphere.ZenithAngle;
import cascadeatmosphere.domain.profile.DepthDensityProfile;

import java.util.Objects;

/**
 * Resultado de una consulta a la caché: el perfil servido y el ángulo al que realmente
 * corresponde, que puede diferir del pedido si se reutilizó un ángulo almacenado cercano.
 *
 * @param servedAngle Ángulo del perfil servido.
 * @param profile     Perfil rho(X).
 * @param fromCache   {@code true} si el perfil se leyó de la caché en lugar de calcularse.
 */
public record ProfileSelection(ZenithAngle servedAngle, DepthDensityProfile profile, boolean fromCache) {

    public ProfileSelection {
        Objects.requireNonNull(servedAngle, "El ángulo servido no puede ser nulo.");
        Objects.requireNonNull(profile, "El perfil no puede ser nulo.");
    }
}
