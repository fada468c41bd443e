package cascadeatmosphere.domain.atmosphere;

import java.util.Objects;

/**
 * Identidad de una atmósfera CORSIKA: par (localización, estación).
 * <p>
 * Se valida contra la tabla cerrada {@link CorsikaParameterTable} en el momento de la
 * construcción, de modo que nunca existe una identidad para una combinación no
 * parametrizada.
 *
 * @param location Etiqueta de la localización (ej: "USStd", "SouthPole").
 * @param season   Estación (ej: "December"), o {@code null} si la localización no tiene estaciones.
 */
public record AtmosphereIdentity(String location, String season) {

    public AtmosphereIdentity {
        Objects.requireNonNull(location, "La localización no puede ser nula.");
        if (CorsikaParameterTable.find(location, season).isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    "La atmósfera '%s' (estación: %s) no está parametrizada.", location, season));
        }
    }

    public static AtmosphereIdentity of(String location) {
        return new AtmosphereIdentity(location, null);
    }

    public static AtmosphereIdentity of(String location, String season) {
        return new AtmosphereIdentity(location, season);
    }

    /**
     * Entrada de la tabla CORSIKA asociada. Siempre existe tras la validación del constructor.
     */
    public CorsikaParameterTable tableEntry() {
        return CorsikaParameterTable.find(location, season).orElseThrow();
    }

    @Override
    public String toString() {
        return season == null ? location : location + "/" + season;
    }
}
