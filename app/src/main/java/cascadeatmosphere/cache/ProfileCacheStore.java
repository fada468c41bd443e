package cascadeatmosphere.cache;

import cascadeatmosphere.domain.profile.DepthDensityProfile;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Contenedor de la caché persistente de perfiles.
 * <p>
 * Para cada {@link CacheKey} guarda un mapa ordenado ángulo cenital (grados) → perfil.
 * Es un objeto de valor mutable que se carga y se guarda entero; no es Thread safe.
 */
public class ProfileCacheStore {

    private final Map<String, TreeMap<Double, DepthDensityProfile>> entries;

    public ProfileCacheStore() {
        this.entries = new HashMap<>();
    }

    @JsonCreator
    public ProfileCacheStore(@JsonProperty("entries") Map<String, TreeMap<Double, DepthDensityProfile>> entries) {
        this.entries = new HashMap<>();
        if (entries != null) {
            entries.forEach((key, profiles) -> this.entries.put(key, profiles == null ? new TreeMap<>() : new TreeMap<>(profiles)));
        }
    }

    public static ProfileCacheStore empty() {
        return new ProfileCacheStore();
    }

    @JsonProperty("entries")
    public Map<String, TreeMap<Double, DepthDensityProfile>> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Ángulos almacenados para una clave, ordenados. Vacío si la clave no existe.
     */
    public NavigableMap<Double, DepthDensityProfile> profilesFor(CacheKey key) {
        TreeMap<Double, DepthDensityProfile> profiles = entries.get(key.storageKey());
        return profiles == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(profiles);
    }

    /**
     * Busca el ángulo almacenado más cercano al pedido.
     *
     * @return El par (ángulo almacenado, perfil) más cercano, o vacío si la clave no tiene ángulos.
     *         El perfil puede ser {@code null} si la entrada está corrupta.
     */
    public Optional<Map.Entry<Double, DepthDensityProfile>> findClosest(CacheKey key, double angleDeg) {
        NavigableMap<Double, DepthDensityProfile> profiles = profilesFor(key);
        if (profiles.isEmpty()) {
            return Optional.empty();
        }
        Map.Entry<Double, DepthDensityProfile> floor = profiles.floorEntry(angleDeg);
        Map.Entry<Double, DepthDensityProfile> ceiling = profiles.ceilingEntry(angleDeg);
        if (floor == null) {
            return Optional.of(ceiling);
        }
        if (ceiling == null) {
            return Optional.of(floor);
        }
        // En caso de empate gana el ángulo menor
        return Optional.of((angleDeg - floor.getKey() <= ceiling.getKey() - angleDeg) ? floor : ceiling);
    }

    public void put(CacheKey key, double angleDeg, DepthDensityProfile profile) {
        entries.computeIfAbsent(key.storageKey(), k -> new TreeMap<>()).put(angleDeg, profile);
    }

    public void remove(CacheKey key, double angleDeg) {
        TreeMap<Double, DepthDensityProfile> profiles = entries.get(key.storageKey());
        if (profiles != null) {
            profiles.remove(angleDeg);
        }
    }

    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }
}
