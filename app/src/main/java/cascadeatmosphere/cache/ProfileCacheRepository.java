package cascadeatmosphere.cache;

import cascadeatmosphere.io.JsonFileHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Ciclo de vida del fichero de caché: carga y guardado del {@link ProfileCacheStore} completo.
 * <p>
 * Supone un único proceso: el fichero se relee en cada consulta y se reescribe entero en
 * cada actualización, sin bloqueo. Dos procesos que compartan el mismo fichero compiten y
 * gana la última escritura.
 */
@Slf4j
public class ProfileCacheRepository {

    private final JsonFileHandler jsonFileHandler;
    @Getter
    private final Path cacheFile;

    public ProfileCacheRepository(JsonFileHandler jsonFileHandler, Path cacheFile) {
        this.jsonFileHandler = Objects.requireNonNull(jsonFileHandler, "El gestor JSON no puede ser nulo.");
        this.cacheFile = Objects.requireNonNull(cacheFile, "La ruta de la caché no puede ser nula.");
    }

    /**
     * Carga la caché. Un fichero inexistente o ilegible no es un error: se devuelve una caché vacía.
     */
    public ProfileCacheStore load() {
        if (!Files.exists(cacheFile)) {
            log.info("No existe caché de atmósfera en {}: se crea una nueva.", cacheFile.toAbsolutePath());
            return ProfileCacheStore.empty();
        }
        try {
            ProfileCacheStore store = jsonFileHandler.readFromFile(cacheFile, ProfileCacheStore.class);
            return store != null ? store : ProfileCacheStore.empty();
        } catch (IOException e) {
            log.warn("Caché de atmósfera ilegible en {} ({}): se descarta.", cacheFile.toAbsolutePath(), e.getMessage());
            return ProfileCacheStore.empty();
        }
    }

    /**
     * Sobrescribe el fichero de caché.
     *
     * @throws IOException si no se puede (re)crear el fichero.
     */
    public void save(ProfileCacheStore store) throws IOException {
        log.debug("Guardando caché de atmósfera con {} perfiles.", store.size());
        jsonFileHandler.writeToFile(store, cacheFile);
    }
}
