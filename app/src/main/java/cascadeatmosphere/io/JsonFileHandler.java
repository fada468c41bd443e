package cascadeatmosphere.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Gestiona la serialización (escritura) y deserialización (lectura) de objetos
 * hacia y desde archivos JSON.
 * <p>
 * La escritura pasa por un fichero temporal en el mismo directorio que se mueve sobre el
 * destino al terminar, de forma que un fallo a mitad de escritura no deja un JSON truncado.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y es thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, será sobrescrito.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath Ruta del archivo de destino (ej: "data/atmosphere_cache.json").
     * @param <T>      El tipo del objeto a serializar.
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public <T> void writeToFile(T data, Path filePath) throws IOException {
        Path path = filePath.toAbsolutePath();
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path);

        try {
            Files.createDirectories(path.getParent());
            Path temporary = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temporary.toFile(), data);
                Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temporary);
            }
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON para reconstruir un objeto de un tipo específico.
     *
     * @param filePath   La ruta del archivo JSON a leer.
     * @param objectType El tipo de clase al que se debe convertir el JSON.
     * @param <T>        El tipo del objeto a deserializar.
     * @return Una nueva instancia del objeto reconstruido desde el JSON.
     * @throws IOException Si el archivo no se encuentra o hay un error de lectura o formato.
     */
    public <T> T readFromFile(Path filePath, Class<T> objectType) throws IOException {
        Path path = filePath.toAbsolutePath();
        log.info("Deserializando archivo {} a un objeto de tipo {}", path, objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            // El llamante decide si el fallo es recuperable y con qué nivel se registra
            log.debug("Error al leer o parsear el archivo JSON desde {}", path, e);
            throw e;
        }
    }
}
