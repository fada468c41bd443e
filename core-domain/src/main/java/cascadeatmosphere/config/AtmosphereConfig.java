package cascadeatmosphere.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor principal para la configuración de un modelo de atmósfera en cascada.
 * Agrupa la geometría de la línea de visión con los parámetros de cálculo de los
 * perfiles de densidad y de su caché persistente.
 */
@Value
@Builder
@With
public class AtmosphereConfig {

    /**
     * Número de muestras por defecto a lo largo de la línea de visión.
     */
    public static final int DEFAULT_SPLINE_STEPS = 1000;

    /**
     * Geometría terrestre usada para convertir distancia recorrida en altura.
     */
    GeometryConfig geometryConfig;

    /**
     * Activa la reutilización de perfiles ya calculados desde el fichero de caché.
     */
    boolean useAtmosphereCache;

    /**
     * Ruta del fichero JSON donde se persisten los perfiles calculados.
     */
    String cacheFilePath;

    /**
     * Número de muestras de distancia utilizadas para ajustar el spline rho(X).
     */
    int splineSteps;

    /**
     * Número de hilos CPU para integrar los segmentos de la línea de visión
     */
    int cpuProcessorCount;

    /**
     * Configuración por defecto: geometría estándar, caché activada en el directorio
     * de trabajo y 1000 muestras.
     */
    public static AtmosphereConfig getDefault() {
        return AtmosphereConfig.builder()
                .geometryConfig(GeometryConfig.getStandardEarth())
                .useAtmosphereCache(true)
                .cacheFilePath("data/atmosphere_cache.json")
                .splineSteps(DEFAULT_SPLINE_STEPS)
                .cpuProcessorCount(Runtime.getRuntime().availableProcessors())
                .build();
    }
}
