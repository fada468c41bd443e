package cascadeatmosphere.physics.geometry;

/**
 * Contrato de la geometría de la línea de visión.
 * <p>
 * Las implementaciones deben ser puras y sin estado: el constructor de perfiles las
 * invoca en paralelo desde varios hilos.
 */
public interface GeometryProvider {

    /**
     * Convierte un ángulo cenital de grados a radianes.
     */
    double toRadians(double angleDeg);

    /**
     * Longitud total de la línea de visión, desde el techo de la atmósfera hasta el observador.
     *
     * @param angleRad Ángulo cenital en radianes.
     * @return Longitud del camino en cm.
     */
    double pathLength(double angleRad);

    /**
     * Altura sobre la superficie de un punto de la línea de visión.
     *
     * @param distance Distancia recorrida desde el techo de la atmósfera, en cm.
     * @param angleRad Ángulo cenital en radianes.
     * @return Altura en cm.
     */
    double heightAt(double distance, double angleRad);
}
