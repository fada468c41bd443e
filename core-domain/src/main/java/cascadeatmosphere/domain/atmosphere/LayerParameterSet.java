package cascadeatmosphere.domain.atmosphere;

import java.util.Arrays;
import java.util.Objects;

/**
 * Conjunto inmutable de coeficientes de una parametrización tipo Linsley/CORSIKA.
 * <p>
 * La atmósfera se divide en {@value #LAYER_COUNT} capas. Las cuatro primeras siguen
 * la ley exponencial {@code X(h) = a + b·exp(-h/c)} y la capa superior decrece
 * linealmente, {@code X(h) = a - h/c}. Cada capa tiene además su frontera en el
 * dominio de alturas ({@code hlay}, creciente) y en el dominio de profundidades
 * ({@code thickl}, decreciente).
 */
public final class LayerParameterSet {

    public static final int LAYER_COUNT = 5;
    public static final int TOP_LAYER = LAYER_COUNT - 1;

    private final double[] a;
    private final double[] b;
    private final double[] c;
    private final double[] depthBoundaries;
    private final double[] heightBoundaries;

    /**
     * @param a                Término independiente de cada capa [g/cm²].
     * @param b                Amplitud de cada capa [g/cm²].
     * @param c                Escala de altura de cada capa [cm].
     * @param depthBoundaries  Profundidad vertical a la que empieza cada capa (thickl) [g/cm²].
     * @param heightBoundaries Altura a la que empieza cada capa (hlay) [cm].
     */
    public LayerParameterSet(double[] a, double[] b, double[] c,
                             double[] depthBoundaries, double[] heightBoundaries) {
        Objects.requireNonNull(a, "El array de coeficientes a no puede ser nulo.");
        Objects.requireNonNull(b, "El array de coeficientes b no puede ser nulo.");
        Objects.requireNonNull(c, "El array de coeficientes c no puede ser nulo.");
        Objects.requireNonNull(depthBoundaries, "El array de fronteras en profundidad no puede ser nulo.");
        Objects.requireNonNull(heightBoundaries, "El array de fronteras en altura no puede ser nulo.");

        if (a.length != LAYER_COUNT || b.length != LAYER_COUNT || c.length != LAYER_COUNT
                || depthBoundaries.length != LAYER_COUNT || heightBoundaries.length != LAYER_COUNT) {
            throw new IllegalArgumentException("Todos los arrays de parámetros deben tener " + LAYER_COUNT + " capas.");
        }
        for (int i = 0; i < LAYER_COUNT; i++) {
            if (c[i] <= 0) {
                throw new IllegalArgumentException("La escala c de la capa " + i + " debe ser positiva.");
            }
        }
        for (int i = 0; i < LAYER_COUNT - 1; i++) {
            if (heightBoundaries[i] >= heightBoundaries[i + 1]) {
                throw new IllegalArgumentException(String.format(
                        "Las fronteras en altura deben ser estrictamente crecientes (capa %d: %.1f >= %.1f).",
                        i, heightBoundaries[i], heightBoundaries[i + 1]));
            }
            if (depthBoundaries[i] <= depthBoundaries[i + 1]) {
                throw new IllegalArgumentException(String.format(
                        "Las fronteras en profundidad deben ser estrictamente decrecientes (capa %d: %.6f <= %.6f).",
                        i, depthBoundaries[i], depthBoundaries[i + 1]));
            }
        }

        this.a = a.clone();
        this.b = b.clone();
        this.c = c.clone();
        this.depthBoundaries = depthBoundaries.clone();
        this.heightBoundaries = heightBoundaries.clone();
    }

    public double getA(int layer) {
        validateLayer(layer);
        return a[layer];
    }

    public double getB(int layer) {
        validateLayer(layer);
        return b[layer];
    }

    public double getC(int layer) {
        validateLayer(layer);
        return c[layer];
    }

    public double getDepthBoundary(int layer) {
        validateLayer(layer);
        return depthBoundaries[layer];
    }

    public double getHeightBoundary(int layer) {
        validateLayer(layer);
        return heightBoundaries[layer];
    }

    public double[] cloneHeightBoundaries() {
        return heightBoundaries.clone();
    }

    public double[] cloneDepthBoundaries() {
        return depthBoundaries.clone();
    }

    private void validateLayer(int layer) {
        if (layer < 0 || layer >= LAYER_COUNT) {
            throw new IndexOutOfBoundsException("La capa " + layer + " está fuera de los límites [0, " + TOP_LAYER + "].");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LayerParameterSet that)) return false;
        return Arrays.equals(a, that.a) && Arrays.equals(b, that.b) && Arrays.equals(c, that.c)
                && Arrays.equals(depthBoundaries, that.depthBoundaries)
                && Arrays.equals(heightBoundaries, that.heightBoundaries);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(a);
        result = 31 * result + Arrays.hashCode(b);
        result = 31 * result + Arrays.hashCode(c);
        result = 31 * result + Arrays.hashCode(depthBoundaries);
        result = 31 * result + Arrays.hashCode(heightBoundaries);
        return result;
    }
}
