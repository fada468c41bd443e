package cascadeatmosphere.physics.model;

import cascadeatmosphere.domain.atmosphere.AtmosphereIdentity;
import cascadeatmosphere.domain.atmosphere.LayerParameterSet;
import cascadeatmosphere.domain.atmosphere.ZenithAngle;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static cascadeatmosphere.domain.atmosphere.LayerParameterSet.LAYER_COUNT;
import static cascadeatmosphere.domain.atmosphere.LayerParameterSet.TOP_LAYER;

/**
 * Parametrización de la atmósfera tipo Linsley, como la del simulador de cascadas CORSIKA.
 * <p>
 * Cinco capas: en las cuatro inferiores la profundidad vertical decae exponencialmente con
 * la altura, {@code X = a + b·exp(-h/c)}, y en la superior decrece linealmente,
 * {@code X = a - h/c}. Todas las transformaciones son analíticas y exactas.
 * <p>
 * La selección de capa NO es simétrica entre los dos sentidos de la transformación:
 * <ul>
 * <li>altura → X: gana la última capa cuya frontera en altura NO cumple {@code h <= hlay};</li>
 * <li>X → altura: gana la primera capa cuya frontera en profundidad cumple {@code X >= thickl}.</li>
 * </ul>
 * Esta clase es inmutable y Thread safe.
 */
@Slf4j
public class CorsikaAtmosphere implements AtmosphereDensityModel {

    private final AtmosphereIdentity identity;
    private final LayerParameterSet parameters;

    public CorsikaAtmosphere(AtmosphereIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "La identidad de la atmósfera no puede ser nula.");
        this.parameters = identity.tableEntry().getParameters();
        log.debug("CorsikaAtmosphere inicializada: {} (tabla CORSIKA {})", identity, identity.tableEntry().getCorsikaTable());
    }

    public CorsikaAtmosphere(String location, String season) {
        this(AtmosphereIdentity.of(location, season));
    }

    /**
     * Identidad validada contra la tabla CORSIKA.
     */
    public AtmosphereIdentity identity() {
        return identity;
    }

    @Override
    public String location() {
        return identity.location();
    }

    @Override
    public String season() {
        return identity.season();
    }

    public LayerParameterSet getParameters() {
        return parameters;
    }

    /**
     * Densidad del aire según la parametrización por capas.
     * <p>
     * En la capa superior la escala c es del orden de 1e9 cm, así que el término
     * exponencial vale prácticamente 1 y la densidad queda en {@code b/c}.
     */
    @Override
    public double density(double heightCm) {
        final int layer = heightLayer(heightCm);
        final double b = parameters.getB(layer);
        final double c = parameters.getC(layer);
        if (layer == TOP_LAYER) {
            return b / c;
        }
        return b / c * Math.exp(-heightCm / c);
    }

    /**
     * Convierte altura en profundidad vertical (columna).
     *
     * @param heightCm Altura en cm.
     * @return Profundidad vertical en g/cm².
     */
    public double depth(double heightCm) {
        final int layer = heightLayer(heightCm);
        final double a = parameters.getA(layer);
        final double b = parameters.getB(layer);
        final double c = parameters.getC(layer);
        if (layer == TOP_LAYER) {
            return a - heightCm / c;
        }
        return a + b * Math.exp(-heightCm / c);
    }

    /**
     * Convierte profundidad vertical en altura (inversa analítica de {@link #depth}).
     *
     * @param verticalDepth Profundidad vertical en g/cm².
     * @return Altura en cm.
     */
    public double height(double verticalDepth) {
        for (int layer = 0; layer < TOP_LAYER; layer++) {
            if (verticalDepth >= parameters.getDepthBoundary(layer + 1)) {
                return parameters.getC(layer)
                        * Math.log(parameters.getB(layer) / (verticalDepth - parameters.getA(layer)));
            }
        }
        return (parameters.getA(TOP_LAYER) - verticalDepth) * parameters.getC(TOP_LAYER);
    }

    /**
     * Inversa de la densidad en aproximación plana, sin integrar la línea de visión.
     * <p>
     * Proyecta la profundidad inclinada sobre la vertical ({@code X·cosθ}) y aplica la
     * relación analítica {@code 1/rho = c / (Xv - a)}. Sólo es válida para ángulos
     * cenitales por debajo de unos 70°.
     *
     * @param slantDepth Profundidad inclinada en g/cm².
     * @param cosTheta   Coseno del ángulo cenital.
     * @return 1/rho en cm³/g.
     */
    public double planarInverseDensity(double slantDepth, double cosTheta) {
        final double verticalDepth = slantDepth * cosTheta;
        int layer = 0;
        for (int i = 0; i < LAYER_COUNT; i++) {
            if (!(verticalDepth >= parameters.getDepthBoundary(i))) {
                layer = i;
            }
        }
        if (layer == TOP_LAYER) {
            return parameters.getC(TOP_LAYER) / parameters.getB(TOP_LAYER);
        }
        return parameters.getC(layer) / (verticalDepth - parameters.getA(layer));
    }

    public double planarInverseDensity(double slantDepth, ZenithAngle angle) {
        return planarInverseDensity(slantDepth, angle.cosine());
    }

    private int heightLayer(double heightCm) {
        int layer = 0;
        for (int i = 0; i < LAYER_COUNT; i++) {
            if (!(heightCm <= parameters.getHeightBoundary(i))) {
                layer = i;
            }
        }
        return layer;
    }
}
