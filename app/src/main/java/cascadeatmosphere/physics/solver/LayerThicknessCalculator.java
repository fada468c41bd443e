package cascadeatmosphere.physics.solver;

import cascadeatmosphere.domain.atmosphere.LayerParameterSet;
import cascadeatmosphere.physics.model.CorsikaAtmosphere;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.UnivariateIntegrator;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Calcula las fronteras en profundidad (thickl) de una parametrización por capas a partir
 * de sus fronteras en altura.
 * <p>
 * La inversión analítica X → h necesita conocer la profundidad a la que se produce cada
 * cambio de capa. Para un conjunto de parámetros nuevo, thickl[i] es la columna de aire
 * por encima de hlay[i], es decir, la integral de la densidad desde hlay[i] hasta el techo
 * de la atmósfera.
 */
@Slf4j
public final class LayerThicknessCalculator {

    public static final double RELATIVE_ACCURACY = 1e-4;
    private static final double ABSOLUTE_ACCURACY = 1e-15;
    private static final int GAUSS_POINTS = 5;
    private static final int MAX_EVALUATIONS = 1_000_000;

    /**
     * Prohibido construir esta clase utilidad
     */
    private LayerThicknessCalculator() {
    }

    /**
     * @param model           Atmósfera por capas cuyas fronteras en altura se usan.
     * @param atmosphereTopCm Altura del techo de la atmósfera en cm (ej: 112.8e5).
     * @return Profundidad vertical por encima de cada frontera en altura [g/cm²].
     */
    public static double[] computeDepthBoundaries(CorsikaAtmosphere model, double atmosphereTopCm) {
        final double[] heightBoundaries = model.getParameters().cloneHeightBoundaries();
        if (atmosphereTopCm <= heightBoundaries[LayerParameterSet.TOP_LAYER]) {
            throw new IllegalArgumentException("El techo de la atmósfera debe estar por encima de la última frontera de capa.");
        }

        double[] thickness = new double[LayerParameterSet.LAYER_COUNT];
        for (int i = 0; i < LayerParameterSet.LAYER_COUNT; i++) {
            // La densidad es discontinua en las fronteras: se integra capa a capa
            double column = 0.0;
            for (int layer = i; layer < LayerParameterSet.LAYER_COUNT; layer++) {
                final double lower = heightBoundaries[layer];
                final double upper = (layer == LayerParameterSet.TOP_LAYER) ? atmosphereTopCm : heightBoundaries[layer + 1];
                UnivariateIntegrator integrator = new IterativeLegendreGaussIntegrator(GAUSS_POINTS, RELATIVE_ACCURACY, ABSOLUTE_ACCURACY);
                column += integrator.integrate(MAX_EVALUATIONS, model::density, lower, upper);
            }
            thickness[i] = column;
        }

        log.info("thickl para {}: [{}]", model.describe(), Arrays.stream(thickness)
                .mapToObj(value -> String.format(Locale.ROOT, "%.6f", value))
                .collect(Collectors.joining(", ")));
        return thickness;
    }
}
