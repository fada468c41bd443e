package cascadeatmosphere.physics.profile;

import cascadeatmosphere.config.AtmosphereConfig;
import cascadeatmosphere.config.GeometryConfig;
import cascadeatmosphere.domain.atmosphere.ZenithAngle;
import cascadeatmosphere.domain.profile.DepthDensityProfile;
import cascadeatmosphere.physics.geometry.EarthGeometry;
import cascadeatmosphere.physics.geometry.GeometryProvider;
import cascadeatmosphere.physics.model.CorsikaAtmosphere;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.withinPercentage;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Test de integración del constructor de perfiles rho(X) con el modelo USStd real.
 * Se usan 200 muestras para que el test sea rápido; la precisión sigue siendo sub-g/cm².
 */
@Slf4j
class DensityProfileBuilderTest {

    private static final int TEST_STEPS = 200;

    private CorsikaAtmosphere model;
    private GeometryProvider geometry;
    private DensityProfileBuilder builder;

    @BeforeEach
    void setUp() {
        model = new CorsikaAtmosphere("USStd", null);
        geometry = new EarthGeometry(GeometryConfig.getStandardEarth());
        builder = new DensityProfileBuilder(model, geometry, TEST_STEPS, 2);
    }

    @AfterEach
    void tearDown() {
        builder.close();
    }

    @Test
    @DisplayName("Vertical: X_surf ≈ 1036 g/cm² y extremos del perfil correctos")
    void build_vertical_shouldMatchColumnDepth() {
        // ACT
        DepthDensityProfile profile = builder.build(ZenithAngle.of(0.0, geometry));

        // ASSERT
        assertEquals(1036.1, profile.getSurfaceDepth(), 0.5);
        // X = 0 es el techo de la atmósfera y X = X_surf el observador
        assertEquals(1.0e-9, profile.densityAt(0.0), 1e-15);
        assertEquals(model.density(0.0), profile.densityAt(profile.getSurfaceDepth()), 1e-9);
        assertThat(profile.getPieceCount()).isEqualTo(TEST_STEPS - 2);
        assertThat(profile.getBreakpoints()[0]).isZero();
    }

    @Test
    @DisplayName("Muestras intermedias: el perfil reproduce la densidad del modelo")
    void build_vertical_shouldFollowModelDensity() {
        // ARRANGE
        DepthDensityProfile profile = builder.build(ZenithAngle.of(0.0, geometry));

        // ACT & ASSERT: en vertical X(h) es la profundidad vertical del modelo
        for (double h : new double[]{2.0e5, 7.0e5, 2.5e6}) {
            double expected = model.density(h);
            double actual = profile.densityAt(model.depth(h));
            assertThat(actual).as("Densidad a h=%.0f cm", h).isCloseTo(expected, withinPercentage(2));
        }
    }

    @Test
    @DisplayName("Inclinación: X_surf crece con el ángulo cenital")
    void build_inclined_shouldIncreaseSurfaceDepth() {
        // ACT
        double vertical = builder.build(ZenithAngle.of(0.0, geometry)).getSurfaceDepth();
        double sixty = builder.build(ZenithAngle.of(60.0, geometry)).getSurfaceDepth();
        double horizontal = builder.build(ZenithAngle.of(90.0, geometry)).getSurfaceDepth();

        // ASSERT
        // La curvatura terrestre deja X(60°) algo por debajo de X(0°)/cos(60°)
        assertThat(sixty).isBetween(1.95 * vertical, 2.0 * vertical);
        assertThat(horizontal).isCloseTo(36537.0, withinPercentage(2));
    }

    @Test
    @DisplayName("Positividad: la densidad interpolada es positiva en todo el dominio")
    void build_shouldBePositiveEverywhere() {
        // ARRANGE
        DepthDensityProfile profile = builder.build(ZenithAngle.of(75.0, geometry));

        // ACT & ASSERT
        for (int i = 0; i <= 2000; i++) {
            final double x = profile.getSurfaceDepth() * i / 2000.0;
            assertThat(profile.densityAt(x)).as("rho(X=%.3f)", x).isPositive();
        }
    }

    @Test
    @DisplayName("Número de muestras explícito: define el número de tramos")
    void build_withExplicitSteps_shouldHonourSampleCount() {
        DepthDensityProfile profile = builder.build(ZenithAngle.of(30.0, geometry), 50);
        assertThat(profile.getPieceCount()).isEqualTo(48);
    }

    @Test
    @DisplayName("Menos de 3 muestras: debe lanzar IllegalArgumentException")
    void build_withTooFewSteps_shouldThrow() {
        ZenithAngle angle = ZenithAngle.of(0.0, geometry);
        assertThrows(IllegalArgumentException.class, () -> builder.build(angle, 2));
        assertThrows(IllegalArgumentException.class, () -> new DensityProfileBuilder(model, geometry, 1, 1));
    }

    @Test
    @DisplayName("Construcción desde la configuración: toma muestras e hilos de AtmosphereConfig")
    void constructor_fromConfig_shouldUseConfiguredSteps() {
        // ARRANGE
        AtmosphereConfig config = AtmosphereConfig.getDefault().withSplineSteps(120).withCpuProcessorCount(1);

        // ACT
        try (DensityProfileBuilder configured = new DensityProfileBuilder(model, geometry, config)) {
            DepthDensityProfile profile = configured.build(ZenithAngle.of(0.0, geometry));

            // ASSERT
            assertThat(configured.getDefaultSteps()).isEqualTo(120);
            assertThat(profile.getPieceCount()).isEqualTo(118);
        }
    }

    @Test
    @DisplayName("Error medio del spline: sólo se calcula y registra con DEBUG activo")
    void build_shouldLogFitResidualOnlyWhenDebugEnabled() {
        // ARRANGE
        Logger builderLogger = (Logger) LoggerFactory.getLogger(DensityProfileBuilder.class);
        Level previousLevel = builderLogger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        builderLogger.addAppender(appender);
        ZenithAngle angle = ZenithAngle.of(0.0, geometry);

        try {
            // ACT
            builderLogger.setLevel(Level.INFO);
            builder.build(angle, 50);
            long residualLinesAtInfo = countResidualLines(appender);

            builderLogger.setLevel(Level.DEBUG);
            builder.build(angle, 50);
            long residualLinesAtDebug = countResidualLines(appender);

            // ASSERT
            assertThat(residualLinesAtInfo).isZero();
            assertThat(residualLinesAtDebug).isEqualTo(1);
        } finally {
            builderLogger.detachAppender(appender);
            builderLogger.setLevel(previousLevel);
        }
    }

    private static long countResidualLines(ListAppender<ILoggingEvent> appender) {
        return appender.list.stream()
                .filter(event -> event.getMessage().startsWith("Error medio del spline"))
                .count();
    }
}
