package cascadeatmosphere.domain.atmosphere;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Tabla cerrada de parametrizaciones atmosféricas disponibles, tomadas del manual de CORSIKA.
 * <p>
 * Cada entrada asocia un par (localización, estación) con su {@link LayerParameterSet}.
 * Las localizaciones sin variación estacional se registran con estación {@code null}.
 * <p>
 * Para añadir un conjunto nuevo, las fronteras en profundidad ({@code thickl}) pueden
 * obtenerse integrando la densidad desde cada frontera en altura hasta el techo de la
 * atmósfera.
 */
public enum CorsikaParameterTable {

    /** CORSIKA 1: Atmósfera estándar de EE.UU. */
    US_STANDARD("USStd", null, 1, new LayerParameterSet(
            new double[]{-186.5562, -94.919, 0.61289, 0.0, 0.01128292},
            new double[]{1222.6562, 1144.9069, 1305.5948, 540.1778, 1.0},
            new double[]{994186.38, 878153.55, 636143.04, 772170., 1.0e9},
            new double[]{1036.102549, 631.100309, 271.700230, 3.039494, 0.001280},
            new double[]{0.0, 4.0e5, 1.0e6, 4.0e6, 1.0e7})),

    /** CORSIKA 31: USStd según B. Keilhauer. */
    KEILHAUER_US_STANDARD("BK_USStd", null, 31, new LayerParameterSet(
            new double[]{-149.801663, -57.932486, 0.63631894, 4.3545369e-4, 0.01128292},
            new double[]{1183.6071, 1143.0425, 1322.9748, 655.69307, 1.0},
            new double[]{954248.34, 800005.34, 629568.93, 737521.77, 1.0e9},
            new double[]{1033.804941, 418.557770, 216.981635, 4.344861, 0.001280},
            new double[]{0.0, 7.0e5, 1.14e6, 3.7e6, 1.0e7})),

    /** CORSIKA 18: AT115 / Karlsruhe. */
    KARLSRUHE("Karlsruhe", null, 18, new LayerParameterSet(
            new double[]{-118.1277, -154.258, 0.4191499, 5.4094056e-4, 0.01128292},
            new double[]{1173.9861, 1205.7625, 1386.7807, 555.8935, 1.0},
            new double[]{919546., 963267.92, 614315., 739059.6, 1.0e9},
            new double[]{1055.858707, 641.755364, 272.720974, 2.480633, 0.001280},
            new double[]{0.0, 4.0e5, 1.0e6, 4.0e6, 1.0e7})),

    /** CORSIKA 26: MSIS-90-E, Polo Sur en diciembre. */
    SOUTH_POLE_DECEMBER("SouthPole", "December", 26, new LayerParameterSet(
            new double[]{-128.601, -39.5548, 1.13088, -0.00264960, 0.00192534},
            new double[]{1139.99, 1073.82, 1052.96, 492.503, 1.0},
            new double[]{861913., 744955., 675928., 829627., 5.8587010e9},
            new double[]{1011.398804, 588.128367, 240.955360, 3.964546, 0.000218},
            new double[]{0.0, 4.0e5, 1.0e6, 4.0e6, 1.0e7})),

    /** CORSIKA 28: MSIS-90-E, Polo Sur en junio. */
    SOUTH_POLE_JUNE("SouthPole", "June", 28, new LayerParameterSet(
            new double[]{-163.331, -65.3713, 0.402903, -0.000479198, 0.00188667},
            new double[]{1183.70, 1108.06, 1424.02, 207.595, 1.0},
            new double[]{875221., 753213., 545846., 793043., 5.9787908e9},
            new double[]{1020.370363, 586.143464, 228.374393, 1.338258, 0.000214},
            new double[]{0.0, 4.0e5, 1.0e6, 4.0e6, 1.0e7})),

    /**
     * CORSIKA 29: Polo Sur en enero según P. Lipari.
     * a[1] = -79.0635 reproduce thickl[1] en la frontera de 2.67 km.
     */
    LIPARI_SOUTH_POLE_JANUARY("PL_SouthPole", "January", 29, new LayerParameterSet(
            new double[]{-113.139, -79.0635, -54.3888, -0.0, 0.00421033},
            new double[]{1133.10, 1101.20, 1085.00, 1098.00, 1.0},
            new double[]{861730., 826340., 790950., 682800., 2.6798156e9},
            new double[]{1019.966898, 718.071682, 498.659703, 340.222344, 0.000478},
            new double[]{0.0, 2.67e5, 5.33e5, 8.0e5, 1.0e7})),

    /** CORSIKA 30: Polo Sur en agosto según P. Lipari. */
    LIPARI_SOUTH_POLE_AUGUST("PL_SouthPole", "August", 30, new LayerParameterSet(
            new double[]{-59.0293, -21.5794, -7.14839, 0.0, 0.000190175},
            new double[]{1079.0, 1071.90, 1182.0, 1647.1, 1.0},
            new double[]{764170., 699910., 635650., 551010., 59.329575e9},
            new double[]{1019.946057, 391.739652, 138.023515, 43.687992, 0.000022},
            new double[]{0.0, 6.67e5, 13.33e5, 2.0e6, 1.0e7}));

    private final String location;
    private final String season;
    private final int corsikaTable;
    private final LayerParameterSet parameters;

    CorsikaParameterTable(String location, String season, int corsikaTable, LayerParameterSet parameters) {
        this.location = location;
        this.season = season;
        this.corsikaTable = corsikaTable;
        this.parameters = parameters;
    }

    public String getLocation() {
        return location;
    }

    public String getSeason() {
        return season;
    }

    public int getCorsikaTable() {
        return corsikaTable;
    }

    public LayerParameterSet getParameters() {
        return parameters;
    }

    /**
     * Busca la entrada que corresponde exactamente al par (localización, estación).
     *
     * @param location Etiqueta de localización (ej: "USStd").
     * @param season   Estación, o {@code null} para localizaciones sin estación.
     * @return La entrada, o vacío si la combinación no está parametrizada.
     */
    public static Optional<CorsikaParameterTable> find(String location, String season) {
        return Arrays.stream(values())
                .filter(entry -> entry.location.equals(location) && Objects.equals(entry.season, season))
                .findFirst();
    }
}
