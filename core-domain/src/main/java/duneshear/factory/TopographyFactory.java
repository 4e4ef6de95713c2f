package duneshear.factory;

import duneshear.domain.grid.InputGrid;

import java.util.function.DoubleBinaryOperator;

/**
 * Fábrica de rejillas de entrada sintéticas: llanuras, dunas gaussianas y rejillas
 * deformadas (no alineadas con los ejes) para ensayar el solver sin datos de campo.
 * <p>
 * Todas las rejillas tienen forma (ny, nx) con el nodo (0, 0) en el origen de coordenadas,
 * salvo la deformación aplicada en {@link #createSkewedGrid}.
 */
public final class TopographyFactory {

    /**
     * Relación entre la base visible de una duna gaussiana y su desviación típica (base = 4 sigma).
     */
    public static final double BASE_WIDTH_IN_SIGMAS = 4.0;

    private TopographyFactory() {}

    /**
     * Rejilla regular con elevación dada por una función de las coordenadas.
     */
    public static InputGrid createRegularGrid(int nx, int ny, double spacing, DoubleBinaryOperator elevation) {
        validateDimensions(nx, ny, spacing);
        double[][] x = new double[ny][nx];
        double[][] y = new double[ny][nx];
        double[][] z = new double[ny][nx];
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                x[j][i] = i * spacing;
                y[j][i] = j * spacing;
                z[j][i] = elevation.applyAsDouble(x[j][i], y[j][i]);
            }
        }
        return new InputGrid(x, y, z);
    }

    /**
     * Llanura a elevación constante.
     */
    public static InputGrid createFlat(int nx, int ny, double spacing, double elevation) {
        return createRegularGrid(nx, ny, spacing, (x, y) -> elevation);
    }

    /**
     * Duna gaussiana aislada centrada en la rejilla.
     *
     * @param height    Altura de la cresta [m].
     * @param baseWidth Anchura de la base [m] (4 desviaciones típicas).
     */
    public static InputGrid createGaussianHill(int nx, int ny, double spacing, double height, double baseWidth) {
        double cx = (nx - 1) * spacing / 2.0;
        double cy = (ny - 1) * spacing / 2.0;
        return createRegularGrid(nx, ny, spacing, gaussian(cx, cy, height, baseWidth));
    }

    /**
     * Rejilla en paralelogramo: las filas se desplazan en X proporcionalmente a su Y,
     * de modo que las líneas de la rejilla no son ortogonales. Sirve como rejilla
     * "curvilínea" mínima para comprobar que nada asume ejes alineados.
     *
     * @param skewDegrees Ángulo de cizalla de las columnas respecto a la vertical.
     */
    public static InputGrid createSkewedGrid(int nx, int ny, double spacing, double skewDegrees,
                                             double height, double baseWidth) {
        validateDimensions(nx, ny, spacing);
        double shear = Math.tan(Math.toRadians(skewDegrees));
        double[][] x = new double[ny][nx];
        double[][] y = new double[ny][nx];
        double[][] z = new double[ny][nx];

        double cy = (ny - 1) * spacing / 2.0;
        double cx = (nx - 1) * spacing / 2.0 + shear * cy;
        DoubleBinaryOperator hill = gaussian(cx, cy, height, baseWidth);

        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                y[j][i] = j * spacing;
                x[j][i] = i * spacing + shear * y[j][i];
                z[j][i] = hill.applyAsDouble(x[j][i], y[j][i]);
            }
        }
        return new InputGrid(x, y, z);
    }

    /**
     * Perfil gaussiano radial.
     */
    public static DoubleBinaryOperator gaussian(double centerX, double centerY, double height, double baseWidth) {
        double sigma = baseWidth / BASE_WIDTH_IN_SIGMAS;
        double twoSigma2 = 2.0 * sigma * sigma;
        return (x, y) -> {
            double dx = x - centerX;
            double dy = y - centerY;
            return height * Math.exp(-(dx * dx + dy * dy) / twoSigma2);
        };
    }

    private static void validateDimensions(int nx, int ny, double spacing) {
        if (nx < 2 || ny < 2) {
            throw new IllegalArgumentException("La rejilla necesita al menos 2x2 nodos.");
        }
        if (!(spacing > 0)) {
            throw new IllegalArgumentException("El espaciado debe ser positivo: " + spacing);
        }
    }
}
