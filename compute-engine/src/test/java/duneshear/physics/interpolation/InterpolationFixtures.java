package duneshear.physics.interpolation;

import java.util.function.DoubleBinaryOperator;

/**
 * Rejillas de prueba compartidas por los tests de interpolación.
 */
final class InterpolationFixtures {

    private InterpolationFixtures() {}

    static double[][][] regularGrid(int nx, int ny, double spacing, double x0, double y0) {
        double[][] x = new double[ny][nx];
        double[][] y = new double[ny][nx];
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                x[r][c] = x0 + c * spacing;
                y[r][c] = y0 + r * spacing;
            }
        }
        return new double[][][]{x, y};
    }

    static double[][] sample(double[][] x, double[][] y, DoubleBinaryOperator f) {
        double[][] z = new double[x.length][x[0].length];
        for (int r = 0; r < x.length; r++) {
            for (int c = 0; c < x[0].length; c++) {
                z[r][c] = f.applyAsDouble(x[r][c], y[r][c]);
            }
        }
        return z;
    }
}
