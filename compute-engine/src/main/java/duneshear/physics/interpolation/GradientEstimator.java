package duneshear.physics.interpolation;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Estimación de gradientes nodales para Clough-Tocher.
 * <p>
 * Busca el gradiente que minimiza la curvatura a lo largo de las aristas (aproximación cúbica
 * sobre cada arista), resolviendo por vértice un sistema 2x2 con iteraciones de Gauss-Seidel.
 * Con datos lineales o cuadráticos converge al gradiente exacto.
 */
@Slf4j
@Builder
@Getter
public class GradientEstimator {

    @Builder.Default
    private final int maxIterations = 400;

    @Builder.Default
    private final double tolerance = 1e-6;

    public static GradientEstimator defaults() {
        return GradientEstimator.builder().build();
    }

    /**
     * @return Matriz [n][2] con (df/dx, df/dy) por vértice.
     */
    public double[][] estimate(DelaunayMesh mesh, double[] values) {
        int n = mesh.getPointCount();
        if (values.length != n) {
            throw new IllegalArgumentException("Número de valores distinto al número de vértices.");
        }
        double[][] grad = new double[n][2];

        for (int iter = 0; iter < maxIterations; iter++) {
            double maxChange = 0.0;
            double maxGrad = 0.0;

            for (int i = 0; i < n; i++) {
                double xi = mesh.getPointX(i);
                double yi = mesh.getPointY(i);
                double q00 = 0, q01 = 0, q11 = 0, s0 = 0, s1 = 0;

                for (int slot = mesh.adjacencyStart(i); slot < mesh.adjacencyEnd(i); slot++) {
                    int j = mesh.adjacent(slot);
                    double ex = mesh.getPointX(j) - xi;
                    double ey = mesh.getPointY(j) - yi;
                    double len = Math.hypot(ex, ey);
                    double len3 = len * len * len;

                    double slopeJ = grad[j][0] * ex + grad[j][1] * ey;
                    double r = (6.0 * (values[j] - values[i]) - 2.0 * slopeJ) / len3;

                    q00 += 4.0 * ex * ex / len3;
                    q01 += 4.0 * ex * ey / len3;
                    q11 += 4.0 * ey * ey / len3;
                    s0 += r * ex;
                    s1 += r * ey;
                }

                double det = q00 * q11 - q01 * q01;
                if (det == 0.0) {
                    // Vértice aislado o con vecinos colineales
                    continue;
                }
                double g0 = (q11 * s0 - q01 * s1) / det;
                double g1 = (-q01 * s0 + q00 * s1) / det;

                maxChange = Math.max(maxChange, Math.max(Math.abs(g0 - grad[i][0]), Math.abs(g1 - grad[i][1])));
                maxGrad = Math.max(maxGrad, Math.max(Math.abs(g0), Math.abs(g1)));
                grad[i][0] = g0;
                grad[i][1] = g1;
            }

            if (maxChange < tolerance * (1.0 + maxGrad)) {
                log.trace("Gradientes convergidos en {} iteraciones", iter + 1);
                return grad;
            }
            if (Double.isNaN(maxChange)) {
                break;
            }
        }
        log.debug("Estimación de gradientes sin convergencia tras {} iteraciones", maxIterations);
        return grad;
    }
}
