package duneshear.physics.buffer;

import duneshear.domain.grid.InputGrid;
import lombok.Getter;

/**
 * Contorno de la rejilla de entrada como polilínea cerrada de nodos con su elevación.
 * <p>
 * Orden: fila superior (índice 0) de izquierda a derecha, columna derecha hacia abajo sin
 * esquinas, fila inferior de derecha a izquierda, columna izquierda hacia arriba sin esquinas y
 * cierre repitiendo el primer punto. Longitud {@code 2(nx+ny)-3}.
 */
public final class GridBorder {

    private final double[] x;
    private final double[] y;
    private final double[] z;
    @Getter
    private final int size;

    private GridBorder(double[] x, double[] y, double[] z) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.size = x.length;
    }

    public static GridBorder of(InputGrid grid) {
        final int ny = grid.getRows();
        final int nx = grid.getCols();
        final int n = 2 * (nx + ny) - 3;
        double[] bx = new double[n];
        double[] by = new double[n];
        double[] bz = new double[n];

        int k = 0;
        for (int c = 0; c < nx; c++) {
            k = put(grid, 0, c, bx, by, bz, k);
        }
        for (int r = 1; r < ny - 1; r++) {
            k = put(grid, r, nx - 1, bx, by, bz, k);
        }
        for (int c = nx - 1; c >= 0; c--) {
            k = put(grid, ny - 1, c, bx, by, bz, k);
        }
        for (int r = ny - 2; r >= 1; r--) {
            k = put(grid, r, 0, bx, by, bz, k);
        }
        put(grid, 0, 0, bx, by, bz, k);

        return new GridBorder(bx, by, bz);
    }

    private static int put(InputGrid grid, int r, int c, double[] bx, double[] by, double[] bz, int k) {
        bx[k] = grid.getXAt(r, c);
        by[k] = grid.getYAt(r, c);
        bz[k] = grid.getZAt(r, c);
        return k + 1;
    }

    public double getXAt(int i) {
        return x[i];
    }

    public double getYAt(int i) {
        return y[i];
    }

    public double getZAt(int i) {
        return z[i];
    }

    /**
     * Índice del punto de contorno más cercano (distancia euclídea). En empate gana el primero.
     */
    public int nearest(double px, double py) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < size; i++) {
            double ddx = x[i] - px;
            double ddy = y[i] - py;
            double d2 = ddx * ddx + ddy * ddy;
            if (d2 < bestDistance) {
                bestDistance = d2;
                best = i;
            }
        }
        return best;
    }

    public double distance(int i, double px, double py) {
        return Math.hypot(x[i] - px, y[i] - py);
    }
}
