package duneshear.utils;

import java.util.Objects;

/**
 * Utilidades estáticas para trabajar con campos 2D almacenados como {@code double[fila][columna]}.
 * <p>
 * Todas las rejillas del proyecto siguen la convención (ny, nx): el primer índice recorre
 * el eje Y y el segundo el eje X.
 */
public final class GridArrays {

    private GridArrays() {}

    /**
     * Copia profunda de un campo 2D.
     */
    public static double[][] copy(double[][] field) {
        Objects.requireNonNull(field, "El campo a copiar no puede ser nulo.");
        double[][] out = new double[field.length][];
        for (int r = 0; r < field.length; r++) {
            out[r] = field[r].clone();
        }
        return out;
    }

    public static double[][] zeros(int rows, int cols) {
        return new double[rows][cols];
    }

    /**
     * Comprueba que el campo no es nulo, tiene al menos una fila y que todas las filas
     * tienen la misma longitud.
     *
     * @return true si el campo es rectangular.
     */
    public static boolean isRectangular(double[][] field) {
        if (field == null || field.length == 0 || field[0] == null) return false;
        int cols = field[0].length;
        for (double[] row : field) {
            if (row == null || row.length != cols) return false;
        }
        return true;
    }

    public static boolean sameShape(double[][] a, double[][] b) {
        return a.length == b.length && a[0].length == b[0].length;
    }

    public static boolean allFinite(double[][] field) {
        for (double[] row : field) {
            for (double v : row) {
                if (!Double.isFinite(v)) return false;
            }
        }
        return true;
    }

    public static int countNaN(double[][] field) {
        int count = 0;
        for (double[] row : field) {
            for (double v : row) {
                if (Double.isNaN(v)) count++;
            }
        }
        return count;
    }

    public static double mean(double[][] field) {
        double sum = 0.0;
        long n = 0;
        for (double[] row : field) {
            for (double v : row) {
                sum += v;
                n++;
            }
        }
        return sum / n;
    }

    public static double min(double[][] field) {
        double m = Double.POSITIVE_INFINITY;
        for (double[] row : field) {
            for (double v : row) m = Math.min(m, v);
        }
        return m;
    }

    public static double max(double[][] field) {
        double m = Double.NEGATIVE_INFINITY;
        for (double[] row : field) {
            for (double v : row) m = Math.max(m, v);
        }
        return m;
    }

    /**
     * Aplana el campo por filas (orden C).
     */
    public static double[] flatten(double[][] field) {
        int rows = field.length;
        int cols = field[0].length;
        double[] out = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(field[r], 0, out, r * cols, cols);
        }
        return out;
    }

    /**
     * Máxima diferencia absoluta entre dos campos de la misma forma. NaN si alguno contiene NaN.
     */
    public static double maxAbsDifference(double[][] a, double[][] b) {
        double m = 0.0;
        for (int r = 0; r < a.length; r++) {
            for (int c = 0; c < a[r].length; c++) {
                double d = Math.abs(a[r][c] - b[r][c]);
                if (Double.isNaN(d)) return Double.NaN;
                m = Math.max(m, d);
            }
        }
        return m;
    }
}
