package duneshear.physics.geometry;

/**
 * Rotación 2D de campos de coordenadas o de componentes vectoriales.
 * <p>
 * Convención única para todo el proyecto:
 * <ul>
 * <li>Ángulos en grados sexagesimales ({@link #DEGREES_TO_RADIANS}).</li>
 * <li>Sentido antihorario positivo: matriz estándar {@code [[cos, -sin], [sin, cos]]}
 * aplicada sobre vectores columna.</li>
 * <li>La misma función sirve para rotar la rejilla (con pivote) y para re-expresar en ejes
 * del mundo un vector calculado en ejes de la rejilla rotada (sin pivote, mismo ángulo).</li>
 * </ul>
 * No se normaliza el ángulo: 370° y 10° dan el mismo resultado por periodicidad de seno y coseno.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class GridRotation {

    public static final double DEGREES_TO_RADIANS = Math.PI / 180.0;

    /**
     * Pivote neutro para la rotación de componentes vectoriales.
     */
    public static final double NO_ORIGIN = 0.0;

    private GridRotation() {}

    /**
     * Resultado de una rotación: dos campos con la forma de la entrada.
     */
    public record Rotated(double[][] x, double[][] y) {}

    /**
     * Rota los pares (x, y) el ángulo dado alrededor de (originX, originY).
     *
     * @param x              Primera componente (ny, nx).
     * @param y              Segunda componente, misma forma que x.
     * @param angleDegrees   Ángulo en grados, antihorario positivo.
     * @param originX        Pivote X.
     * @param originY        Pivote Y.
     * @return Campos rotados con la misma forma.
     */
    public static Rotated rotate(double[][] x, double[][] y, double angleDegrees, double originX, double originY) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Los campos a rotar deben tener la misma forma.");
        }
        final double a = angleDegrees * DEGREES_TO_RADIANS;
        final double cos = Math.cos(a);
        final double sin = Math.sin(a);

        double[][] xr = new double[x.length][];
        double[][] yr = new double[y.length][];
        for (int r = 0; r < x.length; r++) {
            if (x[r].length != y[r].length) {
                throw new IllegalArgumentException("Los campos a rotar deben tener la misma forma.");
            }
            int cols = x[r].length;
            xr[r] = new double[cols];
            yr[r] = new double[cols];
            for (int c = 0; c < cols; c++) {
                double dx = x[r][c] - originX;
                double dy = y[r][c] - originY;
                xr[r][c] = cos * dx - sin * dy + originX;
                yr[r][c] = sin * dx + cos * dy + originY;
            }
        }
        return new Rotated(xr, yr);
    }

    /**
     * Rotación de componentes vectoriales (sin pivote).
     */
    public static Rotated rotate(double[][] u, double[][] v, double angleDegrees) {
        return rotate(u, v, angleDegrees, NO_ORIGIN, NO_ORIGIN);
    }

    /**
     * Rota un único punto. Devuelve {x', y'}.
     */
    public static double[] rotatePoint(double x, double y, double angleDegrees, double originX, double originY) {
        final double a = angleDegrees * DEGREES_TO_RADIANS;
        double dx = x - originX;
        double dy = y - originY;
        return new double[]{
                Math.cos(a) * dx - Math.sin(a) * dy + originX,
                Math.sin(a) * dx + Math.cos(a) * dy + originY
        };
    }

    /**
     * Vector unitario del eje X de la rejilla computacional (dirección de avance del viento)
     * expresado en ejes del mundo.
     */
    public static double[] windUnitVector(double angleDegrees) {
        return rotatePoint(1.0, 0.0, angleDegrees, NO_ORIGIN, NO_ORIGIN);
    }
}
