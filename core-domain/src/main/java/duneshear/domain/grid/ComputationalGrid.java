package duneshear.domain.grid;

import duneshear.utils.GridArrays;
import lombok.Getter;

import java.util.Objects;

/**
 * Rejilla computacional cuadrada, equidistante y alineada con el viento.
 * <p>
 * Tiene dos capas de coordenadas:
 * <ul>
 * <li>Referencia (xi, yi): sin rotar, fijada en la construcción.</li>
 * <li>Trabajo (x, y): la referencia rotada a la dirección del viento de la invocación actual.</li>
 * </ul>
 * El estado de trabajo (x, y, z y perturbaciones) se sobrescribe en cada invocación del
 * simulador; no se guarda historial. Un único escritor: el simulador que la posee.
 */
public final class ComputationalGrid {

    @Getter
    private final double dx;
    @Getter
    private final double dy;
    /**
     * Pivote de rotación (centroide de la rejilla de entrada).
     */
    @Getter
    private final double originX;
    @Getter
    private final double originY;
    /**
     * Lado D del cuadrado: diagonal de la caja de la entrada + 2 * ancho de buffer.
     */
    @Getter
    private final double sideLength;
    @Getter
    private final int rows;
    @Getter
    private final int cols;

    private final double[][] referenceX;
    private final double[][] referenceY;

    // --- Estado de trabajo (una generación por invocación) ---
    @Getter
    private double direction = Double.NaN;
    private double[][] x;
    private double[][] y;
    private double[][] z;
    /**
     * Perturbación cruda del solver, en ejes alineados con el viento.
     */
    @Getter
    private ShearField alignedShear;
    /**
     * La misma perturbación re-expresada en ejes del mundo.
     */
    @Getter
    private ShearField worldShear;

    public ComputationalGrid(double dx, double dy, double originX, double originY, double sideLength,
                             double[][] referenceX, double[][] referenceY) {
        Objects.requireNonNull(referenceX, "Las coordenadas X de referencia no pueden ser nulas.");
        Objects.requireNonNull(referenceY, "Las coordenadas Y de referencia no pueden ser nulas.");
        if (!GridArrays.isRectangular(referenceX) || !GridArrays.isRectangular(referenceY)
                || !GridArrays.sameShape(referenceX, referenceY)) {
            throw new IllegalArgumentException("Las coordenadas de referencia deben ser rectangulares y de igual forma.");
        }
        this.dx = dx;
        this.dy = dy;
        this.originX = originX;
        this.originY = originY;
        this.sideLength = sideLength;
        this.rows = referenceX.length;
        this.cols = referenceX[0].length;
        this.referenceX = GridArrays.copy(referenceX);
        this.referenceY = GridArrays.copy(referenceY);
    }

    /**
     * Copia independiente del estado actual. Las modificaciones sobre la copia no alcanzan
     * a esta rejilla; las perturbaciones se comparten porque {@link ShearField} es inmutable.
     */
    public ComputationalGrid snapshot() {
        ComputationalGrid copy = new ComputationalGrid(dx, dy, originX, originY, sideLength, referenceX, referenceY);
        copy.direction = direction;
        copy.x = x == null ? null : GridArrays.copy(x);
        copy.y = y == null ? null : GridArrays.copy(y);
        copy.z = z == null ? null : GridArrays.copy(z);
        copy.alignedShear = alignedShear;
        copy.worldShear = worldShear;
        return copy;
    }

    /**
     * Sustituye las coordenadas de trabajo por las de una nueva dirección e invalida
     * la elevación y las perturbaciones de la invocación anterior.
     */
    public void updateWorkingCoordinates(double direction, double[][] rotatedX, double[][] rotatedY) {
        requireShape(rotatedX, "x rotada");
        requireShape(rotatedY, "y rotada");
        this.direction = direction;
        this.x = GridArrays.copy(rotatedX);
        this.y = GridArrays.copy(rotatedY);
        this.z = null;
        this.alignedShear = null;
        this.worldShear = null;
    }

    public void updateElevation(double[][] elevation) {
        requireShape(elevation, "z");
        this.z = GridArrays.copy(elevation);
    }

    public void updateShear(ShearField aligned, ShearField world) {
        Objects.requireNonNull(aligned, "La perturbación alineada no puede ser nula.");
        Objects.requireNonNull(world, "La perturbación en ejes del mundo no puede ser nula.");
        if (aligned.rows() != rows || aligned.cols() != cols || world.rows() != rows || world.cols() != cols) {
            throw new IllegalArgumentException("La perturbación no tiene la forma de la rejilla computacional.");
        }
        this.alignedShear = aligned;
        this.worldShear = world;
    }

    public double[][] cloneReferenceX() {
        return GridArrays.copy(referenceX);
    }

    public double[][] cloneReferenceY() {
        return GridArrays.copy(referenceY);
    }

    public double[][] cloneX() {
        return x == null ? null : GridArrays.copy(x);
    }

    public double[][] cloneY() {
        return y == null ? null : GridArrays.copy(y);
    }

    public double[][] cloneZ() {
        return z == null ? null : GridArrays.copy(z);
    }

    public boolean isPopulated() {
        return z != null;
    }

    private void requireShape(double[][] field, String name) {
        if (!GridArrays.isRectangular(field) || field.length != rows || field[0].length != cols) {
            throw new IllegalArgumentException(String.format(
                    "El campo %s no tiene la forma (%d, %d) de la rejilla computacional.", name, rows, cols));
        }
    }
}
