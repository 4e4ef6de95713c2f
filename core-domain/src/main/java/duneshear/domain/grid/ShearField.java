package duneshear.domain.grid;

import duneshear.utils.GridArrays;

import java.util.Arrays;
import java.util.Objects;

/**
 * Par inmutable de campos de perturbación del cortante (adimensionales) sobre una rejilla.
 * <p>
 * Según dónde se use, las componentes están expresadas en ejes alineados con el viento
 * (salida directa del solver espectral) o en ejes del mundo (tras la rotación inversa).
 *
 * @param dtaux Perturbación en la componente X (ny, nx).
 * @param dtauy Perturbación en la componente Y (ny, nx).
 */
public record ShearField(double[][] dtaux, double[][] dtauy) {

    public ShearField {
        Objects.requireNonNull(dtaux, "El campo dtaux no puede ser nulo.");
        Objects.requireNonNull(dtauy, "El campo dtauy no puede ser nulo.");
        if (!GridArrays.isRectangular(dtaux) || !GridArrays.isRectangular(dtauy)
                || !GridArrays.sameShape(dtaux, dtauy)) {
            throw new IllegalArgumentException("dtaux y dtauy deben ser rectangulares y tener la misma forma.");
        }
        dtaux = GridArrays.copy(dtaux);
        dtauy = GridArrays.copy(dtauy);
    }

    /**
     * Campo nulo, resultado definido para viento en calma.
     */
    public static ShearField zeros(int rows, int cols) {
        return new ShearField(GridArrays.zeros(rows, cols), GridArrays.zeros(rows, cols));
    }

    @Override
    public double[][] dtaux() {
        return GridArrays.copy(dtaux);
    }

    @Override
    public double[][] dtauy() {
        return GridArrays.copy(dtauy);
    }

    public double getDtauxAt(int row, int col) {
        return dtaux[row][col];
    }

    public double getDtauyAt(int row, int col) {
        return dtauy[row][col];
    }

    public int rows() {
        return dtaux.length;
    }

    public int cols() {
        return dtaux[0].length;
    }

    public double getMagnitudeAt(int row, int col) {
        return Math.hypot(dtaux[row][col], dtauy[row][col]);
    }

    public boolean isAllFinite() {
        return GridArrays.allFinite(dtaux) && GridArrays.allFinite(dtauy);
    }

    /**
     * Igualdad por contenido de los campos, no por referencia de los arrays.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShearField other)) {
            return false;
        }
        return Arrays.deepEquals(dtaux, other.dtaux) && Arrays.deepEquals(dtauy, other.dtauy);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(dtaux) + Arrays.deepHashCode(dtauy);
    }
}
