package duneshear.domain.grid;

import duneshear.config.ShearConfigurationException;
import duneshear.utils.GridArrays;
import lombok.Getter;

/**
 * Rejilla lógica de entrada, tal y como la entrega el llamador: coordenadas X e Y
 * (posiblemente curvilíneas y no uniformes) y elevación Z, todas con forma (ny, nx).
 * <p>
 * Es inmutable: los arrays se copian en la construcción y los accesores devuelven copias.
 * El resultado del cálculo no se guarda aquí; el simulador mantiene el último
 * {@link ShearField} asociado a esta rejilla.
 *
 * @since 2025-11-02
 */
public final class InputGrid {

    @Getter
    private final int rows;
    @Getter
    private final int cols;
    private final double[][] x;
    private final double[][] y;
    private final double[][] z;

    /**
     * @param x Coordenadas X de cada nodo (ny, nx).
     * @param y Coordenadas Y de cada nodo (ny, nx).
     * @param z Elevación de cada nodo (ny, nx).
     * @throws ShearConfigurationException si las formas no coinciden, la rejilla tiene menos de
     *                                     2x2 nodos, hay valores no finitos o la caja envolvente es degenerada.
     */
    public InputGrid(double[][] x, double[][] y, double[][] z) {
        // --- Validación de Forma ---
        if (!GridArrays.isRectangular(x) || !GridArrays.isRectangular(y) || !GridArrays.isRectangular(z)) {
            throw new ShearConfigurationException("Las coordenadas y la elevación deben ser arrays 2D rectangulares no nulos.");
        }
        if (!GridArrays.sameShape(x, y) || !GridArrays.sameShape(x, z)) {
            throw new ShearConfigurationException(String.format(
                    "Las formas de x (%d, %d), y (%d, %d) y z (%d, %d) deben coincidir.",
                    x.length, x[0].length, y.length, y[0].length, z.length, z[0].length));
        }
        if (x.length < 2 || x[0].length < 2) {
            throw new ShearConfigurationException("La rejilla de entrada necesita al menos 2x2 nodos.");
        }
        if (!GridArrays.allFinite(x) || !GridArrays.allFinite(y) || !GridArrays.allFinite(z)) {
            throw new ShearConfigurationException("La rejilla de entrada contiene valores no finitos (NaN/Inf).");
        }

        // --- Validación de Caja Envolvente ---
        double width = GridArrays.max(x) - GridArrays.min(x);
        double height = GridArrays.max(y) - GridArrays.min(y);
        if (!(width > 0) || !(height > 0)) {
            throw new ShearConfigurationException(String.format(
                    "La caja envolvente de la rejilla de entrada es degenerada (ancho=%s, alto=%s).", width, height));
        }

        this.rows = x.length;
        this.cols = x[0].length;
        this.x = GridArrays.copy(x);
        this.y = GridArrays.copy(y);
        this.z = GridArrays.copy(z);
    }

    public double getXAt(int row, int col) {
        return x[row][col];
    }

    public double getYAt(int row, int col) {
        return y[row][col];
    }

    public double getZAt(int row, int col) {
        return z[row][col];
    }

    public double[][] cloneX() {
        return GridArrays.copy(x);
    }

    public double[][] cloneY() {
        return GridArrays.copy(y);
    }

    public double[][] cloneZ() {
        return GridArrays.copy(z);
    }

    /**
     * Centroide de las coordenadas (media aritmética de todos los nodos).
     * Es el pivote fijo de todas las rotaciones.
     */
    public double getCentroidX() {
        return GridArrays.mean(x);
    }

    public double getCentroidY() {
        return GridArrays.mean(y);
    }

    /**
     * Diagonal de la caja envolvente alineada con los ejes.
     */
    public double getBoundingBoxDiagonal() {
        double w = GridArrays.max(x) - GridArrays.min(x);
        double h = GridArrays.max(y) - GridArrays.min(y);
        return Math.sqrt(w * w + h * h);
    }

    public boolean hasSameShape(double[][] field) {
        return field != null && field.length == rows && field.length > 0 && field[0].length == cols;
    }
}
