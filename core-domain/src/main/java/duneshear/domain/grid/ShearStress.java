package duneshear.domain.grid;

import duneshear.utils.GridArrays;

import java.util.Arrays;
import java.util.Objects;

/**
 * Esfuerzo cortante absoluto [N/m²] en ejes del mundo:
 * {@code tau = rho_aire * Cd * u0² * (e_viento + dtau)}.
 *
 * @param taux Componente X (ny, nx).
 * @param tauy Componente Y (ny, nx).
 */
public record ShearStress(double[][] taux, double[][] tauy) {

    public ShearStress {
        Objects.requireNonNull(taux, "El campo taux no puede ser nulo.");
        Objects.requireNonNull(tauy, "El campo tauy no puede ser nulo.");
        taux = GridArrays.copy(taux);
        tauy = GridArrays.copy(tauy);
    }

    /**
     * Compone el esfuerzo total a partir de la perturbación en ejes del mundo.
     *
     * @param perturbation   Perturbación adimensional en ejes del mundo.
     * @param windUnitX      Componente X del vector unitario del viento.
     * @param windUnitY      Componente Y del vector unitario del viento.
     * @param freeStreamSpeed Velocidad del flujo libre u0 [m/s].
     * @param airDensity     Densidad del aire [kg/m³].
     * @param dragCoefficient Coeficiente de arrastre.
     */
    public static ShearStress fromPerturbation(ShearField perturbation, double windUnitX, double windUnitY,
                                               double freeStreamSpeed, double airDensity, double dragCoefficient) {
        double scale = airDensity * dragCoefficient * freeStreamSpeed * freeStreamSpeed;
        int rows = perturbation.rows();
        int cols = perturbation.cols();
        double[][] tx = new double[rows][cols];
        double[][] ty = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                tx[r][c] = scale * (windUnitX + perturbation.getDtauxAt(r, c));
                ty[r][c] = scale * (windUnitY + perturbation.getDtauyAt(r, c));
            }
        }
        return new ShearStress(tx, ty);
    }

    @Override
    public double[][] taux() {
        return GridArrays.copy(taux);
    }

    @Override
    public double[][] tauy() {
        return GridArrays.copy(tauy);
    }

    public double getTauxAt(int row, int col) {
        return taux[row][col];
    }

    public double getTauyAt(int row, int col) {
        return tauy[row][col];
    }

    /**
     * Igualdad por contenido de los campos, no por referencia de los arrays.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShearStress other)) {
            return false;
        }
        return Arrays.deepEquals(taux, other.taux) && Arrays.deepEquals(tauy, other.tauy);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(taux) + Arrays.deepHashCode(tauy);
    }
}
