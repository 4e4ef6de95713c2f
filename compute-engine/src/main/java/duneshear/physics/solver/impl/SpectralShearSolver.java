package duneshear.physics.solver.impl;

import duneshear.config.ShearConfig.SpectralConfig;
import duneshear.domain.grid.ComputationalGrid;
import duneshear.domain.grid.ShearField;
import duneshear.physics.math.ComplexBessel;
import duneshear.physics.math.SpectralTransform;
import duneshear.physics.math.Wavenumbers;
import duneshear.physics.solver.ShearSolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Solución analítica linealizada de capa límite turbulenta en el espacio de números de onda.
 * <p>
 * Para cada modo (kx, ky) de la elevación transformada:
 * <pre>
 * hs     = -FFT2(z)
 * σ      = sqrt(i · L/4 · kx · z0 / l)
 * dtaux^ = hs · kx²/k · 2/u0² · (-1 + (2·ln(l/z0) + k²/kx²) · σ · J1(2σ) / J0(2σ))
 * dtauy^ = hs · kx·ky/k · 2/u0² · 2√2 · σ · J1(2√2·σ)
 * </pre>
 * y la perturbación es la parte real de la FFT2 inversa. Como σ solo depende de kx, los
 * factores de Bessel se evalúan una vez por columna.
 * <p>
 * Stateless y Thread-Safe: cada llamada crea su propio plan de FFT.
 */
@Slf4j
public class SpectralShearSolver implements ShearSolver {

    private static final double TWO_SQRT_TWO = 2.0 * Math.sqrt(2.0);

    @Getter
    private final SpectralConfig parameters;

    public SpectralShearSolver(SpectralConfig parameters) {
        this.parameters = Objects.requireNonNull(parameters, "Los parámetros espectrales no pueden ser nulos.");
    }

    @Override
    public String getName() {
        return "Spectral_Bessel";
    }

    @Override
    public ShearField compute(ComputationalGrid grid, double u0) {
        if (!grid.isPopulated()) {
            throw new IllegalStateException("La rejilla computacional no tiene elevación para esta dirección.");
        }
        final int rows = grid.getRows();
        final int cols = grid.getCols();
        if (u0 == 0.0) {
            log.debug("Velocidad nula: perturbación idénticamente cero.");
            return ShearField.zeros(rows, cols);
        }

        final double[] kx = Wavenumbers.axis(cols, grid.getDx());
        final double[] ky = Wavenumbers.axis(rows, grid.getDy());

        final double l = parameters.getInnerLayerHeight();
        final double z0 = parameters.getRoughnessLength();
        final double sigmaScale = parameters.getCharacteristicLength() / 4.0 * z0 / l;
        final double logTerm = 2.0 * Math.log(l / z0);
        final double speedFactor = 2.0 / (u0 * u0);

        // Factores de Bessel por columna
        Complex[] besselX = new Complex[cols];
        Complex[] besselY = new Complex[cols];
        for (int c = 0; c < cols; c++) {
            Complex sigma = new Complex(0.0, sigmaScale * kx[c]).sqrt();
            Complex twoSigma = sigma.multiply(2.0);
            besselX[c] = sigma.multiply(ComplexBessel.j1(twoSigma)).divide(ComplexBessel.j0(twoSigma));
            besselY[c] = sigma.multiply(ComplexBessel.j1(sigma.multiply(TWO_SQRT_TWO))).multiply(TWO_SQRT_TWO);
        }

        SpectralTransform transform = new SpectralTransform(rows, cols);
        double[] hs = transform.forward(grid.cloneZ());
        double[] tauxHat = new double[hs.length];
        double[] tauyHat = new double[hs.length];

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                Complex h = transform.get(hs, r, c).negate();
                double kxv = kx[c];
                double kyv = ky[r];
                double k2 = kxv * kxv + kyv * kyv;
                double k = Math.sqrt(k2);

                Complex bracket = besselX[c].multiply(logTerm + k2 / (kxv * kxv)).subtract(1.0);
                Complex dx = h.multiply(kxv * kxv / k * speedFactor).multiply(bracket);
                Complex dy = h.multiply(kxv * kyv / k * speedFactor).multiply(besselY[c]);

                transform.set(tauxHat, r, c, dx);
                transform.set(tauyHat, r, c, dy);
            }
        }

        ShearField result = new ShearField(transform.inverseReal(tauxHat), transform.inverseReal(tauyHat));
        log.debug("Solver espectral: {}x{} modos, u0={} m/s", rows, cols, u0);
        return result;
    }
}
