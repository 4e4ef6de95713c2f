package duneshear.physics.math;

import lombok.Getter;
import org.apache.commons.math3.complex.Complex;
import org.jtransforms.fft.DoubleFFT_2D;

/**
 * Transformada de Fourier discreta 2D sobre una rejilla (rows, cols) fija.
 * <p>
 * Convención: directa sin normalizar, inversa normalizada por 1/(rows*cols).
 * Los espectros se almacenan intercalados (re, im) por fila, como los consume JTransforms.
 * No es thread-safe: el plan de JTransforms se reutiliza entre llamadas.
 */
public final class SpectralTransform {

    @Getter
    private final int rows;
    @Getter
    private final int cols;
    private final DoubleFFT_2D fft;

    public SpectralTransform(int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Dimensiones de la transformada inválidas: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.fft = new DoubleFFT_2D(rows, cols);
    }

    /**
     * FFT2 de un campo real.
     *
     * @return Espectro intercalado de tamaño rows * 2 * cols.
     */
    public double[] forward(double[][] field) {
        if (field.length != rows || field[0].length != cols) {
            throw new IllegalArgumentException("El campo no coincide con la forma de la transformada.");
        }
        double[] spectrum = new double[rows * 2 * cols];
        for (int r = 0; r < rows; r++) {
            int base = r * 2 * cols;
            for (int c = 0; c < cols; c++) {
                spectrum[base + 2 * c] = field[r][c];
            }
        }
        fft.complexForward(spectrum);
        return spectrum;
    }

    /**
     * FFT2 inversa normalizada; devuelve la parte real. El array de entrada se sobrescribe.
     */
    public double[][] inverseReal(double[] spectrum) {
        if (spectrum.length != rows * 2 * cols) {
            throw new IllegalArgumentException("Espectro de tamaño inesperado: " + spectrum.length);
        }
        fft.complexInverse(spectrum, true);
        double[][] field = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            int base = r * 2 * cols;
            for (int c = 0; c < cols; c++) {
                field[r][c] = spectrum[base + 2 * c];
            }
        }
        return field;
    }

    public Complex get(double[] spectrum, int row, int col) {
        int i = row * 2 * cols + 2 * col;
        return new Complex(spectrum[i], spectrum[i + 1]);
    }

    public void set(double[] spectrum, int row, int col, Complex value) {
        int i = row * 2 * cols + 2 * col;
        spectrum[i] = value.getReal();
        spectrum[i + 1] = value.getImaginary();
    }
}
