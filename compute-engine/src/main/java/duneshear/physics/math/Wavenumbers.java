package duneshear.physics.math;

/**
 * Números de onda angulares de una rejilla de cálculo.
 * <p>
 * Para un eje de n puntos con paso d, el índice j usa la frecuencia entera de la posición j+1
 * en un eje de n+1 muestras (orden FFT: positivas, luego negativas), y k = m * 2π / (d * n).
 * Con este desplazamiento ningún número de onda es exactamente cero.
 * <p>
 * Es el número de onda angular físico del eje, no la escala {@code m * d * n / (2π * (n + 1))}:
 * esa otra escala cambia la magnitud de las perturbaciones pero no su patrón espacial.
 */
public final class Wavenumbers {

    private Wavenumbers() {
    }

    /**
     * Índice de frecuencia entero en orden FFT para la posición p de un eje de longitud total.
     */
    static int frequencyIndex(int position, int total) {
        return position <= (total - 1) / 2 ? position : position - total;
    }

    public static double[] axis(int n, double spacing) {
        if (n < 1 || !(spacing > 0)) {
            throw new IllegalArgumentException("Eje espectral inválido: n=" + n + ", d=" + spacing);
        }
        double[] k = new double[n];
        double scale = 2.0 * Math.PI / (spacing * n);
        for (int j = 0; j < n; j++) {
            k[j] = frequencyIndex(j + 1, n + 1) * scale;
        }
        return k;
    }
}
