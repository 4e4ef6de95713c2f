package duneshear.physics.math;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SpectralTransformTest {

    @Test
    @DisplayName("Componente continua: la FFT de un campo constante concentra todo en el modo (0, 0)")
    void forward_constantField_shouldOnlyHaveMeanMode() {
        // ARRANGE
        SpectralTransform transform = new SpectralTransform(3, 5);
        double[][] field = new double[3][5];
        for (double[] row : field) java.util.Arrays.fill(row, 2.0);

        // ACT
        double[] spectrum = transform.forward(field);

        // ASSERT: sin normalizar -> 2 * 15
        assertThat(transform.get(spectrum, 0, 0).getReal()).isCloseTo(30.0, within(1e-12));
        assertThat(transform.get(spectrum, 1, 2).abs()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Inversa normalizada: recupera el campo real original")
    void inverseReal_shouldRecoverField() {
        SpectralTransform transform = new SpectralTransform(4, 6);
        double[][] field = new double[4][6];
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 6; c++) {
                field[r][c] = Math.sin(r + 0.3 * c) + r * c;
            }
        }

        double[][] back = transform.inverseReal(transform.forward(field));

        for (int r = 0; r < 4; r++) {
            assertThat(back[r]).containsExactly(field[r], within(1e-12));
        }
    }

    @Test
    @DisplayName("Acceso a modos: set/get sobre el espectro intercalado")
    void setAndGet_shouldUseInterleavedLayout() {
        SpectralTransform transform = new SpectralTransform(2, 3);
        double[] spectrum = new double[2 * 2 * 3];

        transform.set(spectrum, 1, 2, new Complex(7.0, -3.0));

        assertThat(spectrum[1 * 6 + 4]).isEqualTo(7.0);
        assertThat(spectrum[1 * 6 + 5]).isEqualTo(-3.0);
        assertThat(transform.get(spectrum, 1, 2)).isEqualTo(new Complex(7.0, -3.0));
    }

    @Test
    @DisplayName("Campo con forma distinta a la del plan: se rechaza")
    void forward_wrongShape_shouldFail() {
        SpectralTransform transform = new SpectralTransform(2, 2);

        assertThatThrownBy(() -> transform.forward(new double[3][2]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
