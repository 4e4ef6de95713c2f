package duneshear.physics.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GridRotationTest {

    private static final double TOL = 1e-12;

    @Test
    @DisplayName("90° antihorario: (1, 0) pasa a (0, 1) alrededor del origen")
    void rotatePoint_ninetyDegrees_shouldBeCounterClockwise() {
        double[] p = GridRotation.rotatePoint(1.0, 0.0, 90.0, 0.0, 0.0);

        assertThat(p[0]).isCloseTo(0.0, within(TOL));
        assertThat(p[1]).isCloseTo(1.0, within(TOL));
    }

    @Test
    @DisplayName("Rotación con pivote: el pivote queda fijo y las distancias se conservan")
    void rotate_aroundOrigin_shouldPreserveDistances() {
        // ARRANGE
        double[][] x = {{0, 1, 2}, {0, 1, 2}};
        double[][] y = {{0, 0, 0}, {1, 1, 1}};
        double ox = 1.0, oy = 0.5;

        // ACT
        GridRotation.Rotated r = GridRotation.rotate(x, y, 37.0, ox, oy);

        // ASSERT
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 3; j++) {
                double before = Math.hypot(x[i][j] - ox, y[i][j] - oy);
                double after = Math.hypot(r.x()[i][j] - ox, r.y()[i][j] - oy);
                assertThat(after).isCloseTo(before, within(TOL));
            }
        }
        double[] pivot = GridRotation.rotatePoint(ox, oy, 37.0, ox, oy);
        assertThat(pivot).containsExactly(new double[]{ox, oy}, within(TOL));
    }

    @Test
    @DisplayName("Periodicidad: θ y θ+360 dan el mismo resultado")
    void rotate_fullTurn_shouldBeIdentical() {
        double[][] u = {{1.5, -2.0}};
        double[][] v = {{0.3, 4.0}};

        GridRotation.Rotated a = GridRotation.rotate(u, v, 25.0);
        GridRotation.Rotated b = GridRotation.rotate(u, v, 385.0);

        assertThat(b.x()[0]).containsExactly(a.x()[0], within(1e-12));
        assertThat(b.y()[0]).containsExactly(a.y()[0], within(1e-12));
    }

    @Test
    @DisplayName("Ida y vuelta: rotar θ y luego -θ devuelve las coordenadas originales")
    void rotate_thenInverse_shouldRestore() {
        double[][] x = {{3.0, -7.0}};
        double[][] y = {{2.0, 11.0}};

        GridRotation.Rotated there = GridRotation.rotate(x, y, 123.0, 5.0, -1.0);
        GridRotation.Rotated back = GridRotation.rotate(there.x(), there.y(), -123.0, 5.0, -1.0);

        assertThat(back.x()[0]).containsExactly(x[0], within(1e-10));
        assertThat(back.y()[0]).containsExactly(y[0], within(1e-10));
    }

    @Test
    @DisplayName("Vector unitario del viento: 0° es +X y 90° es +Y")
    void windUnitVector_shouldFollowAngleConvention() {
        assertThat(GridRotation.windUnitVector(0.0)).containsExactly(new double[]{1.0, 0.0}, within(TOL));
        assertThat(GridRotation.windUnitVector(90.0)).containsExactly(new double[]{0.0, 1.0}, within(TOL));
    }

    @Test
    @DisplayName("Formas distintas: se rechaza")
    void rotate_shapeMismatch_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> GridRotation.rotate(new double[2][2], new double[3][2], 10.0));
    }
}
