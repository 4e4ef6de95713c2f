package duneshear.physics.interpolation;

import duneshear.config.InterpolationMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.function.DoubleBinaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearTriangleInterpolatorTest {

    private final GridInterpolator interpolator = GridInterpolator.forMethod(InterpolationMethod.LINEAR);

    @Test
    @DisplayName("Factoría: LINEAR produce el interpolador baricéntrico")
    void forMethod_linear_shouldCreateBarycentric() {
        assertThat(interpolator).isInstanceOf(LinearTriangleInterpolator.class);
        assertThat(interpolator.getName()).isEqualTo("Linear_Barycentric");
    }

    @Test
    @DisplayName("Campo lineal: se reproduce exactamente en el interior")
    void interpolate_linearField_shouldBeExact() {
        // ARRANGE
        DoubleBinaryOperator plane = (x, y) -> 2.0 * x - 3.0 * y + 1.0;
        double[][][] src = InterpolationFixtures.regularGrid(6, 5, 1.0, 0.0, 0.0);
        double[][] z = InterpolationFixtures.sample(src[0], src[1], plane);
        double[][][] dst = InterpolationFixtures.regularGrid(4, 3, 0.7, 0.35, 0.4);

        // ACT
        double[][] result = interpolator.interpolate(src[0], src[1], z, dst[0], dst[1]);

        // ASSERT
        assertThat(result.length).isEqualTo(3);
        assertThat(result[0].length).isEqualTo(4);
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 4; c++) {
                assertThat(result[r][c]).isCloseTo(plane.applyAsDouble(dst[0][r][c], dst[1][r][c]), within(1e-10));
            }
        }
    }

    @Test
    @DisplayName("Destinos fuera del casco convexo: NaN")
    void interpolate_outsideHull_shouldBeNaN() {
        double[][][] src = InterpolationFixtures.regularGrid(3, 3, 1.0, 0.0, 0.0);
        double[][] z = new double[3][3];

        double[][] result = interpolator.interpolate(src[0], src[1], z,
                new double[][]{{1.0, 5.0}}, new double[][]{{1.0, 1.0}});

        assertThat(result[0][0]).isEqualTo(0.0);
        assertThat(result[0][1]).isNaN();
    }

    @Test
    @DisplayName("Valores con forma ajena a la triangulación: se rechazan")
    void interpolate_wrongValueShape_shouldFail() {
        double[][][] src = InterpolationFixtures.regularGrid(3, 3, 1.0, 0.0, 0.0);
        DelaunayMesh mesh = DelaunayMesh.of(src[0], src[1]);

        assertThatThrownBy(() -> interpolator.interpolate(mesh, new double[2][3], src[0], src[1]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
