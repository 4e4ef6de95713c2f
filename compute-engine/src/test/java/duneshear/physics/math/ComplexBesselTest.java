package duneshear.physics.math;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Slf4j
class ComplexBesselTest {

    private static final double TOL = 1e-12;
    // La serie pierde algunos dígitos por cancelación cerca del radio de cambio
    private static final double SERIES_TOL = 1e-10;

    @ParameterizedTest(name = "J0({0}) = {1}, J1({0}) = {2}")
    @CsvSource({
            "0.0,  1.0,                  0.0",
            "1.0,  0.7651976865579666,   0.44005058574493355",
            "12.0, 0.04768931079683354,  -0.2234471044906276",
            "20.0, 0.16702466434058315,  0.06683312417585005",
            "25.0, 0.09626678327595812,  -0.1253502495802899"
    })
    @DisplayName("Argumento real: coincide con los valores tabulados (serie y asintótica)")
    void besselJ_realArgument_shouldMatchTables(double x, double j0, double j1) {
        // ACT
        Complex r0 = ComplexBessel.j0(new Complex(x, 0.0));
        Complex r1 = ComplexBessel.j1(new Complex(x, 0.0));
        log.info("x={} -> J0={}, J1={}", x, r0, r1);

        // ASSERT
        assertThat(r0.getReal()).isCloseTo(j0, within(SERIES_TOL));
        assertThat(r1.getReal()).isCloseTo(j1, within(SERIES_TOL));
        assertThat(r0.getImaginary()).isCloseTo(0.0, within(SERIES_TOL));
        assertThat(r1.getImaginary()).isCloseTo(0.0, within(SERIES_TOL));
    }

    @Test
    @DisplayName("Argumento imaginario puro: J0(i) = I0(1) y J1(i) = i·I1(1)")
    void besselJ_imaginaryArgument_shouldMatchModifiedBessel() {
        Complex r0 = ComplexBessel.j0(Complex.I);
        Complex r1 = ComplexBessel.j1(Complex.I);

        assertThat(r0.getReal()).isCloseTo(1.2660658777520082, within(TOL));
        assertThat(r0.getImaginary()).isCloseTo(0.0, within(TOL));
        assertThat(r1.getReal()).isCloseTo(0.0, within(TOL));
        assertThat(r1.getImaginary()).isCloseTo(0.565159103992485, within(TOL));
    }

    @Test
    @DisplayName("Continuidad en el cambio de régimen: serie y asintótica coinciden a ambos lados de |z| = 17")
    void besselJ_aroundSwitchRadius_shouldBeContinuous() {
        // ARRANGE: mismo argumento complejo justo dentro y justo fuera del radio de cambio
        Complex direction = new Complex(Math.cos(0.3), Math.sin(0.3));
        Complex inside = direction.multiply(ComplexBessel.SERIES_LIMIT - 1e-12);
        Complex outside = direction.multiply(ComplexBessel.SERIES_LIMIT + 1e-12);

        // ACT
        Complex a = ComplexBessel.j1(inside);
        Complex b = ComplexBessel.j1(outside);
        log.info("J1 dentro={}, fuera={}", a, b);

        // ASSERT
        double scale = Math.max(1.0, a.abs());
        assertThat(a.subtract(b).abs() / scale).isLessThan(1e-9);
    }

    @Test
    @DisplayName("Identidad de Wronskiano aproximada: J0'(z) = -J1(z) por diferencias centradas")
    void besselJ_derivativeIdentity_shouldHold() {
        Complex z = new Complex(0.4, 0.7);
        double h = 1e-6;

        Complex derivative = ComplexBessel.j0(z.add(h)).subtract(ComplexBessel.j0(z.subtract(h))).divide(2 * h);

        assertThat(derivative.add(ComplexBessel.j1(z)).abs()).isLessThan(1e-8);
    }

    @Test
    @DisplayName("NaN se propaga")
    void besselJ_nan_shouldPropagate() {
        assertThat(ComplexBessel.j0(Complex.NaN).isNaN()).isTrue();
    }
}
