package duneshear.domain.grid;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Slf4j
class ShearStressTest {

    @Test
    @DisplayName("Sin perturbación: el esfuerzo es ρ·Cd·u0² en la dirección del viento")
    void fromPerturbation_zeroPerturbation_shouldBeAlignedWithWind() {
        // ARRANGE
        ShearField none = ShearField.zeros(2, 2);
        double u0 = 10.0;

        // ACT: viento hacia +Y
        ShearStress stress = ShearStress.fromPerturbation(none, 0.0, 1.0, u0, 1.25, 0.001);

        // ASSERT: 1.25 * 0.001 * 100 = 0.125 N/m²
        log.info("tau = ({}, {})", stress.getTauxAt(0, 0), stress.getTauyAt(0, 0));
        assertThat(stress.getTauxAt(0, 0)).isCloseTo(0.0, within(1e-15));
        assertThat(stress.getTauyAt(1, 1)).isCloseTo(0.125, within(1e-12));
    }

    @Test
    @DisplayName("Con perturbación: se suma al vector unitario antes de escalar")
    void fromPerturbation_shouldAddPerturbationToUnitVector() {
        // ARRANGE
        ShearField perturbation = new ShearField(new double[][]{{0.2}}, new double[][]{{-0.1}});

        // ACT
        ShearStress stress = ShearStress.fromPerturbation(perturbation, 1.0, 0.0, 2.0, 1.0, 0.5);

        // ASSERT: escala = 1 * 0.5 * 4 = 2
        assertThat(stress.getTauxAt(0, 0)).isCloseTo(2.0 * 1.2, within(1e-12));
        assertThat(stress.getTauyAt(0, 0)).isCloseTo(-0.2, within(1e-12));
    }

    @Test
    @DisplayName("Igualdad por contenido: misma composición, esfuerzos iguales")
    void equals_sameComposition_shouldBeEqual() {
        ShearField perturbation = ShearField.zeros(2, 2);

        ShearStress a = ShearStress.fromPerturbation(perturbation, 1.0, 0.0, 10.0, 1.25, 0.001);
        ShearStress b = ShearStress.fromPerturbation(perturbation, 1.0, 0.0, 10.0, 1.25, 0.001);
        ShearStress c = ShearStress.fromPerturbation(perturbation, 0.0, 1.0, 10.0, 1.25, 0.001);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
    }
}
