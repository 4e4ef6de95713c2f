package duneshear.domain.grid;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComputationalGridTest {

    private ComputationalGrid grid;

    @BeforeEach
    void setUp() {
        double[][] xi = {{0, 1, 2}, {0, 1, 2}};
        double[][] yi = {{0, 0, 0}, {1, 1, 1}};
        grid = new ComputationalGrid(1.0, 1.0, 1.0, 0.5, 3.0, xi, yi);
    }

    @Test
    @DisplayName("Recién construida: sin dirección ni elevación")
    void newGrid_shouldNotBePopulated() {
        assertThat(grid.getRows()).isEqualTo(2);
        assertThat(grid.getCols()).isEqualTo(3);
        assertThat(grid.isPopulated()).isFalse();
        assertThat(grid.getDirection()).isNaN();
        assertThat(grid.cloneZ()).isNull();
        assertThat(grid.getAlignedShear()).isNull();
    }

    @Test
    @DisplayName("Nueva dirección: invalida la elevación y las perturbaciones anteriores")
    void updateWorkingCoordinates_shouldResetPreviousGeneration() {
        // ARRANGE
        grid.updateWorkingCoordinates(10.0, grid.cloneReferenceX(), grid.cloneReferenceY());
        grid.updateElevation(new double[2][3]);
        grid.updateShear(ShearField.zeros(2, 3), ShearField.zeros(2, 3));
        assertThat(grid.isPopulated()).isTrue();

        // ACT
        grid.updateWorkingCoordinates(20.0, grid.cloneReferenceX(), grid.cloneReferenceY());

        // ASSERT
        assertThat(grid.getDirection()).isEqualTo(20.0);
        assertThat(grid.isPopulated()).isFalse();
        assertThat(grid.getWorldShear()).isNull();
        assertThat(grid.cloneX()).isDeepEqualTo(grid.cloneReferenceX());
    }

    @Test
    @DisplayName("Campos con forma ajena a la rejilla: se rechazan")
    void updates_withWrongShape_shouldFail() {
        assertThatThrownBy(() -> grid.updateElevation(new double[3][2]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> grid.updateShear(ShearField.zeros(1, 1), ShearField.zeros(2, 3)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Instantánea: modificarla no altera la rejilla de la que procede")
    void snapshot_shouldBeIndependentOfSource() {
        // ARRANGE
        grid.updateWorkingCoordinates(10.0, grid.cloneReferenceX(), grid.cloneReferenceY());
        grid.updateElevation(new double[][]{{1, 2, 3}, {4, 5, 6}});
        grid.updateShear(ShearField.zeros(2, 3), ShearField.zeros(2, 3));

        // ACT
        ComputationalGrid copy = grid.snapshot();
        copy.updateWorkingCoordinates(20.0, grid.cloneReferenceX(), grid.cloneReferenceY());

        // ASSERT
        assertThat(copy.isPopulated()).isFalse();
        assertThat(grid.getDirection()).isEqualTo(10.0);
        assertThat(grid.isPopulated()).isTrue();
        assertThat(grid.getWorldShear()).isNotNull();
        assertThat(grid.cloneZ()[1][2]).isEqualTo(6.0);
    }
}
