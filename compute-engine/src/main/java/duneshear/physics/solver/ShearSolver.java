package duneshear.physics.solver;

import duneshear.domain.grid.ComputationalGrid;
import duneshear.domain.grid.ShearField;

/**
 * Cálculo de la perturbación del esfuerzo cortante sobre una rejilla computacional poblada.
 */
public interface ShearSolver {

    String getName();

    /**
     * @param grid Rejilla computacional con la elevación ya alineada con el viento.
     * @param u0   Velocidad del viento libre [m/s], no negativa.
     * @return Perturbación (dtaux, dtauy) en ejes de la rejilla (x = dirección del viento).
     */
    ShearField compute(ComputationalGrid grid, double u0);
}
