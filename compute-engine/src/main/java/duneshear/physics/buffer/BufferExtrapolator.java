package duneshear.physics.buffer;

import duneshear.config.ShearConfig.BufferConfig;
import duneshear.domain.grid.ComputationalGrid;
import duneshear.domain.grid.InputGrid;
import duneshear.physics.geometry.GridRotation;
import duneshear.physics.interpolation.DelaunayMesh;
import duneshear.physics.interpolation.GridInterpolator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Puebla la rejilla computacional para una dirección de viento.
 * <ol>
 * <li>Rota la rejilla de referencia alrededor del pivote.</li>
 * <li>Interpola la elevación de la entrada sobre los nodos rotados (NaN fuera del casco).</li>
 * <li>Cada nodo sin definir toma la elevación del punto de contorno más cercano atenuada por la
 * sigmoide de la distancia.</li>
 * </ol>
 * El contorno y la triangulación de la entrada se calculan una vez y se reutilizan.
 */
@Slf4j
public class BufferExtrapolator {

    private final InputGrid input;
    private final DelaunayMesh inputMesh;
    private final GridInterpolator interpolator;
    @Getter
    private final GridBorder border;
    @Getter
    private final SigmoidBlend blend;

    public BufferExtrapolator(InputGrid input, DelaunayMesh inputMesh, GridInterpolator interpolator,
                              BufferConfig buffer) {
        this.input = Objects.requireNonNull(input, "La rejilla de entrada no puede ser nula.");
        this.inputMesh = Objects.requireNonNull(inputMesh, "La triangulación de entrada no puede ser nula.");
        this.interpolator = Objects.requireNonNull(interpolator, "El interpolador no puede ser nulo.");
        this.border = GridBorder.of(input);
        this.blend = new SigmoidBlend(buffer.getWidth(), buffer.getEffectiveRelaxation());
    }

    /**
     * Rota la rejilla a la dirección dada y rellena su elevación.
     *
     * @return Número de nodos rellenados por extrapolación.
     */
    public int populate(ComputationalGrid grid, double direction) {
        GridRotation.Rotated rotated = GridRotation.rotate(grid.cloneReferenceX(), grid.cloneReferenceY(),
                direction, grid.getOriginX(), grid.getOriginY());
        grid.updateWorkingCoordinates(direction, rotated.x(), rotated.y());

        double[][] z = interpolator.interpolate(inputMesh, input.cloneZ(), rotated.x(), rotated.y());
        int filled = extrapolate(z, rotated.x(), rotated.y());
        grid.updateElevation(z);

        log.debug("Buffer: {} de {} nodos extrapolados (dirección {}°)",
                filled, grid.getRows() * grid.getCols(), direction);
        return filled;
    }

    /**
     * Sustituye in situ los NaN de z por {@code z_contorno · sigmoide(d)}.
     */
    int extrapolate(double[][] z, double[][] x, double[][] y) {
        int filled = 0;
        for (int r = 0; r < z.length; r++) {
            for (int c = 0; c < z[r].length; c++) {
                if (!Double.isNaN(z[r][c])) {
                    continue;
                }
                int nearest = border.nearest(x[r][c], y[r][c]);
                double d = border.distance(nearest, x[r][c], y[r][c]);
                z[r][c] = border.getZAt(nearest) * blend.factor(d);
                filled++;
            }
        }
        return filled;
    }
}
