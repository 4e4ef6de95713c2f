package duneshear.physics.simulator;

import duneshear.config.ShearConfig;
import duneshear.config.ShearConfigurationException;
import duneshear.domain.grid.ComputationalGrid;
import duneshear.domain.grid.InputGrid;
import duneshear.domain.grid.ShearField;
import duneshear.domain.grid.ShearStress;
import duneshear.factory.ComputationalGridFactory;
import duneshear.physics.buffer.BufferExtrapolator;
import duneshear.physics.geometry.GridRotation;
import duneshear.physics.interpolation.DelaunayMesh;
import duneshear.physics.interpolation.GridInterpolator;
import duneshear.physics.interpolation.InterpolationCoverageException;
import duneshear.physics.solver.ShearSolver;
import duneshear.physics.solver.impl.SpectralShearSolver;
import duneshear.utils.GridArrays;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Orquesta el cálculo de la perturbación del esfuerzo cortante sobre una rejilla de entrada.
 * <p>
 * Por invocación:
 * <ol>
 * <li>Puebla la rejilla computacional para la dirección (rotación + buffer).</li>
 * <li>Resuelve la perturbación en ejes alineados con el viento.</li>
 * <li>Rota el campo vectorial de vuelta a ejes del mundo.</li>
 * <li>Lo interpola sobre los nodos de la rejilla de entrada.</li>
 * </ol>
 * La rejilla computacional y las triangulaciones se construyen una vez. Solo se conserva el
 * resultado de la última invocación.
 * <p>
 * Thread-Safe: las invocaciones y los accesos se serializan sobre la instancia.
 */
@Slf4j
public class WindShearSimulator {

    @Getter
    private final InputGrid inputGrid;
    @Getter
    private final ShearConfig config;

    private final ComputationalGrid computationalGrid;
    private final DelaunayMesh referenceMesh;
    private final BufferExtrapolator bufferExtrapolator;
    private final ShearSolver solver;
    private final GridInterpolator interpolator;

    // --- Resultado de la última invocación ---
    private ShearField shear;
    private double lastSpeed = Double.NaN;
    private double lastDirection = Double.NaN;

    public WindShearSimulator(double[][] x, double[][] y, double[][] z, ShearConfig config) {
        this(new InputGrid(x, y, z), config);
    }

    public WindShearSimulator(InputGrid inputGrid, ShearConfig config) {
        this(inputGrid, config, null, null);
    }

    /**
     * Constructor con costuras inyectables (solver e interpolador). Nulo = implementación por defecto.
     */
    WindShearSimulator(InputGrid inputGrid, ShearConfig config, ShearSolver solver, GridInterpolator interpolator) {
        this.inputGrid = Objects.requireNonNull(inputGrid, "La rejilla de entrada no puede ser nula.");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        config.validate();
        if (config.getBuffer().getWidth() == 0.0) {
            log.warn("Ancho de buffer 0: la topografía sintética empieza ya atenuada a la mitad en el contorno.");
        }

        this.solver = solver != null ? solver : new SpectralShearSolver(config.getSpectral());
        this.interpolator = interpolator != null ? interpolator : GridInterpolator.forMethod(config.getInterpolationMethod());

        long start = System.currentTimeMillis();

        // 1. Rejilla computacional de referencia (sin rotar)
        this.computationalGrid = ComputationalGridFactory.createReferenceGrid(inputGrid, config);

        // 2. Triangulaciones reutilizables
        DelaunayMesh inputMesh = DelaunayMesh.of(inputGrid.cloneX(), inputGrid.cloneY());
        this.referenceMesh = DelaunayMesh.of(computationalGrid.cloneReferenceX(), computationalGrid.cloneReferenceY());

        // 3. Buffer
        this.bufferExtrapolator = new BufferExtrapolator(inputGrid, inputMesh, this.interpolator, config.getBuffer());

        log.info("WindShearSimulator listo: entrada {}x{}, computacional {}x{} ({}, {}) en {} ms",
                inputGrid.getRows(), inputGrid.getCols(), computationalGrid.getRows(), computationalGrid.getCols(),
                this.solver.getName(), this.interpolator.getName(), System.currentTimeMillis() - start);
    }

    /**
     * Calcula la perturbación del cortante para un viento libre.
     *
     * @param u0        Velocidad del viento [m/s], no negativa.
     * @param direction Dirección en grados (cualquier real; se usa la periodicidad trigonométrica).
     * @return Esta instancia, para encadenar {@link #getShear()}.
     */
    public synchronized WindShearSimulator compute(double u0, double direction) {
        if (!(u0 >= 0) || !Double.isFinite(u0)) {
            throw new ShearConfigurationException("La velocidad del viento debe ser finita y no negativa: " + u0);
        }
        if (!Double.isFinite(direction)) {
            throw new ShearConfigurationException("La dirección del viento debe ser finita: " + direction);
        }

        long start = System.currentTimeMillis();
        try {
            // 1. Rotación + buffer
            bufferExtrapolator.populate(computationalGrid, direction);

            // 2. Solver en ejes del viento
            ShearField aligned = solver.compute(computationalGrid, u0);

            // 3. De vuelta a ejes del mundo
            GridRotation.Rotated back = GridRotation.rotate(aligned.dtaux(), aligned.dtauy(), direction);
            ShearField world = new ShearField(back.x(), back.y());
            computationalGrid.updateShear(aligned, world);

            // 4. Interpolación a la entrada: los nodos de entrada se llevan al marco de referencia
            GridRotation.Rotated queries = GridRotation.rotate(inputGrid.cloneX(), inputGrid.cloneY(), -direction,
                    computationalGrid.getOriginX(), computationalGrid.getOriginY());
            double[][] dtaux = interpolator.interpolate(referenceMesh, world.dtaux(), queries.x(), queries.y());
            double[][] dtauy = interpolator.interpolate(referenceMesh, world.dtauy(), queries.x(), queries.y());

            int uncovered = GridArrays.countNaN(dtaux) + GridArrays.countNaN(dtauy);
            if (uncovered > 0) {
                throw new InterpolationCoverageException(String.format(
                        "%d valores sin cubrir al interpolar sobre la rejilla de entrada (dirección %s°).",
                        uncovered, direction), uncovered);
            }

            this.shear = new ShearField(dtaux, dtauy);
            this.lastSpeed = u0;
            this.lastDirection = direction;
        } catch (RuntimeException e) {
            log.error("Fallo calculando el cortante (u0={}, dirección={}): {}", u0, direction, e.getMessage());
            throw e;
        }

        log.info("Cortante calculado: u0={} m/s, dirección={}° en {} ms",
                u0, direction, System.currentTimeMillis() - start);
        return this;
    }

    /**
     * Perturbación (dtaux, dtauy) en los nodos de la rejilla de entrada y en ejes del mundo.
     *
     * @throws IllegalStateException si todavía no se ha invocado {@link #compute(double, double)}.
     */
    public synchronized ShearField getShear() {
        requireComputed();
        return shear;
    }

    /**
     * Esfuerzo cortante total {@code ρ · Cd · u0² · (ê + δτ)} de la última invocación.
     */
    public synchronized ShearStress getShearStress() {
        requireComputed();
        double[] unit = GridRotation.windUnitVector(lastDirection);
        return ShearStress.fromPerturbation(shear, unit[0], unit[1], lastSpeed,
                config.getAirDensity(), config.getDragCoefficient());
    }

    /**
     * Instantánea de la rejilla computacional (visualización), tomada bajo el mismo cerrojo que
     * {@link #compute(double, double)}. Modificarla no altera el estado del simulador.
     */
    public synchronized ComputationalGrid getComputationalGrid() {
        return computationalGrid.snapshot();
    }

    public synchronized double getLastSpeed() {
        return lastSpeed;
    }

    public synchronized double getLastDirection() {
        return lastDirection;
    }

    public synchronized boolean hasResult() {
        return shear != null;
    }

    private void requireComputed() {
        if (shear == null) {
            throw new IllegalStateException("No hay resultado: invoque compute(u0, dirección) primero.");
        }
    }
}
