package duneshear.physics.interpolation;

/**
 * Lanzada cuando algún destino de una interpolación queda fuera del casco convexo de la fuente
 * y el resultado contiene NaN donde el llamante exige cobertura completa.
 */
public class InterpolationCoverageException extends IllegalStateException {

    private final int uncoveredCount;

    public InterpolationCoverageException(String message, int uncoveredCount) {
        super(message);
        this.uncoveredCount = uncoveredCount;
    }

    public int getUncoveredCount() {
        return uncoveredCount;
    }
}
