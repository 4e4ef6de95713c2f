package duneshear.physics.interpolation;

/**
 * Interpolación lineal baricéntrica sobre la triangulación.
 */
public class LinearTriangleInterpolator extends AbstractMeshInterpolator {

    @Override
    public String getName() {
        return "Linear_Barycentric";
    }

    @Override
    protected Evaluator prepare(DelaunayMesh mesh, double[] values) {
        return (t, b) -> b[0] * values[mesh.vertex(t, 0)]
                + b[1] * values[mesh.vertex(t, 1)]
                + b[2] * values[mesh.vertex(t, 2)];
    }
}
