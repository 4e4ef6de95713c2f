package duneshear.physics.interpolation;

import duneshear.utils.GridArrays;

/**
 * Recorrido común: valida formas, localiza cada destino en la malla y delega la evaluación.
 */
abstract class AbstractMeshInterpolator implements GridInterpolator {

    @Override
    public double[][] interpolate(DelaunayMesh mesh, double[][] values, double[][] xDst, double[][] yDst) {
        if (!mesh.acceptsShape(values)) {
            throw new IllegalArgumentException(String.format(
                    "Los valores fuente deben tener forma (%d, %d).", mesh.getRows(), mesh.getCols()));
        }
        if (!GridArrays.isRectangular(xDst) || !GridArrays.sameShape(xDst, yDst)) {
            throw new IllegalArgumentException("Las coordenadas destino deben ser rectangulares y de igual forma.");
        }

        double[] flat = GridArrays.flatten(values);
        Evaluator evaluator = prepare(mesh, flat);

        int rows = xDst.length;
        int cols = xDst[0].length;
        double[][] result = new double[rows][cols];
        double[] bary = new double[3];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int t = mesh.locate(xDst[r][c], yDst[r][c], bary);
                result[r][c] = t < 0 ? Double.NaN : evaluator.evaluate(t, bary);
            }
        }
        return result;
    }

    /**
     * Precálculo por llamada (p. ej. gradientes nodales).
     */
    protected abstract Evaluator prepare(DelaunayMesh mesh, double[] values);

    @FunctionalInterface
    protected interface Evaluator {
        double evaluate(int triangle, double[] bary);
    }
}
