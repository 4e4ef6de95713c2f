package duneshear.physics.interpolation;

import duneshear.config.InterpolationMethod;

/**
 * Interpolación de datos dispersos (nodos de una rejilla 2D, tratados como nube de puntos)
 * sobre los nodos de otra rejilla. Los destinos fuera del casco convexo de la fuente valen NaN.
 */
public interface GridInterpolator {

    String getName();

    /**
     * Interpola sobre una triangulación ya construida (reutilizable entre llamadas).
     *
     * @param mesh   Triangulación de los nodos fuente.
     * @param values Valores en los nodos fuente, con la misma forma que la rejilla triangulada.
     * @param xDst   Coordenadas X de destino.
     * @param yDst   Coordenadas Y de destino, misma forma que xDst.
     * @return Matriz con la forma del destino.
     */
    double[][] interpolate(DelaunayMesh mesh, double[][] values, double[][] xDst, double[][] yDst);

    default double[][] interpolate(double[][] xSrc, double[][] ySrc, double[][] zSrc,
                                   double[][] xDst, double[][] yDst) {
        return interpolate(DelaunayMesh.of(xSrc, ySrc), zSrc, xDst, yDst);
    }

    static GridInterpolator forMethod(InterpolationMethod method) {
        switch (method) {
            case LINEAR:
                return new LinearTriangleInterpolator();
            case CUBIC:
                return new CloughTocherInterpolator();
            default:
                throw new IllegalArgumentException("Método de interpolación no soportado: " + method);
        }
    }
}
