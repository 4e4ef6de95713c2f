package duneshear.config;

/**
 * Método de interpolación dispersa entre la rejilla de entrada y la rejilla computacional.
 */
public enum InterpolationMethod {
    /**
     * Interpolación lineal baricéntrica sobre la triangulación de Delaunay.
     */
    LINEAR,

    /**
     * Interpolante cúbico C1 de Clough-Tocher sobre la triangulación de Delaunay (por defecto).
     */
    CUBIC
}
