package duneshear.factory;

import duneshear.config.ShearConfig;
import duneshear.domain.grid.ComputationalGrid;
import duneshear.domain.grid.InputGrid;
import lombok.extern.slf4j.Slf4j;

/**
 * Construye la rejilla computacional de referencia (sin rotar) a partir de la rejilla de entrada.
 * <p>
 * La rejilla es cuadrada, de lado {@code D = diagonal(caja de la entrada) + 2 * ancho de buffer},
 * centrada en el centroide de la entrada. Así cubre la entrada para cualquier dirección de viento.
 * Los límites se redondean hacia fuera a múltiplos del espaciado (floor abajo, ceil arriba) para
 * que la rejilla sea reproducible con independencia del valor exacto del centroide.
 */
@Slf4j
public final class ComputationalGridFactory {

    private ComputationalGridFactory() {}

    public static ComputationalGrid createReferenceGrid(InputGrid input, ShearConfig config) {
        // 1. Pivote fijo de rotación
        final double x0 = input.getCentroidX();
        final double y0 = input.getCentroidY();

        // 2. Lado del cuadrado
        final double side = input.getBoundingBoxDiagonal() + 2.0 * config.getBuffer().getWidth();

        // 3. Ejes equidistantes
        double[] xAxis = exactAxis(x0 - side / 2.0, x0 + side / 2.0, config.getDx());
        double[] yAxis = exactAxis(y0 - side / 2.0, y0 + side / 2.0, config.getDy());

        double[][] xi = new double[yAxis.length][xAxis.length];
        double[][] yi = new double[yAxis.length][xAxis.length];
        for (int j = 0; j < yAxis.length; j++) {
            for (int i = 0; i < xAxis.length; i++) {
                xi[j][i] = xAxis[i];
                yi[j][i] = yAxis[j];
            }
        }

        log.info("Rejilla computacional: {}x{} nodos, lado D={} m, dx={}, dy={}, pivote=({}, {})",
                yAxis.length, xAxis.length, String.format("%.2f", side), config.getDx(), config.getDy(),
                String.format("%.3f", x0), String.format("%.3f", y0));

        return new ComputationalGrid(config.getDx(), config.getDy(), x0, y0, side, xi, yi);
    }

    /**
     * Eje {@code [floor(min/d)*d, ceil(max/d)*d)} con paso d (extremo superior excluido).
     */
    public static double[] exactAxis(double min, double max, double spacing) {
        double start = Math.floor(min / spacing) * spacing;
        double stop = Math.ceil(max / spacing) * spacing;
        int n = (int) Math.ceil((stop - start) / spacing);
        if (n < 2) {
            throw new IllegalArgumentException(String.format(
                    "El eje [%s, %s) con paso %s tiene menos de 2 nodos.", start, stop, spacing));
        }
        double[] axis = new double[n];
        for (int i = 0; i < n; i++) {
            axis[i] = start + i * spacing;
        }
        return axis;
    }
}
