package duneshear.physics.interpolation;

/**
 * Interpolación cúbica por partes C1 de Clough-Tocher.
 * <p>
 * Cada triángulo se subdivide en tres subtriángulos alrededor del baricentro; sobre ellos se
 * construye un polinomio de Bernstein-Bézier cúbico a partir de los valores y de los gradientes
 * nodales estimados. Reproduce exactamente funciones cuadráticas si los gradientes son exactos.
 */
public class CloughTocherInterpolator extends AbstractMeshInterpolator {

    private final GradientEstimator gradientEstimator;

    public CloughTocherInterpolator() {
        this(GradientEstimator.defaults());
    }

    public CloughTocherInterpolator(GradientEstimator gradientEstimator) {
        this.gradientEstimator = gradientEstimator;
    }

    @Override
    public String getName() {
        return "CloughTocher_C1";
    }

    @Override
    protected Evaluator prepare(DelaunayMesh mesh, double[] values) {
        double[][] gradients = gradientEstimator.estimate(mesh, values);
        return (t, b) -> evaluate(mesh, values, gradients, t, b);
    }

    static double evaluate(DelaunayMesh mesh, double[] f, double[][] grad, int t, double[] b) {
        int v1 = mesh.vertex(t, 0);
        int v2 = mesh.vertex(t, 1);
        int v3 = mesh.vertex(t, 2);

        double e12x = mesh.getPointX(v2) - mesh.getPointX(v1);
        double e12y = mesh.getPointY(v2) - mesh.getPointY(v1);
        double e23x = mesh.getPointX(v3) - mesh.getPointX(v2);
        double e23y = mesh.getPointY(v3) - mesh.getPointY(v2);
        double e31x = mesh.getPointX(v1) - mesh.getPointX(v3);
        double e31y = mesh.getPointY(v1) - mesh.getPointY(v3);

        // Derivadas direccionales en los extremos de cada arista
        double df12 = grad[v1][0] * e12x + grad[v1][1] * e12y;
        double df21 = -(grad[v2][0] * e12x + grad[v2][1] * e12y);
        double df23 = grad[v2][0] * e23x + grad[v2][1] * e23y;
        double df32 = -(grad[v3][0] * e23x + grad[v3][1] * e23y);
        double df31 = grad[v3][0] * e31x + grad[v3][1] * e31y;
        double df13 = -(grad[v1][0] * e31x + grad[v1][1] * e31y);

        double c3000 = f[v1];
        double c2100 = (df12 + 3.0 * c3000) / 3.0;
        double c2010 = (df13 + 3.0 * c3000) / 3.0;
        double c0300 = f[v2];
        double c1200 = (df21 + 3.0 * c0300) / 3.0;
        double c0210 = (df23 + 3.0 * c0300) / 3.0;
        double c0030 = f[v3];
        double c1020 = (df31 + 3.0 * c0030) / 3.0;
        double c0120 = (df32 + 3.0 * c0030) / 3.0;

        double c2001 = (c2100 + c2010 + c3000) / 3.0;
        double c0201 = (c1200 + c0300 + c0210) / 3.0;
        double c0021 = (c1020 + c0120 + c0030) / 3.0;

        // Condición C1 a través de cada arista, usando el baricentro del triángulo vecino
        double[] g = new double[3];
        double[] c = new double[3];
        for (int k = 0; k < 3; k++) {
            int other = mesh.neighbor(t, k);
            if (other < 0) {
                g[k] = -0.5;
                continue;
            }
            double cx = (mesh.getPointX(mesh.vertex(other, 0)) + mesh.getPointX(mesh.vertex(other, 1))
                    + mesh.getPointX(mesh.vertex(other, 2))) / 3.0;
            double cy = (mesh.getPointY(mesh.vertex(other, 0)) + mesh.getPointY(mesh.vertex(other, 1))
                    + mesh.getPointY(mesh.vertex(other, 2))) / 3.0;
            mesh.barycentric(t, cx, cy, c);
            if (k == 0) {
                g[k] = (2.0 * c[2] + c[1] - 1.0) / (2.0 - 3.0 * c[2] - 3.0 * c[1]);
            } else if (k == 1) {
                g[k] = (2.0 * c[0] + c[2] - 1.0) / (2.0 - 3.0 * c[0] - 3.0 * c[2]);
            } else {
                g[k] = (2.0 * c[1] + c[0] - 1.0) / (2.0 - 3.0 * c[1] - 3.0 * c[0]);
            }
        }

        double c0111 = (g[0] * (-c0300 + 3.0 * c0210 - 3.0 * c0120 + c0030)
                + (-c0300 + 2.0 * c0210 - c0120 + c0021 + c0201)) / 2.0;
        double c1011 = (g[1] * (-c0030 + 3.0 * c1020 - 3.0 * c2010 + c3000)
                + (-c0030 + 2.0 * c1020 - c2010 + c2001 + c0021)) / 2.0;
        double c1101 = (g[2] * (-c3000 + 3.0 * c2100 - 3.0 * c1200 + c0300)
                + (-c3000 + 2.0 * c2100 - c1200 + c2001 + c0201)) / 2.0;

        double c1002 = (c1101 + c1011 + c2001) / 3.0;
        double c0102 = (c1101 + c0111 + c0201) / 3.0;
        double c0012 = (c1011 + c0111 + c0021) / 3.0;
        double c0003 = (c1002 + c0102 + c0012) / 3.0;

        // Baricéntricas extendidas respecto al subtriángulo que contiene el punto
        double minB = Math.min(b[0], Math.min(b[1], b[2]));
        double b1 = b[0] - minB;
        double b2 = b[1] - minB;
        double b3 = b[2] - minB;
        double b4 = 3.0 * minB;

        return b1 * b1 * b1 * c3000 + 3.0 * b1 * b1 * b2 * c2100 + 3.0 * b1 * b1 * b3 * c2010
                + 3.0 * b1 * b1 * b4 * c2001 + 3.0 * b1 * b2 * b2 * c1200 + 6.0 * b1 * b2 * b4 * c1101
                + 3.0 * b1 * b3 * b3 * c1020 + 6.0 * b1 * b3 * b4 * c1011 + 3.0 * b1 * b4 * b4 * c1002
                + b2 * b2 * b2 * c0300 + 3.0 * b2 * b2 * b3 * c0210 + 3.0 * b2 * b2 * b4 * c0201
                + 3.0 * b2 * b3 * b3 * c0120 + 6.0 * b2 * b3 * b4 * c0111 + 3.0 * b2 * b4 * b4 * c0102
                + b3 * b3 * b3 * c0030 + 3.0 * b3 * b3 * b4 * c0021 + 3.0 * b3 * b4 * b4 * c0012
                + b4 * b4 * b4 * c0003;
    }
}
