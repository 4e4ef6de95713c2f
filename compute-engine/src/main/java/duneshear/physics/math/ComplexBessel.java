package duneshear.physics.math;

import org.apache.commons.math3.complex.Complex;

/**
 * Funciones de Bessel de primera especie J0 y J1 para argumento complejo.
 * <p>
 * Serie de potencias para |z| <= {@value #SERIES_LIMIT}; expansión asintótica de Hankel para
 * módulos mayores, donde la serie pierde precisión por cancelación.
 */
public final class ComplexBessel {

    static final double SERIES_LIMIT = 17.0;
    private static final int MAX_SERIES_TERMS = 300;
    private static final int MAX_ASYMPTOTIC_TERMS = 30;
    private static final double EPS = 1e-17;

    private ComplexBessel() {
    }

    public static Complex j0(Complex z) {
        return besselJ(0, z);
    }

    public static Complex j1(Complex z) {
        return besselJ(1, z);
    }

    /**
     * J_n(z) para orden entero n = 0 o 1.
     */
    static Complex besselJ(int order, Complex z) {
        if (order != 0 && order != 1) {
            throw new IllegalArgumentException("Orden de Bessel no soportado: " + order);
        }
        if (z.isNaN()) {
            return Complex.NaN;
        }
        return z.abs() <= SERIES_LIMIT ? series(order, z) : asymptotic(order, z);
    }

    private static Complex series(int order, Complex z) {
        Complex half = z.multiply(0.5);
        Complex term = order == 0 ? Complex.ONE : half;
        Complex quarterSquare = half.multiply(half).negate();
        Complex sum = term;

        for (int k = 0; k < MAX_SERIES_TERMS; k++) {
            term = term.multiply(quarterSquare).divide((double) (k + 1) * (k + 1 + order));
            sum = sum.add(term);
            if (term.abs() <= EPS * sum.abs()) {
                break;
            }
        }
        return sum;
    }

    private static Complex asymptotic(int order, Complex z) {
        double mu = 4.0 * order * order;
        Complex inverse = z.reciprocal();

        Complex p = Complex.ZERO;
        Complex q = Complex.ZERO;
        Complex power = Complex.ONE;
        double coefficient = 1.0;
        double previousMagnitude = Double.POSITIVE_INFINITY;

        for (int k = 0; k < MAX_ASYMPTOTIC_TERMS; k++) {
            Complex term = power.multiply(coefficient);
            double magnitude = term.abs();
            if (magnitude > previousMagnitude) {
                // Serie asintótica: se corta en el término mínimo
                break;
            }
            previousMagnitude = magnitude;

            if (k % 2 == 0) {
                p = ((k / 2) % 2 == 0) ? p.add(term) : p.subtract(term);
            } else {
                q = (((k - 1) / 2) % 2 == 0) ? q.add(term) : q.subtract(term);
            }
            if (magnitude == 0.0) {
                break;
            }
            double odd = 2.0 * k + 1.0;
            coefficient *= (mu - odd * odd) / ((k + 1) * 8.0);
            power = power.multiply(inverse);
        }

        Complex chi = z.subtract((order / 2.0 + 0.25) * Math.PI);
        Complex amplitude = z.multiply(Math.PI).reciprocal().multiply(2.0).sqrt();
        return amplitude.multiply(p.multiply(chi.cos()).subtract(q.multiply(chi.sin())));
    }
}
