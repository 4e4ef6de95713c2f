package duneshear.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Contenedor principal de la configuración del cálculo de perturbación del cortante.
 * Agrupa la resolución de la rejilla computacional, la especificación del buffer,
 * los parámetros físicos del modelo espectral y el método de interpolación.
 * <p>
 * Los valores por defecto reproducen el modelo de referencia:
 * dx = dy = 1, ancho de buffer 100, relajación = ancho / 4, L = 100, z0 = 0.001, l = 10.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class ShearConfig {

    /**
     * Resolución en X de la rejilla computacional [m].
     */
    @Builder.Default
    double dx = 1.0;

    /**
     * Resolución en Y de la rejilla computacional [m].
     */
    @Builder.Default
    double dy = 1.0;

    /**
     * Especificación del buffer entre el borde de la rejilla de entrada y el de la computacional.
     */
    @Builder.Default
    BufferConfig buffer = BufferConfig.builder().build();

    /**
     * Parámetros físicos de la solución linealizada de capa límite.
     */
    @Builder.Default
    SpectralConfig spectral = SpectralConfig.builder().build();

    /**
     * Método de interpolación en ambos sentidos (entrada → computacional y vuelta).
     */
    @Builder.Default
    InterpolationMethod interpolationMethod = InterpolationMethod.CUBIC;

    /**
     * Densidad del aire [kg/m³], solo para el esfuerzo total.
     */
    @Builder.Default
    double airDensity = 1.25;

    /**
     * Coeficiente de arrastre adimensional, solo para el esfuerzo total.
     */
    @Builder.Default
    double dragCoefficient = 0.001;

    public static ShearConfig defaults() {
        return ShearConfig.builder().build();
    }

    /**
     * Valida la coherencia física de la configuración.
     *
     * @throws ShearConfigurationException si algún parámetro es inválido.
     */
    public void validate() {
        if (!(dx > 0) || !(dy > 0) || !Double.isFinite(dx) || !Double.isFinite(dy)) {
            throw new ShearConfigurationException(String.format(
                    "La resolución de la rejilla computacional debe ser positiva y finita (dx=%s, dy=%s).", dx, dy));
        }
        if (buffer == null || spectral == null || interpolationMethod == null) {
            throw new ShearConfigurationException("Las secciones buffer, spectral e interpolationMethod son obligatorias.");
        }
        buffer.validate();
        spectral.validate();
        if (!(airDensity > 0) || !(dragCoefficient > 0)) {
            throw new ShearConfigurationException(String.format(
                    "La densidad del aire y el coeficiente de arrastre deben ser positivos (rho=%s, Cd=%s).",
                    airDensity, dragCoefficient));
        }
    }

    /**
     * Define el buffer de extrapolación de la topografía.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class BufferConfig {

        /**
         * Distancia [m] más allá del borde de la rejilla de entrada en la que la topografía
         * sintética cae a la mitad (centro de la sigmoide).
         */
        @Builder.Default
        double width = 100.0;

        /**
         * Longitud de decaimiento [m] de la sigmoide. Nulo = {@code width / 4}.
         */
        Double relaxation;

        /**
         * Relajación efectiva: la explícita o, si no se ha dado, {@code width / 4}.
         */
        @JsonIgnore
        public double getEffectiveRelaxation() {
            return relaxation != null ? relaxation : width / 4.0;
        }

        void validate() {
            if (!(width >= 0) || !Double.isFinite(width)) {
                throw new ShearConfigurationException("El ancho del buffer debe ser finito y no negativo: " + width);
            }
            double r = getEffectiveRelaxation();
            if (!(r > 0) || !Double.isFinite(r)) {
                throw new ShearConfigurationException(String.format(
                        "La relajación del buffer debe ser positiva (relajación=%s, ancho=%s). "
                                + "Con ancho 0 hay que indicar la relajación explícitamente.", r, width));
            }
        }
    }

    /**
     * Parámetros de la solución analítica en el espacio de números de onda.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class SpectralConfig {

        /**
         * Escala característica L [m] de las formas topográficas.
         */
        @Builder.Default
        double characteristicLength = 100.0;

        /**
         * Rugosidad aerodinámica z0 [m].
         */
        @Builder.Default
        double roughnessLength = 0.001;

        /**
         * Altura l [m] de la capa interna.
         */
        @Builder.Default
        double innerLayerHeight = 10.0;

        void validate() {
            if (!(characteristicLength > 0) || !(roughnessLength > 0) || !(innerLayerHeight > 0)) {
                throw new ShearConfigurationException(String.format(
                        "L, z0 y l deben ser positivos (L=%s, z0=%s, l=%s).",
                        characteristicLength, roughnessLength, innerLayerHeight));
            }
        }
    }
}
