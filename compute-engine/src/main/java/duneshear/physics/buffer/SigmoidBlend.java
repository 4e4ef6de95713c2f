package duneshear.physics.buffer;

import lombok.Getter;

/**
 * Atenuación logística de la topografía sintética del buffer:
 * {@code 1 / (1 + exp(-(ancho - d) / relajación))}.
 * Vale 0.5 a distancia {@code ancho} del contorno y tiende a 0 lejos de él.
 */
@Getter
public final class SigmoidBlend {

    private final double width;
    private final double relaxation;

    public SigmoidBlend(double width, double relaxation) {
        if (!(relaxation > 0)) {
            throw new IllegalArgumentException("La relajación de la sigmoide debe ser positiva: " + relaxation);
        }
        this.width = width;
        this.relaxation = relaxation;
    }

    public double factor(double distance) {
        return 1.0 / (1.0 + Math.exp(-(width - distance) / relaxation));
    }
}
