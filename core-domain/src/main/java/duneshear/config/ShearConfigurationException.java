package duneshear.config;

/**
 * Configuración o rejilla de entrada inválida para el cálculo de cortante.
 * <p>
 * Se lanza en construcción (o al invocar con argumentos no físicos), nunca a mitad de un cálculo.
 */
public class ShearConfigurationException extends IllegalArgumentException {

    public ShearConfigurationException(String message) {
        super(message);
    }
}
