package duneshear.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import duneshear.config.ShearConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lee y escribe la {@link ShearConfig} en JSON.
 * <p>
 * Las propiedades ausentes del fichero toman su valor por defecto (el builder de la
 * configuración respalda la deserialización). La configuración leída se valida antes
 * de devolverse.
 */
@Slf4j
public class ShearConfigReader {

    // Costoso de crear y thread-safe: una instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * @param path Fichero JSON de configuración.
     * @return La configuración validada.
     * @throws IOException si el fichero no existe o no se puede parsear.
     * @throws duneshear.config.ShearConfigurationException si los valores son inválidos.
     */
    public ShearConfig read(Path path) throws IOException {
        log.info("Leyendo configuración de cortante desde {}", path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo de configuración no existe: " + path.toAbsolutePath());
        }

        ShearConfig config;
        try {
            config = objectMapper.readValue(path.toFile(), ShearConfig.class);
        } catch (IOException e) {
            log.error("Error al leer o parsear la configuración desde {}", path.toAbsolutePath(), e);
            throw e;
        }
        config.validate();
        log.debug("Configuración cargada: {}", config);
        return config;
    }

    public ShearConfig readFromString(String json) throws IOException {
        ShearConfig config = objectMapper.readValue(json, ShearConfig.class);
        config.validate();
        return config;
    }

    /**
     * Escribe la configuración (sobrescribe el fichero si existe).
     */
    public void write(ShearConfig config, Path path) throws IOException {
        log.info("Escribiendo configuración de cortante en {}", path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), config);
        } catch (IOException e) {
            log.error("Error al escribir la configuración en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
