package filmstack.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.type.CollectionType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Lee y escribe en JSON los objetos que intercambia el motor con sus colaboradores externos:
 * listas de {@link filmstack.domain.stack.LayerSpec} de entrada y espectros
 * ({@link filmstack.domain.spectrum.SpectrumResult}, {@link filmstack.domain.spectrum.AngleResolvedSpectrum})
 * de salida para el trazado.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe y costoso de crear: una sola instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @param data     El objeto a serializar.
     * @param filePath Ruta del archivo de destino (ej: "out/espectro_sio2.json").
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, Path filePath) throws IOException {
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), filePath.toAbsolutePath());

        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(filePath.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path filePath, Class<T> objectType) throws IOException {
        log.info("Deserializando {} a {}", filePath.toAbsolutePath(), objectType.getSimpleName());
        requireExists(filePath);

        try {
            return objectMapper.readValue(filePath.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un array JSON a una lista (p. ej. la lista de capas de un dispositivo).
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> List<T> readListFromFile(Path filePath, Class<T> elementType) throws IOException {
        log.info("Deserializando {} a List<{}>", filePath.toAbsolutePath(), elementType.getSimpleName());
        requireExists(filePath);

        CollectionType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return objectMapper.readValue(filePath.toFile(), listType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    private static void requireExists(Path filePath) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("El archivo especificado no existe: " + filePath.toAbsolutePath());
        }
    }
}
