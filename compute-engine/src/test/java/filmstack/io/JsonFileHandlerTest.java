package filmstack.io;

import filmstack.domain.optics.Polarization;
import filmstack.domain.spectrum.AngleResolvedSpectrum;
import filmstack.domain.spectrum.SpectrumResult;
import filmstack.domain.stack.LayerSpec;
import filmstack.domain.stack.Stack;
import filmstack.factory.StackFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas unitarias para {@link JsonFileHandler}: exportación de espectros y lectura de
 * descriptores de capas.
 */
class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    private static SpectrumResult sampleSpectrum(double angle) {
        return SpectrumResult.builder()
                .wavelengths(new double[]{500e-9, 600e-9})
                .reflectance(new double[]{0.04, 0.05})
                .transmittance(new double[]{0.96, 0.95})
                .polarization(Polarization.P)
                .incidenceAngleDegrees(angle)
                .computationTimeMs(3L)
                .build();
    }

    @Test
    @DisplayName("writeToFile: Debería exportar un espectro a JSON indentado, creando los directorios")
    void writeToFile_ShouldCreateIndentedJson() throws IOException {
        // --- 1. Arrange ---
        Path outputFile = tempDir.resolve("resultados").resolve("espectro.json");

        // --- 2. Act ---
        jsonFileHandler.writeToFile(sampleSpectrum(0.0), outputFile);

        // --- 3. Assert ---
        assertThat(outputFile).exists();
        String fileContent = Files.readString(outputFile);
        assertThat(fileContent)
                .contains("\"polarization\" : \"P\"")
                .contains("\"reflectance\" : [ 0.04, 0.05 ]")
                .contains("\"computationTimeMs\" : 3")
                .doesNotContain("sampleCount");
    }

    @Test
    @DisplayName("writeToFile / readFromFile: El espectro se reconstruye con los mismos datos")
    void writeAndRead_SpectrumShouldSurvive() throws IOException {
        Path file = tempDir.resolve("espectro.json");
        SpectrumResult original = sampleSpectrum(15.0);

        jsonFileHandler.writeToFile(original, file);
        SpectrumResult read = jsonFileHandler.readFromFile(file, SpectrumResult.class);

        assertThat(read.getWavelengths()).containsExactly(original.getWavelengths());
        assertThat(read.getReflectance()).containsExactly(original.getReflectance());
        assertThat(read.getTransmittance()).containsExactly(original.getTransmittance());
        assertThat(read.getPolarization()).isEqualTo(Polarization.P);
        assertThat(read.getIncidenceAngleDegrees()).isEqualTo(15.0);
    }

    @Test
    @DisplayName("writeToFile / readFromFile: Un barrido angular conserva un espectro por ángulo")
    void writeAndRead_AngleSweepShouldSurvive() throws IOException {
        Path file = tempDir.resolve("barrido.json");
        AngleResolvedSpectrum sweep = new AngleResolvedSpectrum(
                new double[]{0.0, 30.0}, List.of(sampleSpectrum(0.0), sampleSpectrum(30.0)));

        jsonFileHandler.writeToFile(sweep, file);
        AngleResolvedSpectrum read = jsonFileHandler.readFromFile(file, AngleResolvedSpectrum.class);

        assertThat(read.getAngleCount()).isEqualTo(2);
        assertThat(read.getSpectrumAt(1).getIncidenceAngleDegrees()).isEqualTo(30.0);
        assertThat(read.reflectanceAtSample(1)).containsExactly(0.05, 0.05);
    }

    @Test
    @DisplayName("readListFromFile: Un descriptor de dispositivo produce una pila válida")
    void readListFromFile_ShouldBuildStack() throws IOException {
        String json = """
        [
          { "material": "Aire", "thickness": 0.0, "index": [1.0], "extinction": [0.0] },
          { "material": "Au", "thickness": 2.0e-8,
            "wavelengths": [5.0e-7, 6.0e-7, 7.0e-7],
            "index": [0.97, 0.25, 0.16], "extinction": [1.87, 2.98, 3.95] },
          { "material": "Vidrio", "thickness": 0.0, "index": [1.52], "extinction": [0.0] }
        ]
        """;
        Path inputFile = tempDir.resolve("dispositivo.json");
        Files.writeString(inputFile, json);

        List<LayerSpec> specs = jsonFileHandler.readListFromFile(inputFile, LayerSpec.class);
        Stack stack = new StackFactory().createStack(specs);

        assertThat(specs).hasSize(3);
        assertThat(specs.get(0).isConstant()).isTrue();
        assertThat(stack.getSampleCount()).isEqualTo(3);
        assertThat(stack.getInteriorLayers().get(0).getExtinctionAt(2)).isEqualTo(3.95);
    }

    @Test
    @DisplayName("readListFromFile: Una capa constante con varios índices es un descriptor inválido")
    void readListFromFile_InvalidSpec_ShouldThrowIOException() throws IOException {
        Path inputFile = tempDir.resolve("invalido.json");
        Files.writeString(inputFile, """
        [ { "material": "X", "thickness": 0.0, "index": [1.0, 1.1], "extinction": [0.0, 0.0] } ]
        """);

        assertThrows(IOException.class, () -> jsonFileHandler.readListFromFile(inputFile, LayerSpec.class));
    }

    @Test
    @DisplayName("readFromFile: Debería lanzar IOException si el archivo no existe")
    void readFromFile_WhenFileDoesNotExist_ShouldThrowIOException() {
        Path nonExistentFile = tempDir.resolve("imaginario.json");

        IOException exception = assertThrows(IOException.class,
                () -> jsonFileHandler.readFromFile(nonExistentFile, SpectrumResult.class));

        assertThat(exception.getMessage()).contains("El archivo especificado no existe");
    }

    @Test
    @DisplayName("readFromFile: Debería lanzar IOException con un JSON mal formado")
    void readFromFile_WhenJsonIsMalformed_ShouldThrowIOException() throws IOException {
        Path inputFile = tempDir.resolve("malformado.json");
        Files.writeString(inputFile, """
        {
          "wavelengths": [5.0e-7],
        }
        """);

        assertThrows(IOException.class, () -> jsonFileHandler.readFromFile(inputFile, SpectrumResult.class));
    }
}
