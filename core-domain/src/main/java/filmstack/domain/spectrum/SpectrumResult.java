package filmstack.domain.spectrum;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import filmstack.domain.optics.Polarization;
import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * Resultado de un barrido espectral: reflectancia y transmitancia de la pila en cada
 * longitud de onda de la rejilla.
 * <p>
 * Es el objeto que se entrega a los colaboradores externos (trazado, exportación). Se
 * serializa con Jackson; los arrays se copian al entrar y al salir.
 */
public class SpectrumResult {

    private final double[] wavelengths;
    private final double[] reflectance;
    private final double[] transmittance;

    @Getter
    private final Polarization polarization;

    @Getter
    private final double incidenceAngleDegrees;

    /**
     * Tiempo de cómputo del barrido en milisegundos.
     */
    @Getter
    private final long computationTimeMs;

    @Builder
    @JsonCreator
    public SpectrumResult(@JsonProperty("wavelengths") double[] wavelengths,
                          @JsonProperty("reflectance") double[] reflectance,
                          @JsonProperty("transmittance") double[] transmittance,
                          @JsonProperty("polarization") Polarization polarization,
                          @JsonProperty("incidenceAngleDegrees") double incidenceAngleDegrees,
                          @JsonProperty("computationTimeMs") long computationTimeMs) {
        Objects.requireNonNull(wavelengths, "wavelengths");
        Objects.requireNonNull(reflectance, "reflectance");
        Objects.requireNonNull(transmittance, "transmittance");
        if (reflectance.length != wavelengths.length || transmittance.length != wavelengths.length) {
            throw new IllegalArgumentException(String.format(
                    "Resultado inconsistente: %d longitudes de onda, %d reflectancias, %d transmitancias.",
                    wavelengths.length, reflectance.length, transmittance.length));
        }
        this.wavelengths = wavelengths.clone();
        this.reflectance = reflectance.clone();
        this.transmittance = transmittance.clone();
        this.polarization = Objects.requireNonNull(polarization, "polarization");
        this.incidenceAngleDegrees = incidenceAngleDegrees;
        this.computationTimeMs = computationTimeMs;
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    public double[] getReflectance() {
        return reflectance.clone();
    }

    public double[] getTransmittance() {
        return transmittance.clone();
    }

    @JsonIgnore
    public int getSampleCount() {
        return wavelengths.length;
    }

    public double getWavelengthAt(int sampleIndex) {
        return wavelengths[sampleIndex];
    }

    public double getReflectanceAt(int sampleIndex) {
        return reflectance[sampleIndex];
    }

    public double getTransmittanceAt(int sampleIndex) {
        return transmittance[sampleIndex];
    }

    /**
     * Absortancia A = 1 − R − T. No se recorta: un valor negativo delata un problema numérico.
     */
    public double getAbsorptanceAt(int sampleIndex) {
        return 1.0 - reflectance[sampleIndex] - transmittance[sampleIndex];
    }

    @Override
    public String toString() {
        return String.format("SpectrumResult{%d muestras, pol=%s, θ=%.2f°, %d ms}",
                wavelengths.length, polarization, incidenceAngleDegrees, computationTimeMs);
    }
}
