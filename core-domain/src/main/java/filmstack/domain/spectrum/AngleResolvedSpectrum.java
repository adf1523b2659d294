package filmstack.domain.spectrum;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Barrido en ángulo de incidencia: un {@link SpectrumResult} por ángulo, en el mismo orden
 * que {@link #getAnglesDegrees()}.
 */
public class AngleResolvedSpectrum {

    private final double[] anglesDegrees;
    private final List<SpectrumResult> spectra;

    @JsonCreator
    public AngleResolvedSpectrum(@JsonProperty("anglesDegrees") double[] anglesDegrees,
                                 @JsonProperty("spectra") List<SpectrumResult> spectra) {
        Objects.requireNonNull(anglesDegrees, "anglesDegrees");
        Objects.requireNonNull(spectra, "spectra");
        if (anglesDegrees.length != spectra.size()) {
            throw new IllegalArgumentException("Se esperaban " + anglesDegrees.length + " espectros y hay " + spectra.size() + ".");
        }
        this.anglesDegrees = anglesDegrees.clone();
        this.spectra = List.copyOf(spectra);
    }

    public double[] getAnglesDegrees() {
        return anglesDegrees.clone();
    }

    public List<SpectrumResult> getSpectra() {
        return spectra;
    }

    @JsonIgnore
    public int getAngleCount() {
        return anglesDegrees.length;
    }

    public SpectrumResult getSpectrumAt(int angleIndex) {
        return spectra.get(angleIndex);
    }

    /**
     * Reflectancia en función del ángulo para una muestra espectral fija.
     */
    public double[] reflectanceAtSample(int sampleIndex) {
        double[] out = new double[spectra.size()];
        for (int a = 0; a < out.length; a++) {
            out[a] = spectra.get(a).getReflectanceAt(sampleIndex);
        }
        return out;
    }

    public double[] transmittanceAtSample(int sampleIndex) {
        double[] out = new double[spectra.size()];
        for (int a = 0; a < out.length; a++) {
            out[a] = spectra.get(a).getTransmittanceAt(sampleIndex);
        }
        return out;
    }
}
