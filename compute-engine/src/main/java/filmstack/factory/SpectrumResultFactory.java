package filmstack.factory;

import filmstack.domain.optics.Polarization;
import filmstack.domain.spectrum.SpectralSample;
import filmstack.domain.spectrum.SpectrumResult;

/**
 * Fábrica centralizada para construir {@link SpectrumResult} a partir de las muestras
 * calculadas por el barrido.
 */
public class SpectrumResultFactory {

    /**
     * Ensambla el espectro en el orden de la rejilla. Cada muestra se coloca por su índice,
     * no por el orden en que terminó su cálculo.
     *
     * @param samples Muestras calculadas; {@code samples[i].index()} debe ser {@code i}.
     */
    public static SpectrumResult fromSamples(SpectralSample[] samples,
                                             Polarization polarization,
                                             double incidenceAngleDegrees,
                                             long executionTimeMs) {
        int n = samples.length;
        double[] wavelengths = new double[n];
        double[] reflectance = new double[n];
        double[] transmittance = new double[n];

        for (int i = 0; i < n; i++) {
            SpectralSample sample = samples[i];
            if (sample == null || sample.index() != i) {
                throw new IllegalStateException("Falta la muestra " + i + " o está fuera de orden.");
            }
            wavelengths[i] = sample.wavelength();
            reflectance[i] = sample.reflectance().power();
            transmittance[i] = sample.transmittance().power();
        }

        return SpectrumResult.builder()
                .wavelengths(wavelengths)
                .reflectance(reflectance)
                .transmittance(transmittance)
                .polarization(polarization)
                .incidenceAngleDegrees(incidenceAngleDegrees)
                .computationTimeMs(executionTimeMs)
                .build();
    }
}
