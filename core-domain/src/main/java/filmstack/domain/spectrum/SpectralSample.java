package filmstack.domain.spectrum;

import filmstack.domain.optics.Reflectance;
import filmstack.domain.optics.Transmittance;

/**
 * Resultado completo de una única muestra espectral, con las amplitudes complejas r y t.
 * Se usa para diagnóstico; el barrido solo conserva las potencias.
 *
 * @param index         Índice de la muestra en la rejilla.
 * @param wavelength    Longitud de onda en el vacío [m].
 * @param reflectance   Reflectancia (R, r).
 * @param transmittance Transmitancia (T, t).
 */
public record SpectralSample(int index, double wavelength, Reflectance reflectance, Transmittance transmittance) {

    public double absorptance() {
        return 1.0 - reflectance.power() - transmittance.power();
    }
}
