package filmstack.domain.optics;

import filmstack.config.PhysicalConstants;
import filmstack.domain.exception.OpticalDomainException;

/**
 * Estado óptico inmutable de una onda plana en el vacío, derivado de su longitud de onda.
 * <p>
 * Se crea una instancia por muestra espectral; no guarda más estado que el de construcción.
 *
 * @param wavelength          Longitud de onda en el vacío [m].
 * @param angularFrequency    Frecuencia angular ω = 2πc/λ [rad/s].
 * @param frequency           Frecuencia f = c/λ [Hz].
 * @param wavenumber          Número de onda en el vacío k = 2π/λ [rad/m].
 * @param energyJoules        Energía del fotón E = hc/λ [J].
 * @param energyElectronVolts Energía del fotón [eV].
 */
public record Light(
        double wavelength,
        double angularFrequency,
        double frequency,
        double wavenumber,
        double energyJoules,
        double energyElectronVolts
) {

    /**
     * Deriva el estado óptico completo a partir de la longitud de onda.
     *
     * @param wavelength Longitud de onda en el vacío [m] (> 0).
     * @param constants  Tabla de constantes físicas.
     * @return El estado óptico de la onda.
     * @throws OpticalDomainException si la longitud de onda no es positiva y finita.
     */
    public static Light of(double wavelength, PhysicalConstants constants) {
        if (!Double.isFinite(wavelength) || wavelength <= 0.0) {
            throw new OpticalDomainException("La longitud de onda debe ser positiva: " + wavelength + " m.");
        }
        double c = constants.speedOfLight();
        double energy = constants.planckConstant() * c / wavelength;
        return new Light(
                wavelength,
                2.0 * Math.PI * c / wavelength,
                c / wavelength,
                2.0 * Math.PI / wavelength,
                energy,
                energy / constants.elementaryCharge()
        );
    }
}
