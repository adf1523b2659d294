package filmstack.domain.optics;

import org.apache.commons.math3.complex.Complex;

/**
 * Componentes del vector de onda dentro de una capa.
 *
 * @param longitudinal k_x = n·ω/c·cos θ, a lo largo de la normal de la pila (gobierna la fase de propagación).
 * @param transverse   k_z = n·ω/c·sin θ, paralela a las interfaces (se conserva entre capas).
 */
public record Wavenumber(Complex longitudinal, Complex transverse) {
}
