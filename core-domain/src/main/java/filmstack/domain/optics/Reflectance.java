package filmstack.domain.optics;

import org.apache.commons.math3.complex.Complex;

/**
 * Reflexión de la pila en una muestra espectral.
 *
 * @param power     Reflectancia R = |r|², fracción de potencia reflejada.
 * @param amplitude Coeficiente de reflexión complejo r = M[1,0] / M[0,0].
 */
public record Reflectance(double power, Complex amplitude) {
}
