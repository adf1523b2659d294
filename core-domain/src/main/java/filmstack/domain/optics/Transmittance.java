package filmstack.domain.optics;

import org.apache.commons.math3.complex.Complex;

/**
 * Transmisión de la pila en una muestra espectral.
 *
 * @param power     Transmitancia T = Re(det M)·|t|², fracción de potencia transmitida.
 * @param amplitude Coeficiente de transmisión complejo t = 1 / M[0,0].
 */
public record Transmittance(double power, Complex amplitude) {
}
