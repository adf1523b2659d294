package filmstack.physics.model;

import filmstack.domain.exception.NumericalInstabilityException;
import filmstack.domain.optics.TransferMatrix;
import org.apache.commons.math3.complex.Complex;

/**
 * Coeficientes de Fresnel de una única interfaz plana entre dos medios.
 * <p>
 * Con las componentes longitudinales del vector de onda k_{1x} y k_{2x}:
 * <ul>
 * <li><b>s:</b> r = (k₁ − k₂)/(k₁ + k₂), t = 2k₁/(k₁ + k₂)</li>
 * <li><b>p:</b> r = (n₁²k₂ − n₂²k₁)/(n₁²k₂ + n₂²k₁), t = 2n₁²k₂/(n₁²k₂ + n₂²k₁)</li>
 * </ul>
 * Sirve como comprobación independiente del ensamblado por matrices dinámicas.
 */
public final class FresnelInterfaceModel {

    private FresnelInterfaceModel() {
    }

    /**
     * Coeficientes de amplitud de una interfaz para ambas polarizaciones.
     */
    public record InterfaceCoefficients(Complex rs, Complex ts, Complex rp, Complex tp) {
    }

    /**
     * @param n1  Índice complejo del medio de incidencia.
     * @param n2  Índice complejo del medio de salida.
     * @param k1x Componente longitudinal del vector de onda en el medio 1.
     * @param k2x Componente longitudinal del vector de onda en el medio 2.
     * @throws NumericalInstabilityException si algún denominador es nulo o no finito.
     */
    public static InterfaceCoefficients coefficients(Complex n1, Complex n2, Complex k1x, Complex k2x) {
        Complex sumS = requireDenominator(k1x.add(k2x), "k1x + k2x");
        Complex rs = k1x.subtract(k2x).divide(sumS);
        Complex ts = k1x.multiply(2.0).divide(sumS);

        Complex a = n1.multiply(n1).multiply(k2x);
        Complex b = n2.multiply(n2).multiply(k1x);
        Complex sumP = requireDenominator(a.add(b), "n1²·k2x + n2²·k1x");
        Complex rp = a.subtract(b).divide(sumP);
        Complex tp = a.multiply(2.0).divide(sumP);

        return new InterfaceCoefficients(rs, ts, rp, tp);
    }

    private static Complex requireDenominator(Complex value, String expression) {
        if (value.isNaN() || value.isInfinite() || value.abs() == 0.0) {
            throw new NumericalInstabilityException("Denominador de Fresnel nulo o no finito (" + expression + " = " + value + ").");
        }
        return value;
    }

    /**
     * Matriz de interfaz (1/t)·[[1, r], [r, 1]].
     *
     * @throws NumericalInstabilityException si t es nulo o no finito.
     */
    public static TransferMatrix interfaceMatrix(Complex r, Complex t) {
        if (t.isNaN() || t.isInfinite() || t.abs() == 0.0) {
            throw new NumericalInstabilityException("Coeficiente de transmisión de interfaz no válido: " + t);
        }
        Complex inv = Complex.ONE.divide(t);
        Complex off = r.multiply(inv);
        return TransferMatrix.of(inv, off, off, inv);
    }
}
