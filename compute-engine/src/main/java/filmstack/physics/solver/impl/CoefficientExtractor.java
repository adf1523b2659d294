package filmstack.physics.solver.impl;

import filmstack.domain.exception.NumericalInstabilityException;
import filmstack.domain.optics.Reflectance;
import filmstack.domain.optics.Transmittance;
import filmstack.domain.optics.TransferMatrix;
import org.apache.commons.math3.complex.Complex;

/**
 * Biblioteca estática que extrae los coeficientes de la matriz de transferencia total M.
 * <ul>
 * <li>r = M[1,0] / M[0,0], R = Re(r·r*)</li>
 * <li>t = 1 / M[0,0], T = Re(det M)·Re(t·t*)</li>
 * </ul>
 * R y T nunca se recortan al intervalo [0, 1].
 */
public final class CoefficientExtractor {

    public static final double DEFAULT_SINGULARITY_THRESHOLD = 1e-12;

    private CoefficientExtractor() {}

    public static Reflectance reflectance(TransferMatrix m) {
        return reflectance(m, DEFAULT_SINGULARITY_THRESHOLD);
    }

    /**
     * @throws NumericalInstabilityException si |M[0,0]| ≤ umbral o el resultado no es finito.
     */
    public static Reflectance reflectance(TransferMatrix m, double singularityThreshold) {
        Complex m00 = requireInvertibleM00(m, singularityThreshold);
        Complex r = m.get(1, 0).divide(m00);
        double power = r.multiply(r.conjugate()).getReal();
        requireFinite(r, power, "reflexión");
        return new Reflectance(power, r);
    }

    public static Transmittance transmittance(TransferMatrix m) {
        return transmittance(m, DEFAULT_SINGULARITY_THRESHOLD);
    }

    /**
     * @throws NumericalInstabilityException si |M[0,0]| ≤ umbral o el resultado no es finito.
     */
    public static Transmittance transmittance(TransferMatrix m, double singularityThreshold) {
        Complex m00 = requireInvertibleM00(m, singularityThreshold);
        Complex t = Complex.ONE.divide(m00);
        double power = m.determinant().getReal() * t.multiply(t.conjugate()).getReal();
        requireFinite(t, power, "transmisión");
        return new Transmittance(power, t);
    }

    private static Complex requireInvertibleM00(TransferMatrix m, double singularityThreshold) {
        Complex m00 = m.get(0, 0);
        if (m00.isNaN() || m00.isInfinite() || m00.abs() <= singularityThreshold) {
            throw new NumericalInstabilityException("Elemento M[0,0] nulo o no finito: " + m00);
        }
        return m00;
    }

    private static void requireFinite(Complex amplitude, double power, String what) {
        if (amplitude.isNaN() || amplitude.isInfinite() || !Double.isFinite(power)) {
            throw new NumericalInstabilityException("Coeficiente de " + what + " no finito: " + amplitude);
        }
    }
}
