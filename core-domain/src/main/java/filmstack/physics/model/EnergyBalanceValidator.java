package filmstack.physics.model;

import filmstack.domain.exception.NumericalInstabilityException;
import filmstack.domain.spectrum.SpectrumResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Comprueba la conservación de la energía en un espectro ya calculado.
 * <p>
 * Reglas, con tolerancia τ:
 * <ul>
 * <li>Cualquier pila: R ≥ −τ, T ≥ −τ y R + T ≤ 1 + τ.</li>
 * <li>Pila sin pérdidas: además |R + T − 1| ≤ τ.</li>
 * </ul>
 * Los valores nunca se corrigen. En modo estricto la primera violación se lanza como
 * {@link NumericalInstabilityException}; si no, se registran como advertencias.
 */
@Slf4j
public class EnergyBalanceValidator {

    private final double tolerance;
    private final boolean strict;

    public EnergyBalanceValidator(double tolerance, boolean strict) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("La tolerancia de balance energético debe ser finita y no negativa: " + tolerance);
        }
        this.tolerance = tolerance;
        this.strict = strict;
    }

    /**
     * @param result   Espectro a comprobar.
     * @param lossless Si la pila no tiene absorción en ninguna capa.
     * @return Índices de las muestras que violan el balance (vacío si todo es correcto).
     */
    public List<Integer> validate(SpectrumResult result, boolean lossless) {
        List<Integer> violations = new ArrayList<>();
        for (int i = 0; i < result.getSampleCount(); i++) {
            double r = result.getReflectanceAt(i);
            double t = result.getTransmittanceAt(i);
            String problem = check(r, t, lossless);
            if (problem == null) {
                continue;
            }
            if (strict) {
                throw new NumericalInstabilityException(String.format(
                        "Balance energético violado (%s): R=%.12g, T=%.12g", problem, r, t), i);
            }
            log.warn("Balance energético violado en la muestra {} (λ={} m): {} (R={}, T={}).",
                    i, result.getWavelengthAt(i), problem, r, t);
            violations.add(i);
        }

        if (violations.isEmpty()) {
            log.debug("Balance energético correcto en {} muestras.", result.getSampleCount());
        } else {
            log.warn("{} de {} muestras violan el balance energético.", violations.size(), result.getSampleCount());
        }
        return violations;
    }

    private String check(double r, double t, boolean lossless) {
        if (!Double.isFinite(r) || !Double.isFinite(t)) {
            return "valores no finitos";
        }
        if (r < -tolerance || t < -tolerance) {
            return "potencia negativa";
        }
        if (r + t > 1.0 + tolerance) {
            return "R + T > 1";
        }
        if (lossless && Math.abs(r + t - 1.0) > tolerance) {
            return "R + T ≠ 1 en pila sin pérdidas";
        }
        return null;
    }
}
