package filmstack.domain.exception;

/**
 * Valor fuera del dominio físico: longitud de onda no positiva, espesor negativo
 * o ángulo de incidencia fuera de [0°, 90°).
 */
public class OpticalDomainException extends TmmException {

    public OpticalDomainException(String message) {
        super(message);
    }
}
