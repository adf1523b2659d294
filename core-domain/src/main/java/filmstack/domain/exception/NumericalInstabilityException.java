package filmstack.domain.exception;

import java.util.OptionalInt;

/**
 * Fallo numérico durante el cálculo: matriz dinámica singular, elemento M[0,0] nulo,
 * coeficientes no finitos o violación del balance energético en modo estricto.
 * <p>
 * Durante un barrido se adjunta el índice de la muestra espectral que falló,
 * de modo que el llamador sepa exactamente qué longitud de onda abortó el cálculo.
 */
public class NumericalInstabilityException extends TmmException {

    private static final int NO_SAMPLE = -1;

    private final int sampleIndex;

    public NumericalInstabilityException(String message) {
        super(message);
        this.sampleIndex = NO_SAMPLE;
    }

    public NumericalInstabilityException(String message, int sampleIndex) {
        super(message + " (muestra " + sampleIndex + ")");
        this.sampleIndex = sampleIndex;
    }

    private NumericalInstabilityException(String message, int sampleIndex, Throwable cause) {
        super(message, cause);
        this.sampleIndex = sampleIndex;
    }

    /**
     * @return El índice de la muestra que provocó el fallo, si se conoce.
     */
    public OptionalInt getSampleIndex() {
        return sampleIndex == NO_SAMPLE ? OptionalInt.empty() : OptionalInt.of(sampleIndex);
    }

    /**
     * Devuelve esta excepción con el índice de muestra adjunto. Si ya tenía uno, se devuelve tal cual.
     *
     * @param index Índice de la muestra espectral en la que se produjo el fallo.
     * @return Una excepción que informa del índice.
     */
    public NumericalInstabilityException atSample(int index) {
        if (sampleIndex != NO_SAMPLE) {
            return this;
        }
        return new NumericalInstabilityException(getMessage() + " (muestra " + index + ")", index, this);
    }
}
