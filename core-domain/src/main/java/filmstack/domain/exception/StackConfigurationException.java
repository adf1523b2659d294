package filmstack.domain.exception;

/**
 * Error de configuración de la pila: número de muestras distinto entre capas,
 * datos por capa ausentes, polarización desconocida o estructura inválida.
 * <p>
 * Se detecta siempre antes de iniciar un barrido espectral.
 */
public class StackConfigurationException extends TmmException {

    public StackConfigurationException(String message) {
        super(message);
    }
}
