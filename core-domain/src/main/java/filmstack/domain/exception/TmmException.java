package filmstack.domain.exception;

/**
 * Raíz de la jerarquía de errores del motor de matrices de transferencia.
 * <p>
 * Todas las excepciones del dominio son no comprobadas: un error de configuración,
 * de dominio físico o numérico aborta la operación en curso y debe llegar intacto
 * al llamador.
 */
public abstract class TmmException extends RuntimeException {

    protected TmmException(String message) {
        super(message);
    }

    protected TmmException(String message, Throwable cause) {
        super(message, cause);
    }
}
