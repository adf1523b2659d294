package filmstack.physics.simulator;

/**
 * Ciclo de vida de un {@link SpectrumSimulator}.
 */
public enum SweepState {
    /** Pila recién asignada, sin validar. */
    UNINITIALIZED,
    /** Pila validada y lista para barrer. */
    READY,
    /** Hay un espectro calculado para la pila actual. */
    COMPUTED
}
