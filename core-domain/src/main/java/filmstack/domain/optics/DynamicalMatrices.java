package filmstack.domain.optics;

/**
 * Par de matrices dinámicas de una capa, una por polarización.
 *
 * @param sWave Forma para polarización s: [[1, 1], [n·cos θ, −n·cos θ]].
 * @param pWave Forma para polarización p: [[cos θ, cos θ], [n, −n]].
 */
public record DynamicalMatrices(TransferMatrix sWave, TransferMatrix pWave) {

    public TransferMatrix forPolarization(Polarization polarization) {
        return polarization == Polarization.P ? pWave : sWave;
    }
}
