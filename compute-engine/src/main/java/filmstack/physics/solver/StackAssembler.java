package filmstack.physics.solver;

import filmstack.domain.optics.Light;
import filmstack.domain.optics.Polarization;
import filmstack.domain.optics.TransferMatrix;
import filmstack.domain.stack.Stack;

import java.util.List;

/**
 * Construye, para una muestra espectral, la lista ordenada de matrices cuyo producto
 * es la matriz de transferencia de la pila:
 * {@code [D0⁻¹] + Σ[D, P, D⁻¹] + [D_sustrato]}.
 */
@FunctionalInterface
public interface StackAssembler {
    List<TransferMatrix> assemble(
            Stack stack,
            int sampleIndex,
            Light light,
            Polarization polarization,
            double incidenceAngleRadians
    );
}
