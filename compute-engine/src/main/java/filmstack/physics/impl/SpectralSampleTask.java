package filmstack.physics.impl;

import filmstack.config.PhysicalConstants;
import filmstack.domain.exception.NumericalInstabilityException;
import filmstack.domain.optics.Light;
import filmstack.domain.optics.Polarization;
import filmstack.domain.optics.Reflectance;
import filmstack.domain.optics.TransferMatrix;
import filmstack.domain.optics.Transmittance;
import filmstack.domain.spectrum.SpectralSample;
import filmstack.domain.stack.Stack;
import filmstack.physics.solver.StackAssembler;
import filmstack.physics.solver.impl.CoefficientExtractor;
import filmstack.physics.solver.impl.MultilayerComposer;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Tarea que calcula una única muestra espectral: deriva el estado óptico, ensambla la
 * lista de matrices, la compone y extrae R, T, r y t.
 * <p>
 * No comparte estado mutable con otras tareas, así que puede ejecutarse en un pool de hilos.
 */
@Getter
@RequiredArgsConstructor
public class SpectralSampleTask implements Callable<SpectralSample> {

    private final Stack stack;
    private final int sampleIndex;
    private final StackAssembler assembler;
    private final Polarization polarization;
    private final double incidenceAngleRadians;
    private final PhysicalConstants constants;
    private final double singularityThreshold;

    @Override
    public SpectralSample call() {
        Light light = lightAtSample();
        try {
            TransferMatrix m = transferMatrix(light);
            Reflectance r = CoefficientExtractor.reflectance(m, singularityThreshold);
            Transmittance t = CoefficientExtractor.transmittance(m, singularityThreshold);
            return new SpectralSample(sampleIndex, light.wavelength(), r, t);
        } catch (NumericalInstabilityException e) {
            throw e.atSample(sampleIndex);
        }
    }

    /**
     * Matriz de transferencia total M de la pila en esta muestra.
     */
    public TransferMatrix transferMatrix() {
        return transferMatrix(lightAtSample());
    }

    private TransferMatrix transferMatrix(Light light) {
        return MultilayerComposer.compose(
                assembler.assemble(stack, sampleIndex, light, polarization, incidenceAngleRadians));
    }

    private Light lightAtSample() {
        return Light.of(stack.getAmbient().getWavelengthAt(sampleIndex), constants);
    }
}
