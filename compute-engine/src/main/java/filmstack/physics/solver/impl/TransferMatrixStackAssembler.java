package filmstack.physics.solver.impl;

import filmstack.config.PhysicalConstants;
import filmstack.domain.exception.NumericalInstabilityException;
import filmstack.domain.optics.Light;
import filmstack.domain.optics.Polarization;
import filmstack.domain.optics.TransferMatrix;
import filmstack.domain.stack.Layer;
import filmstack.domain.stack.Stack;
import filmstack.physics.solver.StackAssembler;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.List;

/**
 * Ensamblador estándar del método de matrices de transferencia.
 * <p>
 * El ángulo de cada capa se obtiene por la ley de Snell con coseno complejo:
 * cos θⱼ = √(1 − (n₀·sin θ₀ / nⱼ)²), eligiendo la rama con Im(nⱼ·cos θⱼ) ≥ 0
 * (onda progresiva que se atenúa). En incidencia normal cos θⱼ = 1 en todas las capas.
 * <p>
 * Stateless y Thread-Safe: puede compartirse entre todas las tareas de un barrido.
 */
public class TransferMatrixStackAssembler implements StackAssembler {

    private final PhysicalConstants constants;
    private final double singularityThreshold;

    public TransferMatrixStackAssembler(PhysicalConstants constants, double singularityThreshold) {
        this.constants = constants;
        this.singularityThreshold = singularityThreshold;
    }

    @Override
    public List<TransferMatrix> assemble(Stack stack, int sampleIndex, Light light,
                                         Polarization polarization, double incidenceAngleRadians) {
        List<Layer> layers = stack.getLayers();
        List<TransferMatrix> matrices = new ArrayList<>(3 * layers.size() - 4);
        double omega = light.angularFrequency();

        try {
            // 1. Ambiente: solo la inversa de su matriz dinámica
            Layer ambient = stack.getAmbient();
            Complex n0 = ambient.complexIndexAt(sampleIndex);
            Complex snellInvariant = n0.multiply(Math.sin(incidenceAngleRadians));
            TransferMatrix d0 = ambient.dynamicalMatrix(n0, cosine(n0, snellInvariant)).forPolarization(polarization);
            matrices.add(d0.inverse(singularityThreshold));

            // 2. Capas interiores: D · P · D⁻¹
            for (Layer layer : stack.getInteriorLayers()) {
                Complex n = layer.complexIndexAt(sampleIndex);
                Complex cosTheta = cosine(n, snellInvariant);
                TransferMatrix d = layer.dynamicalMatrix(n, cosTheta).forPolarization(polarization);
                Complex kx = layer.wavenumber(n, omega, cosTheta, constants).longitudinal();
                matrices.add(d);
                matrices.add(layer.propagationMatrix(kx));
                matrices.add(d.inverse(singularityThreshold));
            }

            // 3. Sustrato: solo su matriz dinámica
            Layer substrate = stack.getSubstrate();
            Complex ns = substrate.complexIndexAt(sampleIndex);
            matrices.add(substrate.dynamicalMatrix(ns, cosine(ns, snellInvariant)).forPolarization(polarization));
        } catch (NumericalInstabilityException e) {
            throw e.atSample(sampleIndex);
        }
        return matrices;
    }

    /**
     * Coseno complejo del ángulo de propagación en un medio de índice n.
     */
    static Complex cosine(Complex n, Complex snellInvariant) {
        if (snellInvariant.abs() == 0.0) {
            return Complex.ONE;
        }
        Complex sine = snellInvariant.divide(n);
        Complex cos = Complex.ONE.subtract(sine.multiply(sine)).sqrt();
        if (n.multiply(cos).getImaginary() < 0.0) {
            cos = cos.negate();
        }
        return cos;
    }
}
