package filmstack.physics.simulator;

import filmstack.config.TmmConfig;
import filmstack.domain.exception.StackConfigurationException;
import filmstack.domain.optics.Polarization;
import filmstack.domain.optics.TransferMatrix;
import filmstack.domain.spectrum.AngleResolvedSpectrum;
import filmstack.domain.spectrum.SpectralSample;
import filmstack.domain.spectrum.SpectrumResult;
import filmstack.domain.stack.Layer;
import filmstack.domain.stack.Stack;
import filmstack.physics.model.EnergyBalanceValidator;
import filmstack.physics.solver.StackAssembler;
import filmstack.physics.solver.impl.TransferMatrixStackAssembler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Orquesta el cálculo del espectro de reflectancia y transmitancia de una pila.
 * <p>
 * Facade de alto nivel: valida la pila, delega el barrido al {@link SpectrumBatchProcessor}
 * y comprueba el balance energético del resultado con {@link EnergyBalanceValidator}.
 * <p>
 * Ciclo de vida: {@code UNINITIALIZED → READY → COMPUTED}. Cambiar la pila con
 * {@link #updateStack(Stack)} devuelve el simulador a {@code UNINITIALIZED} y descarta el
 * último resultado. Las transiciones están sincronizadas: la pila no puede sustituirse
 * mientras hay un barrido en curso.
 */
@Slf4j
public class SpectrumSimulator implements AutoCloseable {

    @Getter
    private final TmmConfig config;
    private final SpectrumBatchProcessor batchProcessor;
    private final EnergyBalanceValidator energyBalanceValidator;

    private Stack stack;
    private SweepState state = SweepState.UNINITIALIZED;
    private SpectrumResult lastResult;

    public SpectrumSimulator(Stack stack, TmmConfig config) {
        this(stack, config, new TransferMatrixStackAssembler(config.getConstants(), config.getSingularityThreshold()));
    }

    public SpectrumSimulator(Stack stack, TmmConfig config, StackAssembler assembler) {
        this.stack = Objects.requireNonNull(stack, "La pila no puede ser nula.");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.batchProcessor = new SpectrumBatchProcessor(config, assembler);
        this.energyBalanceValidator = new EnergyBalanceValidator(
                config.getEnergyBalanceTolerance(), config.isStrictEnergyBalance());

        log.info("SpectrumSimulator listo. (Capas: {}, Polarización: {}, θ: {}°)",
                stack.getLayerCount(), config.getPolarization(), config.getIncidenceAngleDegrees());
    }

    /**
     * Punto de entrada directo: valida la pila y calcula su espectro con la configuración
     * por defecto y la polarización indicada.
     *
     * @param stack        Pila a calcular.
     * @param polarization Polarización de la onda incidente.
     * @return El espectro de la pila.
     */
    public static SpectrumResult computeSpectrum(Stack stack, Polarization polarization) {
        TmmConfig config = TmmConfig.builder().polarization(polarization).build();
        try (SpectrumSimulator simulator = new SpectrumSimulator(stack, config)) {
            return simulator.computeSpectrum();
        }
    }

    /**
     * Comprueba que la pila y la configuración permiten un barrido.
     *
     * @throws StackConfigurationException si el muestreo es inconsistente, falta la polarización
     *                                     o se pide incidencia oblicua desde un ambiente absorbente.
     * @throws filmstack.domain.exception.OpticalDomainException si una capa interior tiene
     *                                     espesor nulo no permitido o el ángulo no es válido.
     */
    public synchronized void validate() {
        if (config.getPolarization() == null) {
            throw new StackConfigurationException("La polarización debe ser s o p.");
        }
        stack.requireConsistentSampling();
        stack.requirePositiveInteriorThickness(config.isAllowZeroThicknessLayers());
        warnOnZeroThicknessLayers();

        config.validateIncidenceAngle();
        boolean oblique = config.getIncidenceAngleDegrees() > 0.0;
        if (config.getAngleSweep() != null) {
            for (double angle : config.getAngleSweep().anglesDegrees()) {
                oblique |= angle > 0.0;
            }
        }
        if (oblique && !stack.getAmbient().isLossless()) {
            throw new StackConfigurationException("La incidencia oblicua requiere un ambiente sin absorción; '"
                    + stack.getAmbient().getMaterial() + "' tiene extinción no nula.");
        }

        state = SweepState.READY;
        log.info("Pila validada: {} muestras espectrales, {} capas interiores.",
                stack.getSampleCount(), stack.getInteriorLayers().size());
    }

    /**
     * Calcula el espectro completo al ángulo de incidencia configurado.
     * Si la pila aún no se ha validado, se valida primero. Puede repetirse: cada llamada
     * recalcula y sustituye el último resultado.
     */
    public synchronized SpectrumResult computeSpectrum() {
        ensureValidated();
        log.info("Iniciando barrido espectral ({} muestras)...", stack.getSampleCount());

        SpectrumResult result = runSweep(config.getIncidenceAngleDegrees());

        lastResult = result;
        state = SweepState.COMPUTED;
        log.info("Barrido finalizado. Tiempo de cómputo: {}ms", result.getComputationTimeMs());
        return result;
    }

    /**
     * Calcula un espectro por cada ángulo del {@link TmmConfig.AngleSweep} configurado.
     *
     * @throws IllegalStateException si la configuración no define un barrido angular.
     */
    public synchronized AngleResolvedSpectrum computeAngleSweep() {
        TmmConfig.AngleSweep sweep = config.getAngleSweep();
        if (sweep == null) {
            throw new IllegalStateException("La configuración no define un barrido angular.");
        }
        ensureValidated();

        double[] angles = sweep.anglesDegrees();
        log.info("Iniciando barrido angular: {} ángulos de {}° a {}°.", angles.length, sweep.getStartDegrees(), sweep.getEndDegrees());
        List<SpectrumResult> spectra = new ArrayList<>(angles.length);
        for (double angle : angles) {
            spectra.add(runSweep(angle));
        }
        return new AngleResolvedSpectrum(angles, spectra);
    }

    /**
     * Diagnóstico: matriz de transferencia total de la pila en la muestra indicada.
     */
    public synchronized TransferMatrix transferMatrixAt(int sampleIndex) {
        ensureValidated();
        return batchProcessor.createTask(stack, requireSampleIndex(sampleIndex),
                config.getPolarization(), config.getIncidenceAngleDegrees()).transferMatrix();
    }

    /**
     * Diagnóstico: muestra completa, con las amplitudes complejas r y t.
     */
    public synchronized SpectralSample sampleAt(int sampleIndex) {
        ensureValidated();
        return batchProcessor.createTask(stack, requireSampleIndex(sampleIndex),
                config.getPolarization(), config.getIncidenceAngleDegrees()).call();
    }

    /**
     * Sustituye la pila. El simulador vuelve a {@code UNINITIALIZED} y se descarta el último resultado.
     */
    public synchronized void updateStack(Stack newStack) {
        this.stack = Objects.requireNonNull(newStack, "La pila no puede ser nula.");
        this.lastResult = null;
        this.state = SweepState.UNINITIALIZED;
        log.debug("Pila sustituida; el simulador debe validarse de nuevo.");
    }

    public synchronized Stack getStack() {
        return stack;
    }

    public synchronized SweepState getState() {
        return state;
    }

    /**
     * @return El último espectro calculado.
     * @throws IllegalStateException si no hay ningún espectro calculado para la pila actual.
     */
    public synchronized SpectrumResult getLastResult() {
        if (state != SweepState.COMPUTED) {
            throw new IllegalStateException("No hay espectro calculado para la pila actual (estado " + state + ").");
        }
        return lastResult;
    }

    private SpectrumResult runSweep(double incidenceAngleDegrees) {
        SpectrumResult result = batchProcessor.process(stack, config.getPolarization(), incidenceAngleDegrees);
        energyBalanceValidator.validate(result, stack.isLossless());
        return result;
    }

    private void ensureValidated() {
        if (state == SweepState.UNINITIALIZED) {
            validate();
        }
    }

    private int requireSampleIndex(int sampleIndex) {
        if (sampleIndex < 0 || sampleIndex >= stack.getSampleCount()) {
            throw new IndexOutOfBoundsException("El índice de muestra " + sampleIndex
                    + " está fuera de los límites [0, " + (stack.getSampleCount() - 1) + "].");
        }
        return sampleIndex;
    }

    private void warnOnZeroThicknessLayers() {
        List<Layer> interior = stack.getInteriorLayers();
        for (int i = 0; i < interior.size(); i++) {
            if (interior.get(i).getThickness() == 0.0) {
                log.warn("La capa interior {} ('{}') tiene espesor nulo y no tiene efecto óptico.",
                        i + 1, interior.get(i).getMaterial());
            }
        }
    }

    @Override
    public void close() {
        batchProcessor.close();
        log.info("SpectrumSimulator cerrado y recursos liberados.");
    }
}
