package filmstack.physics.simulator;

import filmstack.config.TmmConfig;
import filmstack.domain.exception.NumericalInstabilityException;
import filmstack.domain.exception.TmmException;
import filmstack.domain.optics.Polarization;
import filmstack.domain.spectrum.SpectralSample;
import filmstack.domain.spectrum.SpectrumResult;
import filmstack.domain.stack.Stack;
import filmstack.factory.SpectrumResultFactory;
import filmstack.physics.impl.SpectralSampleTask;
import filmstack.physics.solver.StackAssembler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Ejecuta el barrido espectral completo de una pila.
 * <p>
 * Las muestras son independientes entre sí. Con {@code cpuProcessorCount <= 1} se calculan
 * en secuencia en el hilo llamador; en otro caso se reparten en un pool fijo y se
 * reordenan por índice. Cualquier fallo aborta el barrido completo: no hay resultados parciales.
 */
@Slf4j
public class SpectrumBatchProcessor implements AutoCloseable {

    private final TmmConfig config;
    private final StackAssembler assembler;
    private final ExecutorService threadPool;

    public SpectrumBatchProcessor(TmmConfig config, StackAssembler assembler) {
        this.config = config;
        this.assembler = assembler;
        int processorCount = config.getCpuProcessorCount();
        this.threadPool = processorCount > 1 ? Executors.newFixedThreadPool(processorCount) : null;
        log.info("SpectrumBatchProcessor inicializado. (Hilos: {})", Math.max(processorCount, 1));
    }

    /**
     * Calcula R y T en todas las muestras de la pila.
     *
     * @param stack                 Pila ya validada.
     * @param polarization          Polarización de la ejecución.
     * @param incidenceAngleDegrees Ángulo de incidencia en el ambiente [grados].
     * @return El espectro completo.
     * @throws NumericalInstabilityException con el índice de la muestra que falló.
     */
    public SpectrumResult process(Stack stack, Polarization polarization, double incidenceAngleDegrees) {
        long startTime = System.currentTimeMillis();
        int sampleCount = stack.getSampleCount();

        List<SpectralSampleTask> tasks = new ArrayList<>(sampleCount);
        for (int i = 0; i < sampleCount; i++) {
            tasks.add(createTask(stack, i, polarization, incidenceAngleDegrees));
        }

        SpectralSample[] samples = threadPool == null
                ? processSequential(tasks)
                : processParallel(tasks);

        long elapsed = System.currentTimeMillis() - startTime;
        log.debug("Barrido de {} muestras completado en {} ms.", sampleCount, elapsed);
        return SpectrumResultFactory.fromSamples(samples, polarization, incidenceAngleDegrees, elapsed);
    }

    /**
     * Crea la tarea de una muestra concreta. La usa también el simulador para los diagnósticos.
     */
    public SpectralSampleTask createTask(Stack stack, int sampleIndex, Polarization polarization, double incidenceAngleDegrees) {
        return new SpectralSampleTask(
                stack,
                sampleIndex,
                assembler,
                polarization,
                Math.toRadians(incidenceAngleDegrees),
                config.getConstants(),
                config.getSingularityThreshold()
        );
    }

    // --- SECUENCIAL ---

    private SpectralSample[] processSequential(List<SpectralSampleTask> tasks) {
        SpectralSample[] samples = new SpectralSample[tasks.size()];
        for (int i = 0; i < tasks.size(); i++) {
            try {
                samples[i] = tasks.get(i).call();
            } catch (RuntimeException e) {
                throw rethrow(e, i);
            }
        }
        return samples;
    }

    // --- PARALELO ---

    private SpectralSample[] processParallel(List<SpectralSampleTask> tasks) {
        CompletionService<SpectralSample> completion = new ExecutorCompletionService<>(threadPool);
        Map<Future<SpectralSample>, Integer> indexByFuture = new HashMap<>();
        for (SpectralSampleTask task : tasks) {
            indexByFuture.put(completion.submit(task), task.getSampleIndex());
        }

        SpectralSample[] samples = new SpectralSample[tasks.size()];
        try {
            for (int received = 0; received < tasks.size(); received++) {
                Future<SpectralSample> done = completion.take();
                int index = indexByFuture.get(done);
                try {
                    samples[index] = done.get();
                } catch (ExecutionException e) {
                    cancelAll(indexByFuture.keySet());
                    throw rethrow(e.getCause(), index);
                }
            }
        } catch (InterruptedException e) {
            cancelAll(indexByFuture.keySet());
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Barrido espectral interrumpido.", e);
        }
        return samples;
    }

    private static void cancelAll(Iterable<Future<SpectralSample>> futures) {
        for (Future<SpectralSample> future : futures) {
            future.cancel(true);
        }
    }

    private static RuntimeException rethrow(Throwable cause, int sampleIndex) {
        if (cause instanceof NumericalInstabilityException) {
            return ((NumericalInstabilityException) cause).atSample(sampleIndex);
        }
        if (cause instanceof TmmException) {
            return (TmmException) cause;
        }
        return new IllegalStateException("Error en el cálculo de la muestra " + sampleIndex + ".", cause);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("SpectrumBatchProcessor cerrado.");
    }
}
