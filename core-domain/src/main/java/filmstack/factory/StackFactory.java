package filmstack.factory;

import filmstack.domain.exception.StackConfigurationException;
import filmstack.domain.stack.Layer;
import filmstack.domain.stack.LayerSpec;
import filmstack.domain.stack.Stack;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Fábrica responsable de construir instancias de {@link Stack} a partir de las
 * especificaciones de capa entregadas por los colaboradores externos.
 * <p>
 * La rejilla de longitudes de onda la define la primera capa tabulada (o se pasa
 * explícitamente). Las capas constantes se extienden sobre esa rejilla, de forma que
 * todas las capas de la pila resultante comparten la misma rejilla. Una capa tabulada en
 * otras longitudes de onda es un error de configuración: no hay interpolación.
 */
@Slf4j
public class StackFactory {

    /**
     * Construye una pila tomando la rejilla espectral de la primera capa tabulada.
     *
     * @param specs Especificaciones ordenadas desde el ambiente hasta el sustrato.
     * @return Una pila con muestreo consistente.
     * @throws StackConfigurationException si no hay ninguna capa tabulada o alguna capa
     *                                     tabulada no está muestreada en la rejilla de referencia.
     */
    public Stack createStack(List<LayerSpec> specs) {
        requireSpecs(specs);
        LayerSpec reference = specs.stream()
                .filter(spec -> !spec.isConstant())
                .findFirst()
                .orElseThrow(() -> new StackConfigurationException(
                        "Ninguna capa aporta datos tabulados; indique la rejilla de longitudes de onda explícitamente."));
        return buildStack(specs, reference.wavelengths(), reference.material());
    }

    /**
     * Construye una pila sobre una rejilla de longitudes de onda explícita.
     *
     * @param specs       Especificaciones ordenadas desde el ambiente hasta el sustrato.
     * @param wavelengths Rejilla espectral [m].
     * @return Una pila con muestreo consistente.
     */
    public Stack createStack(List<LayerSpec> specs, double[] wavelengths) {
        requireSpecs(specs);
        if (wavelengths == null || wavelengths.length == 0) {
            throw new StackConfigurationException("La rejilla de longitudes de onda no puede estar vacía.");
        }
        return buildStack(specs, wavelengths, "rejilla explícita");
    }

    private Stack buildStack(List<LayerSpec> specs, double[] grid, String gridSource) {
        List<Layer> layers = new ArrayList<>(specs.size());
        for (LayerSpec spec : specs) {
            if (spec.isConstant()) {
                layers.add(Layer.nonDispersive(spec.material(), spec.thickness(),
                        spec.index()[0], spec.extinction()[0], grid));
                continue;
            }
            if (spec.wavelengths().length != grid.length) {
                throw new StackConfigurationException(String.format(
                        "Las muestras no coinciden: '%s' tiene %d longitudes de onda y '%s' tiene %d.",
                        spec.material(), spec.wavelengths().length, gridSource, grid.length));
            }
            requireSameGrid(spec, grid, gridSource);
            layers.add(Layer.fromTabulatedData(spec.material(), spec.thickness(),
                    spec.wavelengths(), spec.index(), spec.extinction()));
        }

        Stack stack = new Stack(layers);
        log.info("Pila creada: {} capas ({} interiores), {} muestras espectrales.",
                stack.getLayerCount(), stack.getInteriorLayers().size(), stack.getSampleCount());
        return stack;
    }

    private static void requireSameGrid(LayerSpec spec, double[] grid, String gridSource) {
        int mismatch = Stack.firstGridMismatch(grid, spec.wavelengths());
        if (mismatch >= 0) {
            throw new StackConfigurationException(String.format(
                    "La capa '%s' no tiene datos en la rejilla de '%s' (primera diferencia en la muestra %d: %s m frente a %s m).",
                    spec.material(), gridSource, mismatch, spec.wavelengths()[mismatch], grid[mismatch]));
        }
    }

    private static void requireSpecs(List<LayerSpec> specs) {
        if (specs == null || specs.size() < 2) {
            throw new StackConfigurationException("Se necesitan al menos dos especificaciones de capa (ambiente y sustrato).");
        }
    }
}
