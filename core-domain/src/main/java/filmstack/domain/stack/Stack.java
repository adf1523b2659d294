package filmstack.domain.stack;

import filmstack.domain.exception.OpticalDomainException;
import filmstack.domain.exception.StackConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pila multicapa plana e inmutable: ambiente → capas interiores → sustrato.
 * <p>
 * El primer y el último elemento son semi-infinitos (espesor 0). La pila garantiza su
 * estructura en la construcción; que todas las capas cubran la misma rejilla espectral se
 * comprueba con {@link #requireConsistentSampling()} antes de cada barrido.
 */
public final class Stack {

    private final List<Layer> layers;

    /**
     * @param layers Capas ordenadas desde el ambiente hasta el sustrato (al menos dos).
     * @throws StackConfigurationException si hay menos de dos capas, alguna es nula, o el
     *                                     ambiente o el sustrato tienen espesor no nulo.
     */
    public Stack(List<Layer> layers) {
        if (layers == null || layers.size() < 2) {
            throw new StackConfigurationException("Una pila necesita al menos ambiente y sustrato.");
        }
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i) == null) {
                throw new StackConfigurationException("La capa " + i + " de la pila es nula.");
            }
        }
        Layer ambient = layers.get(0);
        Layer substrate = layers.get(layers.size() - 1);
        if (ambient.getThickness() != 0.0) {
            throw new StackConfigurationException("El ambiente '" + ambient.getMaterial() + "' es semi-infinito y debe tener espesor 0.");
        }
        if (substrate.getThickness() != 0.0) {
            throw new StackConfigurationException("El sustrato '" + substrate.getMaterial() + "' es semi-infinito y debe tener espesor 0.");
        }
        this.layers = List.copyOf(layers);
    }

    public static Stack of(Layer... layers) {
        return new Stack(List.of(layers));
    }

    public Layer getAmbient() {
        return layers.get(0);
    }

    public Layer getSubstrate() {
        return layers.get(layers.size() - 1);
    }

    /**
     * @return Las capas entre ambiente y sustrato, en orden de propagación.
     */
    public List<Layer> getInteriorLayers() {
        return layers.subList(1, layers.size() - 1);
    }

    public List<Layer> getLayers() {
        return layers;
    }

    public int getLayerCount() {
        return layers.size();
    }

    /**
     * @return Número de muestras espectrales, tomado del ambiente.
     */
    public int getSampleCount() {
        return getAmbient().getSampleCount();
    }

    public double[] getWavelengths() {
        return getAmbient().getWavelengths();
    }

    /**
     * @return {@code true} si ninguna capa absorbe en ninguna muestra.
     */
    public boolean isLossless() {
        return layers.stream().allMatch(Layer::isLossless);
    }

    /**
     * Tolerancia relativa al comparar las longitudes de onda de dos capas.
     */
    public static final double WAVELENGTH_RELATIVE_TOLERANCE = 1e-9;

    /**
     * Comprueba que todas las capas están muestreadas en la rejilla del ambiente: mismo número
     * de muestras y mismas longitudes de onda, dentro de {@link #WAVELENGTH_RELATIVE_TOLERANCE}.
     *
     * @throws StackConfigurationException si alguna capa difiere del ambiente.
     */
    public void requireConsistentSampling() {
        int expected = getSampleCount();
        double[] grid = getWavelengths();
        for (Layer layer : layers) {
            if (layer.getSampleCount() != expected) {
                throw new StackConfigurationException(String.format(
                        "La capa '%s' tiene %d muestras, pero el ambiente '%s' tiene %d.",
                        layer.getMaterial(), layer.getSampleCount(), getAmbient().getMaterial(), expected));
            }
            int mismatch = firstGridMismatch(grid, layer.getWavelengths());
            if (mismatch >= 0) {
                throw new StackConfigurationException(String.format(
                        "La capa '%s' no tiene datos en la rejilla del ambiente '%s': muestra %d a %s m frente a %s m.",
                        layer.getMaterial(), getAmbient().getMaterial(), mismatch,
                        layer.getWavelengthAt(mismatch), grid[mismatch]));
            }
        }
    }

    /**
     * @return El índice de la primera longitud de onda que difiere entre ambas rejillas,
     * o {@code -1} si coinciden dentro de la tolerancia. Las rejillas deben tener la misma longitud.
     */
    public static int firstGridMismatch(double[] grid, double[] other) {
        for (int i = 0; i < grid.length; i++) {
            double scale = Math.max(Math.abs(grid[i]), Math.abs(other[i]));
            if (Math.abs(grid[i] - other[i]) > WAVELENGTH_RELATIVE_TOLERANCE * scale) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Comprueba que las capas interiores tienen espesor positivo.
     *
     * @param allowZeroThickness Si es {@code true}, se aceptan capas interiores de espesor nulo.
     * @throws OpticalDomainException si una capa interior tiene espesor no positivo no permitido.
     */
    public void requirePositiveInteriorThickness(boolean allowZeroThickness) {
        List<Layer> interior = getInteriorLayers();
        for (int i = 0; i < interior.size(); i++) {
            Layer layer = interior.get(i);
            if (layer.getThickness() == 0.0 && !allowZeroThickness) {
                throw new OpticalDomainException(String.format(
                        "La capa interior %d ('%s') debe tener espesor positivo.", i + 1, layer.getMaterial()));
            }
        }
    }

    /**
     * @return Una nueva pila con las capas en orden inverso (el sustrato pasa a ser el ambiente).
     */
    public Stack reversed() {
        List<Layer> copy = new ArrayList<>(layers);
        Collections.reverse(copy);
        return new Stack(copy);
    }

    /**
     * @return Una nueva pila sin la capa de la posición indicada (solo capas interiores).
     */
    public Stack withoutLayer(int position) {
        if (position <= 0 || position >= layers.size() - 1) {
            throw new IllegalArgumentException("Solo pueden eliminarse capas interiores: posición " + position + ".");
        }
        List<Layer> copy = new ArrayList<>(layers);
        copy.remove(position);
        return new Stack(copy);
    }

    /**
     * @return Una nueva pila con la capa de la posición indicada sustituida.
     */
    public Stack withLayer(int position, Layer layer) {
        if (position < 0 || position >= layers.size()) {
            throw new IndexOutOfBoundsException("Posición de capa " + position + " fuera de los límites [0, " + (layers.size() - 1) + "].");
        }
        List<Layer> copy = new ArrayList<>(layers);
        copy.set(position, layer);
        return new Stack(copy);
    }

    @Override
    public String toString() {
        return "Stack" + layers;
    }
}
