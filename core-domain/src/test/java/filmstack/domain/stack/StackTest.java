package filmstack.domain.stack;

import filmstack.domain.exception.OpticalDomainException;
import filmstack.domain.exception.StackConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StackTest {

    private static final double[] GRID = {500e-9, 600e-9};

    private final Layer air = Layer.nonDispersive("Aire", 0.0, 1.0, 0.0, GRID);
    private final Layer film = Layer.nonDispersive("TiO2", 80e-9, 2.4, 0.0, GRID);
    private final Layer spacer = Layer.nonDispersive("SiO2", 120e-9, 1.46, 0.0, GRID);
    private final Layer glass = Layer.nonDispersive("Vidrio", 0.0, 1.52, 0.0, GRID);

    @Test
    @DisplayName("Constructor: Una pila necesita al menos ambiente y sustrato")
    void constructor_TooFewLayers_ShouldThrow() {
        assertThrows(StackConfigurationException.class, () -> new Stack(List.of(air)));
        assertThrows(StackConfigurationException.class, () -> new Stack(null));
    }

    @Test
    @DisplayName("Constructor: Ambiente y sustrato deben tener espesor 0")
    void constructor_ThickBoundary_ShouldThrow() {
        assertThrows(StackConfigurationException.class, () -> Stack.of(film, glass));
        assertThrows(StackConfigurationException.class, () -> Stack.of(air, film));
    }

    @Test
    @DisplayName("Accesores: Ambiente, interiores y sustrato en orden de propagación")
    void accessors_ShouldExposeStructure() {
        Stack stack = Stack.of(air, film, spacer, glass);

        assertSame(air, stack.getAmbient());
        assertSame(glass, stack.getSubstrate());
        assertEquals(List.of(film, spacer), stack.getInteriorLayers());
        assertEquals(4, stack.getLayerCount());
        assertEquals(2, stack.getSampleCount());
        assertTrue(stack.isLossless());
    }

    @Test
    @DisplayName("requireConsistentSampling: Distinto número de muestras es un error de configuración")
    void requireConsistentSampling_Mismatch_ShouldThrow() {
        Layer oneSample = Layer.nonDispersive("TiO2", 80e-9, 2.4, 0.0, new double[]{500e-9});
        Stack stack = Stack.of(air, oneSample, glass);

        StackConfigurationException ex = assertThrows(StackConfigurationException.class, stack::requireConsistentSampling);
        assertTrue(ex.getMessage().contains("TiO2"));
    }

    @Test
    @DisplayName("requireConsistentSampling: Una capa tabulada en otra rejilla no cubre el barrido aunque tenga las mismas muestras")
    void requireConsistentSampling_DifferentGrid_ShouldThrow() {
        Layer gold = Layer.fromTabulatedData("Au", 20e-9, new double[]{5e-6, 6e-6},
                new double[]{1.2, 1.6}, new double[]{30.0, 36.0});
        Stack stack = Stack.of(air, gold, glass);

        StackConfigurationException ex = assertThrows(StackConfigurationException.class, stack::requireConsistentSampling);
        assertTrue(ex.getMessage().contains("Au"));
        assertTrue(ex.getMessage().contains("Aire"));
    }

    @Test
    @DisplayName("requireConsistentSampling: Diferencias por debajo de la tolerancia relativa se aceptan")
    void requireConsistentSampling_WithinTolerance_ShouldPass() {
        double[] shifted = GRID.clone();
        shifted[1] *= 1.0 + 1e-12;
        Layer nearlySame = Layer.nonDispersive("TiO2", 80e-9, 2.4, 0.0, shifted);

        assertDoesNotThrow(Stack.of(air, nearlySame, glass)::requireConsistentSampling);
        assertEquals(-1, Stack.firstGridMismatch(GRID, shifted));
        assertEquals(0, Stack.firstGridMismatch(GRID, new double[]{GRID[0] * 1.01, GRID[1]}));
    }

    @Test
    @DisplayName("requirePositiveInteriorThickness: Capas interiores de espesor nulo solo si se permiten")
    void requirePositiveInteriorThickness_ZeroLayer() {
        Stack stack = Stack.of(air, film.withThickness(0.0), glass);

        assertThrows(OpticalDomainException.class, () -> stack.requirePositiveInteriorThickness(false));
        assertDoesNotThrow(() -> stack.requirePositiveInteriorThickness(true));
    }

    @Test
    @DisplayName("reversed / withoutLayer: Devuelven pilas nuevas sin modificar la original")
    void structuralCopies_ShouldNotMutateOriginal() {
        Stack stack = Stack.of(air, film, spacer, glass);

        Stack reversed = stack.reversed();
        Stack withoutFilm = stack.withoutLayer(1);

        assertEquals(List.of(glass, spacer, film, air), reversed.getLayers());
        assertEquals(List.of(air, spacer, glass), withoutFilm.getLayers());
        assertEquals(4, stack.getLayerCount());
        assertThrows(IllegalArgumentException.class, () -> stack.withoutLayer(0));
    }
}
