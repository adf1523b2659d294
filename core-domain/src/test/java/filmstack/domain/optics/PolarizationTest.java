package filmstack.domain.optics;

import filmstack.domain.exception.StackConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PolarizationTest {

    @Test
    @DisplayName("fromLabel: Acepta s y p sin distinguir mayúsculas")
    void fromLabel_ShouldParseValidLabels() {
        assertEquals(Polarization.S, Polarization.fromLabel("s"));
        assertEquals(Polarization.S, Polarization.fromLabel("S"));
        assertEquals(Polarization.P, Polarization.fromLabel(" p "));
    }

    @Test
    @DisplayName("fromLabel: Cualquier otra etiqueta es un error de configuración")
    void fromLabel_Invalid_ShouldThrow() {
        assertThrows(StackConfigurationException.class, () -> Polarization.fromLabel("te"));
        assertThrows(StackConfigurationException.class, () -> Polarization.fromLabel(""));
        assertThrows(StackConfigurationException.class, () -> Polarization.fromLabel(null));
    }
}
