package filmstack.config;

import filmstack.domain.exception.OpticalDomainException;
import filmstack.domain.optics.Polarization;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TmmConfigTest {

    @Test
    @DisplayName("builder: Valores por defecto de un cálculo en incidencia normal")
    void builder_ShouldApplyDefaults() {
        TmmConfig config = TmmConfig.builder().build();

        assertEquals(Polarization.S, config.getPolarization());
        assertEquals(0.0, config.getIncidenceAngleDegrees());
        assertEquals(PhysicalConstants.CODATA_2018, config.getConstants());
        assertEquals(1, config.getCpuProcessorCount());
        assertEquals(1e-12, config.getSingularityThreshold());
        assertEquals(1e-9, config.getEnergyBalanceTolerance());
        assertFalse(config.isStrictEnergyBalance());
        assertFalse(config.isAllowZeroThicknessLayers());
        assertNull(config.getAngleSweep());
    }

    @Test
    @DisplayName("validateIncidenceAngle: Solo se aceptan ángulos en [0°, 90°)")
    void validateIncidenceAngle_ShouldEnforceRange() {
        TmmConfig config = TmmConfig.builder().build();

        assertDoesNotThrow(config.withIncidenceAngleDegrees(89.9)::validateIncidenceAngle);
        assertThrows(OpticalDomainException.class, config.withIncidenceAngleDegrees(90.0)::validateIncidenceAngle);
        assertThrows(OpticalDomainException.class, config.withIncidenceAngleDegrees(-1.0)::validateIncidenceAngle);
        assertEquals(Math.PI / 4.0, config.withIncidenceAngleDegrees(45.0).getIncidenceAngleRadians(), 1e-15);
    }

    @Test
    @DisplayName("AngleSweep: Ángulos equiespaciados con ambos extremos incluidos")
    void angleSweep_ShouldBeInclusiveAndEvenlySpaced() {
        TmmConfig.AngleSweep sweep = TmmConfig.AngleSweep.builder()
                .startDegrees(0.0).endDegrees(60.0).count(4).build();

        assertArrayEquals(new double[]{0.0, 20.0, 40.0, 60.0}, sweep.anglesDegrees(), 1e-12);
    }

    @Test
    @DisplayName("AngleSweep: Un solo ángulo o ángulos inválidos")
    void angleSweep_EdgeCases() {
        TmmConfig.AngleSweep single = TmmConfig.AngleSweep.builder().startDegrees(30.0).endDegrees(50.0).count(1).build();
        assertArrayEquals(new double[]{30.0}, single.anglesDegrees());

        TmmConfig.AngleSweep empty = TmmConfig.AngleSweep.builder().startDegrees(0.0).endDegrees(10.0).count(0).build();
        assertThrows(IllegalArgumentException.class, empty::anglesDegrees);

        TmmConfig.AngleSweep grazing = TmmConfig.AngleSweep.builder().startDegrees(0.0).endDegrees(90.0).count(3).build();
        assertThrows(OpticalDomainException.class, grazing::anglesDegrees);
    }
}
