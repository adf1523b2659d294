package filmstack.config;

import filmstack.domain.exception.OpticalDomainException;
import filmstack.domain.optics.Polarization;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor principal de los parámetros de un cálculo de matrices de transferencia.
 * Agrupa la onda incidente, las tolerancias numéricas y el grado de paralelismo del barrido.
 */
@Value
@Builder
@With
public class TmmConfig {

    /**
     * Polarización de la onda incidente. Una sola por ejecución.
     */
    @Builder.Default
    Polarization polarization = Polarization.S;

    /**
     * Ángulo de incidencia en el medio ambiente, en grados [0, 90).
     */
    @Builder.Default
    double incidenceAngleDegrees = 0.0;

    /**
     * Constantes físicas usadas para derivar frecuencias y números de onda.
     */
    @Builder.Default
    PhysicalConstants constants = PhysicalConstants.CODATA_2018;

    /**
     * Número de hilos del barrido espectral. Con 1 o menos el barrido es secuencial.
     */
    @Builder.Default
    int cpuProcessorCount = 1;

    /**
     * Por debajo de este módulo un determinante o un elemento M[0,0] se considera nulo.
     */
    @Builder.Default
    double singularityThreshold = 1e-12;

    /**
     * Tolerancia absoluta del balance energético R + T (+ A) = 1.
     */
    @Builder.Default
    double energyBalanceTolerance = 1e-9;

    /**
     * Si está activo, una violación del balance energético aborta el cálculo
     * en lugar de registrarse como advertencia.
     */
    boolean strictEnergyBalance;

    /**
     * Permite capas interiores de espesor nulo (sin efecto óptico).
     */
    boolean allowZeroThicknessLayers;

    /**
     * Barrido angular opcional. Nulo si solo se calcula el ángulo de incidencia fijo.
     */
    AngleSweep angleSweep;

    public double getIncidenceAngleRadians() {
        return Math.toRadians(incidenceAngleDegrees);
    }

    /**
     * Comprueba que el ángulo de incidencia es físicamente válido.
     *
     * @throws OpticalDomainException si el ángulo está fuera de [0°, 90°).
     */
    public void validateIncidenceAngle() {
        requireValidAngle(incidenceAngleDegrees);
    }

    static void requireValidAngle(double degrees) {
        if (!Double.isFinite(degrees) || degrees < 0.0 || degrees >= 90.0) {
            throw new OpticalDomainException("El ángulo de incidencia debe estar en [0°, 90°): " + degrees + "°.");
        }
    }

    /**
     * Define un barrido de ángulos de incidencia equiespaciados e inclusivos,
     * en grados, desde {@code startDegrees} hasta {@code endDegrees}.
     */
    @Value
    @Builder
    public static class AngleSweep {
        double startDegrees;
        double endDegrees;
        int count;

        /**
         * Genera los ángulos del barrido.
         *
         * @return Array de {@code count} ángulos en grados.
         * @throws IllegalArgumentException si {@code count} es menor que 1.
         */
        public double[] anglesDegrees() {
            if (count < 1) {
                throw new IllegalArgumentException("El barrido angular necesita al menos un ángulo.");
            }
            double[] angles = new double[count];
            double step = count == 1 ? 0.0 : (endDegrees - startDegrees) / (count - 1);
            for (int i = 0; i < count; i++) {
                angles[i] = startDegrees + i * step;
                requireValidAngle(angles[i]);
            }
            return angles;
        }
    }
}
