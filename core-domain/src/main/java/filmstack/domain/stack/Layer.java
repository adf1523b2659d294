package filmstack.domain.stack;

import filmstack.config.PhysicalConstants;
import filmstack.domain.exception.OpticalDomainException;
import filmstack.domain.exception.StackConfigurationException;
import filmstack.domain.optics.DynamicalMatrices;
import filmstack.domain.optics.TransferMatrix;
import filmstack.domain.optics.Wavenumber;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

import java.util.Arrays;

/**
 * Representa una lámina homogénea de material dentro de una pila multicapa.
 * <p>
 * Guarda el espesor y los datos tabulados por longitud de onda (índice de refracción y
 * coeficiente de extinción). Una vez construida no puede modificarse: el índice complejo
 * {@code n + j·κ} de cada muestra se precalcula en la construcción y se devuelve como valor,
 * nunca se reutiliza un campo mutable entre llamadas. Esto permite compartir la misma capa
 * entre todos los hilos de un barrido espectral.
 * <p>
 * Convención de fase: Ψ(x, t) = Ψ₀·exp(j(kx − ωt)), con n = n' + j·n''.
 */
public final class Layer {

    @Getter
    private final String material;
    @Getter
    private final double thickness;
    private final double[] wavelengths;
    private final double[] index;
    private final double[] extinction;
    private final Complex[] complexIndex;

    /**
     * Constructor canónico. Valida y copia los datos tabulados.
     *
     * @param material    Etiqueta del material (no afecta al cálculo).
     * @param thickness   Espesor en metros (>= 0; 0 para ambiente y sustrato semi-infinitos).
     * @param wavelengths Longitudes de onda en el vacío [m] de cada muestra (> 0).
     * @param index       Índice de refracción real de cada muestra.
     * @param extinction  Coeficiente de extinción de cada muestra.
     */
    public Layer(String material, double thickness, double[] wavelengths, double[] index, double[] extinction) {
        if (material == null) {
            throw new StackConfigurationException("La capa necesita una etiqueta de material.");
        }
        if (wavelengths == null || index == null || extinction == null) {
            throw new StackConfigurationException("Faltan datos tabulados (longitud de onda, índice o extinción) en la capa '" + material + "'.");
        }
        if (wavelengths.length != index.length || wavelengths.length != extinction.length) {
            throw new StackConfigurationException(String.format(
                    "Datos inconsistentes en la capa '%s': %d longitudes de onda, %d índices, %d coeficientes de extinción.",
                    material, wavelengths.length, index.length, extinction.length));
        }
        if (wavelengths.length == 0) {
            throw new StackConfigurationException("La capa '" + material + "' no contiene ninguna muestra espectral.");
        }
        if (!Double.isFinite(thickness) || thickness < 0.0) {
            throw new OpticalDomainException("El espesor de la capa '" + material + "' debe ser no negativo: " + thickness + " m.");
        }
        for (int i = 0; i < wavelengths.length; i++) {
            if (!Double.isFinite(wavelengths[i]) || wavelengths[i] <= 0.0) {
                throw new OpticalDomainException(String.format(
                        "Longitud de onda no positiva en la capa '%s', muestra %d: %s m.", material, i, wavelengths[i]));
            }
        }

        this.material = material;
        this.thickness = thickness;
        this.wavelengths = wavelengths.clone();
        this.index = index.clone();
        this.extinction = extinction.clone();
        this.complexIndex = new Complex[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            this.complexIndex[i] = new Complex(index[i], extinction[i]);
        }
    }

    /**
     * Crea una capa a partir de datos tabulados leídos de una fuente externa.
     *
     * @throws StackConfigurationException si los tres arrays no tienen la misma longitud.
     */
    public static Layer fromTabulatedData(String material, double thickness,
                                          double[] wavelengths, double[] index, double[] extinction) {
        return new Layer(material, thickness, wavelengths, index, extinction);
    }

    /**
     * Crea una capa no dispersiva: el mismo índice complejo en todas las longitudes de onda dadas.
     */
    public static Layer nonDispersive(String material, double thickness, double n, double k, double[] wavelengths) {
        if (wavelengths == null) {
            throw new StackConfigurationException("La capa no dispersiva '" + material + "' necesita una rejilla de longitudes de onda.");
        }
        double[] index = new double[wavelengths.length];
        double[] extinction = new double[wavelengths.length];
        Arrays.fill(index, n);
        Arrays.fill(extinction, k);
        return new Layer(material, thickness, wavelengths, index, extinction);
    }

    /**
     * Devuelve una copia de esta capa con otro espesor.
     */
    public Layer withThickness(double newThickness) {
        return new Layer(material, newThickness, wavelengths, index, extinction);
    }

    // --- MÉTODOS DE CONSULTA DE DATOS TABULADOS ---

    public int getSampleCount() {
        return wavelengths.length;
    }

    public double getWavelengthAt(int sampleIndex) {
        validateSampleIndex(sampleIndex);
        return wavelengths[sampleIndex];
    }

    public double getIndexAt(int sampleIndex) {
        validateSampleIndex(sampleIndex);
        return index[sampleIndex];
    }

    public double getExtinctionAt(int sampleIndex) {
        validateSampleIndex(sampleIndex);
        return extinction[sampleIndex];
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    /**
     * Devuelve el índice de refracción complejo {@code index[i] + j·extinction[i]}.
     *
     * @param sampleIndex El índice de la muestra espectral.
     * @return El índice complejo precalculado.
     * @throws IndexOutOfBoundsException si el índice está fuera de rango.
     */
    public Complex complexIndexAt(int sampleIndex) {
        validateSampleIndex(sampleIndex);
        return complexIndex[sampleIndex];
    }

    /**
     * @return {@code true} si el coeficiente de extinción es cero en todas las muestras.
     */
    public boolean isLossless() {
        for (double k : extinction) {
            if (k != 0.0) {
                return false;
            }
        }
        return true;
    }

    // --- MÉTODOS DE CÁLCULO ÓPTICO (REQUIEREN CONTEXTO DE LA MUESTRA) ---

    /**
     * Calcula las componentes del vector de onda para un ángulo real.
     * En incidencia normal (θ = 0) la componente transversal es nula.
     *
     * @param n         Índice complejo de la capa.
     * @param omega     Frecuencia angular [rad/s].
     * @param theta     Ángulo de propagación dentro de la capa [rad].
     * @param constants Constantes físicas.
     * @return (k_x, k_z) = (n·ω/c·cos θ, n·ω/c·sin θ).
     */
    public Wavenumber wavenumber(Complex n, double omega, double theta, PhysicalConstants constants) {
        Complex k = n.multiply(omega / constants.speedOfLight());
        return new Wavenumber(k.multiply(Math.cos(theta)), k.multiply(Math.sin(theta)));
    }

    /**
     * Variante para ángulos complejos, necesaria en incidencia oblicua sobre medios absorbentes,
     * donde el ángulo de refracción de Snell deja de ser real.
     *
     * @param cosTheta Coseno (complejo) del ángulo de propagación dentro de la capa.
     */
    public Wavenumber wavenumber(Complex n, double omega, Complex cosTheta, PhysicalConstants constants) {
        Complex k = n.multiply(omega / constants.speedOfLight());
        Complex sinTheta = Complex.ONE.subtract(cosTheta.multiply(cosTheta)).sqrt();
        return new Wavenumber(k.multiply(cosTheta), k.multiply(sinTheta));
    }

    /**
     * Matriz de propagación: acumulación de fase de la onda plana al atravesar la capa.
     *
     * @param longitudinalWavenumber k_x dentro de la capa [rad/m].
     * @return diag(exp(−j·k·d), exp(+j·k·d)); la identidad si el espesor es nulo.
     */
    public TransferMatrix propagationMatrix(Complex longitudinalWavenumber) {
        if (thickness == 0.0) {
            return TransferMatrix.IDENTITY;
        }
        Complex phase = longitudinalWavenumber.multiply(thickness).multiply(Complex.I);
        return TransferMatrix.diagonal(phase.negate().exp(), phase.exp());
    }

    /**
     * Matrices dinámicas (condiciones de contorno en la interfaz) para un ángulo real.
     *
     * @param n     Índice complejo de la capa.
     * @param theta Ángulo de propagación dentro de la capa [rad].
     * @return Las formas s y p. El llamador elige una sola por ejecución.
     */
    public DynamicalMatrices dynamicalMatrix(Complex n, double theta) {
        return dynamicalMatrix(n, new Complex(Math.cos(theta)));
    }

    /**
     * Matrices dinámicas para un coseno de ángulo complejo.
     * <ul>
     *   <li>s: [[1, 1], [n·cos θ, −n·cos θ]]</li>
     *   <li>p: [[cos θ, cos θ], [n, −n]]</li>
     * </ul>
     */
    public DynamicalMatrices dynamicalMatrix(Complex n, Complex cosTheta) {
        Complex m = n.multiply(cosTheta);
        TransferMatrix s = TransferMatrix.of(Complex.ONE, Complex.ONE, m, m.negate());
        TransferMatrix p = TransferMatrix.of(cosTheta, cosTheta, n, n.negate());
        return new DynamicalMatrices(s, p);
    }

    private void validateSampleIndex(int sampleIndex) {
        if (sampleIndex < 0 || sampleIndex >= wavelengths.length) {
            throw new IndexOutOfBoundsException("El índice de muestra " + sampleIndex + " está fuera de los límites [0, "
                    + (wavelengths.length - 1) + "] en la capa '" + material + "'.");
        }
    }

    @Override
    public String toString() {
        return "Layer{" + material + ", d=" + thickness + " m, " + wavelengths.length + " muestras}";
    }
}
