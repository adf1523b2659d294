package filmstack.domain.optics;

import filmstack.domain.exception.NumericalInstabilityException;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Matriz compleja 2×2 inmutable que relaciona las amplitudes de las ondas progresiva y
 * regresiva a ambos lados de un elemento de la pila (interfaz, capa o pila completa).
 * <p>
 * Los índices de fila y columna empiezan en 0: {@code get(1, 0)} es el elemento M21
 * en notación matemática.
 */
public final class TransferMatrix {

    public static final TransferMatrix IDENTITY =
            new TransferMatrix(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.ONE);

    private final Complex m00;
    private final Complex m01;
    private final Complex m10;
    private final Complex m11;

    private TransferMatrix(Complex m00, Complex m01, Complex m10, Complex m11) {
        this.m00 = Objects.requireNonNull(m00, "El elemento M[0,0] no puede ser nulo.");
        this.m01 = Objects.requireNonNull(m01, "El elemento M[0,1] no puede ser nulo.");
        this.m10 = Objects.requireNonNull(m10, "El elemento M[1,0] no puede ser nulo.");
        this.m11 = Objects.requireNonNull(m11, "El elemento M[1,1] no puede ser nulo.");
    }

    /**
     * Crea la matriz [[m00, m01], [m10, m11]].
     */
    public static TransferMatrix of(Complex m00, Complex m01, Complex m10, Complex m11) {
        return new TransferMatrix(m00, m01, m10, m11);
    }

    /**
     * Crea la matriz diagonal diag(d0, d1).
     */
    public static TransferMatrix diagonal(Complex d0, Complex d1) {
        return new TransferMatrix(d0, Complex.ZERO, Complex.ZERO, d1);
    }

    /**
     * Devuelve el elemento (fila, columna).
     *
     * @throws IndexOutOfBoundsException si fila o columna no están en {0, 1}.
     */
    public Complex get(int row, int column) {
        if (row < 0 || row > 1 || column < 0 || column > 1) {
            throw new IndexOutOfBoundsException("Elemento (" + row + ", " + column + ") fuera de una matriz 2x2.");
        }
        if (row == 0) {
            return column == 0 ? m00 : m01;
        }
        return column == 0 ? m10 : m11;
    }

    /**
     * Producto matricial {@code this × other}.
     */
    public TransferMatrix multiply(TransferMatrix other) {
        return new TransferMatrix(
                m00.multiply(other.m00).add(m01.multiply(other.m10)),
                m00.multiply(other.m01).add(m01.multiply(other.m11)),
                m10.multiply(other.m00).add(m11.multiply(other.m10)),
                m10.multiply(other.m01).add(m11.multiply(other.m11))
        );
    }

    public Complex determinant() {
        return m00.multiply(m11).subtract(m01.multiply(m10));
    }

    /**
     * Calcula la inversa mediante la adjunta.
     *
     * @param singularityThreshold Módulo del determinante por debajo del cual la matriz se considera singular.
     * @return La matriz inversa.
     * @throws NumericalInstabilityException si la matriz es singular o su determinante no es finito.
     */
    public TransferMatrix inverse(double singularityThreshold) {
        Complex det = determinant();
        if (det.isNaN() || det.isInfinite() || det.abs() <= singularityThreshold) {
            throw new NumericalInstabilityException("Matriz singular: |det| = " + det.abs() + ".");
        }
        return new TransferMatrix(
                m11.divide(det),
                m01.negate().divide(det),
                m10.negate().divide(det),
                m00.divide(det)
        );
    }

    /**
     * @return {@code true} si algún elemento es NaN o infinito.
     */
    public boolean isNaN() {
        return m00.isNaN() || m01.isNaN() || m10.isNaN() || m11.isNaN()
                || m00.isInfinite() || m01.isInfinite() || m10.isInfinite() || m11.isInfinite();
    }

    /**
     * Compara elemento a elemento con una tolerancia absoluta.
     */
    public boolean isClose(TransferMatrix other, double tolerance) {
        return m00.subtract(other.m00).abs() <= tolerance
                && m01.subtract(other.m01).abs() <= tolerance
                && m10.subtract(other.m10).abs() <= tolerance
                && m11.subtract(other.m11).abs() <= tolerance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransferMatrix that = (TransferMatrix) o;
        return m00.equals(that.m00) && m01.equals(that.m01) && m10.equals(that.m10) && m11.equals(that.m11);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m00, m01, m10, m11);
    }

    @Override
    public String toString() {
        return "[[" + m00 + ", " + m01 + "], [" + m10 + ", " + m11 + "]]";
    }
}
