package filmstack.domain.optics;

import filmstack.domain.exception.NumericalInstabilityException;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransferMatrixTest {

    private final TransferMatrix m = TransferMatrix.of(
            new Complex(1, 2), new Complex(0, -1),
            new Complex(3, 0), new Complex(2, 1));

    @Test
    @DisplayName("multiply: La identidad es neutra por ambos lados")
    void multiply_ByIdentity_ShouldReturnSameMatrix() {
        assertTrue(m.multiply(TransferMatrix.IDENTITY).isClose(m, 1e-15));
        assertTrue(TransferMatrix.IDENTITY.multiply(m).isClose(m, 1e-15));
    }

    @Test
    @DisplayName("determinant: Debe calcular m00·m11 − m01·m10")
    void determinant_ShouldMatchDefinition() {
        // (1+2i)(2+i) − (−i)(3) = (0+5i) + 3i = 8i
        Complex det = m.determinant();
        assertEquals(0.0, det.getReal(), 1e-12);
        assertEquals(8.0, det.getImaginary(), 1e-12);
    }

    @Test
    @DisplayName("inverse: M × M⁻¹ debe ser la identidad")
    void inverse_ShouldProduceIdentity() {
        TransferMatrix product = m.multiply(m.inverse(1e-12));
        assertTrue(product.isClose(TransferMatrix.IDENTITY, 1e-12), "Producto: " + product);
    }

    @Test
    @DisplayName("inverse: Una matriz singular debe lanzar NumericalInstabilityException")
    void inverse_Singular_ShouldThrow() {
        TransferMatrix singular = TransferMatrix.of(Complex.ONE, Complex.ONE, Complex.ZERO, Complex.ZERO);

        NumericalInstabilityException ex = assertThrows(NumericalInstabilityException.class,
                () -> singular.inverse(1e-12));
        assertTrue(ex.getSampleIndex().isEmpty());
    }

    @Test
    @DisplayName("get: Índices fuera de 2x2 deben lanzar IndexOutOfBoundsException")
    void get_OutOfRange_ShouldThrow() {
        assertEquals(new Complex(3, 0), m.get(1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> m.get(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> m.get(0, -1));
    }

    @Test
    @DisplayName("isNaN: Detecta elementos NaN o infinitos")
    void isNaN_ShouldDetectNonFiniteElements() {
        assertFalse(m.isNaN());
        assertTrue(TransferMatrix.diagonal(Complex.NaN, Complex.ONE).isNaN());
        assertTrue(TransferMatrix.diagonal(Complex.ONE, Complex.INF).isNaN());
    }
}
