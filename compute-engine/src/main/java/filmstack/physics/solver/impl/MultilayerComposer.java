package filmstack.physics.solver.impl;

import filmstack.domain.optics.TransferMatrix;

import java.util.List;

/**
 * Biblioteca estática que compone la matriz de transferencia total de la pila.
 * <p>
 * Producto de izquierda a derecha con un acumulador 2×2: coste lineal en el número de capas.
 * Stateless y Thread-Safe.
 */
public final class MultilayerComposer {

    private MultilayerComposer() {}

    /**
     * @param matrices Lista ordenada producida por el ensamblador (al menos dos matrices).
     * @return M = matrices[0] × matrices[1] × … × matrices[n-1].
     * @throws IllegalArgumentException si la lista es nula o tiene menos de dos elementos.
     */
    public static TransferMatrix compose(List<TransferMatrix> matrices) {
        if (matrices == null || matrices.size() < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos matrices para componer una pila.");
        }
        TransferMatrix product = matrices.get(0);
        for (int i = 1; i < matrices.size(); i++) {
            product = product.multiply(matrices.get(i));
        }
        return product;
    }
}
