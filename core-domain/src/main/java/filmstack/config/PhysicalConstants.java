package filmstack.config;

/**
 * Tabla inmutable de constantes físicas utilizadas por el motor óptico.
 * <p>
 * Se pasa por valor a {@code Light} y {@code Layer} en lugar de depender de estado global,
 * lo que permite sustituirla en pruebas (por ejemplo, unidades naturales con c = 1).
 *
 * @param speedOfLight     Velocidad de la luz en el vacío [m/s].
 * @param planckConstant   Constante de Planck [J·s].
 * @param elementaryCharge Carga elemental [C], usada para convertir julios a electronvoltios.
 */
public record PhysicalConstants(
        double speedOfLight,
        double planckConstant,
        double elementaryCharge
) {

    /**
     * Valores exactos del SI redefinido (CODATA 2018).
     */
    public static final PhysicalConstants CODATA_2018 =
            new PhysicalConstants(299_792_458.0, 6.626_070_15e-34, 1.602_176_634e-19);

    public PhysicalConstants {
        if (!isPositiveFinite(speedOfLight) || !isPositiveFinite(planckConstant) || !isPositiveFinite(elementaryCharge)) {
            throw new IllegalArgumentException("Las constantes físicas deben ser positivas y finitas.");
        }
    }

    private static boolean isPositiveFinite(double value) {
        return value > 0 && Double.isFinite(value);
    }
}
