package filmstack.domain.stack;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import filmstack.domain.exception.StackConfigurationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descripción validable de una capa tal como la entrega un colaborador externo
 * (lector de CSV, descriptor de dispositivo, etc.).
 * <p>
 * Una especificación es <b>tabulada</b> si trae longitudes de onda propias, o <b>constante</b>
 * si solo trae un índice y una extinción literales que se extienden a la rejilla de la pila.
 * La igualdad compara el contenido de los arrays, no su identidad.
 *
 * @param material    Etiqueta del material.
 * @param thickness   Espesor en metros.
 * @param wavelengths Longitudes de onda [m]; nulo para capas constantes.
 * @param index       Índices de refracción (un único valor en capas constantes).
 * @param extinction  Coeficientes de extinción (un único valor en capas constantes).
 */
public record LayerSpec(
        @JsonProperty("material") String material,
        @JsonProperty("thickness") double thickness,
        @JsonProperty("wavelengths") double[] wavelengths,
        @JsonProperty("index") double[] index,
        @JsonProperty("extinction") double[] extinction
) {

    public LayerSpec {
        if (index == null || extinction == null) {
            throw new StackConfigurationException("Faltan índice o extinción en la especificación de la capa '" + material + "'.");
        }
        if (wavelengths == null && (index.length != 1 || extinction.length != 1)) {
            throw new StackConfigurationException(
                    "La capa constante '" + material + "' debe dar exactamente un índice y una extinción.");
        }
    }

    public static LayerSpec tabulated(String material, double thickness,
                                      double[] wavelengths, double[] index, double[] extinction) {
        if (wavelengths == null) {
            throw new StackConfigurationException("La capa tabulada '" + material + "' necesita longitudes de onda.");
        }
        return new LayerSpec(material, thickness, wavelengths, index, extinction);
    }

    public static LayerSpec constant(String material, double thickness, double n, double k) {
        return new LayerSpec(material, thickness, null, new double[]{n}, new double[]{k});
    }

    @JsonIgnore
    public boolean isConstant() {
        return wavelengths == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LayerSpec)) return false;
        LayerSpec other = (LayerSpec) o;
        return Double.compare(thickness, other.thickness) == 0
                && Objects.equals(material, other.material)
                && Arrays.equals(wavelengths, other.wavelengths)
                && Arrays.equals(index, other.index)
                && Arrays.equals(extinction, other.extinction);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(material, thickness);
        result = 31 * result + Arrays.hashCode(wavelengths);
        result = 31 * result + Arrays.hashCode(index);
        result = 31 * result + Arrays.hashCode(extinction);
        return result;
    }

    @Override
    public String toString() {
        return "LayerSpec[material=" + material + ", thickness=" + thickness
                + ", wavelengths=" + Arrays.toString(wavelengths)
                + ", index=" + Arrays.toString(index)
                + ", extinction=" + Arrays.toString(extinction) + "]";
    }
}
