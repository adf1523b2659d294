package filmstack.domain.optics;

import filmstack.domain.exception.StackConfigurationException;

import java.util.Locale;

/**
 * Estado de polarización de la onda incidente. Cada ejecución usa exactamente uno.
 */
public enum Polarization {
    S, // Campo eléctrico perpendicular al plano de incidencia (TE)
    P; // Campo eléctrico contenido en el plano de incidencia (TM)

    /**
     * Interpreta una etiqueta de configuración ("s" o "p", sin distinguir mayúsculas).
     *
     * @param label Etiqueta de polarización.
     * @return La polarización correspondiente.
     * @throws StackConfigurationException si la etiqueta no es "s" ni "p".
     */
    public static Polarization fromLabel(String label) {
        if (label == null) {
            throw new StackConfigurationException("La polarización no puede ser nula; valores válidos: s, p.");
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "s":
                return S;
            case "p":
                return P;
            default:
                throw new StackConfigurationException("Polarización desconocida '" + label + "'; valores válidos: s, p.");
        }
    }
}
