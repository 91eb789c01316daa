package guraa.diagramwatch.compare;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which part of the diagram a change concerns.
 */
public enum ChangeCategory {
    TAXIWAY("taxiway"),
    RUNWAY("runway"),
    GEOMETRY("geometry");

    private final String label;

    ChangeCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
