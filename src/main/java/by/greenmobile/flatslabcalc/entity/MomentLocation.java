package by.greenmobile.flatslabcalc.entity;

public enum MomentLocation {
    NEG_EXTERIOR("Exterior negative"),
    POSITIVE("Positive"),
    NEG_INTERIOR("Interior negative");

    private final String label;

    MomentLocation(String label) {
        this.label = label;
    }

    public boolean isNegative() {
        return this != POSITIVE;
    }

    public String getLabel() {
        return label;
    }
}
