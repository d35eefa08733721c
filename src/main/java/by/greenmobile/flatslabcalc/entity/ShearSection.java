package by.greenmobile.flatslabcalc.entity;

public enum ShearSection {
    /** d/2 от грани колонны. */
    COLUMN_FACE("Column face"),
    /** d/2 от грани капители (drop panel), d плиты. */
    DROP_PANEL_FACE("Drop panel face");

    private final String label;

    ShearSection(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
