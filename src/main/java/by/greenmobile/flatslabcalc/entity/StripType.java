package by.greenmobile.flatslabcalc.entity;

public enum StripType {
    COLUMN_STRIP("Column strip"),
    MIDDLE_STRIP("Middle strip");

    private final String label;

    StripType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
