package by.greenmobile.flatslabcalc.entity;

/**
 * Положение колонны в плане:
 * INTERIOR - 4 панели вокруг, EDGE - 3 (нет пролёта L1 слева), CORNER - 2 (нет L1 слева и L2 снизу).
 */
public enum ColumnLocation {
    INTERIOR,
    EDGE,
    CORNER;

    public boolean isExterior() {
        return this != INTERIOR;
    }
}
