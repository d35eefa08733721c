package by.greenmobile.flatslabcalc.entity;

/**
 * Условие на дальнем конце колонны: коэффициент k в kEI/L.
 */
public enum FarEndCondition {
    FIXED(4),
    PINNED(3);

    private final int stiffnessFactor;

    FarEndCondition(int stiffnessFactor) {
        this.stiffnessFactor = stiffnessFactor;
    }

    public int getStiffnessFactor() {
        return stiffnessFactor;
    }
}
