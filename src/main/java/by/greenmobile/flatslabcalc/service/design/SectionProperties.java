package by.greenmobile.flatslabcalc.service.design;

/**
 * Геометрические характеристики прямоугольных сечений.
 */
public final class SectionProperties {

    private SectionProperties() {
    }

    /** b·h³/12. */
    public static double rectangleInertia(double b, double h) {
        return b * h * h * h / 12.0;
    }

    /**
     * Крутильная постоянная прямоугольника: C = (1 − 0.63·x/y)·x³·y/3, x ≤ y.
     * Порядок сторон не важен.
     */
    public static double torsionConstant(double a, double b) {
        double x = Math.min(a, b);
        double y = Math.max(a, b);
        if (x <= 0) return 0.0;
        return (1.0 - 0.63 * x / y) * x * x * x * y / 3.0;
    }
}
