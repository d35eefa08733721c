package by.greenmobile.flatslabcalc.service.design;

/**
 * Линейная интерполяция с ограничением по краям. Все табличные интерполяции ACI
 * (l2/l1, αf1·l2/l1, βt) идут только через неё.
 */
public final class Interpolation {

    private Interpolation() {
    }

    /**
     * y(x) на отрезке [x0, x1]; вне отрезка возвращает крайнее значение (y0 или y1 точно).
     */
    public static double lerp(double x, double x0, double y0, double x1, double y1) {
        if (x1 <= x0) {
            throw new IllegalArgumentException("lerp: x1 must be > x0");
        }
        if (Double.isNaN(x) || x <= x0) return y0;
        if (x >= x1) return y1;
        return y0 + (y1 - y0) * (x - x0) / (x1 - x0);
    }

    public static double clamp(double x, double min, double max) {
        return Math.max(min, Math.min(max, x));
    }
}
