package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Нормализованная геометрия, все размеры в м.
 * Отсутствующий пролёт (край плиты) = 0.
 */
@Value
public class Geometry {

    double l1Left;
    double l1Right;
    double l2Top;
    double l2Bottom;

    double c1;
    double c2;

    double slabThickness;

    boolean dropPanel;

    /** Выступ капители ниже плиты (0 без капители). */
    double dropDepth;

    double dropWidth1;
    double dropWidth2;

    @Builder
    public Geometry(double l1Left, double l1Right, double l2Top, double l2Bottom,
                    double c1, double c2, double slabThickness,
                    boolean dropPanel, double dropDepth, double dropWidth1, double dropWidth2) {
        if (l1Left < 0 || l1Right < 0 || l2Top < 0 || l2Bottom < 0) {
            throw new IllegalArgumentException("Spans must be >= 0");
        }
        if (Math.max(l1Left, l1Right) <= 0 || Math.max(l2Top, l2Bottom) <= 0) {
            throw new IllegalArgumentException("At least one span is required in each direction");
        }
        if (c1 <= 0 || c2 <= 0 || slabThickness <= 0) {
            throw new IllegalArgumentException("Column size and slab thickness must be > 0");
        }
        if (dropPanel && (dropDepth <= 0 || dropWidth1 <= 0 || dropWidth2 <= 0)) {
            throw new IllegalArgumentException("Drop panel dimensions must be > 0");
        }
        this.l1Left = l1Left;
        this.l1Right = l1Right;
        this.l2Top = l2Top;
        this.l2Bottom = l2Bottom;
        this.c1 = c1;
        this.c2 = c2;
        this.slabThickness = slabThickness;
        this.dropPanel = dropPanel;
        this.dropDepth = dropPanel ? dropDepth : 0.0;
        this.dropWidth1 = dropPanel ? dropWidth1 : 0.0;
        this.dropWidth2 = dropPanel ? dropWidth2 : 0.0;
    }

    /** Расчётный пролёт L1: больший из соседних. */
    public double getL1() {
        return Math.max(l1Left, l1Right);
    }

    /** Пролёт панели L2: больший из соседних. */
    public double getL2() {
        return Math.max(l2Top, l2Bottom);
    }

    /** Ширина расчётной рамы: половины соседних поперечных пролётов. */
    public double getL2Tributary() {
        return (l2Top + l2Bottom) / 2.0;
    }

    /** Геометрический чистый пролёт L1 − c1 (без ограничения 0.65·L1). */
    public double getClearSpan() {
        return getL1() - c1;
    }

    /** Толщина плиты в зоне капители. */
    public double getDropThickness() {
        return slabThickness + dropDepth;
    }

    /** Грузовая площадь колонны. */
    public double getTributaryArea() {
        return (l1Left + l1Right) / 2.0 * getL2Tributary();
    }

    public boolean hasBothL1Spans() {
        return l1Left > 0 && l1Right > 0;
    }

    public boolean hasBothL2Spans() {
        return l2Top > 0 && l2Bottom > 0;
    }
}
