package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Колонны над и под узлом: высоты, условия на дальних концах, момент инерции сечения.
 * Для покрытия верхняя высота принудительно 0.
 */
@Value
@Builder
public class ColumnFrame {
    JointType jointType;
    double upperHeight;
    double lowerHeight;
    FarEndCondition farEndUpper;
    FarEndCondition farEndLower;
    /** Ic = c2·c1³/12, м⁴. */
    double columnInertia;

    public int getUpperStiffnessFactor() {
        return farEndUpper.getStiffnessFactor();
    }

    public int getLowerStiffnessFactor() {
        return farEndLower.getStiffnessFactor();
    }

    public boolean isRoof() {
        return jointType == JointType.ROOF;
    }
}
