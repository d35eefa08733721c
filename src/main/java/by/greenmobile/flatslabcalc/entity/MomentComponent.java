package by.greenmobile.flatslabcalc.entity;

import lombok.Value;

/**
 * Продольная составляющая момента и её разделение на полосы.
 * columnStrip + middleStrip == total.
 */
@Value
public class MomentComponent {
    MomentLocation location;
    double coefficient;
    double total;
    double columnStripShare;
    double columnStrip;
    double middleStrip;

    public static MomentComponent split(MomentLocation location, double coefficient, double total,
                                        double columnStripShare) {
        if (columnStripShare < 0 || columnStripShare > 1) {
            throw new IllegalArgumentException("Column strip share out of [0,1]: " + columnStripShare);
        }
        double cs = total * columnStripShare;
        return new MomentComponent(location, coefficient, total, columnStripShare, cs, total - cs);
    }

    public double forStrip(StripType strip) {
        return strip == StripType.COLUMN_STRIP ? columnStrip : middleStrip;
    }
}
