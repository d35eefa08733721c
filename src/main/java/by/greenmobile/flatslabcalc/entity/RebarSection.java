package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Требуемое армирование одного сечения (место × полоса).
 * Площади в м², размеры в м, момент в Н·м.
 */
@Value
@Builder
public class RebarSection {
    MomentLocation location;
    StripType strip;
    double designMoment;
    double width;
    double thickness;
    double effectiveDepth;
    double rn;
    double rho;
    double asMin;
    double asRequired;
    RebarStatus status;
    /** Причина FAIL (null для OK / MIN_STEEL). */
    String failureReason;
    int barCount;
    double barSpacing;
    String suggestion;

    public double getAsRequiredCm2() {
        return asRequired * 1e4;
    }
}
