package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Проверка продавливания по одному критическому периметру. Силы в Н, размеры в м.
 */
@Value
@Builder
public class ShearCheckResult {
    ShearSection section;
    double criticalB1;
    double criticalB2;
    double perimeter;
    double effectiveDepth;
    double beta;
    double alphaS;
    /** vc, Па (минимум из трёх формул ACI). */
    double vc;
    double vu;
    double phiVc;
    double ratio;
    ShearStatus status;
}
