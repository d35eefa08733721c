package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Минимальная толщина плиты по ACI 318 Table 8.3.1.1.
 */
@Value
@Builder
public class ThicknessCheck {
    boolean passed;
    double providedCm;
    /** Требуемая с учётом абсолютного минимума. */
    double requiredCm;
    /** Ln·(0.8 + fy/1400)/denominator до применения минимума. */
    double computedCm;
    double absoluteMinCm;
    double denominator;
    /** Больший чистый пролёт, м. */
    double clearSpan;
    String caseName;
}
