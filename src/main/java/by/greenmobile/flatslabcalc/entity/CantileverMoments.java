package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Консольные (уравновешивающие) моменты wu·L2·Lc²/2, Н·м.
 * Справочные: в DDM / EFM не передаются.
 */
@Value
@Builder
public class CantileverMoments {
    double leftLength;
    double rightLength;
    double left;
    double right;

    public boolean isPresent() {
        return leftLength > 0 || rightLength > 0;
    }
}
