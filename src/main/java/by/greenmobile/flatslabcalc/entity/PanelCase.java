package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Расчётный случай панели: положение колонны и условия на наружном краю.
 */
@Value
@Builder
public class PanelCase {
    ColumnLocation location;
    boolean edgeBeam;
    /** Размеры контурной балки, м (0 без балки). */
    double edgeBeamWidth;
    double edgeBeamDepth;
    boolean exteriorEdgeRestrained;

    /** Крайний пролёт: у колонны нет соседнего пролёта L1. */
    public boolean isEndSpan() {
        return location.isExterior();
    }

    public SpanCase getSpanCase() {
        return SpanCase.of(this);
    }
}
