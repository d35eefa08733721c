package by.greenmobile.flatslabcalc.entity;

/**
 * Строка таблицы продольных коэффициентов DDM (ACI 318, 8.10.4).
 * Доли от Mo: отрицательный у наружной опоры, положительный в пролёте, отрицательный у внутренней опоры.
 */
public enum SpanCase {
    INTERIOR_SPAN(0.65, 0.35, 0.65, "Interior span"),
    END_SPAN_RESTRAINED(0.65, 0.35, 0.65, "End span (exterior edge fully restrained)"),
    END_SPAN_EDGE_BEAM(0.30, 0.50, 0.70, "End span (edge beam)"),
    END_SPAN_FLAT_PLATE(0.26, 0.52, 0.70, "End span (flat plate, no edge beam)");

    private final double negExterior;
    private final double positive;
    private final double negInterior;
    private final String description;

    SpanCase(double negExterior, double positive, double negInterior, String description) {
        this.negExterior = negExterior;
        this.positive = positive;
        this.negInterior = negInterior;
        this.description = description;
    }

    public static SpanCase of(PanelCase panel) {
        if (!panel.isEndSpan()) {
            return INTERIOR_SPAN;
        }
        if (panel.isExteriorEdgeRestrained()) {
            return END_SPAN_RESTRAINED;
        }
        return panel.isEdgeBeam() ? END_SPAN_EDGE_BEAM : END_SPAN_FLAT_PLATE;
    }

    public double coefficient(MomentLocation location) {
        return switch (location) {
            case NEG_EXTERIOR -> negExterior;
            case POSITIVE -> positive;
            case NEG_INTERIOR -> negInterior;
        };
    }

    /** Наружная опора работает как внутренняя (симметричная схема). */
    public boolean isSymmetric() {
        return this == INTERIOR_SPAN || this == END_SPAN_RESTRAINED;
    }

    public double getNegExterior() {
        return negExterior;
    }

    public double getPositive() {
        return positive;
    }

    public double getNegInterior() {
        return negInterior;
    }

    public String getDescription() {
        return description;
    }
}
