package by.greenmobile.flatslabcalc.service.engine;

import by.greenmobile.flatslabcalc.entity.ColumnLocation;
import by.greenmobile.flatslabcalc.entity.DdmResult;
import by.greenmobile.flatslabcalc.entity.MomentComponent;
import by.greenmobile.flatslabcalc.entity.MomentSet;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.RebarSection;
import by.greenmobile.flatslabcalc.entity.RebarStatus;
import by.greenmobile.flatslabcalc.entity.ShearCheckResult;
import by.greenmobile.flatslabcalc.entity.ShearSection;
import by.greenmobile.flatslabcalc.entity.SpanCase;
import by.greenmobile.flatslabcalc.entity.StripType;
import by.greenmobile.flatslabcalc.service.design.SectionProperties;
import org.junit.jupiter.api.Test;

import static by.greenmobile.flatslabcalc.SlabFixtures.UNITS;
import static by.greenmobile.flatslabcalc.SlabFixtures.ddmEngine;
import static by.greenmobile.flatslabcalc.SlabFixtures.defaults;
import static by.greenmobile.flatslabcalc.SlabFixtures.prepare;
import static by.greenmobile.flatslabcalc.SlabFixtures.unitLoad;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DdmEngineTest {

    private final DdmEngine engine = ddmEngine();

    @Test
    void six_by_six_interior_panel_static_moment() {
        DdmResult r = engine.run(prepare(unitLoad()));
        MomentSet m = r.getMoments();

        // wu = 1000 кгс/м², l2 = 6 м, Ln = 5.5 м -> Mo = 22 687.5 кгс·м
        assertThat(UNITS.nToKg(m.getMo())).isCloseTo(22_687.5, within(1e-6));
        assertThat(m.getNegInterior().getTotal()).isCloseTo(0.65 * m.getMo(), within(1e-6));
        assertThat(m.getNegInterior().getColumnStripShare()).isEqualTo(0.75);
        assertThat(m.getNegInterior().getColumnStrip()).isCloseTo(0.75 * 0.65 * m.getMo(), within(1e-6));
    }

    @Test
    void interior_span_is_symmetric() {
        DdmResult r = engine.run(prepare(defaults()));
        MomentSet m = r.getMoments();

        assertThat(r.getSpanCase()).isEqualTo(SpanCase.INTERIOR_SPAN);
        assertThat(m.getNegExterior().getCoefficient()).isEqualTo(0.65);
        assertThat(m.getPositive().getCoefficient()).isEqualTo(0.35);
        assertThat(m.getNegInterior().getCoefficient()).isEqualTo(0.65);
        assertThat(m.getNegExterior().getColumnStripShare()).isEqualTo(m.getNegInterior().getColumnStripShare());
        assertThat(m.getPositive().getColumnStripShare()).isEqualTo(0.60);
    }

    @Test
    void strip_moments_add_up_to_total() {
        DdmResult r = engine.run(prepare(defaults().location(ColumnLocation.EDGE)));

        for (MomentComponent c : r.getMoments().getComponents()) {
            assertThat(c.getColumnStrip() + c.getMiddleStrip()).isCloseTo(c.getTotal(), within(1e-6));
        }
    }

    @Test
    void clear_span_is_clamped_to_065_l1() {
        NormalizedSlab slab = prepare(unitLoad().columnC1Cm(250.0));
        DdmResult r = engine.run(slab);

        assertThat(r.getClearSpanActual()).isCloseTo(3.5, within(1e-12));
        assertThat(r.getClearSpanUsed()).isCloseTo(0.65 * 6.0, within(1e-12));
        assertThat(r.getNotes()).anyMatch(n -> n.contains("0.65"));

        double wu = slab.getLoads().getWuPa();
        assertThat(r.getMoments().getMo()).isCloseTo(wu * 6.0 * 3.9 * 3.9 / 8.0, within(1e-6));
    }

    @Test
    void edge_column_without_beam_sends_exterior_moment_to_column_strip() {
        DdmResult r = engine.run(prepare(defaults().location(ColumnLocation.EDGE)));

        assertThat(r.getSpanCase()).isEqualTo(SpanCase.END_SPAN_FLAT_PLATE);
        assertThat(r.getBetaT()).isZero();
        assertThat(r.getMoments().getNegExterior().getCoefficient()).isEqualTo(0.26);
        assertThat(r.getMoments().getNegExterior().getColumnStripShare()).isEqualTo(1.0);
        assertThat(r.getMoments().getNegExterior().getMiddleStrip()).isZero();
    }

    @Test
    void edge_beam_reduces_exterior_column_strip_share() {
        NormalizedSlab slab = prepare(defaults()
                .location(ColumnLocation.EDGE)
                .edgeBeam(true)
                .edgeBeamWidthCm(30.0)
                .edgeBeamDepthCm(60.0));
        DdmResult r = engine.run(slab);

        double c = SectionProperties.torsionConstant(0.30, 0.60);
        double is = SectionProperties.rectangleInertia(6.0, 0.20);
        assertThat(r.getSpanCase()).isEqualTo(SpanCase.END_SPAN_EDGE_BEAM);
        assertThat(r.getBetaT()).isCloseTo(c / (2 * is), within(1e-9));
        assertThat(r.getMoments().getNegExterior().getColumnStripShare())
                .isCloseTo(1.0 - 0.25 * r.getBetaT() / 2.5, within(1e-12));
    }

    @Test
    void restrained_exterior_edge_uses_interior_coefficients() {
        DdmResult r = engine.run(prepare(defaults()
                .location(ColumnLocation.EDGE)
                .exteriorEdgeRestrained(true)));

        assertThat(r.getSpanCase()).isEqualTo(SpanCase.END_SPAN_RESTRAINED);
        assertThat(r.getMoments().getNegExterior().getCoefficient()).isEqualTo(0.65);
        assertThat(r.getMoments().getNegExterior().getColumnStripShare()).isEqualTo(0.75);
    }

    @Test
    void column_strip_width_depends_on_transverse_spans() {
        DdmResult interior = engine.run(prepare(defaults()));
        DdmResult corner = engine.run(prepare(defaults().location(ColumnLocation.CORNER)));

        assertThat(interior.getColumnStripWidth()).isEqualTo(3.0);
        assertThat(interior.getMiddleStripWidth()).isEqualTo(3.0);
        assertThat(corner.getColumnStripWidth()).isEqualTo(1.5);
        assertThat(corner.getMiddleStripWidth()).isEqualTo(1.5);
    }

    @Test
    void default_slab_designs_all_six_sections() {
        DdmResult r = engine.run(prepare(defaults()));

        assertThat(r.getRebarSections()).hasSize(6);
        assertThat(r.getRebarSections()).noneMatch(s -> s.getStatus() == RebarStatus.FAIL);
        assertThat(r.getShearChecks()).hasSize(1);
        assertThat(r.isShearOk()).isTrue();
        assertThat(r.getWarnings()).isEmpty();
    }

    @Test
    void drop_panel_thickens_negative_column_strip_and_adds_second_shear_section() {
        DdmResult r = engine.run(prepare(defaults()
                .dropPanel(true)
                .dropDepthCm(10.0)
                .dropWidth1M(2.0)
                .dropWidth2M(2.0)));

        RebarSection negCs = r.getRebarSections().stream()
                .filter(s -> s.getLocation().isNegative() && s.getStrip() == StripType.COLUMN_STRIP)
                .findFirst().orElseThrow();
        RebarSection posCs = r.getRebarSections().stream()
                .filter(s -> !s.getLocation().isNegative() && s.getStrip() == StripType.COLUMN_STRIP)
                .findFirst().orElseThrow();

        assertThat(negCs.getThickness()).isCloseTo(0.30, within(1e-12));
        assertThat(posCs.getThickness()).isCloseTo(0.20, within(1e-12));
        assertThat(r.getShearChecks()).extracting(ShearCheckResult::getSection)
                .containsExactly(ShearSection.COLUMN_FACE, ShearSection.DROP_PANEL_FACE);
    }

    @Test
    void failures_are_reported_as_warnings_without_stopping() {
        DdmResult r = engine.run(prepare(defaults()
                .slabThicknessCm(12.0)
                .columnC1Cm(25.0)
                .columnC2Cm(25.0)
                .l1LeftM(9.0)
                .l1RightM(9.0)
                .l2TopM(9.0)
                .l2BottomM(9.0)
                .liveLoadKgM2(1000.0)));

        assertThat(r.getRebarSections()).hasSize(6);
        assertThat(r.isShearOk()).isFalse();
        assertThat(r.getWarnings()).anyMatch(w -> w.startsWith("Punching shear FAIL"));
        assertThat(r.getWarnings()).anyMatch(w -> w.startsWith("Flexure FAIL"));
    }
}
