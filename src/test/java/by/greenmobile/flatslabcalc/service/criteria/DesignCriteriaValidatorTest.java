package by.greenmobile.flatslabcalc.service.criteria;

import by.greenmobile.flatslabcalc.entity.ColumnLocation;
import by.greenmobile.flatslabcalc.entity.CriteriaReport;
import by.greenmobile.flatslabcalc.entity.CriterionResult;
import by.greenmobile.flatslabcalc.entity.DdmApplicability;
import by.greenmobile.flatslabcalc.entity.SlabInput;
import by.greenmobile.flatslabcalc.entity.ThicknessCheck;
import org.junit.jupiter.api.Test;

import java.util.List;

import static by.greenmobile.flatslabcalc.SlabFixtures.UNITS;
import static by.greenmobile.flatslabcalc.SlabFixtures.defaults;
import static by.greenmobile.flatslabcalc.SlabFixtures.prepare;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DesignCriteriaValidatorTest {

    private final DesignCriteriaValidator validator = new DesignCriteriaValidator(UNITS);

    @Test
    void interior_flat_plate_thickness() {
        ThicknessCheck t = validator.checkMinThickness(prepare(defaults()));

        assertThat(t.getDenominator()).isEqualTo(33.0);
        assertThat(t.getClearSpan()).isCloseTo(5.5, within(1e-12));
        assertThat(t.getComputedCm()).isCloseTo(550.0 * (0.8 + 400.0 / 1400.0) / 33.0, within(1e-9));
        assertThat(t.isPassed()).isTrue();
    }

    @Test
    void exterior_panel_without_edge_beam_needs_thicker_slab() {
        ThicknessCheck ok = validator.checkMinThickness(prepare(defaults().location(ColumnLocation.EDGE)));
        ThicknessCheck thin = validator.checkMinThickness(prepare(defaults()
                .location(ColumnLocation.EDGE)
                .slabThicknessCm(19.0)));

        assertThat(ok.getDenominator()).isEqualTo(30.0);
        assertThat(ok.isPassed()).isTrue();
        assertThat(thin.isPassed()).isFalse();
        assertThat(thin.getCaseName()).startsWith("Exterior panel without edge beam");
    }

    @Test
    void drop_panel_relaxes_thickness_limits() {
        ThicknessCheck t = validator.checkMinThickness(prepare(withDrop(2.0, 2.0, 5.0)));

        assertThat(t.getDenominator()).isEqualTo(36.0);
        assertThat(t.getAbsoluteMinCm()).isEqualTo(10.0);
    }

    @Test
    void short_spans_are_governed_by_absolute_minimum() {
        ThicknessCheck t = validator.checkMinThickness(prepare(defaults()
                .l1LeftM(3.0).l1RightM(3.0).l2TopM(3.0).l2BottomM(3.0)
                .slabThicknessCm(12.0)));

        assertThat(t.getComputedCm()).isLessThan(12.5);
        assertThat(t.getRequiredCm()).isEqualTo(12.5);
        assertThat(t.isPassed()).isFalse();
    }

    @Test
    void drop_panel_exactly_at_limits_passes() {
        // W = (6 + 6)/6 = 2.0 м, выступ = h/4 = 5 см
        List<CriterionResult> drop = validator.checkDropPanel(prepare(withDrop(2.0, 2.0, 5.0)));

        assertThat(drop).hasSize(3).allMatch(CriterionResult::isPassed);
    }

    @Test
    void drop_panel_below_limits_fails() {
        List<CriterionResult> drop = validator.checkDropPanel(prepare(withDrop(1.99, 2.0, 4.0)));

        assertThat(drop).filteredOn(c -> !c.isPassed())
                .extracting(CriterionResult::getName)
                .containsExactly("Drop depth", "Drop width W1");
    }

    @Test
    void drop_panel_at_edge_needs_third_of_span_plus_half_column() {
        // L1 = 6 м, c1 = 50 см: W1 ≥ 6/3 + 0.25 = 2.25 м
        List<CriterionResult> atLimit = validator.checkDropPanel(prepare(withDrop(2.25, 2.0, 5.0)
                .location(ColumnLocation.EDGE)));
        List<CriterionResult> narrow = validator.checkDropPanel(prepare(withDrop(2.0, 2.0, 5.0)
                .location(ColumnLocation.EDGE)));

        assertThat(atLimit.get(1).getLimit()).isCloseTo(6.0 / 3.0 + 0.25, within(1e-12));
        assertThat(atLimit).allMatch(CriterionResult::isPassed);
        assertThat(narrow.get(1).isPassed()).isFalse();
    }

    @Test
    void drop_panel_between_unequal_spans_follows_longer_span() {
        List<CriterionResult> drop = validator.checkDropPanel(prepare(withDrop(1.8, 2.0, 5.0)
                .l1LeftM(6.0).l1RightM(4.5)));

        assertThat(drop.get(1).getLimit()).isCloseTo(2.0, within(1e-12));
        assertThat(drop.get(1).isPassed()).isFalse();
    }

    @Test
    void no_drop_panel_means_no_drop_checks() {
        assertThat(validator.checkDropPanel(prepare(defaults()))).isEmpty();
    }

    @Test
    void ddm_is_applicable_for_regular_panel() {
        DdmApplicability ddm = validator.checkDdm(prepare(defaults()));

        assertThat(ddm.isApplicable()).isTrue();
        assertThat(ddm.getCriteria()).hasSize(4);
        assertThat(ddm.getReasons()).isEmpty();
    }

    @Test
    void panel_ratio_boundary() {
        DdmApplicability atLimit = validator.checkDdm(prepare(defaults().l2TopM(12.0).l2BottomM(12.0)));
        DdmApplicability over = validator.checkDdm(prepare(defaults().l2TopM(13.0).l2BottomM(13.0)));

        assertThat(atLimit.isApplicable()).isTrue();
        assertThat(over.isApplicable()).isFalse();
        assertThat(over.getReasons()).singleElement().asString().startsWith("Panel ratio");
    }

    @Test
    void heavy_live_load_makes_ddm_inapplicable() {
        DdmApplicability ddm = validator.checkDdm(prepare(defaults()
                .autoSelfWeight(false)
                .superimposedDeadKgM2(100.0)
                .liveLoadKgM2(250.0)));

        assertThat(ddm.isApplicable()).isFalse();
        assertThat(ddm.getReasons()).anyMatch(r -> r.startsWith("Load ratio"));
    }

    @Test
    void successive_span_difference_of_one_third_passes() {
        DdmApplicability atLimit = validator.checkDdm(prepare(defaults().l1LeftM(6.0).l1RightM(4.0)));
        DdmApplicability over = validator.checkDdm(prepare(defaults().l1LeftM(6.0).l1RightM(3.9)));

        assertThat(atLimit.isApplicable()).isTrue();
        assertThat(over.isApplicable()).isFalse();
    }

    @Test
    void edge_column_skips_l1_successive_span_check() {
        DdmApplicability ddm = validator.checkDdm(prepare(defaults().location(ColumnLocation.EDGE)));

        assertThat(ddm.getCriteria()).extracting(CriterionResult::getName)
                .containsExactly("Panel ratio", "Load ratio", "L2 successive spans");
    }

    @Test
    void validate_collects_warnings_from_every_check() {
        CriteriaReport report = validator.validate(prepare(withDrop(1.4, 2.0, 5.0)
                .slabThicknessCm(20.0)
                .l1LeftM(6.0).l1RightM(3.0)));

        assertThat(report.isEfmApplicable()).isTrue();
        assertThat(report.getDdm().isApplicable()).isFalse();
        assertThat(report.getWarnings())
                .anyMatch(w -> w.startsWith("Drop width W1"))
                .anyMatch(w -> w.startsWith("DDM is not applicable"))
                .anyMatch(w -> w.startsWith("L1 successive spans"));
    }

    private static SlabInput.SlabInputBuilder withDrop(double w1, double w2, double depthCm) {
        return defaults()
                .dropPanel(true)
                .dropDepthCm(depthCm)
                .dropWidth1M(w1)
                .dropWidth2M(w2);
    }
}
