package by.greenmobile.flatslabcalc.service.design;

import by.greenmobile.flatslabcalc.entity.Materials;
import by.greenmobile.flatslabcalc.entity.MomentLocation;
import by.greenmobile.flatslabcalc.entity.RebarSection;
import by.greenmobile.flatslabcalc.entity.RebarStatus;
import by.greenmobile.flatslabcalc.entity.SteelGrade;
import by.greenmobile.flatslabcalc.entity.StripType;
import org.junit.jupiter.api.Test;

import static by.greenmobile.flatslabcalc.SlabFixtures.DESIGN;
import static by.greenmobile.flatslabcalc.SlabFixtures.defaults;
import static by.greenmobile.flatslabcalc.SlabFixtures.prepare;
import static org.assertj.core.api.Assertions.assertThat;

class FlexuralDesignerTest {

    private final FlexuralDesigner designer = new FlexuralDesigner(DESIGN);
    private final Materials sd40 = prepare(defaults()).getMaterials();

    @Test
    void required_steel_grows_with_moment() {
        double previous = 0.0;
        for (double mu = 40_000; mu <= 200_000; mu += 40_000) {
            RebarSection s = designer.design(MomentLocation.NEG_INTERIOR, StripType.COLUMN_STRIP, mu, 1.0, 0.20, sd40);
            assertThat(s.getStatus()).isNotEqualTo(RebarStatus.FAIL);
            assertThat(s.getAsRequired()).isGreaterThanOrEqualTo(previous);
            previous = s.getAsRequired();
        }
    }

    @Test
    void negative_moment_is_designed_by_magnitude() {
        RebarSection pos = designer.design(MomentLocation.POSITIVE, StripType.MIDDLE_STRIP, 80_000, 1.0, 0.20, sd40);
        RebarSection neg = designer.design(MomentLocation.POSITIVE, StripType.MIDDLE_STRIP, -80_000, 1.0, 0.20, sd40);

        assertThat(neg.getAsRequired()).isEqualTo(pos.getAsRequired());
    }

    @Test
    void minimum_steel_controls_small_moment_exactly() {
        RebarSection s = designer.design(MomentLocation.POSITIVE, StripType.MIDDLE_STRIP, 1_000, 1.0, 0.20, sd40);

        assertThat(s.getStatus()).isEqualTo(RebarStatus.MIN_STEEL);
        assertThat(s.getAsRequired()).isEqualTo(0.0018 * 1.0 * 0.20);
        assertThat(s.getSuggestion()).isEqualTo("4-DB12 @ 25.0 cm");
    }

    @Test
    void low_grade_steel_uses_higher_minimum_ratio() {
        Materials sd30 = prepare(defaults().steelGrade(SteelGrade.SD30)).getMaterials();

        assertThat(designer.rhoMin(sd30)).isEqualTo(0.0020);
        assertThat(designer.rhoMin(sd40)).isEqualTo(0.0018);
    }

    @Test
    void section_too_thin_fails_with_zero_steel() {
        // Rn ≈ 12 МПа > 0.35·f'c ≈ 9.6 МПа
        RebarSection s = designer.design(MomentLocation.NEG_INTERIOR, StripType.COLUMN_STRIP, 312_000, 1.0, 0.20, sd40);

        assertThat(s.getStatus()).isEqualTo(RebarStatus.FAIL);
        assertThat(s.getAsRequired()).isZero();
        assertThat(s.getSuggestion()).isEqualTo("-");
        assertThat(s.getFailureReason()).contains("section too thin");
    }

    @Test
    void zero_width_strip_fails() {
        RebarSection s = designer.design(MomentLocation.POSITIVE, StripType.MIDDLE_STRIP, 10_000, 0.0, 0.20, sd40);

        assertThat(s.getStatus()).isEqualTo(RebarStatus.FAIL);
        assertThat(s.getFailureReason()).isEqualTo("strip width is zero");
    }

    @Test
    void bar_spacing_never_exceeds_limit() {
        RebarSection s = designer.design(MomentLocation.POSITIVE, StripType.MIDDLE_STRIP, 1_000, 3.0, 0.15, sd40);

        // 2h = 30 см управляет раньше 45 см
        assertThat(s.getBarSpacing()).isLessThanOrEqualTo(0.30);
        assertThat(s.getBarCount()).isEqualTo(10);
    }
}
