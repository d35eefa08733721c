package by.greenmobile.flatslabcalc.service.design;

import by.greenmobile.flatslabcalc.entity.ColumnLocation;
import by.greenmobile.flatslabcalc.entity.ShearCheckResult;
import by.greenmobile.flatslabcalc.entity.ShearSection;
import by.greenmobile.flatslabcalc.entity.ShearStatus;
import org.junit.jupiter.api.Test;

import static by.greenmobile.flatslabcalc.SlabFixtures.DESIGN;
import static by.greenmobile.flatslabcalc.SlabFixtures.UNITS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PunchingShearCheckerTest {

    private final PunchingShearChecker checker = new PunchingShearChecker(DESIGN, UNITS);

    @Test
    void interior_column_uses_four_sided_perimeter() {
        ShearCheckResult r = checker.check(ShearSection.COLUMN_FACE, ColumnLocation.INTERIOR,
                0.5, 0.5, 0.17, 36.0, 13_650.0, 280.0);

        assertThat(r.getCriticalB1()).isCloseTo(0.67, within(1e-12));
        assertThat(r.getPerimeter()).isCloseTo(2.68, within(1e-12));
        assertThat(r.getAlphaS()).isEqualTo(40.0);

        // Для квадратной колонны управляет 1.06·√f'c
        double vc = UNITS.kscToPa(1.06 * Math.sqrt(280.0));
        assertThat(r.getVc()).isCloseTo(vc, within(1e-6));
        assertThat(r.getPhiVc()).isCloseTo(0.75 * vc * 2.68 * 0.17, within(1e-3));
        assertThat(r.getVu()).isCloseTo(13_650.0 * (36.0 - 0.67 * 0.67), within(1e-6));
        assertThat(r.getStatus()).isEqualTo(ShearStatus.PASS);
    }

    @Test
    void edge_and_corner_perimeters_lose_sides() {
        ShearCheckResult edge = checker.check(ShearSection.COLUMN_FACE, ColumnLocation.EDGE,
                0.5, 0.5, 0.2, 18.0, 10_000.0, 280.0);
        ShearCheckResult corner = checker.check(ShearSection.COLUMN_FACE, ColumnLocation.CORNER,
                0.5, 0.5, 0.2, 9.0, 10_000.0, 280.0);

        assertThat(edge.getPerimeter()).isCloseTo(2 * 0.6 + 0.7, within(1e-12));
        assertThat(edge.getAlphaS()).isEqualTo(30.0);
        assertThat(corner.getPerimeter()).isCloseTo(0.6 + 0.6, within(1e-12));
        assertThat(corner.getAlphaS()).isEqualTo(20.0);
    }

    @Test
    void elongated_column_is_governed_by_aspect_ratio() {
        ShearCheckResult r = checker.check(ShearSection.COLUMN_FACE, ColumnLocation.INTERIOR,
                1.5, 0.3, 0.2, 36.0, 10_000.0, 280.0);

        assertThat(r.getBeta()).isCloseTo(5.0, within(1e-12));
        double vc2 = 0.53 * (1.0 + 2.0 / 5.0) * Math.sqrt(280.0);
        assertThat(r.getVc()).isCloseTo(UNITS.kscToPa(vc2), within(1e-6));
    }

    @Test
    void overloaded_column_fails_with_ratio_above_one() {
        ShearCheckResult r = checker.check(ShearSection.COLUMN_FACE, ColumnLocation.INTERIOR,
                0.3, 0.3, 0.12, 64.0, 30_000.0, 210.0);

        assertThat(r.getStatus()).isEqualTo(ShearStatus.FAIL);
        assertThat(r.getRatio()).isGreaterThan(1.0);
    }

    @Test
    void critical_area_larger_than_tributary_gives_zero_shear() {
        ShearCheckResult r = checker.check(ShearSection.DROP_PANEL_FACE, ColumnLocation.INTERIOR,
                3.0, 3.0, 0.17, 4.0, 10_000.0, 280.0);

        assertThat(r.getVu()).isZero();
        assertThat(r.getStatus()).isEqualTo(ShearStatus.PASS);
    }
}
