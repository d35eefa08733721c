package by.greenmobile.flatslabcalc.service.design;

import by.greenmobile.flatslabcalc.entity.MomentLocation;
import org.springframework.stereotype.Component;

import static by.greenmobile.flatslabcalc.service.design.Interpolation.clamp;
import static by.greenmobile.flatslabcalc.service.design.Interpolation.lerp;

/**
 * Доля момента, которую берёт надколонная полоса (ACI 318, 8.10.5 / 8.10.6).
 *
 * Таблица для αf1·l2/l1 ≥ 1 (по l2/l1 = 0.5 / 1.0 / 2.0): 90 / 75 / 45 %.
 * - внутренний отрицательный: 75 % при αf1·l2/l1 = 0;
 * - положительный: 60 % при αf1·l2/l1 = 0;
 * - наружный отрицательный: 100 % при βt = 0; при βt ≥ 2.5 доля берётся по l2/l1:
 *   75 % при l2/l1 ≤ 1.0, линейно растёт до 90 % при l2/l1 = 2.0.
 *
 * Промежуточные значения - вложенная линейная интерполяция (сначала l2/l1 и α, затем βt),
 * с ограничением на обоих концах.
 */
@Component
public class ColumnStripDistributor {

    /** βt, начиная с которого контурная балка считается жёсткой на кручение. */
    public static final double BETA_T_LIMIT = 2.5;

    private static final double INTERIOR_NEG_FLAT = 0.75;
    private static final double POSITIVE_FLAT = 0.60;
    private static final double EXTERIOR_NEG_NO_BEAM = 1.00;
    private static final double EXTERIOR_NEG_STIFF_BEAM = 0.75;
    /** Доля наружного отрицательного при βt ≥ 2.5 и l2/l1 = 2.0. */
    public static final double EXTERIOR_NEG_STIFF_BEAM_WIDE = 0.90;

    /**
     * @param location место по длине пролёта
     * @param l2l1     отношение пролётов панели
     * @param alphaF1  относительная жёсткость балок по осям (0 для плоской плиты)
     * @param betaT    βt контурной балки (учитывается только для NEG_EXTERIOR)
     * @return доля в [0, 1]
     */
    public double percent(MomentLocation location, double l2l1, double alphaF1, double betaT) {
        double alphaL = clamp(alphaF1 * l2l1, 0.0, 1.0);
        double withBeams = beamRow(l2l1);

        double interiorNeg = lerp(alphaL, 0.0, INTERIOR_NEG_FLAT, 1.0, withBeams);

        return switch (location) {
            case NEG_INTERIOR -> interiorNeg;
            case POSITIVE -> lerp(alphaL, 0.0, POSITIVE_FLAT, 1.0, withBeams);
            case NEG_EXTERIOR -> lerp(betaT, 0.0, EXTERIOR_NEG_NO_BEAM, BETA_T_LIMIT,
                    lerp(alphaL, 0.0, stiffBeamTarget(l2l1), 1.0, withBeams));
        };
    }

    /** Наружный отрицательный при βt ≥ 2.5 без балок по осям. */
    private static double stiffBeamTarget(double l2l1) {
        return lerp(l2l1, 1.0, EXTERIOR_NEG_STIFF_BEAM, 2.0, EXTERIOR_NEG_STIFF_BEAM_WIDE);
    }

    /** Строка αf1·l2/l1 ≥ 1: 0.90 при l2/l1 ≤ 0.5, 0.75 при 1.0, 0.45 при ≥ 2.0. */
    private static double beamRow(double l2l1) {
        if (l2l1 <= 1.0) {
            return lerp(l2l1, 0.5, 0.90, 1.0, 0.75);
        }
        return lerp(l2l1, 1.0, 0.75, 2.0, 0.45);
    }
}
