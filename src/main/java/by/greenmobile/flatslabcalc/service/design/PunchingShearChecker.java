package by.greenmobile.flatslabcalc.service.design;

import by.greenmobile.flatslabcalc.config.DesignProperties;
import by.greenmobile.flatslabcalc.config.UnitsConfig;
import by.greenmobile.flatslabcalc.entity.ColumnLocation;
import by.greenmobile.flatslabcalc.entity.ShearCheckResult;
import by.greenmobile.flatslabcalc.entity.ShearSection;
import by.greenmobile.flatslabcalc.entity.ShearStatus;
import org.springframework.stereotype.Component;

/**
 * Продавливание (двусторонний срез) по критическому периметру на расстоянии d/2
 * от грани опоры (колонны или капители).
 *
 * Периметр:
 * - INTERIOR: 4 стороны, b1 = a1 + d, b2 = a2 + d, αs = 40
 * - EDGE:     3 стороны, b1 = a1 + d/2, b2 = a2 + d, αs = 30
 * - CORNER:   2 стороны, b1 = a1 + d/2, b2 = a2 + d/2, αs = 20
 *
 * vc = min(1.06√f'c, 0.53(1 + 2/β)√f'c, 0.265(αs·d/bo + 2)√f'c), f'c и vc в ksc;
 * φVc = φ·vc·bo·d.
 */
@Component
public class PunchingShearChecker {

    private final DesignProperties design;
    private final UnitsConfig units;

    public PunchingShearChecker(DesignProperties design, UnitsConfig units) {
        this.design = design;
        this.units = units;
    }

    /**
     * @param a1            размер опоры вдоль L1, м
     * @param a2            размер опоры вдоль L2, м
     * @param d             эффективная высота в сечении, м
     * @param tributaryArea грузовая площадь колонны, м²
     * @param wuPa          расчётная нагрузка, Па
     */
    public ShearCheckResult check(ShearSection section, ColumnLocation location,
                                  double a1, double a2, double d,
                                  double tributaryArea, double wuPa, double fcKsc) {
        double b1;
        double b2;
        double bo;
        double alphaS;
        switch (location) {
            case INTERIOR -> {
                b1 = a1 + d;
                b2 = a2 + d;
                bo = 2.0 * (b1 + b2);
                alphaS = 40.0;
            }
            case EDGE -> {
                b1 = a1 + d / 2.0;
                b2 = a2 + d;
                bo = 2.0 * b1 + b2;
                alphaS = 30.0;
            }
            case CORNER -> {
                b1 = a1 + d / 2.0;
                b2 = a2 + d / 2.0;
                bo = b1 + b2;
                alphaS = 20.0;
            }
            default -> throw new IllegalArgumentException("Unknown column location: " + location);
        }

        double beta = Math.max(a1, a2) / Math.min(a1, a2);
        double sqrtFc = Math.sqrt(fcKsc);

        double vc1 = 1.06 * sqrtFc;
        double vc2 = 0.53 * (1.0 + 2.0 / beta) * sqrtFc;
        double vc3 = 0.265 * (alphaS * d / bo + 2.0) * sqrtFc;
        double vcPa = units.kscToPa(Math.min(vc1, Math.min(vc2, vc3)));

        double phiVc = design.getPhiShear() * vcPa * bo * d;
        double vu = wuPa * Math.max(0.0, tributaryArea - b1 * b2);
        double ratio = phiVc > 0 ? vu / phiVc : 0.0;
        ShearStatus status = (phiVc > 0 && vu <= phiVc) ? ShearStatus.PASS : ShearStatus.FAIL;

        return ShearCheckResult.builder()
                .section(section)
                .criticalB1(b1)
                .criticalB2(b2)
                .perimeter(bo)
                .effectiveDepth(d)
                .beta(beta)
                .alphaS(alphaS)
                .vc(vcPa)
                .vu(vu)
                .phiVc(phiVc)
                .ratio(ratio)
                .status(status)
                .build();
    }
}
