package by.greenmobile.flatslabcalc.service.design;

import by.greenmobile.flatslabcalc.config.DesignProperties;
import by.greenmobile.flatslabcalc.entity.Materials;
import by.greenmobile.flatslabcalc.entity.MomentLocation;
import by.greenmobile.flatslabcalc.entity.RebarSection;
import by.greenmobile.flatslabcalc.entity.RebarStatus;
import by.greenmobile.flatslabcalc.entity.StripType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Подбор арматуры полосы на момент Mu (прямоугольное сечение, одиночное армирование).
 *
 * 1) Rn = Mu / (φ·b·d²)
 * 2) Rn > 0.35·f'c  -> FAIL (сечение слишком тонкое), As = 0
 * 3) ρ = (0.85·f'c/fy)·(1 − √(1 − 2·Rn/(0.85·f'c))), отрицательный дискриминант -> FAIL
 * 4) As = max(ρ·b·d, ρmin·b·h), если управляет минимум -> MIN_STEEL
 * 5) шаг стержней не больше min(2h, 45 см)
 *
 * Все величины в Н, м, Па.
 */
@Component
@Slf4j
public class FlexuralDesigner {

    private final DesignProperties design;

    public FlexuralDesigner(DesignProperties design) {
        this.design = design;
    }

    public RebarSection design(MomentLocation location, StripType strip,
                               double mu, double width, double thickness, Materials materials) {
        double d = thickness - design.getCover();
        double rhoMin = rhoMin(materials);
        double asMin = rhoMin * width * thickness;

        RebarSection.RebarSectionBuilder b = RebarSection.builder()
                .location(location)
                .strip(strip)
                .designMoment(mu)
                .width(width)
                .thickness(thickness)
                .effectiveDepth(d)
                .asMin(Math.max(0.0, asMin));

        if (width <= 0) {
            return failed(b, "strip width is zero");
        }
        if (d <= 0) {
            return failed(b, "effective depth <= 0 (thickness not greater than cover)");
        }

        FlexureSolution sol = solveRho(mu, width, d, materials.getFcPa(), materials.getFyPa());
        b.rn(sol.getRn());
        if (!sol.isOk()) {
            log.debug("FLEXURE: {} / {} -> FAIL ({}), Mu={} b={} d={}", location, strip, sol.getReason(), mu, width, d);
            return failed(b, sol.getReason());
        }

        double asCalc = sol.getRho() * width * d;
        RebarStatus status;
        double as;
        if (asCalc < asMin) {
            status = RebarStatus.MIN_STEEL;
            as = asMin;
        } else {
            status = RebarStatus.OK;
            as = asCalc;
        }

        b.rho(sol.getRho()).asRequired(as).status(status);
        suggestBars(b, as, width, thickness);
        return b.build();
    }

    /**
     * Решение для ρ. Mu берётся по модулю (знак момента задаёт только грань).
     */
    public FlexureSolution solveRho(double mu, double b, double d, double fc, double fy) {
        double rn = Math.abs(mu) / (design.getPhiFlexure() * b * d * d);

        if (rn > design.getRnCeilingRatio() * fc) {
            return FlexureSolution.fail(String.format(Locale.US,
                    "Rn = %.3f MPa exceeds %.2f f'c: section too thin", rn / 1e6, design.getRnCeilingRatio()), rn);
        }

        double radicand = 1.0 - 2.0 * rn / (0.85 * fc);
        if (radicand < 0) {
            return FlexureSolution.fail("no real solution for rho (negative radicand)", rn);
        }

        double rho = (0.85 * fc / fy) * (1.0 - Math.sqrt(radicand));
        return FlexureSolution.ok(rho, rn);
    }

    /** 0.0020 для стали ниже 400 МПа, иначе 0.0018. */
    public double rhoMin(Materials materials) {
        return materials.getFyNominalMpa() < 400.0 ? design.getRhoMinLowGrade() : design.getRhoMin();
    }

    private void suggestBars(RebarSection.RebarSectionBuilder b, double as, double width, double thickness) {
        double barArea = design.barAreaM2();
        double maxSpacing = Math.min(2.0 * thickness, design.getMaxBarSpacing());

        int count = (int) Math.ceil(as / barArea);
        double spacing = width / Math.max(1, count);
        if (spacing > maxSpacing) {
            spacing = maxSpacing;
            count = (int) Math.ceil(width / maxSpacing - 1e-9);
        }

        // Шаг вниз до 0.5 см
        double rounded = Math.floor(spacing * 200.0) / 200.0;
        if (rounded > 0) {
            spacing = rounded;
        }

        b.barCount(count)
                .barSpacing(spacing)
                .suggestion(String.format(Locale.US, "%d-%s @ %.1f cm", count, design.barLabel(), spacing * 100.0));
    }

    private static RebarSection failed(RebarSection.RebarSectionBuilder b, String reason) {
        return b.rho(0.0)
                .asRequired(0.0)
                .status(RebarStatus.FAIL)
                .failureReason(reason)
                .barCount(0)
                .barSpacing(0.0)
                .suggestion("-")
                .build();
    }
}
