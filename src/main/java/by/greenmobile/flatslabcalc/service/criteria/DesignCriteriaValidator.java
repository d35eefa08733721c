package by.greenmobile.flatslabcalc.service.criteria;

import by.greenmobile.flatslabcalc.config.UnitsConfig;
import by.greenmobile.flatslabcalc.entity.CriteriaReport;
import by.greenmobile.flatslabcalc.entity.CriterionResult;
import by.greenmobile.flatslabcalc.entity.DdmApplicability;
import by.greenmobile.flatslabcalc.entity.Geometry;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.PanelCase;
import by.greenmobile.flatslabcalc.entity.ThicknessCheck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Проверки ACI 318: минимальная толщина, размеры капители, применимость DDM.
 *
 * Ничего не выбрасывает: каждая проверка возвращает вердикт и числа, по которым он получен.
 * Равенство границе считается выполнением (допуск TOLERANCE).
 */
@Service
@Slf4j
public class DesignCriteriaValidator {

    static final double TOLERANCE = 1e-9;

    private static final double MAX_PANEL_RATIO = 2.0;
    private static final double MAX_LIVE_DEAD_RATIO = 2.0;
    private static final double MAX_SPAN_DIFFERENCE = 1.0 / 3.0;

    private final UnitsConfig units;

    public DesignCriteriaValidator(UnitsConfig units) {
        this.units = units;
    }

    public CriteriaReport validate(NormalizedSlab slab) {
        ThicknessCheck thickness = checkMinThickness(slab);
        List<CriterionResult> drop = checkDropPanel(slab);
        DdmApplicability ddm = checkDdm(slab);

        log.info("CRITERIA: thickness={} (req {} cm) dropChecks={} ddmApplicable={}",
                thickness.isPassed(), thickness.getRequiredCm(), drop.size(), ddm.isApplicable());
        if (!ddm.isApplicable()) {
            log.warn("CRITERIA: DDM не применим: {}", ddm.getReasons());
        }
        return new CriteriaReport(thickness, drop, ddm, true);
    }

    /**
     * ACI 318 Table 8.3.1.1: h_min = Ln·(0.8 + fy/1400) / знаменатель,
     * но не менее 12.5 см (без капители) / 10 см (с капителью).
     */
    public ThicknessCheck checkMinThickness(NormalizedSlab slab) {
        Geometry g = slab.getGeometry();
        PanelCase panel = slab.getPanelCase();
        boolean exterior = panel.getLocation().isExterior();
        boolean drop = g.isDropPanel();

        double denominator;
        String caseName;
        if (!exterior) {
            denominator = drop ? 36.0 : 33.0;
            caseName = "Interior panel";
        } else if (panel.isEdgeBeam()) {
            denominator = drop ? 36.0 : 33.0;
            caseName = "Exterior panel with edge beam";
        } else {
            denominator = drop ? 33.0 : 30.0;
            caseName = "Exterior panel without edge beam";
        }
        caseName += drop ? ", with drop panel" : ", without drop panel";

        double ln = Math.max(g.getL1() - g.getC1(), g.getL2() - g.getC2());
        double fyFactor = 0.8 + slab.getMaterials().getFyNominalMpa() / 1400.0;
        double computedCm = toCm(ln * fyFactor / denominator);
        double absMinCm = drop ? 10.0 : 12.5;
        double requiredCm = Math.max(computedCm, absMinCm);
        double providedCm = toCm(g.getSlabThickness());

        return ThicknessCheck.builder()
                .passed(providedCm + TOLERANCE >= requiredCm)
                .providedCm(providedCm)
                .requiredCm(requiredCm)
                .computedCm(computedCm)
                .absoluteMinCm(absMinCm)
                .denominator(denominator)
                .clearSpan(ln)
                .caseName(caseName)
                .build();
    }

    /**
     * Капитель: выступ ≥ h/4; размер в каждом направлении ≥ L/3 (L - больший из пролётов),
     * у края плиты ≥ L/3 + c/2.
     */
    public List<CriterionResult> checkDropPanel(NormalizedSlab slab) {
        Geometry g = slab.getGeometry();
        List<CriterionResult> out = new ArrayList<>();
        if (!g.isDropPanel()) {
            return out;
        }

        double reqDepth = g.getSlabThickness() / 4.0;
        out.add(atLeast("Drop depth", g.getDropDepth(), reqDepth,
                "%s %.3f m %s h/4 = %.3f m"));

        double reqW1 = requiredDropWidth(g.getL1(), g.getC1(), g.hasBothL1Spans());
        out.add(atLeast("Drop width W1", g.getDropWidth1(), reqW1,
                g.hasBothL1Spans() ? "%s %.3f m %s L1/3 = %.3f m" : "%s %.3f m %s L1/3 + c1/2 = %.3f m"));

        double reqW2 = requiredDropWidth(g.getL2(), g.getC2(), g.hasBothL2Spans());
        out.add(atLeast("Drop width W2", g.getDropWidth2(), reqW2,
                g.hasBothL2Spans() ? "%s %.3f m %s L2/3 = %.3f m" : "%s %.3f m %s L2/3 + c2/2 = %.3f m"));

        return out;
    }

    private static double requiredDropWidth(double span, double column, boolean bothSides) {
        return bothSides ? span / 3.0 : span / 3.0 + column / 2.0;
    }

    /**
     * Условия применимости DDM. Все критерии вычисляются всегда, провал одного не скрывает остальные.
     * Разница соседних пролётов проверяется только если есть оба пролёта.
     */
    public DdmApplicability checkDdm(NormalizedSlab slab) {
        Geometry g = slab.getGeometry();
        List<CriterionResult> criteria = new ArrayList<>();

        double longSide = Math.max(g.getL1(), g.getL2());
        double shortSide = Math.min(g.getL1(), g.getL2());
        double ratio = longSide / shortSide;
        criteria.add(atMost("Panel ratio", ratio, MAX_PANEL_RATIO, "%s long/short %.2f %s %.2f"));

        double loadRatio = slab.getLoads().getLiveToDeadRatio();
        criteria.add(atMost("Load ratio", loadRatio, MAX_LIVE_DEAD_RATIO, "%s LL/DL %.2f %s %.2f"));

        if (g.hasBothL1Spans()) {
            criteria.add(spanDifference("L1 successive spans", g.getL1Left(), g.getL1Right()));
        }
        if (g.hasBothL2Spans()) {
            criteria.add(spanDifference("L2 successive spans", g.getL2Top(), g.getL2Bottom()));
        }

        return DdmApplicability.of(criteria);
    }

    private CriterionResult spanDifference(String name, double a, double b) {
        double diff = Math.abs(a - b) / Math.max(a, b);
        return atMost(name, diff, MAX_SPAN_DIFFERENCE, "%s difference %.3f %s %.3f of the longer span");
    }

    private static CriterionResult atLeast(String name, double provided, double required, String pattern) {
        boolean ok = provided + TOLERANCE >= required;
        String msg = String.format(Locale.US, pattern, name, provided, ok ? ">=" : "<", required);
        return new CriterionResult(name, ok, provided, required, msg);
    }

    private static CriterionResult atMost(String name, double value, double limit, String pattern) {
        boolean ok = value <= limit + TOLERANCE;
        String msg = String.format(Locale.US, pattern, name, value, ok ? "<=" : ">", limit);
        return new CriterionResult(name, ok, value, limit, msg);
    }

    private double toCm(double meters) {
        return meters / units.getCmToM();
    }
}
