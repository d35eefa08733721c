package by.greenmobile.flatslabcalc.service.engine;

import by.greenmobile.flatslabcalc.config.DesignProperties;
import by.greenmobile.flatslabcalc.entity.DdmResult;
import by.greenmobile.flatslabcalc.entity.Geometry;
import by.greenmobile.flatslabcalc.entity.Loads;
import by.greenmobile.flatslabcalc.entity.Materials;
import by.greenmobile.flatslabcalc.entity.MomentComponent;
import by.greenmobile.flatslabcalc.entity.MomentLocation;
import by.greenmobile.flatslabcalc.entity.MomentSet;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.PanelCase;
import by.greenmobile.flatslabcalc.entity.RebarSection;
import by.greenmobile.flatslabcalc.entity.RebarStatus;
import by.greenmobile.flatslabcalc.entity.ShearCheckResult;
import by.greenmobile.flatslabcalc.entity.ShearSection;
import by.greenmobile.flatslabcalc.entity.ShearStatus;
import by.greenmobile.flatslabcalc.entity.SpanCase;
import by.greenmobile.flatslabcalc.entity.StripType;
import by.greenmobile.flatslabcalc.service.design.ColumnStripDistributor;
import by.greenmobile.flatslabcalc.service.design.FlexuralDesigner;
import by.greenmobile.flatslabcalc.service.design.PunchingShearChecker;
import by.greenmobile.flatslabcalc.service.design.SectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Direct Design Method (ACI 318, 8.10).
 *
 * Порядок:
 * 1) Ln = max(L1 − c1, 0.65·L1), Mo = wu·L2·Ln²/8 (L2 = ширина рамы)
 * 2) продольные коэффициенты по случаю пролёта
 * 3) доли надколонной полосы (βt контурной балки для наружного отрицательного)
 * 4) армирование 3 мест × 2 полосы
 * 5) продавливание у колонны и, при наличии, у капители
 *
 * Ни одна «неудача» не прерывает расчёт: FAIL остаётся значением, плюс строка в warnings.
 */
@Component
@Slf4j
public class DdmEngine {

    /** Плоская плита: балок по осям колонн нет. */
    private static final double FLAT_PLATE_ALPHA = 0.0;

    private static final double MIN_CLEAR_SPAN_RATIO = 0.65;

    private final ColumnStripDistributor distributor;
    private final FlexuralDesigner flexure;
    private final PunchingShearChecker shear;
    private final DesignProperties design;

    public DdmEngine(ColumnStripDistributor distributor,
                     FlexuralDesigner flexure,
                     PunchingShearChecker shear,
                     DesignProperties design) {
        this.distributor = distributor;
        this.flexure = flexure;
        this.shear = shear;
        this.design = design;
    }

    public DdmResult run(NormalizedSlab slab) {
        Geometry g = slab.getGeometry();
        Loads loads = slab.getLoads();
        Materials mat = slab.getMaterials();
        PanelCase panel = slab.getPanelCase();

        DdmResult.DdmResultBuilder out = DdmResult.builder();

        // 1) Чистый пролёт и статический момент
        double l1 = g.getL1();
        double lnActual = g.getClearSpan();
        double lnFloor = MIN_CLEAR_SPAN_RATIO * l1;
        double ln = Math.max(lnActual, lnFloor);
        if (lnActual < lnFloor) {
            out.note(String.format(Locale.US,
                    "Clear span %.3f m < 0.65·L1 = %.3f m: 0.65·L1 used for Mo", lnActual, lnFloor));
        }

        double l2 = g.getL2Tributary();
        double wu = loads.getWuPa();
        double mo = wu * l2 * ln * ln / 8.0;

        // 2) Продольное распределение
        SpanCase spanCase = panel.getSpanCase();

        // 3) Поперечное распределение
        double betaT = torsionalStiffnessRatio(slab);
        double l2l1 = g.getL2() / l1;
        double negIntShare = distributor.percent(MomentLocation.NEG_INTERIOR, l2l1, FLAT_PLATE_ALPHA, 0.0);
        double posShare = distributor.percent(MomentLocation.POSITIVE, l2l1, FLAT_PLATE_ALPHA, 0.0);
        double negExtShare = spanCase.isSymmetric()
                ? negIntShare
                : distributor.percent(MomentLocation.NEG_EXTERIOR, l2l1, FLAT_PLATE_ALPHA, betaT);

        MomentSet moments = new MomentSet(mo,
                component(MomentLocation.NEG_EXTERIOR, spanCase, mo, negExtShare),
                component(MomentLocation.POSITIVE, spanCase, mo, posShare),
                component(MomentLocation.NEG_INTERIOR, spanCase, mo, negIntShare));

        // 4) Армирование по полосам
        double csWidth = columnStripWidth(g);
        double msWidth = Math.max(0.0, l2 - csWidth);

        int failed = 0;
        for (MomentComponent c : moments.getComponents()) {
            for (StripType strip : StripType.values()) {
                double width = strip == StripType.COLUMN_STRIP ? csWidth : msWidth;
                double mu = c.forStrip(strip);
                if (width <= 0 && mu == 0.0) {
                    out.note(c.getLocation().getLabel() + " / " + strip.getLabel() + ": no strip width, no moment");
                    continue;
                }
                double h = (strip == StripType.COLUMN_STRIP && c.getLocation().isNegative() && g.isDropPanel())
                        ? g.getDropThickness()
                        : g.getSlabThickness();

                RebarSection section = flexure.design(c.getLocation(), strip, mu, width, h, mat);
                out.rebarSection(section);
                if (section.getStatus() == RebarStatus.FAIL) {
                    failed++;
                    out.warning(String.format(Locale.US, "Flexure FAIL at %s / %s: %s (Mu = %.1f kN·m)",
                            c.getLocation().getLabel(), strip.getLabel(), section.getFailureReason(), mu / 1000.0));
                }
            }
        }

        // 5) Продавливание
        double cover = design.getCover();
        double dColumn = (g.isDropPanel() ? g.getDropThickness() : g.getSlabThickness()) - cover;
        double area = g.getTributaryArea();
        ShearCheckResult atColumn = shear.check(ShearSection.COLUMN_FACE, panel.getLocation(),
                g.getC1(), g.getC2(), dColumn, area, wu, mat.getFcKsc());
        out.shearCheck(atColumn);
        warnIfFailed(out, atColumn);

        if (g.isDropPanel()) {
            double dSlab = g.getSlabThickness() - cover;
            ShearCheckResult atDrop = shear.check(ShearSection.DROP_PANEL_FACE, panel.getLocation(),
                    g.getDropWidth1(), g.getDropWidth2(), dSlab, area, wu, mat.getFcKsc());
            out.shearCheck(atDrop);
            warnIfFailed(out, atDrop);
        }

        DdmResult result = out
                .spanCase(spanCase)
                .clearSpanActual(lnActual)
                .clearSpanUsed(ln)
                .wuPa(wu)
                .l2Tributary(l2)
                .betaT(betaT)
                .columnStripWidth(csWidth)
                .middleStripWidth(msWidth)
                .moments(moments)
                .build();

        log.info("DDM: case={} Ln={} (actual {}) Mo={} N·m betaT={} csShare[ext/pos/int]={}/{}/{} flexFail={} shearOk={}",
                spanCase, ln, lnActual, mo, betaT, negExtShare, posShare, negIntShare, failed, result.isShearOk());
        return result;
    }

    /**
     * βt = C / (2·Is): только для крайнего пролёта с контурной балкой, иначе 0.
     * C - по сечению балки, Is = L2·h³/12 (L2 = ширина рамы).
     */
    public double torsionalStiffnessRatio(NormalizedSlab slab) {
        PanelCase panel = slab.getPanelCase();
        if (!panel.isEndSpan() || !panel.isEdgeBeam()) {
            return 0.0;
        }
        Geometry g = slab.getGeometry();
        double c = SectionProperties.torsionConstant(panel.getEdgeBeamWidth(), panel.getEdgeBeamDepth());
        double is = SectionProperties.rectangleInertia(g.getL2Tributary(), g.getSlabThickness());
        return is > 0 ? c / (2.0 * is) : 0.0;
    }

    /**
     * Надколонная полоса: 0.25·min(L1, L2) в каждую сторону, где есть поперечный пролёт,
     * но не шире рамы.
     */
    public double columnStripWidth(Geometry g) {
        double half = 0.25 * Math.min(g.getL1(), g.getL2());
        int sides = g.hasBothL2Spans() ? 2 : 1;
        return Math.min(sides * half, g.getL2Tributary());
    }

    private static MomentComponent component(MomentLocation location, SpanCase spanCase, double mo, double share) {
        double coefficient = spanCase.coefficient(location);
        return MomentComponent.split(location, coefficient, mo * coefficient, share);
    }

    private static void warnIfFailed(DdmResult.DdmResultBuilder out, ShearCheckResult r) {
        if (r.getStatus() == ShearStatus.FAIL) {
            out.warning(String.format(Locale.US,
                    "Punching shear FAIL at %s: Vu = %.1f kN > phiVc = %.1f kN (ratio %.2f)",
                    r.getSection().getLabel(), r.getVu() / 1000.0, r.getPhiVc() / 1000.0, r.getRatio()));
        }
    }
}
