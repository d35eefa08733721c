package by.greenmobile.flatslabcalc.service.engine;

import by.greenmobile.flatslabcalc.entity.ColumnFrame;
import by.greenmobile.flatslabcalc.entity.Geometry;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.PanelCase;
import by.greenmobile.flatslabcalc.entity.StiffnessSet;
import by.greenmobile.flatslabcalc.service.design.SectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Equivalent Frame Method: жёсткости элементов в узле плита-колонна.
 * Сам итерационный расчёт рамы здесь НЕ выполняется - только K и коэффициенты распределения.
 *
 * Ks  = 4·Ec·Is / L1                        (дальний конец защемлён)
 * Kc  = k·Ec·Ic / h, k = 4 / 3               (по условию на дальнем конце)
 * Kt  = Σ 9·Ec·C / (L2·(1 − c2/L2)³)         (по одному плечу на каждый поперечный пролёт)
 * Kec = 1 / (1/ΣKc + 1/Kt)                   (0, если ΣKc или Kt равны 0)
 */
@Component
@Slf4j
public class EfmEngine {

    public StiffnessSet run(NormalizedSlab slab) {
        Geometry g = slab.getGeometry();
        ColumnFrame frame = slab.getColumnFrame();
        double ec = slab.getMaterials().getEcPa();

        // Плита
        double is = SectionProperties.rectangleInertia(g.getL2Tributary(), g.getSlabThickness());
        double ks = 4.0 * ec * is / g.getL1();

        // Колонны
        double ic = frame.getColumnInertia();
        double kcUp = columnStiffness(frame.getUpperStiffnessFactor(), ec, ic, frame.getUpperHeight());
        double kcLo = columnStiffness(frame.getLowerStiffnessFactor(), ec, ic, frame.getLowerHeight());
        double sumKc = kcUp + kcLo;

        // Поперечный крутильный элемент
        double c = torsionConstant(slab);
        double kt = 0.0;
        int arms = 0;
        for (double l2 : new double[]{g.getL2Top(), g.getL2Bottom()}) {
            if (l2 <= 0) continue;
            double lever = 1.0 - g.getC2() / l2;
            kt += 9.0 * ec * c / (l2 * lever * lever * lever);
            arms++;
        }

        // Эквивалентная колонна: последовательное соединение
        double kec = (sumKc > 0 && kt > 0) ? 1.0 / (1.0 / sumKc + 1.0 / kt) : 0.0;

        double sum = ks + kec;
        double dfSlab = sum > 0 ? ks / sum : 0.0;
        double dfCol = sum > 0 ? kec / sum : 0.0;

        if (log.isDebugEnabled()) {
            log.debug("EFM: Ec={} Is={} Ic={} C={} KcUp={} KcLo={} arms={}", ec, is, ic, c, kcUp, kcLo, arms);
        }
        log.info("EFM: Ks={} SumKc={} Kt={} Kec={} DF_slab={} DF_col={}", ks, sumKc, kt, kec, dfSlab, dfCol);

        return StiffnessSet.builder()
                .ec(ec)
                .slabInertia(is)
                .columnInertia(ic)
                .torsionConstant(c)
                .ks(ks)
                .kcUpper(kcUp)
                .kcLower(kcLo)
                .sumKc(sumKc)
                .torsionalArms(arms)
                .kt(kt)
                .kec(kec)
                .dfSlab(dfSlab)
                .dfColumn(dfCol)
                .build();
    }

    /**
     * C крутильного элемента: полоса плиты h × c1, а у крайнего пролёта с контурной
     * балкой - сечение балки.
     */
    public double torsionConstant(NormalizedSlab slab) {
        PanelCase panel = slab.getPanelCase();
        if (panel.isEndSpan() && panel.isEdgeBeam()) {
            return SectionProperties.torsionConstant(panel.getEdgeBeamWidth(), panel.getEdgeBeamDepth());
        }
        Geometry g = slab.getGeometry();
        return SectionProperties.torsionConstant(g.getSlabThickness(), g.getC1());
    }

    private static double columnStiffness(int k, double ec, double ic, double height) {
        return height > 0 ? k * ec * ic / height : 0.0;
    }
}
