package by.greenmobile.flatslabcalc.entity;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Сводка проверок применимости и конструктивных требований.
 */
@Value
public class CriteriaReport {
    ThicknessCheck thickness;
    /** Пустой список, если капители нет. */
    List<CriterionResult> dropPanel;
    DdmApplicability ddm;
    /** EFM применим для любой геометрии. */
    boolean efmApplicable;

    /**
     * Нефатальные предупреждения: недостаточная толщина (риск прогибов),
     * капитель вне требований, нарушения условий DDM.
     */
    public List<String> getWarnings() {
        List<String> out = new ArrayList<>();
        if (!thickness.isPassed()) {
            out.add(String.format(Locale.US,
                    "Slab thickness %.1f cm < required %.2f cm (%s): deflection control not satisfied",
                    thickness.getProvidedCm(), thickness.getRequiredCm(), thickness.getCaseName()));
        }
        for (CriterionResult c : dropPanel) {
            if (!c.isPassed()) out.add(c.getMessage());
        }
        if (!ddm.isApplicable()) {
            out.add("DDM is not applicable, use EFM results for design");
            out.addAll(ddm.getReasons());
        }
        return out;
    }
}
