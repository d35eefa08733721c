package by.greenmobile.flatslabcalc.entity;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class DdmApplicability {
    boolean applicable;
    List<CriterionResult> criteria;

    public static DdmApplicability of(List<CriterionResult> criteria) {
        boolean ok = criteria.stream().allMatch(CriterionResult::isPassed);
        return new DdmApplicability(ok, List.copyOf(criteria));
    }

    /** Только нарушенные критерии. */
    public List<String> getReasons() {
        return criteria.stream()
                .filter(c -> !c.isPassed())
                .map(CriterionResult::getMessage)
                .collect(Collectors.toList());
    }
}
