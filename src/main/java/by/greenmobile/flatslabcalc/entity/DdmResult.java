package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DdmResult {
    SpanCase spanCase;
    double clearSpanActual;
    /** max(Ln, 0.65·L1). */
    double clearSpanUsed;
    double wuPa;
    double l2Tributary;
    double betaT;
    double columnStripWidth;
    double middleStripWidth;
    MomentSet moments;
    @Singular
    List<RebarSection> rebarSections;
    @Singular
    List<ShearCheckResult> shearChecks;
    @Singular
    List<String> warnings;
    @Singular
    List<String> notes;

    public boolean isShearOk() {
        return shearChecks.stream().allMatch(s -> s.getStatus() == ShearStatus.PASS);
    }
}
