package by.greenmobile.flatslabcalc.entity;

import lombok.Value;

import java.util.List;

/**
 * Полный прогон: нормализованные данные, проверки, DDM, EFM и сводные предупреждения.
 */
@Value
public class SlabDesignReport {
    NormalizedSlab slab;
    CriteriaReport criteria;
    DdmResult ddm;
    StiffnessSet efm;
    List<String> warnings;
}
