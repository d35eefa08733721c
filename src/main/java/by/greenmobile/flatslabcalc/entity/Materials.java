package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Материалы в рабочих единицах (Па), плюс исходные ksc / МПа для формул ACI.
 */
@Value
@Builder
public class Materials {
    double fcKsc;
    double fcPa;
    double fcMpa;
    SteelGrade steelGrade;
    double fyPa;
    /** Номинальный fy класса стали (для ρmin и минимальной толщины). */
    double fyNominalMpa;
    /** Ec = 4700·√f'c (МПа), в Па. */
    double ecPa;
}
