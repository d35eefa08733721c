package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Жёсткости EFM в узле, Н·м/рад (модуль в Па, инерции в м⁴).
 */
@Value
@Builder
public class StiffnessSet {
    double ec;
    double slabInertia;
    double columnInertia;
    double torsionConstant;
    double ks;
    double kcUpper;
    double kcLower;
    double sumKc;
    int torsionalArms;
    double kt;
    double kec;
    double dfSlab;
    double dfColumn;
}
