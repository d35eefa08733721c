package by.greenmobile.flatslabcalc.entity;

import lombok.Value;

import java.util.List;

/**
 * Полный статический момент Mo и его распределение, Н·м.
 */
@Value
public class MomentSet {
    double mo;
    MomentComponent negExterior;
    MomentComponent positive;
    MomentComponent negInterior;

    public List<MomentComponent> getComponents() {
        return List.of(negExterior, positive, negInterior);
    }
}
