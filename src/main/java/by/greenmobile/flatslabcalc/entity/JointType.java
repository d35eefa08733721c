package by.greenmobile.flatslabcalc.entity;

public enum JointType {
    /** Промежуточный этаж: колонны сверху и снизу. */
    INTERMEDIATE,
    /** Покрытие: верхней колонны нет. */
    ROOF
}
