package by.greenmobile.flatslabcalc.entity;

public enum RebarStatus {
    /** Требуемая площадь по расчёту. */
    OK,
    /** Управляет минимальное армирование ρmin·b·h. */
    MIN_STEEL,
    /** Сечение не проходит (Rn выше потолка или отрицательный дискриминант), As = 0. */
    FAIL
}
