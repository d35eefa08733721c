package by.greenmobile.flatslabcalc.entity;

import lombok.Value;

/**
 * Одна проверка: вердикт плюс фактическое значение и предел, чтобы показать и вывод, и расчёт.
 */
@Value
public class CriterionResult {
    String name;
    boolean passed;
    double provided;
    double limit;
    String message;
}
