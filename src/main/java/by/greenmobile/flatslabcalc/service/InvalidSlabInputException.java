package by.greenmobile.flatslabcalc.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Некорректные / отсутствующие входные данные. Единственный случай, когда расчёт
 * прерывается до инженерной части; несёт сразу все ошибки (поле → проблема).
 */
public class InvalidSlabInputException extends RuntimeException {

    private final Map<String, String> problems;

    public InvalidSlabInputException(Map<String, String> problems) {
        super("Invalid slab input: " + problems);
        this.problems = Collections.unmodifiableMap(new LinkedHashMap<>(problems));
    }

    public Map<String, String> getProblems() {
        return problems;
    }
}
