package by.greenmobile.flatslabcalc.entity;

public enum ShearStatus {
    PASS,
    FAIL
}
