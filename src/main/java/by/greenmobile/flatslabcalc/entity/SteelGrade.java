package by.greenmobile.flatslabcalc.entity;

/**
 * Класс арматуры (TIS): fy в ksc и номинальное значение в МПа для формул ACI.
 */
public enum SteelGrade {
    SD30(3000, 300),
    SD40(4000, 400),
    SD50(5000, 500);

    private final double fyKsc;
    private final double nominalMpa;

    SteelGrade(double fyKsc, double nominalMpa) {
        this.fyKsc = fyKsc;
        this.nominalMpa = nominalMpa;
    }

    public double getFyKsc() {
        return fyKsc;
    }

    public double getNominalMpa() {
        return nominalMpa;
    }
}
