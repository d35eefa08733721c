package by.greenmobile.flatslabcalc.service.design;

/**
 * Результат решения квадратного уравнения для ρ: либо ok(ρ), либо fail(причина).
 * Никаких исключений для математических областей.
 */
public final class FlexureSolution {

    private final boolean ok;
    private final String reason;
    private final double rho;
    private final double rn;

    private FlexureSolution(boolean ok, String reason, double rho, double rn) {
        this.ok = ok;
        this.reason = reason;
        this.rho = rho;
        this.rn = rn;
    }

    public static FlexureSolution ok(double rho, double rn) {
        return new FlexureSolution(true, null, rho, rn);
    }

    public static FlexureSolution fail(String reason, double rn) {
        return new FlexureSolution(false, reason, 0.0, rn);
    }

    public boolean isOk() { return ok; }
    public String getReason() { return reason; }
    public double getRho() { return rho; }
    public double getRn() { return rn; }
}
