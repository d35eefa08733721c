package by.greenmobile.flatslabcalc.config;

import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Константы перевода единиц (неизменяемые).
 *
 * Передаются явно в GeometryPreparer и движки, глобального состояния нет.
 * Рабочие единицы ядра: м, Па, Н, Н·м.
 */
@Getter
@ToString
@ConfigurationProperties(prefix = "slab.units")
public class UnitsConfig {

    /** Ускорение свободного падения, м/с². Он же множитель кгс → Н. */
    private final double gravity;

    /** см → м. */
    private final double cmToM;

    /** ksc (кгс/см²) → Па. */
    private final double kscToPa;

    /** Плотность бетона, кг/м³. */
    private final double concreteDensity;

    public UnitsConfig(@DefaultValue("9.80665") double gravity,
                       @DefaultValue("0.01") double cmToM,
                       @DefaultValue("98066.5") double kscToPa,
                       @DefaultValue("2400") double concreteDensity) {
        if (gravity <= 0 || cmToM <= 0 || kscToPa <= 0 || concreteDensity <= 0) {
            throw new IllegalArgumentException("slab.units.*: все коэффициенты должны быть > 0");
        }
        this.gravity = gravity;
        this.cmToM = cmToM;
        this.kscToPa = kscToPa;
        this.concreteDensity = concreteDensity;
    }

    /** Стандартный набор (для тестов и вызовов без Spring). */
    public static UnitsConfig standard() {
        return new UnitsConfig(9.80665, 0.01, 98066.5, 2400);
    }

    public double cm(double valueCm) {
        return valueCm * cmToM;
    }

    /** кгс (или кгс/м², кгс·м) → Н (Па, Н·м). */
    public double kgToN(double kg) {
        return kg * gravity;
    }

    public double nToKg(double newtons) {
        return newtons / gravity;
    }

    public double kscToPa(double ksc) {
        return ksc * kscToPa;
    }

    public double paToKsc(double pa) {
        return pa / kscToPa;
    }

    public double kscToMpa(double ksc) {
        return paToMpa(kscToPa(ksc));
    }

    public double mpaToPa(double mpa) {
        return mpa * 1e6;
    }

    public double paToMpa(double pa) {
        return pa / 1e6;
    }

    /**
     * Модуль упругости бетона: Ec = 4700·√f'c (МПа), результат в Па.
     */
    public double concreteModulusPa(double fcKsc) {
        return mpaToPa(4700.0 * Math.sqrt(kscToMpa(fcKsc)));
    }

    /** Собственный вес плиты толщиной h (м), Па. */
    public double selfWeightPa(double thicknessM) {
        return thicknessM * concreteDensity * gravity;
    }
}
