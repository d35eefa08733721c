package by.greenmobile.flatslabcalc.config;

import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Расчётные константы армирования и продавливания (ACI 318).
 */
@Getter
@ToString
@ConfigurationProperties(prefix = "slab.design")
public class DesignProperties {

    /** Защитный слой до центра арматуры, м. */
    private final double cover;

    /** φ для изгиба. */
    private final double phiFlexure;

    /** φ для среза (продавливания). */
    private final double phiShear;

    /** Диаметр стержня для подбора шага, мм. */
    private final double barDiameterMm;

    /** Предельный шаг стержней, м (вместе с 2h). */
    private final double maxBarSpacing;

    /** Эмпирический потолок Rn / f'c, выше которого сечение считается не прошедшим. */
    private final double rnCeilingRatio;

    /** ρmin для стали ниже 400 МПа (SD30). */
    private final double rhoMinLowGrade;

    /** ρmin для SD40 / SD50. */
    private final double rhoMin;

    public DesignProperties(@DefaultValue("0.03") double cover,
                            @DefaultValue("0.9") double phiFlexure,
                            @DefaultValue("0.75") double phiShear,
                            @DefaultValue("12") double barDiameterMm,
                            @DefaultValue("0.45") double maxBarSpacing,
                            @DefaultValue("0.35") double rnCeilingRatio,
                            @DefaultValue("0.0020") double rhoMinLowGrade,
                            @DefaultValue("0.0018") double rhoMin) {
        this.cover = cover;
        this.phiFlexure = phiFlexure;
        this.phiShear = phiShear;
        this.barDiameterMm = barDiameterMm;
        this.maxBarSpacing = maxBarSpacing;
        this.rnCeilingRatio = rnCeilingRatio;
        this.rhoMinLowGrade = rhoMinLowGrade;
        this.rhoMin = rhoMin;
    }

    public static DesignProperties defaults() {
        return new DesignProperties(0.03, 0.9, 0.75, 12, 0.45, 0.35, 0.0020, 0.0018);
    }

    /** Площадь одного стержня, м². */
    public double barAreaM2() {
        double dM = barDiameterMm / 1000.0;
        return Math.PI * dM * dM / 4.0;
    }

    public String barLabel() {
        return "DB" + Math.round(barDiameterMm);
    }
}
