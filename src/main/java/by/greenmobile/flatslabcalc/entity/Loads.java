package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Нагрузки, Па. wu = LF_dead·dead + LF_live·live.
 */
@Value
@Builder
public class Loads {
    double selfWeightPa;
    double superimposedDeadPa;
    /** Полная постоянная (собственный вес + SDL). */
    double deadPa;
    double livePa;
    double deadFactor;
    double liveFactor;
    double wuPa;

    /** Нормативное отношение LL/DL (0 при нулевой постоянной). */
    public double getLiveToDeadRatio() {
        return deadPa > 0 ? livePa / deadPa : 0.0;
    }
}
