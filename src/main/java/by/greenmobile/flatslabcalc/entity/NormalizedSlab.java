package by.greenmobile.flatslabcalc.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Результат GeometryPreparer: единая запись в метрических единицах,
 * которую независимо потребляют валидатор, DDM и EFM.
 */
@Value
@Builder
public class NormalizedSlab {
    Geometry geometry;
    Materials materials;
    Loads loads;
    PanelCase panelCase;
    ColumnFrame columnFrame;
    CantileverMoments cantilever;

    /** Что было принудительно изменено при нормализации. */
    @Singular
    List<String> notes;
}
