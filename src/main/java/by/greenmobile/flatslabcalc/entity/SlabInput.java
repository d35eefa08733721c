package by.greenmobile.flatslabcalc.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Входные данные в «пользовательских» единицах (как в форме ввода).
 *
 * Единицы:
 * - толщины, размеры колонн и балок: см
 * - пролёты, высоты этажей, капитель в плане, консоли: м
 * - бетон f'c: ksc (кгс/см²)
 * - нагрузки: кг/м² (нормативные, без коэффициентов)
 *
 * Все поля nullable: проверку полноты делает GeometryPreparer и возвращает
 * сразу весь список ошибок.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SlabInput {

    // ===== ПЛИТА И КАПИТЕЛЬ =====

    /** Толщина плиты, см. */
    private Double slabThicknessCm;

    /** Есть ли утолщение (drop panel). */
    private Boolean dropPanel;

    /** Выступ капители ниже плиты, см. */
    private Double dropDepthCm;

    /** Размер капители вдоль L1, м. */
    private Double dropWidth1M;

    /** Размер капители вдоль L2, м. */
    private Double dropWidth2M;

    // ===== КОЛОННА =====

    /** Размер колонны в направлении расчёта (вдоль L1), см. */
    private Double columnC1Cm;

    /** Поперечный размер колонны (вдоль L2), см. */
    private Double columnC2Cm;

    // ===== ПРОЛЁТЫ (между осями), м =====

    private Double l1LeftM;
    private Double l1RightM;
    private Double l2TopM;
    private Double l2BottomM;

    private ColumnLocation location;

    // ===== МАТЕРИАЛЫ =====

    /** f'c, ksc. */
    private Double fcKsc;

    private SteelGrade steelGrade;

    // ===== НАГРУЗКИ =====

    /** Дополнительная постоянная нагрузка (SDL), кг/м². */
    private Double superimposedDeadKgM2;

    /** Временная нагрузка (LL), кг/м². */
    private Double liveLoadKgM2;

    /** Добавлять собственный вес плиты к постоянной нагрузке (по умолчанию да). */
    private Boolean autoSelfWeight;

    private Double deadLoadFactor;
    private Double liveLoadFactor;

    // ===== УЗЕЛ И КОЛОННЫ (EFM) =====

    private JointType jointType;

    /** Высота верхнего этажа, м (игнорируется для покрытия). */
    private Double upperStoreyHeightM;

    /** Высота нижнего этажа, м. */
    private Double lowerStoreyHeightM;

    private FarEndCondition farEndUpper;
    private FarEndCondition farEndLower;

    // ===== КРАЙ ПЛИТЫ =====

    /** Контурная балка (только для EDGE / CORNER). */
    private Boolean edgeBeam;

    private Double edgeBeamWidthCm;
    private Double edgeBeamDepthCm;

    /** Наружный край полностью защемлён (коэффициенты как у внутреннего пролёта). */
    private Boolean exteriorEdgeRestrained;

    // ===== КОНСОЛИ =====

    private Boolean leftCantilever;
    private Double leftCantileverM;
    private Boolean rightCantilever;
    private Double rightCantileverM;

    /**
     * Значения по умолчанию формы ввода: внутренняя колонна 6×6 м, плита 20 см,
     * колонна 50×50, f'c 280 ksc, SD40, SDL 150 / LL 300 кг/м², коэффициенты 1.4 / 1.7.
     */
    public static SlabInput defaults() {
        return SlabInput.builder()
                .slabThicknessCm(20.0)
                .dropPanel(false)
                .dropDepthCm(0.0)
                .dropWidth1M(0.0)
                .dropWidth2M(0.0)
                .columnC1Cm(50.0)
                .columnC2Cm(50.0)
                .l1LeftM(6.0)
                .l1RightM(6.0)
                .l2TopM(6.0)
                .l2BottomM(6.0)
                .location(ColumnLocation.INTERIOR)
                .fcKsc(280.0)
                .steelGrade(SteelGrade.SD40)
                .superimposedDeadKgM2(150.0)
                .liveLoadKgM2(300.0)
                .autoSelfWeight(true)
                .deadLoadFactor(1.4)
                .liveLoadFactor(1.7)
                .jointType(JointType.INTERMEDIATE)
                .upperStoreyHeightM(3.0)
                .lowerStoreyHeightM(3.0)
                .farEndUpper(FarEndCondition.PINNED)
                .farEndLower(FarEndCondition.PINNED)
                .edgeBeam(false)
                .edgeBeamWidthCm(0.0)
                .edgeBeamDepthCm(0.0)
                .exteriorEdgeRestrained(false)
                .leftCantilever(false)
                .leftCantileverM(0.0)
                .rightCantilever(false)
                .rightCantileverM(0.0)
                .build();
    }
}
