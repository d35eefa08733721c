package by.greenmobile.flatslabcalc.service;

import by.greenmobile.flatslabcalc.config.UnitsConfig;
import by.greenmobile.flatslabcalc.entity.CantileverMoments;
import by.greenmobile.flatslabcalc.entity.ColumnFrame;
import by.greenmobile.flatslabcalc.entity.ColumnLocation;
import by.greenmobile.flatslabcalc.entity.FarEndCondition;
import by.greenmobile.flatslabcalc.entity.Geometry;
import by.greenmobile.flatslabcalc.entity.JointType;
import by.greenmobile.flatslabcalc.entity.Loads;
import by.greenmobile.flatslabcalc.entity.Materials;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.PanelCase;
import by.greenmobile.flatslabcalc.entity.SlabInput;
import by.greenmobile.flatslabcalc.entity.SteelGrade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Нормализация входных данных формы (см, м, ksc, кг/м²) в единую метрическую запись.
 *
 * ВАЖНО:
 * - Все ошибки ввода собираются и выбрасываются ОДНИМ InvalidSlabInputException,
 *   до какого-либо инженерного расчёта.
 * - Положение колонны диктует наличие пролётов: у EDGE нет L1 слева, у CORNER ещё и L2 снизу.
 *   Лишние значения обнуляются с заметкой, а не считаются ошибкой.
 * - Консольные моменты считаются только как справочные (в DDM/EFM не идут).
 */
@Service
@Slf4j
public class GeometryPreparer {

    private final UnitsConfig units;

    public GeometryPreparer(UnitsConfig units) {
        this.units = units;
    }

    public NormalizedSlab prepare(SlabInput in) {
        if (in == null) {
            throw new InvalidSlabInputException(Map.of("input", "is required"));
        }

        Map<String, String> problems = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();

        ColumnLocation location = required(in.getLocation(), "location", problems);

        // ===== Плита / колонна =====
        double hCm = positive(in.getSlabThicknessCm(), "slabThicknessCm", problems);
        double c1Cm = positive(in.getColumnC1Cm(), "columnC1Cm", problems);
        double c2Cm = positive(in.getColumnC2Cm(), "columnC2Cm", problems);

        // ===== Пролёты по положению колонны =====
        double l1Right = positive(in.getL1RightM(), "l1RightM", problems);
        double l2Top = positive(in.getL2TopM(), "l2TopM", problems);
        double l1Left = 0.0;
        double l2Bottom = 0.0;

        if (location == ColumnLocation.INTERIOR) {
            l1Left = positive(in.getL1LeftM(), "l1LeftM", problems);
        } else if (location != null && isSet(in.getL1LeftM())) {
            notes.add("L1 left span ignored: " + location + " column has no span on the left");
        }

        if (location == ColumnLocation.INTERIOR || location == ColumnLocation.EDGE) {
            l2Bottom = positive(in.getL2BottomM(), "l2BottomM", problems);
        } else if (location == ColumnLocation.CORNER && isSet(in.getL2BottomM())) {
            notes.add("L2 bottom span ignored: CORNER column has no span below");
        }

        double c1 = units.cm(c1Cm);
        double c2 = units.cm(c2Cm);
        if (c1 > 0 && l1Right > 0 && (c1 >= l1Right || (l1Left > 0 && c1 >= l1Left))) {
            problems.put("columnC1Cm", "must be smaller than the L1 spans");
        }
        if (c2 > 0 && l2Top > 0 && (c2 >= l2Top || (l2Bottom > 0 && c2 >= l2Bottom))) {
            problems.put("columnC2Cm", "must be smaller than the L2 spans");
        }

        // ===== Капитель =====
        boolean drop = Boolean.TRUE.equals(in.getDropPanel());
        double dropDepthCm = 0.0;
        double dropW1 = 0.0;
        double dropW2 = 0.0;
        if (drop) {
            dropDepthCm = positive(in.getDropDepthCm(), "dropDepthCm", problems);
            dropW1 = positive(in.getDropWidth1M(), "dropWidth1M", problems);
            dropW2 = positive(in.getDropWidth2M(), "dropWidth2M", problems);
            if (dropW1 > 0 && c1 > 0 && dropW1 < c1) {
                problems.put("dropWidth1M", "must not be smaller than column c1");
            }
            if (dropW2 > 0 && c2 > 0 && dropW2 < c2) {
                problems.put("dropWidth2M", "must not be smaller than column c2");
            }
        }

        // ===== Материалы =====
        double fcKsc = positive(in.getFcKsc(), "fcKsc", problems);
        SteelGrade grade = required(in.getSteelGrade(), "steelGrade", problems);

        // ===== Нагрузки =====
        double sdlKg = nonNegative(in.getSuperimposedDeadKgM2(), "superimposedDeadKgM2", problems);
        double llKg = nonNegative(in.getLiveLoadKgM2(), "liveLoadKgM2", problems);
        double lfDead = positive(in.getDeadLoadFactor(), "deadLoadFactor", problems);
        double lfLive = positive(in.getLiveLoadFactor(), "liveLoadFactor", problems);
        boolean autoSelfWeight = in.getAutoSelfWeight() == null || in.getAutoSelfWeight();

        // ===== Узел =====
        JointType joint = required(in.getJointType(), "jointType", problems);
        boolean roof = joint == JointType.ROOF;
        double hLower = positive(in.getLowerStoreyHeightM(), "lowerStoreyHeightM", problems);
        FarEndCondition farLower = required(in.getFarEndLower(), "farEndLower", problems);
        double hUpper = 0.0;
        FarEndCondition farUpper = in.getFarEndUpper();
        if (roof) {
            if (isSet(in.getUpperStoreyHeightM())) {
                notes.add("Roof joint: upper column height forced to 0");
            }
            if (farUpper == null) {
                farUpper = FarEndCondition.PINNED;
            }
        } else if (joint != null) {
            hUpper = positive(in.getUpperStoreyHeightM(), "upperStoreyHeightM", problems);
            farUpper = required(farUpper, "farEndUpper", problems);
        }

        // ===== Край плиты =====
        boolean edgeBeam = false;
        double beamW = 0.0;
        double beamD = 0.0;
        if (Boolean.TRUE.equals(in.getEdgeBeam())) {
            if (location == ColumnLocation.INTERIOR) {
                notes.add("Edge beam ignored: interior column has a continuous slab on all sides");
            } else if (location != null) {
                edgeBeam = true;
                beamW = units.cm(positive(in.getEdgeBeamWidthCm(), "edgeBeamWidthCm", problems));
                beamD = units.cm(positive(in.getEdgeBeamDepthCm(), "edgeBeamDepthCm", problems));
            }
        }
        boolean restrained = location != null && location.isExterior()
                && Boolean.TRUE.equals(in.getExteriorEdgeRestrained());

        // ===== Консоли =====
        double cantLeft = 0.0;
        double cantRight = 0.0;
        if (Boolean.TRUE.equals(in.getLeftCantilever())) {
            if (l1Left > 0) {
                notes.add("Left cantilever ignored: a left span exists");
            } else {
                cantLeft = positive(in.getLeftCantileverM(), "leftCantileverM", problems);
            }
        }
        if (Boolean.TRUE.equals(in.getRightCantilever())) {
            cantRight = positive(in.getRightCantileverM(), "rightCantileverM", problems);
        }

        if (!problems.isEmpty()) {
            log.warn("PREPARE: отклонены входные данные, ошибок={}: {}", problems.size(), problems);
            throw new InvalidSlabInputException(problems);
        }

        // ===== Сборка записи =====
        double h = units.cm(hCm);
        Geometry geometry = Geometry.builder()
                .l1Left(l1Left)
                .l1Right(l1Right)
                .l2Top(l2Top)
                .l2Bottom(l2Bottom)
                .c1(c1)
                .c2(c2)
                .slabThickness(h)
                .dropPanel(drop)
                .dropDepth(units.cm(dropDepthCm))
                .dropWidth1(dropW1)
                .dropWidth2(dropW2)
                .build();

        Materials materials = Materials.builder()
                .fcKsc(fcKsc)
                .fcPa(units.kscToPa(fcKsc))
                .fcMpa(units.kscToMpa(fcKsc))
                .steelGrade(grade)
                .fyPa(units.kscToPa(grade.getFyKsc()))
                .fyNominalMpa(grade.getNominalMpa())
                .ecPa(units.concreteModulusPa(fcKsc))
                .build();

        double selfWeight = autoSelfWeight ? units.selfWeightPa(h) : 0.0;
        double sdl = units.kgToN(sdlKg);
        double dead = selfWeight + sdl;
        double live = units.kgToN(llKg);
        double wu = lfDead * dead + lfLive * live;

        Loads loads = Loads.builder()
                .selfWeightPa(selfWeight)
                .superimposedDeadPa(sdl)
                .deadPa(dead)
                .livePa(live)
                .deadFactor(lfDead)
                .liveFactor(lfLive)
                .wuPa(wu)
                .build();

        PanelCase panelCase = PanelCase.builder()
                .location(location)
                .edgeBeam(edgeBeam)
                .edgeBeamWidth(beamW)
                .edgeBeamDepth(beamD)
                .exteriorEdgeRestrained(restrained)
                .build();

        ColumnFrame columnFrame = ColumnFrame.builder()
                .jointType(joint)
                .upperHeight(hUpper)
                .lowerHeight(hLower)
                .farEndUpper(farUpper)
                .farEndLower(farLower)
                .columnInertia(c2 * Math.pow(c1, 3) / 12.0)
                .build();

        // Уравновешивающий момент консоли на ширину рамы
        double wLine = wu * geometry.getL2Tributary();
        CantileverMoments cantilever = CantileverMoments.builder()
                .leftLength(cantLeft)
                .rightLength(cantRight)
                .left(wLine * cantLeft * cantLeft / 2.0)
                .right(wLine * cantRight * cantRight / 2.0)
                .build();

        NormalizedSlab slab = NormalizedSlab.builder()
                .geometry(geometry)
                .materials(materials)
                .loads(loads)
                .panelCase(panelCase)
                .columnFrame(columnFrame)
                .cantilever(cantilever)
                .notes(notes)
                .build();

        log.info("PREPARE: location={} L1={} L2={} L2trib={} h={} drop={} wu={} Pa, Ec={} Pa, notes={}",
                location, geometry.getL1(), geometry.getL2(), geometry.getL2Tributary(), h, drop,
                wu, materials.getEcPa(), notes.size());
        return slab;
    }

    // =====================================================================
    // Проверка полей
    // =====================================================================

    private static boolean isSet(Double v) {
        return v != null && v > 0;
    }

    private static <T> T required(T value, String field, Map<String, String> problems) {
        if (value == null) {
            problems.put(field, "is required");
        }
        return value;
    }

    private static double positive(Double v, String field, Map<String, String> problems) {
        if (!finite(v, field, problems)) return 0.0;
        if (v <= 0) {
            problems.put(field, "must be > 0");
            return 0.0;
        }
        return v;
    }

    private static double nonNegative(Double v, String field, Map<String, String> problems) {
        if (!finite(v, field, problems)) return 0.0;
        if (v < 0) {
            problems.put(field, "must be >= 0");
            return 0.0;
        }
        return v;
    }

    private static boolean finite(Double v, String field, Map<String, String> problems) {
        if (v == null) {
            problems.put(field, "is required");
            return false;
        }
        if (v.isNaN() || v.isInfinite()) {
            problems.put(field, "must be a finite number");
            return false;
        }
        return true;
    }
}
