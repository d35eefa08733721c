package by.greenmobile.flatslabcalc.service;

import by.greenmobile.flatslabcalc.entity.CantileverMoments;
import by.greenmobile.flatslabcalc.entity.CriteriaReport;
import by.greenmobile.flatslabcalc.entity.DdmResult;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.SlabDesignReport;
import by.greenmobile.flatslabcalc.entity.SlabInput;
import by.greenmobile.flatslabcalc.entity.StiffnessSet;
import by.greenmobile.flatslabcalc.service.criteria.DesignCriteriaValidator;
import by.greenmobile.flatslabcalc.service.engine.DdmEngine;
import by.greenmobile.flatslabcalc.service.engine.EfmEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Единая точка инженерного расчёта плиты:
 * - нормализует ввод (GeometryPreparer)
 * - проверяет толщину / капитель / применимость DDM
 * - считает DDM и EFM (независимо друг от друга)
 * - собирает все предупреждения в один список
 *
 * Неприменимость DDM не останавливает расчёт: результат DDM возвращается вместе с предупреждением.
 */
@Service
@Slf4j
public class EngineeringFacade {

    private final GeometryPreparer preparer;
    private final DesignCriteriaValidator validator;
    private final DdmEngine ddmEngine;
    private final EfmEngine efmEngine;

    public EngineeringFacade(GeometryPreparer preparer,
                             DesignCriteriaValidator validator,
                             DdmEngine ddmEngine,
                             EfmEngine efmEngine) {
        this.preparer = preparer;
        this.validator = validator;
        this.ddmEngine = ddmEngine;
        this.efmEngine = efmEngine;
    }

    public NormalizedSlab prepare(SlabInput input) {
        return preparer.prepare(input);
    }

    public CriteriaReport criteria(SlabInput input) {
        return validator.validate(preparer.prepare(input));
    }

    public DdmResult ddm(SlabInput input) {
        return ddmEngine.run(preparer.prepare(input));
    }

    public StiffnessSet efm(SlabInput input) {
        return efmEngine.run(preparer.prepare(input));
    }

    public SlabDesignReport design(SlabInput input) {
        NormalizedSlab slab = preparer.prepare(input);

        CriteriaReport criteria = validator.validate(slab);
        DdmResult ddm = ddmEngine.run(slab);
        StiffnessSet efm = efmEngine.run(slab);

        List<String> warnings = new ArrayList<>(criteria.getWarnings());
        warnings.addAll(ddm.getWarnings());

        CantileverMoments cant = slab.getCantilever();
        if (cant.isPresent()) {
            // Справочно: в распределение моментов консоль не входит
            warnings.add(String.format(Locale.US,
                    "Cantilever balancing moments (informational, not applied): left %.1f kN·m, right %.1f kN·m",
                    cant.getLeft() / 1000.0, cant.getRight() / 1000.0));
        }

        log.info("DESIGN: location={} ddmApplicable={} shearOk={} Kec={} warnings={}",
                slab.getPanelCase().getLocation(), criteria.getDdm().isApplicable(),
                ddm.isShearOk(), efm.getKec(), warnings.size());

        return new SlabDesignReport(slab, criteria, ddm, efm, List.copyOf(warnings));
    }
}
