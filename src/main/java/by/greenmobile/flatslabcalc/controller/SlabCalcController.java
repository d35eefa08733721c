package by.greenmobile.flatslabcalc.controller;

import by.greenmobile.flatslabcalc.entity.CriteriaReport;
import by.greenmobile.flatslabcalc.entity.DdmResult;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.SlabDesignReport;
import by.greenmobile.flatslabcalc.entity.SlabInput;
import by.greenmobile.flatslabcalc.entity.StiffnessSet;
import by.greenmobile.flatslabcalc.service.EngineeringFacade;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON API расчёта. Каждый шаг доступен отдельно, /design - полный прогон.
 */
@RestController
@RequestMapping("/api/slab")
@RequiredArgsConstructor
public class SlabCalcController {

    private final EngineeringFacade engineeringFacade;

    /** Значения формы по умолчанию: внутренняя колонна, пролёты 6 × 6 м. */
    @GetMapping("/defaults")
    public SlabInput defaults() {
        return SlabInput.defaults();
    }

    @PostMapping("/prepare")
    public NormalizedSlab prepare(@RequestBody SlabInput input) {
        return engineeringFacade.prepare(input);
    }

    @PostMapping("/criteria")
    public CriteriaReport criteria(@RequestBody SlabInput input) {
        return engineeringFacade.criteria(input);
    }

    @PostMapping("/ddm")
    public DdmResult ddm(@RequestBody SlabInput input) {
        return engineeringFacade.ddm(input);
    }

    @PostMapping("/efm")
    public StiffnessSet efm(@RequestBody SlabInput input) {
        return engineeringFacade.efm(input);
    }

    @PostMapping("/design")
    public SlabDesignReport design(@RequestBody SlabInput input) {
        return engineeringFacade.design(input);
    }
}
