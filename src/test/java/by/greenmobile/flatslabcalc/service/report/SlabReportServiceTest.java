package by.greenmobile.flatslabcalc.service.report;

import by.greenmobile.flatslabcalc.entity.SlabDesignReport;
import by.greenmobile.flatslabcalc.service.EngineeringFacade;
import by.greenmobile.flatslabcalc.service.criteria.DesignCriteriaValidator;
import by.greenmobile.flatslabcalc.service.engine.EfmEngine;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static by.greenmobile.flatslabcalc.SlabFixtures.DESIGN;
import static by.greenmobile.flatslabcalc.SlabFixtures.UNITS;
import static by.greenmobile.flatslabcalc.SlabFixtures.ddmEngine;
import static by.greenmobile.flatslabcalc.SlabFixtures.defaults;
import static by.greenmobile.flatslabcalc.SlabFixtures.preparer;
import static org.assertj.core.api.Assertions.assertThat;

class SlabReportServiceTest {

    private final EngineeringFacade facade = new EngineeringFacade(
            preparer(), new DesignCriteriaValidator(UNITS), ddmEngine(), new EfmEngine());
    private final SlabReportService reportService = new SlabReportService(DESIGN);

    @Test
    void report_is_a_multi_page_pdf() throws Exception {
        byte[] pdf = reportService.buildReport(facade.design(defaults().build()));

        assertThat(new String(pdf, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertThat(doc.getNumberOfPages()).isGreaterThanOrEqualTo(7);
            String text = new PDFTextStripper().getText(doc);
            assertThat(text).contains("FLAT SLAB DESIGN REPORT", "PUNCHING SHEAR", "Kec");
        }
    }

    @Test
    void report_renders_failing_design_with_drop_panel() throws Exception {
        SlabDesignReport design = facade.design(defaults()
                .slabThicknessCm(12.0)
                .dropPanel(true)
                .dropDepthCm(2.0)
                .dropWidth1M(1.0)
                .dropWidth2M(1.0)
                .liveLoadKgM2(1000.0)
                .build());

        byte[] pdf = reportService.buildReport(design);

        assertThat(design.getWarnings()).isNotEmpty();
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertThat(new PDFTextStripper().getText(doc)).contains("Drop panel", "Warnings");
        }
    }

    @Test
    void non_latin_symbols_are_replaced_for_standard_fonts() {
        assertThat(SlabReportService.pdfSafe("0.65·L1 ≥ φVc β²")).isEqualTo("0.65*L1 >= phiVc beta2");
        assertThat(SlabReportService.pdfSafe("Плита")).isEqualTo("?????");
        assertThat(SlabReportService.pdfSafe(null)).isEqualTo("-");
    }
}
