package by.greenmobile.flatslabcalc.controller;

import by.greenmobile.flatslabcalc.entity.SlabDesignReport;
import by.greenmobile.flatslabcalc.entity.SlabInput;
import by.greenmobile.flatslabcalc.service.EngineeringFacade;
import by.greenmobile.flatslabcalc.service.report.SlabReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@RestController
@RequiredArgsConstructor
public class ExportController {

    private final EngineeringFacade engineeringFacade;
    private final SlabReportService slabReportService;

    /**
     * Полный расчёт и PDF-отчёт одним запросом (состояние между запросами не хранится).
     */
    @PostMapping("/api/slab/report")
    public ResponseEntity<byte[]> exportPdf(@RequestBody SlabInput input) throws IOException {
        SlabDesignReport report = engineeringFacade.design(input);
        byte[] pdf = slabReportService.buildReport(report);

        return ResponseEntity.ok()
                .headers(fileHeaders("slab-report.pdf"))
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    private HttpHeaders fileHeaders(String baseName) {
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String name = baseName.replace(".", "_" + ts + ".");

        HttpHeaders h = new HttpHeaders();
        h.setContentDisposition(ContentDisposition.attachment().filename(name, StandardCharsets.UTF_8).build());
        h.setCacheControl("no-cache, no-store, must-revalidate");
        h.setPragma("no-cache");
        return h;
    }
}
