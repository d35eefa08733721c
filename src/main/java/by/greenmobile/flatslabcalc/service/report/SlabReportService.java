package by.greenmobile.flatslabcalc.service.report;

import by.greenmobile.flatslabcalc.config.DesignProperties;
import by.greenmobile.flatslabcalc.entity.CriteriaReport;
import by.greenmobile.flatslabcalc.entity.CriterionResult;
import by.greenmobile.flatslabcalc.entity.DdmResult;
import by.greenmobile.flatslabcalc.entity.Geometry;
import by.greenmobile.flatslabcalc.entity.Loads;
import by.greenmobile.flatslabcalc.entity.Materials;
import by.greenmobile.flatslabcalc.entity.MomentComponent;
import by.greenmobile.flatslabcalc.entity.NormalizedSlab;
import by.greenmobile.flatslabcalc.entity.PanelCase;
import by.greenmobile.flatslabcalc.entity.RebarSection;
import by.greenmobile.flatslabcalc.entity.ShearCheckResult;
import by.greenmobile.flatslabcalc.entity.SlabDesignReport;
import by.greenmobile.flatslabcalc.entity.StiffnessSet;
import by.greenmobile.flatslabcalc.entity.ThicknessCheck;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * PDF-отчёт полного расчёта плиты.
 *
 * Шрифты - стандартные Type1 (Helvetica), поэтому весь текст отчёта латиницей;
 * символы вне WinAnsi заменяются в {@link #pdfSafe(String)}.
 */
@Service
@Slf4j
public class SlabReportService {

    private static final float M = 50f;
    private static final float W = PDRectangle.A4.getWidth();
    private static final float H = PDRectangle.A4.getHeight();
    private static final float MAX_WIDTH = W - 2 * M;
    private static final float TOP = H - 105;

    private static final float[] REBAR_COLUMNS = {M, M + 95, M + 180, M + 235, M + 290, M + 345, M + 400};

    private final DesignProperties design;

    // Standard14 не привязаны к документу, один экземпляр на сервис
    private final PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDType1Font fontBold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

    public SlabReportService(DesignProperties design) {
        this.design = design;
    }

    public byte[] buildReport(SlabDesignReport r) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            Cursor c = new Cursor(doc);
            writeHeader(c, "FLAT SLAB DESIGN REPORT");
            writeSummaryPage(c, r);

            c.newPage();
            writeHeader(c, "INPUT DATA");
            writeInputsPage(c, r.getSlab());

            c.newPage();
            writeHeader(c, "DESIGN CRITERIA");
            writeCriteriaPage(c, r.getCriteria());

            c.newPage();
            writeHeader(c, "DIRECT DESIGN METHOD");
            writeDdmPage(c, r.getDdm());

            c.newPage();
            writeHeader(c, "PUNCHING SHEAR");
            writeShearPage(c, r.getDdm());

            c.newPage();
            writeHeader(c, "EQUIVALENT FRAME STIFFNESS");
            writeEfmPage(c, r.getEfm());

            c.newPage();
            writeHeader(c, "NOTES");
            writeNotesPage(c, r);

            c.close();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            log.info("REPORT: pages={} bytes={}", doc.getNumberOfPages(), out.size());
            return out.toByteArray();
        }
    }

    private void writeSummaryPage(Cursor c, SlabDesignReport r) throws IOException {
        NormalizedSlab slab = r.getSlab();
        Geometry g = slab.getGeometry();
        DdmResult ddm = r.getDdm();
        float y = c.y;

        y = h2(c, y, "Summary");
        y = kv(c, y, "Column location", slab.getPanelCase().getLocation().name());
        y = kv(c, y, "Span case", ddm.getSpanCase().getDescription());
        y = kv(c, y, "L1 x L2 (frame width)", fmt(g.getL1()) + " x " + fmt(g.getL2())
                + " m (" + fmt(g.getL2Tributary()) + " m)");
        y = kv(c, y, "Slab thickness", cm(g.getSlabThickness()) + " cm");
        y = kv(c, y, "Factored load wu", kpa(slab.getLoads().getWuPa()) + " kPa");

        y -= 6;
        y = h2(c, y, "Result");
        y = kv(c, y, "Minimum thickness", r.getCriteria().getThickness().isPassed() ? "PASS" : "FAIL");
        y = kv(c, y, "DDM applicable", r.getCriteria().getDdm().isApplicable() ? "YES" : "NO");
        y = kv(c, y, "Static moment Mo", kNm(ddm.getMoments().getMo()) + " kN*m");
        y = kv(c, y, "Punching shear", ddm.isShearOk() ? "PASS" : "FAIL");
        y = kv(c, y, "Kec", sci(r.getEfm().getKec()) + " N*m/rad");

        if (!r.getWarnings().isEmpty()) {
            y -= 10;
            y = h2(c, y, "Warnings");
            for (String w : r.getWarnings()) {
                y = paragraph(c, y, "- " + w);
            }
        }

        c.y = y;
    }

    private void writeInputsPage(Cursor c, NormalizedSlab slab) throws IOException {
        Geometry g = slab.getGeometry();
        Materials m = slab.getMaterials();
        Loads l = slab.getLoads();
        PanelCase p = slab.getPanelCase();
        float y = c.y;

        y = h2(c, y, "Geometry");
        y = kv(c, y, "L1 left / right", fmt(g.getL1Left()) + " / " + fmt(g.getL1Right()) + " m");
        y = kv(c, y, "L2 top / bottom", fmt(g.getL2Top()) + " / " + fmt(g.getL2Bottom()) + " m");
        y = kv(c, y, "Column c1 x c2", cm(g.getC1()) + " x " + cm(g.getC2()) + " cm");
        y = kv(c, y, "Slab thickness h", cm(g.getSlabThickness()) + " cm");
        if (g.isDropPanel()) {
            y = kv(c, y, "Drop panel depth", cm(g.getDropDepth()) + " cm");
            y = kv(c, y, "Drop panel W1 x W2", fmt(g.getDropWidth1()) + " x " + fmt(g.getDropWidth2()) + " m");
        } else {
            y = kv(c, y, "Drop panel", "none");
        }
        if (p.isEdgeBeam()) {
            y = kv(c, y, "Edge beam b x h", cm(p.getEdgeBeamWidth()) + " x " + cm(p.getEdgeBeamDepth()) + " cm");
        }

        y -= 8;
        y = h2(c, y, "Materials");
        y = kv(c, y, "f'c", fmt(m.getFcKsc()) + " ksc (" + fmt(m.getFcMpa()) + " MPa)");
        y = kv(c, y, "Steel", m.getSteelGrade().name() + ", fy = " + fmt(m.getFyPa() / 1e6) + " MPa");
        y = kv(c, y, "Ec = 4700 sqrt(f'c)", fmt(m.getEcPa() / 1e6) + " MPa");

        y -= 8;
        y = h2(c, y, "Loads");
        y = kv(c, y, "Self weight", kpa(l.getSelfWeightPa()) + " kPa");
        y = kv(c, y, "Superimposed dead", kpa(l.getSuperimposedDeadPa()) + " kPa");
        y = kv(c, y, "Live", kpa(l.getLivePa()) + " kPa");
        y = kv(c, y, "Load factors D / L", fmt(l.getDeadFactor()) + " / " + fmt(l.getLiveFactor()));
        y = codeLine(c, y, "wu = " + fmt(l.getDeadFactor()) + " * " + kpa(l.getDeadPa()) + " + "
                + fmt(l.getLiveFactor()) + " * " + kpa(l.getLivePa()) + " = " + kpa(l.getWuPa()) + " kPa");

        if (!slab.getNotes().isEmpty()) {
            y -= 8;
            y = h2(c, y, "Input adjustments");
            for (String n : slab.getNotes()) {
                y = paragraph(c, y, "- " + n);
            }
        }

        c.y = y;
    }

    private void writeCriteriaPage(Cursor c, CriteriaReport cr) throws IOException {
        ThicknessCheck t = cr.getThickness();
        float y = c.y;

        y = h2(c, y, "Minimum thickness (ACI 318 Table 8.3.1.1)");
        y = kv(c, y, "Case", t.getCaseName());
        y = kv(c, y, "Ln (longer clear span)", fmt(t.getClearSpan()) + " m");
        y = codeLine(c, y, "h_min = Ln (0.8 + fy/1400) / " + fmt(t.getDenominator()) + " = " + fmt(t.getComputedCm())
                + " cm, absolute minimum " + fmt(t.getAbsoluteMinCm()) + " cm");
        y = kv(c, y, "Provided / required", fmt(t.getProvidedCm()) + " / " + fmt(t.getRequiredCm()) + " cm");
        y = kv(c, y, "Verdict", t.isPassed() ? "PASS" : "FAIL");

        if (!cr.getDropPanel().isEmpty()) {
            y -= 8;
            y = h2(c, y, "Drop panel");
            y = criteria(c, y, cr.getDropPanel());
        }

        y -= 8;
        y = h2(c, y, "Direct Design Method applicability");
        y = criteria(c, y, cr.getDdm().getCriteria());
        y = kv(c, y, "DDM applicable", cr.getDdm().isApplicable() ? "YES" : "NO (use EFM)");

        c.y = y;
    }

    private float criteria(Cursor c, float y, List<CriterionResult> list) throws IOException {
        for (CriterionResult cr : list) {
            y = kv(c, y, cr.getName(), (cr.isPassed() ? "PASS " : "FAIL ") + fmt(cr.getProvided())
                    + " (limit " + fmt(cr.getLimit()) + ")");
        }
        return y;
    }

    private void writeDdmPage(Cursor c, DdmResult ddm) throws IOException {
        float y = c.y;

        y = h2(c, y, "Step 1. Total static moment");
        y = kv(c, y, "Ln actual / used", fmt(ddm.getClearSpanActual()) + " / " + fmt(ddm.getClearSpanUsed()) + " m");
        y = codeLine(c, y, "Mo = wu l2 Ln^2 / 8 = " + kpa(ddm.getWuPa()) + " * " + fmt(ddm.getL2Tributary())
                + " * " + fmt(ddm.getClearSpanUsed()) + "^2 / 8 = " + kNm(ddm.getMoments().getMo()) + " kN*m");

        y -= 6;
        y = h2(c, y, "Step 2. Longitudinal and transverse distribution");
        y = kv(c, y, "Span case", ddm.getSpanCase().getDescription());
        y = kv(c, y, "beta_t (edge beam)", fmt(ddm.getBetaT()));
        y = kv(c, y, "Column / middle strip width", fmt(ddm.getColumnStripWidth()) + " / "
                + fmt(ddm.getMiddleStripWidth()) + " m");
        for (MomentComponent mc : ddm.getMoments().getComponents()) {
            y = kv(c, y, mc.getLocation().getLabel(), fmt(mc.getCoefficient()) + " Mo = " + kNm(mc.getTotal())
                    + " kN*m, CS " + pct(mc.getColumnStripShare()) + "%");
        }

        y -= 6;
        y = h2(c, y, "Step 3. Reinforcement (" + design.barLabel() + ")");
        y = row(c, y, fontBold, "Location", "Strip", "Mu kN*m", "d cm", "rho", "As cm2", "Bars / status");
        for (RebarSection s : ddm.getRebarSections()) {
            String bars = switch (s.getStatus()) {
                case OK -> s.getSuggestion();
                case MIN_STEEL -> s.getSuggestion() + " (min)";
                case FAIL -> "FAIL";
            };
            y = row(c, y, font,
                    s.getLocation().getLabel(), s.getStrip().getLabel(), kNm(s.getDesignMoment()),
                    cm(s.getEffectiveDepth()), String.format(Locale.US, "%.5f", s.getRho()),
                    fmt(s.getAsRequiredCm2()), bars);
        }

        for (RebarSection s : ddm.getRebarSections()) {
            if (s.getFailureReason() != null) {
                y = paragraph(c, y, s.getLocation().getLabel() + " / " + s.getStrip().getLabel() + ": "
                        + s.getFailureReason());
            }
        }

        c.y = y;
    }

    private void writeShearPage(Cursor c, DdmResult ddm) throws IOException {
        float y = c.y;

        for (ShearCheckResult s : ddm.getShearChecks()) {
            y = h2(c, y, "Critical section at " + s.getSection().getLabel());
            y = kv(c, y, "b1 x b2", fmt(s.getCriticalB1()) + " x " + fmt(s.getCriticalB2()) + " m");
            y = kv(c, y, "Perimeter bo / d", fmt(s.getPerimeter()) + " / " + fmt(s.getEffectiveDepth()) + " m");
            y = kv(c, y, "beta / alpha_s", fmt(s.getBeta()) + " / " + fmt(s.getAlphaS()));
            y = kv(c, y, "vc", fmt(s.getVc() / 1e6) + " MPa");
            y = kv(c, y, "Vu / phiVc", kN(s.getVu()) + " / " + kN(s.getPhiVc()) + " kN");
            y = kv(c, y, "Ratio", fmt(s.getRatio()) + "  " + s.getStatus().name());
            y -= 8;
        }

        c.y = y;
    }

    private void writeEfmPage(Cursor c, StiffnessSet e) throws IOException {
        float y = c.y;

        y = h2(c, y, "Section properties");
        y = kv(c, y, "Ec", fmt(e.getEc() / 1e6) + " MPa");
        y = kv(c, y, "Is / Ic", sci(e.getSlabInertia()) + " / " + sci(e.getColumnInertia()) + " m4");
        y = kv(c, y, "Torsional constant C", sci(e.getTorsionConstant()) + " m4");

        y -= 6;
        y = h2(c, y, "Stiffness, N*m/rad");
        y = kv(c, y, "Ks = 4 Ec Is / L1", sci(e.getKs()));
        y = kv(c, y, "Kc upper / lower", sci(e.getKcUpper()) + " / " + sci(e.getKcLower()));
        y = kv(c, y, "Sum Kc", sci(e.getSumKc()));
        y = kv(c, y, "Kt (" + e.getTorsionalArms() + " arm(s))", sci(e.getKt()));
        y = kv(c, y, "Kec = 1 / (1/Sum Kc + 1/Kt)", sci(e.getKec()));

        y -= 6;
        y = h2(c, y, "Distribution factors");
        y = kv(c, y, "DF slab", fmt(e.getDfSlab()));
        y = kv(c, y, "DF equivalent column", fmt(e.getDfColumn()));

        c.y = y;
    }

    private void writeNotesPage(Cursor c, SlabDesignReport r) throws IOException {
        float y = c.y;

        y = h2(c, y, "Limitations");
        y = paragraph(c, y,
                "1) Moments are distributed by the Direct Design Method for a flat plate (no beams between columns). "
                        + "When DDM is not applicable the EFM stiffnesses should be used in a frame analysis.");
        y = paragraph(c, y,
                "2) The EFM page lists member stiffnesses and joint distribution factors only; "
                        + "no moment distribution is performed.");
        y = paragraph(c, y,
                "3) Cantilever balancing moments are informational and are not subtracted from span moments.");
        y = paragraph(c, y,
                "4) Bar suggestions assume " + design.barLabel() + " bars, cover " + cm(design.getCover())
                        + " cm, spacing not more than min(2h, " + cm(design.getMaxBarSpacing()) + " cm).");

        if (!r.getDdm().getNotes().isEmpty()) {
            y -= 8;
            y = h2(c, y, "Calculation notes");
            for (String n : r.getDdm().getNotes()) {
                y = paragraph(c, y, "- " + n);
            }
        }

        c.y = y;
    }

    // ===== Drawing helpers =====

    private void writeHeader(Cursor c, String title) throws IOException {
        float y = H - 70;
        text(c, fontBold, 18, M, y, title);
        text(c, font, 10, W - 150, y + 4, "Date: " + LocalDate.now().format(DateTimeFormatter.ofPattern("dd.MM.yyyy")));
        c.y = TOP;
    }

    private float h2(Cursor c, float y, String t) throws IOException {
        y = c.ensureSpace(y, 28);
        text(c, fontBold, 13, M, y, t);
        return y - 18;
    }

    private float kv(Cursor c, float y, String key, String value) throws IOException {
        y = c.ensureSpace(y, 18);
        text(c, font, 11, M, y, key + ":");
        text(c, fontBold, 11, M + 220, y, value);
        return y - 16;
    }

    private float row(Cursor c, float y, PDType1Font f, String... cells) throws IOException {
        y = c.ensureSpace(y, 16);
        for (int i = 0; i < cells.length && i < REBAR_COLUMNS.length; i++) {
            text(c, f, 9, REBAR_COLUMNS[i], y, cells[i]);
        }
        return y - 14;
    }

    private float paragraph(Cursor c, float y, String text) throws IOException {
        return wrappedText(c, y, text, 11, 16, 0);
    }

    private float codeLine(Cursor c, float y, String text) throws IOException {
        return wrappedText(c, y, text, 11, 16, 14);
    }

    private float wrappedText(Cursor c, float y, String text, int size, float leading, float indent) throws IOException {
        y = c.ensureSpace(y, leading + 6);

        String[] words = pdfSafe(text).split("\\s+");
        StringBuilder line = new StringBuilder();

        float x0 = M + indent;
        float maxW = MAX_WIDTH - indent;

        for (String word : words) {
            String test = (line.length() == 0) ? word : (line + " " + word);
            float tw = font.getStringWidth(test) / 1000f * size;

            if (tw > maxW && line.length() > 0) {
                y = c.ensureSpace(y, leading);
                text(c, font, size, x0, y, line.toString());
                y -= leading;
                line = new StringBuilder(word);
            } else {
                if (line.length() > 0) line.append(" ");
                line.append(word);
            }
        }

        if (line.length() > 0) {
            y = c.ensureSpace(y, leading);
            text(c, font, size, x0, y, line.toString());
            y -= leading;
        }

        return y - 4;
    }

    private void text(Cursor c, PDType1Font f, int size, float x, float y, String t) throws IOException {
        c.cs.beginText();
        c.cs.setFont(f, size);
        c.cs.newLineAtOffset(x, y);
        c.cs.showText(pdfSafe(t));
        c.cs.endText();
    }

    /**
     * Helvetica (WinAnsi) не содержит греческих букв и математических знаков.
     */
    static String pdfSafe(String s) {
        if (s == null) return "-";
        StringBuilder b = new StringBuilder(s.length());
        for (char ch : s.toCharArray()) {
            if (ch >= 0x20 && ch < 0x7f) {
                b.append(ch);
                continue;
            }
            switch (ch) {
                case '·' -> b.append('*');
                case '²' -> b.append('2');
                case '³' -> b.append('3');
                case '≥' -> b.append(">=");
                case '≤' -> b.append("<=");
                case '\u2212', '\u2013', '\u2014' -> b.append('-');
                case 'φ' -> b.append("phi");
                case 'β' -> b.append("beta");
                case 'α' -> b.append("alpha");
                case 'ρ' -> b.append("rho");
                case '√' -> b.append("sqrt");
                case '\t', '\n', '\r' -> b.append(' ');
                default -> b.append('?');
            }
        }
        return b.toString();
    }

    // ===== Formatting =====

    private static String fmt(double v) {
        return String.format(Locale.US, "%.3f", v);
    }

    private static String sci(double v) {
        return String.format(Locale.US, "%.4e", v);
    }

    private static String cm(double meters) {
        return String.format(Locale.US, "%.1f", meters * 100.0);
    }

    private static String kpa(double pa) {
        return String.format(Locale.US, "%.3f", pa / 1000.0);
    }

    private static String kNm(double nm) {
        return String.format(Locale.US, "%.2f", nm / 1000.0);
    }

    private static String kN(double n) {
        return String.format(Locale.US, "%.2f", n / 1000.0);
    }

    private static String pct(double share) {
        return String.format(Locale.US, "%.1f", share * 100.0);
    }

    // ===== Cursor / pagination =====

    private static class Cursor {
        final PDDocument doc;
        PDPage page;
        PDPageContentStream cs;
        float y;

        Cursor(PDDocument doc) throws IOException {
            this.doc = doc;
            newPage();
        }

        void newPage() throws IOException {
            if (cs != null) cs.close();
            page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            cs = new PDPageContentStream(doc, page);
            y = TOP;
        }

        void close() throws IOException {
            if (cs != null) {
                cs.close();
                cs = null;
            }
        }

        float ensureSpace(float currentY, float needed) throws IOException {
            if (currentY - needed < M) {
                newPage();
                return TOP;
            }
            return currentY;
        }
    }
}
