package com.exohunt.extractor;

import com.exohunt.error.DataFormatException;
import com.exohunt.model.FluxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads comma-, tab- or whitespace-delimited light-curve tables such as archive CSV exports.
 *
 * <pre>
 * # MISSION = Kepler
 * # KEPLERID = 757450
 * time,pdcsap_flux,sap_flux,quality
 * 131.512,1.0002,10234.5,0
 * </pre>
 *
 * <p>Column names are matched case-insensitively. A bare {@code flux} column is read as PDCSAP
 * when no {@code pdcsap_flux} column exists. Empty cells and {@code nan} read as NaN.
 */
@Component
@Order(100)
public class DelimitedTextFormatProvider implements LightCurveFormatProvider {

    private static final Logger log = LoggerFactory.getLogger(DelimitedTextFormatProvider.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern METADATA = Pattern.compile("^#\\s*([A-Za-z_][A-Za-z0-9_ ]*?)\\s*[=:]\\s*(.+)$");
    private static final int SNIFF_BYTES = 4096;

    @Override
    public String name() {
        return "delimited-text";
    }

    @Override
    public boolean supports(byte[] content) {
        String head = new String(content, 0, Math.min(content.length, SNIFF_BYTES), StandardCharsets.UTF_8);
        for (String line : head.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            for (String column : split(trimmed)) {
                if (column.trim().equalsIgnoreCase("time")) return true;
            }
            return false;
        }
        return false;
    }

    @Override
    public RawLightCurve load(byte[] content) {
        String[] lines = new String(content, StandardCharsets.UTF_8).split("\\R");
        Map<String, String> metadata = new HashMap<>();
        String[] header = null;
        int headerLine = -1;
        List<double[]> rows = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("#")) {
                Matcher m = METADATA.matcher(line);
                if (m.matches()) metadata.put(m.group(1).trim().toUpperCase(Locale.ROOT), m.group(2).trim());
                continue;
            }
            if (header == null) {
                header = split(line);
                headerLine = i + 1;
                continue;
            }
            String[] cells = split(line);
            if (cells.length != header.length) {
                throw new DataFormatException(String.format("Line %d has %d cells, header at line %d has %d",
                        i + 1, cells.length, headerLine, header.length));
            }
            double[] row = new double[cells.length];
            for (int c = 0; c < cells.length; c++) row[c] = parseCell(cells[c], i + 1);
            rows.add(row);
        }

        if (header == null) throw new DataFormatException("No header row found in delimited light curve");

        int timeCol = -1;
        int qualityCol = -1;
        int bareFluxCol = -1;
        Map<FluxType, Integer> fluxCols = new EnumMap<>(FluxType.class);
        for (int c = 0; c < header.length; c++) {
            String name = header[c].trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case "time" -> timeCol = c;
                case "quality", "sap_quality" -> qualityCol = c;
                case "flux" -> bareFluxCol = c;
                default -> {
                    Optional<FluxType> type = FluxType.fromColumnName(name);
                    if (type.isPresent()) fluxCols.put(type.get(), c);
                }
            }
        }
        if (timeCol < 0) throw new DataFormatException("Delimited light curve has no 'time' column");
        if (bareFluxCol >= 0 && !fluxCols.containsKey(FluxType.PDCSAP)) fluxCols.put(FluxType.PDCSAP, bareFluxCol);

        int n = rows.size();
        double[] time = column(rows, timeCol);
        Map<FluxType, double[]> flux = new EnumMap<>(FluxType.class);
        fluxCols.forEach((type, col) -> flux.put(type, column(rows, col)));
        int[] quality = null;
        if (qualityCol >= 0) {
            quality = new int[n];
            for (int r = 0; r < n; r++) {
                double q = rows.get(r)[qualityCol];
                // unreadable flags count as flagged
                quality[r] = Double.isFinite(q) ? (int) q : 1;
            }
        }

        log.debug("Parsed delimited light curve: rows={} fluxColumns={} quality={} metadata={}",
                n, flux.keySet(), quality != null, metadata.keySet());
        return new RawLightCurve(time, flux, quality, metadata);
    }

    private static String[] split(String line) {
        if (line.indexOf(',') >= 0) return line.split(",", -1);
        if (line.indexOf('\t') >= 0) return line.split("\t", -1);
        return WHITESPACE.split(line);
    }

    private static double parseCell(String cell, int lineNumber) {
        String value = cell.trim();
        if (value.isEmpty() || value.equalsIgnoreCase("nan") || value.equalsIgnoreCase("null")) return Double.NaN;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new DataFormatException("Unreadable number '" + value + "' at line " + lineNumber, e);
        }
    }

    private static double[] column(List<double[]> rows, int col) {
        double[] out = new double[rows.size()];
        for (int r = 0; r < out.length; r++) out[r] = rows.get(r)[col];
        return out;
    }
}
