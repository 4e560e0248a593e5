package com.funnelanalytics.api;

import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.StepAggregate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tabular export of the per-step analysis.
 */
@Component
public class FunnelReportExporter {

    static final List<String> HEADER = List.of(
            "Step", "Total Users", "Conversion Rate", "Drop-off Rate", "Avg Time to Next");
    
    public List<List<String>> rows(FunnelAnalysisResult result) {
        List<List<String>> rows = new ArrayList<>(result.getSteps().size());
        for (StepAggregate step : result.getSteps()) {
            rows.add(List.of(
                    step.getStep(),
                    String.valueOf(step.getTotalUsers()),
                    percent(step.getConversionRate()),
                    percent(step.getDropOffRate()),
                    duration(step.getAvgTimeToNext())));
        }
        return rows;
    }
    
    public String toCsv(FunnelAnalysisResult result) {
        StringBuilder csv = new StringBuilder();
        appendLine(csv, HEADER);
        for (List<String> row : rows(result)) {
            appendLine(csv, row);
        }
        return csv.toString();
    }
    
    static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value);
    }
    
    /**
     * Formats seconds as "1h 2m 3s", dropping leading zero units. Zero renders as "0s".
     */
    static String duration(double seconds) {
        long total = Math.round(seconds);
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long secs = total % 60;
        
        if (hours > 0) {
            return hours + "h " + minutes + "m " + secs + "s";
        }
        if (minutes > 0) {
            return minutes + "m " + secs + "s";
        }
        return secs + "s";
    }
    
    private static void appendLine(StringBuilder csv, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append(escape(cells.get(i)));
        }
        csv.append('\n');
    }
    
    private static String escape(String cell) {
        if (cell == null) {
            return "";
        }
        if (cell.contains(",") || cell.contains("\"") || cell.contains("\n")) {
            return "\"" + cell.replace("\"", "\"\"") + "\"";
        }
        return cell;
    }
}
