package com.funnelanalytics.api;

import com.funnelanalytics.domain.model.FunnelAnalysisResult;
import com.funnelanalytics.domain.model.StepAggregate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunnelReportExporterTest {

    private final FunnelReportExporter exporter = new FunnelReportExporter();
    
    @Test
    void testToCsv() {
        FunnelAnalysisResult result = FunnelAnalysisResult.builder()
                .steps(List.of(
                        StepAggregate.builder().step("Landing").stepNumber(0).totalUsers(100)
                                .conversionRate(100).dropOffRate(0).avgTimeToNext(3725).build(),
                        StepAggregate.builder().step("Sign up, then verify").stepNumber(1).totalUsers(40)
                                .conversionRate(40).dropOffRate(60).avgTimeToNext(0).build()))
                .build();
        
        String csv = exporter.toCsv(result);
        
        assertEquals("Step,Total Users,Conversion Rate,Drop-off Rate,Avg Time to Next\n"
                + "Landing,100,100.00%,0.00%,1h 2m 5s\n"
                + "\"Sign up, then verify\",40,40.00%,60.00%,0s\n", csv);
    }
    
    @Test
    void testDuration_DropsLeadingZeroUnits() {
        assertEquals("0s", FunnelReportExporter.duration(0));
        assertEquals("59s", FunnelReportExporter.duration(59.4));
        assertEquals("2m 0s", FunnelReportExporter.duration(120));
        assertEquals("1h 0m 0s", FunnelReportExporter.duration(3600));
    }
    
    @Test
    void testPercent_TwoDecimals() {
        assertEquals("33.33%", FunnelReportExporter.percent(100.0 / 3));
    }
}
