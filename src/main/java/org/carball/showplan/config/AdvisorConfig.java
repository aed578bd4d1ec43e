package org.carball.showplan.config;

import lombok.Data;
import org.carball.showplan.model.plan.WarningSeverity;

import java.nio.file.Path;

@Data
public class AdvisorConfig {
    private Path planFile;
    private String outputFile = "plan-analysis.json";
    private OutputFormat outputFormat = OutputFormat.JSON;
    private WarningSeverity minSeverity = WarningSeverity.INFO;
    private boolean verbose;
    private AnalyzerThresholds thresholds = AnalyzerThresholds.defaults();
}
