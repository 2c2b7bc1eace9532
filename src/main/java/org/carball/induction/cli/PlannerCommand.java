package org.carball.induction.cli;

import lombok.Data;
import org.carball.induction.model.decision.ManualOverride;
import org.carball.induction.output.OutputFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options for one command-line run. Planner tuning flags are handled by
 * {@link org.carball.induction.config.ConfigurationLoader}.
 */
@Data
public class PlannerCommand {
    private Path datasetFile;
    private String outputFile = "induction-plan.json";
    private OutputFormat outputFormat = OutputFormat.JSON;
    private boolean train;
    private String configFile;
    private String profile;
    private List<ManualOverride> overrides = new ArrayList<>();
    private boolean verbose;
}
