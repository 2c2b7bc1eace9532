package org.carball.induction.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.induction.config.ConfigurationLoader;
import org.carball.induction.config.PlannerSettings;
import org.carball.induction.config.PlanningProfile;
import org.carball.induction.exception.ModelLoadException;
import org.carball.induction.exception.OverrideNotFoundException;
import org.carball.induction.exception.PlannerException;
import org.carball.induction.model.decision.DecisionSummary;
import org.carball.induction.model.decision.ManualOverride;
import org.carball.induction.model.decision.OptimizationOutcome;
import org.carball.induction.model.decision.RankedDecision;
import org.carball.induction.model.prediction.TrainingReport;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.output.OutputFormat;
import org.carball.induction.output.PlanningReport;
import org.carball.induction.parser.TrainDatasetReader;
import org.carball.induction.session.PlanningSession;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class InductionPlannerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Metro Train Induction Planner v%s                 ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    // Options consumed by ConfigurationLoader; the CLI only skips their values
    private static final Set<String> SETTINGS_OPTIONS = Set.of(
            "--target", "--weights.service", "--weights.mileage", "--weights.shunting", "--weights.depot",
            "--solver", "--solver-timeout", "--mip-gap", "--model-type", "--seed", "--model", "--depot-capacity");

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            PlannerCommand command = parseArgs(args);
            if (command.isVerbose()) {
                ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.DEBUG);
            }

            ConfigurationLoader loader = new ConfigurationLoader();
            PlannerSettings settings = command.getProfile() != null
                    ? loader.loadConfigurationWithProfile(command.getProfile(), command.getConfigFile(), args)
                    : loader.loadConfiguration(command.getConfigFile(), args);

            System.out.println("\n🚆 Starting induction planning...");
            System.out.println("   Dataset: " + command.getDatasetFile());
            System.out.println("   Profile: " + settings.getProfileName());
            System.out.println("   Target inductions: " + settings.getTargetInductions());
            System.out.println();

            System.out.print("📥 Reading fleet data... ");
            TrainDataset dataset = new TrainDatasetReader().read(command.getDatasetFile());
            System.out.println("✓ (" + dataset.size() + " trains)");

            PlanningSession session = new PlanningSession(settings);
            session.loadDataset(dataset);
            Path modelPath = Paths.get(settings.getModelPath());

            TrainingReport trainingReport = null;
            if (command.isTrain()) {
                System.out.print("🧠 Training " + settings.getModelType().getConfigName() + " model... ");
                trainingReport = session.trainModel();
                session.saveModel(modelPath);
                System.out.printf("✓ (accuracy %.3f)%n", trainingReport.getAccuracy());
            } else {
                loadModel(session, modelPath);
            }

            System.out.print("🧮 Optimizing induction plan... ");
            OptimizationOutcome outcome = session.plan(settings.getTargetInductions());
            System.out.println(outcome.isFallback() ? "⚠️ fallback (" + outcome.getStatus() + ")" : "✓");

            if (!command.getOverrides().isEmpty()) {
                System.out.print("✋ Applying manual overrides... ");
                for (ManualOverride override : command.getOverrides()) {
                    try {
                        session.override(override.trainId(), override.decision(), override.reason());
                    } catch (OverrideNotFoundException e) {
                        System.out.print("\n   ⚠️ " + e.getMessage());
                    }
                }
                System.out.println(" ✓");
            }

            System.out.print("📝 Writing results... ");
            PlanningReport report = new PlanningReport(
                    session.getCurrentOutcome(), session.ranking(), trainingReport, settings);
            List<String> written = outputResults(report, command);
            System.out.println("✓");

            printSummary(session.getCurrentOutcome(), session.ranking());

            System.out.println("\n✅ Planning complete!");
            System.out.println("   Output files:");
            written.forEach(file -> System.out.println("     - " + file));

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (PlannerException e) {
            System.err.println("\n❌ Planning error [" + e.getErrorCode() + "]: " + e.getMessage());
            log.debug("Planning error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static void loadModel(PlanningSession session, Path modelPath) {
        try {
            if (session.restoreModel(modelPath)) {
                System.out.println("🧠 Loaded model from " + modelPath);
            } else {
                System.out.println("ℹ️ No saved model at " + modelPath + ", using rule-based predictions");
            }
        } catch (ModelLoadException e) {
            System.out.println("⚠️ " + e.getMessage() + ", using rule-based predictions");
            log.debug("Model load error details", e);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar induction-planner.jar <dataset.json> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  dataset.json        Fleet snapshot: JSON array of trains or {\"trains\": [...]}");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file (default: induction-plan.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --train             Train the predictor on the dataset and save it");
        System.out.println("  --config            YAML planner configuration file");
        System.out.println("  --profile           Planning profile: " + PlanningProfile.availableProfiles());
        System.out.println("  --override          Manual decision ID=0|1[:reason] (repeatable)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  # Plan with the rule-based predictor");
        System.out.println("  java -jar induction-planner.jar fleet.json");
        System.out.println();
        System.out.println("  # Train a model, plan 20 inductions and write both report formats");
        System.out.println("  java -jar induction-planner.jar fleet.json --train --target 20 --format both");
        System.out.println();
        System.out.println("  # Force a train into service");
        System.out.println("  java -jar induction-planner.jar fleet.json --override KMRL-007=1:Event service");
    }

    static PlannerCommand parseArgs(String[] args) {
        PlannerCommand command = new PlannerCommand();
        command.setDatasetFile(Paths.get(args[0]));

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output":
                case "-o":
                    command.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    command.setOutputFormat(OutputFormat.fromName(requireValue(args, ++i, "Output format not specified")));
                    break;

                case "--train":
                    command.setTrain(true);
                    break;

                case "--config":
                    command.setConfigFile(requireValue(args, ++i, "Config file not specified"));
                    break;

                case "--profile":
                    command.setProfile(requireValue(args, ++i, "Profile not specified"));
                    break;

                case "--override":
                    command.getOverrides().add(parseOverride(requireValue(args, ++i, "Override not specified")));
                    break;

                case "--verbose":
                case "-v":
                    command.setVerbose(true);
                    break;

                default:
                    if (SETTINGS_OPTIONS.contains(arg)) {
                        // Value is applied by ConfigurationLoader
                        requireValue(args, ++i, "Value for " + arg + " not specified");
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        String baseFileName = removeFileExtension(command.getOutputFile());
        command.setOutputFile(baseFileName + (command.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        validateCommand(command);
        return command;
    }

    /**
     * Parses {@code ID=0|1[:reason]}.
     */
    static ManualOverride parseOverride(String value) {
        int eq = value.indexOf('=');
        if (eq <= 0 || eq == value.length() - 1) {
            throw new IllegalArgumentException("Invalid override (expected ID=0|1[:reason]): " + value);
        }
        String trainId = value.substring(0, eq).trim();
        String rest = value.substring(eq + 1);
        int colon = rest.indexOf(':');
        String decisionText = colon >= 0 ? rest.substring(0, colon).trim() : rest.trim();
        String reason = colon >= 0 ? rest.substring(colon + 1).trim() : null;

        if (!decisionText.equals("0") && !decisionText.equals("1")) {
            throw new IllegalArgumentException("Override decision must be 0 or 1: " + value);
        }
        return new ManualOverride(trainId, Integer.parseInt(decisionText), reason);
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static void validateCommand(PlannerCommand command) {
        if (!Files.exists(command.getDatasetFile())) {
            throw new IllegalArgumentException("Dataset file not found: " + command.getDatasetFile());
        }

        Path outputDir = Paths.get(command.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static List<String> outputResults(PlanningReport report, PlannerCommand command) throws IOException {
        String baseFileName = removeFileExtension(command.getOutputFile());
        OutputFormat format = command.getOutputFormat();
        List<String> written = new ArrayList<>();

        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            String jsonFile = baseFileName + ".json";
            Files.writeString(Paths.get(jsonFile), report.toJson());
            written.add(jsonFile);
        }

        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            String markdownFile = baseFileName + ".md";
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
            written.add(markdownFile);
        }
        return written;
    }

    private static void printSummary(OptimizationOutcome outcome, List<RankedDecision> ranking) {
        DecisionSummary summary = outcome.getSummary();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 INDUCTION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nSolver status: " + outcome.getStatus() +
                (outcome.isFallback() ? " (predictor fallback)" : ""));
        System.out.println("Trains inducted: " + summary.trainsInducted() + " / " + summary.totalTrains());
        System.out.println("Trains held: " + summary.trainsHeld());
        System.out.printf("Average fitness (inducted): %.1f%n", summary.avgFitnessInducted());
        if (summary.manualOverridesApplied() > 0) {
            System.out.println("Manual overrides: " + summary.manualOverridesApplied());
        }

        if (!summary.depotDistribution().isEmpty()) {
            System.out.println("\nInductions by depot:");
            for (Map.Entry<String, Integer> entry : summary.depotDistribution().entrySet()) {
                System.out.println("  - " + entry.getKey() + ": " + entry.getValue());
            }
        }

        System.out.println("\nTop priorities:");
        ranking.stream()
                .limit(5)
                .forEach(row -> System.out.printf("  %2d. %-12s %-6s %s%n",
                        row.priorityRank(), row.trainId(), row.finalDecision(), row.reasoning()));
    }
}
