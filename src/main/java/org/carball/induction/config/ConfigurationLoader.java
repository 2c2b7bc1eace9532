package org.carball.induction.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.induction.model.prediction.ModelType;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > YAML file > defaults.
     * A profile named in the YAML file replaces the built-in defaults as the base.
     */
    public PlannerSettings loadConfiguration(String configPath, String[] args) {
        log.debug("Loading configuration");

        PlannerConfigFile file = readConfigFile(configPath);
        PlannerSettings.PlannerSettingsBuilder builder = file != null && file.getProfile() != null
                ? loadProfile(file.getProfile()).toBuilder()
                : PlannerSettings.builder();

        return finish(builder, file, args);
    }

    /**
     * Loads a named profile, then overlays file, environment and CLI values.
     */
    public PlannerSettings loadConfigurationWithProfile(String profileName, String configPath, String[] args) {
        PlannerSettings.PlannerSettingsBuilder builder = loadProfile(profileName).toBuilder();
        return finish(builder, readConfigFile(configPath), args);
    }

    public PlannerSettings loadProfile(String profileName) {
        try {
            PlanningProfile profile = PlanningProfile.fromName(profileName);
            PlannerSettings settings = profile.buildSettings();
            log.info("Loaded profile '{}': {}", profileName, settings.getConfigurationSummary());
            return settings;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    private PlannerSettings finish(PlannerSettings.PlannerSettingsBuilder builder, PlannerConfigFile file, String[] args) {
        if (file != null) {
            file.applyTo(builder);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args != null ? args : new String[0]);

        PlannerSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private PlannerConfigFile readConfigFile(String configPath) {
        if (configPath == null || configPath.trim().isEmpty()) {
            return null;
        }

        File configFile = new File(configPath);
        if (!configFile.exists()) {
            log.warn("Planner config file not found: {}, using defaults", configPath);
            return null;
        }

        try {
            PlannerConfigFile file = yamlMapper.readValue(configFile, PlannerConfigFile.class);
            log.info("Loaded planner configuration from: {}", configPath);
            return file;
        } catch (IOException e) {
            log.error("Failed to load planner config from {}: {}, using defaults", configPath, e.getMessage());
            return null;
        }
    }

    private void applyEnvironmentVariables(PlannerSettings.PlannerSettingsBuilder builder) {
        try {
            if (environment.containsKey("INDUCTION_TARGET")) {
                builder.targetInductions(Integer.parseInt(environment.get("INDUCTION_TARGET")));
            }
            if (environment.containsKey("INDUCTION_SOLVER")) {
                builder.solverId(environment.get("INDUCTION_SOLVER"));
            }
            if (environment.containsKey("INDUCTION_SOLVER_TIMEOUT")) {
                builder.solverTimeoutSeconds(Integer.parseInt(environment.get("INDUCTION_SOLVER_TIMEOUT")));
            }
            if (environment.containsKey("INDUCTION_MIP_GAP")) {
                builder.mipGap(Double.parseDouble(environment.get("INDUCTION_MIP_GAP")));
            }
            if (environment.containsKey("INDUCTION_MODEL_TYPE")) {
                builder.modelType(ModelType.fromName(environment.get("INDUCTION_MODEL_TYPE")));
            }
            if (environment.containsKey("INDUCTION_MODEL_PATH")) {
                builder.modelPath(environment.get("INDUCTION_MODEL_PATH"));
            }
            if (environment.containsKey("INDUCTION_RANDOM_SEED")) {
                builder.randomSeed(Long.parseLong(environment.get("INDUCTION_RANDOM_SEED")));
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            log.warn("Ignoring invalid environment configuration value: {}", e.getMessage());
        }
    }

    private void applyCLIArguments(PlannerSettings.PlannerSettingsBuilder builder, String[] args) {
        Map<String, Integer> extraCapacities = new LinkedHashMap<>();

        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--target":
                        builder.targetInductions(Integer.parseInt(value));
                        break;
                    case "--weights.service":
                        builder.servicePriorityWeight(Double.parseDouble(value));
                        break;
                    case "--weights.mileage":
                        builder.mileageBalanceWeight(Double.parseDouble(value));
                        break;
                    case "--weights.shunting":
                        builder.shuntingCostWeight(Double.parseDouble(value));
                        break;
                    case "--weights.depot":
                        builder.depotEfficiencyWeight(Double.parseDouble(value));
                        break;
                    case "--solver":
                        builder.solverId(value);
                        break;
                    case "--solver-timeout":
                        builder.solverTimeoutSeconds(Integer.parseInt(value));
                        break;
                    case "--mip-gap":
                        builder.mipGap(Double.parseDouble(value));
                        break;
                    case "--model-type":
                        builder.modelType(ModelType.fromName(value));
                        break;
                    case "--seed":
                        builder.randomSeed(Long.parseLong(value));
                        break;
                    case "--model":
                        builder.modelPath(value);
                        break;
                    case "--depot-capacity":
                        String[] parts = value.split("=", 2);
                        if (parts.length == 2) {
                            extraCapacities.put(parts[0].trim(), Integer.parseInt(parts[1].trim()));
                        } else {
                            log.warn("Invalid depot capacity (expected Name=N): {}", value);
                        }
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }

        if (!extraCapacities.isEmpty()) {
            Map<String, Integer> merged = new LinkedHashMap<>(builder.build().getDepotCapacities());
            merged.putAll(extraCapacities);
            builder.depotCapacities(merged);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --target <num>                 Target number of inductions (default 25)
              --weights.service <num>        Service priority weight
              --weights.mileage <num>        Mileage balance weight
              --weights.shunting <num>       Shunting cost weight (subtracted)
              --weights.depot <num>          Depot efficiency weight
              --depot-capacity <name=num>    Capacity for a depot (repeatable)
              --solver <id>                  MILP backend: SCIP or CBC
              --solver-timeout <seconds>     Solver wall-clock limit
              --mip-gap <num>                Relative optimality gap
              --model-type <type>            random_forest or decision_tree
              --seed <num>                   Random seed for training and synthetic labels
              --model <path>                 Model artifact path

            Environment Variables:
              INDUCTION_TARGET               Same as --target
              INDUCTION_SOLVER               Same as --solver
              INDUCTION_SOLVER_TIMEOUT       Same as --solver-timeout
              INDUCTION_MIP_GAP              Same as --mip-gap
              INDUCTION_MODEL_TYPE           Same as --model-type
              INDUCTION_MODEL_PATH           Same as --model
              INDUCTION_RANDOM_SEED          Same as --seed

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML config file (--config)
              4. Profile defaults or built-in defaults
            """;
    }
}
