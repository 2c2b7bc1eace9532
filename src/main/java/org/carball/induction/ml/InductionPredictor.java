package org.carball.induction.ml;

import lombok.extern.slf4j.Slf4j;
import org.carball.induction.config.PlannerSettings;
import org.carball.induction.exception.InputException;
import org.carball.induction.exception.InsufficientDataException;
import org.carball.induction.exception.ModelLoadException;
import org.carball.induction.exception.PredictionException;
import org.carball.induction.feature.CategoryRegistry;
import org.carball.induction.feature.FeatureBuilder;
import org.carball.induction.feature.FeatureMode;
import org.carball.induction.model.feature.FeatureTable;
import org.carball.induction.model.prediction.LabelSource;
import org.carball.induction.model.prediction.ModelType;
import org.carball.induction.model.prediction.PredictionResult;
import org.carball.induction.model.prediction.PredictorState;
import org.carball.induction.model.prediction.TrainingReport;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.classifiers.Evaluation;
import weka.classifiers.trees.REPTree;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;
import weka.core.SerializationHelper;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.Standardize;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Estimates per-train induction probability.
 * <p>
 * Starts {@link PredictorState#UNTRAINED} and scores with {@link RuleBasedScorer}.
 * A successful {@link #train} or {@link #restore} moves it to
 * {@link PredictorState#TRAINED}; a failed restore moves it back. A failed
 * training run leaves the previous state untouched. Not thread-safe.
 */
@Slf4j
public class InductionPredictor {

    static final String CLASS_ATTRIBUTE = "target_induct";
    static final String INDUCT_VALUE = "1";
    static final String HOLD_VALUE = "0";

    private final PlannerSettings settings;
    private final FeatureBuilder featureBuilder;
    private final SyntheticLabeler labeler;
    private final RuleBasedScorer ruleScorer = new RuleBasedScorer();

    private PredictorState state = PredictorState.UNTRAINED;
    private ModelType trainedType;
    private Classifier classifier;
    private Standardize scaler;
    private Instances header;
    private Instant trainedAt;

    public InductionPredictor(PlannerSettings settings) {
        this(settings, new FeatureBuilder(Clock.systemDefaultZone(), settings.isTimeFeatures()), new Random());
    }

    /**
     * @param labelRandom random source for synthetic labels; seed it for reproducible training
     */
    public InductionPredictor(PlannerSettings settings, FeatureBuilder featureBuilder, Random labelRandom) {
        this.settings = settings;
        this.featureBuilder = featureBuilder;
        this.labeler = new SyntheticLabeler(labelRandom);
    }

    /**
     * Fits a classifier on {@code dataset}, using provided labels where present
     * and synthetic labels elsewhere.
     *
     * @throws InsufficientDataException if there are too few rows or only one class
     * @throws PredictionException       if the learning library fails
     */
    public TrainingReport train(TrainDataset dataset) {
        int size = dataset == null ? 0 : dataset.size();
        if (size < settings.getMinTrainingSamples()) {
            throw new InsufficientDataException(String.format(
                    "Need at least %d trains to train, got %d", settings.getMinTrainingSamples(), size), size);
        }

        LabelSource labelSource = dataset.allLabelled() ? LabelSource.PROVIDED
                : dataset.anyLabelled() ? LabelSource.MIXED : LabelSource.SYNTHETIC;
        if (labelSource != LabelSource.PROVIDED) {
            log.info("Generating synthetic labels for {} unlabelled trains",
                    dataset.stream().filter(r -> !r.hasLabel()).count());
        }

        int[] labels = new int[size];
        int inductCount = 0;
        for (int i = 0; i < size; i++) {
            TrainRecord train = dataset.getRecords().get(i);
            labels[i] = train.hasLabel() ? (train.getTargetInduct() == 1 ? 1 : 0) : labeler.label(train);
            inductCount += labels[i];
        }
        if (inductCount == 0 || inductCount == size) {
            throw new InsufficientDataException(
                    "Training labels contain a single class (" + (inductCount == 0 ? HOLD_VALUE : INDUCT_VALUE) + ")", size);
        }

        List<String> previousColumns = featureBuilder.getRecordedColumns();
        Map<String, CategoryRegistry> previousEncoders = featureBuilder.snapshotEncoders();
        try {
            return fit(dataset, labels, labelSource);
        } catch (RuntimeException e) {
            featureBuilder.restore(previousColumns, previousEncoders);
            throw e;
        } catch (Exception e) {
            featureBuilder.restore(previousColumns, previousEncoders);
            throw new PredictionException("Model training failed: " + e.getMessage(), e);
        }
    }

    private TrainingReport fit(TrainDataset dataset, int[] labels, LabelSource labelSource) throws Exception {
        ModelType modelType = settings.getModelType();
        FeatureTable table = featureBuilder.build(dataset, FeatureMode.TRAINING);
        Instances raw = toInstances(newHeader(table.columns()), table, labels);

        Random splitRandom = new Random(settings.getRandomSeed());
        Instances trainRaw;
        Instances testRaw;
        boolean stratified = true;
        try {
            StratifiedSplitter.Split split = new StratifiedSplitter()
                    .split(labels, settings.getTestFraction(), splitRandom);
            trainRaw = subset(raw, split.trainIndices());
            testRaw = subset(raw, split.testIndices());
        } catch (IllegalArgumentException e) {
            log.warn("{}; training and evaluating on the full dataset", e.getMessage());
            trainRaw = new Instances(raw);
            testRaw = new Instances(raw);
            stratified = false;
        }

        Standardize newScaler = new Standardize();
        newScaler.setInputFormat(trainRaw);
        Instances trainScaled = Filter.useFilter(trainRaw, newScaler);
        Instances testScaled = Filter.useFilter(testRaw, newScaler);

        Classifier template = newClassifier(modelType);
        Classifier fitted = AbstractClassifier.makeCopy(template);
        fitted.buildClassifier(trainScaled);

        Evaluation evaluation = new Evaluation(trainScaled);
        evaluation.evaluateModel(fitted, testScaled);

        double[] cvScores = crossValidate(template, trainScaled);
        Instances allScaled = Filter.useFilter(raw, newScaler);
        Map<String, Double> importance = permutationImportance(fitted, allScaled);

        Instant now = Instant.now();
        TrainingReport report = TrainingReport.builder()
                .modelType(modelType)
                .accuracy(evaluation.pctCorrect() / 100.0)
                .cvMean(mean(cvScores))
                .cvStd(std(cvScores))
                .cvFolds(cvScores.length)
                .precision(finite(evaluation.precision(1)))
                .recall(finite(evaluation.recall(1)))
                .f1(finite(evaluation.fMeasure(1)))
                .featureImportance(importance)
                .confusionMatrix(toIntMatrix(evaluation.confusionMatrix()))
                .trainingSize(trainRaw.numInstances())
                .testSize(testRaw.numInstances())
                .stratified(stratified)
                .labelSource(labelSource)
                .trainedAt(now)
                .build();

        this.classifier = fitted;
        this.scaler = newScaler;
        this.header = new Instances(raw, 0);
        this.trainedType = modelType;
        this.trainedAt = now;
        this.state = PredictorState.TRAINED;

        log.info("Trained {} on {} trains: accuracy={}, cv={} (+/- {})", modelType.getConfigName(),
                trainRaw.numInstances(), String.format("%.3f", report.getAccuracy()),
                String.format("%.3f", report.getCvMean()), String.format("%.3f", report.getCvStd()));
        return report;
    }

    /**
     * Returns one prediction per row, in input order.
     *
     * @throws InputException      if the dataset is null, or empty for a trained predictor
     * @throws PredictionException if the learning library fails
     */
    public List<PredictionResult> predict(TrainDataset dataset) {
        if (dataset == null) {
            throw new InputException("Train dataset must not be null");
        }
        if (state == PredictorState.UNTRAINED) {
            log.debug("Predictor untrained, using rule-based scores for {} trains", dataset.size());
            return ruleScorer.predict(dataset);
        }
        if (dataset.isEmpty()) {
            throw new InputException("Cannot predict on an empty train dataset");
        }

        FeatureTable table = featureBuilder.build(dataset, FeatureMode.PREDICTION);
        List<PredictionResult> results = new ArrayList<>(dataset.size());
        try {
            Instances scaled = Filter.useFilter(toInstances(header, table, null), scaler);
            int inductIndex = scaled.classAttribute().indexOfValue(INDUCT_VALUE);
            for (int i = 0; i < scaled.numInstances(); i++) {
                double[] distribution = classifier.distributionForInstance(scaled.instance(i));
                results.add(PredictionResult.fromProbability(table.trainIds().get(i), distribution[inductIndex]));
            }
        } catch (Exception e) {
            throw new PredictionException("Prediction failed: " + e.getMessage(), e);
        }
        return results;
    }

    /**
     * Writes the trained model atomically: a reader sees either the old file or the new one.
     *
     * @throws IllegalStateException if the predictor is untrained
     */
    public void save(Path path) throws IOException {
        if (state != PredictorState.TRAINED) {
            throw new IllegalStateException("Cannot save an untrained predictor");
        }

        ModelArtifact artifact = new ModelArtifact(ModelArtifact.FORMAT_VERSION, trainedType, classifier, scaler,
                header, featureBuilder.getRecordedColumns(), featureBuilder.snapshotEncoders(), trainedAt);

        Path target = path.toAbsolutePath();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                SerializationHelper.write(out, artifact);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        } catch (Exception e) {
            Files.deleteIfExists(temp);
            throw new IOException("Failed to serialize model to " + target + ": " + e.getMessage(), e);
        }
        log.info("Saved {} model to {}", trainedType.getConfigName(), target);
    }

    /**
     * Replaces the current model with the one stored at {@code path}.
     *
     * @throws ModelLoadException if the file is missing, unreadable or inconsistent;
     *                            the predictor is then untrained
     */
    public void restore(Path path) {
        Object stored;
        try (InputStream in = Files.newInputStream(path)) {
            stored = SerializationHelper.read(in);
        } catch (Exception e) {
            reset();
            throw new ModelLoadException("Failed to read model from " + path + ": " + e.getMessage(), e);
        }

        if (!(stored instanceof ModelArtifact)) {
            reset();
            throw new ModelLoadException("File " + path + " does not contain an induction model");
        }
        ModelArtifact artifact = (ModelArtifact) stored;
        String problem = artifact.inconsistency();
        if (problem != null) {
            reset();
            throw new ModelLoadException("Model at " + path + " is inconsistent: " + problem);
        }

        featureBuilder.restore(artifact.featureColumns(), artifact.encoders());
        this.classifier = artifact.classifier();
        this.scaler = artifact.scaler();
        this.header = artifact.header();
        this.trainedType = artifact.modelType();
        this.trainedAt = artifact.trainedAt();
        this.state = PredictorState.TRAINED;
        log.info("Loaded {} model trained at {} from {}", trainedType.getConfigName(), trainedAt, path);
    }

    /**
     * Restores from {@code path} if the file exists.
     *
     * @return true if a model was loaded
     */
    public boolean restoreIfPresent(Path path) {
        if (!Files.exists(path)) {
            log.debug("No saved model at {}", path);
            return false;
        }
        restore(path);
        return true;
    }

    public PredictorState getState() {
        return state;
    }

    public boolean isTrained() {
        return state == PredictorState.TRAINED;
    }

    public ModelType getTrainedType() {
        return trainedType;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public FeatureBuilder getFeatureBuilder() {
        return featureBuilder;
    }

    private void reset() {
        classifier = null;
        scaler = null;
        header = null;
        trainedType = null;
        trainedAt = null;
        featureBuilder.reset();
        state = PredictorState.UNTRAINED;
    }

    private Classifier newClassifier(ModelType modelType) {
        int seed = (int) settings.getRandomSeed();
        switch (modelType) {
            case DECISION_TREE:
                REPTree tree = new REPTree();
                tree.setMaxDepth(10);
                tree.setMinNum(2);
                tree.setSeed(seed);
                return tree;
            case RANDOM_FOREST:
            default:
                RandomForest forest = new RandomForest();
                forest.setNumIterations(100);
                forest.setMaxDepth(10);
                forest.setSeed(seed);
                forest.setNumExecutionSlots(1);
                return forest;
        }
    }

    private double[] crossValidate(Classifier template, Instances data) throws Exception {
        int folds = Math.min(settings.getCvFolds(), data.numInstances());
        if (folds < 2) {
            log.warn("Skipping cross-validation: only {} training rows", data.numInstances());
            return new double[0];
        }

        Random random = new Random(settings.getRandomSeed());
        Instances shuffled = new Instances(data);
        shuffled.randomize(random);
        shuffled.stratify(folds);

        double[] scores = new double[folds];
        for (int fold = 0; fold < folds; fold++) {
            Instances train = shuffled.trainCV(folds, fold, random);
            Instances test = shuffled.testCV(folds, fold);
            Classifier copy = AbstractClassifier.makeCopy(template);
            copy.buildClassifier(train);
            Evaluation evaluation = new Evaluation(train);
            evaluation.evaluateModel(copy, test);
            scores[fold] = evaluation.pctCorrect() / 100.0;
        }
        return scores;
    }

    /**
     * Mean absolute change in induction probability when one feature column is
     * shuffled, normalized to sum to 1 and ordered descending.
     */
    private Map<String, Double> permutationImportance(Classifier model, Instances data) throws Exception {
        int inductIndex = data.classAttribute().indexOfValue(INDUCT_VALUE);
        double[] baseline = probabilities(model, data, inductIndex);
        Random random = new Random(settings.getRandomSeed());

        Map<String, Double> raw = new LinkedHashMap<>();
        double total = 0;
        for (int attr = 0; attr < data.numAttributes(); attr++) {
            if (attr == data.classIndex()) {
                continue;
            }
            Instances permuted = new Instances(data);
            for (int i = permuted.numInstances() - 1; i > 0; i--) {
                int j = random.nextInt(i + 1);
                double swap = permuted.instance(i).value(attr);
                permuted.instance(i).setValue(attr, permuted.instance(j).value(attr));
                permuted.instance(j).setValue(attr, swap);
            }
            double[] shuffled = probabilities(model, permuted, inductIndex);
            double change = 0;
            for (int i = 0; i < baseline.length; i++) {
                change += Math.abs(baseline[i] - shuffled[i]);
            }
            change /= baseline.length;
            raw.put(data.attribute(attr).name(), change);
            total += change;
        }

        double sum = total;
        Map<String, Double> ranked = new LinkedHashMap<>();
        raw.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .forEach(e -> ranked.put(e.getKey(), sum > 0 ? e.getValue() / sum : 0.0));
        return ranked;
    }

    private static double[] probabilities(Classifier model, Instances data, int inductIndex) throws Exception {
        double[] out = new double[data.numInstances()];
        for (int i = 0; i < out.length; i++) {
            out[i] = model.distributionForInstance(data.instance(i))[inductIndex];
        }
        return out;
    }

    private static Instances newHeader(List<String> columns) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String column : columns) {
            attributes.add(new Attribute(column));
        }
        attributes.add(new Attribute(CLASS_ATTRIBUTE, List.of(HOLD_VALUE, INDUCT_VALUE)));
        Instances header = new Instances("train_induction", attributes, 0);
        header.setClassIndex(attributes.size() - 1);
        return header;
    }

    /**
     * Copies {@code table} into an empty copy of {@code header}; a null
     * {@code labels} leaves the class missing.
     */
    private static Instances toInstances(Instances header, FeatureTable table, int[] labels) {
        Instances data = new Instances(header, table.rowCount());
        int classIndex = data.classIndex();
        for (int r = 0; r < table.rowCount(); r++) {
            double[] values = new double[data.numAttributes()];
            System.arraycopy(table.row(r), 0, values, 0, table.columnCount());
            DenseInstance instance = new DenseInstance(1.0, values);
            instance.setDataset(data);
            if (labels == null) {
                instance.setMissing(classIndex);
            } else {
                instance.setValue(classIndex, labels[r] == 1 ? INDUCT_VALUE : HOLD_VALUE);
            }
            data.add(instance);
        }
        return data;
    }

    private static Instances subset(Instances data, int[] indices) {
        Instances out = new Instances(data, indices.length);
        for (int index : indices) {
            out.add(data.instance(index));
        }
        return out;
    }

    private static int[][] toIntMatrix(double[][] matrix) {
        int[][] out = new int[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            out[i] = new int[matrix[i].length];
            for (int j = 0; j < matrix[i].length; j++) {
                out[i][j] = (int) Math.round(matrix[i][j]);
            }
        }
        return out;
    }

    private static double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0.0 : value;
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double std(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double mean = mean(values);
        double sq = 0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / values.length);
    }
}
