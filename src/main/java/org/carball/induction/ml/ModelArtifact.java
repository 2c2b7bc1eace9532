package org.carball.induction.ml;

import org.carball.induction.feature.CategoryRegistry;
import org.carball.induction.model.prediction.ModelType;
import weka.classifiers.Classifier;
import weka.core.Instances;
import weka.filters.unsupervised.attribute.Standardize;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a trained predictor needs, persisted as one unit.
 */
record ModelArtifact(
        int formatVersion,
        ModelType modelType,
        Classifier classifier,
        Standardize scaler,
        Instances header,
        List<String> featureColumns,
        Map<String, CategoryRegistry> encoders,
        Instant trainedAt
) implements Serializable {

    static final int FORMAT_VERSION = 1;

    /**
     * Returns a description of the first inconsistency, or null if the
     * artifact is usable.
     */
    String inconsistency() {
        if (formatVersion != FORMAT_VERSION) {
            return "unsupported format version " + formatVersion;
        }
        if (classifier == null || scaler == null || header == null || featureColumns == null || encoders == null) {
            return "missing component";
        }
        if (header.classIndex() != header.numAttributes() - 1) {
            return "class attribute is not the last column";
        }
        if (featureColumns.size() != header.numAttributes() - 1) {
            return "feature column count " + featureColumns.size() +
                    " does not match model header (" + (header.numAttributes() - 1) + ")";
        }
        for (int i = 0; i < featureColumns.size(); i++) {
            if (!featureColumns.get(i).equals(header.attribute(i).name())) {
                return "feature column " + i + " is " + featureColumns.get(i) +
                        " but model header has " + header.attribute(i).name();
            }
        }
        return null;
    }
}
