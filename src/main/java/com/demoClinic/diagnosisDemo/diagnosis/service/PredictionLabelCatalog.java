package com.demoClinic.diagnosisDemo.diagnosis.service;

import com.demoClinic.diagnosisDemo.diagnosis.util.LabelText;
import com.demoClinic.diagnosisDemo.util.JsonFileLoader;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Catalog of prediction labels the inference service is known to emit.
 *
 * Loaded once from a classpath JSON file. Labels are stored normalized
 * (see {@link LabelText#normalize(String)}); blank and duplicate entries are dropped
 * with a warning. A missing or unreadable file yields an empty catalog.
 */
@Slf4j
@Component
public class PredictionLabelCatalog {

    public static final String DEFAULT_CATALOG_PATH = "labels/known-prediction-labels.json";

    private final Set<String> drLabels;
    private final Set<String> glaucomaLabels;

    public PredictionLabelCatalog(
            @Value("${diagnosis.labels.catalog-path:" + DEFAULT_CATALOG_PATH + "}") String catalogPath) {
        CatalogFile file = JsonFileLoader.loadAsObjectOrNull(catalogPath, CatalogFile.class);
        if (file == null) {
            log.warn("Prediction label catalog not available at {} - every label will be reported as unrecognized",
                    catalogPath);
            file = new CatalogFile();
        }
        this.drLabels = validated("diabeticRetinopathy", file.getDiabeticRetinopathy());
        this.glaucomaLabels = validated("glaucoma", file.getGlaucoma());
        log.info("Prediction label catalog loaded from {} - DR labels: {}, glaucoma labels: {}",
                catalogPath, drLabels.size(), glaucomaLabels.size());
    }

    public boolean isKnownDrLabel(String normalizedLabel) {
        return normalizedLabel != null && drLabels.contains(normalizedLabel);
    }

    public boolean isKnownGlaucomaLabel(String normalizedLabel) {
        return normalizedLabel != null && glaucomaLabels.contains(normalizedLabel);
    }

    public Set<String> getDrLabels() {
        return drLabels;
    }

    public Set<String> getGlaucomaLabels() {
        return glaucomaLabels;
    }

    private static Set<String> validated(String section, Collection<String> labels) {
        Set<String> result = new LinkedHashSet<>();
        if (labels == null) {
            log.warn("Prediction label catalog has no '{}' section", section);
            return Collections.emptySet();
        }
        for (String label : labels) {
            String normalized = LabelText.normalize(label);
            if (normalized == null) {
                log.warn("Dropping blank label in catalog section '{}'", section);
            } else if (!result.add(normalized)) {
                log.warn("Dropping duplicate label '{}' in catalog section '{}'", label, section);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * On-disk shape of the catalog file.
     */
    @Data
    @NoArgsConstructor
    static class CatalogFile {

        private List<String> diabeticRetinopathy;

        private List<String> glaucoma;
    }
}
