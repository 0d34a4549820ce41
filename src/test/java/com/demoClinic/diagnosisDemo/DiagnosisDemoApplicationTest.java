package com.demoClinic.diagnosisDemo;

import com.demoClinic.diagnosisDemo.diagnosis.service.DiagnosisRecordMapper;
import com.demoClinic.diagnosisDemo.diagnosis.service.PredictionLabelCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DiagnosisDemoApplicationTest {

    @Autowired
    private DiagnosisRecordMapper diagnosisRecordMapper;

    @Autowired
    private PredictionLabelCatalog predictionLabelCatalog;

    @Test
    void contextLoadsWithBundledLabelCatalog() {
        assertThat(diagnosisRecordMapper).isNotNull();
        assertThat(predictionLabelCatalog.isKnownDrLabel("npdr moderate")).isTrue();
        assertThat(predictionLabelCatalog.isKnownGlaucomaLabel("glaucoma suspect")).isTrue();
    }
}
