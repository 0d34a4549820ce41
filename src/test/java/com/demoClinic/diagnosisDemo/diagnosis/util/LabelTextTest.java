package com.demoClinic.diagnosisDemo.diagnosis.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LabelTextTest {

    @Test
    void normalizesSeparatorsAndCase() {
        assertThat(LabelText.normalize("NPDR_Moderate")).isEqualTo("npdr moderate");
        assertThat(LabelText.normalize("  Glaucoma__Suspect \t")).isEqualTo("glaucoma suspect");
        assertThat(LabelText.normalize("No DR")).isEqualTo("no dr");
    }

    @Test
    void blankLabelsNormalizeToNull() {
        assertThat(LabelText.normalize(null)).isNull();
        assertThat(LabelText.normalize("")).isNull();
        assertThat(LabelText.normalize(" _ ")).isNull();
    }

    @Test
    void capitalizesOnlyTheFirstCharacter() {
        assertThat(LabelText.capitalizeFirst("mild diabetic retinopathy")).isEqualTo("Mild diabetic retinopathy");
        assertThat(LabelText.capitalizeFirst("x")).isEqualTo("X");
        assertThat(LabelText.capitalizeFirst("")).isEmpty();
        assertThat(LabelText.capitalizeFirst(null)).isNull();
    }
}
