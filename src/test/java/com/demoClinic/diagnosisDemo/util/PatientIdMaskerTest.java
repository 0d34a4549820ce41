package com.demoClinic.diagnosisDemo.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatientIdMaskerTest {

    @Test
    void keepsFirstAndLastTwoCharacters() {
        assertThat(PatientIdMasker.mask("pat-7f3a9c21")).isEqualTo("pa****21");
    }

    @Test
    void fiveCharactersIsTheShortestPartlyVisibleId() {
        assertThat(PatientIdMasker.mask("abcde")).isEqualTo("ab****de");
    }

    @Test
    void fullyMasksShortOrMissingIds() {
        assertThat(PatientIdMasker.mask(null)).isEqualTo("****");
        assertThat(PatientIdMasker.mask("")).isEqualTo("****");
        assertThat(PatientIdMasker.mask("abcd")).isEqualTo("****");
    }
}
