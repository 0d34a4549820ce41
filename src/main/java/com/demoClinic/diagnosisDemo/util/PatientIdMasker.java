package com.demoClinic.diagnosisDemo.util;

/**
 * Masks patient identifiers before they reach a log line.
 *
 * Ids longer than four characters keep two characters at each end ("pat-7f3a9c21"
 * logs as "pa****21"). Anything shorter, and a missing id, logs as a bare "****"
 * so neither the value nor its length leaks.
 */
public final class PatientIdMasker {

    private static final String MASK = "****";
    private static final int VISIBLE_EDGE = 2;

    private PatientIdMasker() {
    }

    public static String mask(String patientId) {
        if (patientId == null || patientId.length() <= 2 * VISIBLE_EDGE) {
            return MASK;
        }
        int tailStart = patientId.length() - VISIBLE_EDGE;
        return patientId.substring(0, VISIBLE_EDGE) + MASK + patientId.substring(tailStart);
    }
}
