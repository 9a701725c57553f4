package com.openforge.autopilot.intent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FilingDetailsTest {

    @Test
    void plainRequestFallsBackToDefaults() {
        FilingDetails details = FilingDetails.extract("Please file my taxes");

        assertThat(details.panNumber()).isEqualTo(FilingDetails.DEFAULT_PAN);
        assertThat(details.mobileNumber()).isEqualTo(FilingDetails.DEFAULT_MOBILE);
        assertThat(details.assessmentYear()).isEqualTo(FilingDetails.DEFAULT_ASSESSMENT_YEAR);
        assertThat(details.itrType()).isEqualTo(FilingDetails.DEFAULT_ITR_TYPE);
        assertThat(details.filingMode()).isEqualTo("Online Filing");
        assertThat(details.additionalIncomes()).hasSize(2);
        assertThat(details.deductions()).hasSize(2);
    }

    @Test
    void extractsFieldsTheUserTyped() {
        FilingDetails details = FilingDetails.extract(
                "File ITR 1 with PAN: pqrst6789k, mobile 9123456780 for assessment year 2024-25");

        assertThat(details.panNumber()).isEqualTo("PQRST6789K");
        assertThat(details.mobileNumber()).isEqualTo("9123456780");
        assertThat(details.assessmentYear()).isEqualTo("2024-25");
        assertThat(details.itrType()).isEqualTo("ITR-1");
    }

    @Test
    void readsAssessmentYearWrittenAsAy() {
        FilingDetails details = FilingDetails.extract("Start ITR filing for AY 2024-25");

        assertThat(details.assessmentYear()).isEqualTo("2024-25");
        assertThat(details.itrType()).isEqualTo(FilingDetails.DEFAULT_ITR_TYPE);
    }

    @Test
    void ignoresItrNumbersOutsideOneToFour() {
        assertThat(FilingDetails.extract("ITR 7 please").itrType()).isEqualTo("ITR-2");
    }

    @Test
    void nullTextYieldsDefaults() {
        assertThat(FilingDetails.extract(null).panNumber()).isEqualTo(FilingDetails.DEFAULT_PAN);
    }
}
