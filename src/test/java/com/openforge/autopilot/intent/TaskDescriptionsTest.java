package com.openforge.autopilot.intent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskDescriptionsTest {

    @Test
    void filingTaskExpandsToTheSixPhaseTemplate() {
        IntentResult filing = new IntentResult(Intent.TAX_FILING, true, TaskType.TAX_FILING, "start_filing", 0.95);

        String task = TaskDescriptions.forIntent(filing, "Please file my ITR for 2023-24");

        assertThat(task)
                .startsWith("User request: 'Please file my ITR for 2023-24'")
                .contains("- PAN Number: ABCDE1234F")
                .contains("- Mobile: 9876543210")
                .contains("Select Assessment Year \"2023-24\"")
                .contains("Select ITR Type \"ITR-2\"")
                .contains("1. LOGIN PHASE", "2. START FILING PHASE", "3. PRE-FILLED INFO PHASE",
                        "4. INCOME & DEDUCTIONS PHASE", "5. TAX SUMMARY & PAYMENT PHASE", "6. FINAL SUBMISSION")
                .contains("* Select \"Rental Income\" from dropdown")
                .contains("* Enter amount: 3252530")
                .contains("* Enter description: \"Health Insurance Premium\"");
    }

    @Test
    void otherTasksUseTheMessageAsIs() {
        IntentResult form = new IntentResult(Intent.FORM_FILLING, true, TaskType.FORM_FILLING, null, 0.8);

        assertThat(TaskDescriptions.forIntent(form, "Fill the passport form"))
                .isEqualTo("Fill the passport form");
    }
}
