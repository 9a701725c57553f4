package com.openforge.autopilot.intent;

/**
 * Expands a classified chat message into the instructions handed to the agent.
 *
 * Pure functions: the output depends only on the message and its {@link FilingDetails}.
 */
public final class TaskDescriptions {

    private TaskDescriptions() {}

    public static String forIntent(IntentResult intent, String userMessage) {
        if (intent.taskType() == TaskType.TAX_FILING) {
            return taxFiling(userMessage, FilingDetails.extract(userMessage));
        }
        return userMessage;
    }

    public static String taxFiling(String userMessage, FilingDetails details) {
        StringBuilder incomes = new StringBuilder();
        for (FilingDetails.Income income : details.additionalIncomes()) {
            incomes.append("\n         * Click \"Add Income\" button")
                   .append("\n         * Select \"").append(income.type()).append("\" from dropdown")
                   .append("\n         * Enter amount: ").append(income.amount());
        }

        StringBuilder deductions = new StringBuilder();
        for (FilingDetails.Deduction deduction : details.deductions()) {
            deductions.append("\n         * Click \"Add Deduction\" button")
                      .append("\n         * Select \"").append(deduction.type()).append('"')
                      .append("\n         * Enter description: \"").append(deduction.description()).append('"')
                      .append("\n         * Enter amount: ").append(deduction.amount());
        }

        return """
                User request: '%s'

                Based on the user request, perform tax filing automation with the following details:
                - PAN Number: %s
                - Mobile: %s
                - Assessment Year: %s
                - ITR Type: %s

                Follow these steps precisely to complete the tax filing process:

                1. LOGIN PHASE:
                   - Verify login form elements are present: PAN Number field, Captcha field, "Get OTP" button
                   - Enter PAN: %s
                   - Read and enter the captcha shown on screen
                   - Click "Get OTP" button
                   - When OTP field appears, enter: 123456
                   - Click final login button
                   - Verify successful login by checking for dashboard elements

                2. START FILING PHASE:
                   - On dashboard, locate "File ITR" section
                   - Click "Start Filing" button
                   - In the filing form:
                     * Select Assessment Year "%s"
                     * Select ITR Type "%s"
                     * Choose Filing Mode "%s"
                   - Click "Continue" button

                3. PRE-FILLED INFO PHASE:
                   - Review pre-filled information and verify personal details
                   - Click "Continue to Income & Deductions"

                4. INCOME & DEDUCTIONS PHASE:
                   - Under "Other Income" section:%s

                   - Under "Deductions" section:%s

                   - Click "Continue to Tax Summary"

                5. TAX SUMMARY & PAYMENT PHASE:
                   - Review and verify the tax calculation summary
                   - Click "Continue to Payment"
                   - Select any available payment method and click "Make Payment"

                6. FINAL SUBMISSION:
                   - Review all information on the submission page
                   - Check "I accept the above declaration"
                   - Click "Submit Return"
                   - Verify the success message and note the acknowledgment number

                Important instructions:
                - Wait for each page to load completely before acting
                - If an element is not found, wait a moment and try again
                - If any step fails, report detailed error information
                """.formatted(
                userMessage,
                details.panNumber(), details.mobileNumber(), details.assessmentYear(), details.itrType(),
                details.panNumber(),
                details.assessmentYear(), details.itrType(), details.filingMode(),
                incomes, deductions);
    }
}
