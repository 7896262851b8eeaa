package pl.marcinmilkowski.vocab_tutor.evaluation;

/**
 * Outcome of {@link UsageClassifier#classify}.
 *
 * @param matchesExpectedRole the word plays the role its dictionary entry expects
 * @param natural             the immediate left context fits that role
 */
public record UsageAssessment(boolean matchesExpectedRole, boolean natural) {

    public boolean isCorrect() {
        return matchesExpectedRole && natural;
    }
}
