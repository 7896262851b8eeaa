package pl.marcinmilkowski.vocab_tutor.evaluation;

/**
 * Overall judgement of how the learner used the target word.
 */
public enum UsageVerdict {
    CORRECT("Correct"),
    MOSTLY_CORRECT("Mostly correct"),
    INCORRECT("Incorrect");

    private final String label;

    UsageVerdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
