package quest.gekko.pulse.domain;

public enum FeedbackAction {
    MORE_LIKE_THIS(true),
    GREAT_EXPLAINER(true),
    MORE_LAUNCHES(true),
    TOO_INTENSE(false),
    TOO_FLUFFY(false),
    TOO_SHORT(false),
    NOT_RELEVANT(false);

    private final boolean positive;

    FeedbackAction(boolean positive) {
        this.positive = positive;
    }

    public boolean isPositive() {
        return positive;
    }

    public double signal() {
        return positive ? 1.0 : -1.0;
    }
}
