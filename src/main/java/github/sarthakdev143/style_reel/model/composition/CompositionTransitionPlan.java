package github.sarthakdev143.style_reel.model.composition;

public record CompositionTransitionPlan(
        String transitionId,
        double durationSec) {

    public static final String CUT = "cut";

    public static CompositionTransitionPlan cut() {
        return new CompositionTransitionPlan(CUT, 0.0);
    }

    public boolean isCut() {
        return CUT.equals(transitionId) || durationSec <= 0.0;
    }
}
