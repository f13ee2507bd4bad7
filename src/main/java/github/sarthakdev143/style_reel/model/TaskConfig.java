package github.sarthakdev143.style_reel.model;

import java.util.List;

public record TaskConfig(
        int styleCount,
        List<String> styles,
        int width,
        int height,
        int fps,
        List<String> transitions,
        int concurrencyLimit,
        CompositionSelection autoSelection) {

    public TaskConfig {
        styles = styles == null ? List.of() : List.copyOf(styles);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
}
