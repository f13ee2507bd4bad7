package github.sarthakdev143.style_reel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "style-reel")
public record StyleReelProperties(
        @DefaultValue Storage storage,
        @DefaultValue Generation generation,
        @DefaultValue Ai ai,
        @DefaultValue Composition composition,
        @DefaultValue Maintenance maintenance) {

    public StyleReelProperties {
        if (maintenance != null && generation != null && ai != null) {
            Duration longestUnattached = generation.phaseTimeout().plus(ai.requestTimeout());
            if (maintenance.orphanGrace().compareTo(longestUnattached) <= 0) {
                throw new IllegalArgumentException(
                        "style-reel.maintenance.orphan-grace (" + maintenance.orphanGrace()
                                + ") must exceed style-reel.generation.phase-timeout plus style-reel.ai.request-timeout ("
                                + longestUnattached + ").");
            }
        }
    }

    public record Storage(
            @DefaultValue("storage") Path root) {
    }

    public record Generation(
            @DefaultValue("3") int defaultConcurrency,
            @DefaultValue("8") int maxConcurrency,
            @DefaultValue("20") int maxStyleCount,
            @DefaultValue("10m") Duration phaseTimeout,
            @DefaultValue("5s") Duration retryBackoff,
            List<String> styles,
            @DefaultValue("Keep the composition and the position of every person unchanged. "
                    + "Restyle the whole picture, faces included, in the %s style. The change of style must be obvious.")
            String promptTemplate) {

        private static final List<String> DEFAULT_STYLES = List.of(
                "Gothic Dark",
                "Big-head cartoon",
                "Vaporwave",
                "Airbrush Art",
                "Sumi-e / Ink Wash Painting",
                "Linocut / Woodcut",
                "Psychedelic Art",
                "Pre-Raphaelite Brotherhood",
                "Tenebrism / Chiaroscuro",
                "Russian Constructivism",
                "Cyberpunk",
                "Art Nouveau",
                "80's Anime",
                "White Marble Sculpture",
                "Bauhaus Style",
                "Neon Fluorescent",
                "Jackson Pollock",
                "Double Exposure",
                "Roy Lichtenstein",
                "Fauvism",
                "American Comics",
                "Cel Animation",
                "Ukiyo-e",
                "Flat Color",
                "Black and White Line Art",
                "Studio Ghibli");

        public Generation {
            styles = styles == null || styles.isEmpty() ? DEFAULT_STYLES : List.copyOf(styles);
        }
    }

    public record Ai(
            @DefaultValue("https://openrouter.ai/api/v1/chat/completions") String baseUrl,
            String apiKey,
            @DefaultValue("google/gemini-2.5-flash-image-preview") String model,
            @DefaultValue("2m") Duration requestTimeout) {
    }

    public record Composition(
            @DefaultValue("10m") Duration phaseTimeout,
            @DefaultValue("3.0") double defaultSecondsPerImage,
            @DefaultValue("0.6") double transitionSeconds,
            @DefaultValue("1280") int defaultWidth,
            @DefaultValue("720") int defaultHeight,
            @DefaultValue("30") int defaultFps,
            List<String> transitions) {

        private static final List<String> DEFAULT_TRANSITIONS = List.of("slideleft", "slideright", "slideup", "slidedown");

        public Composition {
            transitions = transitions == null || transitions.isEmpty() ? DEFAULT_TRANSITIONS : List.copyOf(transitions);
        }
    }

    public record Maintenance(
            @DefaultValue("1h") Duration orphanGrace,
            @DefaultValue("24h") Duration selectionTimeout) {
    }
}
