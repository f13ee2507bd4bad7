package github.sarthakdev143.style_reel.service;

@FunctionalInterface
public interface CompositionProgressListener {

    CompositionProgressListener NONE = fraction -> {
    };

    void onProgress(double fraction);
}
