package github.sarthakdev143.style_reel.dto;

public record SweepResponse(
        int removedFiles) {
}
