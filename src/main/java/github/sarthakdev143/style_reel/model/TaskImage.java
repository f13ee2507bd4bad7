package github.sarthakdev143.style_reel.model;

public record TaskImage(
        String fileId,
        String styleLabel,
        int generationIndex,
        GenerationFailureKind errorKind,
        String errorMessage) {

    public static TaskImage generated(String fileId, String styleLabel, int generationIndex) {
        return new TaskImage(fileId, styleLabel, generationIndex, null, null);
    }

    public static TaskImage failed(
            String styleLabel,
            int generationIndex,
            GenerationFailureKind errorKind,
            String errorMessage) {
        return new TaskImage(null, styleLabel, generationIndex, errorKind, errorMessage);
    }

    public boolean succeeded() {
        return fileId != null && errorKind == null;
    }
}
