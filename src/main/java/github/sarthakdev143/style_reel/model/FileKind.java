package github.sarthakdev143.style_reel.model;

public enum FileKind {
    UPLOAD("uploads"),
    GENERATED_IMAGE("generated"),
    VIDEO("videos");

    private final String directoryName;

    FileKind(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }
}
