package github.sarthakdev143.style_reel.exception;

public class StoredFileNotFoundException extends RuntimeException {

    private final String fileId;

    public StoredFileNotFoundException(String fileId) {
        super("File not found for id: " + fileId);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
