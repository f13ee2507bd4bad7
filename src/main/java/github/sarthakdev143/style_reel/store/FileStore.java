package github.sarthakdev143.style_reel.store;

import github.sarthakdev143.style_reel.model.FileKind;
import github.sarthakdev143.style_reel.model.StoredFile;

import java.util.List;
import java.util.Optional;

public interface FileStore {

    StoredFile put(byte[] bytes, FileKind kind, String contentType);

    Optional<StoredFile> find(String fileId);

    byte[] read(String fileId);

    boolean delete(String fileId);

    List<StoredFile> list();
}
