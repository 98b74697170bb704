package io.quantum.core.spi;

/** File storage collaborator used by {@code q:file}. Paths are interpreted by the implementation. */
public interface FileService {

    String read(String path);

    void write(String path, String content);
}
