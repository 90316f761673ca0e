package com.adlanda.authorityindexer.exception;

import java.nio.file.Path;

/**
 * A document file could not be read or parsed.
 */
public class DocumentLoadException extends RuntimeException {

    private final Path path;

    public DocumentLoadException(Path path, Throwable cause) {
        super("Failed to load documents from " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
