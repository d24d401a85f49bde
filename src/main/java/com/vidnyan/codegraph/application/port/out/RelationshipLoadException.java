package com.vidnyan.codegraph.application.port.out;

import java.nio.file.Path;

/**
 * Relationships could not be read from their source.
 */
public class RelationshipLoadException extends RuntimeException {
    
    private final transient Path source;
    
    public RelationshipLoadException(Path source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }
    
    public Path getSource() {
        return source;
    }
}
