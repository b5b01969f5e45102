package org.dxworks.texmd;

/**
 * Thrown when a single input holds more than one top-level {@code document} environment.
 */
public class MultipleDocumentsException extends TexmdException {

    private final int documentCount;

    public MultipleDocumentsException(int documentCount) {
        super("Multiple documents in a single file are not supported (found " + documentCount + ")");
        this.documentCount = documentCount;
    }

    public int getDocumentCount() {
        return documentCount;
    }
}
