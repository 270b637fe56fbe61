package com.jay.alm.exception;

import java.nio.file.Path;

/**
 * A feed extract is missing, unreadable or carries a malformed record.
 * Always fatal for the run: no partial ledger is persisted.
 */
public class FeedParseException extends AlmException {

    private final String source;

    public FeedParseException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public FeedParseException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public FeedParseException(Path file, String message, Throwable cause) {
        this(String.valueOf(file.getFileName()), message, cause);
    }

    public String getSource() {
        return source;
    }
}
