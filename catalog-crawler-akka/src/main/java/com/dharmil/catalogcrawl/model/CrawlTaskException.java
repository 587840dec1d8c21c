package com.dharmil.catalogcrawl.model;

/**
 * Raised by fetch/parse/persist collaborators to report a classified task failure.
 */
public class CrawlTaskException extends Exception {

    private static final long serialVersionUID = 1L;

    private final CrawlErrorKind kind;

    public CrawlTaskException(CrawlErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CrawlTaskException(CrawlErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CrawlTaskException httpStatus(int status, String url) {
        return new CrawlTaskException(CrawlErrorKind.fromHttpStatus(status),
                "HTTP " + status + " for " + url);
    }

    public CrawlErrorKind kind() {
        return kind;
    }
}
