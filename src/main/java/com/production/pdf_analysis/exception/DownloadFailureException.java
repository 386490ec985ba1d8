package com.production.pdf_analysis.exception;

import lombok.Getter;

/**
 * Network or HTTP failure while fetching a PDF. {@code statusCode} is -1 when no
 * response was received (connection error, timeout).
 */
@Getter
public class DownloadFailureException extends PdfAnalysisException {

    private final int statusCode;

    public DownloadFailureException(String message, int statusCode) {
        super(ErrorKind.DOWNLOAD_FAILURE, message);
        this.statusCode = statusCode;
    }

    public DownloadFailureException(String message, Throwable cause) {
        super(ErrorKind.DOWNLOAD_FAILURE, message, cause);
        this.statusCode = -1;
    }
}
