package com.production.pdf_analysis.extract;

import java.nio.charset.StandardCharsets;

/**
 * Raw PDF bytes with a human-friendly name (file name or last URL segment).
 */
public record PdfSource(byte[] data, String sourceName) {

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

    public boolean hasPdfSignature() {
        if (data == null || data.length < PDF_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PDF_SIGNATURE.length; i++) {
            if (data[i] != PDF_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    public long byteSize() {
        return data == null ? 0 : data.length;
    }
}
