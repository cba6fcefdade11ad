package com.aceflow.research.service.extract;

/**
 * Turns raw fetched content into an ordered list of blocks.
 */
public interface DocumentParser {

    /**
     * @param contentType response content type, may be null
     * @param content     raw body
     */
    boolean supports(String contentType, String content);

    /**
     * @throws RuntimeException when the content cannot be parsed; the caller skips the document
     */
    ParsedDocument parse(String url, String content);
}
