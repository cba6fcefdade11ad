package com.aceflow.research.dto;

/**
 * Outbound link found in a fetched page.
 */
public record DocumentLink(String url, String anchorText) {
}
