package com.aceflow.research.service.extract;

import com.aceflow.research.dto.DocumentLink;

import java.util.List;

public record ParsedDocument(String title, List<DocumentBlock> blocks, List<DocumentLink> links) {

    public ParsedDocument {
        blocks = List.copyOf(blocks);
        links = List.copyOf(links);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
