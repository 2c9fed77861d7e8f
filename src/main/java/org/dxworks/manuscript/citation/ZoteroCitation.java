package org.dxworks.manuscript.citation;

import org.dxworks.manuscript.model.CitationMetadata;

import java.util.List;

/**
 * Parsed payload of a citation field: the plain citation text shown in the document and the cited items.
 */
public record ZoteroCitation(String plainCitation, List<CitationMetadata> items) {

    public ZoteroCitation {
        items = List.copyOf(items);
    }
}
