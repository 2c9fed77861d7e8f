package org.dxworks.manuscript.citation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.manuscript.model.CitationMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the JSON payload out of field instruction text.
 */
public final class CitationFieldParser {

    private static final Logger LOG = LoggerFactory.getLogger(CitationFieldParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CitationFieldParser() {}

    public static boolean isCitation(String instruction) {
        return instruction.contains("ZOTERO_ITEM") && instruction.contains("CSL_CITATION");
    }

    public static boolean isBibliography(String instruction) {
        return instruction.contains("ZOTERO_BIBL");
    }

    /** Empty when the instruction carries no readable payload. */
    public static Optional<ZoteroCitation> parse(String instruction) {
        int start = instruction.indexOf('{');
        int end = instruction.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        JsonNode payload;
        try {
            payload = MAPPER.readTree(instruction.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            LOG.debug("Unreadable citation payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        List<CitationMetadata> items = new ArrayList<>();
        for (JsonNode item : payload.path("citationItems")) {
            items.add(CslItems.metadata(item));
        }
        if (items.isEmpty()) {
            return Optional.empty();
        }
        JsonNode plain = payload.path("properties").path("plainCitation");
        return Optional.of(new ZoteroCitation(plain.isTextual() ? plain.asText() : null, items));
    }
}
