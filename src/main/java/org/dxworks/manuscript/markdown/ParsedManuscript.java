package org.dxworks.manuscript.markdown;

import org.dxworks.manuscript.model.Frontmatter;
import org.dxworks.manuscript.model.Run;
import org.dxworks.manuscript.model.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokenized manuscript: frontmatter, block tokens in document order and footnote definitions by id.
 */
public record ParsedManuscript(Frontmatter frontmatter, List<Token> tokens, Map<String, List<Run>> footnotes) {

    public ParsedManuscript {
        tokens = List.copyOf(tokens);
        footnotes = Collections.unmodifiableMap(new LinkedHashMap<>(footnotes));
    }
}
