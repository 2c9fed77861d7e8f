package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Block read from a document body. Mirrors {@link org.dxworks.manuscript.model.Token} with extracted runs.
 */
class ExtractedBlock {

    TokenType type;
    int level;
    boolean ordered;
    Boolean checked;
    String language;
    String alertType;
    StringBuilder code;
    List<List<List<ExtractedRun>>> rows = new ArrayList<>();
    List<ExtractedRun> runs = new ArrayList<>();

    ExtractedBlock(TokenType type) {
        this.type = type;
    }

    /** All run lists of the block: its own runs, or one per table cell. */
    List<List<ExtractedRun>> runLists() {
        if (type != TokenType.TABLE) {
            return List.of(runs);
        }
        List<List<ExtractedRun>> lists = new ArrayList<>();
        for (List<List<ExtractedRun>> row : rows) {
            lists.addAll(row);
        }
        return lists;
    }
}
