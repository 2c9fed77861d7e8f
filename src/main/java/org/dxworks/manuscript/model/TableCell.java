package org.dxworks.manuscript.model;

import java.util.List;

public record TableCell(List<Run> runs) {

    public TableCell {
        runs = List.copyOf(runs);
    }
}
