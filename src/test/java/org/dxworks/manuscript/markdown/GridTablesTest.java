package org.dxworks.manuscript.markdown;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GridTablesTest {

    @Test
    void gridIsRewrittenAsPipeTable() {
        String grid = "  +------+------+\n"
                + "  | x    | y|z  |\n"
                + "  +------+------+\n"
                + "  | 1    |      |\n"
                + "  +------+------+";

        assertEquals("| x | y\\|z |\n| --- | --- |\n| 1 |  |", GridTables.toPipeTables(grid));
    }

    @Test
    void blankLinesSeparateTableFromText() {
        String text = "before\n+---+\n| a |\n+---+\nafter";

        assertEquals("before\n\n| a |\n| --- |\n\nafter", GridTables.toPipeTables(text));
    }

    @Test
    void incompleteGridIsLeftAlone() {
        String text = "+---+---+\n| a | b |\nnot a row";

        assertEquals(text, GridTables.toPipeTables(text));
    }
}
