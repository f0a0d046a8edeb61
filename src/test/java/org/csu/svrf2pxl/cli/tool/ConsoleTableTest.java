package org.csu.svrf2pxl.cli.tool;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConsoleTableTest {

    @Test
    void testFormatPadsToWidestCell() {
        String table = ConsoleTable.format(List.of("Name", "N"),
                List.of(List.of("METAL1", "10"), Arrays.asList("V1", null)));

        String expected = String.join("\n",
                "+--------+----+",
                "| Name   | N  |",
                "+--------+----+",
                "| METAL1 | 10 |",
                "| V1     |    |",
                "+--------+----+");
        assertEquals(expected, table);
    }

    @Test
    void testEmptyTableKeepsHeader() {
        assertEquals("+---+\n| A |\n+---+\n+---+", ConsoleTable.format(List.of("A"), List.of()));
    }
}
