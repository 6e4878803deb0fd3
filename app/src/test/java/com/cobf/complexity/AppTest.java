package com.cobf.complexity;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void testPositionalFilesAndOptions() {
        App.CliArgs args = App.parseArgs(new String[] {
                "old.c", "--csv", "report.csv", "new.c", "--graphs", "graphs", "--config", "c.yaml" });

        assertNotNull(args);
        assertEquals(Path.of("old.c"), args.oldFile());
        assertEquals(Path.of("new.c"), args.newFile());
        assertEquals(Path.of("report.csv"), args.csvFile());
        assertEquals(Path.of("graphs"), args.graphsDir());
        assertEquals(Path.of("c.yaml"), args.configFile());
    }

    @Test
    void testMissingFileGivesNull() {
        assertNull(App.parseArgs(new String[] { "old.c" }));
        assertNull(App.parseArgs(new String[] {}));
    }

    @Test
    void testUnknownOptionsAndExtraArgumentsAreIgnored() {
        App.CliArgs args = App.parseArgs(new String[] { "--verbose", "a.c", "b.c", "c.c" });

        assertNotNull(args);
        assertEquals(Path.of("a.c"), args.oldFile());
        assertEquals(Path.of("b.c"), args.newFile());
        assertNull(args.csvFile());
    }
}
