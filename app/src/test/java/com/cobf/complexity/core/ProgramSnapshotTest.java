package com.cobf.complexity.core;

import com.cobf.complexity.frontend.ast.CNode.FuncDef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProgramSnapshotTest {

    @Test
    void testReadRegeneratesSource(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("prog.c");
        Files.writeString(file, "int main(void) { return 0; }\n");

        ProgramSnapshot snapshot = ProgramSnapshot.read(file);

        assertEquals("int main(void) { return 0; }\n", snapshot.source());
        assertEquals(1, snapshot.tree().ext().size());
        assertTrue(snapshot.regenerated().contains("return 0;"), "Regenerated text should keep the body");
    }

    @Test
    void testReadToleratesLatin1Bytes(@TempDir Path tempDir) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.writeBytes("/* caf".getBytes(StandardCharsets.US_ASCII));
        bytes.write(0xE9);
        bytes.writeBytes(" */\nint main(void) { return 0; }\n".getBytes(StandardCharsets.US_ASCII));
        Path file = tempDir.resolve("latin1.c");
        Files.write(file, bytes.toByteArray());

        ProgramSnapshot snapshot = ProgramSnapshot.read(file);

        assertTrue(snapshot.source().contains("�"), "Invalid UTF-8 should decode to the replacement character");
        assertEquals("main", ((FuncDef) snapshot.tree().ext().get(0)).name());
    }
}
