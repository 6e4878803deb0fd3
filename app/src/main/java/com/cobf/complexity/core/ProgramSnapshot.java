package com.cobf.complexity.core;

import com.cobf.complexity.frontend.CGenerator;
import com.cobf.complexity.frontend.CParser;
import com.cobf.complexity.frontend.ast.CNode.FileAst;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A program as analysed: the literal source text, its syntax tree and the
 * text regenerated from that tree.
 */
public record ProgramSnapshot(String source, FileAst tree, String regenerated) {

    public static ProgramSnapshot of(String source, FileAst tree) {
        return new ProgramSnapshot(source, tree, new CGenerator().generate(tree));
    }

    /**
     * Parses source text into a snapshot.
     *
     * @throws com.cobf.complexity.frontend.CParseException if the text is not valid C
     */
    public static ProgramSnapshot parse(String source) {
        return of(source, CParser.parse(source));
    }

    /**
     * Reads and parses a source file. Bytes that are not valid UTF-8 decode
     * to the replacement character instead of failing the read.
     */
    public static ProgramSnapshot read(Path file) throws IOException {
        return parse(decode(Files.readAllBytes(file)));
    }

    private static String decode(byte[] data) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPLACE);
        decoder.onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(data)).toString();
        } catch (CharacterCodingException e) {
            return new String(data, StandardCharsets.ISO_8859_1);
        }
    }
}
