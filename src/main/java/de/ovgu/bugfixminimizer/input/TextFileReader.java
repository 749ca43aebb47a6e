package de.ovgu.bugfixminimizer.input;

import de.ovgu.bugfixminimizer.error.EncodingException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads file contents as UTF-8, rejecting malformed input instead of replacing it.
 */
public final class TextFileReader {
    private TextFileReader() {
    }

    public static byte[] readBytes(Path file) throws IOException {
        return Files.readAllBytes(file);
    }

    /**
     * @param name Name of the content, for the error message
     * @throws EncodingException if the bytes are not valid UTF-8
     */
    public static String decode(byte[] content, String name) throws EncodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(content)).toString();
        } catch (CharacterCodingException e) {
            throw new EncodingException(name, e);
        }
    }
}
