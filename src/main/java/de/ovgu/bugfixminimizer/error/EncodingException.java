package de.ovgu.bugfixminimizer.error;

import java.nio.charset.CharacterCodingException;

/**
 * Thrown if the content of a file is not valid UTF-8.
 */
public class EncodingException extends MinimizationException {
    public EncodingException(String fileName, CharacterCodingException cause) {
        super("Content of " + fileName + " is not valid UTF-8", cause);
    }
}
