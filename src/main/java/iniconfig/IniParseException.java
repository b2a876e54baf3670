package iniconfig;

import lombok.Getter;

/**
 * Structural error in an ini document. The whole parse is abandoned, no partial mapping is returned.
 */
@Getter
public class IniParseException extends RuntimeException {

    private final IniError error;
    private final int lineNumber;

    public IniParseException(IniError error, int lineNumber) {
        super("line " + lineNumber + ": " + error.getDescription());
        this.error = error;
        this.lineNumber = lineNumber;
    }
}
