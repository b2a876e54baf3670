package iniconfig;

/**
 * Quote tracking for the line scanner. A quote closes only on the character that opened it,
 * so an apostrophe inside a "double quoted" text is ordinary content and vice versa.
 */
public enum QuoteState {
    NORMAL('\0'),
    IN_SINGLE_QUOTE('\''),
    IN_DOUBLE_QUOTE('"');

    private final char quoteChar;

    QuoteState(char quoteChar) {
        this.quoteChar = quoteChar;
    }

    public QuoteState next(char ch) {
        if (this == NORMAL) {
            if (ch == '\'') {
                return IN_SINGLE_QUOTE;
            }
            if (ch == '"') {
                return IN_DOUBLE_QUOTE;
            }
            return NORMAL;
        }
        return ch == quoteChar ? NORMAL : this;
    }

    public boolean isOpen() {
        return this != NORMAL;
    }

    public char quoteChar() {
        return quoteChar;
    }

    public static boolean isQuote(char ch) {
        return ch == '\'' || ch == '"';
    }
}
