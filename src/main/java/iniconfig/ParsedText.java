package iniconfig;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Physical lines of a document. CR, LF and CRLF all end a line and are not part of it.
 * Every {@link #iterator()} walks the text again from the start.
 */
final class ParsedText implements Iterable<String> {

    private final String text;

    private ParsedText(String text) {
        this.text = text;
    }

    static ParsedText from(String text) {
        return new ParsedText(text == null ? "" : text);
    }

    @Override
    public Iterator<String> iterator() {
        return new LineIterator(text);
    }

    private static final class LineIterator implements Iterator<String> {
        private final String text;
        private int pos;

        LineIterator(String text) {
            this.text = text;
        }

        @Override
        public boolean hasNext() {
            return pos < text.length();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int start = pos;
            int end = nextLineBreak(start);
            if (end < 0) {
                pos = text.length();
                return text.substring(start);
            }
            pos = end + 1;
            if (text.charAt(end) == '\r' && pos < text.length() && text.charAt(pos) == '\n') {
                pos++;
            }
            return text.substring(start, end);
        }

        private int nextLineBreak(int from) {
            for (int i = from; i < text.length(); i++) {
                char ch = text.charAt(i);
                if (ch == '\n' || ch == '\r') {
                    return i;
                }
            }
            return -1;
        }
    }
}
