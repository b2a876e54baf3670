package iniconfig;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads ini-file content into a map of {@code section.key => value}.
 *
 * <pre>
 *  ; comments start from ; or
 *  # from # and empty lines are skipped
 *
 *  [section test]  ; section comment
 *  val = no comment
 *  rem = ; comment only and empty value
 *  dsn = "DSN='server'; UID='user'; PWD='pas#word';"   ; quoted value
 *  t w = the "# quick #" brown 'fox ; jumps' over      ; escaped: ; and # chars
 *  " key "" 'quoted' here " = some value
 *  qts = " allow ' unbalanced quotes                   ; with comment
 *  lst = Aname,\
 *        Bname
 * </pre>
 *
 * Keys and values are trimmed and unquoted. A value ending with {@code \} continues on the next line.
 * Later entries overwrite earlier ones with the same {@code section.key}.
 */
@Slf4j
public class FlatIni implements FlatService {

    private static final char LINE_SEPARATOR = '\n';
    private static final String LINE_BREAK_CHARS = "\r\n";

    @Override
    public Map<String, String> flatToMap(String data) {
        List<IniEntry> entries = flatToEntries(data);

        Map<String, String> out = new LinkedHashMap<>();
        for (IniEntry entry : entries) {
            String previous = out.put(entry.compositeKey(), entry.getValue());
            if (previous != null) {
                log.debug("line {}: {} overrides earlier value", entry.getLineNumber(), entry.compositeKey());
            }
        }
        log.debug("parsed {} entries into {} keys", entries.size(), out.size());
        return out;
    }

    /**
     * Completed entries in document order, duplicates included.
     */
    public List<IniEntry> flatToEntries(String data) {
        ParseContext ctx = new ParseContext();
        for (String rawLine : ParsedText.from(data)) {
            ctx.accept(rawLine);
        }
        ctx.finish();
        return ctx.entries;
    }

    @Override
    public String flatToString(Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            return "";
        }
        validate(data);

        Map<String, Map<String, String>> bySection = new TreeMap<>();
        for (Map.Entry<String, String> entry : data.entrySet()) {
            String compositeKey = entry.getKey();
            int dot = compositeKey.indexOf('.');
            bySection.computeIfAbsent(compositeKey.substring(0, dot), x -> new TreeMap<>())
                    .put(compositeKey.substring(dot + 1), entry.getValue());
        }

        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, Map<String, String>> section : bySection.entrySet()) {
            if (out.length() > 0) {
                out.append(LINE_SEPARATOR);
            }
            out.append('[').append(section.getKey()).append(']').append(LINE_SEPARATOR);
            for (Map.Entry<String, String> kv : section.getValue().entrySet()) {
                appendEntryLine(out, kv.getKey(), kv.getValue());
            }
        }
        return out.toString();
    }

    @Override
    public void validate(Map<String, String> data) {
        if (data == null) {
            return;
        }
        for (Map.Entry<String, String> entry : data.entrySet()) {
            String compositeKey = entry.getKey();
            Validate.isTrue(compositeKey != null, "composite key must not be null");

            int dot = compositeKey.indexOf('.');
            Validate.isTrue(dot > 0 && dot < compositeKey.length() - 1,
                    "expected section.key but found: %s", compositeKey);

            String section = compositeKey.substring(0, dot);
            String key = compositeKey.substring(dot + 1);
            String value = entry.getValue();

            Validate.isTrue(isWritableSection(section), "section name cannot be written: %s", compositeKey);
            Validate.isTrue(writeKey(key) != null, "key cannot be written: %s", compositeKey);
            Validate.isTrue(value != null, "value must not be null: %s", compositeKey);
            Validate.isTrue(writeValue(value) != null, "value cannot be written: %s", compositeKey);
        }
    }

    private static void appendEntryLine(StringBuilder out, String key, String value) {
        out.append(writeKey(key)).append(" =");
        if (!value.isEmpty()) {
            out.append(' ').append(writeValue(value));
        }
        out.append(LINE_SEPARATOR);
    }

    private static boolean isWritableSection(String section) {
        String header = "[" + section;
        return !section.isEmpty()
                && section.equals(StringUtils.strip(section))
                && StringUtils.containsNone(section, "]" + LINE_BREAK_CHARS)
                && !hasUnquotedComment(header, header.length());
    }

    /**
     * Bare text if it reads back unchanged, otherwise the same text in double or single quotes.
     * {@code null} if no form reads back.
     */
    private static String writeKey(String key) {
        if (key.isEmpty() || StringUtils.containsAny(key, LINE_BREAK_CHARS)) {
            return null;
        }
        for (String candidate : quotingCandidates(key)) {
            String line = candidate + " =";
            char first = StringUtils.strip(line).charAt(0);
            if (first != '[' && !isCommentChar(first)
                    && findKeySeparator(line) == line.length() - 1
                    && key.equals(unquote(candidate))) {
                return candidate;
            }
        }
        return null;
    }

    private static String writeValue(String value) {
        if (StringUtils.containsAny(value, LINE_BREAK_CHARS)) {
            return null;
        }
        for (String candidate : quotingCandidates(value)) {
            String fragment = candidate.substring(0, LineScan.of(candidate, QuoteState.NORMAL).end);
            if (!StringUtils.stripEnd(fragment, null).endsWith("\\") && value.equals(unquote(fragment))) {
                return candidate;
            }
        }
        return null;
    }

    private static List<String> quotingCandidates(String s) {
        return List.of(s, '"' + s + '"', '\'' + s + '\'');
    }

    /**
     * Trims and removes boundary quotes when the same quote character opens and closes the string
     * and appears inside only as a doubled pair. Otherwise the trimmed string is returned as is.
     */
    static String unquote(String src) {
        String s = StringUtils.strip(src);
        if (s == null || s.length() < 2) {
            return s == null ? "" : s;
        }
        char q = s.charAt(0);
        if (!QuoteState.isQuote(q) || s.charAt(s.length() - 1) != q) {
            return s;
        }
        String inner = s.substring(1, s.length() - 1);
        return onlyDoubled(inner, q) ? inner : s;
    }

    private static boolean onlyDoubled(String s, char q) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == q) {
                if (i + 1 >= s.length() || s.charAt(i + 1) != q) {
                    return false;
                }
                i++;
            }
        }
        return true;
    }

    private static boolean isCommentChar(char ch) {
        return ch == ';' || ch == '#';
    }

    private static boolean isCommentLine(String trimmed) {
        return !trimmed.isEmpty() && isCommentChar(trimmed.charAt(0));
    }

    private static boolean hasUnquotedComment(String line, int end) {
        return LineScan.of(line.substring(0, end), QuoteState.NORMAL).end < end;
    }

    /**
     * Position of the first {@code =} outside quotes, -1 if a comment or the end of line comes first.
     */
    private static int findKeySeparator(String line) {
        QuoteState state = QuoteState.NORMAL;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (!state.isOpen()) {
                if (ch == '=') {
                    return i;
                }
                if (isCommentChar(ch)) {
                    return -1;
                }
            }
            state = state.next(ch);
        }
        return -1;
    }

    /**
     * Scan of one physical line: where the text ends (start of an unquoted comment or end of line)
     * and the quote state at that point.
     */
    private static final class LineScan {
        final int end;
        final QuoteState state;

        private LineScan(int end, QuoteState state) {
            this.end = end;
            this.state = state;
        }

        static LineScan of(String text, QuoteState start) {
            QuoteState state = start;
            for (int i = 0; i < text.length(); i++) {
                char ch = text.charAt(i);
                if (!state.isOpen() && isCommentChar(ch)) {
                    return new LineScan(i, state);
                }
                state = state.next(ch);
            }
            return new LineScan(text.length(), state);
        }
    }

    private static final class ParseContext {
        final List<IniEntry> entries = new ArrayList<>();
        int lineNumber;
        String section;
        PendingEntry pending;

        void accept(String rawLine) {
            lineNumber++;
            String trimmed = StringUtils.strip(rawLine);

            if (trimmed.isEmpty()) {
                onBlankLine();
                return;
            }
            if (pending != null) {
                scanValue(StringUtils.stripStart(rawLine, null));
                return;
            }
            if (isCommentLine(trimmed)) {
                return;
            }
            if (trimmed.charAt(0) == '[') {
                onSectionHeader(trimmed);
                return;
            }
            if (section == null) {
                throw new IniParseException(IniError.KEY_BEFORE_SECTION, lineNumber);
            }
            onKeyLine(trimmed);
        }

        void finish() {
            if (pending != null) {
                log.debug("line {}: end of document ends continued value of {}", lineNumber, pending.key);
                flushPending();
            }
        }

        private void onBlankLine() {
            if (pending != null) {
                log.debug("line {}: empty line ends continued value of {}", lineNumber, pending.key);
                flushPending();
            }
        }

        private void onSectionHeader(String trimmed) {
            int end = trimmed.indexOf(']');
            if (end < 0 || hasUnquotedComment(trimmed, end)) {
                throw new IniParseException(IniError.INVALID_SECTION_HEADER, lineNumber);
            }
            String name = StringUtils.strip(trimmed.substring(1, end));
            if (name.isEmpty()) {
                throw new IniParseException(IniError.INVALID_SECTION_HEADER, lineNumber);
            }

            String tail = StringUtils.strip(trimmed.substring(end + 1));
            if (!tail.isEmpty() && !isCommentLine(tail)) {
                log.warn("line {}: text after section header [{}] ignored", lineNumber, name);
            }
            section = name;
        }

        private void onKeyLine(String trimmed) {
            int eq = findKeySeparator(trimmed);
            if (eq < 0) {
                throw new IniParseException(IniError.EXPECTED_KEY_EQUALS, lineNumber);
            }

            String key = unquote(trimmed.substring(0, eq));
            if (key.isEmpty()) {
                throw new IniParseException(IniError.EMPTY_KEY, lineNumber);
            }

            pending = new PendingEntry(key, lineNumber);
            scanValue(trimmed.substring(eq + 1));
        }

        private void scanValue(String text) {
            LineScan scan = LineScan.of(text, pending.quote);
            pending.quote = scan.state;

            String fragment = text.substring(0, scan.end);
            String body = StringUtils.stripEnd(fragment, null);
            if (!body.endsWith("\\")) {
                pending.value.append(fragment);
                completePending();
                return;
            }

            String beforeSlash = body.substring(0, body.length() - 1);
            if (scan.state.isOpen()) {
                pending.value.append(beforeSlash);
                return;
            }
            // whitespace before an unquoted \ joins as a single space
            String stripped = StringUtils.stripEnd(beforeSlash, null);
            pending.value.append(stripped);
            if (stripped.length() < beforeSlash.length()) {
                pending.value.append(' ');
            }
        }

        private void flushPending() {
            if (pending.quote.isOpen()) {
                log.warn("line {}: value of {}.{} ends inside an open quote",
                        pending.lineNumber, section, pending.key);
            }
            completePending();
        }

        private void completePending() {
            entries.add(IniEntry.builder()
                    .section(section)
                    .key(pending.key)
                    .value(unquote(pending.value.toString()))
                    .lineNumber(pending.lineNumber)
                    .build());
            pending = null;
        }
    }

    private static final class PendingEntry {
        final String key;
        final int lineNumber;
        final StringBuilder value = new StringBuilder();
        QuoteState quote = QuoteState.NORMAL;

        PendingEntry(String key, int lineNumber) {
            this.key = key;
            this.lineNumber = lineNumber;
        }
    }
}
