package iniconfig;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlatIniTest {

    private static final String TEST_CONFIG_INI = "src/test/resources/flat_mapper/ini/test.ompp.config.ini";

    private final FlatIni flatIni = new FlatIni();

    @Test
    void flatToMap_readsTestConfig() throws Exception {
        var inputData = Files.readString(Paths.get(TEST_CONFIG_INI));
        var map = flatIni.flatToMap(inputData);

        assertEquals("", map.get("Test.non"));
        assertEquals("", map.get("Test.rem"));
        assertEquals("new value of no comments", map.get("Test.val"));
        assertEquals("new value of UID='user'; PWD='secret';", map.get("Test.dsn"));
        assertEquals("new value of \"the # quick\" fox 'jumps # over'", map.get("Test.lst"));
        assertEquals("\"unbalanced quote                           ; this is not a comment: it is a value started from \" quote",
                map.get("Test.unb"));

        assertEquals("16807", map.get("General.StartingSeed"));
        assertEquals("8", map.get("General.Subsamples"));
        assertEquals("5000", map.get("General.Cases"));
        assertEquals("100", map.get("General.SimulationEnd"));
        assertEquals("true", map.get("General.UseSparse"));

        assertEquals("Aname,Bname,Cname,DName", map.get("multi.trim"));
        assertEquals("Multi line   text with spaces", map.get("multi.keep"));
        assertEquals("Multi line   text with spaces", map.get("multi.same"));
        assertEquals("DSN='server'; UID='user'; PWD='secret';", map.get("multi.multi1"));
        assertEquals("new value of \"the # quick\" fox \"jumps # over\"", map.get("multi.multi2"));
        assertEquals("C:\\Program Files \\Windows", map.get("multi.c-prog"));
        assertEquals(map.get("multi.c-prog"), map.get("multi.c-prog-win"));

        assertEquals("4", map.get("replace.k"));

        assertEquals("DSN='server'; UID='user'; PWD='pas#word';", map.get("escape.dsn"));
        assertEquals("the \"# quick #\" brown 'fox ; jumps' over", map.get("escape.t w"));
        assertEquals("some value", map.get("escape. key \"\" 'quoted' here "));
        assertEquals("\" allow ' unbalanced quotes                 ; with comment", map.get("escape.qts"));

        assertEquals("", map.get("end.end"));
    }

    @Test
    void flatToMap_noUnexpectedKeys() throws Exception {
        var inputData = Files.readString(Paths.get(TEST_CONFIG_INI));
        var map = flatIni.flatToMap(inputData);

        var expectedKeys = Set.of(
                "Test.non", "Test.rem", "Test.val", "Test.dsn", "Test.lst", "Test.unb",
                "General.StartingSeed", "General.Subsamples", "General.Cases", "General.SimulationEnd",
                "General.UseSparse",
                "multi.trim", "multi.keep", "multi.same", "multi.multi1", "multi.multi2",
                "multi.c-prog", "multi.c-prog-win",
                "replace.k",
                "escape.dsn", "escape.t w", "escape. key \"\" 'quoted' here ", "escape.qts",
                "end.end");
        assertEquals(expectedKeys, map.keySet());
    }

    @Test
    void flatToEntries_keepsDuplicatesInDocumentOrder() throws Exception {
        var inputData = Files.readString(Paths.get(TEST_CONFIG_INI));
        var entries = flatIni.flatToEntries(inputData);

        var replaced = entries.stream()
                .filter(e -> "replace".equals(e.getSection()))
                .map(IniEntry::getValue)
                .collect(Collectors.toList());
        assertEquals(List.of("1", "2", "3", "4"), replaced);

        var keyCount = entries.stream().filter(e -> e.getKey().equals("k")).count();
        assertTrue(flatIni.flatToMap(inputData).size() <= entries.size());
        assertEquals(4, keyCount);
    }

    @Test
    void flatToEntries_lineNumberOfContinuedEntryIsWhereKeyStarts() {
        var entries = flatIni.flatToEntries("[a]\n\nk = one \\\n  two \\\n  three\nn = 1\n");

        assertEquals(2, entries.size());
        assertEquals("a.k", entries.get(0).compositeKey());
        assertEquals("one two three", entries.get(0).getValue());
        assertEquals(3, entries.get(0).getLineNumber());
        assertEquals(6, entries.get(1).getLineNumber());
    }

    @Test
    void flatToMap_commentedValueEqualsPlainValue() {
        var plain = flatIni.flatToMap("[s]\nk = some value\n");
        var commented = flatIni.flatToMap("[s]\nk = some value ; trailing comment\n");
        var hashed = flatIni.flatToMap("[s]\nk = some value# trailing comment\n");

        assertEquals(plain, commented);
        assertEquals(plain, hashed);
    }

    @Test
    void flatToMap_nullIsEmptyDocument() {
        assertTrue(flatIni.flatToMap(null).isEmpty());
    }

    @Test
    void flatToMap_sectionHeaderTrailingTextIgnored() {
        var map = flatIni.flatToMap("[a] extra\nk = v\n");
        assertEquals(Map.of("a.k", "v"), map);
    }

    @Test
    void flatToMap_commentCharacterQuotedInSectionHeader() {
        var map = flatIni.flatToMap("[\"a;b\"]\nk = v\n");
        assertEquals(Map.of("\"a;b\".k", "v"), map);
    }

    @Test
    void flatToMap_keyBeforeSectionFails() {
        var ex = assertThrows(IniParseException.class, () -> flatIni.flatToMap("k = v\n"));

        assertEquals(IniError.KEY_BEFORE_SECTION, ex.getError());
        assertEquals(1, ex.getLineNumber());
        assertEquals("line 1: only comments or empty lines can be before first section", ex.getMessage());
    }

    @Test
    void flatToMap_errorAbortsWholeParse() {
        var ex = assertThrows(IniParseException.class,
                () -> flatIni.flatToMap("[a]\nk = v\n[b]\nno equals here\nn = 2\n"));

        assertEquals(IniError.EXPECTED_KEY_EQUALS, ex.getError());
        assertEquals(4, ex.getLineNumber());
    }

    @Test
    void unquote_stripsOnlyMatchingBoundaryQuotes() {
        assertEquals("abc", FlatIni.unquote("  \"abc\"  "));
        assertEquals("abc", FlatIni.unquote("'abc'"));
        assertEquals("\"abc'", FlatIni.unquote("\"abc'"));
        assertEquals("it's", FlatIni.unquote("\"it's\""));
        assertEquals("a \"\" b", FlatIni.unquote("\"a \"\" b\""));
        assertEquals("\"a\" b\"", FlatIni.unquote("\"a\" b\""));
        assertEquals("\"", FlatIni.unquote("\""));
        assertEquals("", FlatIni.unquote("''"));
        assertEquals("", FlatIni.unquote("   "));
        assertEquals("", FlatIni.unquote(null));
    }
}
