package iniconfig;

public enum IniError {
    KEY_BEFORE_SECTION("only comments or empty lines can be before first section"),
    INVALID_SECTION_HEADER("invalid section name"),
    EXPECTED_KEY_EQUALS("expected key=..."),
    EMPTY_KEY("empty key");

    private final String description;

    IniError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
