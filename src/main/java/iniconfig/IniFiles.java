package iniconfig;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

/**
 * Reads an ini-file from disk and parses it with {@link FlatIni}.
 */
@Slf4j
public final class IniFiles {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private IniFiles() {
    }

    /**
     * @param path         ini-file path, {@code null} if there is no ini-file
     * @param encodingName code page of the file, e.g. {@code windows-1252}; UTF-8 if blank
     * @return map of {@code section.key => value}, empty if path is {@code null}
     */
    public static Map<String, String> read(Path path, String encodingName) {
        if (path == null) {
            return Collections.emptyMap();
        }
        Charset charset = StringUtils.isBlank(encodingName)
                ? StandardCharsets.UTF_8
                : Charset.forName(encodingName.trim());

        String content;
        try {
            content = Files.readString(path, charset);
        } catch (IOException e) {
            throw new UncheckedIOException("reading ini-file failed: " + path, e);
        }
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }

        log.debug("reading ini-file {} as {}", path, charset.name());
        return new FlatIni().flatToMap(content);
    }
}
