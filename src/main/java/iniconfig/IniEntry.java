package iniconfig;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class IniEntry {
    private String section;
    private String key;
    private String value;
    private int lineNumber;

    public String compositeKey() {
        return section + "." + key;
    }
}
