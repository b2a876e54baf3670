package iniconfig;

import java.util.Map;

public interface FlatService {
    Map<String, String> flatToMap(String data);

    String flatToString(Map<String, String> data);

    void validate(Map<String, String> data);
}
