package org.dxworks.jsxframe.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class ValidationInfo {
    public String name;
    public String fieldKey;
    /** Rule name to literal value (String, Number or Boolean; regexes as {@code /pattern/flags}). */
    public Map<String, Object> rules = new LinkedHashMap<>();

    public ValidationInfo(String name, String fieldKey) {
        this.name = name;
        this.fieldKey = fieldKey;
    }
}
