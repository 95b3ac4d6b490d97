package io.github.samzhu.modelprice.document;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 定價記錄來源：即時 API 抓取或人工維護的資料檔。
 */
public enum RecordSource {

    API("api"),
    MANUAL("manual");

    private final String value;

    RecordSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
