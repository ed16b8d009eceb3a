package com.care.assist.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * JSON 檔案載入工具
 * 從 resources 目錄讀取 JSON 檔案並轉換為設定物件
 */
public final class JsonLoader {

    private static final Logger logger = LoggerFactory.getLogger(JsonLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonLoader() {
    }

    /**
     * 載入指定的 classpath JSON 檔案
     *
     * @param jsonFile JSON 檔案名稱（位於 resources 目錄下）
     * @param type     目標型別
     * @return 解析結果
     * @throws IllegalStateException 找不到檔案或格式錯誤
     */
    public static <T> T load(String jsonFile, Class<T> type) {
        try (InputStream is = JsonLoader.class.getResourceAsStream("/" + jsonFile)) {
            if (is == null) {
                logger.error("找不到檔案: {}", jsonFile);
                throw new IllegalStateException("Missing classpath resource: " + jsonFile);
            }
            T value = MAPPER.readValue(is, type);
            logger.info("成功載入設定檔 {}", jsonFile);
            return value;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            logger.error("載入 JSON 檔案時發生錯誤: {}: {}", jsonFile, e.getMessage());
            throw new IllegalStateException("Unreadable classpath resource: " + jsonFile, e);
        }
    }
}
