package com.care.assist.service;

import com.care.assist.model.ResourceBundle;

/**
 * 資源目錄服務（唯讀）
 */
public interface ResourceDirectoryService {

    String CATEGORY_SUICIDE_PREVENTION = "suicide_prevention";
    String CATEGORY_DOMESTIC_VIOLENCE = "domestic_violence";
    String CATEGORY_SUBSTANCE_ABUSE = "substance_abuse";
    String CATEGORY_MENTAL_HEALTH = "mental_health";

    /**
     * 依地區與類別查詢資源；類別為空時回傳該地區全部資源，
     * 類別查無資料時退回自殺防治熱線，因此結果不會是空的。
     */
    ResourceBundle lookup(String locale, String category);

    /**
     * 地區緊急電話；未知地區回傳預設值
     */
    String emergencyNumber(String locale);

    /**
     * 危機專線號碼
     */
    String crisisLine();
}
