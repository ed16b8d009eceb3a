package com.care.assist.service.impl;

import com.care.assist.model.ResourceBundle;
import com.care.assist.model.SupportResource;
import com.care.assist.service.ResourceDirectoryService;
import com.care.assist.util.JsonLoader;
import com.care.assist.util.ResourceDirectoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 資源目錄服務實作
 * <p>
 * 啟動時從 classpath 載入 resource-directory.json，之後只讀。
 * 未知地區的資源退回預設地區（US），緊急電話退回 defaultEmergencyNumber。
 */
@Service
public class ResourceDirectoryServiceImpl implements ResourceDirectoryService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceDirectoryServiceImpl.class);

    private final ResourceDirectoryConfig directory;

    @Autowired
    public ResourceDirectoryServiceImpl(@Value("${assist.resources.file:resource-directory.json}") String jsonFile) {
        this(JsonLoader.load(jsonFile, ResourceDirectoryConfig.class));
    }

    public ResourceDirectoryServiceImpl(ResourceDirectoryConfig directory) {
        this.directory = directory;
        logger.info("資源目錄載入完成，共 {} 個地區", directory.getLocales().size());
    }

    @Override
    public ResourceBundle lookup(String locale, String category) {
        String key = normalize(locale);
        ResourceDirectoryConfig.LocaleEntry entry = directory.getLocales().get(key);
        if (entry == null) {
            key = directory.getDefaultLocale();
            entry = directory.getLocales().get(key);
        }
        List<SupportResource> all = entry != null ? entry.getResources() : List.of();

        List<SupportResource> matched = new ArrayList<>();
        if (category == null || category.isBlank()) {
            matched.addAll(all);
        } else {
            for (SupportResource r : all) {
                if (category.equalsIgnoreCase(r.category())) {
                    matched.add(r);
                }
            }
            if (matched.isEmpty()) {
                for (SupportResource r : all) {
                    if (CATEGORY_SUICIDE_PREVENTION.equals(r.category())) {
                        matched.add(r);
                    }
                }
            }
        }
        return new ResourceBundle(key, category, emergencyNumber(locale), matched);
    }

    @Override
    public String emergencyNumber(String locale) {
        ResourceDirectoryConfig.LocaleEntry entry = directory.getLocales().get(normalize(locale));
        if (entry == null || entry.getEmergencyNumber() == null) {
            return directory.getDefaultEmergencyNumber();
        }
        return entry.getEmergencyNumber();
    }

    @Override
    public String crisisLine() {
        return directory.getCrisisLine();
    }

    private String normalize(String locale) {
        return locale != null ? locale.trim().toUpperCase(Locale.ROOT) : "";
    }
}
