package com.care.assist.util;

import com.care.assist.model.SupportResource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * resource-directory.json 的對應結構
 */
public class ResourceDirectoryConfig {

    private String defaultLocale = "US";
    private String defaultEmergencyNumber = "911";
    private String crisisLine = "988";
    private Map<String, LocaleEntry> locales = new LinkedHashMap<>();

    public String getDefaultLocale() {
        return defaultLocale;
    }

    public void setDefaultLocale(String defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    public String getDefaultEmergencyNumber() {
        return defaultEmergencyNumber;
    }

    public void setDefaultEmergencyNumber(String defaultEmergencyNumber) {
        this.defaultEmergencyNumber = defaultEmergencyNumber;
    }

    public String getCrisisLine() {
        return crisisLine;
    }

    public void setCrisisLine(String crisisLine) {
        this.crisisLine = crisisLine;
    }

    public Map<String, LocaleEntry> getLocales() {
        return locales;
    }

    public void setLocales(Map<String, LocaleEntry> locales) {
        this.locales = locales;
    }

    public static class LocaleEntry {
        private String emergencyNumber;
        private List<SupportResource> resources = new ArrayList<>();

        public String getEmergencyNumber() {
            return emergencyNumber;
        }

        public void setEmergencyNumber(String emergencyNumber) {
            this.emergencyNumber = emergencyNumber;
        }

        public List<SupportResource> getResources() {
            return resources;
        }

        public void setResources(List<SupportResource> resources) {
            this.resources = resources;
        }
    }
}
