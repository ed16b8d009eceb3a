package com.care.assist.util;

import java.util.ArrayList;
import java.util.List;

/**
 * risk-keywords.json 的對應結構
 */
public class RiskKeywordConfig {

    private List<KeywordGroup> groups = new ArrayList<>();
    private List<PatternRule> patterns = new ArrayList<>();
    private List<String> immediacyIndicators = new ArrayList<>();
    private List<String> planIndicators = new ArrayList<>();
    private List<String> meansIndicators = new ArrayList<>();
    private List<String> specificKeywords = new ArrayList<>();

    public List<KeywordGroup> getGroups() {
        return groups;
    }

    public void setGroups(List<KeywordGroup> groups) {
        this.groups = groups;
    }

    public List<PatternRule> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<PatternRule> patterns) {
        this.patterns = patterns;
    }

    public List<String> getImmediacyIndicators() {
        return immediacyIndicators;
    }

    public void setImmediacyIndicators(List<String> immediacyIndicators) {
        this.immediacyIndicators = immediacyIndicators;
    }

    public List<String> getPlanIndicators() {
        return planIndicators;
    }

    public void setPlanIndicators(List<String> planIndicators) {
        this.planIndicators = planIndicators;
    }

    public List<String> getMeansIndicators() {
        return meansIndicators;
    }

    public void setMeansIndicators(List<String> meansIndicators) {
        this.meansIndicators = meansIndicators;
    }

    public List<String> getSpecificKeywords() {
        return specificKeywords;
    }

    public void setSpecificKeywords(List<String> specificKeywords) {
        this.specificKeywords = specificKeywords;
    }

    public static class KeywordGroup {
        private String id;
        private String severity;
        private List<String> keywords = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords;
        }
    }

    public static class PatternRule {
        private String id;
        private String severity;
        private String regex;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }

        public String getRegex() {
            return regex;
        }

        public void setRegex(String regex) {
            this.regex = regex;
        }
    }
}
