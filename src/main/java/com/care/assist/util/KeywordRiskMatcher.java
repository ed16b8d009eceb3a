package com.care.assist.util;

import com.care.assist.model.RiskVerdict;
import com.care.assist.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 關鍵字風險比對器 (Keyword Risk Matcher)
 * <p>
 * 功能：
 * 風險監控的確定性路徑，永遠可用、不依賴任何外部服務。
 * <p>
 * 評分規則：
 * 1. 每個關鍵字群組有基礎等級，命中即產生一個風險因子。
 * 2. 出現「立即性」指標（now、tonight ...）時，MEDIUM/HIGH 上調一級。
 * 3. 出現「計畫」指標時，LOW/MEDIUM 上調一級。
 * 4. 出現「工具」指標（gun、pills ...）時，MEDIUM/HIGH 上調一級。
 * 5. 信心分數 = 0.6 + 每個命中 0.1（上限 0.3）+ 明確關鍵字 0.1。
 * 6. 最近幾回合的內容若曾命中 MEDIUM 以上，只以 LOW 計入，代表持續性訊號。
 * 7. 整體結果取所有因子的最大等級。
 */
public class KeywordRiskMatcher {

    private static final double BASE_CONFIDENCE = 0.6;
    private static final double PATTERN_CONFIDENCE = 0.8;
    private static final double NO_MATCH_CONFIDENCE = 0.5;

    private final List<CompiledGroup> groups = new ArrayList<>();
    private final List<CompiledPattern> patterns = new ArrayList<>();
    private final List<Pattern> immediacy;
    private final List<Pattern> plan;
    private final List<Pattern> means;
    private final List<String> specificKeywords;

    public KeywordRiskMatcher(RiskKeywordConfig config) {
        for (RiskKeywordConfig.KeywordGroup g : config.getGroups()) {
            List<Keyword> keywords = new ArrayList<>();
            for (String kw : g.getKeywords()) {
                keywords.add(new Keyword(normalize(kw), phrase(kw)));
            }
            groups.add(new CompiledGroup(g.getId(), Severity.parse(g.getSeverity(), Severity.MEDIUM), keywords));
        }
        for (RiskKeywordConfig.PatternRule p : config.getPatterns()) {
            patterns.add(new CompiledPattern(p.getId(), Severity.parse(p.getSeverity(), Severity.MEDIUM),
                    Pattern.compile(p.getRegex(), Pattern.CASE_INSENSITIVE)));
        }
        this.immediacy = phrases(config.getImmediacyIndicators());
        this.plan = phrases(config.getPlanIndicators());
        this.means = phrases(config.getMeansIndicators());
        this.specificKeywords = config.getSpecificKeywords().stream().map(KeywordRiskMatcher::normalize).toList();
    }

    /**
     * 從 classpath 的 risk-keywords.json 建立比對器
     */
    public static KeywordRiskMatcher fromClasspath(String jsonFile) {
        return new KeywordRiskMatcher(JsonLoader.load(jsonFile, RiskKeywordConfig.class));
    }

    /**
     * 評估單一回合
     *
     * @param text    遮罩後的使用者訊息
     * @param context 最近幾回合的遮罩後訊息
     * @param now     判定時間
     * @return 關鍵字路徑的風險判定（不會標記為 degraded）
     */
    public RiskVerdict assess(String text, List<String> context, long now) {
        String normalized = normalize(text);
        Severity overall = Severity.NONE;
        double confidence = NO_MATCH_CONFIDENCE;
        Set<String> signals = new LinkedHashSet<>();

        for (CompiledGroup group : groups) {
            List<String> hits = group.hits(normalized);
            if (hits.isEmpty()) {
                continue;
            }
            Severity severity = adjust(group.severity(), normalized, signals);
            double c = BASE_CONFIDENCE + Math.min(hits.size() * 0.1, 0.3);
            if (hits.stream().anyMatch(specificKeywords::contains)) {
                c += 0.1;
            }
            signals.add("keyword:" + group.id());
            if (severity.compareTo(overall) > 0 || (severity == overall && c > confidence)) {
                overall = severity;
                confidence = c;
            }
        }

        for (CompiledPattern p : patterns) {
            if (p.pattern().matcher(normalized).find()) {
                signals.add("pattern:" + p.id());
                if (p.severity().compareTo(overall) > 0
                        || (p.severity() == overall && PATTERN_CONFIDENCE > confidence)) {
                    overall = p.severity();
                    confidence = PATTERN_CONFIDENCE;
                }
            }
        }

        if (context != null && overall.compareTo(Severity.LOW) < 0) {
            for (String previous : context) {
                String prev = normalize(previous);
                for (CompiledGroup group : groups) {
                    if (group.severity().isAtLeast(Severity.MEDIUM) && !group.hits(prev).isEmpty()) {
                        signals.add("context:" + group.id());
                        overall = Severity.LOW;
                        confidence = BASE_CONFIDENCE;
                    }
                }
            }
        }

        return new RiskVerdict(overall, Math.min(1.0, confidence), new ArrayList<>(signals), false, now);
    }

    private Severity adjust(Severity base, String text, Set<String> signals) {
        Severity severity = base;
        if (anyMatch(immediacy, text) && (severity == Severity.MEDIUM || severity == Severity.HIGH)) {
            severity = severity.raise();
            signals.add("indicator:immediacy");
        }
        if (anyMatch(plan, text) && (severity == Severity.LOW || severity == Severity.MEDIUM)) {
            severity = severity.raise();
            signals.add("indicator:plan");
        }
        if (anyMatch(means, text) && (severity == Severity.MEDIUM || severity == Severity.HIGH)) {
            severity = severity.raise();
            signals.add("indicator:means");
        }
        return severity;
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> phrases(List<String> words) {
        return words.stream().map(KeywordRiskMatcher::phrase).toList();
    }

    private static Pattern phrase(String word) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(normalize(word)) + "(?![\\p{L}\\p{N}])");
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'')
                .replaceAll("\\s+", " ")
                .trim();
    }

    private record Keyword(String text, Pattern pattern) {
    }

    private record CompiledGroup(String id, Severity severity, List<Keyword> keywords) {
        List<String> hits(String normalizedText) {
            List<String> out = new ArrayList<>();
            for (Keyword k : keywords) {
                if (k.pattern().matcher(normalizedText).find()) {
                    out.add(k.text());
                }
            }
            return out;
        }
    }

    private record CompiledPattern(String id, Severity severity, Pattern pattern) {
    }
}
