package com.example.routing.classifier;

import java.util.List;
import java.util.Locale;

import com.example.routing.model.IntentCategory;

/**
 * Ordered keyword table shared by the offline classifier and the last-resort
 * branch of {@link LlmResponseParser}. Specific sub-intents come before the
 * generic per-category entries; the first entry with a hit wins.
 */
final class KeywordIntentInference {

    static final double SPECIFIC_BASE = 0.70;
    static final double GENERIC_CONFIDENCE = 0.55;
    static final double PER_EXTRA_HIT = 0.05;
    static final double MAX_CONFIDENCE = 0.90;

    record Entry(IntentCategory category, String subIntent, boolean generic, List<String> keywords) {}

    record Inference(IntentCategory category, String subIntent, double confidence, List<String> hits) {
        static Inference none() {
            return new Inference(IntentCategory.UNKNOWN, null, 0.0, List.of());
        }
    }

    private static final List<Entry> TABLE = List.of(
        new Entry(IntentCategory.INCIDENT, "etl_failure", false,
            List.of("etl", "pipeline", "批次", "排程", "資料管道")),
        new Entry(IntentCategory.INCIDENT, "system_unavailable", false,
            List.of("當機", "掛了", "無法使用", "打不開", "進不去", "outage", " down")),
        new Entry(IntentCategory.INCIDENT, "performance_issue", false,
            List.of("很慢", "變慢", "不太順", "卡卡", "等很久", "效能", "slow", "latency")),
        new Entry(IntentCategory.REQUEST, "account_request", false,
            List.of("帳號", "帳戶", "account")),
        new Entry(IntentCategory.REQUEST, "access_request", false,
            List.of("權限", "存取", "permission", "access")),
        new Entry(IntentCategory.CHANGE, "release_deployment", false,
            List.of("部署", "上線", "發布", "發佈", "deploy", "release")),
        new Entry(IntentCategory.QUERY, "status_inquiry", false,
            List.of("進度", "狀態", "status")),
        new Entry(IntentCategory.CHANGE, "general_change", true,
            List.of("變更", "修改", "更新", "調整", "升級", "change", "update", "upgrade")),
        new Entry(IntentCategory.INCIDENT, "general_incident", true,
            List.of("錯誤", "失敗", "異常", "故障", "壞了", "error", "fail", "broken")),
        new Entry(IntentCategory.REQUEST, "general_request", true,
            List.of("申請", "需要", "幫我", "安裝", "request", "install", "please")),
        new Entry(IntentCategory.QUERY, "general_query", true,
            List.of("請問", "如何", "怎麼", "什麼", "哪裡", "how", "what", "where", "?", "？"))
    );

    private KeywordIntentInference() {}

    static Inference infer(String text) {
        if (text == null || text.isBlank()) {
            return Inference.none();
        }
        String lowered = " " + text.toLowerCase(Locale.ROOT);
        for (Entry entry : TABLE) {
            List<String> hits = entry.keywords().stream().filter(lowered::contains).toList();
            if (hits.isEmpty()) {
                continue;
            }
            double confidence = entry.generic()
                ? GENERIC_CONFIDENCE
                : Math.min(MAX_CONFIDENCE, SPECIFIC_BASE + PER_EXTRA_HIT * (hits.size() - 1));
            return new Inference(entry.category(), entry.subIntent(), confidence, hits);
        }
        return Inference.none();
    }

    /** Category only, for raw LLM text that names a category without structure. */
    static IntentCategory categoryMentioned(String raw) {
        if (raw == null) {
            return IntentCategory.UNKNOWN;
        }
        String lowered = raw.toLowerCase(Locale.ROOT);
        for (IntentCategory category : IntentCategory.values()) {
            if (category != IntentCategory.UNKNOWN && lowered.contains(category.value())) {
                return category;
            }
        }
        return IntentCategory.UNKNOWN;
    }
}
