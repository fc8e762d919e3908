package com.example.routing.dialog;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.router.BusinessIntentRouter;

/**
 * Per-conversation context: the decision being refined, the fields collected
 * so far and the turn history. Not thread-safe; one instance belongs to one
 * conversation.
 */
public class ConversationContextManager {

    private static final Logger log = LoggerFactory.getLogger(ConversationContextManager.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /** Keyword alternation to normalized value; the first matching entry per field wins. */
    record Normalizer(String field, Pattern pattern, String value) {}

    /** Free-text capture; the first non-empty group is the value. */
    record Capture(String field, Pattern pattern) {}

    private static final List<Normalizer> NORMALIZERS = List.of(
        normalizer("affected_system", "ETL|Pipeline|批次|排程", "ETL"),
        normalizer("affected_system", "網路|network|網絡|VPN", "網路"),
        normalizer("affected_system", "ERP|SAP", "ERP"),
        normalizer("affected_system", "郵件|email|mail|Exchange|Outlook", "郵件系統"),
        normalizer("affected_system", "API|Gateway|服務|service", "API"),
        normalizer("affected_system", "資料庫|database|DB|SQL|Oracle", "資料庫"),
        normalizer("affected_system", "CRM|客戶關係", "CRM"),
        normalizer("affected_system", "訂單|order|交易|trading", "訂單系統"),
        normalizer("affected_system", "網站|website|portal|入口", "網站"),
        normalizer("affected_system", "後台|backend|管理系統|admin", "後台系統"),

        normalizer("symptom_type", "報錯|error|錯誤|失敗|fail", "報錯"),
        normalizer("symptom_type", "慢|slow|延遲|lag|卡", "效能問題"),
        normalizer("symptom_type", "當機|down|掛|停止|unavailable", "系統當機"),
        normalizer("symptom_type", "斷線|disconnect|連不上|無法連接", "連線問題"),
        normalizer("symptom_type", "超時|timeout|逾時", "超時"),
        normalizer("symptom_type", "登入|login|登錄|認證", "登入問題"),
        normalizer("symptom_type", "異常|abnormal|不正常", "異常"),

        normalizer("urgency", "緊急|urgent|馬上|立刻|asap|critical", "緊急"),
        normalizer("urgency", "嚴重|影響業務|影響生產|客戶影響", "嚴重"),
        normalizer("urgency", "一般|正常|普通", "一般"),

        normalizer("request_type", "帳號|account|用戶", "帳號"),
        normalizer("request_type", "權限|access|permission|存取", "權限"),
        normalizer("request_type", "軟體|software|安裝|install", "軟體"),
        normalizer("request_type", "設備|hardware|電腦|laptop", "設備"),
        normalizer("request_type", "密碼|password|重設|reset", "密碼重設"),
        normalizer("request_type", "VPN", "VPN"),

        normalizer("change_type", "部署|deploy|發布|release", "部署"),
        normalizer("change_type", "配置|config|設定", "配置"),
        normalizer("change_type", "升級|upgrade|更新|update", "升級"),
        normalizer("change_type", "遷移|migration|搬遷", "遷移"));

    private static final List<Capture> CAPTURES = List.of(
        new Capture("error_message", Pattern.compile(
            "[「\"'](.+?)[」\"']|error[：:]\\s*(.+?)(?:[。,，]|$)", FLAGS)),
        new Capture("requester", Pattern.compile(
            "(?:申請人|用戶|使用者|員工)[：:]\\s*([^\\s,，。]+)|(?:幫|為|給)\\s*([^\\s,，。]+?)\\s*(?:申請|開)", FLAGS)),
        new Capture("justification", Pattern.compile(
            "(?:因為|由於|為了|原因)[：:]?\\s*(.+?)(?:[。,，]|$)", FLAGS)),
        new Capture("target_system", Pattern.compile(
            "(?:目標|對象|在)\\s*([^\\s,，。]+?)\\s*(?:上|中|系統|$)", FLAGS)));

    private final RefinementRules refinementRules;
    private final CompletenessChecker completenessChecker;
    private final Clock clock;

    private RoutingDecision originalDecision;
    private RoutingDecision currentDecision;
    private final Map<String, String> collected = new LinkedHashMap<>();
    private final List<DialogTurn> history = new ArrayList<>();
    private final List<String> userTexts = new ArrayList<>();
    private final List<String> refinementsApplied = new ArrayList<>();

    public ConversationContextManager(RefinementRules refinementRules, CompletenessChecker completenessChecker,
                                      Clock clock) {
        this.refinementRules = refinementRules;
        this.completenessChecker = completenessChecker;
        this.clock = clock;
    }

    /** Seeds the context with the decision of the opening turn and the fields its text already carries. */
    public void initialize(RoutingDecision decision, String initialText) {
        reset();
        this.originalDecision = decision;
        this.currentDecision = decision;
        String text = initialText != null ? initialText : "";
        userTexts.add(text);
        Map<String, String> extracted = extractFields(decision.intentCategory(), text);
        merge(extracted);
        history.add(new DialogTurn(DialogTurn.Role.USER, text, clock.instant(), extracted, collected));
    }

    /**
     * Folds a user response into the context: extracts fields, applies at most
     * one refinement rule, and recomputes completeness over everything said so
     * far. Returns the updated decision.
     */
    public RoutingDecision update(String userText) {
        if (currentDecision == null) {
            throw new IllegalStateException("Context has not been initialized");
        }
        String text = userText != null ? userText : "";
        IntentCategory category = currentDecision.intentCategory();
        userTexts.add(text);

        Map<String, String> extracted = extractFields(category, text);
        merge(extracted);

        String currentSubIntent = currentSubIntent();
        Optional<RefinementRule> refinement = refinementRules.find(category, currentSubIntent, collected);

        RoutingDecision.Builder builder = currentDecision.toBuilder()
            .routingLayer(RoutingLayer.DIALOG)
            .timestamp(clock.instant())
            .putMetadata("original_layer", originalDecision.routingLayer().value())
            .putMetadata("dialog_turns", userTexts.size() - 1)
            .putMetadata("collected_fields", new ArrayList<>(collected.keySet()));

        if (refinement.isPresent() && !refinement.get().toSubIntent().equals(currentSubIntent)) {
            RefinementRule rule = refinement.get();
            refinementsApplied.add(rule.id());
            builder.subIntent(rule.toSubIntent())
                .workflowType(BusinessIntentRouter.workflowFor(category, rule.toSubIntent()))
                .reasoning(currentDecision.reasoning() + " | Refined by " + rule.id() + ": "
                    + currentSubIntent + " → " + rule.toSubIntent());
            log.info("Sub-intent refined by {}: {} → {}", rule.id(), currentSubIntent, rule.toSubIntent());
        }
        builder.putMetadata("refinements", List.copyOf(refinementsApplied));

        CompletenessInfo completeness = completenessChecker.check(category, accumulatedText(), collected);
        currentDecision = builder.completeness(completeness).build();

        history.add(new DialogTurn(DialogTurn.Role.USER, text, clock.instant(), extracted, collected));
        return currentDecision;
    }

    public void addAssistantTurn(String message) {
        history.add(new DialogTurn(DialogTurn.Role.ASSISTANT, message, clock.instant(), Map.of(), collected));
    }

    /**
     * Field values found in one piece of text: normalized keyword tables and
     * captures first, then the checker's own extraction for the remaining
     * fields of the category.
     */
    public Map<String, String> extractFields(IntentCategory category, String text) {
        Map<String, String> extracted = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return extracted;
        }
        for (Normalizer normalizer : NORMALIZERS) {
            if (!extracted.containsKey(normalizer.field()) && normalizer.pattern().matcher(text).find()) {
                extracted.put(normalizer.field(), normalizer.value());
            }
        }
        for (Capture capture : CAPTURES) {
            if (extracted.containsKey(capture.field())) {
                continue;
            }
            firstGroup(capture.pattern().matcher(text)).ifPresent(value -> extracted.put(capture.field(), value));
        }
        completenessChecker.extractFields(category, text).forEach(extracted::putIfAbsent);
        return extracted;
    }

    /** Sub-intent the refinement rules see; decisions without one read as {@code general_<category>}. */
    public String currentSubIntent() {
        String subIntent = currentDecision.subIntent();
        if (subIntent == null || subIntent.isBlank()) {
            return "general_" + currentDecision.intentCategory().value();
        }
        return subIntent;
    }

    public String accumulatedText() {
        return String.join("\n", userTexts);
    }

    public RoutingDecision currentDecision() {
        return currentDecision;
    }

    public RoutingDecision originalDecision() {
        return originalDecision;
    }

    public Map<String, String> collectedInfo() {
        return Map.copyOf(collected);
    }

    public List<DialogTurn> history() {
        return List.copyOf(history);
    }

    public List<String> refinementsApplied() {
        return List.copyOf(refinementsApplied);
    }

    public void reset() {
        originalDecision = null;
        currentDecision = null;
        collected.clear();
        history.clear();
        userTexts.clear();
        refinementsApplied.clear();
    }

    // Values already collected are kept; later answers only fill gaps.
    private void merge(Map<String, String> extracted) {
        extracted.forEach(collected::putIfAbsent);
    }

    private static Optional<String> firstGroup(Matcher matcher) {
        if (!matcher.find()) {
            return Optional.empty();
        }
        for (int i = 1; i <= matcher.groupCount(); i++) {
            String group = matcher.group(i);
            if (group != null && !group.isBlank()) {
                return Optional.of(group.strip());
            }
        }
        return Optional.empty();
    }

    private static Normalizer normalizer(String field, String alternation, String value) {
        return new Normalizer(field, Pattern.compile(alternation, FLAGS), value);
    }
}
