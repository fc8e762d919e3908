package com.example.routing.semantic;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.example.routing.config.RuleTables;
import com.example.routing.model.IntentCategory;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;

class LexicalSemanticRouterTest {

    static SemanticRoute route(String name, String... utterances) {
        return new SemanticRoute(name, IntentCategory.REQUEST, name, List.of(utterances), null, null, null);
    }

    @Test
    void exactUtteranceMatchesBundledRoute() {
        LexicalSemanticRouter router =
            new LexicalSemanticRouter(RuleTables.defaults().semanticRoutes(), 0.85, OpenTelemetry.noop());

        SemanticRouteResult result = router.route("資料庫連線有問題");

        assertTrue(result.matched());
        assertEquals("database_issue", result.routeName());
        assertEquals(IntentCategory.INCIDENT, result.category());
        assertEquals(1.0, result.similarity(), 1e-9);
        assertEquals("lexical", result.metadata().get("backend"));
    }

    @Test
    void belowThresholdReportsBestSimilarity() {
        LexicalSemanticRouter router = new LexicalSemanticRouter(
            List.of(route("password", "reset my password")), 0.85, OpenTelemetry.noop());

        SemanticRouteResult result = router.route("reset my email");

        assertFalse(result.matched());
        assertNull(result.routeName());
        assertTrue(result.similarity() > 0.0 && result.similarity() < 0.85,
            "similarity was " + result.similarity());
    }

    @Test
    void blankInputIsNoMatch() {
        LexicalSemanticRouter router = new LexicalSemanticRouter(
            List.of(route("password", "reset my password")), 0.85, OpenTelemetry.noop());

        assertFalse(router.route("  ").matched());
        assertFalse(router.route(null).matched());
    }

    @Test
    void routesWithoutUtterancesAreSkipped() {
        LexicalSemanticRouter router = new LexicalSemanticRouter(
            List.of(route("empty"), route("ok", "hello there")), 0.85, OpenTelemetry.noop());

        assertEquals(1, router.routes().size());
        assertEquals(1, router.reload(List.of(route("other", "something"), route("empty"))));
        assertEquals("other", router.routes().get(0).name());
    }

    @ParameterizedTest
    @CsvSource({
        "'資料庫連線有問題',   '資料庫連線有問題',   1.0",
        "'資料庫連線有點問題', '資料庫連線有問題',   0.8",
        "'abc',                'xyz',                0.0",
        "'a',                  'a',                  1.0",
    })
    void diceSimilarityOverBigrams(String a, String b, double expected) {
        assertEquals(expected, LexicalSemanticRouter.similarity(a, b), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
        "'database connection failed', 'failed database connection', 1.0",
        "'reset my password',          'reset my email',             0.6666666667",
        "'VPN 斷線',                   'vpn, 斷線!',                 1.0",
        "'系統很慢',                   '系統很慢了',                 0.0",
    })
    void tokenOverlapIgnoresWordOrder(String a, String b, double expected) {
        assertEquals(expected, LexicalSemanticRouter.tokenOverlap(
            LexicalSemanticRouter.tokens(a), LexicalSemanticRouter.tokens(b)), 1e-9);
    }

    @Test
    void reorderedWordsStillMatchRoute() {
        LexicalSemanticRouter router = new LexicalSemanticRouter(
            List.of(route("db_down", "database connection failed")), 0.85, OpenTelemetry.noop());

        SemanticRouteResult result = router.route("failed database connection");

        assertTrue(result.matched());
        assertEquals(1.0, result.similarity(), 1e-9);
    }

    @Test
    void normalizationDropsCaseWhitespaceAndPunctuation() {
        assertEquals("helloworld", LexicalSemanticRouter.normalize("Hello, World!"));
        assertEquals("系統很慢", LexicalSemanticRouter.normalize("系統，很慢。"));
    }
}
