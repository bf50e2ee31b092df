package com.di.insightnova.recommendation;

import com.di.insightnova.exception.IllegalStatusTransitionException;
import com.di.insightnova.exception.ResourceNotFoundException;
import com.di.insightnova.insight.InsightType;
import com.di.insightnova.insight.StreamInsight;
import com.di.insightnova.insight.Urgency;
import com.di.insightnova.support.InsightNovaFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecommendationService Tests")
class RecommendationServiceTest {

    private InsightNovaFixture f;

    @BeforeEach
    void setUp() {
        f = new InsightNovaFixture();
        f.stub.onText("1. Call the EMEA distributor\n2. Raise safety stock\n3. Brief sales", "generate 3 specific action item")
                .onText("Review the Q1 EMEA revenue dashboard", "Identify relevant information")
                .onText("Weigh margin against fulfilment risk", "Provide decision support")
                .onText("- EMEA orders doubled\n- Stock at 40%\n- Prior spike lasted a week", "Extract 3 key pieces")
                .onDouble(0.9, "Rate the urgency of action items")
                .onDouble(0.6, "Rate the importance of information sharing")
                .onDouble(0.8, "Rate the criticality of decision support");
    }

    private UserContext context(String userId, String discussion) {
        UserContextRequest request = new UserContextRequest();
        request.setRole("ops_manager");
        request.setActiveProjects(Arrays.asList("emea-launch", null));
        request.setRecentQueries(List.of("why are EMEA orders up?"));
        request.setDiscussionContext(discussion);
        request.setConstraints(List.of("budget freeze"));
        return f.recommendationService.upsertContext(userId, request);
    }

    private void insight(String id, String content) {
        f.insightStore.saveAll(List.of(StreamInsight.builder()
                .id(id)
                .sourceItemId("evt-" + id)
                .type(InsightType.CONTEXTUAL)
                .content(content)
                .confidence(0.8)
                .urgency(Urgency.HIGH)
                .targetUsers("all_users")
                .embedding(new float[]{1f, 0f, 0f})
                .createdAt(f.clock.instant())
                .expiresAt(f.clock.instant().plus(Duration.ofHours(24)))
                .build()));
    }

    // =========================================================================
    // Refresh
    // =========================================================================

    @Test
    @DisplayName("Should produce one recommendation per type, ordered by priority")
    void testRefreshProducesThreeRecommendations() {
        insight("ins-1", "EMEA orders doubled week over week");
        context("u-1", "Planning EMEA stock levels");

        assertEquals(1, f.recommendationService.refreshActiveUsers());

        List<Recommendation> recs = f.recommendationService.getRecommendations("u-1", null, null);
        assertEquals(3, recs.size());
        assertEquals(List.of(RecommendationType.ACTION_ITEM, RecommendationType.DECISION_SUPPORT,
                        RecommendationType.INFORMATION),
                recs.stream().map(Recommendation::getType).collect(Collectors.toList()));

        Recommendation action = recs.get(0);
        assertEquals("Recommended Actions", action.getTitle());
        assertEquals(0.9, action.getPriority(), 1e-9);
        assertEquals(0.85, action.getConfidence(), 1e-9);
        assertEquals(List.of("EMEA orders doubled", "Stock at 40%", "Prior spike lasted a week"),
                action.getSupportingEvidence());
        assertEquals(InteractionStatus.PENDING, action.getInteractionStatus());
        assertEquals(1, f.stub.count("Find patterns"));
        assertEquals(1, f.stub.count("EMEA orders doubled week over week"
                + " (confidence: 0.80)"));
    }

    @Test
    @DisplayName("Should skip history prompts when no insight is available")
    void testNoHistory() {
        context("u-1", "Planning EMEA stock levels");

        assertEquals(1, f.recommendationService.refreshActiveUsers());

        assertEquals(0, f.stub.count("Find patterns"));
        assertEquals(0, f.stub.count("Extract key decision points"));
        assertEquals(1, f.stub.count("Historical similar situations: none available"));
    }

    @Test
    @DisplayName("Should expire recommendations after four hours")
    void testExpiry() {
        context("u-1", "Planning EMEA stock levels");
        f.recommendationService.refreshActiveUsers();

        f.clock.advance(Duration.ofHours(4).minusSeconds(1));
        assertEquals(3, f.recommendationService.getRecommendations("u-1", null, null).size());

        f.clock.advance(Duration.ofSeconds(2));
        assertTrue(f.recommendationService.getRecommendations("u-1", null, null).isEmpty());
    }

    @Test
    @DisplayName("Should not regenerate while recommendations are newer than the context")
    void testSkipWhenFresh() {
        context("u-1", "Planning EMEA stock levels");
        assertEquals(1, f.recommendationService.refreshActiveUsers());

        f.clock.advance(Duration.ofMinutes(5));
        assertEquals(0, f.recommendationService.refreshActiveUsers());

        context("u-1", "Planning APAC stock levels");
        f.clock.advance(Duration.ofMinutes(5));
        assertEquals(1, f.recommendationService.refreshActiveUsers());
        assertEquals(2, f.stub.count("Provide decision support"));
    }

    @Test
    @DisplayName("Should only refresh users active within the last two hours")
    void testActiveWindow() {
        context("u-1", "Planning EMEA stock levels");
        f.clock.advance(Duration.ofHours(2).plusSeconds(1));

        assertEquals(0, f.recommendationService.refreshActiveUsers());
        assertEquals(0, f.stub.count("Provide decision support"));
    }

    @Test
    @DisplayName("Should save nothing when a gateway call fails mid-way")
    void testFailureSavesNothing() {
        context("u-1", "Planning EMEA stock levels");
        f.stub.failOn("Rate the criticality of decision support");

        assertEquals(0, f.recommendationService.refreshActiveUsers());
        assertTrue(f.recommendationService.getRecommendations("u-1", null, null).isEmpty());

        f.stub.clearFailures();
        assertEquals(1, f.recommendationService.refreshActiveUsers());
    }

    // =========================================================================
    // Query and status
    // =========================================================================

    @Test
    @DisplayName("Should filter by type and honour the limit")
    void testQueryFilters() {
        context("u-1", "Planning EMEA stock levels");
        f.recommendationService.refreshActiveUsers();

        List<Recommendation> info = f.recommendationService.getRecommendations("u-1",
                EnumSet.of(RecommendationType.INFORMATION), null);
        assertEquals(1, info.size());
        assertEquals("Review the Q1 EMEA revenue dashboard", info.get(0).getContent());

        assertEquals(2, f.recommendationService.getRecommendations("u-1", Set.of(), 2).size());
        assertThrows(IllegalArgumentException.class,
                () -> f.recommendationService.getRecommendations("u-1", null, 0));
        assertThrows(IllegalArgumentException.class,
                () -> f.recommendationService.getRecommendations(" ", null, null));
    }

    @Test
    @DisplayName("Should move interaction status forward only and drop final ones from queries")
    void testStatusUpdates() {
        context("u-1", "Planning EMEA stock levels");
        f.recommendationService.refreshActiveUsers();
        String id = f.recommendationService.getRecommendations("u-1", null, null).get(0).getId();

        f.clock.advance(Duration.ofMinutes(1));
        Recommendation viewed = f.recommendationService.updateStatus(id, InteractionStatus.VIEWED);
        assertEquals(InteractionStatus.VIEWED, viewed.getInteractionStatus());
        assertEquals(f.clock.instant(), viewed.getStatusUpdatedAt());
        assertEquals(3, f.recommendationService.getRecommendations("u-1", null, null).size());

        f.recommendationService.updateStatus(id, InteractionStatus.DISMISSED);
        assertEquals(2, f.recommendationService.getRecommendations("u-1", null, null).size());

        assertThrows(IllegalStatusTransitionException.class,
                () -> f.recommendationService.updateStatus(id, InteractionStatus.ACTED_UPON));
        assertThrows(ResourceNotFoundException.class,
                () -> f.recommendationService.updateStatus("missing", InteractionStatus.VIEWED));
    }

    @Test
    @DisplayName("Should store a cleaned copy of the submitted context")
    void testUpsertContext() {
        UserContext stored = context("u-1", "Planning EMEA stock levels");

        assertEquals(List.of("emea-launch"), stored.getActiveProjects());
        assertEquals(f.clock.instant().plus(Duration.ofDays(1)), stored.getExpiresAt());
        assertEquals("Planning EMEA stock levels. Recent questions: why are EMEA orders up?", stored.situation());
        assertThrows(IllegalArgumentException.class,
                () -> f.recommendationService.upsertContext("", new UserContextRequest()));
    }
}
