package com.knowledge.curation.llm;

import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.provider.ProviderUnavailableException;
import com.knowledge.curation.support.TestItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdjudicationService Tests")
class AdjudicationServiceTest {

    @Mock
    private LLMAdjudicator adjudicator;

    private AdjudicationRequest request;
    private CurationOptions options;

    @BeforeEach
    void setUp() {
        Community community = new Community("skill/a", "skill", List.of("a", "b"), 0.9, 0.9, 1.0, 0.9,
                false, List.of());
        request = new AdjudicationRequest(community,
                List.of(TestItems.pending("a", "skill"), TestItems.pending("b", "skill")), List.of(), 1);
        options = CurationOptions.builder()
                .llmMaxRetries(2)
                .llmRetryBackoff(Duration.ZERO)
                .build();
    }

    @Test
    @DisplayName("Confident decisions pass through")
    void confidentDecision() {
        when(adjudicator.decide(request)).thenReturn(
                AdjudicationDecision.merge(List.of("a", "b"), "a", "same", 0.95));

        AdjudicationDecision decision = new AdjudicationService(adjudicator, options).adjudicate(request);

        assertEquals(AdjudicationDecision.Kind.MERGE, decision.kind());
        verify(adjudicator, times(1)).decide(any());
    }

    @Test
    @DisplayName("Low confidence becomes manual review")
    void lowConfidence() {
        when(adjudicator.decide(request)).thenReturn(AdjudicationDecision.keepSeparate("unsure", 0.5));

        AdjudicationDecision decision = new AdjudicationService(adjudicator, options).adjudicate(request);

        assertEquals(AdjudicationDecision.Kind.MANUAL_REVIEW, decision.kind());
        assertTrue(decision.rationale().contains("low confidence"));
    }

    @Test
    @DisplayName("Transient failures are retried")
    void retriesThenSucceeds() {
        when(adjudicator.decide(request))
                .thenThrow(new ProviderUnavailableException("ollama", "connection refused"))
                .thenReturn(AdjudicationDecision.keepSeparate("distinct", 0.9));

        AdjudicationDecision decision = new AdjudicationService(adjudicator, options).adjudicate(request);

        assertEquals(AdjudicationDecision.Kind.KEEP_SEPARATE, decision.kind());
        verify(adjudicator, times(2)).decide(any());
    }

    @Test
    @DisplayName("Exhausted retries defer to manual review, never merge or keep")
    void exhaustedRetries() {
        when(adjudicator.decide(request)).thenThrow(new ProviderUnavailableException("ollama", "offline"));

        AdjudicationDecision decision = new AdjudicationService(adjudicator, options).adjudicate(request);

        assertEquals(AdjudicationDecision.Kind.MANUAL_REVIEW, decision.kind());
        assertTrue(decision.rationale().startsWith("LLM unavailable"));
        verify(adjudicator, times(3)).decide(any());
    }

    @Test
    @DisplayName("Ambiguous replies keep the raw text for the audit trail")
    void ambiguousReply() {
        when(adjudicator.decide(request)).thenThrow(new AmbiguousDecisionException("not JSON", "maybe?"));

        AdjudicationDecision decision = new AdjudicationService(adjudicator,
                CurationOptions.builder(options).llmMaxRetries(0).build()).adjudicate(request);

        assertEquals(AdjudicationDecision.Kind.MANUAL_REVIEW, decision.kind());
        assertEquals("maybe?", decision.rawReply());
    }

    @Test
    @DisplayName("Backoff doubles on each attempt")
    void backoff() {
        AdjudicationService service = new AdjudicationService(adjudicator,
                CurationOptions.builder().llmRetryBackoff(Duration.ofMillis(100)).build());

        assertEquals(Duration.ofMillis(100), service.delayFor(1));
        assertEquals(Duration.ofMillis(200), service.delayFor(2));
        assertEquals(Duration.ofMillis(400), service.delayFor(3));
    }
}
