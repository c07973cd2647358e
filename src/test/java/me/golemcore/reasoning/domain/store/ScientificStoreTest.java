package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.ScientificInquiry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScientificStoreTest {

    private ScientificStore store;

    @BeforeEach
    void setUp() {
        store = new ScientificStore();
        store.add("s1", ScientificInquiry.builder()
                .inquiryId("latency")
                .stage("hypothesis")
                .hypothesis(ScientificInquiry.Hypothesis.builder()
                        .hypothesisId("h1").statement("GC pauses cause spikes").status("proposed").build())
                .nextStageNeeded(true)
                .build());
        store.add("s2", ScientificInquiry.builder()
                .inquiryId("latency")
                .stage("experiment")
                .hypothesis(ScientificInquiry.Hypothesis.builder()
                        .hypothesisId("h1").statement("GC pauses cause spikes").status("testing").build())
                .experiment(ScientificInquiry.Experiment.builder().experimentId("e1").design("Switch to ZGC").build())
                .nextStageNeeded(true)
                .build());
        store.add("s3", ScientificInquiry.builder()
                .inquiryId("latency")
                .stage("conclusion")
                .conclusion("Spikes disappear with ZGC")
                .build());
        store.add("s4", ScientificInquiry.builder()
                .inquiryId("memory")
                .stage("conclusion")
                .build());
    }

    @Test
    void shouldGroupStagesByInquiry() {
        assertEquals(3, store.getByInquiry("latency").size());
        assertEquals(2, store.getByStage("conclusion").size());
    }

    @Test
    void shouldReturnLatestHypothesisState() {
        assertEquals("testing", store.getHypothesis("h1").orElseThrow().getStatus());
        assertEquals("Switch to ZGC", store.getExperiment("e1").orElseThrow().getDesign());
        assertTrue(store.getHypothesis("h9").isEmpty());
    }

    @Test
    void shouldRequireConclusionTextForCompletion() {
        assertEquals(1, store.getCompleted().size());
        assertEquals(2, store.getActive().size());
    }

    @Test
    void shouldComputeStatistics() {
        ScientificStore.Statistics stats = store.getStatistics();

        assertEquals(4, stats.totalStages());
        assertEquals(2, stats.inquiries());
        assertEquals(1, stats.hypotheses());
        assertEquals(1, stats.experiments());
        assertEquals(1, stats.completedInquiries());
        assertEquals(2, stats.stages().get("conclusion"));
    }
}
