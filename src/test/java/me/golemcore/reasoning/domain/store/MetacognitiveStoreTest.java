package me.golemcore.reasoning.domain.store;

import me.golemcore.reasoning.domain.model.MetacognitiveAssessment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetacognitiveStoreTest {

    private MetacognitiveStore store;

    @BeforeEach
    void setUp() {
        store = new MetacognitiveStore();
        store.add("m1", assessment("mon-1", "estimate effort", "planning", "knowledge-assessment", 0.4));
        store.add("m2", assessment("mon-1", "estimate effort", "planning", "evaluation", 0.7));
        store.add("m3", assessment("mon-2", "review proof", "mathematics", "monitoring", 0.9));
    }

    @Test
    void shouldQueryByTaskDomainStageAndMonitoringId() {
        assertEquals(2, store.getByTask("estimate effort").size());
        assertEquals(1, store.getByDomain("mathematics").size());
        assertEquals(1, store.getByStage("evaluation").size());
        assertEquals(0.4, store.getByMonitoringId("mon-1").orElseThrow().getOverallConfidence());
        assertTrue(store.getByMonitoringId("mon-9").isEmpty());
    }

    @Test
    void shouldReturnAssessmentsBelowThreshold() {
        assertEquals(1, store.getLowConfidence(0.5).size());
        assertEquals(2, store.getLowConfidence(0.9).size());
    }

    @Test
    void shouldComputeStatistics() {
        MetacognitiveStore.Statistics stats = store.getStatistics();

        assertEquals(3, stats.totalSessions());
        assertEquals(2, stats.tasks());
        assertEquals(2, stats.assessedDomains());
        assertEquals(2.0 / 3, stats.averageConfidence(), 1e-9);
    }

    private static MetacognitiveAssessment assessment(String monitoringId, String task, String domain, String stage,
            double confidence) {
        return MetacognitiveAssessment.builder()
                .monitoringId(monitoringId)
                .task(task)
                .knowledgeDomain(domain)
                .stage(stage)
                .overallConfidence(confidence)
                .build();
    }
}
