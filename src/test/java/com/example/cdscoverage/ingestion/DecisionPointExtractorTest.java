package com.example.cdscoverage.ingestion;

import com.example.cdscoverage.model.DecisionPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionPointExtractorTest {

    private final DecisionPointExtractor extractor = new DecisionPointExtractor();

    @Test
    @DisplayName("criteria first: 'For patients with X, recommend Y.'")
    void criteriaThenAction() {
        List<DecisionPoint> points = extractor.extract(
                "For patients with atrial fibrillation, recommend anticoagulation with a DOAC.");

        assertThat(points).singleElement().satisfies(p -> {
            assertThat(p.action()).isEqualTo("anticoagulation with a DOAC");
            assertThat(p.patientCriteria()).containsExactly("atrial fibrillation");
            assertThat(p.context()).contains("recommend anticoagulation");
        });
    }

    @Test
    @DisplayName("action first: 'Recommend Y for patients with X.'")
    void actionThenCriteria() {
        List<DecisionPoint> points = extractor.extract("We recommend metformin for patients with type 2 diabetes.");

        assertThat(points).singleElement().satisfies(p -> {
            assertThat(p.action()).isEqualTo("metformin");
            assertThat(p.patientCriteria()).containsExactly("type 2 diabetes");
        });
    }

    @Test
    @DisplayName("an order sentence should be extracted once, by the most specific pattern")
    void orderDeduplicated() {
        List<DecisionPoint> points = extractor.extract("Order a CT scan for patients with suspected metastasis.");

        assertThat(points).singleElement().satisfies(p -> {
            assertThat(p.action()).isEqualTo("a CT scan");
            assertThat(p.patientCriteria()).containsExactly("suspected metastasis");
        });
    }

    @Test
    @DisplayName("generic order: 'Order Y for X.'")
    void genericOrder() {
        List<DecisionPoint> points = extractor.extract("Order an HbA1c for annual follow-up.");

        assertThat(points).singleElement().satisfies(p -> {
            assertThat(p.action()).isEqualTo("an HbA1c");
            assertThat(p.patientCriteria()).containsExactly("annual follow-up");
        });
    }

    @Test
    @DisplayName("monitoring: 'Monitor patients with X for Y.'")
    void monitoring() {
        List<DecisionPoint> points = extractor.extract("Monitor patients with chronic kidney disease for bleeding.");

        assertThat(points).singleElement().satisfies(p -> {
            assertThat(p.action()).isEqualTo("monitor for bleeding");
            assertThat(p.patientCriteria()).containsExactly("chronic kidney disease");
        });
    }

    @Test
    @DisplayName("prose without decisions should yield nothing")
    void noDecisions() {
        assertThat(extractor.extract("Atrial fibrillation is common in older adults.")).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
