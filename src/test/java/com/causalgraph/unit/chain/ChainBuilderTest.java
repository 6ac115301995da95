package com.causalgraph.unit.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.causalgraph.chain.CancellationToken;
import com.causalgraph.chain.ChainBuilder;
import com.causalgraph.chain.ChainBuilderConfig;
import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.CausalHypothesis;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ChainBuilder over a small graph with a cycle:
 * A -> B (0.9), B -> C (0.8), A -> C (0.7), C -> A (0.65).
 */
class ChainBuilderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    private static final Map<String, Instant> TIMES = Map.of(
            "A", T0,
            "B", T0.plusSeconds(300),
            "C", T0.plusSeconds(900));

    private ChainBuilderConfig chainBuilderConfig;
    private ChainBuilder chainBuilder;

    @BeforeEach
    void setUp() {
        chainBuilderConfig = new ChainBuilderConfig();
        chainBuilder = new ChainBuilder(chainBuilderConfig);
    }

    private static CausalHypothesis hypothesis(String cause, String effect, double strength) {
        return CausalHypothesis.builder()
                .causeId(cause)
                .effectId(effect)
                .causeKind(EntityKind.NEWS_EVENT)
                .effectKind(EntityKind.PRICE_MOVEMENT)
                .causeTimestamp(TIMES.getOrDefault(cause, T0))
                .effectTimestamp(TIMES.getOrDefault(effect, T0))
                .mechanism("information_impact")
                .strength(strength)
                .validated(true)
                .build();
    }

    private static List<CausalHypothesis> cyclicGraph() {
        return List.of(
                hypothesis("A", "B", 0.9),
                hypothesis("B", "C", 0.8),
                hypothesis("A", "C", 0.7),
                hypothesis("C", "A", 0.65));
    }

    private static CausalChain chainThrough(List<CausalChain> chains, String... entities) {
        return chains.stream()
                .filter(c -> c.getEntities().equals(List.of(entities)))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No chain " + String.join("->", entities)));
    }

    @Nested
    @DisplayName("Enumeration")
    class Enumeration {

        @Test
        @DisplayName("every simple path is enumerated and no chain revisits an entity")
        void simplePathsOnly() {
            List<CausalChain> chains = chainBuilder.build(cyclicGraph(), 5);

            assertThat(chains).extracting(c -> String.join("->", c.getEntities()))
                    .containsExactlyInAnyOrder("A->B", "A->B->C", "A->C", "B->C", "B->C->A", "C->A", "C->A->B");
            assertThat(chains).allSatisfy(c ->
                    assertThat(c.getEntities()).doesNotHaveDuplicates());
        }

        @Test
        @DisplayName("length bound limits the number of edges")
        void lengthBound() {
            List<CausalChain> chains = chainBuilder.build(cyclicGraph(), 1);

            assertThat(chains).hasSize(4).allSatisfy(c -> assertThat(c.length()).isEqualTo(2));
        }

        @Test
        @DisplayName("relations are listed as cause->effect edge ids along the path")
        void relationIds() {
            CausalChain chain = chainThrough(chainBuilder.build(cyclicGraph(), 5), "C", "A", "B");

            assertThat(chain.getRelations()).containsExactly("C->A", "A->B");
        }

        @Test
        @DisplayName("hypotheses at or below the edge threshold and self-loops are not edges")
        void thresholdAndSelfLoops() {
            List<CausalChain> chains = chainBuilder.build(List.of(
                    hypothesis("A", "B", 0.6),
                    hypothesis("B", "B", 0.95),
                    hypothesis("B", "C", 0.61)), 5);

            assertThat(chains).extracting(c -> String.join("->", c.getEntities())).containsExactly("B->C");
        }

        @Test
        @DisplayName("the same pair validated twice keeps its strongest strength")
        void duplicatePairKeepsStrongest() {
            List<CausalChain> chains = chainBuilder.build(List.of(
                    hypothesis("A", "B", 0.7),
                    hypothesis("A", "B", 0.9)), 5);

            assertThat(chains).singleElement()
                    .satisfies(c -> assertThat(c.getTotalStrength()).isCloseTo(0.9, within(1e-9)));
        }

        @Test
        @DisplayName("no hypotheses produce no chains")
        void empty() {
            assertThat(chainBuilder.build(List.of(), 5)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("total strength is the product of edge strengths and never exceeds the weakest edge")
        void compoundedStrength() {
            List<CausalChain> chains = chainBuilder.build(cyclicGraph(), 5);
            CausalChain abc = chainThrough(chains, "A", "B", "C");

            assertThat(abc.getTotalStrength()).isCloseTo(0.72, within(1e-9));
            assertThat(abc.getChainConfidence()).isCloseTo(0.24, within(1e-9));
            assertThat(abc.getPredictionPower()).isCloseTo(0.24 * 0.8, within(1e-9));
            assertThat(abc.getTemporalSpan()).isEqualTo(Duration.ofSeconds(900));
            assertThat(chainThrough(chains, "B", "C", "A").getTotalStrength()).isLessThanOrEqualTo(0.65);
        }

        @Test
        @DisplayName("extending a path never raises its strength or confidence")
        void monotonic() {
            List<CausalChain> chains = chainBuilder.build(cyclicGraph(), 5);

            CausalChain ab = chainThrough(chains, "A", "B");
            CausalChain abc = chainThrough(chains, "A", "B", "C");
            assertThat(abc.getTotalStrength()).isLessThanOrEqualTo(ab.getTotalStrength());
            assertThat(abc.getChainConfidence()).isLessThan(ab.getChainConfidence());
        }

        @Test
        @DisplayName("temporal span covers the earliest and latest entity even when the path goes back in time")
        void spanOfCyclicPath() {
            CausalChain bca = chainThrough(chainBuilder.build(cyclicGraph(), 5), "B", "C", "A");

            assertThat(bca.getTemporalSpan()).isEqualTo(Duration.ofSeconds(900));
        }
    }

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @Test
        @DisplayName("chains are ordered by strength times confidence")
        void rankedDescending() {
            List<CausalChain> chains = chainBuilder.build(cyclicGraph(), 5);

            assertThat(chains.get(0).getEntities()).containsExactly("A", "B");
            assertThat(chains.get(1).getEntities()).containsExactly("B", "C");
            for (int i = 1; i < chains.size(); i++) {
                assertThat(chains.get(i - 1).rankScore()).isGreaterThanOrEqualTo(chains.get(i).rankScore());
            }
        }

        @Test
        @DisplayName("only the configured number of chains is kept")
        void capped() {
            chainBuilderConfig.setMaxChains(2);

            assertThat(chainBuilder.build(cyclicGraph(), 5))
                    .extracting(c -> String.join("->", c.getEntities()))
                    .containsExactly("A->B", "B->C");
        }

        @Test
        @DisplayName("a small cap keeps exactly the leading chains of the full ranking")
        void capKeepsLeadingChains() {
            List<CausalHypothesis> dense = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                for (int j = 0; j < 6; j++) {
                    if (i != j) {
                        dense.add(hypothesis("n" + i, "n" + j, 0.61 + 0.05 * ((i * 7 + j * 3) % 8)));
                    }
                }
            }
            ChainBuilderConfig wide = new ChainBuilderConfig();
            wide.setMaxChains(100_000);
            List<CausalChain> all = new ChainBuilder(wide).build(dense, 3);
            chainBuilderConfig.setMaxChains(10);

            List<CausalChain> top = chainBuilder.build(dense, 3);

            assertThat(all).hasSizeGreaterThan(10);
            assertThat(top).extracting(CausalChain::getId)
                    .containsExactlyElementsOf(all.subList(0, 10).stream().map(CausalChain::getId).toList());
        }

        @Test
        @DisplayName("rebuilding from reordered input yields identical chains and ids")
        void deterministic() {
            List<CausalHypothesis> shuffled = new ArrayList<>(cyclicGraph());
            Collections.reverse(shuffled);

            List<CausalChain> first = chainBuilder.build(cyclicGraph(), 5);
            List<CausalChain> second = chainBuilder.build(shuffled, 5);

            assertThat(second).extracting(CausalChain::getId)
                    .containsExactlyElementsOf(first.stream().map(CausalChain::getId).toList());
            assertThat(first).extracting(CausalChain::getId).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("a token cancelled before the run yields no chains")
        void cancelledBeforeStart() {
            CancellationToken token = CancellationToken.manual();
            token.cancel();

            assertThat(chainBuilder.build(cyclicGraph(), 5, token)).isEmpty();
        }

        @Test
        @DisplayName("a dense graph finishes within the length bound")
        void denseGraphBounded() {
            List<CausalHypothesis> dense = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                for (int j = 0; j < 8; j++) {
                    if (i != j) {
                        dense.add(hypothesis("n" + i, "n" + j, 0.9));
                    }
                }
            }
            chainBuilderConfig.setMaxChains(50);

            List<CausalChain> chains = chainBuilder.build(dense, 3);

            assertThat(chains).hasSize(50).allSatisfy(c -> assertThat(c.length()).isBetween(2, 4));
        }
    }
}
