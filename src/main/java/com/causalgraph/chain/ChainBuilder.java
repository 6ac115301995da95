package com.causalgraph.chain;

import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.CausalHypothesis;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Enumerates and scores multi-hop causal paths over validated hypotheses.
 *
 * <p>Each run builds a fresh scratch graph (never the relation graph) from the hypotheses
 * stronger than the edge threshold, then enumerates every simple path of one to
 * {@code maxChainLength} edges by depth-first search with a per-path visited set. Simple
 * paths guarantee that no chain revisits a cause. Every path is scored:
 * <ul>
 *   <li>{@code totalStrength} = product of edge strengths</li>
 *   <li>{@code chainConfidence} = totalStrength / number of entities</li>
 *   <li>{@code temporalSpan} = latest minus earliest entity timestamp</li>
 *   <li>{@code predictionPower} = chainConfidence * multiplier</li>
 * </ul>
 * Chains are ranked by {@code totalStrength * chainConfidence} descending with the chain id as
 * the final tie-breaker, and the top {@code maxChains} are returned. Only those are retained
 * while enumerating. Node and edge iteration
 * is sorted, so an unchanged input always produces the same chains.
 *
 * <p>The path count is exponential in the worst case. The length bound and the
 * {@link CancellationToken}, checked before every expansion, keep a run finite; a cancelled
 * run ranks whatever it had enumerated so far.
 */
@Component
@EnableConfigurationProperties(ChainBuilderConfig.class)
public class ChainBuilder {

    private static final Logger log = LoggerFactory.getLogger(ChainBuilder.class);

    private static final Comparator<CausalChain> RANKING = Comparator.comparingDouble(CausalChain::rankScore)
            .reversed()
            .thenComparing(CausalChain::getId);

    private final ChainBuilderConfig chainBuilderConfig;

    public ChainBuilder(ChainBuilderConfig chainBuilderConfig) {
        this.chainBuilderConfig = chainBuilderConfig;
    }

    public List<CausalChain> build(List<CausalHypothesis> validatedHypotheses, int maxChainLength) {
        return build(validatedHypotheses, maxChainLength, CancellationToken.none());
    }

    public List<CausalChain> build(
            List<CausalHypothesis> validatedHypotheses, int maxChainLength, CancellationToken cancellationToken) {
        ScratchGraph graph = ScratchGraph.from(validatedHypotheses, chainBuilderConfig.getEdgeStrengthThreshold());

        TopChains top = new TopChains(chainBuilderConfig.getMaxChains());
        Enumeration enumeration = new Enumeration(graph, maxChainLength, cancellationToken, top);
        for (String source : graph.nodes()) {
            if (enumeration.cancelled) {
                break;
            }
            enumeration.fromSource(source);
        }

        if (enumeration.cancelled) {
            log.warn("Chain enumeration cancelled after {} paths over {} nodes; ranking partial result",
                    top.offered, graph.nodes().size());
        }

        List<CausalChain> ranked = top.ranked();
        log.debug("Enumerated {} causal paths over {} nodes / {} edges, kept {}",
                top.offered, graph.nodes().size(), graph.edgeCount(), ranked.size());
        return ranked;
    }

    // ---- Internal ----

    private CausalChain toChain(List<String> path, ScratchGraph graph) {
        List<String> relations = new ArrayList<>(path.size() - 1);
        double totalStrength = 1.0;
        for (int i = 0; i < path.size() - 1; i++) {
            String cause = path.get(i);
            String effect = path.get(i + 1);
            totalStrength *= graph.strength(cause, effect);
            relations.add(cause + "->" + effect);
        }

        Instant earliest = null;
        Instant latest = null;
        for (String node : path) {
            Instant ts = graph.timestamp(node);
            if (earliest == null || ts.isBefore(earliest)) {
                earliest = ts;
            }
            if (latest == null || ts.isAfter(latest)) {
                latest = ts;
            }
        }

        double chainConfidence = totalStrength / path.size();
        return CausalChain.builder()
                .id(chainId(path))
                .entities(List.copyOf(path))
                .relations(List.copyOf(relations))
                .totalStrength(totalStrength)
                .chainConfidence(chainConfidence)
                .temporalSpan(Duration.between(earliest, latest))
                .predictionPower(chainConfidence * chainBuilderConfig.getPredictionPowerMultiplier())
                .build();
    }

    /** First 16 hex chars of SHA-256 over the joined path; stable across rebuilds. */
    static String chainId(List<String> path) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join("->", path).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** DFS state for one build run. */
    private final class Enumeration {

        private final ScratchGraph graph;
        private final int maxEdges;
        private final CancellationToken token;
        private final TopChains sink;
        private boolean cancelled;

        private Enumeration(ScratchGraph graph, int maxEdges, CancellationToken token, TopChains sink) {
            this.graph = graph;
            this.maxEdges = maxEdges;
            this.token = token;
            this.sink = sink;
        }

        private void fromSource(String source) {
            List<String> path = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            path.add(source);
            visited.add(source);
            extend(path, visited);
        }

        /** Depth is bounded by {@code maxEdges}, so recursion depth is too. */
        private void extend(List<String> path, Set<String> visited) {
            if (path.size() - 1 >= maxEdges) {
                return;
            }
            String tail = path.get(path.size() - 1);
            for (String next : graph.successors(tail)) {
                if (cancelled || token.isCancelled()) {
                    cancelled = true;
                    return;
                }
                if (visited.contains(next)) {
                    continue;
                }
                path.add(next);
                visited.add(next);
                sink.offer(toChain(path, graph));
                extend(path, visited);
                visited.remove(next);
                path.remove(path.size() - 1);
            }
        }
    }

    /**
     * The best {@code capacity} chains seen so far. The head of the heap is the worst chain
     * retained, so memory stays bounded by the cap rather than by the number of paths.
     */
    private static final class TopChains {

        private final int capacity;
        private final PriorityQueue<CausalChain> heap = new PriorityQueue<>(RANKING.reversed());
        private long offered;

        private TopChains(int capacity) {
            this.capacity = capacity;
        }

        private void offer(CausalChain chain) {
            offered++;
            if (capacity <= 0) {
                return;
            }
            if (heap.size() < capacity) {
                heap.add(chain);
            } else if (RANKING.compare(chain, heap.peek()) < 0) {
                heap.poll();
                heap.add(chain);
            }
        }

        private List<CausalChain> ranked() {
            List<CausalChain> chains = new ArrayList<>(heap);
            chains.sort(RANKING);
            return List.copyOf(chains);
        }
    }

    /** Directed graph of hypothesis edges, rebuilt for every run. */
    static final class ScratchGraph {

        private final Map<String, Map<String, Double>> adjacency = new TreeMap<>();
        private final Map<String, Instant> timestamps = new HashMap<>();

        static ScratchGraph from(List<CausalHypothesis> hypotheses, double strengthThreshold) {
            ScratchGraph graph = new ScratchGraph();
            for (CausalHypothesis hypothesis : hypotheses) {
                if (hypothesis.getStrength() > strengthThreshold
                        && !hypothesis.getCauseId().equals(hypothesis.getEffectId())) {
                    graph.addEdge(hypothesis);
                }
            }
            return graph;
        }

        /** Keeps the strongest hypothesis when the same pair was validated more than once. */
        private void addEdge(CausalHypothesis hypothesis) {
            Map<String, Double> successors =
                    adjacency.computeIfAbsent(hypothesis.getCauseId(), k -> new TreeMap<>());
            adjacency.computeIfAbsent(hypothesis.getEffectId(), k -> new TreeMap<>());
            successors.merge(hypothesis.getEffectId(), hypothesis.getStrength(), Math::max);
            timestamps.putIfAbsent(hypothesis.getCauseId(), hypothesis.getCauseTimestamp());
            timestamps.putIfAbsent(hypothesis.getEffectId(), hypothesis.getEffectTimestamp());
        }

        Set<String> nodes() {
            return adjacency.keySet();
        }

        Set<String> successors(String node) {
            return adjacency.getOrDefault(node, Map.of()).keySet();
        }

        double strength(String cause, String effect) {
            return adjacency.get(cause).get(effect);
        }

        Instant timestamp(String node) {
            return timestamps.get(node);
        }

        int edgeCount() {
            return adjacency.values().stream().mapToInt(Map::size).sum();
        }
    }
}
