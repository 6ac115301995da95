package com.causalgraph.api.controller;

import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.CausalHypothesis;
import com.causalgraph.domain.model.GraphStats;
import com.causalgraph.domain.model.Prediction;
import com.causalgraph.domain.model.TemporalPattern;
import com.causalgraph.exception.InvalidWindowException;
import com.causalgraph.service.TemporalGraphService;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for triggering analytics runs and reading their latest results.
 *
 * <p>POST endpoints run synchronously and return the new result; a second call for the same
 * kind while one is running gets 409. GET endpoints return the last published result.
 * <ul>
 *   <li>{@code POST /api/analytics/hypotheses?windowMinutes} / {@code GET /api/analytics/hypotheses}</li>
 *   <li>{@code POST /api/analytics/chains?maxLength} / {@code GET /api/analytics/chains}</li>
 *   <li>{@code POST /api/analytics/patterns} / {@code GET /api/analytics/patterns}</li>
 *   <li>{@code GET /api/analytics/predictions?horizonMinutes}</li>
 *   <li>{@code GET /api/analytics/statistics}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    private final TemporalGraphService temporalGraphService;

    public AnalyticsController(TemporalGraphService temporalGraphService) {
        this.temporalGraphService = temporalGraphService;
    }

    @PostMapping("/hypotheses")
    public List<CausalHypothesis> discoverHypotheses(@RequestParam(defaultValue = "60") long windowMinutes) {
        log.info("Causal discovery requested over {} minutes", windowMinutes);
        return temporalGraphService.discoverCausalRelationships(minutes("windowMinutes", windowMinutes));
    }

    @GetMapping("/hypotheses")
    public List<CausalHypothesis> getHypotheses() {
        return temporalGraphService.currentHypotheses();
    }

    @PostMapping("/chains")
    public List<CausalChain> buildChains(@RequestParam(required = false) Integer maxLength) {
        log.info("Chain building requested (max length {})", maxLength != null ? maxLength : "default");
        return maxLength != null
                ? temporalGraphService.buildCausalChains(maxLength)
                : temporalGraphService.buildCausalChains();
    }

    @GetMapping("/chains")
    public List<CausalChain> getChains() {
        return temporalGraphService.currentChains();
    }

    @PostMapping("/patterns")
    public List<TemporalPattern> discoverPatterns() {
        return temporalGraphService.discoverTemporalPatterns();
    }

    @GetMapping("/patterns")
    public List<TemporalPattern> getPatterns() {
        return temporalGraphService.currentPatterns();
    }

    @GetMapping("/predictions")
    public List<Prediction> predict(@RequestParam(required = false) Long horizonMinutes) {
        return horizonMinutes != null
                ? temporalGraphService.predictFutureEvents(minutes("horizonMinutes", horizonMinutes))
                : temporalGraphService.predictFutureEvents();
    }

    @GetMapping("/statistics")
    public GraphStats getStatistics() {
        return temporalGraphService.getStatistics();
    }

    private static Duration minutes(String parameter, long value) {
        try {
            return Duration.ofMinutes(value);
        } catch (ArithmeticException e) {
            throw new InvalidWindowException(parameter + " is out of range, was " + value);
        }
    }
}
