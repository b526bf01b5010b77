package com.identity.resolution.match;

import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchResult;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.core.model.UnresolvedReason;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.rules.InputValidator;
import com.identity.resolution.rules.InvalidInputException;
import com.identity.resolution.rules.NameNormalizer;
import com.identity.resolution.similarity.LevenshteinSimilarity;
import com.identity.resolution.similarity.SimilarityAlgorithm;
import com.identity.resolution.similarity.SimilarityEngine;
import com.identity.resolution.similarity.TokenOverlapSimilarity;
import com.identity.resolution.store.AliasCandidate;
import com.identity.resolution.store.AliasKeys;
import com.identity.resolution.store.CanonicalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves one source record against the canonical store with an ordered cascade;
 * the first strategy with a hit wins:
 * <ol>
 *   <li>reference number, exact (confidence 1.0)</li>
 *   <li>normalized name, exact (confidence 0.95)</li>
 *   <li>fuzzy edit-distance similarity against blocked candidates</li>
 *   <li>keyword overlap of significant tokens of the simplified names</li>
 * </ol>
 *
 * <p>A normalized name shared by several entities is ambiguous.
 * Among approximate hits each canonical entity counts once with its best score.
 * When the two best entities score within the ambiguity margin the result is
 * ambiguous and is never accepted. Ties go to the smaller canonical id.</p>
 *
 * <p>The matcher only reads the store and never throws for bad input.</p>
 */
public class Matcher {
    private static final Logger log = LoggerFactory.getLogger(Matcher.class);

    static final double EXACT_NAME_CONFIDENCE = 0.95;
    private static final String QUALIFIER_SEPARATOR = " - ";

    private final CanonicalStore store;
    private final AliasKeys keys;
    private final NameNormalizer normalizer;
    private final MatcherConfig config;
    private final SimilarityEngine fuzzy;
    private final TokenOverlapSimilarity tokens;
    private final MetricsService metrics;

    public Matcher(CanonicalStore store, AliasKeys keys, MatcherConfig config) {
        this(store, keys, config, new LevenshteinSimilarity(), new NoOpMetricsService());
    }

    public Matcher(CanonicalStore store, AliasKeys keys, MatcherConfig config,
                   SimilarityAlgorithm fuzzy, MetricsService metrics) {
        this.store = store;
        this.keys = keys;
        this.normalizer = keys.getNormalizer();
        this.config = config;
        this.fuzzy = new SimilarityEngine(normalizer, fuzzy);
        this.tokens = new TokenOverlapSimilarity(config.getMinTokenLength());
        this.metrics = metrics;
    }

    public MatchResult match(SourceRecord record) {
        long start = System.nanoTime();
        MatchResult result = cascade(record);
        metrics.recordMatchDuration(result.strategy(), result.outcome(), Duration.ofNanos(System.nanoTime() - start));
        if (result.isMatched() && result.strategy().isApproximate()) {
            metrics.recordSimilarityScore(result.confidence());
        }
        log.debug("match.completed sourceId={} strategy={} outcome={} confidence={} canonicalId={} candidateId={}",
                record.sourceId(), result.strategy().getCode(), result.outcome(),
                result.confidence(), result.canonicalId(), result.candidateId());
        return result;
    }

    private MatchResult cascade(SourceRecord record) {
        String reference = InputValidator.cleanReferenceNumber(record.referenceNumber());
        if (reference != null) {
            Optional<String> byReference = store.resolveAlias(reference, AliasScope.REFERENCE_NUMBER);
            if (byReference.isPresent()) {
                return MatchResult.matched(record.sourceId(), byReference.get(), MatchStrategy.REFERENCE_NUMBER,
                        1.0, MatchStrategy.REFERENCE_NUMBER.getCode(), reference);
            }
        }

        String normalized;
        try {
            normalized = InputValidator.requireMatchable(record.rawName(), normalizer);
        } catch (InvalidInputException e) {
            log.debug("match.invalid-input sourceId={} reason={}", record.sourceId(), e.getMessage());
            return MatchResult.unresolved(record.sourceId(), UnresolvedReason.INVALID_INPUT);
        }

        List<String> owners = store.findNameOwners(normalized);
        if (owners.size() == 1) {
            return MatchResult.matched(record.sourceId(), owners.get(0), MatchStrategy.EXACT_NAME,
                    EXACT_NAME_CONFIDENCE, MatchStrategy.EXACT_NAME.getCode(), normalized);
        }
        if (owners.size() > 1) {
            log.debug("match.ambiguous sourceId={} strategy={} owners={}",
                    record.sourceId(), MatchStrategy.EXACT_NAME.getCode(), owners);
            return MatchResult.ambiguous(record.sourceId(), owners.get(0), MatchStrategy.EXACT_NAME,
                    EXACT_NAME_CONFIDENCE, normalized);
        }

        List<AliasCandidate> candidates = new ArrayList<>(store.findCandidates(keys.searchKeys(record.rawName())));
        if (candidates.isEmpty()) {
            return MatchResult.unresolved(record.sourceId(), UnresolvedReason.NO_MATCH);
        }
        candidates.sort(Comparator.comparing(AliasCandidate::canonicalId)
                .thenComparing(AliasCandidate::normalizedText));
        log.trace("match.candidates sourceId={} count={}", record.sourceId(), candidates.size());

        Map<String, Scored> fuzzyHits = new HashMap<>();
        for (AliasCandidate candidate : candidates) {
            double score = fuzzy.similarityOfNormalized(normalized, candidate.normalizedText());
            if (score >= config.getFuzzyThreshold()) {
                keepBest(fuzzyHits, new Scored(candidate.canonicalId(), score, candidate.text()));
            }
        }
        if (!fuzzyHits.isEmpty()) {
            return decide(record.sourceId(), fuzzyHits, MatchStrategy.FUZZY);
        }

        Map<EntityType, Set<String>> recordTokens = new EnumMap<>(EntityType.class);
        Map<String, Scored> keywordHits = new HashMap<>();
        for (AliasCandidate candidate : candidates) {
            Set<String> mine = recordTokens.computeIfAbsent(candidate.entityType(),
                    type -> tokens.tokenize(normalizer.simplify(record.rawName(), type)));
            TokenOverlapSimilarity.Overlap overlap = bestOverlap(mine, candidate);
            if (overlap.shared() >= config.getMinSharedTokens() && overlap.ratio() > config.getOverlapThreshold()) {
                keepBest(keywordHits, new Scored(candidate.canonicalId(), overlap.ratio(), candidate.text()));
            }
        }
        if (!keywordHits.isEmpty()) {
            return decide(record.sourceId(), keywordHits, MatchStrategy.KEYWORD);
        }
        return MatchResult.unresolved(record.sourceId(), UnresolvedReason.NO_MATCH);
    }

    /**
     * Overlap against the whole candidate name and, for names written as
     * {@code "<account> - <title>"}, against the title alone.
     */
    private TokenOverlapSimilarity.Overlap bestOverlap(Set<String> recordTokens, AliasCandidate candidate) {
        EntityType type = candidate.entityType();
        TokenOverlapSimilarity.Overlap best = tokens.overlap(recordTokens,
                tokens.tokenize(normalizer.simplify(candidate.text(), type)));
        int separator = candidate.text().lastIndexOf(QUALIFIER_SEPARATOR);
        if (separator > 0) {
            String qualifier = candidate.text().substring(separator + QUALIFIER_SEPARATOR.length());
            TokenOverlapSimilarity.Overlap segment = tokens.overlap(recordTokens,
                    tokens.tokenize(normalizer.simplify(qualifier, type)));
            if (segment.ratio() > best.ratio()
                    || (segment.ratio() == best.ratio() && segment.shared() > best.shared())) {
                best = segment;
            }
        }
        return best;
    }

    private MatchResult decide(String sourceId, Map<String, Scored> hits, MatchStrategy strategy) {
        List<Scored> ranked = hits.values().stream()
                .sorted(Comparator.comparingDouble(Scored::score).reversed()
                        .thenComparing(Scored::canonicalId))
                .toList();
        Scored top = ranked.get(0);
        if (ranked.size() > 1 && top.score() - ranked.get(1).score() < config.getAmbiguityMargin()) {
            log.debug("match.ambiguous sourceId={} strategy={} top={}:{} runnerUp={}:{}",
                    sourceId, strategy.getCode(), top.canonicalId(), top.score(),
                    ranked.get(1).canonicalId(), ranked.get(1).score());
            return MatchResult.ambiguous(sourceId, top.canonicalId(), strategy, top.score(), top.text());
        }
        return MatchResult.matched(sourceId, top.canonicalId(), strategy, top.score(), strategy.getCode(), top.text());
    }

    private static void keepBest(Map<String, Scored> hits, Scored scored) {
        hits.merge(scored.canonicalId(), scored, (a, b) -> b.score() > a.score() ? b : a);
    }

    private record Scored(String canonicalId, double score, String text) {}
}
