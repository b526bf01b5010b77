package com.identity.resolution.dedup;

import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.rules.InputValidator;
import com.identity.resolution.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes "no counterpart in the target system" records without duplicating them
 * across repeated runs. An existing record is looked up by reference number first,
 * then by normalized name; a new one is keyed by the strongest of the two.
 */
public class DedupWriter {
    private static final Logger log = LoggerFactory.getLogger(DedupWriter.class);

    private final DerivedRecordRepository repository;
    private final NameNormalizer normalizer;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public DedupWriter(DerivedRecordRepository repository, NameNormalizer normalizer) {
        this(repository, normalizer, Clock.systemUTC());
    }

    public DedupWriter(DerivedRecordRepository repository, NameNormalizer normalizer, Clock clock) {
        this.repository = repository;
        this.normalizer = normalizer;
        this.clock = clock;
    }

    public WriteOutcome write(SourceRecord record, String targetSystem) {
        String reference = InputValidator.cleanReferenceNumber(record.referenceNumber());
        String normalizedName = normalizer.normalize(record.rawName());
        if (reference == null && normalizedName.isEmpty()) {
            log.debug("dedup.skipped sourceId={} target={} reason=no-key", record.sourceId(), targetSystem);
            return WriteOutcome.SKIPPED;
        }

        lock.lock();
        try {
            Optional<DerivedRecord> existing = Optional.empty();
            if (reference != null) {
                existing = repository.findByReferenceNumber(targetSystem, reference);
            }
            if (existing.isEmpty() && !normalizedName.isEmpty()) {
                existing = repository.findByNormalizedName(targetSystem, normalizedName);
            }
            if (existing.isPresent()) {
                log.debug("dedup.existing sourceId={} target={} key={}",
                        record.sourceId(), targetSystem, existing.get().naturalKey());
                return WriteOutcome.EXISTING;
            }

            DerivedRecord derived = new DerivedRecord(
                    targetSystem,
                    DerivedRecord.naturalKey(reference, normalizedName),
                    reference,
                    normalizedName,
                    record.rawName(),
                    record.sourceId(),
                    record.sourceSystem(),
                    record.attributes(),
                    clock.instant());
            if (!repository.insertIfAbsent(derived)) {
                return WriteOutcome.EXISTING;
            }
            log.info("dedup.inserted sourceId={} target={} key={}", record.sourceId(), targetSystem, derived.naturalKey());
            return WriteOutcome.INSERTED;
        } finally {
            lock.unlock();
        }
    }
}
