package com.inventoryforecast.store;

import com.inventoryforecast.entity.SalesRecordEntity;
import com.inventoryforecast.exception.ArtifactNotFoundException;
import com.inventoryforecast.model.PipelineArtifact;
import com.inventoryforecast.model.PipelineStage;
import com.inventoryforecast.model.RawRecord;
import com.inventoryforecast.model.StageStatus;
import com.inventoryforecast.model.WeatherObservation;
import com.inventoryforecast.repository.SalesRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw records are persisted through JPA; stage artifacts live in memory, one
 * {@link SessionArtifacts} per session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultRecordStoreAdapter implements RecordStoreAdapter {

    private final SalesRecordRepository salesRecordRepository;
    private final ConcurrentHashMap<String, SessionArtifacts> sessions = new ConcurrentHashMap<>();

    @Override
    @Transactional(readOnly = true)
    public List<RawRecord> readActiveDataset(String sessionId) {
        return salesRecordRepository.findBySessionIdOrderByUploadPositionAsc(sessionId).stream()
            .map(this::toRawRecord)
            .toList();
    }

    @Override
    @Transactional
    public int replaceActiveDataset(String sessionId, List<RawRecord> records, String requestId) {
        int removed = salesRecordRepository.deleteBySessionId(sessionId);
        List<SalesRecordEntity> entities = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            entities.add(toEntity(sessionId, i, records.get(i), requestId));
        }
        salesRecordRepository.saveAll(entities);
        session(sessionId).markStale(EnumSet.complementOf(EnumSet.of(PipelineStage.UPLOAD)));
        log.info("Dataset replaced | session={} | removed={} | inserted={} | requestId={}",
                 sessionId, removed, entities.size(), requestId);
        return entities.size();
    }

    @Override
    public void replaceWeather(String sessionId, List<WeatherObservation> observations) {
        session(sessionId).weather(observations);
        invalidateFrom(sessionId, PipelineStage.FEATURE_ENGINEERING);
    }

    @Override
    public List<WeatherObservation> readWeather(String sessionId) {
        SessionArtifacts artifacts = sessions.get(sessionId);
        return artifacts != null ? artifacts.weather() : List.of();
    }

    @Override
    public void writeArtifact(String sessionId, PipelineStage stage, PipelineArtifact artifact) {
        if (stage == PipelineStage.UPLOAD) {
            throw new IllegalArgumentException("Raw records are written through replaceActiveDataset");
        }
        session(sessionId).put(stage, artifact);
        log.debug("Artifact stored | session={} | stage={} | fingerprint={}",
                  sessionId, stage, artifact.getFingerprint());
    }

    @Override
    public <T extends PipelineArtifact> T readArtifact(String sessionId, PipelineStage stage, Class<T> type) {
        SessionArtifacts artifacts = sessions.get(sessionId);
        SessionArtifacts.Entry entry = artifacts != null ? artifacts.get(stage) : null;
        if (entry == null) {
            throw ArtifactNotFoundException.missing(sessionId, stage);
        }
        if (entry.stale()) {
            throw ArtifactNotFoundException.stale(sessionId, stage);
        }
        return type.cast(entry.artifact());
    }

    @Override
    public <T extends PipelineArtifact> Optional<T> findFreshArtifact(String sessionId, PipelineStage stage, Class<T> type) {
        SessionArtifacts artifacts = sessions.get(sessionId);
        SessionArtifacts.Entry entry = artifacts != null ? artifacts.get(stage) : null;
        if (entry == null || entry.stale()) {
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.artifact()));
    }

    @Override
    public void invalidateFrom(String sessionId, PipelineStage stage) {
        SessionArtifacts artifacts = session(sessionId);
        artifacts.markStale(EnumSet.of(stage));
        artifacts.markStale(stage.dependents());
    }

    @Override
    @Transactional(readOnly = true)
    public List<StageStatus> stageStatus(String sessionId) {
        SessionArtifacts artifacts = sessions.get(sessionId);
        List<StageStatus> statuses = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage == PipelineStage.UPLOAD) {
                boolean present = salesRecordRepository.countBySessionId(sessionId) > 0;
                statuses.add(new StageStatus(stage, present, false, null, null));
                continue;
            }
            SessionArtifacts.Entry entry = artifacts != null ? artifacts.get(stage) : null;
            statuses.add(entry == null
                ? new StageStatus(stage, false, false, null, null)
                : new StageStatus(stage, true, entry.stale(), entry.artifact().getFingerprint(), entry.updatedAt()));
        }
        return statuses;
    }

    private SessionArtifacts session(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> new SessionArtifacts());
    }

    private RawRecord toRawRecord(SalesRecordEntity entity) {
        return RawRecord.builder()
            .date(entity.getSaleDate())
            .productId(entity.getProductId())
            .quantity(entity.getQuantity())
            .unitPrice(entity.getUnitPrice())
            .store(entity.getStore())
            .customerSegment(entity.getCustomerSegment())
            .build();
    }

    private SalesRecordEntity toEntity(String sessionId, int position, RawRecord record, String requestId) {
        return SalesRecordEntity.builder()
            .sessionId(sessionId)
            .uploadPosition(position)
            .saleDate(record.getDate())
            .productId(record.getProductId())
            .quantity(record.getQuantity())
            .unitPrice(record.getUnitPrice())
            .store(record.getStore())
            .customerSegment(record.getCustomerSegment())
            .requestId(requestId)
            .build();
    }
}
