package io.github.drompincen.vigil.persistence.store;

import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;
import io.github.drompincen.vigil.persistence.repository.AutomationScheduleRepository;
import io.github.drompincen.vigil.protocol.api.RunStatus;
import io.github.drompincen.vigil.protocol.api.ScheduleType;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Every targeted update bumps {@code version}, so a full-document save built from a stale read
 * fails with an optimistic locking error instead of overwriting fields the engine wrote.
 */
@Repository
public class MongoScheduleStore implements ScheduleStore {

    private final AutomationScheduleRepository scheduleRepository;
    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(AutomationScheduleRepository scheduleRepository, MongoTemplate mongoTemplate) {
        this.scheduleRepository = scheduleRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<AutomationScheduleDocument> loadActiveSchedules() {
        return scheduleRepository.findByActiveTrueAndScheduleTypeNot(ScheduleType.MANUAL);
    }

    @Override
    public Optional<AutomationScheduleDocument> findById(String scheduleId) {
        return scheduleRepository.findById(scheduleId);
    }

    @Override
    public AutomationScheduleDocument save(AutomationScheduleDocument schedule) {
        return scheduleRepository.save(schedule);
    }

    @Override
    public void delete(String scheduleId) {
        scheduleRepository.deleteById(scheduleId);
    }

    @Override
    public void markFired(String scheduleId, Instant firedAt) {
        mongoTemplate.updateFirst(byId(scheduleId),
                new Update().set("lastRunAt", firedAt).set("updatedAt", firedAt).inc("version", 1),
                AutomationScheduleDocument.class);
    }

    @Override
    public void updateNextRun(String scheduleId, Instant nextRunAt) {
        mongoTemplate.updateFirst(byId(scheduleId),
                new Update().set("nextRunAt", nextRunAt).inc("version", 1),
                AutomationScheduleDocument.class);
    }

    @Override
    public void recordSuccess(String scheduleId, String jobRunId, Instant at) {
        mongoTemplate.updateFirst(byId(scheduleId),
                new Update()
                        .set("consecutiveFailures", 0)
                        .set("lastRunStatus", RunStatus.SUCCESS)
                        .set("lastRunJobId", jobRunId)
                        .unset("lastErrorMessage")
                        .set("updatedAt", at)
                        .inc("version", 1),
                AutomationScheduleDocument.class);
    }

    @Override
    public int recordFailure(String scheduleId, String errorMessage, Instant at) {
        AutomationScheduleDocument updated = mongoTemplate.findAndModify(byId(scheduleId),
                new Update()
                        .inc("consecutiveFailures", 1)
                        .inc("version", 1)
                        .set("lastRunStatus", RunStatus.FAILED)
                        .set("lastErrorMessage", errorMessage)
                        .set("lastErrorAt", at)
                        .set("updatedAt", at),
                FindAndModifyOptions.options().returnNew(true),
                AutomationScheduleDocument.class);
        return updated != null ? updated.getConsecutiveFailures() : 0;
    }

    @Override
    public boolean deactivate(String scheduleId, Instant at) {
        Query query = new Query()
                .addCriteria(Criteria.where("scheduleId").is(scheduleId))
                .addCriteria(Criteria.where("active").is(true));
        return mongoTemplate.updateFirst(query,
                new Update().set("active", false).set("updatedAt", at).inc("version", 1),
                AutomationScheduleDocument.class).getModifiedCount() > 0;
    }

    private static Query byId(String scheduleId) {
        return new Query().addCriteria(Criteria.where("scheduleId").is(scheduleId));
    }
}
