package io.github.drompincen.vigil.persistence.store;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;
import io.github.drompincen.vigil.persistence.repository.AutomationScheduleRepository;
import io.github.drompincen.vigil.protocol.api.ScheduleType;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoScheduleStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private AutomationScheduleRepository scheduleRepository;
    @Mock private MongoTemplate mongoTemplate;
    @Captor private ArgumentCaptor<Update> updateCaptor;
    @Captor private ArgumentCaptor<Query> queryCaptor;

    private MongoScheduleStore store;

    @BeforeEach
    void setUp() {
        store = new MongoScheduleStore(scheduleRepository, mongoTemplate);
    }

    @Test
    void loadActiveSchedules_excludesManual() {
        AutomationScheduleDocument daily = new AutomationScheduleDocument();
        daily.setScheduleId("s1");
        when(scheduleRepository.findByActiveTrueAndScheduleTypeNot(ScheduleType.MANUAL))
                .thenReturn(List.of(daily));

        assertThat(store.loadActiveSchedules()).containsExactly(daily);
    }

    @Test
    void recordFailure_incrementsAtomically_andReturnsNewStreak() {
        AutomationScheduleDocument updated = new AutomationScheduleDocument();
        updated.setConsecutiveFailures(3);
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(AutomationScheduleDocument.class)))
                .thenReturn(updated);

        int streak = store.recordFailure("s1", "provider timeout", NOW);

        assertThat(streak).isEqualTo(3);
        verify(mongoTemplate).findAndModify(queryCaptor.capture(), updateCaptor.capture(),
                any(FindAndModifyOptions.class), eq(AutomationScheduleDocument.class));
        Document update = updateCaptor.getValue().getUpdateObject();
        assertThat(update.get("$inc", Document.class).get("consecutiveFailures")).isEqualTo(1);
        assertThat(update.get("$set", Document.class).get("lastErrorMessage")).isEqualTo("provider timeout");
        assertThat(queryCaptor.getValue().getQueryObject().get("scheduleId")).isEqualTo("s1");
    }

    @Test
    void recordFailure_returnsZero_whenScheduleMissing() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(AutomationScheduleDocument.class)))
                .thenReturn(null);

        assertThat(store.recordFailure("gone", "boom", NOW)).isZero();
    }

    @Test
    void recordSuccess_resetsStreakAndClearsError() {
        store.recordSuccess("s1", "run-1", NOW);

        verify(mongoTemplate).updateFirst(any(Query.class), updateCaptor.capture(),
                eq(AutomationScheduleDocument.class));
        Document update = updateCaptor.getValue().getUpdateObject();
        assertThat(update.get("$set", Document.class).get("consecutiveFailures")).isEqualTo(0);
        assertThat(update.get("$set", Document.class).get("lastRunJobId")).isEqualTo("run-1");
        assertThat(update.get("$unset", Document.class)).containsKey("lastErrorMessage");
    }

    @Test
    void deactivate_reportsWhetherAnythingChanged() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(AutomationScheduleDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.deactivate("s1", NOW)).isTrue();
        assertThat(store.deactivate("s1", NOW)).isFalse();
    }

    @Test
    void markFired_setsLastRunAt() {
        store.markFired("s1", NOW);

        verify(mongoTemplate).updateFirst(any(Query.class), updateCaptor.capture(),
                eq(AutomationScheduleDocument.class));
        assertThat(updateCaptor.getValue().getUpdateObject().get("$set", Document.class).get("lastRunAt"))
                .isEqualTo(NOW);
        assertThat(updateCaptor.getValue().getUpdateObject().get("$inc", Document.class).get("version"))
                .isEqualTo(1);
    }

    @Test
    void updateNextRun_bumpsVersion() {
        Instant next = NOW.plusSeconds(86_400);

        store.updateNextRun("s1", next);

        verify(mongoTemplate).updateFirst(any(Query.class), updateCaptor.capture(),
                eq(AutomationScheduleDocument.class));
        Document update = updateCaptor.getValue().getUpdateObject();
        assertThat(update.get("$set", Document.class).get("nextRunAt")).isEqualTo(next);
        assertThat(update.get("$inc", Document.class).get("version")).isEqualTo(1);
    }
}
