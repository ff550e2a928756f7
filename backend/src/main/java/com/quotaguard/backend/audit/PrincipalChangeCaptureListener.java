package com.quotaguard.backend.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotaguard.backend.entity.AuditChangeType;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.exception.AuditWriteFailureException;
import com.quotaguard.backend.util.TimeUtil;
import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManagerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.engine.spi.SessionFactoryImplementor;
import org.hibernate.event.service.spi.EventListenerRegistry;
import org.hibernate.event.spi.EventSource;
import org.hibernate.event.spi.EventType;
import org.hibernate.event.spi.PostUpdateEvent;
import org.hibernate.event.spi.PostUpdateEventListener;
import org.hibernate.persister.entity.EntityPersister;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Store-level change capture for {@link Principal}. Registered on the Hibernate session factory,
 * so every flushed update of a principal row is seen no matter which code path changed it.
 * For each tracked field whose value changed, one {@code principal_audit_log} row is inserted on
 * the session's own connection, inside the transaction that carries the update. Any failure
 * aborts the flush, and the update is rolled back with it. Inserts are deliberately not
 * listened to.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrincipalChangeCaptureListener implements PostUpdateEventListener {

    static final String INSERT_SQL = """
            insert into principal_audit_log
              (principal_id, principal_email, field_name, old_value, new_value,
               change_type, actor_id, reason, changed_at, metadata)
            values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final EntityManagerFactory entityManagerFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PostConstruct
    void register() {
        SessionFactoryImplementor sessionFactory = entityManagerFactory.unwrap(SessionFactoryImplementor.class);
        EventListenerRegistry registry = sessionFactory.getEventEngine().getListenerRegistry();
        registry.appendListeners(EventType.POST_UPDATE, this);
        log.info("[AUDIT] Change capture attached for fields {}", List.of(TrackedField.values()));
    }

    @Override
    public void onPostUpdate(PostUpdateEvent event) {
        if (!(event.getEntity() instanceof Principal principal)) {
            return;
        }
        Object[] oldState = event.getOldState();
        if (oldState == null) {
            throw new AuditWriteFailureException(principal.getId(), "previous state not loaded", null);
        }
        List<FieldChange> changes = diff(event.getPersister().getPropertyNames(), oldState, event.getState());
        if (changes.isEmpty()) {
            return;
        }
        write(event.getSession(), principal, changes);
    }

    @Override
    public boolean requiresPostCommitHandling(EntityPersister persister) {
        return false;
    }

    static List<FieldChange> diff(String[] propertyNames, Object[] oldState, Object[] newState) {
        List<FieldChange> changes = new ArrayList<>();
        for (TrackedField field : TrackedField.values()) {
            int index = indexOf(propertyNames, field.property());
            if (index < 0) {
                continue;
            }
            String oldValue = toText(oldState[index]);
            String newValue = toText(newState[index]);
            if (!Objects.equals(oldValue, newValue)) {
                changes.add(new FieldChange(field, oldValue, newValue));
            }
        }
        return changes;
    }

    static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime time) {
            return time.toString();
        }
        return String.valueOf(value);
    }

    private void write(EventSource session, Principal principal, List<FieldChange> changes) {
        ChangeAttribution attribution = ChangeAttributionHolder.current()
                .orElseGet(() -> ChangeAttribution.of(null, null));
        LocalDateTime changedAt = TimeUtil.now(clock);
        String metadata = toMetadata(principal, attribution);

        session.doWork(connection -> insert(connection, principal, changes, attribution, changedAt, metadata));
        log.debug("[AUDIT] principal={} fields={} actor={}", principal.getId(),
                changes.stream().map(change -> change.field().fieldName()).toList(), attribution.actorId());
    }

    private void insert(Connection connection, Principal principal, List<FieldChange> changes,
                        ChangeAttribution attribution, LocalDateTime changedAt, String metadata) {
        try (PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (FieldChange change : changes) {
                AuditChangeType changeType = change.field().changeType(change.oldValue(), change.newValue());
                statement.setLong(1, principal.getId());
                statement.setString(2, principal.getEmail());
                statement.setString(3, change.field().fieldName());
                statement.setString(4, change.oldValue());
                statement.setString(5, change.newValue());
                statement.setString(6, changeType.code());
                if (attribution.actorId() == null) {
                    statement.setNull(7, Types.BIGINT);
                } else {
                    statement.setLong(7, attribution.actorId());
                }
                statement.setString(8, attribution.reasonOrDefault());
                statement.setObject(9, changedAt);
                statement.setString(10, metadata);
                statement.addBatch();
            }
            statement.executeBatch();
        } catch (SQLException ex) {
            log.error("[AUDIT] Failed to write audit entries for principal {}", principal.getId(), ex);
            throw new AuditWriteFailureException(principal.getId(), ex.getMessage(), ex);
        }
    }

    private String toMetadata(Principal principal, ChangeAttribution attribution) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("changed_via", "change_capture_listener");
        metadata.put("entity_version", principal.getVersion());
        metadata.putAll(attribution.metadata());
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit metadata: {}", metadata, e);
            return null;
        }
    }

    private static int indexOf(String[] propertyNames, String property) {
        for (int i = 0; i < propertyNames.length; i++) {
            if (propertyNames[i].equals(property)) {
                return i;
            }
        }
        return -1;
    }

    record FieldChange(TrackedField field, String oldValue, String newValue) {
    }
}
