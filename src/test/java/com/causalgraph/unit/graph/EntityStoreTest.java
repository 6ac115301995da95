package com.causalgraph.unit.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.causalgraph.domain.enums.EntityKind;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.exception.DuplicateIdException;
import com.causalgraph.graph.EntityStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EntityStore: uniqueness, half-open window iteration and eviction.
 */
class EntityStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private EntityStore entityStore;

    @BeforeEach
    void setUp() {
        entityStore = new EntityStore();
    }

    private TemporalEntity entity(String id, EntityKind kind, long offsetSeconds) {
        return TemporalEntity.builder()
                .id(id)
                .kind(kind)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .confidence(0.9)
                .source("test")
                .build();
    }

    private static List<String> ids(Iterable<TemporalEntity> entities) {
        List<String> ids = new ArrayList<>();
        entities.forEach(e -> ids.add(e.getId()));
        return ids;
    }

    @Nested
    @DisplayName("Insert and lookup")
    class InsertAndLookup {

        @Test
        @DisplayName("stored entity is returned by id")
        void storedEntityIsReturned() {
            TemporalEntity entity = entity("e1", EntityKind.NEWS_EVENT, 0);
            entityStore.add(entity);

            assertThat(entityStore.get("e1")).containsSame(entity);
            assertThat(entityStore.contains("e1")).isTrue();
            assertThat(entityStore.size()).isOne();
        }

        @Test
        @DisplayName("unknown id yields empty")
        void unknownIdYieldsEmpty() {
            assertThat(entityStore.get("missing")).isEmpty();
        }

        @Test
        @DisplayName("reused id fails with DuplicateIdException and leaves the store unchanged")
        void duplicateIdRejected() {
            TemporalEntity original = entity("e1", EntityKind.NEWS_EVENT, 0);
            entityStore.add(original);

            assertThatThrownBy(() -> entityStore.add(entity("e1", EntityKind.PRICE_MOVEMENT, 60)))
                    .isInstanceOf(DuplicateIdException.class)
                    .hasMessageContaining("e1");

            assertThat(entityStore.size()).isOne();
            assertThat(entityStore.get("e1")).containsSame(original);
            assertThat(ids(entityStore.entitiesInWindow(T0, T0.plusSeconds(120)))).containsExactly("e1");
        }

        @Test
        @DisplayName("property map is a read-only copy")
        void propertyMapIsCopied() {
            Map<String, Object> properties = new java.util.HashMap<>();
            properties.put("price", 101.5);
            TemporalEntity entity = TemporalEntity.builder()
                    .id("e1")
                    .kind(EntityKind.PRICE_MOVEMENT)
                    .timestamp(T0)
                    .confidence(1.0)
                    .properties(properties)
                    .build();
            properties.put("price", 0.0);

            assertThat(entity.getProperties()).containsEntry("price", 101.5);
            assertThatThrownBy(() -> entity.getProperties().put("x", 1))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Window iteration")
    class WindowIteration {

        @BeforeEach
        void populate() {
            entityStore.add(entity("late", EntityKind.PRICE_MOVEMENT, 300));
            entityStore.add(entity("early", EntityKind.NEWS_EVENT, 0));
            entityStore.add(entity("mid", EntityKind.VOLUME_SPIKE, 120));
        }

        @Test
        @DisplayName("entities are returned in timestamp order")
        void orderedByTimestamp() {
            assertThat(ids(entityStore.entitiesInWindow(T0, T0.plusSeconds(3600))))
                    .containsExactly("early", "mid", "late");
        }

        @Test
        @DisplayName("start is inclusive and end is exclusive")
        void halfOpenBounds() {
            assertThat(ids(entityStore.entitiesInWindow(T0, T0.plusSeconds(300)))).containsExactly("early", "mid");
            assertThat(ids(entityStore.entitiesInWindow(T0.plusSeconds(120), T0.plusSeconds(301))))
                    .containsExactly("mid", "late");
        }

        @Test
        @DisplayName("window can be iterated more than once")
        void restartable() {
            Iterable<TemporalEntity> window = entityStore.entitiesInWindow(T0, T0.plusSeconds(3600));

            assertThat(ids(window)).containsExactly("early", "mid", "late");
            assertThat(ids(window)).containsExactly("early", "mid", "late");
        }

        @Test
        @DisplayName("empty or inverted window yields nothing")
        void emptyWindow() {
            assertThat(entityStore.entitiesInWindow(T0, T0)).isEmpty();
            assertThat(entityStore.entitiesInWindow(T0.plusSeconds(60), T0)).isEmpty();
        }

        @Test
        @DisplayName("entities sharing a timestamp are all returned")
        void sameTimestamp() {
            entityStore.add(entity("mid-2", EntityKind.TRADING_SIGNAL, 120));

            assertThat(ids(entityStore.entitiesInWindow(T0.plusSeconds(120), T0.plusSeconds(121))))
                    .containsExactlyInAnyOrder("mid", "mid-2");
        }
    }

    @Nested
    @DisplayName("Eviction")
    class Eviction {

        @BeforeEach
        void populate() {
            entityStore.add(entity("a", EntityKind.NEWS_EVENT, 0));
            entityStore.add(entity("b", EntityKind.PRICE_MOVEMENT, 60));
            entityStore.add(entity("c", EntityKind.PRICE_MOVEMENT, 120));
        }

        @Test
        @DisplayName("evictBefore removes entities strictly older than the cutoff")
        void evictBeforeCutoff() {
            List<String> evicted = entityStore.evictBefore(T0.plusSeconds(120));

            assertThat(evicted).containsExactly("a", "b");
            assertThat(entityStore.size()).isOne();
            assertThat(entityStore.contains("c")).isTrue();
            assertThat(entityStore.entitiesInWindow(Instant.EPOCH, T0.plusSeconds(120))).isEmpty();
        }

        @Test
        @DisplayName("evictBefore with nothing older returns no ids")
        void evictNothing() {
            assertThat(entityStore.evictBefore(T0)).isEmpty();
            assertThat(entityStore.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("evictOldest removes exactly the requested number, oldest first")
        void evictOldest() {
            assertThat(entityStore.evictOldest(2)).containsExactly("a", "b");
            assertThat(entityStore.allOrdered()).extracting(TemporalEntity::getId).containsExactly("c");
        }
    }
}
