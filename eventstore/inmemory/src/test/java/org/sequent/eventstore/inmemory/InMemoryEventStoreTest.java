/*
 *
 *  Copyright 2024 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.sequent.eventstore.inmemory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.sequent.domain.error.AggregateConflictException;
import org.sequent.domain.error.CommandValidationException;
import org.sequent.domain.error.TechnicalException;
import org.sequent.eventstore.api.AggregateContext;
import org.sequent.eventstore.api.BackendLimits;
import org.sequent.eventstore.api.EventEnvelope;
import org.sequent.eventstore.api.PersistedEventStore;
import org.sequent.eventstore.api.SerializedEvent;
import org.sequent.eventstore.api.SerializedSnapshot;
import org.sequent.eventstore.api.SnapshotStrategy;
import org.sequent.eventstore.api.serialization.JacksonEventSerializer;
import org.sequent.eventstore.api.serialization.JacksonStateSerializer;
import org.sequent.eventstore.api.upcasting.EventUpcasterChain;
import org.sequent.eventstore.api.upcasting.SemanticVersionEventUpcaster;
import org.sequent.example.bankaccount.BankAccount;
import org.sequent.example.bankaccount.BankAccountEvent;
import org.sequent.example.bankaccount.BankAccountEvent.AccountOpened;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerDepositedMoney;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWithdrewCash;
import org.sequent.example.bankaccount.BankAccountState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("persisted event store backed by the in-memory repository")
@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventStoreTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final BankAccount bankAccount = new BankAccount();

    private InMemoryEventRepository repository;
    private PersistedEventStore<BankAccountState, BankAccountEvent> eventStore;

    @BeforeEach
    void create_event_store() {
        repository = new InMemoryEventRepository();
        eventStore = builder(repository).build();
    }

    @Test
    void new_instance_is_loaded_with_initial_state_at_sequence_zero() {
        AggregateContext<BankAccountState> context = eventStore.load("account-1");

        assertAll(
                () -> assertThat(context.sequence()).isZero(),
                () -> assertThat(context.state()).isEqualTo(BankAccountState.EMPTY),
                () -> assertThat(context.aggregateType()).isEqualTo(BankAccount.AGGREGATE_TYPE)
        );
    }

    @Test
    void appended_events_get_consecutive_sequences_and_are_replayed_on_load() {
        // Given
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("user", "john");
        metadata.put("ip", "127.0.0.1");

        // When
        List<EventEnvelope<BankAccountEvent>> committed = eventStore.append(eventStore.load("account-1"),
                List.of(new AccountOpened("account-1"), new CustomerDepositedMoney(200, 200)), metadata);
        AggregateContext<BankAccountState> context = eventStore.load("account-1");

        // Then
        assertAll(
                () -> assertThat(committed).extracting(EventEnvelope::sequence).containsExactly(1L, 2L),
                () -> assertThat(committed).extracting(EventEnvelope::eventType).containsExactly("AccountOpened", "CustomerDepositedMoney"),
                () -> assertThat(committed).extracting(EventEnvelope::eventVersion).containsExactly("2.0", "1.0"),
                () -> assertThat(committed.get(0).metadata().keySet()).containsExactly("user", "ip"),
                () -> assertThat(context.sequence()).isEqualTo(2),
                () -> assertThat(context.state()).isEqualTo(new BankAccountState("account-1", 200)),
                () -> assertThat(eventStore.loadEvents("account-1")).isEqualTo(committed)
        );
    }

    @Test
    void appending_no_events_writes_nothing() {
        // Given
        CopyOnWriteArrayList<SerializedEvent> written = new CopyOnWriteArrayList<>();
        PersistedEventStore<BankAccountState, BankAccountEvent> store = builder(new InMemoryEventRepository(written::addAll)).build();

        // When
        List<EventEnvelope<BankAccountEvent>> committed = store.append(store.load("account-1"), List.of(), Map.of());

        // Then
        assertAll(
                () -> assertThat(committed).isEmpty(),
                () -> assertThat(written).isEmpty(),
                () -> assertThat(store.load("account-1").sequence()).isZero()
        );
    }

    @Nested
    @DisplayName("optimistic concurrency")
    class OptimisticConcurrency {

        @Test
        void append_with_stale_context_is_rejected_without_partial_write() {
            // Given
            AggregateContext<BankAccountState> first = eventStore.load("account-1");
            AggregateContext<BankAccountState> second = eventStore.load("account-1");
            eventStore.append(first, List.of(new CustomerDepositedMoney(100, 100)), Map.of());

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(second, List.of(new CustomerDepositedMoney(100, 100), new CustomerDepositedMoney(100, 200)), Map.of()));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(AggregateConflictException.class),
                    () -> assertThat(((AggregateConflictException) throwable).aggregateId).isEqualTo("account-1"),
                    () -> assertThat(eventStore.loadEvents("account-1")).hasSize(1)
            );
        }

        @Test
        void append_with_explicit_expected_sequence_is_rejected_when_sequence_has_advanced() {
            // Given
            eventStore.append("account-1", 0, List.of(new CustomerDepositedMoney(100, 100)), Map.of());

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append("account-1", 0, List.of(new CustomerDepositedMoney(100, 100)), Map.of()));

            // Then
            assertThat(throwable).isExactlyInstanceOf(AggregateConflictException.class);
        }

        @Timeout(20)
        @Test
        void concurrent_writers_never_produce_gaps_or_duplicates() throws InterruptedException {
            // Given
            int writers = 8;
            int commitsPerWriter = 25;
            ExecutorService executor = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger finished = new AtomicInteger();
            AtomicInteger conflicts = new AtomicInteger();

            // When
            for (int i = 0; i < writers; i++) {
                executor.execute(() -> {
                    try {
                        start.await();
                        for (int commit = 0; commit < commitsPerWriter; commit++) {
                            while (true) {
                                AggregateContext<BankAccountState> context = eventStore.load("account-1");
                                try {
                                    long balance = context.state().balance();
                                    eventStore.append(context, List.of(new CustomerDepositedMoney(1, balance + 1), new CustomerDepositedMoney(1, balance + 2)), Map.of());
                                    break;
                                } catch (AggregateConflictException e) {
                                    conflicts.incrementAndGet();
                                }
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        finished.incrementAndGet();
                    }
                });
            }
            start.countDown();
            await().atMost(Duration.ofSeconds(15)).until(() -> finished.get() == writers);
            executor.shutdown();

            // Then
            long expectedEvents = (long) writers * commitsPerWriter * 2;
            assertAll(
                    () -> assertThat(eventStore.loadEvents("account-1")).extracting(EventEnvelope::sequence)
                            .containsExactlyElementsOf(LongStream.rangeClosed(1, expectedEvents).boxed().toList()),
                    () -> assertThat(eventStore.load("account-1").state().balance()).isEqualTo(expectedEvents)
            );
        }
    }

    @Nested
    @DisplayName("backend limits")
    class Limits {

        @Test
        void too_many_events_are_rejected_before_anything_is_written() {
            // Given
            PersistedEventStore<BankAccountState, BankAccountEvent> store = builder(repository).backendLimits(BackendLimits.dynamoDb()).build();
            List<BankAccountEvent> events = new ArrayList<>();
            for (int i = 1; i <= 26; i++) {
                events.add(new CustomerDepositedMoney(1, i));
            }

            // When
            Throwable throwable = catchThrowable(() -> store.append(store.load("account-1"), events, Map.of()));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(CommandValidationException.class),
                    () -> assertThat(repository.loadEvents(BankAccount.AGGREGATE_TYPE, "account-1")).isEmpty()
            );
        }

        @Test
        void one_event_less_is_allowed_when_a_snapshot_is_due_in_the_same_commit() {
            // Given
            PersistedEventStore<BankAccountState, BankAccountEvent> store = builder(repository)
                    .backendLimits(BackendLimits.dynamoDb())
                    .snapshots(new JacksonStateSerializer<>(objectMapper, BankAccountState.class), SnapshotStrategy.everyNEvents(10))
                    .build();
            List<BankAccountEvent> events = new ArrayList<>();
            for (int i = 1; i <= 25; i++) {
                events.add(new CustomerDepositedMoney(1, i));
            }

            // When
            Throwable withSnapshot = catchThrowable(() -> store.append(store.load("account-1"), events, Map.of()));
            List<EventEnvelope<BankAccountEvent>> committed = store.append(store.load("account-1"), events.subList(0, 24), Map.of());

            // Then
            assertAll(
                    () -> assertThat(withSnapshot).isExactlyInstanceOf(CommandValidationException.class),
                    () -> assertThat(committed).hasSize(24),
                    () -> assertThat(repository.loadSnapshot(BankAccount.AGGREGATE_TYPE, "account-1")).hasValueSatisfying(s -> assertThat(s.lastSequence()).isEqualTo(24))
            );
        }

        @Test
        void event_with_too_large_payload_is_rejected() {
            // Given
            PersistedEventStore<BankAccountState, BankAccountEvent> store = builder(repository).backendLimits(new BackendLimits(25, 24, 30)).build();

            // When
            Throwable throwable = catchThrowable(() -> store.append(store.load("account-1"), List.of(new AccountOpened("an-account-id-that-is-way-too-long")), Map.of()));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(CommandValidationException.class),
                    () -> assertThat(repository.loadEvents(BankAccount.AGGREGATE_TYPE, "account-1")).isEmpty()
            );
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        void snapshot_is_written_every_n_events_with_increasing_generation() {
            // Given
            PersistedEventStore<BankAccountState, BankAccountEvent> store = snapshottingStore(2);

            // When
            for (int i = 1; i <= 5; i++) {
                store.append(store.load("account-1"), List.of(new CustomerDepositedMoney(10, i * 10L)), Map.of());
            }

            // Then
            SerializedSnapshot snapshot = repository.loadSnapshot(BankAccount.AGGREGATE_TYPE, "account-1").orElseThrow();
            AggregateContext<BankAccountState> context = store.load("account-1");
            assertAll(
                    () -> assertThat(snapshot.lastSequence()).isEqualTo(4),
                    () -> assertThat(snapshot.currentSnapshot()).isEqualTo(2),
                    () -> assertThat(context.sequence()).isEqualTo(5),
                    () -> assertThat(context.currentSnapshot()).isEqualTo(2),
                    () -> assertThat(context.state()).isEqualTo(new BankAccountState(null, 50))
            );
        }

        @Test
        void snapshot_that_cannot_be_deserialized_is_discarded_in_favour_of_full_replay() {
            // Given
            PersistedEventStore<BankAccountState, BankAccountEvent> store = snapshottingStore(1);
            store.append(store.load("account-1"), List.of(new AccountOpened("account-1"), new CustomerDepositedMoney(10, 10)), Map.of());
            repository.replaceSnapshot(new SerializedSnapshot(BankAccount.AGGREGATE_TYPE, "account-1", 2, 1, objectMapper.createArrayNode().add("garbage")));

            // When
            AggregateContext<BankAccountState> context = store.load("account-1");

            // Then
            assertAll(
                    () -> assertThat(context.state()).isEqualTo(new BankAccountState("account-1", 10)),
                    () -> assertThat(context.sequence()).isEqualTo(2)
            );
        }

        @Test
        void snapshot_that_does_not_connect_to_the_event_log_is_discarded() {
            // Given
            PersistedEventStore<BankAccountState, BankAccountEvent> store = snapshottingStore(100);
            store.append(store.load("account-1"), List.of(new CustomerDepositedMoney(10, 10), new CustomerDepositedMoney(10, 20)), Map.of());
            ObjectNode wrongState = objectMapper.createObjectNode().put("balance", 999);
            wrongState.putNull("accountId");
            InMemoryEventRepository skippingRepository = new InMemoryEventRepository() {
                @Override
                public List<SerializedEvent> loadEventsAfter(String aggregateType, String aggregateId, long sequence) {
                    return repository.loadEventsAfter(aggregateType, aggregateId, sequence + 1);
                }

                @Override
                public List<SerializedEvent> loadEvents(String aggregateType, String aggregateId) {
                    return repository.loadEvents(aggregateType, aggregateId);
                }

                @Override
                public Optional<SerializedSnapshot> loadSnapshot(String aggregateType, String aggregateId) {
                    return Optional.of(new SerializedSnapshot(aggregateType, aggregateId, 0, 1, wrongState));
                }
            };
            PersistedEventStore<BankAccountState, BankAccountEvent> storeWithBrokenSnapshot = builder(skippingRepository)
                    .snapshots(new JacksonStateSerializer<>(objectMapper, BankAccountState.class), SnapshotStrategy.none())
                    .build();

            // When
            AggregateContext<BankAccountState> context = storeWithBrokenSnapshot.load("account-1");

            // Then
            assertThat(context.state().balance()).isEqualTo(20);
        }

        @Test
        void snapshot_ahead_of_the_event_log_is_discarded_and_the_instance_stays_writable() {
            // Given
            PersistedEventStore<BankAccountState, BankAccountEvent> store = snapshottingStore(100);
            store.append(store.load("account-1"), List.of(new CustomerDepositedMoney(10, 10), new CustomerDepositedMoney(10, 20)), Map.of());
            ObjectNode aheadState = objectMapper.createObjectNode().put("balance", 999);
            aheadState.putNull("accountId");
            repository.replaceSnapshot(new SerializedSnapshot(BankAccount.AGGREGATE_TYPE, "account-1", 10, 1, aheadState));

            // When
            AggregateContext<BankAccountState> context = store.load("account-1");
            List<EventEnvelope<BankAccountEvent>> committed = store.append(context, List.of(new CustomerDepositedMoney(10, 30)), Map.of());

            // Then
            assertAll(
                    () -> assertThat(context.sequence()).isEqualTo(2),
                    () -> assertThat(context.state().balance()).isEqualTo(20),
                    () -> assertThat(committed).extracting(EventEnvelope::sequence).containsExactly(3L),
                    () -> assertThat(store.load("account-1").state().balance()).isEqualTo(30)
            );
        }

        private PersistedEventStore<BankAccountState, BankAccountEvent> snapshottingStore(int everyNEvents) {
            return builder(repository)
                    .snapshots(new JacksonStateSerializer<>(objectMapper, BankAccountState.class), SnapshotStrategy.everyNEvents(everyNEvents))
                    .build();
        }
    }

    @Nested
    @DisplayName("upcasting")
    class Upcasting {
        private final SemanticVersionEventUpcaster accountOpenedV2 = new SemanticVersionEventUpcaster("AccountOpened", AccountOpened.VERSION, payload -> {
            ObjectNode node = (ObjectNode) payload;
            node.set("accountId", node.remove("id"));
            return node;
        });

        @Test
        void legacy_event_is_upcasted_before_it_is_applied() {
            // Given
            storeLegacyAccountOpened("account-1");
            PersistedEventStore<BankAccountState, BankAccountEvent> store = builder(repository).upcasters(EventUpcasterChain.of(accountOpenedV2)).build();
            PersistedEventStore<BankAccountState, BankAccountEvent> referenceStore = builder(new InMemoryEventRepository()).build();
            referenceStore.append(referenceStore.load("account-1"), List.of(new AccountOpened("account-1"), new CustomerDepositedMoney(100, 100)), Map.of());

            // When
            AggregateContext<BankAccountState> upcasted = store.load("account-1");
            List<EventEnvelope<BankAccountEvent>> envelopes = store.loadEvents("account-1");

            // Then
            assertAll(
                    () -> assertThat(upcasted.state()).isEqualTo(referenceStore.load("account-1").state()),
                    () -> assertThat(upcasted.sequence()).isEqualTo(2),
                    () -> assertThat(envelopes.get(0).eventVersion()).isEqualTo("2.0.0"),
                    () -> assertThat(envelopes.get(0).payload()).isEqualTo(new AccountOpened("account-1"))
            );
        }

        @Test
        void legacy_event_without_upcaster_fails_with_deserialization_error() {
            // Given
            storeLegacyAccountOpened("account-1");

            // When
            Throwable throwable = catchThrowable(() -> eventStore.load("account-1"));

            // Then
            assertAll(
                    () -> assertThat(throwable).isInstanceOf(TechnicalException.class),
                    () -> assertThat(((TechnicalException) throwable).kind()).isEqualTo(TechnicalException.Kind.DESERIALIZATION)
            );
        }

        private void storeLegacyAccountOpened(String aggregateId) {
            repository.commit(BankAccount.AGGREGATE_TYPE, aggregateId, 0, List.of(
                    new SerializedEvent(BankAccount.AGGREGATE_TYPE, aggregateId, 1, "AccountOpened", "1.0", objectMapper.createObjectNode().put("id", aggregateId), Map.of()),
                    new SerializedEvent(BankAccount.AGGREGATE_TYPE, aggregateId, 2, "CustomerDepositedMoney", "1.0", objectMapper.createObjectNode().put("amount", 100).put("balance", 100), Map.of())
            ), null);
        }
    }

    @Nested
    @DisplayName("technical errors")
    class TechnicalErrors {

        @Test
        void gap_in_the_event_log_is_reported() {
            // Given
            eventStore.append(eventStore.load("account-1"), List.of(new CustomerDepositedMoney(1, 1), new CustomerDepositedMoney(1, 2), new CustomerDepositedMoney(1, 3)), Map.of());
            InMemoryEventRepository gappedRepository = new InMemoryEventRepository() {
                @Override
                public List<SerializedEvent> loadEvents(String aggregateType, String aggregateId) {
                    List<SerializedEvent> events = new ArrayList<>(repository.loadEvents(aggregateType, aggregateId));
                    events.remove(1);
                    return Collections.unmodifiableList(events);
                }
            };

            // When
            Throwable throwable = catchThrowable(() -> builder(gappedRepository).build().load("account-1"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(TechnicalException.class).hasMessageContaining("expected sequence 2 but found 3");
        }

        @Test
        void unexpected_repository_failure_is_wrapped_as_technical_error() {
            // Given
            InMemoryEventRepository failingRepository = new InMemoryEventRepository() {
                @Override
                public List<SerializedEvent> loadEvents(String aggregateType, String aggregateId) {
                    throw new IllegalStateException("connection reset");
                }
            };

            // When
            Throwable throwable = catchThrowable(() -> builder(failingRepository).build().load("account-1"));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(TechnicalException.class).hasMessage("connection reset").hasCauseExactlyInstanceOf(IllegalStateException.class),
                    () -> assertThat(((TechnicalException) throwable).kind()).isEqualTo(TechnicalException.Kind.UNEXPECTED)
            );
        }
    }

    @Test
    void stream_all_events_returns_every_instance_of_the_aggregate_type() {
        // Given
        eventStore.append(eventStore.load("account-1"), List.of(new CustomerDepositedMoney(1, 1)), Map.of());
        eventStore.append(eventStore.load("account-2"), List.of(new CustomerDepositedMoney(2, 2), new CustomerWithdrewCash(1, 1)), Map.of());

        // When
        List<String> events;
        try (Stream<EventEnvelope<BankAccountEvent>> stream = eventStore.streamAllEvents()) {
            events = stream.map(e -> e.aggregateId() + ":" + e.eventType()).toList();
        }

        // Then
        assertThat(events).containsExactly("account-1:CustomerDepositedMoney", "account-2:CustomerDepositedMoney", "account-2:CustomerWithdrewCash");
    }

    static PersistedEventStore.Builder<BankAccountState, BankAccountEvent> builder(InMemoryEventRepository repository) {
        return PersistedEventStore.builder(bankAccount, repository, JacksonEventSerializer.forSealedHierarchy(objectMapper, BankAccountEvent.class));
    }
}
