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

package org.sequent.dsl.view;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.sequent.domain.error.AggregateConflictException;
import org.sequent.eventstore.api.EventEnvelope;
import org.sequent.eventstore.api.VersionedView;
import org.sequent.eventstore.api.ViewRepository;
import org.sequent.eventstore.inmemory.InMemoryViewRepository;
import org.sequent.example.bankaccount.BankAccount;
import org.sequent.example.bankaccount.BankAccountEvent;
import org.sequent.example.bankaccount.BankAccountEvent.AccountOpened;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerDepositedMoney;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWithdrewCash;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("generic query")
@DisplayNameGeneration(ReplaceUnderscores.class)
class GenericQueryTest {

    @Test
    void applies_envelopes_in_order_and_counts_them_as_the_view_version() {
        // Given
        InMemoryViewRepository<AccountActivity> repository = new InMemoryViewRepository<>("account_activity");
        GenericQuery<AccountActivity, BankAccountEvent> query = GenericQuery.create(AccountActivity.VIEW, repository);

        // When
        query.dispatch("account-1", List.of(envelope("account-1", 1, new AccountOpened("account-1")), envelope("account-1", 2, new CustomerDepositedMoney(100, 100))));
        query.dispatch("account-1", List.of(envelope("account-1", 3, new CustomerWithdrewCash(40, 60))));

        // Then
        VersionedView<AccountActivity> view = query.loadVersioned("account-1").orElseThrow();
        assertAll(
                () -> assertThat(view.version()).isEqualTo(3),
                () -> assertThat(view.view()).isEqualTo(new AccountActivity(60, List.of("deposit 100", "withdrawal 40"))),
                () -> assertThat(query.load("account-1")).contains(view.view()),
                () -> assertThat(query.load("account-2")).isEmpty()
        );
    }

    @Test
    void view_id_can_be_derived_from_the_envelope() {
        // Given
        InMemoryViewRepository<AccountActivity> repository = new InMemoryViewRepository<>("account_activity");
        GenericQuery<AccountActivity, BankAccountEvent> query = GenericQuery.builder(AccountActivity.VIEW, repository)
                .viewId(envelope -> envelope.metadata().getOrDefault("branch", "unknown"))
                .build();

        // When
        query.dispatch("account-1", List.of(envelope("account-1", 1, new CustomerDepositedMoney(10, 10), Map.of("branch", "north"))));
        query.dispatch("account-2", List.of(envelope("account-2", 1, new CustomerDepositedMoney(20, 20), Map.of("branch", "north"))));

        // Then
        assertThat(query.load("north")).hasValueSatisfying(activity -> assertThat(activity.ledger()).containsExactly("deposit 10", "deposit 20"));
    }

    @Nested
    @DisplayName("when the view is written concurrently")
    class Conflicts {

        @Test
        void row_is_reloaded_and_envelopes_are_applied_again() {
            // Given
            InMemoryViewRepository<AccountActivity> delegate = new InMemoryViewRepository<>("account_activity");
            AtomicInteger writes = new AtomicInteger();
            ViewRepository<AccountActivity> repository = new ViewRepository<>() {
                @Override
                public Optional<VersionedView<AccountActivity>> load(String viewId) {
                    return delegate.load(viewId);
                }

                @Override
                public void write(VersionedView<AccountActivity> view, long expectedVersion) {
                    if (writes.incrementAndGet() == 1) {
                        // Someone else writes between our load and write
                        delegate.write(new VersionedView<>(view.viewId(), 1, new AccountActivity(5, List.of("deposit 5"))), 0);
                    }
                    delegate.write(view, expectedVersion);
                }
            };
            CopyOnWriteArrayList<RuntimeException> errors = new CopyOnWriteArrayList<>();
            GenericQuery<AccountActivity, BankAccountEvent> query = GenericQuery.builder(AccountActivity.VIEW, repository)
                    .errorHandler((viewId, error) -> errors.add(error))
                    .build();

            // When
            query.dispatch("account-1", List.of(envelope("account-1", 2, new CustomerDepositedMoney(10, 15))));

            // Then
            assertAll(
                    () -> assertThat(errors).isEmpty(),
                    () -> assertThat(query.loadVersioned("account-1")).contains(new VersionedView<>("account-1", 2, new AccountActivity(15, List.of("deposit 5", "deposit 10"))))
            );
        }

        @Test
        void error_handler_is_called_when_attempts_are_exhausted() {
            // Given
            ViewRepository<AccountActivity> alwaysConflicting = new ViewRepository<>() {
                @Override
                public Optional<VersionedView<AccountActivity>> load(String viewId) {
                    return Optional.empty();
                }

                @Override
                public void write(VersionedView<AccountActivity> view, long expectedVersion) {
                    throw new AggregateConflictException("account_activity", view.viewId(), expectedVersion);
                }
            };
            CopyOnWriteArrayList<String> failedViewIds = new CopyOnWriteArrayList<>();
            CopyOnWriteArrayList<RuntimeException> errors = new CopyOnWriteArrayList<>();
            GenericQuery<AccountActivity, BankAccountEvent> query = GenericQuery.builder(AccountActivity.VIEW, alwaysConflicting)
                    .maxAttempts(2)
                    .errorHandler((viewId, error) -> {
                        failedViewIds.add(viewId);
                        errors.add(error);
                    })
                    .build();

            // When
            query.dispatch("account-1", List.of(envelope("account-1", 1, new CustomerDepositedMoney(10, 10))));

            // Then
            assertAll(
                    () -> assertThat(failedViewIds).containsExactly("account-1"),
                    () -> assertThat(errors).singleElement().isInstanceOf(AggregateConflictException.class)
            );
        }
    }

    @Test
    void failing_view_never_throws_out_of_dispatch() {
        // Given
        View<AccountActivity, BankAccountEvent> failingView = View.create(AccountActivity.EMPTY, (activity, envelope) -> {
            throw new IllegalStateException("boom");
        });
        CopyOnWriteArrayList<RuntimeException> errors = new CopyOnWriteArrayList<>();
        GenericQuery<AccountActivity, BankAccountEvent> query = GenericQuery.builder(failingView, new InMemoryViewRepository<AccountActivity>("failing"))
                .errorHandler((viewId, error) -> errors.add(error))
                .build();

        // When
        assertThatCode(() -> query.dispatch("account-1", List.of(envelope("account-1", 1, new CustomerDepositedMoney(10, 10))))).doesNotThrowAnyException();

        // Then
        assertAll(
                () -> assertThat(errors).singleElement().isInstanceOf(IllegalStateException.class),
                () -> assertThat(query.load("account-1")).isEmpty()
        );
    }

    @Test
    void failing_error_handler_is_logged_and_ignored() {
        // Given
        View<AccountActivity, BankAccountEvent> failingView = View.create(AccountActivity.EMPTY, (activity, envelope) -> {
            throw new IllegalStateException("boom");
        });
        GenericQuery<AccountActivity, BankAccountEvent> query = GenericQuery.builder(failingView, new InMemoryViewRepository<AccountActivity>("failing"))
                .errorHandler((viewId, error) -> {
                    throw new IllegalArgumentException("handler failed");
                })
                .build();

        // When / Then
        assertThatCode(() -> query.dispatch("account-1", List.of(envelope("account-1", 1, new CustomerDepositedMoney(10, 10))))).doesNotThrowAnyException();
    }

    static EventEnvelope<BankAccountEvent> envelope(String aggregateId, long sequence, BankAccountEvent event) {
        return envelope(aggregateId, sequence, event, Map.of());
    }

    static EventEnvelope<BankAccountEvent> envelope(String aggregateId, long sequence, BankAccountEvent event, Map<String, String> metadata) {
        return new EventEnvelope<>(BankAccount.AGGREGATE_TYPE, aggregateId, sequence, event.eventType(), event.eventVersion(), event, metadata);
    }
}
