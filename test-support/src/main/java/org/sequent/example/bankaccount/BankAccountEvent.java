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

package org.sequent.example.bankaccount;

import org.sequent.domain.DomainEvent;

/**
 * Events of a bank account. Amounts and balances are expressed in the smallest currency unit.
 */
public sealed interface BankAccountEvent extends DomainEvent {

    @Override
    default String eventVersion() {
        return "1.0";
    }

    /**
     * Version {@code 1.0} of this event stored the account id in a property called {@code id}.
     */
    record AccountOpened(String accountId) implements BankAccountEvent {
        public static final String VERSION = "2.0";

        @Override
        public String eventVersion() {
            return VERSION;
        }
    }

    record CustomerDepositedMoney(long amount, long balance) implements BankAccountEvent {
    }

    record CustomerWithdrewCash(long amount, long balance) implements BankAccountEvent {
    }

    record CustomerWroteCheck(String checkNumber, long amount, long balance) implements BankAccountEvent {
    }
}
