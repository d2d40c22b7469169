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

import org.sequent.eventstore.api.EventEnvelope;
import org.sequent.example.bankaccount.BankAccountEvent;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerDepositedMoney;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWithdrewCash;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWroteCheck;

import java.util.ArrayList;
import java.util.List;

record AccountActivity(long balance, List<String> ledger) {
    static final AccountActivity EMPTY = new AccountActivity(0, List.of());

    static final View<AccountActivity, BankAccountEvent> VIEW = View.create(EMPTY, AccountActivity::update);

    static AccountActivity update(AccountActivity activity, EventEnvelope<BankAccountEvent> envelope) {
        BankAccountEvent event = envelope.payload();
        if (event instanceof CustomerDepositedMoney deposited) {
            return activity.record(deposited.balance(), "deposit " + deposited.amount());
        } else if (event instanceof CustomerWithdrewCash withdrew) {
            return activity.record(withdrew.balance(), "withdrawal " + withdrew.amount());
        } else if (event instanceof CustomerWroteCheck check) {
            return activity.record(check.balance(), "check " + check.checkNumber());
        }
        return activity;
    }

    private AccountActivity record(long newBalance, String entry) {
        List<String> newLedger = new ArrayList<>(ledger);
        newLedger.add(entry);
        return new AccountActivity(newBalance, List.copyOf(newLedger));
    }
}
