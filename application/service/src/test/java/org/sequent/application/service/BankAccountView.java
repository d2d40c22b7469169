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

package org.sequent.application.service;

import org.sequent.dsl.view.View;
import org.sequent.eventstore.api.EventEnvelope;
import org.sequent.example.bankaccount.BankAccountEvent;
import org.sequent.example.bankaccount.BankAccountEvent.AccountOpened;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerDepositedMoney;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWithdrewCash;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWroteCheck;

record BankAccountView(String accountId, long balance, int transactions) {
    static final BankAccountView EMPTY = new BankAccountView("", 0, 0);

    static final View<BankAccountView, BankAccountEvent> VIEW = View.create(EMPTY, BankAccountView::update);

    static BankAccountView update(BankAccountView view, EventEnvelope<BankAccountEvent> envelope) {
        BankAccountEvent event = envelope.payload();
        if (event instanceof AccountOpened opened) {
            return new BankAccountView(opened.accountId(), view.balance, view.transactions);
        } else if (event instanceof CustomerDepositedMoney deposited) {
            return new BankAccountView(view.accountId, deposited.balance(), view.transactions + 1);
        } else if (event instanceof CustomerWithdrewCash withdrew) {
            return new BankAccountView(view.accountId, withdrew.balance(), view.transactions + 1);
        } else if (event instanceof CustomerWroteCheck check) {
            return new BankAccountView(view.accountId, check.balance(), view.transactions + 1);
        }
        return view;
    }
}
