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

import org.sequent.domain.Aggregate;
import org.sequent.domain.error.UserErrorException;
import org.sequent.example.bankaccount.BankAccountCommand.DepositMoney;
import org.sequent.example.bankaccount.BankAccountCommand.OpenAccount;
import org.sequent.example.bankaccount.BankAccountCommand.WithdrawMoney;
import org.sequent.example.bankaccount.BankAccountCommand.WriteCheck;
import org.sequent.example.bankaccount.BankAccountEvent.AccountOpened;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerDepositedMoney;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWithdrewCash;
import org.sequent.example.bankaccount.BankAccountEvent.CustomerWroteCheck;

import java.util.List;
import java.util.Map;

public class BankAccount implements Aggregate<BankAccountCommand, BankAccountState, BankAccountEvent, BankAccountServices> {
    public static final String AGGREGATE_TYPE = "bank_account";

    @Override
    public String aggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public BankAccountState initialState() {
        return BankAccountState.EMPTY;
    }

    @Override
    public List<BankAccountEvent> handle(BankAccountCommand command, BankAccountState state, BankAccountServices services) {
        if (command instanceof OpenAccount open) {
            if (state.hasBeenOpened()) {
                throw new UserErrorException("account already open", Map.of("accountId", String.valueOf(state.accountId())));
            }
            return List.of(new AccountOpened(open.accountId()));
        } else if (command instanceof DepositMoney deposit) {
            return List.of(new CustomerDepositedMoney(deposit.amount(), state.balance() + deposit.amount()));
        } else if (command instanceof WithdrawMoney withdraw) {
            long balance = requireFunds(state, withdraw.amount());
            if (!services.isAtmWithdrawalAllowed(withdraw.atmId(), withdraw.amount())) {
                throw new UserErrorException("atm rule violation", Map.of("atmId", withdraw.atmId()));
            }
            return List.of(new CustomerWithdrewCash(withdraw.amount(), balance));
        } else if (command instanceof WriteCheck check) {
            long balance = requireFunds(state, check.amount());
            if (!services.isCheckValid(String.valueOf(state.accountId()), check.checkNumber())) {
                throw new UserErrorException("check invalid", Map.of("checkNumber", check.checkNumber()));
            }
            return List.of(new CustomerWroteCheck(check.checkNumber(), check.amount(), balance));
        }
        throw new IllegalArgumentException("Unsupported command: " + command.getClass().getName());
    }

    @Override
    public BankAccountState apply(BankAccountState state, BankAccountEvent event) {
        if (event instanceof AccountOpened opened) {
            return new BankAccountState(opened.accountId(), state.balance());
        } else if (event instanceof CustomerDepositedMoney deposited) {
            return state.withBalance(deposited.balance());
        } else if (event instanceof CustomerWithdrewCash withdrew) {
            return state.withBalance(withdrew.balance());
        } else if (event instanceof CustomerWroteCheck check) {
            return state.withBalance(check.balance());
        }
        throw new IllegalArgumentException("Unsupported event: " + event.getClass().getName());
    }

    private static long requireFunds(BankAccountState state, long amount) {
        long balance = state.balance() - amount;
        if (balance < 0) {
            throw new UserErrorException("funds not available", Map.of("balance", String.valueOf(state.balance())));
        }
        return balance;
    }
}
