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

import org.jspecify.annotations.Nullable;

public record BankAccountState(@Nullable String accountId, long balance) {
    public static final BankAccountState EMPTY = new BankAccountState(null, 0);

    public boolean hasBeenOpened() {
        return accountId != null;
    }

    BankAccountState withBalance(long balance) {
        return new BankAccountState(accountId, balance);
    }
}
