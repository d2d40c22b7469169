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

/**
 * External validators the bank account consults when handling commands. Implementations must not modify the account.
 */
public interface BankAccountServices {

    boolean isAtmWithdrawalAllowed(String atmId, long amount);

    boolean isCheckValid(String accountId, String checkNumber);

    static BankAccountServices allowAll() {
        return new BankAccountServices() {
            @Override
            public boolean isAtmWithdrawalAllowed(String atmId, long amount) {
                return true;
            }

            @Override
            public boolean isCheckValid(String accountId, String checkNumber) {
                return true;
            }
        };
    }
}
