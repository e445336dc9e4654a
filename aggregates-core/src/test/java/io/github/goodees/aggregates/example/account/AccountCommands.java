package io.github.goodees.aggregates.example.account;

/*-
 * #%L
 * aggregates-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

/**
 * Commands of the bank account. Commands are not stored, so plain classes do.
 */
public final class AccountCommands {
    private AccountCommands() {
    }

    public abstract static class AccountCommand {
        private final String accountId;

        AccountCommand(String accountId) {
            this.accountId = accountId;
        }

        public String getAccountId() {
            return accountId;
        }
    }

    public static final class OpenAccount extends AccountCommand {
        private final String owner;

        public OpenAccount(String accountId, String owner) {
            super(accountId);
            this.owner = owner;
        }

        public String getOwner() {
            return owner;
        }
    }

    public static final class Deposit extends AccountCommand {
        private final long amount;

        public Deposit(String accountId, long amount) {
            super(accountId);
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }
    }

    public static final class Withdraw extends AccountCommand {
        private final long amount;

        public Withdraw(String accountId, long amount) {
            super(accountId);
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }
    }

    /**
     * Open the account and deposit the initial amount in one command.
     */
    public static final class OpenWithDeposit extends AccountCommand {
        private final String owner;
        private final long amount;

        public OpenWithDeposit(String accountId, String owner, long amount) {
            super(accountId);
            this.owner = owner;
            this.amount = amount;
        }

        public String getOwner() {
            return owner;
        }

        public long getAmount() {
            return amount;
        }
    }
}
