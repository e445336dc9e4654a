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

import java.util.Objects;

public final class BankAccountState {
    private final String accountId;
    private final String owner;
    private final long balance;

    BankAccountState(String accountId, String owner, long balance) {
        this.accountId = accountId;
        this.owner = owner;
        this.balance = balance;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getOwner() {
        return owner;
    }

    public boolean isOpened() {
        return owner != null;
    }

    public long getBalance() {
        return balance;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BankAccountState)) {
            return false;
        }
        BankAccountState other = (BankAccountState) o;
        return accountId.equals(other.accountId) && Objects.equals(owner, other.owner) && balance == other.balance;
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, owner, balance);
    }

    @Override
    public String toString() {
        return "BankAccountState[" + accountId + ", owner=" + owner + ", balance=" + balance + "]";
    }
}
