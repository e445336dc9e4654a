package io.github.goodees.aggregates.store.jdbc;

/*-
 * #%L
 * aggregates-jdbc
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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class JdbcTestEvent {
    private final int amount;
    private final String note;

    @JsonCreator
    public JdbcTestEvent(@JsonProperty("amount") int amount, @JsonProperty("note") String note) {
        this.amount = amount;
        this.note = note;
    }

    public int getAmount() {
        return amount;
    }

    public String getNote() {
        return note;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof JdbcTestEvent)) {
            return false;
        }
        JdbcTestEvent other = (JdbcTestEvent) o;
        return amount == other.amount && Objects.equals(note, other.note);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, note);
    }

    @Override
    public String toString() {
        return "JdbcTestEvent[" + amount + ", " + note + "]";
    }
}
