package io.github.goodees.aggregates.serialization;

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

import io.github.goodees.aggregates.example.account.AccountSnapshot;
import io.github.goodees.aggregates.example.account.BankAccount;
import io.github.goodees.aggregates.example.account.ImmutableAccountSnapshot;
import io.github.goodees.aggregates.example.account.ImmutableMoneyDepositedEvent;
import io.github.goodees.aggregates.example.account.MoneyDepositedEvent;
import io.github.goodees.aggregates.store.EventType;
import org.junit.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JsonSerializationTest {
    private final JsonSerialization serialization = BankAccount.serialization();

    @Test
    public void type_names_strip_immutable_prefix_and_event_suffix() {
        assertEquals("MoneyDeposited", EventType.defaultTypeName(ImmutableMoneyDepositedEvent.class));
        assertEquals("MoneyDeposited", EventType.defaultTypeName(MoneyDepositedEvent.class));
        assertEquals("AccountSnapshot", EventType.defaultTypeName(AccountSnapshot.class));
        assertTrue(serialization.isRegistered("MoneyDeposited"));
        assertFalse(serialization.isRegistered("MoneyDepositedEvent"));
    }

    @Test
    public void immutable_values_survive_serialization() {
        MoneyDepositedEvent deposited = ImmutableMoneyDepositedEvent.builder().amount(42).build();
        String json = serialization.serialize(deposited);
        assertThat(json, containsString("\"amount\":42"));
        assertEquals(deposited, serialization.deserialize(json, "MoneyDeposited"));
    }

    @Test
    public void optional_attributes_are_supported() {
        AccountSnapshot empty = ImmutableAccountSnapshot.builder().balance(0).build();
        assertEquals(empty, serialization.deserialize(serialization.serialize(empty), "AccountSnapshot"));
        AccountSnapshot named = ImmutableAccountSnapshot.builder().owner("bob").balance(3).build();
        assertEquals(named, serialization.deserialize(serialization.serialize(named), "AccountSnapshot"));
    }

    @Test
    public void dates_are_written_as_iso_strings() {
        Map<String, Instant> payload = Collections.singletonMap("at", Instant.parse("2017-05-01T10:15:30Z"));
        assertThat(serialization.serialize(payload), containsString("2017-05-01T10:15:30Z"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknown_type_is_rejected() {
        serialization.deserialize("{}", "Unknown");
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformed_payload_is_rejected() {
        serialization.deserialize("{not json", "MoneyDeposited");
    }

    @Test(expected = IllegalArgumentException.class)
    public void type_name_cannot_be_taken_twice() {
        serialization.register("MoneyDeposited", AccountSnapshot.class);
    }

    @Test
    public void registering_same_type_again_is_harmless() {
        serialization.register(MoneyDepositedEvent.class);
        assertTrue(serialization.isRegistered("MoneyDeposited"));
    }
}
