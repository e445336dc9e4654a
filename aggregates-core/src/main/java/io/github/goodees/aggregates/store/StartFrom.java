package io.github.goodees.aggregates.store;

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
 * Where a new durable subscription starts reading. Positions are event numbers for {@link EventStore#ALL_STREAMS}
 * and {@code streamVersion + 1} for a single stream, so position 0 is before the first event.
 */
public final class StartFrom {
    private static final long CURRENT_POSITION = -1;

    public static final StartFrom ORIGIN = new StartFrom(0);
    public static final StartFrom CURRENT = new StartFrom(CURRENT_POSITION);

    private final long position;

    private StartFrom(long position) {
        this.position = position;
    }

    /**
     * Start after given position, i.e. the first delivered event has position {@code position + 1}.
     * @param position last position that will not be delivered
     * @return start position
     */
    public static StartFrom after(long position) {
        if (position < 0) {
            throw new IllegalArgumentException("Position must not be negative: " + position);
        }
        return new StartFrom(position);
    }

    public boolean isCurrent() {
        return position == CURRENT_POSITION;
    }

    public long getPosition() {
        if (isCurrent()) {
            throw new IllegalStateException("Current position is resolved by the store");
        }
        return position;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StartFrom && ((StartFrom) o).position == position;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(position);
    }

    @Override
    public String toString() {
        return isCurrent() ? "current" : position == 0 ? "origin" : String.valueOf(position);
    }
}
