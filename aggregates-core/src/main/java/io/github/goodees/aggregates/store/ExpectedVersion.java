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
 * Optimistic concurrency guard of an append. Stream versions are counted in events, so {@code exactly(n)} means that
 * the stream holds exactly {@code n} events before the append. A missing stream holds zero events.
 */
public final class ExpectedVersion {
    private static final long ANY = -1;
    private static final long NONE = -2;
    private static final long EXISTS = -3;

    public static final ExpectedVersion ANY_VERSION = new ExpectedVersion(ANY);
    public static final ExpectedVersion NO_STREAM = new ExpectedVersion(NONE);
    public static final ExpectedVersion STREAM_EXISTS = new ExpectedVersion(EXISTS);

    private final long value;

    private ExpectedVersion(long value) {
        this.value = value;
    }

    public static ExpectedVersion exactly(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Version must not be negative: " + version);
        }
        return new ExpectedVersion(version);
    }

    /**
     * Check the guard against current stream length.
     * @param currentVersion number of events in the stream, 0 when the stream does not exist
     * @return true if the append may proceed
     */
    public boolean matches(long currentVersion) {
        if (value == ANY) {
            return true;
        } else if (value == NONE) {
            return currentVersion == 0;
        } else if (value == EXISTS) {
            return currentVersion > 0;
        } else {
            return currentVersion == value;
        }
    }

    public boolean isExact() {
        return value >= 0;
    }

    public long getVersion() {
        if (!isExact()) {
            throw new IllegalStateException(this + " does not name a version");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpectedVersion && ((ExpectedVersion) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        if (value == ANY) {
            return "any_version";
        } else if (value == NONE) {
            return "no_stream";
        } else if (value == EXISTS) {
            return "stream_exists";
        } else {
            return String.valueOf(value);
        }
    }
}
