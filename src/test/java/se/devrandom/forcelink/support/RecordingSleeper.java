/*
 * Forcelink - Salesforce API Integration Runtime
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.forcelink.support;

import se.devrandom.forcelink.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records requested sleeps instead of sleeping. When given a clock it moves that clock forward
 * by each requested duration.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private final MutableClock clock;
    private final FakeNanoTime nanoTime;

    public RecordingSleeper() {
        this(null, null);
    }

    public RecordingSleeper(MutableClock clock) {
        this(clock, null);
    }

    public RecordingSleeper(MutableClock clock, FakeNanoTime nanoTime) {
        this.clock = clock;
        this.nanoTime = nanoTime;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
        if (nanoTime != null) {
            nanoTime.advance(duration);
        }
    }

    public List<Duration> getSleeps() {
        synchronized (sleeps) {
            return new ArrayList<>(sleeps);
        }
    }

    public Duration total() {
        Duration total = Duration.ZERO;
        for (Duration sleep : getSleeps()) {
            total = total.plus(sleep);
        }
        return total;
    }
}
