/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.foldstream.retry;

import java.time.Duration;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * How long to wait between attempts
 */
public abstract class Backoff {

    private Backoff() {
    }

    public static Backoff none() {
        return None.INSTANCE;
    }

    public static Backoff fixed(long millis) {
        return new Fixed(millis);
    }

    public static Backoff fixed(Duration duration) {
        requireNonNull(duration, Duration.class.getSimpleName() + " cannot be null");
        return new Fixed(duration.toMillis());
    }

    public static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    /**
     * @param attempt The attempt that just failed, starting with 1
     * @return The time to wait before the next attempt
     */
    public abstract Duration delayAfter(int attempt);

    public static final class None extends Backoff {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public Duration delayAfter(int attempt) {
            return Duration.ZERO;
        }

        @Override
        public String toString() {
            return None.class.getSimpleName();
        }
    }

    public static final class Fixed extends Backoff {
        public final long millis;

        private Fixed(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("Millis cannot be negative");
            }
            this.millis = millis;
        }

        @Override
        public Duration delayAfter(int attempt) {
            return Duration.ofMillis(millis);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Fixed)) return false;
            Fixed fixed = (Fixed) o;
            return millis == fixed.millis;
        }

        @Override
        public int hashCode() {
            return Objects.hash(millis);
        }

        @Override
        public String toString() {
            return "Fixed{millis=" + millis + '}';
        }
    }

    public static final class Exponential extends Backoff {
        public final Duration initial;
        public final Duration max;
        public final double multiplier;

        private Exponential(Duration initial, Duration max, double multiplier) {
            requireNonNull(initial, "Initial duration cannot be null");
            requireNonNull(max, "Max duration cannot be null");
            if (multiplier < 1) {
                throw new IllegalArgumentException("Multiplier cannot be less than 1");
            }
            this.initial = initial;
            this.max = max;
            this.multiplier = multiplier;
        }

        @Override
        public Duration delayAfter(int attempt) {
            double millis = initial.toMillis() * Math.pow(multiplier, attempt - 1);
            return millis >= max.toMillis() ? max : Duration.ofMillis(Math.round(millis));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Exponential)) return false;
            Exponential that = (Exponential) o;
            return Double.compare(that.multiplier, multiplier) == 0 && Objects.equals(initial, that.initial) && Objects.equals(max, that.max);
        }

        @Override
        public int hashCode() {
            return Objects.hash(initial, max, multiplier);
        }

        @Override
        public String toString() {
            return "Exponential{initial=" + initial + ", max=" + max + ", multiplier=" + multiplier + '}';
        }
    }
}
