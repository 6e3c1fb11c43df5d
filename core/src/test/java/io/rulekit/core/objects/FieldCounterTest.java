package io.rulekit.core.objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.RuleContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FieldCounter and KnownFields")
class FieldCounterTest {

    @Nested
    @DisplayName("FieldCounter")
    class Counter {

        @Test
        @DisplayName("awaitSettled returns at once when nothing is outstanding")
        void settledWhenZero() {
            FieldCounter counter = new FieldCounter("a");

            counter.awaitSettled();

            assertThat(counter.count()).isZero();
        }

        @Test
        @DisplayName("a waiter wakes when the last evaluation finishes")
        void waiterWakesAtZero() throws InterruptedException {
            FieldCounter counter = new FieldCounter("a");
            counter.increment();
            counter.increment();
            AtomicBoolean settled = new AtomicBoolean();
            CountDownLatch done = new CountDownLatch(1);

            Thread waiter = new Thread(() -> {
                counter.awaitSettled();
                settled.set(true);
                done.countDown();
            });
            waiter.start();

            counter.lock();
            counter.unlock();
            assertThat(done.await(100, TimeUnit.MILLISECONDS)).isFalse();
            assertThat(settled).isFalse();

            counter.release();
            assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(settled).isTrue();
        }

        @Test
        @DisplayName("release does not wait for a running evaluation")
        void releaseDoesNotBlock() throws InterruptedException {
            FieldCounter counter = new FieldCounter("a");
            counter.increment();
            counter.increment();
            counter.lock();
            CountDownLatch released = new CountDownLatch(1);

            Thread other = new Thread(() -> {
                counter.release();
                released.countDown();
            });
            other.start();

            assertThat(released.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(counter.count()).isEqualTo(1);
            counter.unlock();
            assertThat(counter.count()).isZero();
        }

        @Test
        void negativeCountIsAnError() {
            FieldCounter counter = new FieldCounter("a");

            assertThatThrownBy(counter::release).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("FieldCounters skips keys without a counter")
        void countersSkipUnknownKeys() {
            FieldCounters counters = new FieldCounters();
            counters.increment("a");
            counters.release("a");

            counters.awaitSettled(List.of("a", "missing"));

            assertThat(counters.get("missing")).isNull();
        }
    }

    @Nested
    @DisplayName("KnownFields")
    class Known {

        private final Map<String, Object> raw = new LinkedHashMap<>();

        Known() {
            raw.put("a", 1);
            raw.put("b", 2);
            raw.put("c", 3);
        }

        @Test
        @DisplayName("unclaimed keys are unexpected, in input order")
        void reportsUnclaimedKeys() {
            KnownFields known = new KnownFields(true);
            known.add("b");

            ValidationErrorCollection errors =
                    known.check(RuleContext.background().withPath("root"), InputAccessors.ofMap(raw));

            assertThat(known.unknown(InputAccessors.ofMap(raw))).containsExactly("a", "c");
            assertThat(errors.asList()).extracting(e -> e.path()).containsExactly("/root/a", "/root/c");
            assertThat(errors.first().code()).isEqualTo(ErrorCode.UNEXPECTED);
        }

        @Test
        @DisplayName("an inactive tracker reports nothing")
        void inactiveTracksNothing() {
            KnownFields known = new KnownFields(false);
            known.add("a");

            assertThat(known.unknown(InputAccessors.ofMap(raw))).isEmpty();
            assertThat(known.check(RuleContext.background(), InputAccessors.ofMap(raw)).isEmpty()).isTrue();
        }
    }
}
