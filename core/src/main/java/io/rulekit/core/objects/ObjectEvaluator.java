package io.rulekit.core.objects;

import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import io.rulekit.core.rules.ConstantRuleSet;
import io.rulekit.core.rules.Rule;
import io.rulekit.core.rules.RuleSet;
import io.rulekit.core.rules.ValueKinds;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One apply of an {@link ObjectRuleSet}: owns the output record, the output
 * lock, the per-key counters and the error queue for that call.
 *
 * <p>
 * Evaluation proceeds in three stages:
 * <ol>
 * <li>One task per (key rule, matching key) pair, all started concurrently.
 * Tasks for the same key run one at a time. A conditional task first waits
 * until every rule on the keys its condition reads has finished.</li>
 * <li>Unclaimed keys are routed into buckets, reported as unexpected, or
 * copied into map outputs.</li>
 * <li>Whole-record rules run concurrently against the assembled record.</li>
 * </ol>
 * All reads and writes of the output record happen under a single lock.
 * Cancellation is cooperative: started tasks run to completion, tasks not yet
 * started are skipped, and exactly one {@code TIMEOUT} or {@code CANCELLED}
 * error is appended.
 *
 * @param <T> the output record type
 */
final class ObjectEvaluator<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectEvaluator.class);

    private final ObjectRuleSet<T> ruleSet;
    private final RuleContext ctx;
    private final InputAccessor input;
    private final T out;
    private final Setter setter;
    private final ReentrantLock outputLock = new ReentrantLock();
    private final FieldCounters counters = new FieldCounters();
    private final Queue<ValidationErrorCollection> taskErrors = new ConcurrentLinkedQueue<>();
    private final List<FieldTask<T>> fieldTasks = new ArrayList<>();
    private final List<BucketRule<T>> buckets = new ArrayList<>();
    private final List<Rule<T>> recordRules = new ArrayList<>();
    private final KnownFields knownFields;

    private ObjectEvaluator(ObjectRuleSet<T> ruleSet, RuleContext ctx, InputAccessor input, T out) {
        this.ruleSet = ruleSet;
        this.ctx = ctx;
        this.input = input;
        this.out = out;
        this.setter = ruleSet.shape().setter(out);

        List<FieldRule<T>> fieldRules = new ArrayList<>();
        for (Rule<T> rule : ruleSet.chain().rules()) {
            if (rule instanceof FieldRule<T> field) {
                fieldRules.add(field);
            } else if (rule instanceof BucketRule<T> bucket) {
                buckets.add(bucket);
            } else {
                recordRules.add(rule);
            }
        }

        boolean outputIsMap = ruleSet.shape().isMapShaped();
        this.knownFields = new KnownFields(
                (!ruleSet.allowsUnknown() || outputIsMap || !buckets.isEmpty()) && input.isMapShaped());

        for (FieldRule<T> field : fieldRules) {
            String constant = field.constantKey();
            if (constant != null) {
                fieldTasks.add(new FieldTask<>(field, constant, List.of()));
            } else if (input.isMapShaped()) {
                for (String key : input.keys()) {
                    if (field.matches(ctx, key)) {
                        fieldTasks.add(new FieldTask<>(field, key, buckets));
                    }
                }
            }
        }
    }

    /**
     * Applies {@code ruleSet} to {@code value}. The output is written back to
     * {@code output} only when no error was produced.
     */
    static <T> ValidationErrorCollection apply(
            ObjectRuleSet<T> ruleSet, RuleContext ctx, Object value, OutputRef<T> output) {
        if (output == null) {
            return ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.INTERNAL, ctx, "output must not be null"));
        }
        Optional<InputAccessor> input = InputAccessors.resolve(value, ruleSet.shape(), ruleSet.isJson());
        if (input.isEmpty()) {
            String expected = ruleSet.isJson() && InputAccessors.isJsonCandidate(value)
                    ? "object, map, or JSON string"
                    : "object or map";
            return ValidationErrorCollection.of(ValidationError.of(ErrorCode.TYPE, ctx, expected, ValueKinds.of(value)));
        }

        T out = output.get() != null ? output.get() : ruleSet.shape().newInstance();
        ValidationErrorCollection errors = new ObjectEvaluator<>(ruleSet, ctx, input.get(), out).run();
        if (errors.isEmpty()) {
            output.set(out);
        }
        return errors;
    }

    private ValidationErrorCollection run() {
        for (FieldTask<T> task : fieldTasks) {
            counters.increment(task.key());
        }
        dispatchFieldTasks();
        sweepBuckets();

        ValidationErrorCollection errors = ValidationErrorCollection.empty();
        if (!ruleSet.allowsUnknown()) {
            errors = knownFields.check(ctx, input);
        } else if (setter.isMapShaped()) {
            for (String key : knownFields.unknown(input)) {
                write(ctx.withPath(key), () -> setter.set(key, input.get(key)));
            }
        }

        runRecordRules();

        for (ValidationErrorCollection taskError : taskErrors) {
            errors = errors.concat(taskError);
        }
        // nested rule sets report their own termination errors; keep one, here
        return errors.settle(ctx);
    }

    // ── Stage 1: key rules ──

    private void dispatchFieldTasks() {
        List<CompletableFuture<Void>> futures = new ArrayList<>(fieldTasks.size());
        int skipped = 0;
        for (FieldTask<T> task : fieldTasks) {
            knownFields.add(task.key());
            if (ctx.isDone()) {
                counters.release(task.key());
                skipped++;
                continue;
            }
            try {
                futures.add(CompletableFuture.runAsync(() -> runFieldTask(task), ctx.executor()));
            } catch (RejectedExecutionException e) {
                counters.release(task.key());
                taskErrors.add(ValidationErrorCollection.of(ValidationError.withMessage(
                        ErrorCode.INTERNAL, ctx.withPath(task.key()), "rule task rejected: %s", e.getMessage())));
            }
        }
        if (skipped > 0) {
            LOG.atDebug()
                    .setMessage("Stopped dispatching key rules")
                    .addKeyValue("context", ctx)
                    .addKeyValue("skipped", skipped)
                    .addKeyValue("cancelled", ctx.isCancelled())
                    .log();
        }
        join(futures);
    }

    private void runFieldTask(FieldTask<T> task) {
        RuleContext fieldCtx = ctx.withPath(task.key());
        FieldCounter counter = counters.get(task.key());
        counter.lock();
        try {
            evaluateField(task, fieldCtx);
        } catch (RuntimeException e) {
            LOG.warn("Key rule failed unexpectedly: key={}", task.key(), e);
            taskErrors.add(ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.INTERNAL, fieldCtx, "rule failed: %s", e.getMessage())));
        } finally {
            counter.unlock();
        }
    }

    private void evaluateField(FieldTask<T> task, RuleContext fieldCtx) {
        if (ctx.isDone()) {
            return;
        }
        FieldRule<T> field = task.rule();

        Conditional<T> condition = field.condition();
        if (condition != null) {
            counters.awaitSettled(constantKeys(condition.keyRules()));
            boolean passed;
            outputLock.lock();
            try {
                passed = condition.evaluate(fieldCtx, out).isEmpty();
            } finally {
                outputLock.unlock();
            }
            if (!passed) {
                return;
            }
        }

        if (!input.contains(task.key())) {
            if (field.valueRuleSet().required()) {
                taskErrors.add(ValidationErrorCollection.of(ValidationError.of(ErrorCode.REQUIRED, fieldCtx)));
            }
            return;
        }

        Applied applied = applyValue(field.valueRuleSet(), fieldCtx, input.get(task.key()));
        if (!applied.errors().isEmpty()) {
            taskErrors.add(applied.errors());
            return;
        }

        write(fieldCtx, () -> {
            boolean bucketed = false;
            for (BucketRule<T> bucket : task.buckets()) {
                if (bucket.accepts(fieldCtx, task.key(), out)) {
                    setter.setInBucket(bucket.bucket(), task.key(), applied.value());
                    bucketed = true;
                }
            }
            if (!bucketed) {
                setter.set(task.key(), applied.value());
            }
        });
    }

    private static <V> Applied applyValue(RuleSet<V> valueRuleSet, RuleContext ctx, Object value) {
        OutputRef<V> ref = OutputRef.empty();
        ValidationErrorCollection errors = valueRuleSet.apply(ctx, value, ref);
        return new Applied(ref.get(), errors == null ? ValidationErrorCollection.empty() : errors);
    }

    private static List<String> constantKeys(List<Rule<String>> keyRules) {
        List<String> keys = new ArrayList<>(keyRules.size());
        for (Rule<String> key : keyRules) {
            if (key instanceof ConstantRuleSet<String> constant) {
                keys.add(constant.value());
            }
        }
        return keys;
    }

    // ── Stage 2: unclaimed keys ──

    private void sweepBuckets() {
        if (buckets.isEmpty()) {
            return;
        }
        for (String key : knownFields.unknown(input)) {
            RuleContext keyCtx = ctx.withPath(key);
            for (BucketRule<T> bucket : buckets) {
                outputLock.lock();
                try {
                    if (bucket.accepts(keyCtx, key, out)) {
                        knownFields.add(key);
                        write(keyCtx, () -> setter.setInBucket(bucket.bucket(), key, input.get(key)));
                    }
                } finally {
                    outputLock.unlock();
                }
            }
        }
    }

    // ── Stage 3: whole-record rules ──

    private void runRecordRules() {
        if (recordRules.isEmpty() || ctx.isDone()) {
            return;
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(recordRules.size());
        for (Rule<T> rule : recordRules) {
            try {
                futures.add(CompletableFuture.runAsync(() -> runRecordRule(rule), ctx.executor()));
            } catch (RejectedExecutionException e) {
                taskErrors.add(ValidationErrorCollection.of(ValidationError.withMessage(
                        ErrorCode.INTERNAL, ctx, "rule task rejected: %s", e.getMessage())));
            }
        }
        join(futures);
    }

    private void runRecordRule(Rule<T> rule) {
        outputLock.lock();
        try {
            if (ctx.isDone()) {
                return;
            }
            ValidationErrorCollection errors = rule.evaluate(ctx, out);
            if (errors != null && !errors.isEmpty()) {
                taskErrors.add(errors);
            }
        } catch (RuntimeException e) {
            LOG.warn("Record rule failed unexpectedly: rule={}", rule.describe(), e);
            taskErrors.add(ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.INTERNAL, ctx, "rule failed: %s", e.getMessage())));
        } finally {
            outputLock.unlock();
        }
    }

    // ── Helpers ──

    /** Runs {@code write} under the output lock; rejected assignments become {@code INTERNAL} errors. */
    private void write(RuleContext at, Runnable write) {
        outputLock.lock();
        try {
            write.run();
        } catch (ClassCastException | IllegalStateException | UnsupportedOperationException e) {
            taskErrors.add(ValidationErrorCollection.of(
                    ValidationError.withMessage(ErrorCode.INTERNAL, at, "cannot assign value: %s", e.getMessage())));
        } finally {
            outputLock.unlock();
        }
    }

    private static void join(List<CompletableFuture<Void>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    }

    private record FieldTask<T>(FieldRule<T> rule, String key, List<BucketRule<T>> buckets) {}

    private record Applied(Object value, ValidationErrorCollection errors) {}
}
