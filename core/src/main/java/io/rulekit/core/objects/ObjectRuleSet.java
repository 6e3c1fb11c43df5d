package io.rulekit.core.objects;

import io.rulekit.core.error.RuleConfigurationException;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import io.rulekit.core.rules.ConstantRuleSet;
import io.rulekit.core.rules.ConstraintChain;
import io.rulekit.core.rules.Rule;
import io.rulekit.core.rules.RuleFunc;
import io.rulekit.core.rules.RuleSet;
import io.rulekit.core.rules.WrapAny;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule set for records: maps or beans described by a {@link BeanShape}.
 *
 * <p>
 * A schema is built by chaining {@code with*} calls, each of which returns a
 * new immutable instance:
 *
 * <pre>{@code
 * ObjectRuleSet<Map<String, Object>> person = ObjectRuleSet.map()
 *         .withKey("name", StringRuleSet.string().withRequired())
 *         .withKey("age", IntRuleSet.integer().withMin(0));
 * }</pre>
 *
 * <p>
 * Applying the schema evaluates every key rule in parallel on the context's
 * executor, then runs whole-record rules. See {@link ObjectEvaluator} for the
 * exact ordering guarantees. Construction errors such as circular conditional
 * keys are thrown as {@link RuleConfigurationException} subclasses; all
 * evaluation problems are returned as errors.
 *
 * <p>
 * An {@code ObjectRuleSet} is also a {@link Conditional}: used as the
 * condition of another key, it depends on the keys it declares.
 *
 * @param <T> the output record type
 */
public final class ObjectRuleSet<T> implements RuleSet<T>, Conditional<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectRuleSet.class);

    private final ObjectShape<T> shape;
    private final ConstraintChain<T> chain;
    private final boolean allowUnknown;
    private final boolean required;
    private final boolean json;
    private final ReferenceTracker refs;

    private ObjectRuleSet(
            ObjectShape<T> shape,
            ConstraintChain<T> chain,
            boolean allowUnknown,
            boolean required,
            boolean json,
            ReferenceTracker refs) {
        this.shape = shape;
        this.chain = chain;
        this.allowUnknown = allowUnknown;
        this.required = required;
        this.json = json;
        this.refs = refs;
    }

    /** A schema producing {@code LinkedHashMap} outputs. */
    public static ObjectRuleSet<Map<String, Object>> map() {
        return of(MapShape.INSTANCE);
    }

    /** A schema producing records of the given shape. */
    public static <T> ObjectRuleSet<T> of(ObjectShape<T> shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        return new ObjectRuleSet<>(
                shape, ConstraintChain.root("ObjectRuleSet[" + shape.typeName() + "]"), false, false, false, null);
    }

    private ObjectRuleSet<T> withChain(ConstraintChain<T> newChain, ReferenceTracker newRefs) {
        return new ObjectRuleSet<>(shape, newChain, allowUnknown, required, json, newRefs);
    }

    // ── Key rules ──

    public ObjectRuleSet<T> withKey(String key, RuleSet<?> ruleSet) {
        return withConditionalKey(key, null, ruleSet);
    }

    /**
     * Validates {@code key} with {@code ruleSet} only when {@code condition}
     * passes against the output record. The condition is evaluated after every
     * rule on the keys it {@linkplain Conditional#keyRules() depends on} has
     * finished.
     *
     * @throws io.rulekit.core.error.CircularReferenceException if the dependency
     *     closes a cycle
     * @throws io.rulekit.core.error.DynamicKeyConditionException if the condition
     *     depends on a dynamic key
     * @throws RuleConfigurationException if the output shape has no field
     *     {@code key}
     */
    public ObjectRuleSet<T> withConditionalKey(String key, Conditional<T> condition, RuleSet<?> ruleSet) {
        Objects.requireNonNull(key, "key must not be null");
        if (!shape.hasField(key)) {
            throw rejected(new RuleConfigurationException(
                    "missing mapping for key '" + key + "' in " + shape.typeName()));
        }
        return withEntry(ConstantRuleSet.of(key), condition, ruleSet);
    }

    /** Validates every input key accepted by {@code matcher} with {@code ruleSet}. */
    public ObjectRuleSet<T> withDynamicKey(Rule<String> matcher, RuleSet<?> ruleSet) {
        return withConditionalDynamicKey(matcher, null, ruleSet);
    }

    /**
     * Like {@link #withDynamicKey} with a condition. The condition may not
     * depend on any key, since dynamic keys cannot take part in dependency
     * ordering.
     *
     * @throws io.rulekit.core.error.DynamicKeyConditionException if the condition
     *     declares dependency keys
     */
    public ObjectRuleSet<T> withConditionalDynamicKey(
            Rule<String> matcher, Conditional<T> condition, RuleSet<?> ruleSet) {
        Objects.requireNonNull(matcher, "matcher must not be null");
        return withEntry(matcher, condition, ruleSet);
    }

    private ObjectRuleSet<T> withEntry(Rule<String> key, Conditional<T> condition, RuleSet<?> ruleSet) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        ReferenceTracker newRefs = refs;
        if (condition != null) {
            List<Rule<String>> dependencies = condition.keyRules();
            if (!dependencies.isEmpty()) {
                newRefs = refs == null ? new ReferenceTracker() : refs.copy();
                try {
                    for (Rule<String> dependency : dependencies) {
                        newRefs.add(key, dependency);
                    }
                } catch (RuleConfigurationException e) {
                    throw rejected(e);
                }
            }
        }
        return withChain(chain.withRule(new FieldRule<>(key, ruleSet, condition)), newRefs);
    }

    // ── Buckets ──

    /**
     * Routes every input key accepted by {@code matcher} into the map named
     * {@code bucket}. Keys also claimed by a dynamic key rule are written to
     * the bucket instead of the top level.
     */
    public ObjectRuleSet<T> withDynamicBucket(Rule<String> matcher, String bucket) {
        return withConditionalDynamicBucket(matcher, null, bucket);
    }

    public ObjectRuleSet<T> withConditionalDynamicBucket(Rule<String> matcher, Conditional<T> condition, String bucket) {
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(bucket, "bucket must not be null");
        if (!shape.hasBucket(bucket)) {
            throw rejected(new RuleConfigurationException(
                    "missing bucket '" + bucket + "' in " + shape.typeName()));
        }
        return withChain(chain.withRule(new BucketRule<>(matcher, condition, bucket)), refs);
    }

    // ── Whole-record rules ──

    /** Adds a rule evaluated against the assembled record after every key rule. */
    public ObjectRuleSet<T> withRule(Rule<T> rule) {
        return withChain(chain.withRule(rule), refs);
    }

    public ObjectRuleSet<T> withRuleFunc(RuleFunc<T> fn) {
        return withRule(Rule.of(fn));
    }

    // ── Flags ──

    /** Input keys matched by no rule are accepted; map outputs receive them verbatim. */
    public ObjectRuleSet<T> withUnknown() {
        if (allowUnknown) {
            return this;
        }
        return new ObjectRuleSet<>(shape, chain.withLabel("WithUnknown()"), true, required, json, refs);
    }

    public ObjectRuleSet<T> withRequired() {
        if (required) {
            return this;
        }
        return new ObjectRuleSet<>(shape, chain.withLabel("WithRequired()"), allowUnknown, true, json, refs);
    }

    /** String and {@code byte[]} inputs are decoded as JSON objects before validation. */
    public ObjectRuleSet<T> withJson() {
        if (json) {
            return this;
        }
        return new ObjectRuleSet<>(shape, chain.withLabel("WithJson()"), allowUnknown, required, true, refs);
    }

    // ── Queries ──

    @Override
    public boolean required() {
        return required;
    }

    /** Distinct key matchers that carry value rules, most recently added first. */
    @Override
    public List<Rule<String>> keyRules() {
        List<Rule<String>> keys = new ArrayList<>();
        for (Rule<T> rule : chain.rules()) {
            if (rule instanceof FieldRule<T> field && !keys.contains(field.key())) {
                keys.add(field.key());
            }
        }
        return Collections.unmodifiableList(keys);
    }

    /** Constant key names, most recently added first. */
    public List<String> keys() {
        List<String> names = new ArrayList<>();
        for (Rule<String> key : keyRules()) {
            if (key instanceof ConstantRuleSet<String> constant) {
                names.add(constant.value());
            }
        }
        return Collections.unmodifiableList(names);
    }

    ObjectShape<T> shape() {
        return shape;
    }

    ConstraintChain<T> chain() {
        return chain;
    }

    boolean allowsUnknown() {
        return allowUnknown;
    }

    boolean isJson() {
        return json;
    }

    // ── Evaluation ──

    @Override
    public ValidationErrorCollection apply(RuleContext ctx, Object input, OutputRef<T> output) {
        return ObjectEvaluator.apply(this, ctx, input, output);
    }

    /** Re-validates an existing record by applying this schema to it. */
    @Override
    public ValidationErrorCollection evaluate(RuleContext ctx, T value) {
        return apply(ctx, value, OutputRef.empty());
    }

    @Override
    public RuleSet<Object> any() {
        return WrapAny.of(this);
    }

    @Override
    public String describe() {
        return chain.describe();
    }

    @Override
    public String toString() {
        return describe();
    }

    private RuleConfigurationException rejected(RuleConfigurationException e) {
        LOG.atDebug()
                .setMessage("Rejected object rule set construction")
                .addKeyValue("rule_set", chain.describe())
                .addKeyValue("reason", e.getMessage())
                .log();
        return e;
    }
}
