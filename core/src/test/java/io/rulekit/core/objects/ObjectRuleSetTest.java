package io.rulekit.core.objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rulekit.core.error.CircularReferenceException;
import io.rulekit.core.error.DynamicKeyConditionException;
import io.rulekit.core.error.ErrorCode;
import io.rulekit.core.error.RuleConfigurationException;
import io.rulekit.core.error.ValidationError;
import io.rulekit.core.error.ValidationErrorCollection;
import io.rulekit.core.model.CancellationToken;
import io.rulekit.core.model.OutputRef;
import io.rulekit.core.model.RuleContext;
import io.rulekit.core.rules.AnyRuleSet;
import io.rulekit.core.rules.ConstantRuleSet;
import io.rulekit.core.rules.IntRuleSet;
import io.rulekit.core.rules.Rule;
import io.rulekit.core.rules.StringRuleSet;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ObjectRuleSet")
class ObjectRuleSetTest {

    private static <T> ValidationErrorCollection apply(ObjectRuleSet<T> ruleSet, Object input, OutputRef<T> out) {
        return ruleSet.apply(RuleContext.background(), input, out);
    }

    private static Map<String, Object> mapOf(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static StringRuleSet prefix(String prefix) {
        return StringRuleSet.string().withRegex("^" + prefix, "must start with " + prefix);
    }

    /** A condition on the output record that declares one dependency key. */
    private static Conditional<Map<String, Object>> condition(
            String dependsOn, Predicate<Map<String, Object>> test, Runnable onEvaluate) {
        return new Conditional<>() {
            @Override
            public List<Rule<String>> keyRules() {
                return List.of(ConstantRuleSet.of(dependsOn));
            }

            @Override
            public ValidationErrorCollection evaluate(RuleContext ctx, Map<String, Object> value) {
                onEvaluate.run();
                return test.test(value)
                        ? ValidationErrorCollection.empty()
                        : ValidationErrorCollection.of(ValidationError.of(ErrorCode.PATTERN, ctx));
            }

            @Override
            public String describe() {
                return "Condition(" + dependsOn + ")";
            }
        };
    }

    private static Conditional<Map<String, Object>> dependsOn(String key) {
        return condition(key, value -> true, () -> {});
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("describe lists constraints in the order they were added")
        void describe() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("A", IntRuleSet.integer().withMin(2))
                    .withRequired()
                    .withDynamicBucket(prefix("x-"), "extras");

            assertThat(rs.describe())
                    .isEqualTo("ObjectRuleSet[Map].WithKey(\"A\", IntRuleSet.WithMin(2)).WithRequired()"
                            + ".WithDynamicBucket(StringRuleSet.WithRegex(^x-), \"extras\")");
        }

        @Test
        @DisplayName("flag builders return the same instance when already set")
        void flagsAreIdempotent() {
            ObjectRuleSet<Map<String, Object>> required = ObjectRuleSet.map().withRequired();

            assertThat(required.withRequired()).isSameAs(required);
            assertThat(required.required()).isTrue();
            assertThat(ObjectRuleSet.map().withUnknown().withUnknown().describe())
                    .isEqualTo("ObjectRuleSet[Map].WithUnknown()");
        }

        @Test
        @DisplayName("keyRules lists each key matcher once")
        void keyRules() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("a", AnyRuleSet.anything())
                    .withKey("b", AnyRuleSet.anything())
                    .withKey("a", IntRuleSet.integer());

            assertThat(rs.keys()).containsExactly("a", "b");
            assertThat(rs.keyRules()).hasSize(2);
        }

        @Test
        @DisplayName("a direct conditional cycle is rejected")
        void directCycle() {
            ObjectRuleSet<Map<String, Object>> rs =
                    ObjectRuleSet.map().withConditionalKey("A", dependsOn("B"), AnyRuleSet.anything());

            assertThatThrownBy(() -> rs.withConditionalKey("B", dependsOn("A"), AnyRuleSet.anything()))
                    .isInstanceOf(CircularReferenceException.class);
        }

        @Test
        @DisplayName("an indirect conditional cycle is rejected and a diamond is not")
        void indirectCycleAndDiamond() {
            ObjectRuleSet<Map<String, Object>> chain = ObjectRuleSet.map()
                    .withConditionalKey("A", dependsOn("B"), AnyRuleSet.anything())
                    .withConditionalKey("B", dependsOn("C"), AnyRuleSet.anything());

            assertThatThrownBy(() -> chain.withConditionalKey("C", dependsOn("A"), AnyRuleSet.anything()))
                    .isInstanceOf(CircularReferenceException.class);
            assertThatCode(() -> chain.withConditionalKey("A", dependsOn("D"), AnyRuleSet.anything())
                            .withConditionalKey("C", dependsOn("D"), AnyRuleSet.anything()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("sibling schemas do not share dependency state")
        void siblingsAreIndependent() {
            ObjectRuleSet<Map<String, Object>> base = ObjectRuleSet.map();

            base.withConditionalKey("A", dependsOn("B"), AnyRuleSet.anything());

            assertThatCode(() -> base.withConditionalKey("B", dependsOn("A"), AnyRuleSet.anything()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("a conditional dynamic key may not depend on other keys")
        void conditionalDynamicKey() {
            assertThatThrownBy(() -> ObjectRuleSet.map()
                            .withConditionalDynamicKey(prefix("x-"), dependsOn("A"), AnyRuleSet.anything()))
                    .isInstanceOf(DynamicKeyConditionException.class);

            Conditional<Map<String, Object>> independent = ObjectRuleSet.map().withUnknown();
            assertThatCode(() -> ObjectRuleSet.map()
                            .withConditionalDynamicKey(prefix("x-"), independent, AnyRuleSet.anything()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("bean schemas reject undeclared keys and buckets")
        void beanSchemaRejectsUndeclared() {
            assertThatThrownBy(() -> ObjectRuleSet.of(Person.SHAPE).withKey("height", AnyRuleSet.anything()))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("height");
            assertThatThrownBy(() -> ObjectRuleSet.of(Person.SHAPE).withDynamicBucket(prefix("x"), "name"))
                    .isInstanceOf(RuleConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("key rules")
    class KeyRules {

        @Test
        @DisplayName("a missing required key yields exactly one REQUIRED error")
        void missingRequiredKey() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("A", IntRuleSet.integer().withMin(2))
                    .withKey("B", StringRuleSet.string().withRequired());
            OutputRef<Map<String, Object>> out = OutputRef.empty();

            ValidationErrorCollection errors = apply(rs, mapOf("A", 5), out);

            assertThat(errors.size()).isEqualTo(1);
            assertThat(errors.first().code()).isEqualTo(ErrorCode.REQUIRED);
            assertThat(errors.first().path()).isEqualTo("/B");
            assertThat(out.isPresent()).isFalse();
        }

        @Test
        @DisplayName("valid input produces coerced output")
        void coercesValues() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("age", IntRuleSet.integer())
                    .withKey("name", StringRuleSet.string())
                    .withKey("nickname", StringRuleSet.string());

            Map<String, Object> result = rs.validate(mapOf("age", "42", "name", 7));

            assertThat(result).isEqualTo(Map.of("age", 42, "name", "7"));
        }

        @Test
        @DisplayName("every failing key is reported, not just the first")
        void reportsEveryKey() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("a", IntRuleSet.integer().withMin(10))
                    .withKey("b", IntRuleSet.integer().withMin(10))
                    .withKey("c", IntRuleSet.integer().withMin(10));

            ValidationErrorCollection errors = apply(rs, mapOf("a", 1, "b", 2, "c", 30), OutputRef.empty());

            assertThat(errors.asList()).extracting(ValidationError::path).containsExactlyInAnyOrder("/a", "/b");
        }

        @Test
        @DisplayName("unknown keys are unexpected unless allowed")
        void unknownKeys() {
            ObjectRuleSet<Map<String, Object>> strict = ObjectRuleSet.map().withKey("a", AnyRuleSet.anything());

            ValidationErrorCollection errors = apply(strict, mapOf("a", 1, "zzz", 2), OutputRef.empty());
            Map<String, Object> lenient = strict.withUnknown().validate(mapOf("a", 1, "zzz", 2));

            assertThat(errors.size()).isEqualTo(1);
            assertThat(errors.first().code()).isEqualTo(ErrorCode.UNEXPECTED);
            assertThat(errors.first().path()).isEqualTo("/zzz");
            assertThat(lenient).containsEntry("zzz", 2);
        }

        @Test
        @DisplayName("nested object errors carry the full path")
        void nestedPaths() {
            ObjectRuleSet<Map<String, Object>> address =
                    ObjectRuleSet.map().withKey("zip", StringRuleSet.string().withStrict());
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map().withKey("address", address);

            ValidationErrorCollection errors = apply(rs, mapOf("address", mapOf("zip", 12345)), OutputRef.empty());

            assertThat(errors.first().code()).isEqualTo(ErrorCode.TYPE);
            assertThat(errors.first().path()).isEqualTo("/address/zip");
        }

        @Test
        @DisplayName("rules on the same key never overlap")
        void sameKeyRulesAreSerialized() {
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            AnyRuleSet tracked = AnyRuleSet.anything().withRuleFunc((ctx, value) -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                pause(50);
                active.decrementAndGet();
                return ValidationErrorCollection.empty();
            });
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withDynamicKey(prefix("k"), tracked)
                    .withDynamicKey(prefix("k"), tracked)
                    .withKey("k1", tracked);

            ValidationErrorCollection errors = apply(rs, mapOf("k1", 1), OutputRef.empty());

            assertThat(errors.isEmpty()).isTrue();
            assertThat(maxActive.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("an existing output record is filled in place")
        void reusesExistingOutput() {
            Map<String, Object> existing = mapOf("kept", true);
            OutputRef<Map<String, Object>> out = OutputRef.of(existing);

            apply(ObjectRuleSet.map().withKey("a", AnyRuleSet.anything()), mapOf("a", 1), out);

            assertThat(out.get()).isSameAs(existing);
            assertThat(existing).containsEntry("kept", true).containsEntry("a", 1);
        }
    }

    @Nested
    @DisplayName("conditional keys")
    class ConditionalKeys {

        @ParameterizedTest(name = "X = {0}")
        @ValueSource(ints = {20, 1})
        @DisplayName("a conditional key sees its dependency fully evaluated")
        void conditionWaitsForDependency(int x) {
            AtomicBoolean xFinished = new AtomicBoolean();
            AtomicBoolean conditionSawX = new AtomicBoolean();
            AtomicBoolean yRan = new AtomicBoolean();
            IntRuleSet slowX = IntRuleSet.integer().withRuleFunc((ctx, value) -> {
                pause(100);
                xFinished.set(true);
                return ValidationErrorCollection.empty();
            });
            StringRuleSet y = StringRuleSet.string().withRuleFunc((ctx, value) -> {
                yRan.set(true);
                return ValidationErrorCollection.empty();
            });
            Conditional<Map<String, Object>> xAtLeastTen = condition(
                    "X",
                    record -> record.get("X") instanceof Integer i && i >= 10,
                    () -> conditionSawX.set(xFinished.get()));

            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withConditionalKey("Y", xAtLeastTen, y)
                    .withKey("X", slowX);
            OutputRef<Map<String, Object>> out = OutputRef.empty();

            ValidationErrorCollection errors = apply(rs, mapOf("X", x, "Y", "why"), out);

            assertThat(errors.isEmpty()).isTrue();
            assertThat(conditionSawX).isTrue();
            assertThat(yRan.get()).isEqualTo(x >= 10);
            assertThat(out.get().containsKey("Y")).isEqualTo(x >= 10);
        }

        @Test
        @DisplayName("an object rule set works as a condition")
        void objectRuleSetAsCondition() {
            ObjectRuleSet<Map<String, Object>> isBusiness =
                    ObjectRuleSet.map().withUnknown().withKey("type", ConstantRuleSet.of("business"));
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("type", StringRuleSet.string())
                    .withConditionalKey("vat", isBusiness, StringRuleSet.string().withRequired());

            ValidationErrorCollection business = apply(rs, mapOf("type", "business"), OutputRef.empty());
            ValidationErrorCollection personal = apply(rs, mapOf("type", "personal"), OutputRef.empty());

            assertThat(business.size()).isEqualTo(1);
            assertThat(business.first().code()).isEqualTo(ErrorCode.REQUIRED);
            assertThat(business.first().path()).isEqualTo("/vat");
            assertThat(personal.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("buckets")
    class Buckets {

        @Test
        @DisplayName("matching keys fan out into their buckets and the rest is unexpected")
        void fanOut() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("name", StringRuleSet.string())
                    .withDynamicBucket(prefix("a-"), "alpha")
                    .withDynamicBucket(prefix("b-"), "beta");
            OutputRef<Map<String, Object>> out = OutputRef.empty();

            ValidationErrorCollection clean = apply(rs, mapOf("name", "n", "a-1", 1, "b-1", 2, "a-2", 3), out);
            ValidationErrorCollection stray = apply(rs, mapOf("name", "n", "a-1", 1, "zzz", 9), OutputRef.empty());

            assertThat(clean.isEmpty()).isTrue();
            assertThat(out.get().get("alpha")).isEqualTo(Map.of("a-1", 1, "a-2", 3));
            assertThat(out.get().get("beta")).isEqualTo(Map.of("b-1", 2));
            assertThat(out.get()).doesNotContainKeys("a-1", "b-1");
            assertThat(stray.size()).isEqualTo(1);
            assertThat(stray.first().code()).isEqualTo(ErrorCode.UNEXPECTED);
            assertThat(stray.first().path()).isEqualTo("/zzz");
        }

        @Test
        @DisplayName("validated dynamic keys are written to the bucket instead of the top level")
        void dynamicKeyIntoBucket() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withDynamicKey(prefix("x-"), IntRuleSet.integer())
                    .withDynamicBucket(prefix("x-"), "ext");

            Map<String, Object> result = rs.validate(mapOf("x-a", "5"));

            assertThat(result).isEqualTo(Map.of("ext", Map.of("x-a", 5)));
        }

        @Test
        @DisplayName("a conditional bucket only receives keys while its condition holds")
        void conditionalBucket() {
            ObjectRuleSet<Map<String, Object>> hasMode =
                    ObjectRuleSet.map().withUnknown().withKey("mode", ConstantRuleSet.of("debug"));
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("mode", StringRuleSet.string())
                    .withConditionalDynamicBucket(prefix("dbg-"), hasMode, "debug");

            ValidationErrorCollection debug = apply(rs, mapOf("mode", "debug", "dbg-1", 1), OutputRef.empty());
            ValidationErrorCollection normal = apply(rs, mapOf("mode", "normal", "dbg-1", 1), OutputRef.empty());

            assertThat(debug.isEmpty()).isTrue();
            assertThat(normal.first().code()).isEqualTo(ErrorCode.UNEXPECTED);
        }

        @Test
        @DisplayName("bean outputs receive bucketed keys through the bucket property")
        void beanBucket() {
            ObjectRuleSet<Person> rs = ObjectRuleSet.of(Person.SHAPE)
                    .withKey("name", StringRuleSet.string())
                    .withUnknown()
                    .withDynamicBucket(prefix("x-"), "extras");

            Person person = rs.validate(mapOf("name", "Ada", "x-lang", "en", "other", 1));

            assertThat(person.getName()).isEqualTo("Ada");
            assertThat(person.getExtras()).isEqualTo(Map.of("x-lang", "en"));
        }
    }

    @Nested
    @DisplayName("whole-record rules")
    class RecordRules {

        @Test
        @DisplayName("record rules see the assembled record")
        void seesAssembledRecord() {
            ObjectRuleSet<Map<String, Object>> range = ObjectRuleSet.map()
                    .withKey("min", IntRuleSet.integer())
                    .withKey("max", IntRuleSet.integer())
                    .withRuleFunc((ctx, record) -> (Integer) record.get("min") <= (Integer) record.get("max")
                            ? ValidationErrorCollection.empty()
                            : ValidationErrorCollection.of(
                                    ValidationError.withMessage(ErrorCode.RANGE, ctx, "min must not exceed max")));

            ValidationErrorCollection errors = apply(range, mapOf("min", "9", "max", 3), OutputRef.empty());

            assertThat(errors.size()).isEqualTo(1);
            assertThat(errors.first().message()).isEqualTo("min must not exceed max");
            assertThat(errors.first().path()).isEmpty();
            assertThat(apply(range, mapOf("min", 1, "max", 3), OutputRef.empty()).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("an exception in a record rule becomes an INTERNAL error")
        void throwingRule() {
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map().withUnknown().withRuleFunc((ctx, record) -> {
                throw new IllegalArgumentException("boom");
            });

            ValidationErrorCollection errors = apply(rs, mapOf(), OutputRef.empty());

            assertThat(errors.first().code()).isEqualTo(ErrorCode.INTERNAL);
            assertThat(errors.first().message()).contains("boom");
        }
    }

    @Nested
    @DisplayName("inputs and outputs")
    class InputsAndOutputs {

        @Test
        void scalarInputIsATypeError() {
            ValidationErrorCollection errors = apply(ObjectRuleSet.map(), 5, OutputRef.empty());

            assertThat(errors.first().code()).isEqualTo(ErrorCode.TYPE);
            assertThat(errors.first().message()).isEqualTo("expected object or map but got int");
        }

        @Test
        @DisplayName("JSON input is decoded when enabled")
        void jsonInput() {
            ObjectRuleSet<Map<String, Object>> rs =
                    ObjectRuleSet.map().withJson().withKey("a", IntRuleSet.integer());

            assertThat(rs.validate("{\"a\": 3}")).isEqualTo(Map.of("a", 3));
            assertThat(apply(rs, "{oops", OutputRef.empty()).first().message())
                    .isEqualTo("expected object, map, or JSON string but got string");
            assertThat(apply(ObjectRuleSet.map(), "{}", OutputRef.empty()).first().message())
                    .isEqualTo("expected object or map but got string");
        }

        @Test
        void nullOutputRefIsInternal() {
            assertThat(apply(ObjectRuleSet.map(), mapOf(), null).first().code()).isEqualTo(ErrorCode.INTERNAL);
        }

        @Test
        @DisplayName("bean outputs are populated from map input")
        void beanOutput() {
            ObjectRuleSet<Person> rs = ObjectRuleSet.of(Person.SHAPE)
                    .withKey("name", StringRuleSet.string().withRequired())
                    .withKey("age", IntRuleSet.integer().withMin(0));

            Person person = rs.validate(mapOf("name", "Ada", "age", "36"));

            assertThat(person.getName()).isEqualTo("Ada");
            assertThat(person.getAge()).isEqualTo(36);
        }

        @Test
        @DisplayName("a bean can be re-validated through evaluate")
        void beanEvaluate() {
            ObjectRuleSet<Person> rs = ObjectRuleSet.of(Person.SHAPE).withKey("age", IntRuleSet.integer().withMin(0));

            ValidationErrorCollection errors = rs.evaluate(RuleContext.background(), new Person(null, -1));

            assertThat(errors.first().code()).isEqualTo(ErrorCode.MIN);
            assertThat(errors.first().path()).isEqualTo("/age");
        }

        @Test
        @DisplayName("a value the bean property cannot hold is an INTERNAL error")
        void unassignableValue() {
            ObjectRuleSet<Person> rs = ObjectRuleSet.of(Person.SHAPE).withKey("age", StringRuleSet.string());

            ValidationErrorCollection errors = apply(rs, mapOf("age", "old"), OutputRef.empty());

            assertThat(errors.size()).isEqualTo(1);
            assertThat(errors.first().code()).isEqualTo(ErrorCode.INTERNAL);
            assertThat(errors.first().path()).isEqualTo("/age");
        }

        @Test
        @DisplayName("unknown keys are dropped for bean outputs when allowed")
        void beanIgnoresUnknown() {
            ObjectRuleSet<Person> rs = ObjectRuleSet.of(Person.SHAPE).withKey("name", StringRuleSet.string());

            assertThat(apply(rs, mapOf("name", "Ada", "zzz", 1), OutputRef.empty()).first().code())
                    .isEqualTo(ErrorCode.UNEXPECTED);
            assertThat(rs.withUnknown().validate(mapOf("name", "Ada", "zzz", 1)).getName()).isEqualTo("Ada");
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancelling mid-evaluation yields exactly one CANCELLED error")
        void cancelledOnce() {
            CancellationToken token = new CancellationToken();
            Map<String, AtomicInteger> calls = Map.of(
                    "A", new AtomicInteger(), "B", new AtomicInteger(), "C", new AtomicInteger());
            IntRuleSet cancelling = IntRuleSet.integer().withRuleFunc((ctx, value) -> {
                calls.get("A").incrementAndGet();
                token.cancel();
                return ValidationErrorCollection.empty();
            });
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("B", counting(calls.get("B")))
                    .withKey("C", counting(calls.get("C")))
                    .withKey("A", cancelling);
            OutputRef<Map<String, Object>> out = OutputRef.empty();

            ValidationErrorCollection errors =
                    rs.apply(RuleContext.background().withCancellation(token), mapOf("A", 1, "B", 2, "C", 3), out);

            assertThat(errors.size()).isEqualTo(1);
            assertThat(errors.first().code()).isEqualTo(ErrorCode.CANCELLED);
            assertThat(errors.first().path()).isEmpty();
            assertThat(calls.get("A").get()).isEqualTo(1);
            assertThat(calls.get("B").get()).isLessThanOrEqualTo(1);
            assertThat(calls.get("C").get()).isLessThanOrEqualTo(1);
            assertThat(out.isPresent()).isFalse();
        }

        private IntRuleSet counting(AtomicInteger calls) {
            return IntRuleSet.integer().withRuleFunc((ctx, value) -> {
                calls.incrementAndGet();
                return ValidationErrorCollection.empty();
            });
        }

        @Test
        @DisplayName("nested object rule sets do not duplicate the CANCELLED error")
        void nestedCancellation() {
            CancellationToken token = new CancellationToken();
            AnyRuleSet cancelling = AnyRuleSet.anything().withRuleFunc((ctx, value) -> {
                token.cancel();
                return ValidationErrorCollection.empty();
            });
            ObjectRuleSet<Map<String, Object>> rs =
                    ObjectRuleSet.map().withKey("inner", ObjectRuleSet.map().withKey("x", cancelling));

            ValidationErrorCollection errors = rs.apply(
                    RuleContext.background().withCancellation(token), mapOf("inner", mapOf("x", 1)), OutputRef.empty());

            assertThat(errors.asList()).extracting(ValidationError::code).containsExactly(ErrorCode.CANCELLED);
        }

        @Test
        @DisplayName("sibling nested object rule sets report a single CANCELLED error at the root")
        void siblingNestedCancellation() {
            CancellationToken token = new CancellationToken();
            AnyRuleSet slow = AnyRuleSet.anything().withRuleFunc((ctx, value) -> {
                pause(200);
                return ValidationErrorCollection.empty();
            });
            AnyRuleSet cancelling = AnyRuleSet.anything().withRuleFunc((ctx, value) -> {
                pause(50);
                token.cancel();
                return ValidationErrorCollection.empty();
            });
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("p", ObjectRuleSet.map().withKey("x", slow))
                    .withKey("q", ObjectRuleSet.map().withKey("x", slow))
                    .withKey("c", cancelling);

            ValidationErrorCollection errors = rs.apply(
                    RuleContext.background().withCancellation(token),
                    mapOf("p", mapOf("x", 1), "q", mapOf("x", 2), "c", 3),
                    OutputRef.empty());

            assertThat(errors.asList()).extracting(ValidationError::code).containsExactly(ErrorCode.CANCELLED);
            assertThat(errors.first().path()).isEmpty();
        }

        @Test
        @DisplayName("an already cancelled context runs no rules")
        void cancelledBeforeStart() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            AtomicInteger calls = new AtomicInteger();
            AnyRuleSet counted = AnyRuleSet.anything().withRuleFunc((ctx, value) -> {
                calls.incrementAndGet();
                return ValidationErrorCollection.empty();
            });
            ObjectRuleSet<Map<String, Object>> rs = ObjectRuleSet.map()
                    .withKey("a", counted)
                    .withConditionalKey("b", dependsOn("a"), counted)
                    .withRuleFunc((ctx, record) -> {
                        calls.incrementAndGet();
                        return ValidationErrorCollection.empty();
                    });

            ValidationErrorCollection errors = rs.apply(
                    RuleContext.background().withCancellation(token), mapOf("a", 1, "b", 2), OutputRef.empty());

            assertThat(errors.asList()).extracting(ValidationError::code).containsExactly(ErrorCode.CANCELLED);
            assertThat(calls.get()).isZero();
        }

        @Test
        @DisplayName("a deadline that passes mid-evaluation yields exactly one TIMEOUT error")
        void timeout() {
            AnyRuleSet slow = AnyRuleSet.anything().withRuleFunc((ctx, value) -> {
                pause(150);
                return ValidationErrorCollection.empty();
            });
            ObjectRuleSet<Map<String, Object>> rs =
                    ObjectRuleSet.map().withKey("a", slow).withKey("b", slow);

            ValidationErrorCollection errors = rs.apply(
                    RuleContext.background().withTimeout(Duration.ofMillis(30)),
                    mapOf("a", 1, "b", 2),
                    OutputRef.empty());

            assertThat(errors.asList()).extracting(ValidationError::code).containsExactly(ErrorCode.TIMEOUT);
        }
    }
}
