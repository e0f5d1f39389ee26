package io.github.vishalmysore.loggraph.typing;

import io.github.vishalmysore.loggraph.ast.Ast;
import io.github.vishalmysore.loggraph.ast.AstSerializer;
import io.github.vishalmysore.loggraph.ast.Operator;
import io.github.vishalmysore.loggraph.ast.PrimitiveAst;
import io.github.vishalmysore.loggraph.ast.PrimitiveType;
import io.github.vishalmysore.loggraph.ast.PrimitiveValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCheckerTest {

    private static Ast composite(Operator op, Ast... args) {
        Ast ast = Values.makeCompositeNull(op);
        for (Ast arg : args) {
            ast.getComposite().getArgs().add(arg);
        }
        return ast;
    }

    private static Ast mismatched(PrimitiveType type, PrimitiveValue value) {
        Ast ast = new Ast();
        ast.setPrimitive(new PrimitiveAst(type, value));
        return ast;
    }

    @Test
    void acceptsNullValue() {
        assertThat(ValueChecker.isValue(Values.makeNull()).isOk()).isTrue();
    }

    @Test
    void primitiveValueMustMatchItsKind() {
        assertThat(ValueChecker.isPrimitive(PrimitiveType.BOOL, PrimitiveValue.ofBool(true))).isTrue();
        assertThat(ValueChecker.isPrimitive(PrimitiveType.BOOL, PrimitiveValue.ofInt(0))).isFalse();
        assertThat(ValueChecker.isPrimitive(PrimitiveType.INT, null)).isFalse();

        assertThat(ValueChecker.isValue(mismatched(PrimitiveType.BOOL, PrimitiveValue.ofString(""))).isOk())
                .isFalse();
        assertThat(ValueChecker.isValue(mismatched(PrimitiveType.INT, PrimitiveValue.ofTimestamp(0))).isOk())
                .isFalse();
        assertThat(ValueChecker.isValue(Values.makePrimitiveNull(PrimitiveType.STRING)).isOk()).isTrue();
    }

    @Test
    void intervalsHaveZeroOrTwoBoundsOfOneKind() {
        assertThat(ValueChecker.isValue(composite(Operator.INTERVAL, Values.makeInt(0))).isOk()).isFalse();
        assertThat(ValueChecker.isValue(Values.makeIntInterval(0, 1)).isOk()).isTrue();
        assertThat(ValueChecker.isValue(Values.makeIntHalfInterval(0, false)).isOk()).isTrue();
        assertThat(ValueChecker.isValue(composite(Operator.INTERVAL, Values.makeBool(false), Values.makeInt(1)))
                .isOk()).isFalse();
        assertThat(ValueChecker.isValue(composite(Operator.INTERVAL,
                mismatched(PrimitiveType.INT, PrimitiveValue.ofBool(false)), Values.makeInt(1))).isOk()).isFalse();
        assertThat(ValueChecker.isValue(Values.makeEmptyInterval()).isOk()).isTrue();
    }

    @Test
    void containersAcceptMixedElements() {
        for (Operator op : List.of(Operator.LIST, Operator.SET, Operator.TUPLE)) {
            assertThat(ValueChecker.isValue(composite(op, Values.makeInt(0))).isOk()).isTrue();
            assertThat(ValueChecker.isValue(composite(op,
                    mismatched(PrimitiveType.INT, PrimitiveValue.ofString("a")))).isOk()).isFalse();
            assertThat(ValueChecker.isValue(composite(op, Values.makeInt(1), Values.makeBool(false))).isOk())
                    .isTrue();
            assertThat(ValueChecker.isValue(Values.makeCompositeNull(op)).isOk()).isTrue();
        }
    }

    @Test
    void ordersPrimitiveValues() {
        assertThat(ValueChecker.lessThan(Values.makeBool(false).getPrimitive(), Values.makeBool(true).getPrimitive()))
                .isTrue();
        assertThat(ValueChecker.lessThan(Values.makeBool(true).getPrimitive(), Values.makeBool(true).getPrimitive()))
                .isFalse();
        assertThat(ValueChecker.lessThan(Values.makeInt(-1).getPrimitive(), Values.makeInt(0).getPrimitive()))
                .isTrue();
        assertThat(ValueChecker.lessThan(Values.makeString("b").getPrimitive(), Values.makeString("a").getPrimitive()))
                .isFalse();
        assertThat(ValueChecker.lessThan(Values.makeTimestampFromUnixMicros(1).getPrimitive(),
                Values.makeTimestampFromUnixMicros(2).getPrimitive())).isTrue();
    }

    @Test
    void comparingDifferentKindsFails() {
        assertThatThrownBy(() -> ValueChecker.lessThan(Values.makeInt(1).getPrimitive(),
                Values.makeTimestampFromUnixMicros(2).getPrimitive()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ValueChecker.lessThan(Values.makePrimitiveNull(PrimitiveType.INT).getPrimitive(),
                Values.makeInt(2).getPrimitive()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nullValuesAreIsomorphicOnlyToNullsOfTheSameShape() {
        assertThat(ValueChecker.isomorphic(Values.makeNull(), Values.makeNull())).isTrue();
        assertThat(ValueChecker.isomorphic(Values.makePrimitiveNull(PrimitiveType.BOOL), Values.makeNull()))
                .isFalse();
        assertThat(ValueChecker.isomorphic(Values.makePrimitiveNull(PrimitiveType.BOOL),
                Values.makePrimitiveNull(PrimitiveType.BOOL))).isTrue();
        assertThat(ValueChecker.isomorphic(Values.makePrimitiveNull(PrimitiveType.BOOL),
                Values.makePrimitiveNull(PrimitiveType.INT))).isFalse();
        assertThat(ValueChecker.isomorphic(Values.makePrimitiveNull(PrimitiveType.BOOL), Values.makeBool(true)))
                .isFalse();
    }

    @Test
    void primitivesAreIsomorphicWhenKindAndValueAgree() {
        assertThat(ValueChecker.isomorphic(Values.makeInt(0), Values.makeInt(0))).isTrue();
        assertThat(ValueChecker.isomorphic(Values.makeInt(0), Values.makeInt(1))).isFalse();
        assertThat(ValueChecker.isomorphic(Values.makeInt(0), Values.makeTimestampFromUnixMicros(0))).isFalse();
        assertThat(ValueChecker.isomorphic(Values.makeString(""), Values.makeString(""))).isTrue();
    }

    @Test
    void compositesAreComparedPositionally() {
        Ast first = Values.makeEmptyList();
        Ast second = Values.makeEmptyList();
        assertThat(ValueChecker.isomorphic(first, second)).isTrue();
        first.getComposite().getArgs().add(Values.makeInt(0));
        assertThat(ValueChecker.isomorphic(first, second)).isFalse();
        second.getComposite().getArgs().add(Values.makeInt(0));
        assertThat(ValueChecker.isomorphic(first, second)).isTrue();
        assertThat(ValueChecker.isomorphic(first, composite(Operator.SET, Values.makeInt(0)))).isFalse();

        // Without canonicalization, element order matters even for sets.
        Ast oneTwo = composite(Operator.SET, Values.makeInt(1), Values.makeInt(2));
        Ast twoOne = composite(Operator.SET, Values.makeInt(2), Values.makeInt(1));
        assertThat(ValueChecker.isomorphic(oneTwo, twoOne)).isFalse();
    }

    @Test
    void isomorphismRequiresValidValues() {
        Ast invalid = mismatched(PrimitiveType.INT, PrimitiveValue.ofString("a"));
        assertThatThrownBy(() -> ValueChecker.isomorphic(Values.makeInt(0), invalid))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ValueChecker.isomorphic(invalid, Values.makeInt(0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void canonicalizeEmptiesInvertedIntervals() {
        Ast inverted = Values.makeIntInterval(2, 1);
        ValueChecker.canonicalize(inverted);
        assertThat(ValueChecker.isomorphic(inverted, Values.makeEmptyInterval())).isTrue();

        Ast ordered = Values.makeIntInterval(1, 2);
        ValueChecker.canonicalize(ordered);
        assertThat(ValueChecker.isomorphic(ordered, Values.makeIntInterval(1, 2))).isTrue();

        Ast half = Values.makeIntHalfInterval(7, true);
        ValueChecker.canonicalize(half);
        assertThat(ValueChecker.isomorphic(half, Values.makeIntHalfInterval(7, true))).isTrue();
    }

    @Test
    void canonicalizeMakesSetsIndependentOfInsertionOrder() {
        List<Ast> elements = new ArrayList<>();
        for (int i = 0; i < 8; ++i) {
            elements.add(Values.makeString("element-" + i));
        }
        elements.add(Values.makeString("element-3"));
        Random random = new Random(42);

        Ast expected = composite(Operator.SET, elements.stream().map(Ast::copy).toArray(Ast[]::new));
        ValueChecker.canonicalize(expected);
        assertThat(expected.args()).hasSize(8);

        for (int trial = 0; trial < 10; ++trial) {
            Collections.shuffle(elements, random);
            Ast set = composite(Operator.SET, elements.stream().map(Ast::copy).toArray(Ast[]::new));
            ValueChecker.canonicalize(set);
            assertThat(ValueChecker.isomorphic(set, expected)).isTrue();
            assertThat(AstSerializer.serialize(set)).isEqualTo(AstSerializer.serialize(expected));
        }
    }

    @Test
    void canonicalizeRecursesIntoNestedValues() {
        Ast tuple = composite(Operator.TUPLE,
                composite(Operator.SET, Values.makeInt(3), Values.makeInt(1), Values.makeInt(3)),
                Values.makeIntInterval(9, 0));
        ValueChecker.canonicalize(tuple);
        assertThat(tuple.args().get(0).args()).hasSize(2);
        assertThat(tuple.args().get(1).args()).isEmpty();
    }

    @Test
    void canonicalizeRejectsInvalidValues() {
        assertThatThrownBy(() -> ValueChecker.canonicalize(null)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ValueChecker.canonicalize(composite(Operator.INTERVAL, Values.makeInt(0))))
                .isInstanceOf(IllegalStateException.class);
    }
}
