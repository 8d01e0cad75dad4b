package org.blocksync.registry;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OrderTest {

    @Test
    void looserExpressionIsWrapped() {
        assertThat(Order.ADDITIVE.needsParenthesesWithin(Order.MULTIPLICATIVE)).isTrue();
        assertThat(Order.LOGICAL_OR.needsParenthesesWithin(Order.LOGICAL_AND)).isTrue();
    }

    @Test
    void tighterExpressionIsNotWrapped() {
        assertThat(Order.MULTIPLICATIVE.needsParenthesesWithin(Order.ADDITIVE)).isFalse();
        assertThat(Order.ATOMIC.needsParenthesesWithin(Order.FUNCTION_CALL)).isFalse();
        assertThat(Order.RELATIONAL.needsParenthesesWithin(Order.NONE)).isFalse();
    }

    @Test
    void equalPrecedenceIsWrappedUnlessAssociative() {
        assertThat(Order.ADDITIVE.needsParenthesesWithin(Order.ADDITIVE)).isTrue();
        assertThat(Order.RELATIONAL.needsParenthesesWithin(Order.RELATIONAL)).isTrue();

        assertThat(Order.ATOMIC.needsParenthesesWithin(Order.ATOMIC)).isFalse();
        assertThat(Order.NONE.needsParenthesesWithin(Order.NONE)).isFalse();
        assertThat(Order.LOGICAL_AND.needsParenthesesWithin(Order.LOGICAL_AND)).isFalse();
        assertThat(Order.LOGICAL_OR.needsParenthesesWithin(Order.LOGICAL_OR)).isFalse();
        assertThat(Order.LOGICAL_NOT.needsParenthesesWithin(Order.LOGICAL_NOT)).isFalse();
        assertThat(Order.MEMBER.needsParenthesesWithin(Order.FUNCTION_CALL)).isFalse();
    }
}
