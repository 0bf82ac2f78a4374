package org.kidoni.expressions;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OperatorTest {
    @ParameterizedTest
    @CsvSource({
            "ADD, +",
            "MUL, *",
            "NON_COMMUTATIVE_MUL, @",
            "POWER, ^",
            "CALL, call"
    })
    void displayToken(final Operator operator, final String token) {
        assertEquals(token, operator.display());
        assertEquals(token, operator.toString());
    }

    @Test
    void tokensAreDistinct() {
        Set<String> tokens = Arrays.stream(Operator.values())
                .map(Operator::display)
                .collect(Collectors.toSet());

        assertEquals(5, Operator.values().length);
        assertEquals(Set.of("+", "*", "@", "^", "call"), tokens);
    }
}
