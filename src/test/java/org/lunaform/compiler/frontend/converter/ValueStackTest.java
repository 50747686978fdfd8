package org.lunaform.compiler.frontend.converter;

import org.lunaform.compiler.api.ConversionErrorKind;
import org.lunaform.compiler.api.InternalStackException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ValueStackTest {

    @Test
    void popsTheLastPushedItemFirst() throws Exception {
        // Arrange
        ValueStack<String> stack = new ValueStack<>("Expression");
        stack.push("c");
        stack.push("b");
        stack.push("a");

        // Act & Assert
        assertThat(stack.pop(2)).containsExactly("a", "b");
        assertThat(stack.size()).isEqualTo(1);
    }

    @Test
    void failsOnEmptyStack() {
        // Arrange
        ValueStack<String> stack = new ValueStack<>("Block");

        // Act & Assert
        assertThatThrownBy(stack::pop)
                .isInstanceOf(InternalStackException.class)
                .hasMessage("internal conversion stack expected to find an item of `Block`")
                .satisfies(e -> {
                    InternalStackException error = (InternalStackException) e;
                    assertThat(error.getCategory()).isEqualTo("Block");
                    assertThat(error.getKind()).isEqualTo(ConversionErrorKind.INTERNAL_STACK);
                });
    }

    @Test
    void failsWhenFewerItemsThanRequested() {
        // Arrange
        ValueStack<String> stack = new ValueStack<>("Statement");
        stack.push("only");

        // Act & Assert
        assertThatThrownBy(() -> stack.pop(2)).isInstanceOf(InternalStackException.class);
    }
}
