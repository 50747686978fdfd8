package org.lunaform.compiler.nodes;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TokenTest {

    private static final String SOURCE = "local value -- note";

    @Test
    void readsReferencedContentFromTheSource() {
        // Arrange
        Token token = Token.fromPosition(6, 11, 1)
                .withTrailingTrivia(new Trivia(TriviaKind.WHITESPACE, new TokenPosition.Referenced(11, 12, 1)))
                .withTrailingTrivia(new Trivia(TriviaKind.COMMENT, new TokenPosition.Referenced(12, 19, 1)));

        // Act & Assert
        assertThat(token.isReferenced()).isTrue();
        assertThat(token.read(SOURCE)).isEqualTo("value");
        assertThat(token.getTrailingTrivia()).extracting(trivia -> trivia.read(SOURCE)).containsExactly(" ", "-- note");
        assertThatThrownBy(() -> token.read(null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void turnsReferencesIntoOwnedContent() {
        // Arrange
        Token token = Token.fromPosition(6, 11, 3)
                .withLeadingTrivia(new Trivia(TriviaKind.WHITESPACE, new TokenPosition.Referenced(5, 6, 3)));

        // Act
        token.replaceReferencedTokens(SOURCE);

        // Assert
        assertThat(token.isReferenced()).isFalse();
        assertThat(token.read(null)).isEqualTo("value");
        assertThat(token.getLineNumber()).hasValue(3);
        assertThat(token.getLeadingTrivia().get(0).read(null)).isEqualTo(" ");
    }

    @Test
    void clearsTriviaByKind() {
        // Arrange
        Token token = Token.fromContent("x")
                .withLeadingTrivia(Trivia.comment("--[[ a ]]"))
                .withLeadingTrivia(Trivia.whitespace(" "))
                .withTrailingTrivia(Trivia.comment("-- b"));

        // Act
        token.clearComments();

        // Assert
        assertThat(token.getLeadingTrivia()).containsExactly(Trivia.whitespace(" "));
        assertThat(token.getTrailingTrivia()).isEmpty();

        token.clearWhitespaces();
        assertThat(token.hasTrivia()).isFalse();
    }

    @Test
    void shiftsLinesOfTokenAndTrivia() {
        // Arrange
        Token token = Token.fromPosition(0, 5, 2)
                .withTrailingTrivia(new Trivia(TriviaKind.WHITESPACE, new TokenPosition.Referenced(5, 6, 2)));

        // Act
        token.shiftTokenLine(4);

        // Assert
        assertThat(token.getLineNumber()).hasValue(6);
        assertThat(token.getTrailingTrivia().get(0).getLineNumber()).hasValue(6);
    }

    @Test
    void ownedTokensWithoutLineIgnoreShifts() {
        // Arrange
        Token token = Token.fromContent("end");

        // Act
        token.shiftTokenLine(10);

        // Assert
        assertThat(token.getLineNumber()).isEmpty();
        assertThat(token.read(null)).isEqualTo("end");
    }

    @Test
    void rejectsInvertedRanges() {
        assertThatThrownBy(() -> Token.fromPosition(4, 2, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
