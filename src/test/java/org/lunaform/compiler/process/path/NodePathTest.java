package org.lunaform.compiler.process.path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class NodePathTest {

    @Test
    void writesAndParsesTextForm() throws Exception {
        // Arrange
        NodePath path = NodePath.root().withStatement(4).withExpression(1).withStatement(0).withBlock(2);

        // Act
        String text = path.toString();

        // Assert
        assertThat(text).isEqualTo("4/1:0/2#");
        assertThat(NodePath.parse(text)).isEqualTo(path);
        assertThat(NodePath.parse(text).components()).containsExactly(
                new NodePath.Component(NodePath.ComponentKind.STATEMENT, 4),
                new NodePath.Component(NodePath.ComponentKind.EXPRESSION, 1),
                new NodePath.Component(NodePath.ComponentKind.STATEMENT, 0),
                new NodePath.Component(NodePath.ComponentKind.BLOCK, 2));
    }

    @Test
    void rootIsTheEmptyPath() throws Exception {
        assertThat(NodePath.root().toString()).isEmpty();
        assertThat(NodePath.parse("").isRoot()).isTrue();
        assertThat(NodePath.root().parent()).isEmpty();
        assertThat(NodePath.root().last()).isEmpty();
        assertThat(NodePath.of(List.of())).isSameAs(NodePath.root());
    }

    @Test
    void navigatesToParent() throws Exception {
        // Arrange
        NodePath path = NodePath.parse("0/3#1:");

        // Act & Assert
        assertThat(path.parent()).hasValue(NodePath.parse("0/3#"));
        assertThat(path.last()).hasValue(new NodePath.Component(NodePath.ComponentKind.EXPRESSION, 1));
        assertThat(path.parent().flatMap(NodePath::parent).flatMap(NodePath::parent)).hasValue(NodePath.root());
    }

    @Test
    void rejectsMalformedText() {
        assertThatThrownBy(() -> NodePath.parse("1/é"))
                .isInstanceOf(NodePathParseException.class)
                .hasMessage("unable to parse path `1/é`: non-ascii character at position 2");
        assertThatThrownBy(() -> NodePath.parse("1x"))
                .isInstanceOf(NodePathParseException.class)
                .hasMessage("unable to parse path `1x`: unexpected character `x`");
        assertThatThrownBy(() -> NodePath.parse("0//"))
                .isInstanceOf(NodePathParseException.class)
                .hasMessage("unable to parse path `0//`: missing index before `/`");
        assertThatThrownBy(() -> NodePath.parse("0/12"))
                .isInstanceOf(NodePathParseException.class)
                .hasMessage("unable to parse path `0/12`: index `12` is not followed by a delimiter");
        assertThatThrownBy(() -> NodePath.parse("99999999999/"))
                .isInstanceOf(NodePathParseException.class)
                .extracting(e -> ((NodePathParseException) e).getReason())
                .isEqualTo("invalid index `99999999999`");
    }

    @Test
    void rejectsNegativeIndexes() {
        assertThatThrownBy(() -> NodePath.root().withStatement(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
