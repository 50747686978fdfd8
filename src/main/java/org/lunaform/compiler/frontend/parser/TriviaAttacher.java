package org.lunaform.compiler.frontend.parser;

import org.lunaform.compiler.frontend.lexer.Lexeme;
import org.lunaform.compiler.frontend.lexer.TokenType;
import org.lunaform.compiler.frontend.syntax.TokenReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups the lexeme stream into significant tokens carrying their trivia.
 * <p>
 * Trivia following a token up to and including the first one that contains a line break is
 * trailing trivia of that token. Every other trivia lexeme is leading trivia of the next token;
 * the trivia at the end of the source ends up on the end-of-file token.
 */
public final class TriviaAttacher {

    private TriviaAttacher() {
        // Static utility
    }

    /**
     * @param lexemes The complete lexeme stream, terminated by an end-of-file lexeme.
     * @return the significant tokens, the last one being the end-of-file token.
     */
    public static List<TokenReference> attach(List<Lexeme> lexemes) {
        List<TokenReference> tokens = new ArrayList<>();
        List<Lexeme> leading = new ArrayList<>();
        int index = 0;
        while (index < lexemes.size()) {
            Lexeme lexeme = lexemes.get(index++);
            if (lexeme.type().isTrivia()) {
                leading.add(lexeme);
                continue;
            }
            List<Lexeme> trailing = new ArrayList<>();
            if (lexeme.type() != TokenType.END_OF_FILE) {
                while (index < lexemes.size() && lexemes.get(index).type().isTrivia()) {
                    Lexeme trivia = lexemes.get(index++);
                    trailing.add(trivia);
                    if (trivia.text().indexOf('\n') >= 0) {
                        break;
                    }
                }
            }
            tokens.add(new TokenReference(lexeme, leading, trailing));
            leading = new ArrayList<>();
        }
        return tokens;
    }
}
