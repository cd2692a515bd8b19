package io.github.cyfko.formulaql.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<TokenType> types(String text) {
        return Tokenizer.tokenize(text).tokens().stream().map(Token::type).collect(Collectors.toList());
    }

    private static List<String> texts(String text) {
        return Tokenizer.tokenize(text).tokens().stream().map(Token::text).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Recognized tokens")
    class Recognized {

        @Test
        void tokensCarryTextAndOffset() {
            List<Token> tokens = Tokenizer.tokenize("atan2({Y}, 1.5) >= 3").tokens();

            assertEquals(List.of(
                    new Token(TokenType.FUNCTION, "atan2", 0),
                    new Token(TokenType.PAREN_OPEN, "(", 5),
                    new Token(TokenType.ATTRIBUTE, "Y", 6),
                    new Token(TokenType.COMMA, ",", 9),
                    new Token(TokenType.VALUE, "1.5", 11),
                    new Token(TokenType.PAREN_CLOSE, ")", 14),
                    new Token(TokenType.OPERATOR, ">=", 16),
                    new Token(TokenType.VALUE, "3", 19)), tokens);
        }

        @Test
        void attributeNamesMayContainSpaces() {
            assertEquals(List.of("Unit Price", "*", "2"), texts("{Unit Price}*2"));
        }

        @Test
        @DisplayName("A leading minus is an operator, not part of the number")
        void leadingMinusIsAnOperator() {
            assertEquals(List.of(TokenType.OPERATOR, TokenType.VALUE), types("-5"));
        }

        @Test
        void symbolRunsAreMaximal() {
            assertEquals(List.of("2", "**", "3", "!=", "8"), texts("2**3!=8"));
        }

        @Test
        @DisplayName("AND, OR and NOT are functions only when '(' follows immediately")
        void dualRoleNames() {
            assertEquals(List.of(TokenType.FUNCTION, TokenType.PAREN_OPEN, TokenType.ATTRIBUTE, TokenType.PAREN_CLOSE),
                    types("NOT({A})"));
            assertEquals(List.of(TokenType.OPERATOR, TokenType.ATTRIBUTE), types("NOT {A}"));
            assertEquals(List.of(TokenType.ATTRIBUTE, TokenType.OPERATOR, TokenType.PAREN_OPEN,
                    TokenType.ATTRIBUTE, TokenType.PAREN_CLOSE), types("{A} AND ({B})"));
        }

        @Test
        void functionNameWithoutParenthesisStaysAFunction() {
            assertEquals(List.of(TokenType.FUNCTION, TokenType.VALUE), types("sqrt 4"));
        }
    }

    @Nested
    @DisplayName("Skipped input")
    class Skipped {

        @Test
        void adjacentSkippedCharactersAreMerged() {
            Tokenizer.Result result = Tokenizer.tokenize("{A} @# {B}");

            assertEquals(List.of("A", "B"), result.tokens().stream().map(Token::text).collect(Collectors.toList()));
            assertEquals(List.of(new Tokenizer.SkippedInput("@#", 4)), result.skipped());
        }

        @Test
        void unclosedBraceIsSkippedWithTheWordAfterIt() {
            Tokenizer.Result result = Tokenizer.tokenize("{Price + 1");

            assertEquals(new Tokenizer.SkippedInput("{Price", 0), result.skipped().get(0));
            assertEquals(List.of("+", "1"), result.tokens().stream().map(Token::text).collect(Collectors.toList()));
        }

        @ParameterizedTest
        @ValueSource(strings = {"foo", "SQRT", "and", "=", "*-", "$"})
        void unknownRunsProduceNoToken(String text) {
            Tokenizer.Result result = Tokenizer.tokenize(text);

            assertTrue(result.tokens().isEmpty());
            assertEquals(text, result.skipped().get(0).text());
        }

        @Test
        void whitespaceOnlyYieldsNothing() {
            Tokenizer.Result result = Tokenizer.tokenize(" \t\n ");
            assertTrue(result.tokens().isEmpty());
            assertTrue(result.skipped().isEmpty());
        }
    }
}
