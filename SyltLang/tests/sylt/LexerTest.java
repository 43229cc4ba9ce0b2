package sylt;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LexerTest {

  private static ImmutableList<Token> tokenize(String content) throws SyntaxException {
    return new Lexer("/test/file.sy", content).tokenize();
  }

  private static ImmutableList<Token.Kind> kinds(String content) throws SyntaxException {
    return tokenize(content).stream().map(Token::kind).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptyFile() throws SyntaxException {
    assertThat(kinds("")).containsExactly(Token.Kind.EOF);
    assertThat(kinds("\n\n  \n")).containsExactly(Token.Kind.EOF);
  }

  @Test
  public void newlinesAreCollapsed() throws SyntaxException {
    assertThat(kinds("a\n\n\nb"))
        .containsExactly(
            Token.Kind.IDENTIFIER,
            Token.Kind.NEWLINE,
            Token.Kind.IDENTIFIER,
            Token.Kind.NEWLINE,
            Token.Kind.EOF)
        .inOrder();
  }

  @Test
  public void comments() throws SyntaxException {
    assertThat(kinds("a // one\n/* two\nthree */ b"))
        .containsExactly(
            Token.Kind.IDENTIFIER,
            Token.Kind.NEWLINE,
            Token.Kind.IDENTIFIER,
            Token.Kind.NEWLINE,
            Token.Kind.EOF)
        .inOrder();
  }

  @Test
  public void linesAreTracked() throws SyntaxException {
    ImmutableList<Token> tokens = tokenize("a\n/* x\n y */\nb");
    assertThat(tokens.get(0).span().line()).isEqualTo(1);
    assertThat(tokens.get(2).text()).isEqualTo("b");
    assertThat(tokens.get(2).span().line()).isEqualTo(4);
  }

  @Test
  public void longestSymbolWins() throws SyntaxException {
    assertThat(kinds("<=> <= < :: := : -> - += == ="))
        .containsExactly(
            Token.Kind.ASSERT_EQUAL,
            Token.Kind.LESS_EQUAL,
            Token.Kind.LESS,
            Token.Kind.COLON_COLON,
            Token.Kind.COLON_EQUAL,
            Token.Kind.COLON,
            Token.Kind.ARROW,
            Token.Kind.MINUS,
            Token.Kind.PLUS_EQUAL,
            Token.Kind.EQUAL_EQUAL,
            Token.Kind.EQUAL,
            Token.Kind.NEWLINE,
            Token.Kind.EOF)
        .inOrder();
  }

  @Test
  public void keywordsAndIdentifiers() throws SyntaxException {
    ImmutableList<Token> tokens = tokenize("fn fnord in inner _x1");
    assertThat(tokens.stream().limit(5).map(Token::kind).collect(Collectors.toList()))
        .containsExactly(
            Token.Kind.FN,
            Token.Kind.IDENTIFIER,
            Token.Kind.IN,
            Token.Kind.IDENTIFIER,
            Token.Kind.IDENTIFIER)
        .inOrder();
    assertThat(tokens.get(4).text()).isEqualTo("_x1");
  }

  @Test
  public void numbers() throws SyntaxException {
    ImmutableList<Token> tokens = tokenize("12 1.5 3.x");
    assertThat(tokens.get(0).kind()).isEqualTo(Token.Kind.INT);
    assertThat(tokens.get(1).kind()).isEqualTo(Token.Kind.FLOAT);
    assertThat(tokens.get(1).text()).isEqualTo("1.5");
    // '3.' followed by a letter is an int and a field access.
    assertThat(tokens.get(2).kind()).isEqualTo(Token.Kind.INT);
    assertThat(tokens.get(3).kind()).isEqualTo(Token.Kind.DOT);
  }

  @Test
  public void stringEscapes() throws SyntaxException {
    Token token = tokenize("\"a\\n\\t\\\"b\\\\\"").get(0);
    assertThat(token.kind()).isEqualTo(Token.Kind.STRING);
    assertThat(token.text()).isEqualTo("a\n\t\"b\\");
  }

  @Test
  public void errors() {
    assertThat(assertThrows(SyntaxException.class, () -> tokenize("\"abc")))
        .hasMessageThat()
        .contains("unterminated string");
    assertThat(assertThrows(SyntaxException.class, () -> tokenize("/* abc")))
        .hasMessageThat()
        .contains("unterminated comment");
    assertThat(assertThrows(SyntaxException.class, () -> tokenize("\"\\q\"")))
        .hasMessageThat()
        .contains("illegal escape");
    assertThat(assertThrows(SyntaxException.class, () -> tokenize("99999999999999999999")))
        .hasMessageThat()
        .contains("does not fit in 64 bits");
    assertThat(assertThrows(SyntaxException.class, () -> tokenize("1" + "0".repeat(400) + ".0")))
        .hasMessageThat()
        .contains("is not finite");
    assertThat(assertThrows(SyntaxException.class, () -> tokenize("a $ b")))
        .hasMessageThat()
        .isNotEmpty();
  }
}
