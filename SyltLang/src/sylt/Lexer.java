package sylt;

import com.google.common.collect.ImmutableList;

/**
 * Produces the token stream the parser consumes. Newlines are significant (they end statements)
 * and are collapsed, so the parser never sees two in a row.
 */
public class Lexer {
  private final String file;
  private final String content;

  private int index = 0;
  private int line = 1;

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();
  private boolean lastWasNewline = true;

  public Lexer(String file, String content) {
    this.file = file;
    this.content = content;
  }

  public ImmutableList<Token> tokenize() throws SyntaxException {
    while (index < content.length()) {
      char ch = content.charAt(index);
      if (ch == '\n') {
        if (!lastWasNewline) emit(Token.Kind.NEWLINE, "\\n");
        lastWasNewline = true;
        index++;
        line++;
      } else if (Character.isWhitespace(ch)) {
        index++;
      } else if (ch == '/' && peek(1) == '/') {
        while (index < content.length() && content.charAt(index) != '\n') index++;
      } else if (ch == '/' && peek(1) == '*') {
        skipBlockComment();
      } else if (ch == '"') {
        readString();
      } else if (Character.isDigit(ch)) {
        readNumber();
      } else if (Character.isLetter(ch) || ch == '_') {
        readWord();
      } else {
        readSymbol();
      }
    }

    if (!lastWasNewline) emit(Token.Kind.NEWLINE, "\\n");
    emit(Token.Kind.EOF, "");
    return tokensBuilder.build();
  }

  private char peek(int ahead) {
    int at = index + ahead;
    return at < content.length() ? content.charAt(at) : '\0';
  }

  private Span span() {
    return Span.create(file, line);
  }

  private SyntaxException error(String msg) {
    return new SyntaxException(span(), msg);
  }

  private void emit(Token.Kind kind, String text) {
    tokensBuilder.add(Token.create(kind, text, span()));
    lastWasNewline = kind == Token.Kind.NEWLINE;
  }

  private void skipBlockComment() throws SyntaxException {
    int startLine = line;
    index += 2;
    while (index < content.length()) {
      if (content.charAt(index) == '*' && peek(1) == '/') {
        index += 2;
        return;
      }
      if (content.charAt(index) == '\n') line++;
      index++;
    }
    throw new SyntaxException(Span.create(file, startLine), "unterminated comment");
  }

  private void readString() throws SyntaxException {
    StringBuilder text = new StringBuilder();
    index++;
    while (true) {
      if (index >= content.length() || content.charAt(index) == '\n') {
        throw error("unterminated string");
      }

      char ch = content.charAt(index++);
      if (ch == '"') break;
      if (ch != '\\') {
        text.append(ch);
        continue;
      }

      char escaped = peek(0);
      index++;
      switch (escaped) {
        case 'n':
          text.append('\n');
          break;
        case 't':
          text.append('\t');
          break;
        case '"':
        case '\\':
          text.append(escaped);
          break;
        default:
          throw error("illegal escape '\\" + escaped + "'");
      }
    }
    emit(Token.Kind.STRING, text.toString());
  }

  private void readNumber() throws SyntaxException {
    int start = index;
    while (Character.isDigit(peek(0))) index++;

    boolean isFloat = peek(0) == '.' && Character.isDigit(peek(1));
    if (isFloat) {
      index++;
      while (Character.isDigit(peek(0))) index++;
    }

    String text = content.substring(start, index);
    if (isFloat) {
      if (!Double.isFinite(Double.parseDouble(text))) {
        throw error("float literal '" + text + "' is not finite");
      }
      emit(Token.Kind.FLOAT, text);
    } else {
      try {
        Long.parseLong(text);
      } catch (NumberFormatException ex) {
        throw error("integer literal '" + text + "' does not fit in 64 bits");
      }
      emit(Token.Kind.INT, text);
    }
  }

  private void readWord() {
    int start = index;
    while (Character.isLetterOrDigit(peek(0)) || peek(0) == '_') index++;

    String word = content.substring(start, index);
    emit(Token.Kind.keyword(word).orElse(Token.Kind.IDENTIFIER), word);
  }

  private static final ImmutableList<Token.Kind> SYMBOLS_LONGEST_FIRST =
      ImmutableList.sortedCopyOf(
          (a, b) -> Integer.compare(b.repr().get().length(), a.repr().get().length()),
          ImmutableList.of(
              Token.Kind.LEFT_PAREN,
              Token.Kind.RIGHT_PAREN,
              Token.Kind.LEFT_BRACKET,
              Token.Kind.RIGHT_BRACKET,
              Token.Kind.LEFT_BRACE,
              Token.Kind.RIGHT_BRACE,
              Token.Kind.COMMA,
              Token.Kind.DOT,
              Token.Kind.COLON,
              Token.Kind.COLON_COLON,
              Token.Kind.COLON_EQUAL,
              Token.Kind.QUESTION,
              Token.Kind.PIPE,
              Token.Kind.ARROW,
              Token.Kind.EQUAL,
              Token.Kind.EQUAL_EQUAL,
              Token.Kind.BANG,
              Token.Kind.NOT_EQUAL,
              Token.Kind.LESS,
              Token.Kind.LESS_EQUAL,
              Token.Kind.GREATER,
              Token.Kind.GREATER_EQUAL,
              Token.Kind.ASSERT_EQUAL,
              Token.Kind.PLUS,
              Token.Kind.MINUS,
              Token.Kind.STAR,
              Token.Kind.SLASH,
              Token.Kind.PLUS_EQUAL,
              Token.Kind.MINUS_EQUAL,
              Token.Kind.STAR_EQUAL,
              Token.Kind.SLASH_EQUAL,
              Token.Kind.AND,
              Token.Kind.OR));

  private void readSymbol() throws SyntaxException {
    for (Token.Kind kind : SYMBOLS_LONGEST_FIRST) {
      String repr = kind.repr().get();
      if (content.startsWith(repr, index)) {
        index += repr.length();
        emit(kind, repr);
        return;
      }
    }
    throw error(String.format("unexpected character '%c'", content.charAt(index)));
  }
}
