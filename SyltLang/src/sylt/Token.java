package sylt;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class Token {

  public enum Kind {
    IDENTIFIER,
    INT,
    FLOAT,
    STRING,

    // Keywords
    TRUE("true"),
    FALSE("false"),
    NIL("nil"),
    FN("fn"),
    RET("ret"),
    IF("if"),
    ELSE("else"),
    LOOP("loop"),
    USE("use"),
    BLOB("blob"),
    PRINT("print"),
    IN("in"),

    // Punctuation
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    COMMA(","),
    DOT("."),
    COLON(":"),
    COLON_COLON("::"),
    COLON_EQUAL(":="),
    QUESTION("?"),
    PIPE("|"),
    ARROW("->"),

    // Operators
    EQUAL("="),
    EQUAL_EQUAL("=="),
    BANG("!"),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    ASSERT_EQUAL("<=>"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PLUS_EQUAL("+="),
    MINUS_EQUAL("-="),
    STAR_EQUAL("*="),
    SLASH_EQUAL("/="),
    AND("&&"),
    OR("||"),

    NEWLINE,
    EOF;

    private final Optional<String> repr;

    Kind() {
      this.repr = Optional.empty();
    }

    Kind(String repr) {
      this.repr = Optional.of(repr);
    }

    public Optional<String> repr() {
      return repr;
    }

    private static final ImmutableMap<String, Kind> KEYWORDS;

    static {
      ImmutableMap.Builder<String, Kind> builder = ImmutableMap.builder();
      for (Kind kind : values()) {
        if (kind.ordinal() >= TRUE.ordinal() && kind.ordinal() <= IN.ordinal()) {
          builder.put(kind.repr.get(), kind);
        }
      }
      KEYWORDS = builder.build();
    }

    public static Optional<Kind> keyword(String word) {
      return Optional.ofNullable(KEYWORDS.get(word));
    }
  }

  public abstract Kind kind();

  /** The raw text; for strings, the unescaped contents. */
  public abstract String text();

  public abstract Span span();

  public final boolean is(Kind kind) {
    return kind() == kind;
  }

  public static Token create(Kind kind, String text, Span span) {
    return new AutoValue_Token(kind, text, span);
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case NEWLINE:
        return "newline";
      case EOF:
        return "end of file";
      case STRING:
        return "\"" + text() + "\"";
      default:
        return "'" + text() + "'";
    }
  }
}
