package sylt;

import java.util.Comparator;

import com.google.auto.value.AutoValue;

/** A source location: the file and the 1-based line a token or node came from. */
@AutoValue
public abstract class Span implements Comparable<Span> {
  private static final Span INTERNAL = create("<internal>", 0);

  public static Span internal() {
    return INTERNAL;
  }

  public abstract String file();

  public abstract int line();

  public static Span create(String file, int line) {
    return new AutoValue_Span(file, line);
  }

  @Override
  public int compareTo(Span span) {
    return Comparator.comparing(Span::file).thenComparing(Span::line).compare(this, span);
  }

  @Override
  public final String toString() {
    return file() + "@" + line();
  }
}
