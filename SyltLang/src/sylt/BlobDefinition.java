package sylt;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** A record type declared with {@code Name :: blob { ... }}. */
@AutoValue
public abstract class BlobDefinition {
  public abstract int id();

  public abstract String name();

  /** Field name to declared type, in declaration order. */
  public abstract ImmutableMap<String, Type> fields();

  public static BlobDefinition create(int id, String name, ImmutableMap<String, Type> fields) {
    return new AutoValue_BlobDefinition(id, name, fields);
  }
}
