package sylt;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TypeTest {
  private static final Type INT = Type.intType();
  private static final Type STR = Type.stringType();

  private static Type union(Type... types) {
    return Type.union(ImmutableList.copyOf(types));
  }

  @Test
  public void unionsAreFlatAndSorted() {
    assertThat(union(STR, union(INT, STR))).isEqualTo(union(INT, STR));
    assertThat(union(STR, INT).toString()).isEqualTo("int | str");
    assertThat(union(INT, INT)).isEqualTo(INT);
    assertThat(union()).isEqualTo(Type.unknown());
  }

  @Test
  public void fits() {
    assertThat(INT.fits(INT)).isTrue();
    assertThat(INT.fits(STR)).isFalse();
    assertThat(INT.fits(union(INT, STR))).isTrue();
    assertThat(union(INT, STR).fits(INT)).isFalse();
    assertThat(union(INT, STR).fits(union(STR, INT, Type.floatType()))).isTrue();
  }

  @Test
  public void unknownFitsEverything() {
    assertThat(Type.unknown().fits(INT)).isTrue();
    assertThat(INT.fits(Type.unknown())).isTrue();
    assertThat(Type.list(Type.unknown()).fits(Type.list(INT))).isTrue();
  }

  @Test
  public void compositesFitComponentWise() {
    assertThat(Type.list(INT).fits(Type.list(union(INT, STR)))).isTrue();
    assertThat(Type.list(union(INT, STR)).fits(Type.list(INT))).isFalse();
    assertThat(Type.tuple(ImmutableList.of(INT)).fits(Type.tuple(ImmutableList.of(INT, INT))))
        .isFalse();
    assertThat(Type.dict(INT, STR).fits(Type.dict(INT, STR))).isTrue();
    assertThat(Type.set(INT).fits(Type.list(INT))).isFalse();
  }

  @Test
  public void blobsFitByIdentity() {
    assertThat(Type.instance(0, "P").fits(Type.instance(0, "P"))).isTrue();
    assertThat(Type.instance(0, "P").fits(Type.instance(1, "P"))).isFalse();
  }

  @Test
  public void functions() {
    Type f = Type.function(ImmutableList.of(INT, STR), Type.boolType());
    assertThat(f.params()).containsExactly(INT, STR).inOrder();
    assertThat(f.returnType()).isEqualTo(Type.boolType());
    assertThat(f.toString()).isEqualTo("fn int, str -> bool");
    assertThat(f.fits(Type.function(ImmutableList.of(INT, STR), Type.boolType()))).isTrue();
    assertThat(f.fits(Type.function(ImmutableList.of(INT), Type.boolType()))).isFalse();
  }

  @Test
  public void names() {
    assertThat(Type.dict(INT, Type.list(STR)).toString()).isEqualTo("{int: [str]}");
    assertThat(Type.iter(Type.floatType()).toString()).isEqualTo("iter float");
    assertThat(Type.blob(2, "Point").toString()).isEqualTo("blob Point");
    assertThat(Type.instance(2, "Point").toString()).isEqualTo("Point");
  }
}
