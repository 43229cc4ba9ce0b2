package sylt;

import com.google.common.collect.ImmutableList;

/**
 * A host function callable from sylt code.
 *
 * <p>Every extern has two faces. {@link #invoke} performs the real effect. {@link #resultType}
 * only computes the result type from the argument types, with no side effect; the typecheck pass
 * calls it instead and continues with a representative value of that type.
 */
public interface ExternFunction {

  String name();

  Value invoke(ImmutableList<Value> args) throws VmException;

  /** Throws {@link VmException.Kind#EXTERN_TYPE_MISMATCH} for arguments it cannot accept. */
  Type resultType(ImmutableList<Type> argTypes) throws VmException;

  default Value call(ImmutableList<Value> args, boolean typecheck) throws VmException {
    if (!typecheck) return invoke(args);
    ImmutableList<Type> argTypes =
        args.stream().map(Value::type).collect(ImmutableList.toImmutableList());
    return Value.from(resultType(argTypes));
  }
}
