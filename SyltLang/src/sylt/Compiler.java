package sylt;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.Verify;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Table;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import com.google.common.graph.Traverser;

/**
 * Lowers a parsed {@link Prog} to a {@link Program}.
 *
 * <p>Pass 1 gives every module a namespace and every top-level definition and blob a global slot.
 * Pass 2 generates code: the top-level statements of all modules go into the entry block,
 * dependencies first; every function literal becomes its own block.
 *
 * <p>Only the first error of each top-level statement is reported, since later ones are usually
 * consequences of it.
 */
public class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  /** What an identifier in a module namespace refers to. */
  @AutoValue
  abstract static class Name {
    enum Kind {
      SLOT,
      NAMESPACE;
    }

    abstract Kind kind();

    /** Global slot, or namespace index. */
    abstract int index();

    abstract boolean constant();

    static Name slot(int slot, boolean constant) {
      return new AutoValue_Compiler_Name(Kind.SLOT, slot, constant);
    }

    static Name namespace(int namespace) {
      return new AutoValue_Compiler_Name(Kind.NAMESPACE, namespace, true);
    }
  }

  private static final class Local {
    final String name;
    final int depth;
    final boolean constant;
    boolean captured = false;

    Local(String name, int depth, boolean constant) {
      this.name = name;
      this.depth = depth;
      this.constant = constant;
    }
  }

  /** Compile state of one block: its locals and the captures of its closure. */
  private static final class Frame {
    final Frame enclosing;
    final Block block;
    // Stack slots below the first local: the callee, plus the globals in the entry frame.
    final int reserved;
    final List<Local> locals = new ArrayList<>();
    final List<Boolean> upvalueConstant = new ArrayList<>();
    int depth = 0;

    Frame(Frame enclosing, Block block, int reserved) {
      this.enclosing = enclosing;
      this.block = block;
      this.reserved = reserved;
    }

    int slot(int local) {
      return reserved + local;
    }

    Optional<Integer> resolveLocal(String name) {
      for (int i = locals.size() - 1; i >= 0; i--) {
        if (locals.get(i).name.equals(name)) return Optional.of(i);
      }
      return Optional.empty();
    }
  }

  private final Prog prog;
  private final ImmutableList<ExternFunction> externs;
  private final ImmutableMap<String, Integer> externIndices;

  private final Map<String, Integer> namespaceIds = new HashMap<>();
  private final List<Module> namespaceModules = new ArrayList<>();
  private final List<Map<String, Name>> namespaces = new ArrayList<>();
  private final Table<Integer, String, Integer> blobIds = HashBasedTable.create();
  private final List<BlobDefinition> blobs = new ArrayList<>();
  private final List<Integer> blobSlots = new ArrayList<>();
  private int globals = 0;

  private final List<Block> blocks = new ArrayList<>();
  private final List<Value> constants = new ArrayList<>();
  private final Map<Value, Integer> constantIndices = new HashMap<>();
  private final List<String> strings = new ArrayList<>();
  private final Map<String, Integer> stringIndices = new HashMap<>();

  private final List<SyltException> errors = new ArrayList<>();
  private boolean panic = false;

  private Frame frame;
  private int namespace;

  public Compiler(Prog prog, ImmutableList<ExternFunction> externs) {
    this.prog = prog;
    this.externs = externs;

    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < externs.size(); i++) {
      builder.put(externs.get(i).name(), i);
    }
    this.externIndices = builder.build();
  }

  public Program compile() throws CompilationFailedException {
    DeclarationValidator validator = new DeclarationValidator();
    prog.accept(validator, null);
    errors.addAll(validator.errors());

    extractGlobals();

    Module entry = prog.entry();
    Block entryBlock =
        new Block(
            entry.stem(),
            entry.file().toString(),
            Type.function(ImmutableList.of(), Type.voidType()));
    blocks.add(entryBlock);
    frame = new Frame(null, entryBlock, 1 + globals);

    int nil = constant(Value.nil());
    for (int i = 0; i < globals; i++) {
      entryBlock.add(Op.of(Op.Code.CONSTANT, nil), 0);
    }
    writeBlobs(entryBlock);

    for (int module : moduleOrder()) {
      compileModule(module);
    }

    entryBlock.add(Op.of(Op.Code.CONSTANT, nil), entry.span().line());
    entryBlock.add(Op.of(Op.Code.RETURN), entry.span().line());

    if (!errors.isEmpty()) throw new CompilationFailedException(errors);

    Program program =
        Program.create(
            ImmutableList.copyOf(blocks),
            ImmutableList.copyOf(constants),
            ImmutableList.copyOf(strings),
            ImmutableList.copyOf(blobs),
            externs,
            globals);
    if (logger.isDebugEnabled()) {
      logger.debug("Compiled {} blocks:\n{}", blocks.size(), program.disassemble());
    }
    return program;
  }

  // ---------------------------------------------------------------------------
  // Pass 1

  private void extractGlobals() {
    ImmutableList<Module> modules = prog.modules();
    for (Module module : modules) {
      if (namespaceIds.containsKey(module.stem())) {
        errors.add(
            new CompileException(
                module.span(), String.format("Reading module '%s' twice", module.file())));
        continue;
      }
      namespaceIds.put(module.stem(), namespaces.size());
      namespaceModules.add(module);
      namespaces.add(new LinkedHashMap<>());
    }

    // Blob types may refer to blobs defined later, so they are resolved after all are named.
    List<Statement.Blob> blobStatements = new ArrayList<>();
    List<Integer> blobNamespaces = new ArrayList<>();
    for (int id = 0; id < namespaceModules.size(); id++) {
      Module module = namespaceModules.get(id);
      Map<String, Name> names = namespaces.get(id);
      for (Statement statement : module.statements()) {
        switch (statement.kind()) {
          case USE:
            {
              Statement.Use use = statement.cast();
              Integer other = namespaceIds.get(use.module());
              if (other == null) {
                errors.add(
                    new CompileException(
                        use.span(), String.format("Unknown module '%s'", use.module())));
              } else {
                declareGlobal(names, use.module(), Name.namespace(other), use.span());
              }
              break;
            }
          case DEFINITION:
            {
              Statement.Definition definition = statement.cast();
              declareGlobal(
                  names,
                  definition.name(),
                  Name.slot(globals + 1, definition.isConstant()),
                  definition.span());
              break;
            }
          case BLOB:
            {
              Statement.Blob blob = statement.cast();
              if (declareGlobal(names, blob.name(), Name.slot(globals + 1, true), blob.span())) {
                blobIds.put(id, blob.name(), blobStatements.size());
                blobSlots.add(globals);
                blobStatements.add(blob);
                blobNamespaces.add(id);
              }
              break;
            }
          default:
            break;
        }
      }
    }

    for (int i = 0; i < blobStatements.size(); i++) {
      Statement.Blob blob = blobStatements.get(i);
      panic = false;
      Map<String, Type> fields = new LinkedHashMap<>();
      for (Statement.Field field : blob.fields()) {
        fields.putIfAbsent(field.name(), resolveType(field.type(), blobNamespaces.get(i)));
      }
      blobs.add(BlobDefinition.create(i, blob.name(), ImmutableMap.copyOf(fields)));
    }
    panic = false;
  }

  /** Returns false, with an error, if the name is taken; slots are only consumed on success. */
  private boolean declareGlobal(Map<String, Name> names, String name, Name value, Span span) {
    if (names.containsKey(name)) {
      errors.add(
          new CompileException(
              span, String.format("A global variable with the name '%s' already exists", name)));
      return false;
    }
    names.put(name, value);
    if (value.kind() == Name.Kind.SLOT) globals++;
    return true;
  }

  /** Dependencies before the modules that import them; the entry module always runs last. */
  private ImmutableList<Integer> moduleOrder() {
    MutableGraph<Integer> imports = GraphBuilder.directed().allowsSelfLoops(true).build();
    List<Integer> starts = new ArrayList<>();
    for (int id = 0; id < namespaceModules.size(); id++) {
      Module module = namespaceModules.get(id);
      imports.addNode(id);
      if (id != 0) starts.add(id);
      for (String imported : ImportCollector.collect(module).keySet()) {
        Integer other = namespaceIds.get(imported);
        if (other != null && other != 0) imports.putEdge(id, other);
      }
    }
    starts.add(0);

    return ImmutableList.copyOf(Traverser.forGraph(imports).depthFirstPostOrder(starts));
  }

  private void writeBlobs(Block entryBlock) {
    for (BlobDefinition blob : blobs) {
      entryBlock.add(
          Op.of(Op.Code.CONSTANT, constant(Value.blob(blob.id(), blob.name()))), 0);
      entryBlock.add(Op.of(Op.Code.ASSIGN_GLOBAL, blobSlots.get(blob.id())), 0);
    }
  }

  Type resolveType(TypeNode node, int namespace) {
    switch (node.kind()) {
      case RESOLVED:
        return node.resolved().get();
      case USER_DEFINED:
        {
          int target = namespace;
          if (node.namespace().isPresent()) {
            Name alias = namespaces.get(namespace).get(node.namespace().get());
            if (alias == null || alias.kind() != Name.Kind.NAMESPACE) {
              error(
                  node.span(),
                  String.format("Unknown module '%s' in type", node.namespace().get()));
              return Type.unknown();
            }
            target = alias.index();
          }
          Integer blob = blobIds.get(target, node.name().get());
          if (blob == null) {
            error(node.span(), String.format("Unknown type '%s'", node));
            return Type.unknown();
          }
          return Type.instance(blob, node.name().get());
        }
      case TUPLE:
        return Type.tuple(resolveTypes(node.args(), namespace));
      case LIST:
        return Type.list(resolveType(node.args().get(0), namespace));
      case SET:
        return Type.set(resolveType(node.args().get(0), namespace));
      case DICT:
        return Type.dict(
            resolveType(node.args().get(0), namespace), resolveType(node.args().get(1), namespace));
      case FUNCTION:
        {
          ImmutableList<Type> args = resolveTypes(node.args(), namespace);
          return Type.function(args.subList(0, args.size() - 1), args.get(args.size() - 1));
        }
      case UNION:
        return Type.union(resolveTypes(node.args(), namespace));
    }
    throw new AssertionError(node.kind());
  }

  private ImmutableList<Type> resolveTypes(ImmutableList<TypeNode> nodes, int namespace) {
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (TypeNode node : nodes) {
      types.add(resolveType(node, namespace));
    }
    return types.build();
  }

  // ---------------------------------------------------------------------------
  // Pass 2: plumbing

  private void error(Span span, String msg) {
    if (panic) return;
    panic = true;
    errors.add(new CompileException(span, msg));
  }

  private int constant(Value value) {
    Integer existing = constantIndices.get(value);
    if (existing != null) return existing;

    constants.add(value);
    constantIndices.put(value, constants.size() - 1);
    return constants.size() - 1;
  }

  private int string(String value) {
    return stringIndices.computeIfAbsent(
        value,
        v -> {
          strings.add(v);
          return strings.size() - 1;
        });
  }

  private int add(Span span, Op.Code code) {
    return frame.block.add(Op.of(code), span.line());
  }

  private int add(Span span, Op.Code code, int arg) {
    return frame.block.add(Op.of(code, arg), span.line());
  }

  /** Emits a jump with an unknown target; {@link #patch} fills it in. */
  private int jump(Span span, Op.Code code) {
    return add(span, code, 0);
  }

  private void patch(int jump) {
    Op op = frame.block.op(jump);
    frame.block.patch(jump, Op.of(op.code(), frame.block.size()));
  }

  private boolean atTopLevel() {
    return frame.enclosing == null && frame.depth == 0;
  }

  private void beginScope() {
    frame.depth++;
  }

  private void endScope(Span span) {
    frame.depth--;
    List<Local> locals = frame.locals;
    while (!locals.isEmpty() && locals.get(locals.size() - 1).depth > frame.depth) {
      Local local = locals.remove(locals.size() - 1);
      add(span, local.captured ? Op.Code.CLOSE_UPVALUE : Op.Code.POP);
    }
  }

  private void declareLocal(String name, boolean constant, Span span) {
    for (int i = frame.locals.size() - 1; i >= 0; i--) {
      Local local = frame.locals.get(i);
      if (local.depth < frame.depth) break;
      if (local.name.equals(name)) {
        error(span, String.format("A variable named '%s' is already defined in this scope", name));
        return;
      }
    }
    frame.locals.add(new Local(name, frame.depth, constant));
  }

  // ---------------------------------------------------------------------------
  // Name resolution

  @AutoValue
  abstract static class Variable {
    enum Kind {
      LOCAL,
      UPVALUE,
      GLOBAL,
      EXTERN;
    }

    abstract Kind kind();

    abstract int index();

    abstract boolean constant();

    static Variable create(Kind kind, int index, boolean constant) {
      return new AutoValue_Compiler_Variable(kind, index, constant);
    }
  }

  private Optional<Integer> resolveUpvalue(Frame frame, String name) {
    if (frame.enclosing == null) return Optional.empty();

    Optional<Integer> local = frame.enclosing.resolveLocal(name);
    if (local.isPresent()) {
      Local captured = frame.enclosing.locals.get(local.get());
      captured.captured = true;
      return Optional.of(
          addUpvalue(frame, frame.enclosing.slot(local.get()), true, captured.constant));
    }

    Optional<Integer> upvalue = resolveUpvalue(frame.enclosing, name);
    if (upvalue.isPresent()) {
      return Optional.of(
          addUpvalue(
              frame, upvalue.get(), false, frame.enclosing.upvalueConstant.get(upvalue.get())));
    }
    return Optional.empty();
  }

  private static int addUpvalue(Frame frame, int index, boolean fromLocal, boolean constant) {
    int upvalue = frame.block.addCapture(Block.Capture.create(index, fromLocal));
    if (upvalue == frame.upvalueConstant.size()) frame.upvalueConstant.add(constant);
    return upvalue;
  }

  /** Which namespace {@code assignable} names, if it is an import alias. */
  private Optional<Integer> resolveNamespace(Assignable assignable) {
    switch (assignable.kind()) {
      case READ:
        {
          String name = assignable.<Assignable.Read>cast().name();
          if (frame.resolveLocal(name).isPresent()) return Optional.empty();
          Name global = namespaces.get(namespace).get(name);
          if (global == null || global.kind() != Name.Kind.NAMESPACE) return Optional.empty();
          return Optional.of(global.index());
        }
      case ACCESS:
        {
          Assignable.Access access = assignable.cast();
          Optional<Integer> outer = resolveNamespace(access.target());
          if (!outer.isPresent()) return Optional.empty();
          Name name = namespaces.get(outer.get()).get(access.field());
          if (name == null || name.kind() != Name.Kind.NAMESPACE) return Optional.empty();
          return Optional.of(name.index());
        }
      default:
        return Optional.empty();
    }
  }

  private Optional<Variable> resolve(String name, Span span) {
    Optional<Integer> local = frame.resolveLocal(name);
    if (local.isPresent()) {
      return Optional.of(
          Variable.create(
              Variable.Kind.LOCAL,
              frame.slot(local.get()),
              frame.locals.get(local.get()).constant));
    }

    Optional<Integer> upvalue = resolveUpvalue(frame, name);
    if (upvalue.isPresent()) {
      return Optional.of(
          Variable.create(
              Variable.Kind.UPVALUE, upvalue.get(), frame.upvalueConstant.get(upvalue.get())));
    }

    return resolveGlobal(namespace, name, span);
  }

  private Optional<Variable> resolveGlobal(int namespace, String name, Span span) {
    Name global = namespaces.get(namespace).get(name);
    if (global != null) {
      if (global.kind() == Name.Kind.NAMESPACE) {
        error(span, String.format("Cannot use module '%s' as a value", name));
        return Optional.empty();
      }
      return Optional.of(Variable.create(Variable.Kind.GLOBAL, global.index(), global.constant()));
    }

    Integer extern = externIndices.get(name);
    if (extern != null) return Optional.of(Variable.create(Variable.Kind.EXTERN, extern, true));

    error(span, String.format("No active variable called '%s' could be found", name));
    return Optional.empty();
  }

  private void read(Variable variable, Span span) {
    switch (variable.kind()) {
      case LOCAL:
        add(span, Op.Code.READ_LOCAL, variable.index());
        break;
      case UPVALUE:
        add(span, Op.Code.READ_UPVALUE, variable.index());
        break;
      case GLOBAL:
        add(span, Op.Code.READ_GLOBAL, variable.index());
        break;
      case EXTERN:
        add(span, Op.Code.CONSTANT, constant(Value.extern(variable.index())));
        break;
    }
  }

  /** Stores the top of the stack into {@code variable}, popping it. */
  private void write(Variable variable, Span span, String name) {
    if (variable.constant()) {
      error(span, String.format("Cannot assign to constant '%s'", name));
      return;
    }
    switch (variable.kind()) {
      case LOCAL:
        add(span, Op.Code.ASSIGN_LOCAL, variable.index());
        break;
      case UPVALUE:
        add(span, Op.Code.ASSIGN_UPVALUE, variable.index());
        break;
      case GLOBAL:
        add(span, Op.Code.ASSIGN_GLOBAL, variable.index());
        break;
      case EXTERN:
        throw new AssertionError("externs are constant");
    }
  }

  // ---------------------------------------------------------------------------
  // Pass 2: statements

  private void compileModule(int id) {
    Module module = namespaceModules.get(id);
    namespace = id;
    for (Statement statement : module.statements()) {
      panic = false;
      statement(statement);
    }
    panic = false;
  }

  private void statement(Statement statement) {
    Span span = statement.span();
    switch (statement.kind()) {
      case EMPTY:
      case USE:
      case BLOB:
        break;
      case PRINT:
        expression(statement.<Statement.Print>cast().value());
        add(span, Op.Code.PRINT);
        break;
      case STATEMENT_EXPRESSION:
        expression(statement.<Statement.StatementExpression>cast().value());
        add(span, Op.Code.POP);
        break;
      case DEFINITION:
        definition(statement.cast());
        break;
      case ASSIGNMENT:
        assignment(statement.cast());
        break;
      case BLOCK:
        beginScope();
        statement.<Statement.Block>cast().statements().forEach(this::statement);
        endScope(span);
        break;
      case IF:
        {
          Statement.If ifStatement = statement.cast();
          expression(ifStatement.condition());
          int skipThen = jump(span, Op.Code.JMP_FALSE);
          statement(ifStatement.then());
          if (ifStatement.otherwise().isPresent()) {
            int skipElse = jump(span, Op.Code.JMP);
            patch(skipThen);
            statement(ifStatement.otherwise().get());
            patch(skipElse);
          } else {
            patch(skipThen);
          }
          break;
        }
      case LOOP:
        {
          Statement.Loop loop = statement.cast();
          int start = frame.block.size();
          Optional<Integer> exit = Optional.empty();
          if (loop.condition().isPresent()) {
            expression(loop.condition().get());
            exit = Optional.of(jump(span, Op.Code.JMP_FALSE));
          }
          statement(loop.body());
          add(span, Op.Code.JMP, start);
          exit.ifPresent(this::patch);
          break;
        }
      case RET:
        {
          // Reported by the DeclarationValidator.
          if (frame.enclosing == null) break;
          Statement.Ret ret = statement.cast();
          if (ret.value().isPresent()) {
            expression(ret.value().get());
          } else {
            add(span, Op.Code.CONSTANT, constant(Value.nil()));
          }
          add(span, Op.Code.RETURN);
          break;
        }
    }
  }

  private void definition(Statement.Definition definition) {
    Span span = definition.span();
    Optional<Type> declared =
        definition.type().map(typeNode -> resolveType(typeNode, namespace));

    if (atTopLevel()) {
      expression(definition.value());
      declared.ifPresent(type -> add(span, Op.Code.DEFINE, constant(Value.ty(type))));
      Name name = namespaces.get(namespace).get(definition.name());
      Verify.verifyNotNull(name, "global %s was not extracted", definition.name());
      add(span, Op.Code.ASSIGN_GLOBAL, name.index());
      return;
    }

    // Functions can refer to themselves, so they are in scope before their value is compiled.
    boolean isFunction = definition.value().kind() == Expression.Kind.FUNCTION;
    if (isFunction) declareLocal(definition.name(), definition.isConstant(), span);
    expression(definition.value());
    declared.ifPresent(type -> add(span, Op.Code.DEFINE, constant(Value.ty(type))));
    if (!isFunction) declareLocal(definition.name(), definition.isConstant(), span);
  }

  private void assignment(Statement.Assignment assignment) {
    Span span = assignment.span();
    Assignable target = assignment.target();
    Optional<Expression.BinaryOp> op = assignment.op().binaryOp();

    switch (target.kind()) {
      case READ:
        {
          String name = target.<Assignable.Read>cast().name();
          Optional<Variable> variable = resolve(name, target.span());
          if (!variable.isPresent()) return;
          if (variable.get().kind() == Variable.Kind.EXTERN) {
            error(span, String.format("Cannot assign to extern function '%s'", name));
            return;
          }
          storeVariable(variable.get(), op, assignment.value(), span, name);
          return;
        }
      case CALL:
        error(span, "Cannot assign to result from function call");
        return;
      case ACCESS:
        {
          Assignable.Access access = target.cast();
          Optional<Integer> module = resolveNamespace(access.target());
          if (module.isPresent()) {
            Optional<Variable> variable = resolveGlobal(module.get(), access.field(), span);
            if (!variable.isPresent()) return;
            storeVariable(variable.get(), op, assignment.value(), span, access.toString());
            return;
          }

          int field = string(access.field());
          assignable(access.target());
          if (op.isPresent()) {
            add(span, Op.Code.COPY, 1);
            add(span, Op.Code.GET_FIELD, field);
            expression(assignment.value());
            binaryOp(op.get(), span);
          } else {
            expression(assignment.value());
          }
          add(span, Op.Code.ASSIGN_FIELD, field);
          return;
        }
      case INDEX:
        {
          Assignable.Index index = target.cast();
          assignable(index.target());
          expression(index.index());
          if (op.isPresent()) {
            add(span, Op.Code.COPY, 2);
            add(span, Op.Code.GET_INDEX);
            expression(assignment.value());
            binaryOp(op.get(), span);
          } else {
            expression(assignment.value());
          }
          add(span, Op.Code.ASSIGN_INDEX);
          return;
        }
    }
  }

  private void storeVariable(
      Variable variable,
      Optional<Expression.BinaryOp> op,
      Expression value,
      Span span,
      String name) {
    if (op.isPresent()) {
      read(variable, span);
      expression(value);
      binaryOp(op.get(), span);
    } else {
      expression(value);
    }
    write(variable, span, name);
  }

  // ---------------------------------------------------------------------------
  // Pass 2: expressions

  private void expression(Expression expression) {
    Span span = expression.span();
    switch (expression.kind()) {
      case LITERAL:
        add(span, Op.Code.CONSTANT, constant(expression.<Expression.Literal>cast().value()));
        break;
      case BINARY:
        {
          Expression.Binary binary = expression.cast();
          expression(binary.lhs());
          expression(binary.rhs());
          binaryOp(binary.op(), span);
          break;
        }
      case UNARY:
        {
          Expression.Unary unary = expression.cast();
          expression(unary.operand());
          add(span, unary.op() == Expression.UnaryOp.NEG ? Op.Code.NEG : Op.Code.NOT);
          break;
        }
      case COLLECTION:
        {
          Expression.Collection collection = expression.cast();
          collection.elements().forEach(this::expression);
          add(span, collectionOp(collection.collectionKind()), collection.elements().size());
          break;
        }
      case FUNCTION:
        function(expression.cast());
        break;
      case INSTANCE:
        {
          Expression.Instance instance = expression.cast();
          assignable(instance.blob());
          for (int i = 0; i < instance.fieldNames().size(); i++) {
            add(span, Op.Code.CONSTANT, constant(Value.field(instance.fieldNames().get(i))));
            expression(instance.fieldValues().get(i));
          }
          add(span, Op.Code.INSTANCE, instance.fieldNames().size());
          break;
        }
      case GET:
        assignable(expression.<Expression.Get>cast().assignable());
        break;
    }
  }

  private static Op.Code collectionOp(Expression.CollectionKind kind) {
    switch (kind) {
      case TUPLE:
        return Op.Code.TUPLE;
      case LIST:
        return Op.Code.LIST;
      case SET:
        return Op.Code.SET;
      case DICT:
        return Op.Code.DICT;
    }
    throw new AssertionError(kind);
  }

  private void binaryOp(Expression.BinaryOp op, Span span) {
    switch (op) {
      case ADD:
        add(span, Op.Code.ADD);
        break;
      case SUB:
        add(span, Op.Code.SUB);
        break;
      case MUL:
        add(span, Op.Code.MUL);
        break;
      case DIV:
        add(span, Op.Code.DIV);
        break;
      case EQ:
        add(span, Op.Code.EQUAL);
        break;
      case NEQ:
        add(span, Op.Code.EQUAL);
        add(span, Op.Code.NOT);
        break;
      case GT:
        add(span, Op.Code.GREATER);
        break;
      case GTEQ:
        add(span, Op.Code.LESS);
        add(span, Op.Code.NOT);
        break;
      case LT:
        add(span, Op.Code.LESS);
        break;
      case LTEQ:
        add(span, Op.Code.GREATER);
        add(span, Op.Code.NOT);
        break;
      case AND:
        add(span, Op.Code.AND);
        break;
      case OR:
        add(span, Op.Code.OR);
        break;
      case ASSERT_EQ:
        add(span, Op.Code.EQUAL);
        add(span, Op.Code.ASSERT);
        break;
      case IN:
        add(span, Op.Code.CONTAINS);
        break;
    }
  }

  private void function(Expression.Function function) {
    Span span = function.span();
    ImmutableList.Builder<Type> params = ImmutableList.builder();
    for (Expression.Parameter param : function.params()) {
      params.add(resolveType(param.type(), namespace));
    }
    Type returnType = resolveType(function.returnType(), namespace);
    Type type = Type.function(params.build(), returnType);

    Block block = new Block(function.name(), span.file(), type);
    int blockIndex = blocks.size();
    blocks.add(block);

    frame = new Frame(frame, block, 1);
    beginScope();
    for (Expression.Parameter param : function.params()) {
      frame.locals.add(new Local(param.name(), frame.depth, false));
    }
    function.body().statements().forEach(this::statement);

    Span end = function.body().statements().isEmpty()
        ? span
        : function.body().statements().get(function.body().statements().size() - 1).span();
    if (returnType.is(Type.Kind.VOID)) {
      add(end, Op.Code.CONSTANT, constant(Value.nil()));
      add(end, Op.Code.RETURN);
    } else {
      add(end, Op.Code.UNREACHABLE);
    }
    frame = frame.enclosing;

    add(span, Op.Code.CLOSURE, constant(Value.function(ImmutableList.of(), type, blockIndex)));
  }

  private void assignable(Assignable assignable) {
    Span span = assignable.span();
    switch (assignable.kind()) {
      case READ:
        {
          String name = assignable.<Assignable.Read>cast().name();
          resolve(name, span).ifPresent(variable -> read(variable, span));
          break;
        }
      case CALL:
        {
          Assignable.Call call = assignable.cast();
          assignable(call.callee());
          call.args().forEach(this::expression);
          add(span, Op.Code.CALL, call.args().size());
          break;
        }
      case ACCESS:
        {
          Assignable.Access access = assignable.cast();
          Optional<Integer> module = resolveNamespace(access.target());
          if (module.isPresent()) {
            resolveGlobal(module.get(), access.field(), span)
                .ifPresent(variable -> read(variable, span));
            break;
          }
          assignable(access.target());
          add(span, Op.Code.GET_FIELD, string(access.field()));
          break;
        }
      case INDEX:
        {
          Assignable.Index index = assignable.cast();
          assignable(index.target());
          expression(index.index());
          add(span, Op.Code.GET_INDEX);
          break;
        }
    }
  }
}
