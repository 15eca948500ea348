// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.typeflow.evaluator;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.typeflow.syntax.BinaryOperatorExpression;
import net.typeflow.syntax.BoolLiteral;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.Identifier;
import net.typeflow.syntax.IndexExpression;
import net.typeflow.syntax.IntLiteral;
import net.typeflow.syntax.ListExpression;
import net.typeflow.syntax.Location;
import net.typeflow.syntax.Node;
import net.typeflow.syntax.Parameter;
import net.typeflow.syntax.ParserInput;
import net.typeflow.syntax.StringLiteral;
import net.typeflow.syntax.SyntaxError;
import net.typeflow.syntax.TokenKind;
import net.typeflow.syntax.UnaryOperatorExpression;
import net.typeflow.types.StaticType;
import net.typeflow.types.Types;
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.GuardKind;

/**
 * Resolves type annotations to {@link StaticType}s against a {@link TypeEnvironment}.
 *
 * <p>An annotation that cannot be resolved means {@code Any}; the problem is recorded as a {@link
 * SyntaxError} in the resolver's error list.
 */
public final class TypeExpressionResolver {

  private final TypeEnvironment env;
  private final List<SyntaxError> errors;
  private final Map<Expression, StaticType> resolved = new IdentityHashMap<>();

  public TypeExpressionResolver(TypeEnvironment env) {
    this(env, new ArrayList<>());
  }

  private TypeExpressionResolver(TypeEnvironment env, List<SyntaxError> errors) {
    this.env = env;
    this.errors = errors;
  }

  // Formats and reports an error at the start of the specified node.
  @FormatMethod
  private void errorf(Node node, String format, Object... args) {
    errorf(node.getStartLocation(), format, args);
  }

  // Formats and reports an error at the specified location.
  @FormatMethod
  private void errorf(Location loc, String format, Object... args) {
    errors.add(new SyntaxError(loc, String.format(format, args)));
  }

  /** Returns the errors reported so far. */
  public ImmutableList<SyntaxError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  /**
   * Resolves a type expression.
   *
   * @throws SyntaxError.Exception if the expression is not a valid type expression
   */
  public static StaticType evalTypeExpression(Expression expr, TypeEnvironment env)
      throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    StaticType result = new TypeExpressionResolver(env, errors).resolve(expr);
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  /** Resolves a type expression, or returns {@code Any} and records an error. */
  public StaticType resolve(Expression expr) {
    StaticType type = resolved.get(expr);
    if (type == null) {
      type = evalType(expr);
      resolved.put(expr, type);
    }
    return type;
  }

  private StaticType evalType(Expression expr) {
    switch (expr.kind()) {
      case NONE_LITERAL:
        return Types.NONE;
      case STRING_LITERAL:
        // A forward reference.
        try {
          return evalType(
              Expression.parse(
                  ParserInput.fromString(((StringLiteral) expr).getValue(), expr.getFile())));
        } catch (SyntaxError.Exception e) {
          errorf(expr, "invalid forward reference: %s", e.errors().get(0).message());
          return Types.ANY;
        }
      case IDENTIFIER:
        return evalName((Identifier) expr);
      case BINARY_OPERATOR:
        {
          // Syntax sugar for union types, i.e. a|b == Union[a,b]
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          if (binop.getOperator() == TokenKind.PIPE) {
            return Types.union(evalType(binop.getX()), evalType(binop.getY()));
          }
          errorf(expr, "binary operator '%s' is not supported", binop.getOperator());
          return Types.ANY;
        }
      case INDEX:
        return evalApplication((IndexExpression) expr);
      default:
        errorf(expr, "unexpected expression '%s'", expr);
        return Types.ANY;
    }
  }

  private StaticType evalName(Identifier id) {
    switch (id.getName()) {
      case "Any":
        return Types.ANY;
      case "NoReturn":
      case "Never":
        return Types.NEVER;
      case "list":
        return Types.list(Types.ANY);
      case "dict":
        return Types.dict(Types.ANY, Types.ANY);
      default:
        StaticType type = env.getNamedType(id.getName());
        if (type == null) {
          errorf(id, "type '%s' is not defined", id.getName());
          return Types.ANY;
        }
        return type;
    }
  }

  private StaticType evalApplication(IndexExpression app) {
    if (!(app.getObject() instanceof Identifier constructor)) {
      errorf(app, "unexpected expression '%s'", app);
      return Types.ANY;
    }
    List<Expression> args =
        app.getKey() instanceof ListExpression tuple && tuple.isTuple()
            ? tuple.getElements()
            : ImmutableList.of(app.getKey());
    String name = constructor.getName();
    switch (name) {
      case "list":
        return checkArity(app, name, args, 1) ? Types.list(evalType(args.get(0))) : Types.ANY;
      case "dict":
        return checkArity(app, name, args, 2)
            ? Types.dict(evalType(args.get(0)), evalType(args.get(1)))
            : Types.ANY;
      case "type":
        return checkArity(app, name, args, 1)
            ? Types.classObject(evalType(args.get(0)))
            : Types.ANY;
      case "Optional":
        return checkArity(app, name, args, 1)
            ? Types.union(evalType(args.get(0)), Types.NONE)
            : Types.ANY;
      case "tuple":
        {
          ImmutableList.Builder<StaticType> elements = ImmutableList.builder();
          for (Expression arg : args) {
            elements.add(evalType(arg));
          }
          return Types.tuple(elements.build());
        }
      case "Union":
        {
          List<StaticType> members = new ArrayList<>();
          for (Expression arg : args) {
            members.add(evalType(arg));
          }
          return Types.union(members);
        }
      case "Literal":
        {
          List<StaticType> members = new ArrayList<>();
          for (Expression arg : args) {
            members.add(evalLiteral(arg));
          }
          return Types.union(members);
        }
      case "TypeGuard":
      case "TypeIs":
        // Meaningful only as a return annotation; see resolveSignature.
        return checkArity(app, name, args, 1) ? Types.BOOL : Types.ANY;
      default:
        errorf(constructor, "type constructor '%s' is not defined", name);
        return Types.ANY;
    }
  }

  private boolean checkArity(IndexExpression app, String name, List<Expression> args, int n) {
    if (args.size() != n) {
      errorf(app, "'%s' expects %d type argument(s), got %d", name, n, args.size());
      return false;
    }
    return true;
  }

  private StaticType evalLiteral(Expression expr) {
    switch (expr.kind()) {
      case STRING_LITERAL:
        return Types.literal(((StringLiteral) expr).getValue());
      case INT_LITERAL:
        return Types.literal(((IntLiteral) expr).getValue().longValue());
      case BOOL_LITERAL:
        return Types.literal(((BoolLiteral) expr).getValue());
      case NONE_LITERAL:
        return Types.NONE;
      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
          if (unary.getOperator() == TokenKind.MINUS && unary.getX() instanceof IntLiteral i) {
            return Types.literal(-i.getValue().longValue());
          }
          break;
        }
      default:
        break;
    }
    errorf(expr, "'%s' is not a valid literal type argument", expr);
    return Types.ANY;
  }

  /** Resolves the declared type of a parameter. Unannotated parameters are {@code Any}. */
  public StaticType resolveParameter(Parameter param) {
    StaticType type = param.getType() == null ? Types.ANY : resolve(param.getType());
    switch (param.getKind()) {
      case STAR:
        return Types.TUPLE_CLASS;
      case STAR_STAR:
        return Types.dict(Types.STR, type);
      default:
        return type;
    }
  }

  /**
   * Resolves the type of a function from its parameters and return annotation. A return
   * annotation of {@code TypeGuard[T]} or {@code TypeIs[T]} makes the function a type guard of its
   * first argument. {@code returnsIfUnannotated} is used if there is no return annotation.
   */
  public CallableType resolveSignature(
      List<Parameter> parameters,
      @Nullable Expression returnType,
      StaticType returnsIfUnannotated) {
    ImmutableList.Builder<StaticType> types = ImmutableList.builder();
    for (Parameter param : parameters) {
      if (param.getKind() == Parameter.Kind.MANDATORY
          || param.getKind() == Parameter.Kind.OPTIONAL) {
        types.add(resolveParameter(param));
      }
    }
    if (returnType == null) {
      return Types.callable(types.build(), returnsIfUnannotated);
    }
    if (returnType instanceof IndexExpression app
        && app.getObject() instanceof Identifier constructor
        && (constructor.getName().equals("TypeGuard") || constructor.getName().equals("TypeIs"))) {
      GuardKind kind =
          constructor.getName().equals("TypeIs") ? GuardKind.TYPE_IS : GuardKind.TYPE_GUARD;
      return Types.typeGuard(types.build(), kind, resolve(app.getKey()));
    }
    return Types.callable(types.build(), resolve(returnType));
  }
}
