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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import net.typeflow.syntax.DefStatement;
import net.typeflow.syntax.Expression;
import net.typeflow.syntax.ParserInput;
import net.typeflow.syntax.SourceFile;
import net.typeflow.syntax.SyntaxError;
import net.typeflow.types.StaticType;
import net.typeflow.types.Types;
import net.typeflow.types.Types.CallableType;
import net.typeflow.types.Types.GuardKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link TypeExpressionResolver}. */
@RunWith(JUnit4.class)
public final class TypeExpressionResolverTest {

  private final TypeEnvironment env =
      TypeEnvironment.builder()
          .addNamedType("Number", Types.union(Types.INT, Types.FLOAT))
          .addTypedDict(Types.typedDictBuilder("Movie").addRequiredKey("name", Types.STR).build())
          .build();

  private StaticType evalType(String type) throws Exception {
    return TypeExpressionResolver.evalTypeExpression(
        Expression.parse(ParserInput.fromLines(type)), env);
  }

  /** Asserts that resolving the type fails with the given message. */
  private void assertInvalid(String type, String message) throws Exception {
    Expression expr = Expression.parse(ParserInput.fromLines(type));
    SyntaxError.Exception e =
        assertThrows(
            SyntaxError.Exception.class,
            () -> TypeExpressionResolver.evalTypeExpression(expr, env));
    assertThat(e.errors().get(0).message()).isEqualTo(message);
  }

  @Test
  public void testNames() throws Exception {
    assertThat(evalType("int")).isEqualTo(Types.INT);
    assertThat(evalType("None")).isEqualTo(Types.NONE);
    assertThat(evalType("Any")).isEqualTo(Types.ANY);
    assertThat(evalType("NoReturn")).isEqualTo(Types.NEVER);
    assertThat(evalType("Never")).isEqualTo(Types.NEVER);
    assertThat(evalType("object")).isEqualTo(Types.OBJECT);
    assertThat(evalType("Number").toString()).isEqualTo("int | float");
    assertThat(evalType("Movie").toString()).isEqualTo("Movie");
  }

  @Test
  public void testUnions() throws Exception {
    assertThat(evalType("int | None").toString()).isEqualTo("int | None");
    assertThat(evalType("Optional[int]").toString()).isEqualTo("int | None");
    assertThat(evalType("Union[int, str, None]").toString()).isEqualTo("int | str | None");
    assertThat(evalType("Union[int, int]")).isEqualTo(Types.INT);
  }

  @Test
  public void testLiterals() throws Exception {
    assertThat(evalType("Literal[1, 'a', True, None, -3]").toString())
        .isEqualTo("Literal[1] | Literal['a'] | Literal[True] | None | Literal[-3]");
    assertThat(evalType("Literal['a']")).isEqualTo(Types.literal("a"));
  }

  @Test
  public void testContainers() throws Exception {
    assertThat(evalType("list").toString()).isEqualTo("list[Any]");
    assertThat(evalType("list[int]").toString()).isEqualTo("list[int]");
    assertThat(evalType("dict[str, list[int]]").toString()).isEqualTo("dict[str, list[int]]");
    assertThat(evalType("tuple[int, str]").toString()).isEqualTo("tuple[int, str]");
    assertThat(evalType("type[int]").toString()).isEqualTo("type[int]");
  }

  @Test
  public void testForwardReferences() throws Exception {
    assertThat(evalType("'int'")).isEqualTo(Types.INT);
    assertThat(evalType("list['int | None']").toString()).isEqualTo("list[int | None]");
  }

  @Test
  public void testErrors() throws Exception {
    assertInvalid("Bogus", "type 'Bogus' is not defined");
    assertInvalid("Frob[int]", "type constructor 'Frob' is not defined");
    assertInvalid("list[int, str]", "'list' expects 1 type argument(s), got 2");
    assertInvalid("dict[str]", "'dict' expects 2 type argument(s), got 1");
    assertInvalid("Literal[x]", "'x' is not a valid literal type argument");
    assertInvalid("f()", "unexpected expression 'f()'");
  }

  @Test
  public void testUnresolvedAnnotationMeansAny() throws Exception {
    TypeExpressionResolver resolver = new TypeExpressionResolver(env);
    Expression expr = Expression.parse(ParserInput.fromLines("list[Bogus]"));
    assertThat(resolver.resolve(expr).toString()).isEqualTo("list[Any]");
    // Resolved once.
    resolver.resolve(expr);
    assertThat(resolver.getErrors()).hasSize(1);
  }

  @Test
  public void testTypeGuardSignature() {
    SourceFile file =
        SourceFile.parse(
            ParserInput.fromLines(
                "def is_str(x: int | str, *rest, flag=1) -> TypeIs[str]:", //
                "  pass"));
    DefStatement def = (DefStatement) file.getStatements().get(0);
    CallableType signature =
        new TypeExpressionResolver(env)
            .resolveSignature(def.getParameters(), def.getReturnType(), Types.ANY);
    assertThat(signature.getGuardKind()).isEqualTo(GuardKind.TYPE_IS);
    assertThat(signature.getGuardedType()).isEqualTo(Types.STR);
    assertThat(signature.getParameterTypes()).hasSize(2);
    assertThat(signature.toString()).isEqualTo("Callable[[int | str, Any], TypeIs[str]]");
  }
}
