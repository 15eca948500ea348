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
package net.typeflow.syntax;

import java.util.List;

/** A pretty-printer for syntax trees. */
final class NodePrinter {

  private final StringBuilder buf;
  private final int indent;

  private NodePrinter(StringBuilder buf, int indent) {
    this.buf = buf;
    this.indent = indent;
  }

  /** Returns the source-like form of a node. Statements end with a newline. */
  static String print(Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf, 0).printNode(node);
    return buf.toString();
  }

  private void printNode(Node n) {
    if (n instanceof Expression expr) {
      printExpr(expr);
    } else if (n instanceof Statement stmt) {
      printStmt(stmt);
    } else if (n instanceof Pattern pattern) {
      printPattern(pattern);
    } else if (n instanceof Argument arg) {
      printArgument(arg);
    } else if (n instanceof Parameter param) {
      printParameter(param);
    } else if (n instanceof DictExpression.Entry entry) {
      printDictEntry(entry);
    } else if (n instanceof SourceFile file) {
      for (Statement stmt : file.getStatements()) {
        printStmt(stmt);
      }
    } else if (n instanceof MatchStatement.Case c) {
      printCase(c);
    } else if (n instanceof TryStatement.ExceptHandler handler) {
      printHandler(handler);
    } else if (n instanceof WithStatement.Item item) {
      printWithItem(item);
    } else if (n instanceof ImportStatement.Item item) {
      printImportItem(item);
    } else {
      throw new IllegalArgumentException("unexpected node: " + n.getClass().getName());
    }
  }

  private void printIndent() {
    for (int i = 0; i < indent; i++) {
      buf.append("  ");
    }
  }

  private void printSuite(List<Statement> stmts) {
    buf.append('\n');
    NodePrinter nested = new NodePrinter(buf, indent + 1);
    for (Statement stmt : stmts) {
      nested.printStmt(stmt);
    }
  }

  private void printStmt(Statement s) {
    printIndent();
    switch (s.kind()) {
      case ASSERT -> {
        AssertStatement stmt = (AssertStatement) s;
        buf.append("assert ");
        printExpr(stmt.getCondition());
        if (stmt.getMessage() != null) {
          buf.append(", ");
          printExpr(stmt.getMessage());
        }
        buf.append('\n');
      }
      case ASSIGNMENT -> {
        AssignmentStatement stmt = (AssignmentStatement) s;
        printExpr(stmt.getLHS());
        if (stmt.getType() != null) {
          buf.append(": ");
          printExpr(stmt.getType());
        }
        if (stmt.getRHS() != null) {
          buf.append(' ');
          if (stmt.isAugmented()) {
            buf.append(stmt.getOperator());
          }
          buf.append("= ");
          printExpr(stmt.getRHS());
        }
        buf.append('\n');
      }
      case DEF -> {
        DefStatement stmt = (DefStatement) s;
        buf.append("def ").append(stmt.getIdentifier().getName()).append('(');
        String sep = "";
        for (Parameter param : stmt.getParameters()) {
          buf.append(sep);
          printParameter(param);
          sep = ", ";
        }
        buf.append(')');
        if (stmt.getReturnType() != null) {
          buf.append(" -> ");
          printExpr(stmt.getReturnType());
        }
        buf.append(':');
        printSuite(stmt.getBody());
      }
      case DEL -> {
        buf.append("del ");
        printExprs(((DelStatement) s).getTargets());
        buf.append('\n');
      }
      case EXPRESSION -> {
        printExpr(((ExpressionStatement) s).getExpression());
        buf.append('\n');
      }
      case FLOW -> buf.append(((FlowStatement) s).getJump()).append('\n');
      case FOR -> {
        ForStatement stmt = (ForStatement) s;
        buf.append("for ");
        printExpr(stmt.getTarget());
        buf.append(" in ");
        printExpr(stmt.getIterable());
        buf.append(':');
        printSuite(stmt.getBody());
        printElse(stmt.getElseBlock());
      }
      case FROM_IMPORT -> {
        FromImportStatement stmt = (FromImportStatement) s;
        buf.append("from ").append(stmt.getModule()).append(" import ");
        if (stmt.isWildcard()) {
          buf.append('*');
        } else {
          String sep = "";
          for (FromImportStatement.Binding b : stmt.getBindings()) {
            buf.append(sep).append(b.getName().getName());
            if (b.getLocalName() != b.getName()) {
              buf.append(" as ").append(b.getLocalName().getName());
            }
            sep = ", ";
          }
        }
        buf.append('\n');
      }
      case IF -> printIf((IfStatement) s);
      case IMPORT -> {
        buf.append("import ");
        String sep = "";
        for (ImportStatement.Item item : ((ImportStatement) s).getItems()) {
          buf.append(sep);
          printImportItem(item);
          sep = ", ";
        }
        buf.append('\n');
      }
      case MATCH -> {
        MatchStatement stmt = (MatchStatement) s;
        buf.append("match ");
        printExpr(stmt.getSubject());
        buf.append(":\n");
        NodePrinter nested = new NodePrinter(buf, indent + 1);
        for (MatchStatement.Case c : stmt.getCases()) {
          nested.printIndent();
          nested.printCase(c);
        }
      }
      case RAISE -> {
        RaiseStatement stmt = (RaiseStatement) s;
        buf.append("raise");
        if (stmt.getException() != null) {
          buf.append(' ');
          printExpr(stmt.getException());
        }
        if (stmt.getCause() != null) {
          buf.append(" from ");
          printExpr(stmt.getCause());
        }
        buf.append('\n');
      }
      case RETURN -> {
        ReturnStatement stmt = (ReturnStatement) s;
        buf.append("return");
        if (stmt.getResult() != null) {
          buf.append(' ');
          printExpr(stmt.getResult());
        }
        buf.append('\n');
      }
      case TRY -> {
        TryStatement stmt = (TryStatement) s;
        buf.append("try:");
        printSuite(stmt.getBody());
        for (TryStatement.ExceptHandler handler : stmt.getHandlers()) {
          printIndent();
          printHandler(handler);
        }
        printElse(stmt.getElseBlock());
        if (stmt.getFinallyBlock() != null) {
          printIndent();
          buf.append("finally:");
          printSuite(stmt.getFinallyBlock());
        }
      }
      case WHILE -> {
        WhileStatement stmt = (WhileStatement) s;
        buf.append("while ");
        printExpr(stmt.getCondition());
        buf.append(':');
        printSuite(stmt.getBody());
        printElse(stmt.getElseBlock());
      }
      case WITH -> {
        WithStatement stmt = (WithStatement) s;
        buf.append("with ");
        String sep = "";
        for (WithStatement.Item item : stmt.getItems()) {
          buf.append(sep);
          printWithItem(item);
          sep = ", ";
        }
        buf.append(':');
        printSuite(stmt.getBody());
      }
    }
  }

  private void printIf(IfStatement stmt) {
    buf.append(stmt.isElif() ? "elif " : "if ");
    printExpr(stmt.getCondition());
    buf.append(':');
    printSuite(stmt.getThenBlock());
    List<Statement> elseBlock = stmt.getElseBlock();
    if (elseBlock == null) {
      return;
    }
    if (elseBlock.size() == 1
        && elseBlock.get(0) instanceof IfStatement elif
        && elif.isElif()) {
      printIndent();
      printIf(elif);
    } else {
      printElse(elseBlock);
    }
  }

  private void printElse(List<Statement> elseBlock) {
    if (elseBlock != null) {
      printIndent();
      buf.append("else:");
      printSuite(elseBlock);
    }
  }

  private void printCase(MatchStatement.Case c) {
    buf.append("case ");
    printPattern(c.getPattern());
    if (c.getGuard() != null) {
      buf.append(" if ");
      printExpr(c.getGuard());
    }
    buf.append(':');
    printSuite(c.getBody());
  }

  private void printHandler(TryStatement.ExceptHandler handler) {
    buf.append("except");
    if (handler.getType() != null) {
      buf.append(' ');
      printExpr(handler.getType());
      if (handler.getName() != null) {
        buf.append(" as ").append(handler.getName().getName());
      }
    }
    buf.append(':');
    printSuite(handler.getBody());
  }

  private void printWithItem(WithStatement.Item item) {
    printExpr(item.getContextManager());
    if (item.getTarget() != null) {
      buf.append(" as ");
      printExpr(item.getTarget());
    }
  }

  private void printImportItem(ImportStatement.Item item) {
    buf.append(item.getModuleName());
    if (item.getAlias() != null) {
      buf.append(" as ").append(item.getAlias().getName());
    }
  }

  private void printParameter(Parameter param) {
    switch (param.getKind()) {
      case STAR -> buf.append('*');
      case STAR_STAR -> buf.append("**");
      default -> {}
    }
    if (!param.getName().equals("*")) {
      buf.append(param.getName());
    }
    if (param.getType() != null) {
      buf.append(": ");
      printExpr(param.getType());
    }
    if (param.getDefaultValue() != null) {
      buf.append('=');
      printExpr(param.getDefaultValue());
    }
  }

  private void printArgument(Argument arg) {
    if (arg instanceof Argument.Star) {
      buf.append('*');
    } else if (arg instanceof Argument.StarStar) {
      buf.append("**");
    } else if (arg instanceof Argument.Keyword) {
      buf.append(arg.getName()).append('=');
    }
    printExpr(arg.getValue());
  }

  private void printDictEntry(DictExpression.Entry entry) {
    printExpr(entry.getKey());
    buf.append(": ");
    printExpr(entry.getValue());
  }

  private void printExprs(List<? extends Expression> exprs) {
    String sep = "";
    for (Expression e : exprs) {
      buf.append(sep);
      printExpr(e);
      sep = ", ";
    }
  }

  private void printExpr(Expression expr) {
    switch (expr.kind()) {
      case ASSIGNMENT_EXPR -> {
        AssignmentExpression assign = (AssignmentExpression) expr;
        buf.append('(').append(assign.getTarget().getName()).append(" := ");
        printExpr(assign.getValue());
        buf.append(')');
      }
      case BINARY_OPERATOR -> {
        BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
        buf.append('(');
        printExpr(binop.getX());
        buf.append(' ').append(binop.getOperator()).append(' ');
        printExpr(binop.getY());
        buf.append(')');
      }
      case BOOL_LITERAL -> buf.append(((BoolLiteral) expr).getValue() ? "True" : "False");
      case CALL -> {
        CallExpression call = (CallExpression) expr;
        printExpr(call.getFunction());
        buf.append('(');
        String sep = "";
        for (Argument arg : call.getArguments()) {
          buf.append(sep);
          printArgument(arg);
          sep = ", ";
        }
        buf.append(')');
      }
      case CONDITIONAL -> {
        ConditionalExpression cond = (ConditionalExpression) expr;
        printExpr(cond.getThenCase());
        buf.append(" if ");
        printExpr(cond.getCondition());
        buf.append(" else ");
        printExpr(cond.getElseCase());
      }
      case DICT_EXPR -> {
        buf.append('{');
        String sep = "";
        for (DictExpression.Entry entry : ((DictExpression) expr).getEntries()) {
          buf.append(sep);
          printDictEntry(entry);
          sep = ", ";
        }
        buf.append('}');
      }
      case DOT -> {
        DotExpression dot = (DotExpression) expr;
        printExpr(dot.getObject());
        buf.append('.').append(dot.getField().getName());
      }
      case FLOAT_LITERAL -> buf.append(((FloatLiteral) expr).getSourceText());
      case IDENTIFIER -> buf.append(((Identifier) expr).getName());
      case INDEX -> {
        IndexExpression index = (IndexExpression) expr;
        printExpr(index.getObject());
        buf.append('[');
        if (index.getKey() instanceof ListExpression list && list.isTuple()) {
          printExprs(list.getElements());
        } else {
          printExpr(index.getKey());
        }
        buf.append(']');
      }
      case INT_LITERAL -> buf.append(((IntLiteral) expr).getSourceText());
      case LAMBDA -> {
        LambdaExpression lambda = (LambdaExpression) expr;
        buf.append("lambda");
        String sep = " ";
        for (Parameter param : lambda.getParameters()) {
          buf.append(sep);
          printParameter(param);
          sep = ", ";
        }
        buf.append(": ");
        printExpr(lambda.getBody());
      }
      case LIST_EXPR -> {
        ListExpression list = (ListExpression) expr;
        buf.append(list.isTuple() ? '(' : '[');
        printExprs(list.getElements());
        if (list.isTuple() && list.getElements().size() == 1) {
          buf.append(',');
        }
        buf.append(list.isTuple() ? ')' : ']');
      }
      case NONE_LITERAL -> buf.append("None");
      case STRING_LITERAL -> appendQuoted(((StringLiteral) expr).getValue());
      case UNARY_OPERATOR -> {
        UnaryOperatorExpression unop = (UnaryOperatorExpression) expr;
        buf.append(unop.getOperator());
        if (unop.getOperator() == TokenKind.NOT) {
          buf.append(' ');
        }
        printExpr(unop.getX());
      }
    }
  }

  private void printPattern(Pattern p) {
    switch (p.kind()) {
      case LITERAL -> printExpr(((Pattern.Literal) p).getValue());
      case CAPTURE -> buf.append(((Pattern.Capture) p).getName().getName());
      case WILDCARD -> buf.append('_');
      case VALUE -> printExpr(((Pattern.Value) p).getValue());
      case CLASS -> {
        Pattern.ClassPattern cls = (Pattern.ClassPattern) p;
        printExpr(cls.getClassExpression());
        buf.append('(');
        String sep = "";
        for (Pattern arg : cls.getPositionalPatterns()) {
          buf.append(sep);
          printPattern(arg);
          sep = ", ";
        }
        for (int i = 0; i < cls.getKeywordNames().size(); i++) {
          buf.append(sep).append(cls.getKeywordNames().get(i).getName()).append('=');
          printPattern(cls.getKeywordPatterns().get(i));
          sep = ", ";
        }
        buf.append(')');
      }
      case SEQUENCE -> {
        buf.append('[');
        String sep = "";
        for (Pattern elem : ((Pattern.Sequence) p).getElements()) {
          buf.append(sep);
          printPattern(elem);
          sep = ", ";
        }
        buf.append(']');
      }
      case STAR -> {
        Identifier name = ((Pattern.Star) p).getName();
        buf.append('*').append(name == null ? "_" : name.getName());
      }
      case MAPPING -> {
        Pattern.Mapping mapping = (Pattern.Mapping) p;
        buf.append('{');
        String sep = "";
        for (int i = 0; i < mapping.getKeys().size(); i++) {
          buf.append(sep);
          printExpr(mapping.getKeys().get(i));
          buf.append(": ");
          printPattern(mapping.getValues().get(i));
          sep = ", ";
        }
        if (mapping.getRest() != null) {
          buf.append(sep).append("**").append(mapping.getRest().getName());
        }
        buf.append('}');
      }
      case OR -> {
        String sep = "";
        for (Pattern alt : ((Pattern.Or) p).getAlternatives()) {
          buf.append(sep);
          printPattern(alt);
          sep = " | ";
        }
      }
      case AS -> {
        Pattern.As as = (Pattern.As) p;
        printPattern(as.getPattern());
        buf.append(" as ").append(as.getName().getName());
      }
    }
  }

  private void appendQuoted(String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> buf.append("\\\"");
        case '\\' -> buf.append("\\\\");
        case '\n' -> buf.append("\\n");
        case '\t' -> buf.append("\\t");
        case '\r' -> buf.append("\\r");
        default -> buf.append(c);
      }
    }
    buf.append('"');
  }
}
