package com.raditha.bytelift.emit;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.comments.LineComment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.nodeTypes.NodeWithParameters;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VoidType;
import com.raditha.bytelift.model.BinaryNumeric;
import com.raditha.bytelift.model.BinaryOperator;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.Branch;
import com.raditha.bytelift.model.CallInstruction;
import com.raditha.bytelift.model.Comp;
import com.raditha.bytelift.model.ComparisonKind;
import com.raditha.bytelift.model.CompoundAssignment;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.IfInstruction;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.InstructionVisitor;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.LdNull;
import com.raditha.bytelift.model.LdStr;
import com.raditha.bytelift.model.LdTypeToken;
import com.raditha.bytelift.model.LdcI4;
import com.raditha.bytelift.model.LogicNot;
import com.raditha.bytelift.model.Nop;
import com.raditha.bytelift.model.OpCode;
import com.raditha.bytelift.model.Return;
import com.raditha.bytelift.model.SourceHint;
import com.raditha.bytelift.model.StLoc;
import com.raditha.bytelift.model.StringConcat;
import com.raditha.bytelift.model.TypeOf;
import com.raditha.bytelift.model.TypeReference;
import com.raditha.bytelift.model.VariableKind;
import com.raditha.bytelift.workflow.DecompilationResult;
import com.raditha.bytelift.workflow.DecompiledMember;
import com.raditha.bytelift.workflow.MemberKind;

import java.util.List;
import java.util.Map;

/**
 * Renders decompiled declarations as Java-like source through a JavaParser AST.
 * <p>
 * The output is meant for reading, not compiling: unstructured branches show up as {@code goto}
 * comments and non-entry blocks as labeled statements.
 */
public class JavaSourceEmitter {

    private static final Map<String, Type> PRIMITIVES = Map.of(
            "int32", PrimitiveType.intType(),
            "int64", PrimitiveType.longType(),
            "bool", PrimitiveType.booleanType(),
            "float32", PrimitiveType.floatType(),
            "float64", PrimitiveType.doubleType(),
            "char", PrimitiveType.charType());

    /**
     * One compilation unit holding the declaring type and every decompiled member of the result.
     */
    public CompilationUnit toCompilationUnit(DecompilationResult result) {
        TypeReference type = TypeReference.of(result.declaration().typeName());
        CompilationUnit cu = new CompilationUnit();
        if (!type.namespace().isEmpty()) {
            cu.setPackageDeclaration(sanitizeQualified(type.namespace()));
        }
        ClassOrInterfaceDeclaration clazz = cu.addClass(identifier(type.simpleName()));
        if (result.documentation() != null && result.declaration().kind() == MemberKind.TYPE) {
            clazz.setJavadocComment(result.documentation());
        }

        switch (result.status()) {
            case CANCELLED -> clazz.addOrphanComment(new LineComment(" Decompilation was cancelled"));
            case DEGRADED -> clazz.addOrphanComment(new LineComment(" Transforms failed, showing untransformed code: "
                    + result.getFault().map(Throwable::getMessage).orElse("unknown fault")));
            case ABORTED -> clazz.addOrphanComment(new LineComment(" Transform pipeline stopped early"));
            default -> {
                // nothing to note
            }
        }

        for (DecompiledMember member : result.members()) {
            clazz.addMember(toDeclaration(member, type));
        }
        return cu;
    }

    public String emit(DecompilationResult result) {
        return toCompilationUnit(result).toString();
    }

    BodyDeclaration<?> toDeclaration(DecompiledMember member, TypeReference declaringType) {
        ILFunction function = member.function();
        BlockStmt body = new StatementWriter(member).body(function);

        BodyDeclaration<?> declaration;
        switch (member.declaration().kind()) {
            case CONSTRUCTOR -> {
                ConstructorDeclaration ctor = new ConstructorDeclaration(identifier(declaringType.simpleName()));
                ctor.setModifiers(Modifier.Keyword.PUBLIC);
                addParameters(function, ctor);
                ctor.setBody(body);
                declaration = ctor;
            }
            case STATIC_CONSTRUCTOR -> declaration = new InitializerDeclaration(true, body);
            default -> {
                MethodDeclaration method = new MethodDeclaration();
                method.setName(identifier(function.getName()));
                method.setType(toType(function.getReturnType()));
                if (member.declaration().isStatic()) {
                    method.setModifiers(Modifier.Keyword.PUBLIC, Modifier.Keyword.STATIC);
                } else {
                    method.setModifiers(Modifier.Keyword.PUBLIC);
                }
                addParameters(function, method);
                method.setBody(body);
                declaration = method;
            }
        }
        if (member.documentation() != null && declaration instanceof NodeWithJavadoc<?> withJavadoc) {
            withJavadoc.setJavadocComment(member.documentation());
        }
        return declaration;
    }

    private static void addParameters(ILFunction function, NodeWithParameters<?> target) {
        for (ILVariable p : function.getParameters()) {
            target.addParameter(new Parameter(toType(p.getType()), identifier(p.getName())));
        }
    }

    static Type toType(TypeReference type) {
        if (type == null) {
            return StaticJavaParser.parseClassOrInterfaceType("Object");
        }
        if (TypeReference.VOID.equals(type)) {
            return new VoidType();
        }
        Type primitive = PRIMITIVES.get(type.fullName());
        if (primitive != null) {
            return primitive.clone();
        }
        return switch (type.fullName()) {
            case "string", "System.String" -> StaticJavaParser.parseClassOrInterfaceType("String");
            case "object", "System.Object" -> StaticJavaParser.parseClassOrInterfaceType("Object");
            default -> StaticJavaParser.parseClassOrInterfaceType(sanitizeQualified(type.fullName()));
        };
    }

    /**
     * Turns an IL name into a Java identifier by replacing every character Java does not allow.
     */
    static String identifier(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = i == 0 ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c);
            sb.append(ok ? c : '_');
        }
        return sb.isEmpty() ? "_" : sb.toString();
    }

    private static String sanitizeQualified(String name) {
        StringBuilder sb = new StringBuilder();
        for (String part : name.split("\\.")) {
            if (part.isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append('.');
            }
            sb.append(identifier(part));
        }
        return sb.toString();
    }

    private static Expression typeExpression(TypeReference type) {
        Expression expr = null;
        for (String part : sanitizeQualified(type.fullName()).split("\\.")) {
            expr = expr == null ? new NameExpr(part) : new FieldAccessExpr(expr, part);
        }
        return expr;
    }

    /**
     * Builds statements for one function body; holds the member so line hints can be attached.
     */
    private static final class StatementWriter {

        private final DecompiledMember member;
        private final ExpressionWriter expressions = new ExpressionWriter();

        StatementWriter(DecompiledMember member) {
            this.member = member;
        }

        BlockStmt body(ILFunction function) {
            BlockStmt body = new BlockStmt();
            for (ILVariable v : function.getVariables()) {
                if (v.getKind() != VariableKind.PARAMETER && function.referenceCount(v) > 0) {
                    body.addStatement(new ExpressionStmt(new VariableDeclarationExpr(toType(v.getType()),
                            identifier(v.getName()))));
                }
            }
            List<Block> blocks = function.getBlocks();
            for (int i = 0; i < blocks.size(); i++) {
                Block block = blocks.get(i);
                if (i == 0) {
                    block.getInstructions().forEach(s -> body.addStatement(statement(s)));
                } else {
                    BlockStmt inner = new BlockStmt();
                    block.getInstructions().forEach(s -> inner.addStatement(statement(s)));
                    body.addStatement(new LabeledStmt(identifier(block.getLabel()), inner));
                }
            }
            return body;
        }

        Statement statement(Instruction inst) {
            Statement stmt = switch (inst.getOpCode()) {
                case RETURN -> ((Return) inst).getValue()
                        .map(v -> new ReturnStmt(expressions.of(v)))
                        .orElseGet(ReturnStmt::new);
                case IF -> {
                    IfInstruction ifInst = (IfInstruction) inst;
                    Statement elseStmt = ifInst.hasElse() ? asBlock(ifInst.getFalseInst()) : null;
                    yield new IfStmt(expressions.of(ifInst.getCondition()), asBlock(ifInst.getTrueInst()), elseStmt);
                }
                case NOP -> new EmptyStmt();
                case BRANCH -> {
                    EmptyStmt jump = new EmptyStmt();
                    jump.setLineComment(" goto " + ((Branch) inst).getTarget().getLabel());
                    yield jump;
                }
                case ST_LOC -> new ExpressionStmt(expressions.assignment((StLoc) inst));
                case COMPOUND_ASSIGNMENT -> new ExpressionStmt(expressions.compound((CompoundAssignment) inst));
                default -> new ExpressionStmt(expressions.of(inst));
            };
            if (inst.hasILOffset() && inst.getOpCode() != OpCode.BRANCH) {
                member.hintFor(inst.getILOffset())
                        .ifPresent(hint -> stmt.setLineComment(" " + describe(hint)));
            }
            return stmt;
        }

        private Statement asBlock(Instruction inst) {
            BlockStmt block = new BlockStmt();
            if (inst.getOpCode() != OpCode.NOP) {
                block.addStatement(statement(inst));
            }
            return block;
        }

        private static String describe(SourceHint hint) {
            return hint.document() + ":" + hint.line();
        }
    }

    /**
     * Maps nested instructions to expressions.
     */
    private static final class ExpressionWriter implements InstructionVisitor<Expression> {

        Expression of(Instruction inst) {
            return inst.accept(this);
        }

        AssignExpr assignment(StLoc store) {
            return new AssignExpr(new NameExpr(identifier(store.getVariable().getName())), of(store.getValue()),
                    AssignExpr.Operator.ASSIGN);
        }

        AssignExpr compound(CompoundAssignment inst) {
            return new AssignExpr(new NameExpr(identifier(inst.getVariable().getName())), of(inst.getValue()),
                    assignOperator(inst.getOperator()));
        }

        private Expression operand(Instruction inst) {
            Expression expr = of(inst);
            if (expr instanceof BinaryExpr || expr instanceof ConditionalExpr || expr instanceof AssignExpr) {
                return new EnclosedExpr(expr);
            }
            return expr;
        }

        private NodeList<Expression> arguments(List<Instruction> args) {
            NodeList<Expression> list = new NodeList<>();
            for (Instruction arg : args) {
                list.add(of(arg));
            }
            return list;
        }

        @Override
        public Expression visitFunction(ILFunction function) {
            throw new IllegalArgumentException("A function is not an expression");
        }

        @Override
        public Expression visitBlock(Block block) {
            throw new IllegalArgumentException("A block is not an expression");
        }

        @Override
        public Expression visitLdLoc(LdLoc inst) {
            return new NameExpr(identifier(inst.getVariable().getName()));
        }

        @Override
        public Expression visitStLoc(StLoc inst) {
            return new EnclosedExpr(assignment(inst));
        }

        @Override
        public Expression visitCall(CallInstruction inst) {
            List<Instruction> args = inst.getArguments();
            if (inst.getOpCode() == OpCode.NEW_OBJ) {
                ClassOrInterfaceType type = StaticJavaParser.parseClassOrInterfaceType(
                        sanitizeQualified(inst.getMethod().declaringType().fullName()));
                return new ObjectCreationExpr(null, type, arguments(args));
            }
            String name = identifier(inst.getMethod().name());
            boolean hasReceiver = inst.getOpCode() == OpCode.CALL_VIRT
                    || args.size() > inst.getMethod().parameterCount();
            if (hasReceiver && !args.isEmpty()) {
                return new MethodCallExpr(operand(args.get(0)), name, arguments(args.subList(1, args.size())));
            }
            return new MethodCallExpr(typeExpression(inst.getMethod().declaringType()), name, arguments(args));
        }

        @Override
        public Expression visitLdcI4(LdcI4 inst) {
            return new IntegerLiteralExpr(String.valueOf(inst.getValue()));
        }

        @Override
        public Expression visitLdStr(LdStr inst) {
            return new StringLiteralExpr().setString(inst.getValue());
        }

        @Override
        public Expression visitLdNull(LdNull inst) {
            return new NullLiteralExpr();
        }

        @Override
        public Expression visitLdTypeToken(LdTypeToken inst) {
            NodeList<Expression> args = new NodeList<>();
            args.add(new ClassExpr(toType(inst.getType())));
            return new MethodCallExpr(null, "ldtoken", args);
        }

        @Override
        public Expression visitBinaryNumeric(BinaryNumeric inst) {
            return new BinaryExpr(operand(inst.getLeft()), operand(inst.getRight()), binaryOperator(inst.getOperator()));
        }

        @Override
        public Expression visitComp(Comp inst) {
            return new BinaryExpr(operand(inst.getLeft()), operand(inst.getRight()), comparison(inst.getKind()));
        }

        @Override
        public Expression visitLogicNot(LogicNot inst) {
            return new UnaryExpr(operand(inst.getArgument()), UnaryExpr.Operator.LOGICAL_COMPLEMENT);
        }

        @Override
        public Expression visitIf(IfInstruction inst) {
            return new ConditionalExpr(operand(inst.getCondition()), operand(inst.getTrueInst()),
                    operand(inst.getFalseInst()));
        }

        @Override
        public Expression visitBranch(Branch inst) {
            throw new IllegalArgumentException("A branch is not an expression");
        }

        @Override
        public Expression visitReturn(Return inst) {
            throw new IllegalArgumentException("A return is not an expression");
        }

        @Override
        public Expression visitNop(Nop inst) {
            return new NullLiteralExpr();
        }

        @Override
        public Expression visitTypeOf(TypeOf inst) {
            return new ClassExpr(toType(inst.getType()));
        }

        @Override
        public Expression visitStringConcat(StringConcat inst) {
            List<Instruction> operands = inst.getOperands();
            if (operands.isEmpty()) {
                return new StringLiteralExpr("");
            }
            // Java only concatenates once one side of the leftmost + is a String.
            Expression expr = operand(operands.get(0));
            int next = 1;
            if (!isStringValued(operands.get(0))) {
                if (operands.size() > 1 && isStringValued(operands.get(1))) {
                    expr = new BinaryExpr(expr, operand(operands.get(1)), BinaryExpr.Operator.PLUS);
                    next = 2;
                } else {
                    expr = new BinaryExpr(new StringLiteralExpr(""), expr, BinaryExpr.Operator.PLUS);
                }
            }
            for (int i = next; i < operands.size(); i++) {
                expr = new BinaryExpr(expr, operand(operands.get(i)), BinaryExpr.Operator.PLUS);
            }
            return expr;
        }

        private static boolean isStringValued(Instruction inst) {
            if (inst instanceof LdStr || inst instanceof StringConcat) {
                return true;
            }
            if (inst instanceof LdLoc load) {
                TypeReference type = load.getVariable().getType();
                return type != null && ("string".equals(type.fullName()) || "System.String".equals(type.fullName()));
            }
            return false;
        }

        @Override
        public Expression visitCompoundAssignment(CompoundAssignment inst) {
            return new EnclosedExpr(compound(inst));
        }

        private static BinaryExpr.Operator binaryOperator(BinaryOperator op) {
            return switch (op) {
                case ADD -> BinaryExpr.Operator.PLUS;
                case SUB -> BinaryExpr.Operator.MINUS;
                case MUL -> BinaryExpr.Operator.MULTIPLY;
                case DIV -> BinaryExpr.Operator.DIVIDE;
                case REM -> BinaryExpr.Operator.REMAINDER;
                case BIT_AND -> BinaryExpr.Operator.BINARY_AND;
                case BIT_OR -> BinaryExpr.Operator.BINARY_OR;
                case BIT_XOR -> BinaryExpr.Operator.XOR;
                case SHIFT_LEFT -> BinaryExpr.Operator.LEFT_SHIFT;
                case SHIFT_RIGHT -> BinaryExpr.Operator.SIGNED_RIGHT_SHIFT;
            };
        }

        private static AssignExpr.Operator assignOperator(BinaryOperator op) {
            return switch (op) {
                case ADD -> AssignExpr.Operator.PLUS;
                case SUB -> AssignExpr.Operator.MINUS;
                case MUL -> AssignExpr.Operator.MULTIPLY;
                case DIV -> AssignExpr.Operator.DIVIDE;
                case REM -> AssignExpr.Operator.REMAINDER;
                case BIT_AND -> AssignExpr.Operator.BINARY_AND;
                case BIT_OR -> AssignExpr.Operator.BINARY_OR;
                case BIT_XOR -> AssignExpr.Operator.XOR;
                case SHIFT_LEFT -> AssignExpr.Operator.LEFT_SHIFT;
                case SHIFT_RIGHT -> AssignExpr.Operator.SIGNED_RIGHT_SHIFT;
            };
        }

        private static BinaryExpr.Operator comparison(ComparisonKind kind) {
            return switch (kind) {
                case EQ -> BinaryExpr.Operator.EQUALS;
                case NE -> BinaryExpr.Operator.NOT_EQUALS;
                case LT -> BinaryExpr.Operator.LESS;
                case LE -> BinaryExpr.Operator.LESS_EQUALS;
                case GT -> BinaryExpr.Operator.GREATER;
                case GE -> BinaryExpr.Operator.GREATER_EQUALS;
            };
        }
    }
}
