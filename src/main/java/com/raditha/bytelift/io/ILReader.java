package com.raditha.bytelift.io;

import com.raditha.bytelift.io.ILTokenizer.Kind;
import com.raditha.bytelift.io.ILTokenizer.Token;
import com.raditha.bytelift.model.BinaryNumeric;
import com.raditha.bytelift.model.BinaryOperator;
import com.raditha.bytelift.model.Block;
import com.raditha.bytelift.model.Branch;
import com.raditha.bytelift.model.Call;
import com.raditha.bytelift.model.CallVirt;
import com.raditha.bytelift.model.Comp;
import com.raditha.bytelift.model.ComparisonKind;
import com.raditha.bytelift.model.CompoundAssignment;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.ILVariable;
import com.raditha.bytelift.model.IfInstruction;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.model.LdLoc;
import com.raditha.bytelift.model.LdNull;
import com.raditha.bytelift.model.LdStr;
import com.raditha.bytelift.model.LdTypeToken;
import com.raditha.bytelift.model.LdcI4;
import com.raditha.bytelift.model.LogicNot;
import com.raditha.bytelift.model.MethodReference;
import com.raditha.bytelift.model.NewObj;
import com.raditha.bytelift.model.Nop;
import com.raditha.bytelift.model.Return;
import com.raditha.bytelift.model.StLoc;
import com.raditha.bytelift.model.StackType;
import com.raditha.bytelift.model.StringConcat;
import com.raditha.bytelift.model.TypeOf;
import com.raditha.bytelift.model.TypeReference;
import com.raditha.bytelift.model.VariableKind;
import com.raditha.bytelift.workflow.DeclarationRef;
import com.raditha.bytelift.workflow.MemberKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for the textual IL format.
 * <pre>
 * extern type System.Linq.Expressions.ParameterExpression
 * extern method System.Type::GetTypeFromHandle/1
 * type Demo.Sample {
 *   /// doc text
 *   method Build kind=method returns=int32 {
 *     var v : System.Linq.Expressions.ParameterExpression local
 *     param p : int32
 *     block B0 {
 *       stloc v(call System.Linq.Expressions.Expression::Parameter/2(...))
 *       ret(ldloc p) @0x10
 *     }
 *   }
 * }
 * </pre>
 * Every {@code extern} declaration and every declared type and method is registered in the module's
 * {@link InMemoryTypeSystem}. Call targets are not, so a call to an undeclared member stays unresolved.
 */
public final class ILReader {

    private static final Logger logger = LoggerFactory.getLogger(ILReader.class);

    private final List<Token> tokens;
    private final InMemoryTypeSystem typeSystem;
    private int index;

    private ILReader(String text, InMemoryTypeSystem typeSystem) {
        this.tokens = new ILTokenizer(text).tokenize();
        this.typeSystem = typeSystem;
    }

    public static ILModule read(Path file) throws IOException {
        ILModule module = parse(Files.readString(file), file.getFileName().toString());
        logger.debug("Read {} type(s) from {}", module.getTypeNames().size(), file);
        return module;
    }

    public static ILModule parse(String text) {
        return parse(text, "<text>");
    }

    public static ILModule parse(String text, String sourceName) {
        ILReader reader = new ILReader(text, new InMemoryTypeSystem());
        return reader.parseModule(sourceName);
    }

    /**
     * Parses a single {@code method ... { ... }} declaration without an enclosing type.
     */
    public static ILFunction parseFunction(String text) {
        ILReader reader = new ILReader(text, new InMemoryTypeSystem());
        reader.expect("method");
        ILFunction function = reader.parseMethod(null).function();
        reader.expectKind(Kind.EOF, "end of input");
        return function;
    }

    private ILModule parseModule(String sourceName) {
        ILModule module = new ILModule(sourceName, typeSystem);
        String doc = null;
        while (peek().kind() != Kind.EOF) {
            Token t = peek();
            if (t.kind() == Kind.DOC) {
                doc = appendDoc(doc, next().text());
            } else if (t.is("extern")) {
                next();
                parseExtern();
                doc = null;
            } else if (t.is("type")) {
                next();
                parseType(module, doc);
                doc = null;
            } else {
                throw error(t, "Expected 'extern' or 'type' but found " + t.describe());
            }
        }
        return module;
    }

    private void parseExtern() {
        Token kind = expectKind(Kind.WORD, "'type' or 'method'");
        switch (kind.text()) {
            case "type" -> typeSystem.registerType(expectKind(Kind.WORD, "type name").text());
            case "method" -> typeSystem.registerMethod(parseMethodReference(expectKind(Kind.WORD, "method name")));
            default -> throw error(kind, "Expected 'type' or 'method' after 'extern'");
        }
    }

    private void parseType(ILModule module, String typeDoc) {
        String typeName = expectKind(Kind.WORD, "type name").text();
        typeSystem.registerType(typeName);
        module.addType(typeName, typeDoc);
        expect("{");

        String doc = null;
        while (!peek().is("}")) {
            Token t = next();
            if (t.kind() == Kind.DOC) {
                doc = appendDoc(doc, t.text());
                continue;
            }
            switch (t.text()) {
                case "method" -> {
                    ParsedMethod method = parseMethod(typeName);
                    DeclarationRef ref = new DeclarationRef(typeName, method.function().getName(), method.kind(),
                            method.isStatic(), method.owner());
                    if (module.find(ref).isPresent()) {
                        throw error(t, "Duplicate " + method.kind().token() + " " + ref.name() + " in " + typeName);
                    }
                    typeSystem.registerMethod(new MethodReference(TypeReference.of(typeName),
                            method.function().getName(), method.function().getParameters().size()));
                    module.addMember(ref, doc, method.function());
                }
                case "field" -> {
                    String name = expectKind(Kind.WORD, "field name").text();
                    boolean isStatic = acceptWord("static");
                    module.addMember(DeclarationRef.field(typeName, name, isStatic), doc, null);
                }
                case "property" -> module.addMember(
                        DeclarationRef.property(typeName, expectKind(Kind.WORD, "property name").text()), doc, null);
                case "event" -> module.addMember(
                        DeclarationRef.event(typeName, expectKind(Kind.WORD, "event name").text()), doc, null);
                default -> throw error(t, "Expected a member declaration but found " + t.describe());
            }
            doc = null;
        }
        expect("}");
    }

    private record ParsedMethod(ILFunction function, MemberKind kind, boolean isStatic, String owner) {
    }

    private ParsedMethod parseMethod(String typeName) {
        Token nameToken = expectKind(Kind.WORD, "method name");
        MemberKind kind = MemberKind.METHOD;
        boolean isStatic = false;
        String owner = null;
        TypeReference returnType = TypeReference.VOID;

        while (peek().kind() == Kind.WORD) {
            Token attr = next();
            String text = attr.text();
            if (text.equals("static")) {
                isStatic = true;
            } else if (text.startsWith("kind=")) {
                kind = parseMemberKind(attr, text.substring(5));
            } else if (text.startsWith("of=")) {
                owner = text.substring(3);
            } else if (text.startsWith("returns=")) {
                returnType = TypeReference.of(text.substring(8));
            } else {
                throw error(attr, "Unknown method attribute '" + text + "'");
            }
        }
        if (kind.isAccessor() && owner == null) {
            throw error(nameToken, "Accessor " + nameToken.text() + " needs an of=<owner> attribute");
        }

        ILFunction function = new ILFunction(nameToken.text(), returnType);
        new BodyParser(function).parse();
        if (typeName != null) {
            logger.trace("Parsed {}::{}", typeName, function.getName());
        }
        return new ParsedMethod(function, kind, isStatic, owner);
    }

    private MemberKind parseMemberKind(Token at, String token) {
        if (token.equals("type") || token.equals("field") || token.equals("property") || token.equals("event")) {
            throw error(at, "Methods cannot have kind=" + token);
        }
        try {
            return MemberKind.fromToken(token);
        } catch (IllegalArgumentException e) {
            throw error(at, e.getMessage());
        }
    }

    /**
     * Parses the variable table and blocks of one method, with its own variable and label scope.
     */
    private final class BodyParser {

        private final ILFunction function;
        private final Map<String, ILVariable> variables = new HashMap<>();
        private final Map<String, Block> blocks = new LinkedHashMap<>();
        private final Map<String, Token> unresolvedLabels = new LinkedHashMap<>();
        private int parameterIndex;
        private int localIndex;

        BodyParser(ILFunction function) {
            this.function = function;
        }

        void parse() {
            expect("{");
            while (!peek().is("}")) {
                Token t = expectKind(Kind.WORD, "'var', 'param' or 'block'");
                switch (t.text()) {
                    case "var" -> parseVariable(false);
                    case "param" -> parseVariable(true);
                    case "block" -> parseBlock();
                    default -> throw error(t, "Expected 'var', 'param' or 'block' but found " + t.describe());
                }
            }
            expect("}");
            if (!unresolvedLabels.isEmpty()) {
                Map.Entry<String, Token> first = unresolvedLabels.entrySet().iterator().next();
                throw error(first.getValue(), "Undefined block label " + first.getKey());
            }
            if (function.getChildCount() == 0) {
                throw error(peekBack(), "Method " + function.getName() + " has no blocks");
            }
        }

        private void parseVariable(boolean isParameter) {
            Token name = expectKind(Kind.WORD, "variable name");
            if (variables.containsKey(name.text())) {
                throw error(name, "Variable " + name.text() + " is already declared");
            }
            expect(":");
            String typeName = expectKind(Kind.WORD, "type name").text();
            TypeReference type = typeName.equals("?") ? null : TypeReference.of(typeName);

            VariableKind kind;
            int slot;
            if (isParameter) {
                kind = VariableKind.PARAMETER;
                slot = parameterIndex++;
            } else {
                Token kindToken = expectKind(Kind.WORD, "variable kind");
                try {
                    kind = VariableKind.fromToken(kindToken.text());
                } catch (IllegalArgumentException e) {
                    throw error(kindToken, e.getMessage());
                }
                if (kind == VariableKind.PARAMETER) {
                    throw error(kindToken, "Declare parameters with 'param'");
                }
                slot = localIndex++;
            }
            ILVariable variable = new ILVariable(kind, type, name.text(), slot);
            variables.put(name.text(), variable);
            function.registerVariable(variable);
        }

        private void parseBlock() {
            Token label = expectKind(Kind.WORD, "block label");
            Block block = blocks.get(label.text());
            if (block != null && !unresolvedLabels.containsKey(label.text())) {
                throw error(label, "Block " + label.text() + " is already declared");
            }
            if (block == null) {
                block = new Block(label.text());
                blocks.put(label.text(), block);
            }
            unresolvedLabels.remove(label.text());
            function.addBlock(block);

            expect("{");
            while (!peek().is("}")) {
                block.getInstructions().add(parseInstruction());
            }
            expect("}");
        }

        private Instruction parseInstruction() {
            Token t = expectKind(Kind.WORD, "instruction");
            String op = t.text();
            Instruction inst;
            if (op.startsWith("binary.")) {
                List<Instruction> args = arguments(t, 2);
                inst = new BinaryNumeric(operator(t, op.substring(7)), args.get(0), args.get(1));
            } else if (op.startsWith("comp.")) {
                inst = parseComp(t, op.substring(5));
            } else if (op.startsWith("compound.")) {
                BinaryOperator operator = operator(t, op.substring(9));
                ILVariable v = variable();
                inst = new CompoundAssignment(operator, v, arguments(t, 1).get(0));
            } else {
                inst = switch (op) {
                    case "ldloc" -> new LdLoc(variable());
                    case "stloc" -> {
                        ILVariable v = variable();
                        yield new StLoc(v, arguments(t, 1).get(0));
                    }
                    case "call" -> new Call(parseMethodReference(expectKind(Kind.WORD, "call target")),
                            optionalArguments());
                    case "callvirt" -> new CallVirt(parseMethodReference(expectKind(Kind.WORD, "call target")),
                            optionalArguments());
                    case "newobj" -> new NewObj(parseMethodReference(expectKind(Kind.WORD, "constructor")),
                            optionalArguments());
                    case "ldc.i4" -> new LdcI4(parseInt(expectKind(Kind.WORD, "integer")));
                    case "ldstr" -> new LdStr(expectKind(Kind.STRING, "string literal").text());
                    case "ldnull" -> new LdNull();
                    case "ldtoken" -> new LdTypeToken(TypeReference.of(expectKind(Kind.WORD, "type name").text()));
                    case "typeof" -> new TypeOf(TypeReference.of(expectKind(Kind.WORD, "type name").text()));
                    case "logic.not" -> new LogicNot(arguments(t, 1).get(0));
                    case "if" -> parseIf(t);
                    case "br" -> new Branch(blockFor(expectKind(Kind.WORD, "block label")));
                    case "ret" -> {
                        List<Instruction> args = optionalArguments();
                        if (args.size() > 1) {
                            throw error(t, "ret takes at most one value");
                        }
                        yield args.isEmpty() ? new Return() : new Return(args.get(0));
                    }
                    case "nop" -> new Nop();
                    case "concat" -> new StringConcat(arguments(t, -1));
                    default -> throw error(t, "Unknown instruction '" + op + "'");
                };
            }
            if (peek().is("@")) {
                next();
                inst.setILOffset(parseInt(expectKind(Kind.WORD, "IL offset")));
            }
            return inst;
        }

        private Instruction parseComp(Token t, String suffix) {
            int dot = suffix.indexOf('.');
            if (dot < 0) {
                throw error(t, "Expected comp.<kind>.<stack type>");
            }
            ComparisonKind kind;
            StackType type;
            try {
                kind = ComparisonKind.fromToken(suffix.substring(0, dot));
                type = StackType.fromToken(suffix.substring(dot + 1));
            } catch (IllegalArgumentException e) {
                throw error(t, e.getMessage());
            }
            List<Instruction> args = arguments(t, 2);
            return new Comp(kind, type, args.get(0), args.get(1));
        }

        private Instruction parseIf(Token t) {
            List<Instruction> args = optionalArguments();
            if (args.size() == 2) {
                return new IfInstruction(args.get(0), args.get(1));
            }
            if (args.size() == 3) {
                return new IfInstruction(args.get(0), args.get(1), args.get(2));
            }
            throw error(t, "if takes a condition, a true branch and an optional false branch");
        }

        private ILVariable variable() {
            Token name = expectKind(Kind.WORD, "variable name");
            ILVariable v = variables.get(name.text());
            if (v == null) {
                throw error(name, "Unknown variable " + name.text());
            }
            return v;
        }

        private Block blockFor(Token label) {
            Block block = blocks.get(label.text());
            if (block == null) {
                block = new Block(label.text());
                blocks.put(label.text(), block);
                unresolvedLabels.put(label.text(), label);
            }
            return block;
        }

        /**
         * Parenthesized argument list; {@code expected < 0} accepts any count.
         */
        private List<Instruction> arguments(Token owner, int expected) {
            if (!peek().is("(")) {
                throw error(peek(), "Expected '(' after " + owner.text());
            }
            List<Instruction> args = optionalArguments();
            if (expected >= 0 && args.size() != expected) {
                throw error(owner, owner.text() + " takes " + expected + " operand(s) but has " + args.size());
            }
            return args;
        }

        private List<Instruction> optionalArguments() {
            List<Instruction> args = new ArrayList<>();
            if (!peek().is("(")) {
                return args;
            }
            next();
            if (peek().is(")")) {
                next();
                return args;
            }
            args.add(parseInstruction());
            while (peek().is(",")) {
                next();
                args.add(parseInstruction());
            }
            expect(")");
            return args;
        }
    }

    private BinaryOperator operator(Token at, String token) {
        try {
            return BinaryOperator.fromToken(token);
        } catch (IllegalArgumentException e) {
            throw error(at, e.getMessage());
        }
    }

    private MethodReference parseMethodReference(Token t) {
        String text = t.text();
        int sep = text.lastIndexOf("::");
        int slash = text.lastIndexOf('/');
        if (sep <= 0 || slash < sep + 3 || slash == text.length() - 1) {
            throw error(t, "Expected Type::Name/arity but found '" + text + "'");
        }
        try {
            return MethodReference.of(text.substring(0, sep), text.substring(sep + 2, slash),
                    Integer.parseInt(text.substring(slash + 1)));
        } catch (IllegalArgumentException e) {
            throw error(t, "Bad method reference '" + text + "': " + e.getMessage());
        }
    }

    private int parseInt(Token t) {
        String text = t.text();
        boolean negative = text.startsWith("-");
        String digits = negative ? text.substring(1) : text;
        try {
            long value = digits.startsWith("0x") || digits.startsWith("0X")
                    ? Long.parseLong(digits.substring(2), 16)
                    : Long.parseLong(digits);
            value = negative ? -value : value;
            if (value < Integer.MIN_VALUE || value > 0xFFFFFFFFL) {
                throw error(t, "Integer out of range: " + text);
            }
            return (int) value;
        } catch (NumberFormatException e) {
            throw error(t, "Expected an integer but found '" + text + "'");
        }
    }

    private static String appendDoc(String doc, String line) {
        return doc == null ? line : doc + "\n" + line;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekBack() {
        return tokens.get(Math.max(0, index - 1));
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.kind() != Kind.EOF) {
            index++;
        }
        return t;
    }

    private boolean acceptWord(String word) {
        if (peek().is(word)) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(String text) {
        Token t = peek();
        if (!t.is(text)) {
            throw error(t, "Expected '" + text + "' but found " + t.describe());
        }
        return next();
    }

    private Token expectKind(Kind kind, String what) {
        Token t = peek();
        if (t.kind() != kind) {
            throw error(t, "Expected " + what + " but found " + t.describe());
        }
        return next();
    }

    private static ILParseException error(Token at, String message) {
        return new ILParseException(message, at.line(), at.column());
    }
}
