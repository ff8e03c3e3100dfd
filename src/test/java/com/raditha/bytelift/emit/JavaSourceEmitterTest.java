package com.raditha.bytelift.emit;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.Fixtures;
import com.raditha.bytelift.config.DecompilerSettings;
import com.raditha.bytelift.io.ILModule;
import com.raditha.bytelift.io.ILReader;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.SourceHint;
import com.raditha.bytelift.model.TypeReference;
import com.raditha.bytelift.pipeline.TransformPipeline;
import com.raditha.bytelift.transforms.FunctionTransform;
import com.raditha.bytelift.transforms.TransformContext;
import com.raditha.bytelift.workflow.DeclarationRef;
import com.raditha.bytelift.workflow.DecompilationOrchestrator;
import com.raditha.bytelift.workflow.DecompilationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JavaSourceEmitterTest {

    private JavaSourceEmitter emitter;

    @BeforeEach
    void setUp() {
        emitter = new JavaSourceEmitter();
    }

    @Test
    void testWholeTypeParsesAsJava() {
        ILModule module = Fixtures.module("members.il");
        DecompilationResult result = new DecompilationOrchestrator(module, module.getTypeSystem(), null,
                DecompilerSettings.defaults().withShowDocumentation(true))
                .decompile(DeclarationRef.type("Demo.Counter"), CancellationToken.none());

        CompilationUnit cu = StaticJavaParser.parse(emitter.emit(result));

        assertEquals("Demo", cu.getPackageDeclaration().orElseThrow().getNameAsString());
        ClassOrInterfaceDeclaration counter = cu.getClassByName("Counter").orElseThrow();
        assertTrue(counter.getJavadoc().orElseThrow().toText().contains("A counter with a name."));

        List<ConstructorDeclaration> constructors = counter.getConstructors();
        assertEquals(2, constructors.size());
        assertEquals(1, constructors.get(1).getParameters().size());
        assertEquals(1, counter.findAll(InitializerDeclaration.class).stream()
                .filter(InitializerDeclaration::isStatic).count());

        MethodDeclaration getter = counter.getMethodsByName("get_Name").get(0);
        assertEquals("String", getter.getTypeAsString());
        assertTrue(getter.getJavadoc().orElseThrow().toText().contains("Gets the name."));
        assertEquals("\"counter\" + \"-\" + \"name\"",
                getter.findFirst(ReturnStmt.class).orElseThrow().getExpression().orElseThrow().toString());

        MethodDeclaration step = counter.getMethodsByName("Step").get(0);
        assertEquals("int", step.getTypeAsString());
        assertEquals("n", step.getParameter(0).getNameAsString());
        String body = step.getBody().orElseThrow().toString();
        assertTrue(body.contains("total += 5;"));
        assertTrue(body.contains("if (n >= 0)"));
        assertEquals("B1", step.findFirst(LabeledStmt.class).orElseThrow().getLabel().asString());
        assertFalse(body.contains("t1"), "unused temporaries are not declared");
    }

    @Test
    void testConcatenationOfNumbersStaysAString() {
        ILModule module = ILReader.parse("""
                extern method System.String::Concat/3

                type Demo.Text {
                  method Join returns=string {
                    block B0 {
                      ret(call System.String::Concat/3(ldc.i4 1, ldc.i4 2, ldstr "x"))
                    }
                  }

                  method Label returns=string {
                    param s : string
                    block B0 {
                      ret(call System.String::Concat/3(ldc.i4 1, ldloc s, ldc.i4 2))
                    }
                  }
                }
                """);
        DecompilationResult result = new DecompilationOrchestrator(module, module.getTypeSystem(), null,
                DecompilerSettings.defaults()).decompile(DeclarationRef.type("Demo.Text"), CancellationToken.none());

        ClassOrInterfaceDeclaration text = StaticJavaParser.parse(emitter.emit(result)).getClassByName("Text")
                .orElseThrow();

        assertEquals("\"\" + 1 + 2 + \"x\"", returnedExpression(text, "Join"));
        assertEquals("1 + s + 2", returnedExpression(text, "Label"));
    }

    private static String returnedExpression(ClassOrInterfaceDeclaration clazz, String method) {
        return clazz.getMethodsByName(method).get(0).findFirst(ReturnStmt.class).orElseThrow()
                .getExpression().orElseThrow().toString();
    }

    @Test
    void testDegradedResultCarriesComment() {
        ILModule module = Fixtures.module("members.il");
        FunctionTransform failing = new FunctionTransform() {
            @Override
            public boolean run(ILFunction function, TransformContext context) {
                throw new IllegalStateException("boom");
            }
        };
        DecompilationResult result = new DecompilationOrchestrator(module, module.getTypeSystem(), null,
                DecompilerSettings.defaults(), new TransformPipeline(List.of(failing), 4, 4, null))
                .decompile(DeclarationRef.method("Demo.Counter", "Step"), CancellationToken.none());

        CompilationUnit cu = emitter.toCompilationUnit(result);

        ClassOrInterfaceDeclaration counter = cu.getClassByName("Counter").orElseThrow();
        List<String> comments = counter.getOrphanComments().stream().map(Comment::getContent).toList();
        assertEquals(1, comments.size());
        assertTrue(comments.get(0).startsWith(" Transforms failed, showing untransformed code: "));
        assertTrue(comments.get(0).contains("boom"));
        String body = counter.getMethodsByName("Step").get(0).getBody().orElseThrow().toString();
        assertTrue(body.contains("t1 = 5;"), "untransformed tree is shown");
    }

    @Test
    void testCancelledResultHasOnlyTheComment() {
        DecompilationResult cancelled = DecompilationResult.cancelled(
                DeclarationRef.method("Demo.Counter", "Step"), Duration.ZERO);

        ClassOrInterfaceDeclaration clazz = emitter.toCompilationUnit(cancelled).getClassByName("Counter")
                .orElseThrow();

        assertTrue(clazz.getMembers().isEmpty());
        assertEquals(" Decompilation was cancelled", clazz.getOrphanComments().get(0).getContent());
    }

    @Test
    void testSourceHintsBecomeLineComments() {
        ILModule module = Fixtures.module("build_param.il");
        DecompilationResult result = new DecompilationOrchestrator(module, module.getTypeSystem(),
                offset -> Optional.of(new SourceHint("Sample.cs", 10 + offset / 8)), DecompilerSettings.defaults())
                .decompile(DeclarationRef.type("Demo.Sample"), CancellationToken.none());

        String source = emitter.emit(result);

        assertTrue(source.contains("// Sample.cs:12"));
        assertTrue(source.contains("// Sample.cs:14"));
        assertFalse(source.contains("// Sample.cs:10"));
        MethodDeclaration build = StaticJavaParser.parse(source).getClassByName("Sample").orElseThrow()
                .getMethodsByName("BuildParam").get(0);
        assertTrue(build.isStatic());
        assertTrue(build.getBody().orElseThrow().toString().contains("int.class"));
    }

    @Test
    void testToType() {
        assertEquals("int", JavaSourceEmitter.toType(TypeReference.of("int32")).asString());
        assertEquals("boolean", JavaSourceEmitter.toType(TypeReference.of("bool")).asString());
        assertEquals("String", JavaSourceEmitter.toType(TypeReference.of("System.String")).asString());
        assertEquals("Object", JavaSourceEmitter.toType(null).asString());
        assertEquals("void", JavaSourceEmitter.toType(TypeReference.VOID).asString());
        assertEquals("Demo.Outer_Inner", JavaSourceEmitter.toType(TypeReference.of("Demo.Outer+Inner")).asString());
    }

    @Test
    void testIdentifier() {
        assertEquals("_ctor", JavaSourceEmitter.identifier(".ctor"));
        assertEquals("_Main_$", JavaSourceEmitter.identifier("<Main>$"));
        assertEquals("get_Name", JavaSourceEmitter.identifier("get_Name"));
        assertEquals("_", JavaSourceEmitter.identifier(""));
    }
}
