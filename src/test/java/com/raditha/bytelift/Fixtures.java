package com.raditha.bytelift;

import com.raditha.bytelift.io.ILModule;
import com.raditha.bytelift.io.ILReader;
import com.raditha.bytelift.io.InMemoryTypeSystem;
import com.raditha.bytelift.match.WellKnownMembers;
import com.raditha.bytelift.model.MethodReference;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Shared test inputs: the IL files under {@code src/test/resources/il} and a type system that knows
 * every library member the transforms look for.
 */
public final class Fixtures {

    public static final MethodReference GET_TYPE_FROM_HANDLE =
            MethodReference.of(WellKnownMembers.SYSTEM_TYPE, "GetTypeFromHandle", 1);
    public static final MethodReference EXPRESSION_PARAMETER =
            MethodReference.of(WellKnownMembers.EXPRESSION, "Parameter", 2);
    public static final MethodReference CONCAT_2 = MethodReference.of(WellKnownMembers.SYSTEM_STRING, "Concat", 2);
    public static final MethodReference CONCAT_3 = MethodReference.of(WellKnownMembers.SYSTEM_STRING, "Concat", 3);

    private Fixtures() {
    }

    public static InMemoryTypeSystem wellKnownTypeSystem() {
        InMemoryTypeSystem typeSystem = new InMemoryTypeSystem();
        typeSystem.registerType(WellKnownMembers.PARAMETER_EXPRESSION);
        typeSystem.registerMethod(GET_TYPE_FROM_HANDLE);
        typeSystem.registerMethod(EXPRESSION_PARAMETER);
        typeSystem.registerMethod(CONCAT_2);
        typeSystem.registerMethod(CONCAT_3);
        return typeSystem;
    }

    public static String text(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("il/" + resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No test resource il/" + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ILModule module(String resource) {
        return ILReader.parse(text(resource), resource);
    }
}
