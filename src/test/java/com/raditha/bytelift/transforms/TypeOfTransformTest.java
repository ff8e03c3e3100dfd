package com.raditha.bytelift.transforms;

import com.raditha.bytelift.CancellationToken;
import com.raditha.bytelift.Fixtures;
import com.raditha.bytelift.io.ILReader;
import com.raditha.bytelift.io.InMemoryTypeSystem;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.TypeSystemResolver;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeOfTransformTest {

    private static final String BODY = """
            method F {
              block B0 {
                call Demo.Sink::Use/2(call System.Type::GetTypeFromHandle/1(ldtoken int32) @0x4, \
            call System.Type::GetTypeFromHandle/1(ldtoken string))
                ret
              }
            }
            """;

    private final TypeOfTransform transform = new TypeOfTransform();

    @Test
    void testReplacesTypeHandleLookups() {
        ILFunction function = ILReader.parseFunction(BODY);

        assertTrue(transform.run(function.getEntryBlock(), 0, context(function, Fixtures.wellKnownTypeSystem())));

        assertEquals("call Demo.Sink::Use/2(typeof int32 @0x4, typeof string)",
                function.getEntryBlock().getInstructions().get(0).toString());
        assertFalse(transform.run(function.getEntryBlock(), 0, context(function, Fixtures.wellKnownTypeSystem())));
    }

    @Test
    void testUnresolvedLookupIsKept() {
        ILFunction function = ILReader.parseFunction(BODY);
        String before = function.toString();

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function, new InMemoryTypeSystem())));
        assertEquals(before, function.toString());
    }

    @Test
    void testLookupWithoutTokenIsKept() {
        ILFunction function = ILReader.parseFunction("""
                method F {
                  block B0 {
                    ret(call System.Type::GetTypeFromHandle/1(ldnull))
                  }
                }
                """);

        assertFalse(transform.run(function.getEntryBlock(), 0, context(function, Fixtures.wellKnownTypeSystem())));
    }

    private static TransformContext context(ILFunction function, TypeSystemResolver resolver) {
        return new TransformContext(function, resolver, CancellationToken.none());
    }
}
