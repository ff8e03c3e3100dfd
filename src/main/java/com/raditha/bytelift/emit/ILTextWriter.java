package com.raditha.bytelift.emit;

import com.raditha.bytelift.model.ILFormatter;
import com.raditha.bytelift.model.ILFunction;
import com.raditha.bytelift.model.Instruction;
import com.raditha.bytelift.workflow.DecompilationResult;
import com.raditha.bytelift.workflow.DecompiledMember;
import com.raditha.bytelift.workflow.DeclarationRef;

/**
 * Writes decompilation results in the textual IL syntax that {@code io.ILReader} accepts.
 * Tree formatting itself lives in {@link ILFormatter}.
 */
public final class ILTextWriter {

    private ILTextWriter() {
    }

    public static String toText(Instruction instruction) {
        return ILFormatter.toText(instruction);
    }

    public static String writeFunction(ILFunction function) {
        return ILFormatter.writeFunction(function);
    }

    /**
     * @param attributes extra header attributes such as {@code kind=ctor static}, written after the name
     */
    public static String writeFunction(ILFunction function, String attributes) {
        return ILFormatter.writeFunction(function, attributes);
    }

    public static String quote(String value) {
        return ILFormatter.quote(value);
    }

    /**
     * Listing of every member of a decompilation result, each headed by a comment with its status.
     */
    public static String writeResult(DecompilationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("// ").append(result.declaration()).append(" (").append(result.status()).append(")\n");
        result.getFault().ifPresent(f -> sb.append("// ").append(f.getMessage()).append('\n'));
        for (DecompiledMember member : result.members()) {
            DeclarationRef ref = member.declaration();
            StringBuilder attributes = new StringBuilder("kind=").append(ref.kind().token());
            if (ref.owner() != null) {
                attributes.append(" of=").append(ref.owner());
            }
            if (ref.isStatic()) {
                attributes.append(" static");
            }
            member.getDocumentation().ifPresent(doc -> doc.lines().forEach(l -> sb.append("/// ").append(l).append('\n')));
            sb.append(writeFunction(member.function(), attributes.toString()));
        }
        return sb.toString();
    }
}
