package org.kaleido.compiler.ir;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.SizeTPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * A function of an {@link IrModule}: {@code double} parameters, a {@code double} result and,
 * once defined, a body of basic blocks. A function without blocks is a declaration.
 * Two instances are equal when they refer to the same native function.
 *
 * @param ref The native function value.
 */
public record IrFunction(LLVMValueRef ref) {

    /**
     * @return The function name; empty for the anonymous top-level function.
     */
    public String name() {
        return nameOf(ref);
    }

    public int arity() {
        return LLVMCountParams(ref);
    }

    public boolean isDeclaration() {
        return LLVMIsDeclaration(ref) != 0;
    }

    /**
     * @return The LLVM function type, as needed to build calls to this function.
     */
    public LLVMTypeRef type() {
        return LLVMGlobalGetValueType(ref);
    }

    /**
     * @param index Zero-based parameter position.
     * @return The parameter value.
     */
    public LLVMValueRef parameter(int index) {
        return LLVMGetParam(ref, index);
    }

    public List<String> parameterNames() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < arity(); i++) {
            names.add(nameOf(parameter(i)));
        }
        return names;
    }

    /**
     * Renames the parameters, e.g. when a definition follows an extern that used other names.
     *
     * @param parameterNames The new names; must match the arity.
     * @throws IllegalStateException if the function already has a body.
     * @throws IllegalArgumentException if the number of names differs from the arity.
     */
    public void renameParameters(List<String> parameterNames) {
        if (!isDeclaration()) {
            throw new IllegalStateException("Cannot rename parameters of defined function @" + name());
        }
        int arity = arity();
        if (parameterNames.size() != arity) {
            throw new IllegalArgumentException("Expected " + arity + " parameter names for @" + name()
                    + ", got " + parameterNames.size());
        }
        // Clear first so swapped names are not uniqued against their old holders.
        for (int i = 0; i < arity; i++) {
            LLVMSetValueName2(parameter(i), "", 0);
        }
        for (int i = 0; i < arity; i++) {
            String parameterName = parameterNames.get(i);
            LLVMSetValueName2(parameter(i), parameterName, parameterName.length());
        }
    }

    /**
     * Appends a new, empty basic block.
     * @param blockName The block label.
     * @return The new block.
     */
    public LLVMBasicBlockRef appendBasicBlock(String blockName) {
        return LLVMAppendBasicBlockInContext(LLVMGetTypeContext(LLVMTypeOf(ref)), ref, blockName);
    }

    /**
     * Removes all basic blocks, turning the function back into a declaration.
     */
    public void deleteBody() {
        for (LLVMBasicBlockRef block = LLVMGetFirstBasicBlock(ref); !IrModule.isNull(block);
             block = LLVMGetFirstBasicBlock(ref)) {
            LLVMDeleteBasicBlock(block);
        }
    }

    /**
     * @return The function in LLVM's textual IR form.
     */
    public String print() {
        BytePointer text = LLVMPrintValueToString(ref);
        String ir = text.getString();
        LLVMDisposeMessage(text);
        return ir;
    }

    @Override
    public String toString() {
        return "IrFunction{@" + name() + "/" + arity() + (isDeclaration() ? ", declaration" : "") + "}";
    }

    private static String nameOf(LLVMValueRef value) {
        BytePointer name = LLVMGetValueName2(value, new SizeTPointer(1));
        return IrModule.isNull(name) ? "" : name.getString();
    }
}
