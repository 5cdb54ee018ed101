package org.kaleido.compiler.ir;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Owns the LLVM context, module and instruction builder of one session. Declarations and
 * definitions persist for the lifetime of the module, so later input can call functions declared
 * earlier.
 * <p>
 * The native resources are released by {@link #close()}; no {@link IrFunction} of this module may
 * be used afterwards.
 */
public final class IrModule implements AutoCloseable {

    private final String name;
    private final LLVMContextRef context;
    private final LLVMModuleRef module;
    private final LLVMBuilderRef builder;
    private final LLVMTypeRef doubleType;
    private boolean closed;

    /**
     * Creates an empty module in a fresh context.
     * @param name The module identifier, shown as {@code ModuleID} in textual IR.
     */
    public IrModule(String name) {
        this.name = name;
        this.context = LLVMContextCreate();
        this.module = LLVMModuleCreateWithNameInContext(name, context);
        this.builder = LLVMCreateBuilderInContext(context);
        this.doubleType = LLVMDoubleTypeInContext(context);
    }

    public String name() {
        return name;
    }

    public LLVMContextRef context() {
        return context;
    }

    public LLVMBuilderRef builder() {
        return builder;
    }

    /**
     * @return The language's single numeric type.
     */
    public LLVMTypeRef doubleType() {
        return doubleType;
    }

    /**
     * Looks up a named function. Unnamed functions, such as the anonymous top-level function,
     * are never found.
     *
     * @param functionName The name to look up.
     * @return The function registered under that name, if any.
     */
    public Optional<IrFunction> getFunction(String functionName) {
        if (functionName.isEmpty()) {
            return Optional.empty();
        }
        LLVMValueRef function = LLVMGetNamedFunction(module, functionName);
        return isNull(function) ? Optional.empty() : Optional.of(new IrFunction(function));
    }

    /**
     * Declares a new function with one {@code double} parameter per name and a {@code double} result.
     *
     * @param functionName The function name; empty for an unnamed function.
     * @param parameterNames The parameter names.
     * @return The new declaration.
     * @throws IllegalStateException if a function with that name already exists.
     */
    public IrFunction declareFunction(String functionName, List<String> parameterNames) {
        if (getFunction(functionName).isPresent()) {
            throw new IllegalStateException("Function @" + functionName + " already exists in module '" + name + "'");
        }
        int arity = parameterNames.size();
        LLVMTypeRef functionType;
        if (arity == 0) {
            functionType = LLVMFunctionType(doubleType, (PointerPointer) null, 0, 0);
        } else {
            LLVMTypeRef[] parameterTypes = new LLVMTypeRef[arity];
            Arrays.fill(parameterTypes, doubleType);
            functionType = LLVMFunctionType(doubleType, new PointerPointer<>(parameterTypes), arity, 0);
        }
        IrFunction function = new IrFunction(LLVMAddFunction(module, functionName, functionType));
        function.renameParameters(parameterNames);
        return function;
    }

    /**
     * Removes a function from the module and frees it.
     * @param function The function to remove.
     */
    public void removeFunction(IrFunction function) {
        LLVMClearInsertionPosition(builder);
        LLVMDeleteFunction(function.ref());
    }

    /**
     * Runs the LLVM verifier over one function.
     *
     * @param function The function to check.
     * @return The verifier's report if the function is malformed, empty otherwise.
     */
    public Optional<String> verify(IrFunction function) {
        if (LLVMVerifyFunction(function.ref(), LLVMReturnStatusAction) == 0) {
            return Optional.empty();
        }
        // The function-level check only reports a status; the module check carries the message.
        BytePointer error = new BytePointer((Pointer) null);
        LLVMVerifyModule(module, LLVMReturnStatusAction, error);
        String message = error.isNull() ? "" : error.getString().strip();
        LLVMDisposeMessage(error);
        return Optional.of(message.isEmpty() ? "function failed verification" : message);
    }

    /**
     * @return All functions in declaration order.
     */
    public List<IrFunction> functions() {
        List<IrFunction> functions = new ArrayList<>();
        for (LLVMValueRef f = LLVMGetFirstFunction(module); !isNull(f); f = LLVMGetNextFunction(f)) {
            functions.add(new IrFunction(f));
        }
        return functions;
    }

    /**
     * @return The whole module in LLVM's textual IR form.
     */
    public String print() {
        BytePointer text = LLVMPrintModuleToString(module);
        String ir = text.getString();
        LLVMDisposeMessage(text);
        return ir;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        LLVMDisposeBuilder(builder);
        LLVMDisposeModule(module);
        LLVMContextDispose(context);
    }

    static boolean isNull(Pointer pointer) {
        return pointer == null || pointer.isNull();
    }
}
