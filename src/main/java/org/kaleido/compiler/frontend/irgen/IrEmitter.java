package org.kaleido.compiler.frontend.irgen;

import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.kaleido.compiler.api.CompilerErrorCode;
import org.kaleido.compiler.api.Result;
import org.kaleido.compiler.frontend.parser.ast.BinaryOpNode;
import org.kaleido.compiler.frontend.parser.ast.CallNode;
import org.kaleido.compiler.frontend.parser.ast.ExprNode;
import org.kaleido.compiler.frontend.parser.ast.FunctionNode;
import org.kaleido.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kaleido.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleido.compiler.frontend.parser.ast.VariableRefNode;
import org.kaleido.compiler.frontend.semantics.SymbolTable;
import org.kaleido.compiler.ir.IrFunction;
import org.kaleido.compiler.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Lowers AST nodes into LLVM IR of an {@link IrModule}. Expressions are emitted at the end of the
 * builder's current block; names resolve through a {@link SymbolTable} that is rebuilt for each
 * function, calls resolve through the module.
 * <p>
 * Emission never throws for bad input. A function whose body fails to emit is removed from the
 * module again (or reverted to the declaration it was before), so no incomplete definition stays
 * visible to later lookups.
 */
public final class IrEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(IrEmitter.class);

    private final IrModule module;
    private final LLVMBuilderRef builder;
    private final SymbolTable symbols = new SymbolTable();
    private IrFunction anonymous;

    /**
     * Creates an emitter that registers functions in the given module.
     * @param module The module of the session.
     */
    public IrEmitter(IrModule module) {
        this.module = module;
        this.builder = module.builder();
    }

    public IrModule module() {
        return module;
    }

    /**
     * Emits an expression at the current insertion point.
     *
     * @param node The expression.
     * @return The value holding the expression's result.
     */
    public Result<LLVMValueRef> emit(ExprNode node) {
        if (node instanceof NumberLiteralNode number) {
            return Result.ok(LLVMConstReal(module.doubleType(), number.value()));
        }
        if (node instanceof VariableRefNode variable) {
            Optional<LLVMValueRef> bound = symbols.lookup(variable.name());
            if (bound.isEmpty()) {
                return Result.error(CompilerErrorCode.UNKNOWN_VARIABLE,
                        "Unknown variable name '" + variable.name() + "'", variable.source());
            }
            return Result.ok(bound.get());
        }
        if (node instanceof BinaryOpNode binary) {
            return emitBinary(binary);
        }
        if (node instanceof CallNode call) {
            return emitCall(call);
        }
        throw new IllegalStateException("Unhandled expression node: " + node.getClass().getName());
    }

    private Result<LLVMValueRef> emitBinary(BinaryOpNode node) {
        Result<LLVMValueRef> left = emit(node.left());
        if (left.isError()) {
            return left;
        }
        Result<LLVMValueRef> right = emit(node.right());
        if (right.isError()) {
            return right;
        }
        LLVMValueRef l = left.value();
        LLVMValueRef r = right.value();

        switch (node.operator()) {
            case '+':
                return Result.ok(LLVMBuildFAdd(builder, l, r, "addtmp"));
            case '-':
                return Result.ok(LLVMBuildFSub(builder, l, r, "subtmp"));
            case '*':
                return Result.ok(LLVMBuildFMul(builder, l, r, "multmp"));
            case '<':
                LLVMValueRef cmp = LLVMBuildFCmp(builder, LLVMRealULT, l, r, "cmptmp");
                // Convert bool 0/1 to double 0.0 or 1.0
                return Result.ok(LLVMBuildUIToFP(builder, cmp, module.doubleType(), "booltmp"));
            default:
                return Result.error(CompilerErrorCode.INVALID_BINARY_OPERATOR,
                        "invalid binary operator '" + node.operator() + "'", node.source());
        }
    }

    private Result<LLVMValueRef> emitCall(CallNode node) {
        Optional<IrFunction> callee = module.getFunction(node.callee());
        if (callee.isEmpty()) {
            return Result.error(CompilerErrorCode.UNKNOWN_FUNCTION,
                    "Unknown function referenced '" + node.callee() + "'", node.source());
        }
        IrFunction function = callee.get();
        int argc = node.arguments().size();
        if (function.arity() != argc) {
            return Result.error(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "Incorrect # arguments passed to '" + node.callee() + "': expected "
                            + function.arity() + ", got " + argc,
                    node.source());
        }

        LLVMValueRef[] arguments = new LLVMValueRef[argc];
        for (int i = 0; i < argc; i++) {
            Result<LLVMValueRef> value = emit(node.arguments().get(i));
            if (value.isError()) {
                return value;
            }
            arguments[i] = value.value();
        }
        PointerPointer<LLVMValueRef> args = argc == 0 ? null : new PointerPointer<>(arguments);
        return Result.ok(LLVMBuildCall2(builder, function.type(), function.ref(), args, argc, "calltmp"));
    }

    /**
     * Declares the function a prototype describes. A compatible earlier declaration of the same
     * name is returned as is, which allows forward declarations and repeated externs.
     *
     * @param prototype The prototype.
     * @return The declared function.
     */
    public Result<IrFunction> emitPrototype(PrototypeNode prototype) {
        Optional<IrFunction> existing = module.getFunction(prototype.name());
        if (existing.isPresent()) {
            IrFunction function = existing.get();
            if (function.arity() != prototype.arity()) {
                return Result.error(CompilerErrorCode.PROTOTYPE_ARITY_MISMATCH,
                        "Function '" + prototype.name() + "' redeclared with " + prototype.arity()
                                + " parameters, previously declared with " + function.arity(),
                        prototype.source());
            }
            return Result.ok(function);
        }
        IrFunction function = module.declareFunction(prototype.name(), prototype.parameters());
        LOG.debug("Declared function @{} with {} parameter(s)", prototype.name(), prototype.arity());
        return Result.ok(function);
    }

    /**
     * Emits a function: declares it if needed and, if it has a body, defines it with a single
     * entry block returning the body's value. The finished function is verified.
     *
     * @param node The function.
     * @return The declared or defined function.
     */
    public Result<IrFunction> emitFunction(FunctionNode node) {
        PrototypeNode prototype = node.prototype();
        if (node.bodyOptional().isEmpty()) {
            return emitPrototype(prototype);
        }

        if (prototype.isAnonymous() && anonymous != null) {
            // A new top-level expression replaces the previous one.
            module.removeFunction(anonymous);
            anonymous = null;
        }
        Optional<IrFunction> existing = module.getFunction(prototype.name());
        if (existing.isPresent() && !existing.get().isDeclaration()) {
            return Result.error(CompilerErrorCode.FUNCTION_REDEFINITION,
                    "Function cannot be redefined: '" + prototype.name() + "'", prototype.source());
        }
        boolean createdHere = existing.isEmpty();

        Result<IrFunction> declared = emitPrototype(prototype);
        if (declared.isError()) {
            return declared;
        }
        IrFunction function = declared.value();
        List<String> previousNames = function.parameterNames();
        if (!createdHere) {
            function.renameParameters(prototype.parameters());
        }

        LLVMPositionBuilderAtEnd(builder, function.appendBasicBlock("entry"));
        symbols.clear();
        for (int i = 0; i < prototype.arity(); i++) {
            symbols.bind(prototype.parameters().get(i), function.parameter(i));
        }

        Result<LLVMValueRef> body = emit(node.body());
        if (body.isError()) {
            discard(function, createdHere, previousNames);
            return body.propagate();
        }
        LLVMBuildRet(builder, body.value());

        Optional<String> problem = module.verify(function);
        if (problem.isPresent()) {
            discard(function, createdHere, previousNames);
            return Result.error(CompilerErrorCode.IR_VERIFICATION_FAILED,
                    "Generated IR for '" + prototype.name() + "' is invalid: " + problem.get(),
                    prototype.source());
        }
        if (prototype.isAnonymous()) {
            anonymous = function;
        }
        LOG.debug("Defined function @{}", prototype.name());
        return Result.ok(function);
    }

    private void discard(IrFunction function, boolean createdHere, List<String> previousNames) {
        if (createdHere) {
            module.removeFunction(function);
        } else {
            LLVMClearInsertionPosition(builder);
            function.deleteBody();
            function.renameParameters(previousNames);
        }
    }
}
