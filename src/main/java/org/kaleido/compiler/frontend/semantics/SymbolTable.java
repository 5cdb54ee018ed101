package org.kaleido.compiler.frontend.semantics;

import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the names visible inside the function being emitted to their LLVM values.
 * The language has no nested binding forms, so there is a single flat scope that is
 * cleared at the start of every function.
 */
public class SymbolTable {

    private final Map<String, LLVMValueRef> symbols = new HashMap<>();

    /**
     * Binds a name in the current scope, replacing an earlier binding of the same name.
     * @param name The name.
     * @param value The value it stands for.
     */
    public void bind(String name, LLVMValueRef value) {
        symbols.put(name, value);
    }

    /**
     * Resolves a name.
     * @param name The name to look up.
     * @return The bound value, or empty if the name is unbound.
     */
    public Optional<LLVMValueRef> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * Removes every binding, starting a fresh scope.
     */
    public void clear() {
        symbols.clear();
    }

    public int size() {
        return symbols.size();
    }
}
