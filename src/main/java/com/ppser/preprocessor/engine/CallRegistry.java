package com.ppser.preprocessor.engine;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import com.ppser.preprocessor.model.SymbolOwner;

/**
 * Distinct API symbols referenced by generated code in one pass, partitioned by the
 * module they are imported from. Symbols are kept sorted so the import block is
 * independent of directive order.
 */
public class CallRegistry {

    private final Set<String> moduleSymbols = new TreeSet<>();
    private final Set<String> helperSymbols = new TreeSet<>();
    private final boolean frozen;

    public CallRegistry() {
        this(false);
    }

    private CallRegistry(boolean frozen) {
        this.frozen = frozen;
    }

    public static CallRegistry empty() {
        return new CallRegistry(true);
    }

    public void record(SymbolOwner owner, String symbol) {
        if (frozen) {
            throw new IllegalStateException("Call registry is frozen; cannot record " + symbol);
        }
        if (owner == SymbolOwner.SERIALIZATION_MODULE) {
            moduleSymbols.add(symbol);
        } else {
            helperSymbols.add(symbol);
        }
    }

    /**
     * Read-only copy of the current contents.
     */
    public CallRegistry freeze() {
        CallRegistry copy = new CallRegistry(true);
        copy.moduleSymbols.addAll(moduleSymbols);
        copy.helperSymbols.addAll(helperSymbols);
        return copy;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Set<String> getModuleSymbols() {
        return Collections.unmodifiableSet(moduleSymbols);
    }

    public Set<String> getHelperSymbols() {
        return Collections.unmodifiableSet(helperSymbols);
    }

    public boolean contains(String symbol) {
        return moduleSymbols.contains(symbol) || helperSymbols.contains(symbol);
    }

    public boolean isEmpty() {
        return moduleSymbols.isEmpty() && helperSymbols.isEmpty();
    }

    public int size() {
        return moduleSymbols.size() + helperSymbols.size();
    }

    @Override
    public String toString() {
        return "CallRegistry(module=" + moduleSymbols + ", helper=" + helperSymbols + ")";
    }
}
