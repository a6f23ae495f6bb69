package com.allocsafe.refactor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.allocsafe.FixerException;

/** Functions changed during one refactoring session, looked up by name at call sites. */
public final class RefactorContext {

    private final List<RefactoredFunction> functions = new ArrayList<>();

    public RefactoredFunction addFunction(String name, RefactorType type, String returnType) {
        FixerException.requireArg(name, "name");
        FixerException.requireArg(type, "type");
        if (type == RefactorType.PTR_TO_INT_OUT && returnType == null) {
            throw FixerException.invalidArgument("PTR_TO_INT_OUT needs the original return type: " + name);
        }
        RefactoredFunction f = new RefactoredFunction(name, type, returnType);
        functions.add(f);
        return f;
    }

    /** Latest registration for {@code name}, or {@code null}. */
    public RefactoredFunction find(String name) {
        for (int i = functions.size() - 1; i >= 0; i--) {
            if (functions.get(i).name().equals(name)) {
                return functions.get(i);
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return find(name) != null;
    }

    public List<RefactoredFunction> functions() {
        return Collections.unmodifiableList(functions);
    }

    public int size() {
        return functions.size();
    }

    public boolean isEmpty() {
        return functions.isEmpty();
    }

    public void clear() {
        functions.clear();
    }
}
