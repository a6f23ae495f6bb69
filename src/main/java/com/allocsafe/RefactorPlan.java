package com.allocsafe;

import java.util.ArrayList;
import java.util.List;

import com.allocsafe.refactor.RefactorContext;
import com.allocsafe.refactor.RefactorType;

/** Functions whose signatures were changed elsewhere and whose callers must follow. */
public class RefactorPlan {

    public static class Entry {
        public String name;
        public RefactorType type;
        public String returnType;
    }

    public String errorCode; // null keeps the configured default
    public List<Entry> functions = new ArrayList<>();

    public RefactorContext toContext() {
        RefactorContext ctx = new RefactorContext();
        for (Entry e : functions) {
            ctx.addFunction(e.name, e.type, e.returnType);
        }
        return ctx;
    }
}
