package com.allocsafe.analysis;

import java.util.Collection;

import com.google.common.collect.ImmutableMap;

/** The allocators the analyzer knows about, keyed by function name. */
public final class AllocatorTable {

    private static final ImmutableMap<String, AllocatorSpec> SPECS;

    static {
        ImmutableMap.Builder<String, AllocatorSpec> b = ImmutableMap.builder();
        for (String name : new String[] { "malloc", "calloc", "realloc", "strdup", "_strdup", "strndup" }) {
            b.put(name, new AllocatorSpec(name, AllocStyle.RETURN_PTR, CheckStyle.PTR_NULL));
        }
        b.put("asprintf", new AllocatorSpec("asprintf", AllocStyle.ARG_PTR, CheckStyle.INT_NEGATIVE));
        b.put("vasprintf", new AllocatorSpec("vasprintf", AllocStyle.ARG_PTR, CheckStyle.INT_NEGATIVE));
        b.put("_mkdir", new AllocatorSpec("_mkdir", AllocStyle.RETURN_PTR, CheckStyle.INT_NONZERO));
        SPECS = b.build();
    }

    private AllocatorTable() {
    }

    /** Spec for {@code name}, or {@code null} if it is not an allocator. */
    public static AllocatorSpec lookup(String name) {
        return SPECS.get(name);
    }

    public static boolean isAllocator(String name) {
        return SPECS.containsKey(name);
    }

    public static Collection<AllocatorSpec> all() {
        return SPECS.values();
    }
}
