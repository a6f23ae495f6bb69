package com.allocsafe.analysis;

public final class AllocatorSpec {

    private final String name;
    private final AllocStyle allocStyle;
    private final CheckStyle checkStyle;

    public AllocatorSpec(String name, AllocStyle allocStyle, CheckStyle checkStyle) {
        this.name = name;
        this.allocStyle = allocStyle;
        this.checkStyle = checkStyle;
    }

    public String name() {
        return name;
    }

    public AllocStyle allocStyle() {
        return allocStyle;
    }

    public CheckStyle checkStyle() {
        return checkStyle;
    }

    @Override
    public String toString() {
        return name + "(" + allocStyle + ", " + checkStyle + ")";
    }
}
