package org.dxworks.calltree.model;

public enum ProgramType {
    COBOL("cobol"),
    CL("cl");

    private final String name;

    ProgramType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
