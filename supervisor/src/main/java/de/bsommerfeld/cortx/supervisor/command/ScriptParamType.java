package de.bsommerfeld.cortx.supervisor.command;

public enum ScriptParamType {
    STRING,
    BOOL,
    NUMBER,
    ENUM,
    PATH
}
