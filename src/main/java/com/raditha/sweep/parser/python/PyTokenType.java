package com.raditha.sweep.parser.python;

public enum PyTokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    END
}
