package io.operable.cli;

public enum ServeMode {
    STDIO,
    HTTP
}
