package net.kairo.core.executor;

public enum UnknownTypePolicy {
    FAIL,    // UnknownJobTypeException
    DEFAULT  // run GENERIC
}
