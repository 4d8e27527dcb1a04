package io.intellixity.dynattr.exec;

/** Opaque backend transaction handle. */
public interface TxHandle {}
