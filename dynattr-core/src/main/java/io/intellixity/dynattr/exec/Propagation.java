package io.intellixity.dynattr.exec;

/**
 * Transaction propagation for storage engine {@code inTx} calls.
 * <p>
 * Modeled on Spring's propagation semantics without depending on Spring.
 */
public enum Propagation {
  /** Join the current transaction, start one if none exists. */
  REQUIRED,

  /** Join the current transaction, run non-transactionally if none exists. */
  SUPPORTS,

  /** Join the current transaction, fail if none exists. */
  MANDATORY,

  /** Always run in a fresh transaction that commits or rolls back on its own. */
  REQUIRES_NEW,

  /** Run non-transactionally, fail if a transaction exists. */
  NEVER,

  /** Currently treated like {@link #REQUIRED}. */
  NESTED
}
