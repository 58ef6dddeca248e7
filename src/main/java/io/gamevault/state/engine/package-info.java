/**
 * Exclusivity engine.
 *
 * <p>{@link io.gamevault.state.engine.ExclusivityGuard} keeps new writes consistent, while
 * {@link io.gamevault.state.engine.ConflictAuditor}, {@link io.gamevault.state.engine.StateBackupService}
 * and {@link io.gamevault.state.engine.ConflictResolver} clean up rows written before enforcement
 * existed. {@link io.gamevault.state.engine.RollbackManager} undoes either half.
 */
package io.gamevault.state.engine;
