/**
 * Game state exclusivity engine source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.gamevault.state.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.gamevault.state.cli.GameStateCommand} maps commands to engine APIs.</li>
 *   <li>{@code io.gamevault.state.engine.TrackingService} is the guarded write path for tracking sets.</li>
 *   <li>{@code io.gamevault.state.engine.GameStateEngine} wires the maintenance pipeline and rollback.</li>
 * </ul>
 */
package io.gamevault.state;
