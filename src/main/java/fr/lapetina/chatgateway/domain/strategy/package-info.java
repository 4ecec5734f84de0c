/**
 * Credential selection strategies.
 *
 * <p>This package provides pluggable strategy implementations following the Strategy pattern.
 * Strategies are invoked by {@link fr.lapetina.chatgateway.domain.pool.CredentialPool} under its
 * lock, over the full registration order and an eligibility filter (available and not excluded
 * for the current request).
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round_robin}</td><td>Rotating cursor over registration order</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform choice among eligible credentials</td></tr>
 *   <tr><td>{@code least_used}</td><td>Oldest last use, then fewest errors, then registration order</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SelectionStrategy strategy = StrategyFactory.create("least_used").orElseThrow();
 * CredentialPool pool = CredentialPool.builder().strategy(strategy).credential(pair, "main").build();
 * }</pre>
 *
 * @see fr.lapetina.chatgateway.domain.strategy.SelectionStrategy
 * @see fr.lapetina.chatgateway.domain.strategy.StrategyFactory
 */
package fr.lapetina.chatgateway.domain.strategy;
