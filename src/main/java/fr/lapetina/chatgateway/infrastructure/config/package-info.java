/**
 * Configuration loading and credential discovery.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.chatgateway.infrastructure.config.GatewayConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.chatgateway.infrastructure.config.ConfigLoader} - YAML loading</li>
 *   <li>{@link fr.lapetina.chatgateway.infrastructure.config.CredentialSourceResolver} - Credentials from the environment</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog)</li>
 *   <li>{@code strategy} - Credential selection strategy</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code timeouts} - Send, request and connection timeouts</li>
 *   <li>{@code retry} - Attempt bound per request</li>
 *   <li>{@code upstream} - Reference upstream endpoint and cookie names</li>
 *   <li>{@code models} - Model alias table</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <p>Secrets never appear in the YAML file; they are read from environment variables only.
 */
package fr.lapetina.chatgateway.infrastructure.config;
