/**
 * Chat Credential Gateway - OpenAI-compatible chat completions over a pool of
 * upstream credentials.
 *
 * <p>Requests enter through {@link fr.lapetina.chatgateway.api.HttpServer}, are
 * validated and translated on a Disruptor ring buffer, then dispatched by
 * {@link fr.lapetina.chatgateway.dispatch.Dispatcher}, which rotates through
 * {@link fr.lapetina.chatgateway.domain.pool.CredentialPool} on retryable failures.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     ChatRequest request = ChatRequest.of("gemini-2.5-flash",
 *             List.of(new ChatRequest.Message("user", "Hello!")), false);
 *     DispatchResult result = factory.getPipeline().submit(request).get();
 *
 *     OutputEnvelope reply = factory.getStreamEncoder().aggregate(result.outcome(), result.envelope());
 *     System.out.println(reply.text());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Selection strategies: round-robin, random, least-used, switchable at runtime</li>
 *   <li>A credential is disabled after three consecutive failures and restored on success</li>
 *   <li>Server-sent event streaming with a terminal error chunk on mid-stream failure</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.chatgateway.GatewayFactory
 */
package fr.lapetina.chatgateway;
