/**
 * LMAX Disruptor intake for chat requests.
 *
 * <p>Events flow through handlers in sequence:
 * <pre>
 * Validation → Translation → Dispatch → Metrics → Completion
 * </pre>
 *
 * <p>The dispatch stage only hands the request to a worker pool; upstream I/O
 * never runs on a ring buffer consumer thread.
 *
 * @see fr.lapetina.chatgateway.disruptor.DisruptorPipeline
 * @see fr.lapetina.chatgateway.disruptor.exception.BackpressureException
 */
package fr.lapetina.chatgateway.disruptor;
